package com.onthegomap.skycorr.correlation;

import com.onthegomap.skycorr.geo.PixelScheme;

/**
 * How an {@link AngularBin} measures the correlation function, fixed when the bin is created.
 */
public sealed interface BinMode permits BinMode.PairCounting, BinMode.PixelProduct {

  BinMode PAIRS = new PairCounting();

  static BinMode pairs() {
    return PAIRS;
  }

  static BinMode pixels(int level) {
    return new PixelProduct(level);
  }

  /** Returns true for the pixel-product estimator. */
  boolean isPixelMode();

  /** Pixel level for ordering bins, pair-counting bins sort after every pixel level. */
  int sortLevel();

  /** Counts weighted pairs of points and combines them with the Landy-Szalay estimator. */
  record PairCounting() implements BinMode {

    @Override
    public boolean isPixelMode() {
      return false;
    }

    @Override
    public int sortLevel() {
      return -1;
    }
  }

  /**
   * Sums products of pixel over-densities at a fixed pixel level.
   *
   * @param level level of the pixels to correlate
   */
  record PixelProduct(int level) implements BinMode {

    public PixelProduct {
      if (level < PixelScheme.HPIX_LEVEL || level > PixelScheme.MAX_LEVEL) {
        throw new IllegalArgumentException(
          "Pixel level must be in [" + PixelScheme.HPIX_LEVEL + ", " + PixelScheme.MAX_LEVEL + "], was " + level);
      }
    }

    @Override
    public boolean isPixelMode() {
      return true;
    }

    @Override
    public int sortLevel() {
      return level;
    }

    public int resolution() {
      return PixelScheme.resolutionForLevel(level);
    }
  }
}
