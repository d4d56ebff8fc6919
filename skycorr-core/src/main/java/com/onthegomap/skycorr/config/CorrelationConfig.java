package com.onthegomap.skycorr.config;

import com.onthegomap.skycorr.geo.PixelScheme;

/**
 * Holder for the parameters of an angular correlation run.
 *
 * @param thetaMin         smallest angular scale in degrees
 * @param thetaMax         largest angular scale in degrees
 * @param binsPerDecade    logarithmic bins per factor of 10 in scale
 * @param nRandom          number of random catalogs per data catalog
 * @param nJackknife       number of jackknife regions, 0 for twice the number of bins
 * @param maxLevel         finest pixel level to measure with pixel products, -1 to pick from the object density
 * @param useOnlyPairs     count pairs in every bin instead of using pixel products
 * @param regionResolution resolution of the jackknife regions, 0 to pick automatically
 * @param mapResolution    resolution a rectangular footprint is described at
 * @param seed             seed for random catalogs
 * @param minWeight        objects with a lower weight are dropped
 * @param maxWeight        objects with a higher weight are dropped
 */
public record CorrelationConfig(
  Arguments arguments,
  double thetaMin,
  double thetaMax,
  int binsPerDecade,
  int nRandom,
  int nJackknife,
  int maxLevel,
  boolean useOnlyPairs,
  int regionResolution,
  int mapResolution,
  long seed,
  double minWeight,
  double maxWeight
) {

  public static final int AUTO_LEVEL = -1;

  public CorrelationConfig {
    if (!(thetaMin > 0) || !(thetaMin < thetaMax)) {
      throw new IllegalArgumentException("Need 0 < theta_min < theta_max, got " + thetaMin + " and " + thetaMax);
    }
    if (binsPerDecade < 1) {
      throw new IllegalArgumentException("Bins per decade must be >= 1, was " + binsPerDecade);
    }
    if (nRandom < 1) {
      throw new IllegalArgumentException("Number of random catalogs must be >= 1, was " + nRandom);
    }
    if (nJackknife < 0) {
      throw new IllegalArgumentException("Number of jackknife regions must be >= 0, was " + nJackknife);
    }
    if (maxLevel != AUTO_LEVEL && (maxLevel < PixelScheme.HPIX_LEVEL || maxLevel > PixelScheme.MAX_LEVEL)) {
      throw new IllegalArgumentException("Max level must be -1 or in [" + PixelScheme.HPIX_LEVEL + ", " +
        PixelScheme.MAX_LEVEL + "], was " + maxLevel);
    }
    if (regionResolution != 0 && !PixelScheme.isValidResolution(regionResolution)) {
      throw new IllegalArgumentException("Invalid region resolution " + regionResolution);
    }
    if (!PixelScheme.isValidResolution(mapResolution)) {
      throw new IllegalArgumentException("Invalid map resolution " + mapResolution);
    }
    if (minWeight > maxWeight) {
      throw new IllegalArgumentException("min_weight " + minWeight + " > max_weight " + maxWeight);
    }
  }

  public static CorrelationConfig defaults() {
    return from(Arguments.of());
  }

  public static CorrelationConfig from(Arguments arguments) {
    return new CorrelationConfig(
      arguments,
      arguments.getDouble("theta_min", "smallest angular scale in degrees", 0.001),
      arguments.getDouble("theta_max", "largest angular scale in degrees", 10),
      arguments.getInteger("bins_per_decade", "logarithmic angular bins per decade", 5),
      arguments.getInteger("n_random", "random catalogs per data catalog", 1),
      arguments.getInteger("n_jackknife|n_region", "jackknife regions, 0 for twice the number of bins", 0),
      arguments.getInteger("max_level", "finest level for pixel products, -1 for automatic", AUTO_LEVEL),
      arguments.getBoolean("use_only_pairs", "count pairs at every scale", false),
      arguments.getInteger("region_resolution", "jackknife region resolution, 0 for automatic", 0),
      arguments.getInteger("map_resolution", "resolution to pixelize a rectangular footprint at", 256),
      arguments.getLong("seed", "random catalog seed", 0),
      arguments.getDouble("min_weight", "drop objects with weights below this", 0.2),
      arguments.getDouble("max_weight", "drop objects with weights above this", 1.00001)
    );
  }
}
