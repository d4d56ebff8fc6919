package com.onthegomap.skycorr.geo;

import com.carrotsearch.hppc.LongDoubleHashMap;
import com.carrotsearch.hppc.cursors.LongDoubleCursor;
import com.onthegomap.skycorr.collection.Hppc;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.Coordinate;

/**
 * A {@link Footprint} made of weighted pixels at a single resolution, which can describe gapped or disjoint shapes.
 * <p>
 * Coverings at coarser resolutions aggregate the weighted area of the pixels inside each super-pixel.
 */
@Immutable
public class PixelFootprint implements Footprint {

  private final int resolution;
  private final List<SkyPixel> pixels;
  private final LongDoubleHashMap weights;
  private final double area;

  private PixelFootprint(int resolution, List<SkyPixel> pixels) {
    this.resolution = resolution;
    this.pixels = List.copyOf(pixels);
    this.weights = Hppc.newLongDoubleHashMap(pixels.size());
    double total = 0;
    for (SkyPixel pixel : pixels) {
      weights.put(pixel.id(), pixel.weight());
      total += pixel.weightedArea();
    }
    this.area = total;
  }

  /**
   * Returns a footprint from {@code pixels} that must all share the same resolution. Duplicate pixel ids have their
   * weights added together and pixels with a weight {@code <= 0} are dropped.
   *
   * @throws IllegalArgumentException if {@code pixels} is empty or mixes resolutions
   */
  public static PixelFootprint of(Collection<SkyPixel> pixels) {
    if (pixels.isEmpty()) {
      throw new IllegalArgumentException("Footprint must contain at least one pixel");
    }
    int resolution = pixels.iterator().next().resolution();
    LongDoubleHashMap merged = Hppc.newLongDoubleHashMap(pixels.size());
    for (SkyPixel pixel : pixels) {
      if (pixel.resolution() != resolution) {
        throw new IllegalArgumentException(
          "All pixels must have resolution " + resolution + ", got " + pixel.resolution());
      }
      merged.addTo(pixel.id(), pixel.weight());
    }
    return new PixelFootprint(resolution, sortedPixels(merged, resolution));
  }

  /** Returns a footprint of every pixel in the {@code columns x rows} block starting at a column/row, weight 1. */
  public static PixelFootprint ofBlock(long minColumn, long minRow, int columns, int rows, int resolution) {
    List<SkyPixel> result = new ArrayList<>(columns * rows);
    for (long row = minRow; row < minRow + rows; row++) {
      for (long column = minColumn; column < minColumn + columns; column++) {
        result.add(SkyPixel.ofColumnRow(column, row, resolution, 1.0));
      }
    }
    return of(result);
  }

  private static List<SkyPixel> sortedPixels(LongDoubleHashMap weights, int resolution) {
    List<SkyPixel> result = new ArrayList<>(weights.size());
    for (LongDoubleCursor cursor : weights) {
      if (cursor.value > 0) {
        result.add(new SkyPixel(cursor.key, resolution, cursor.value));
      }
    }
    result.sort(Comparator.comparingLong(SkyPixel::id));
    return result;
  }

  @Override
  public double area() {
    return area;
  }

  @Override
  public int maxResolution() {
    return resolution;
  }

  /** Returns the pixels this footprint was built from, sorted by id. */
  public List<SkyPixel> pixels() {
    return pixels;
  }

  @Override
  public List<SkyPixel> coverage(int targetResolution) {
    if (!PixelScheme.isValidResolution(targetResolution)) {
      throw new IllegalArgumentException("Invalid resolution: " + targetResolution);
    }
    if (targetResolution > resolution) {
      throw new IllegalArgumentException(
        "Cannot cover footprint at " + targetResolution + ", max resolution is " + resolution);
    }
    if (targetResolution == resolution) {
      return pixels;
    }
    double superArea = PixelScheme.pixelArea(targetResolution);
    LongDoubleHashMap superWeights = Hppc.newLongDoubleHashMap(pixels.size());
    for (SkyPixel pixel : pixels) {
      superWeights.addTo(pixel.superPixelId(targetResolution), pixel.weightedArea() / superArea);
    }
    return sortedPixels(superWeights, targetResolution);
  }

  @Override
  public boolean contains(Coordinate lonLat) {
    return weights.get(PixelScheme.pixelId(lonLat, resolution)) > 0;
  }

  /** Returns the weight of the pixel at this footprint's resolution containing {@code lonLat}, or 0 if outside. */
  public double weight(Coordinate lonLat) {
    return weights.get(PixelScheme.pixelId(lonLat, resolution));
  }

  @Override
  public String toString() {
    return "PixelFootprint{resolution=" + resolution + " pixels=" + pixels.size() + " area=" + area + '}';
  }
}
