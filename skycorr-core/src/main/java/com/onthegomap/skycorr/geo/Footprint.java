package com.onthegomap.skycorr.geo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.random.RandomGenerator;
import org.locationtech.jts.geom.Coordinate;

/**
 * An arbitrarily shaped, possibly disjoint area of the sky described in terms of {@link PixelScheme} pixels.
 * <p>
 * Implementations supply the geometry that regionation and correlation measurements need: the total area, the finest
 * resolution the shape is described at, and weighted pixel coverings at coarser resolutions.
 */
public interface Footprint {

  /** Total unmasked area in square degrees. */
  double area();

  /** The finest resolution that {@link #coverage(int)} can be generated at. */
  int maxResolution();

  /**
   * Returns every pixel at {@code resolution} that overlaps this footprint, sorted by pixel id, weighted by the fraction
   * of the pixel's area that is inside the footprint.
   *
   * @throws IllegalArgumentException if {@code resolution} is not a valid resolution or is finer than
   *                                  {@link #maxResolution()}
   */
  List<SkyPixel> coverage(int resolution);

  /** Returns true if a longitude/latitude coordinate falls inside the unmasked area. */
  boolean contains(Coordinate lonLat);

  /**
   * Returns {@code count} points uniformly distributed over the unmasked area, each with weight 1.
   * <p>
   * Points are drawn from the {@link #maxResolution()} coverage in proportion to each pixel's unmasked area, placed
   * uniformly in the pixel, and kept if {@link #contains(Coordinate)}.
   */
  default List<WeightedPoint> randomPoints(int count, RandomGenerator random) {
    List<SkyPixel> pixels = coverage(maxResolution());
    List<WeightedPoint> result = new ArrayList<>(count);
    if (pixels.isEmpty() || count <= 0) {
      return result;
    }
    double[] cumulative = new double[pixels.size()];
    double total = 0;
    for (int i = 0; i < pixels.size(); i++) {
      total += pixels.get(i).weightedArea();
      cumulative[i] = total;
    }
    while (result.size() < count) {
      double target = random.nextDouble() * total;
      int idx = Arrays.binarySearch(cumulative, target);
      idx = idx < 0 ? Math.min(-idx - 1, pixels.size() - 1) : idx;
      SkyPixel pixel = pixels.get(idx);
      double minLon = PixelScheme.minLon(pixel.id(), pixel.resolution());
      double maxLon = PixelScheme.maxLon(pixel.id(), pixel.resolution());
      double lon = minLon + random.nextDouble() * (maxLon - minLon);
      double minZ = Math.sin(Math.toRadians(PixelScheme.minLat(pixel.id(), pixel.resolution())));
      double maxZ = Math.sin(Math.toRadians(PixelScheme.maxLat(pixel.id(), pixel.resolution())));
      double lat = Math.toDegrees(Math.asin(minZ + random.nextDouble() * (maxZ - minZ)));
      Coordinate point = new Coordinate(lon, lat);
      if (contains(point)) {
        result.add(new WeightedPoint(point, 1.0));
      }
    }
    return result;
  }
}
