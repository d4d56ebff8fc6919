package com.onthegomap.skycorr.geo;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;
import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * A {@link Footprint} covering a longitude/latitude box, pixelized with unmasked-fraction weights up to a maximum
 * resolution.
 * <p>
 * Longitudes are in {@code [0, 360)} and the box may not wrap around the 0/360 meridian.
 */
@Immutable
public class BoundsFootprint implements Footprint {

  private final Envelope bounds;
  private final int maxResolution;

  /**
   * @param bounds        {@code minX/maxX} are longitudes and {@code minY/maxY} latitudes, in degrees
   * @param maxResolution finest resolution that coverings may be generated at
   * @throws IllegalArgumentException if the box is empty, wraps past 360, or the resolution is invalid
   */
  public BoundsFootprint(Envelope bounds, int maxResolution) {
    if (bounds.isNull() || bounds.getWidth() <= 0 || bounds.getHeight() <= 0) {
      throw new IllegalArgumentException("Footprint bounds must have a positive area: " + bounds);
    }
    if (bounds.getMinX() < 0 || bounds.getMaxX() > 360 || bounds.getMinY() < -90 || bounds.getMaxY() > 90) {
      throw new IllegalArgumentException("Footprint bounds must be inside lon [0, 360] lat [-90, 90]: " + bounds);
    }
    if (!PixelScheme.isValidResolution(maxResolution)) {
      throw new IllegalArgumentException("Invalid max resolution: " + maxResolution);
    }
    this.bounds = new Envelope(bounds);
    this.maxResolution = maxResolution;
  }

  public Envelope bounds() {
    return new Envelope(bounds);
  }

  @Override
  public double area() {
    return SkyUtils.boxArea(bounds.getMinX(), bounds.getMaxX(), bounds.getMinY(), bounds.getMaxY());
  }

  @Override
  public int maxResolution() {
    return maxResolution;
  }

  @Override
  public List<SkyPixel> coverage(int resolution) {
    if (!PixelScheme.isValidResolution(resolution) || resolution > maxResolution) {
      throw new IllegalArgumentException(
        "Cannot cover footprint at " + resolution + ", max resolution is " + maxResolution);
    }
    long nx = PixelScheme.columns(resolution);
    long ny = PixelScheme.rows(resolution);
    long minColumn = (long) Math.floor(bounds.getMinX() / 360d * nx);
    long maxColumn = Math.min(nx - 1, (long) Math.ceil(bounds.getMaxX() / 360d * nx) - 1);
    long minRow = (long) Math.floor((1 - Math.sin(Math.toRadians(bounds.getMaxY()))) / 2 * ny);
    long maxRow = Math.min(ny - 1, (long) Math.ceil((1 - Math.sin(Math.toRadians(bounds.getMinY()))) / 2 * ny) - 1);
    double pixelArea = PixelScheme.pixelArea(resolution);
    List<SkyPixel> result = new ArrayList<>();
    for (long row = minRow; row <= maxRow; row++) {
      for (long column = minColumn; column <= maxColumn; column++) {
        long id = PixelScheme.pixelIdOfColumnRow(column, row, resolution);
        double overlap = SkyUtils.boxArea(
          Math.max(bounds.getMinX(), PixelScheme.minLon(id, resolution)),
          Math.min(bounds.getMaxX(), PixelScheme.maxLon(id, resolution)),
          Math.max(bounds.getMinY(), PixelScheme.minLat(id, resolution)),
          Math.min(bounds.getMaxY(), PixelScheme.maxLat(id, resolution))
        );
        double weight = Math.min(1, overlap / pixelArea);
        if (weight > 1e-12) {
          result.add(new SkyPixel(id, resolution, weight));
        }
      }
    }
    return result;
  }

  @Override
  public boolean contains(Coordinate lonLat) {
    return bounds.contains(SkyUtils.normalizeLongitude(lonLat.x), lonLat.y);
  }

  @Override
  public List<WeightedPoint> randomPoints(int count, RandomGenerator random) {
    List<WeightedPoint> result = new ArrayList<>(Math.max(count, 0));
    double minZ = Math.sin(Math.toRadians(bounds.getMinY()));
    double maxZ = Math.sin(Math.toRadians(bounds.getMaxY()));
    for (int i = 0; i < count; i++) {
      double lon = bounds.getMinX() + random.nextDouble() * bounds.getWidth();
      double lat = Math.toDegrees(Math.asin(minZ + random.nextDouble() * (maxZ - minZ)));
      result.add(WeightedPoint.of(lon, lat));
    }
    return result;
  }

  @Override
  public String toString() {
    return "BoundsFootprint{" + bounds + " maxResolution=" + maxResolution + '}';
  }
}
