package com.onthegomap.skycorr.geo;

import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.Coordinate;

/**
 * A pixel of the {@link PixelScheme} with a weight, typically the fraction of its area that is not masked.
 *
 * @param id         pixel id at {@code resolution}
 * @param resolution power-of-2 resolution of the pixel
 * @param weight     unmasked fraction of the pixel in {@code [0, 1]}, or another per-pixel weight
 */
@Immutable
public record SkyPixel(long id, int resolution, double weight) implements Comparable<SkyPixel> {

  public SkyPixel {
    assert PixelScheme.isValidResolution(resolution) : "bad resolution " + resolution;
  }

  public static SkyPixel of(long id, int resolution) {
    return new SkyPixel(id, resolution, 1.0);
  }

  public static SkyPixel ofColumnRow(long column, long row, int resolution, double weight) {
    return new SkyPixel(PixelScheme.pixelIdOfColumnRow(column, row, resolution), resolution, weight);
  }

  /** Returns the pixel at {@code resolution} containing a longitude/latitude coordinate. */
  public static SkyPixel around(Coordinate lonLat, int resolution) {
    return of(PixelScheme.pixelId(lonLat, resolution), resolution);
  }

  public long column() {
    return PixelScheme.column(id, resolution);
  }

  public long row() {
    return PixelScheme.row(id, resolution);
  }

  public long stripe() {
    return PixelScheme.stripe(id, resolution);
  }

  /** Returns the stripe of this pixel at a coarser resolution. */
  public long stripe(int coarserResolution) {
    return PixelScheme.stripe(superPixelId(coarserResolution), coarserResolution);
  }

  public int level() {
    return PixelScheme.levelForResolution(resolution);
  }

  /** Total area of the pixel in square degrees, ignoring its weight. */
  public double area() {
    return PixelScheme.pixelArea(resolution);
  }

  /** Area of the pixel scaled by its weight. */
  public double weightedArea() {
    return area() * weight;
  }

  public long superPixelId(int superResolution) {
    return PixelScheme.superPixelId(id, resolution, superResolution);
  }

  public SkyPixel superPixel(int superResolution) {
    return new SkyPixel(superPixelId(superResolution), superResolution, weight);
  }

  public SkyPixel withWeight(double newWeight) {
    return new SkyPixel(id, resolution, newWeight);
  }

  public Coordinate center() {
    return PixelScheme.center(id, resolution);
  }

  public boolean contains(Coordinate lonLat) {
    return PixelScheme.pixelId(lonLat, resolution) == id;
  }

  /** Returns true if {@code other} is this pixel or a sub-pixel of it. */
  public boolean contains(SkyPixel other) {
    return other.resolution >= resolution && other.superPixelId(resolution) == id;
  }

  @Override
  public int compareTo(SkyPixel o) {
    int result = Integer.compare(resolution, o.resolution);
    return result != 0 ? result : Long.compare(id, o.id);
  }

  @Override
  public String toString() {
    return "{id=" + id + " res=" + resolution + " weight=" + weight + '}';
  }
}
