package com.onthegomap.skycorr.geo;

import org.locationtech.jts.geom.Coordinate;

/**
 * Constants and static utilities for the equal-area pixelization of the sphere that regions and pixel-based
 * correlations are computed on.
 * <p>
 * At resolution {@code r} the sphere is split into {@code NX0*r} columns equally spaced in longitude and
 * {@code NY0*r} rows equally spaced in {@code sin(latitude)}, so every pixel at a resolution has the same area. Row 0
 * touches the north pole. Resolutions are powers of 2 and the "level" of a resolution is its base-2 logarithm.
 * <p>
 * The column of a pixel is its "stripe": a 1-D scan-order coordinate that regionation walks in ascending order.
 */
public class PixelScheme {

  public static final int NX0 = 36;
  public static final int NY0 = 13;
  public static final int HPIX_LEVEL = 2;
  public static final int MAX_LEVEL = 15;
  public static final int HPIX_RESOLUTION = 1 << HPIX_LEVEL;
  public static final int MAX_RESOLUTION = 1 << MAX_LEVEL;
  public static final double STRAD_TO_DEG2 = (180 / Math.PI) * (180 / Math.PI);
  public static final double SPHERE_AREA_DEG2 = 4 * Math.PI * STRAD_TO_DEG2;

  private PixelScheme() {}

  /** Returns true if {@code resolution} is a power of 2 between {@link #HPIX_RESOLUTION} and {@link #MAX_RESOLUTION}. */
  public static boolean isValidResolution(int resolution) {
    return resolution >= HPIX_RESOLUTION && resolution <= MAX_RESOLUTION && Integer.bitCount(resolution) == 1;
  }

  public static int resolutionForLevel(int level) {
    if (level < HPIX_LEVEL || level > MAX_LEVEL) {
      throw new IllegalArgumentException("Level must be in [" + HPIX_LEVEL + ", " + MAX_LEVEL + "], was " + level);
    }
    return 1 << level;
  }

  public static int levelForResolution(int resolution) {
    if (!isValidResolution(resolution)) {
      throw new IllegalArgumentException("Invalid resolution: " + resolution);
    }
    return Integer.numberOfTrailingZeros(resolution);
  }

  /** Number of pixel columns (stripes) around the sphere at {@code resolution}. */
  public static long columns(int resolution) {
    return (long) NX0 * resolution;
  }

  /** Number of pixel rows from pole to pole at {@code resolution}. */
  public static long rows(int resolution) {
    return (long) NY0 * resolution;
  }

  /** Area in square degrees of one pixel at {@code resolution}. */
  public static double pixelArea(int resolution) {
    return SPHERE_AREA_DEG2 / (columns(resolution) * rows(resolution));
  }

  /** Average area of a pixel at {@code level}, which for this scheme is the area of every pixel at that level. */
  public static double averageArea(int level) {
    return pixelArea(resolutionForLevel(level));
  }

  /** Number of stripes that fit in one degree of longitude at {@code resolution}. */
  public static double stripesPerDegree(int resolution) {
    return columns(resolution) / 360d;
  }

  /** Returns the id of the pixel at {@code column} (counted east from longitude 0) and {@code row} (counted south). */
  public static long pixelIdOfColumnRow(long column, long row, int resolution) {
    return row * columns(resolution) + column;
  }

  public static long column(long pixelId, int resolution) {
    return pixelId % columns(resolution);
  }

  public static long row(long pixelId, int resolution) {
    return pixelId / columns(resolution);
  }

  /** The stripe of a pixel is its column. */
  public static long stripe(long pixelId, int resolution) {
    return column(pixelId, resolution);
  }

  /** Returns the id of the pixel at {@code resolution} containing a longitude/latitude coordinate. */
  public static long pixelId(Coordinate lonLat, int resolution) {
    return pixelId(lonLat.x, lonLat.y, resolution);
  }

  public static long pixelId(double lon, double lat, int resolution) {
    long nx = columns(resolution);
    long ny = rows(resolution);
    long column = (long) Math.floor(SkyUtils.normalizeLongitude(lon) / 360d * nx);
    long row = (long) Math.floor((1 - Math.sin(Math.toRadians(lat))) / 2 * ny);
    column = Math.min(Math.max(column, 0), nx - 1);
    row = Math.min(Math.max(row, 0), ny - 1);
    return pixelIdOfColumnRow(column, row, resolution);
  }

  /** Returns the id of the pixel at the coarser {@code superResolution} that contains {@code pixelId}. */
  public static long superPixelId(long pixelId, int resolution, int superResolution) {
    if (superResolution > resolution) {
      throw new IllegalArgumentException(
        "Super-pixel resolution " + superResolution + " is finer than pixel resolution " + resolution);
    }
    int factor = resolution / superResolution;
    return pixelIdOfColumnRow(column(pixelId, resolution) / factor, row(pixelId, resolution) / factor, superResolution);
  }

  public static double minLon(long pixelId, int resolution) {
    return 360d * column(pixelId, resolution) / columns(resolution);
  }

  public static double maxLon(long pixelId, int resolution) {
    return 360d * (column(pixelId, resolution) + 1) / columns(resolution);
  }

  public static double maxLat(long pixelId, int resolution) {
    return Math.toDegrees(Math.asin(1 - 2d * row(pixelId, resolution) / rows(resolution)));
  }

  public static double minLat(long pixelId, int resolution) {
    return Math.toDegrees(Math.asin(1 - 2d * (row(pixelId, resolution) + 1) / rows(resolution)));
  }

  /** Returns the longitude/latitude of the equal-area center of a pixel. */
  public static Coordinate center(long pixelId, int resolution) {
    double lon = 360d * (column(pixelId, resolution) + 0.5) / columns(resolution);
    double lat = Math.toDegrees(Math.asin(1 - 2d * (row(pixelId, resolution) + 0.5) / rows(resolution)));
    return new Coordinate(lon, lat);
  }
}
