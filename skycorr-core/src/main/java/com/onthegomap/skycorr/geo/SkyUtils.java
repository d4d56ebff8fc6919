package com.onthegomap.skycorr.geo;

import org.locationtech.jts.geom.Coordinate;

/**
 * A collection of utilities for angles on the unit sphere.
 * <p>
 * Coordinates are JTS {@link Coordinate coordinates} where {@code x} is longitude and {@code y} is latitude, both in
 * degrees.
 */
public class SkyUtils {

  private static final double RADIANS_PER_DEGREE = Math.PI / 180;

  private SkyUtils() {}

  /** Returns {@code lon} wrapped into {@code [0, 360)}. */
  public static double normalizeLongitude(double lon) {
    double result = lon % 360d;
    return result < 0 ? result + 360d : result;
  }

  /** Returns the {x, y, z} unit vector pointing at a longitude/latitude. */
  public static double[] unitVector(Coordinate lonLat) {
    double lon = lonLat.x * RADIANS_PER_DEGREE;
    double lat = lonLat.y * RADIANS_PER_DEGREE;
    double cosLat = Math.cos(lat);
    return new double[]{cosLat * Math.cos(lon), cosLat * Math.sin(lon), Math.sin(lat)};
  }

  /** Returns the cosine of the angle between two unit vectors. */
  public static double cosAngle(double[] a, double[] b) {
    return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
  }

  /** Returns the great-circle separation in degrees between two longitude/latitude coordinates. */
  public static double angularDistance(Coordinate a, Coordinate b) {
    double lat1 = a.y * RADIANS_PER_DEGREE;
    double lat2 = b.y * RADIANS_PER_DEGREE;
    double dLat = lat2 - lat1;
    double dLon = (b.x - a.x) * RADIANS_PER_DEGREE;
    double h = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
      Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
    return 2 * Math.asin(Math.min(1, Math.sqrt(h))) / RADIANS_PER_DEGREE;
  }

  /** Returns the area in square degrees of the latitude/longitude box between the given limits. */
  public static double boxArea(double minLon, double maxLon, double minLat, double maxLat) {
    double width = (maxLon - minLon) * RADIANS_PER_DEGREE;
    double height = Math.sin(maxLat * RADIANS_PER_DEGREE) - Math.sin(minLat * RADIANS_PER_DEGREE);
    return Math.max(0, width * height) * PixelScheme.STRAD_TO_DEG2;
  }
}
