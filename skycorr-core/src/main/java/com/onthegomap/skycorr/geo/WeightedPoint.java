package com.onthegomap.skycorr.geo;

import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.Coordinate;

/**
 * A point on the sky with a weight, for example the likelihood that a catalog object is a galaxy.
 *
 * @param lonLat longitude ({@code x}) and latitude ({@code y}) in degrees
 * @param weight weight of the point
 */
@Immutable
public record WeightedPoint(Coordinate lonLat, double weight) {

  public static WeightedPoint of(double lon, double lat) {
    return new WeightedPoint(new Coordinate(lon, lat), 1.0);
  }

  public static WeightedPoint of(double lon, double lat, double weight) {
    return new WeightedPoint(new Coordinate(lon, lat), weight);
  }

  public double lon() {
    return lonLat.x;
  }

  public double lat() {
    return lonLat.y;
  }
}
