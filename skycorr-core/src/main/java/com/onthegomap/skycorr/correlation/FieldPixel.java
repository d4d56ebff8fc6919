package com.onthegomap.skycorr.correlation;

import com.onthegomap.skycorr.geo.SkyPixel;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A pixel of a {@link FieldUnion}: a {@link SkyPixel} with a mutable intensity and the number of points that
 * contributed to it.
 */
@NotThreadSafe
public class FieldPixel {

  private final SkyPixel pixel;
  private double intensity;
  private long nPoints;

  public FieldPixel(SkyPixel pixel, double intensity, long nPoints) {
    this.pixel = pixel;
    this.intensity = intensity;
    this.nPoints = nPoints;
  }

  public static FieldPixel empty(SkyPixel pixel) {
    return new FieldPixel(pixel, 0, 0);
  }

  public SkyPixel pixel() {
    return pixel;
  }

  public long id() {
    return pixel.id();
  }

  public int resolution() {
    return pixel.resolution();
  }

  /** Unmasked fraction of the pixel. */
  public double weight() {
    return pixel.weight();
  }

  public double unmaskedArea() {
    return pixel.weightedArea();
  }

  public double intensity() {
    return intensity;
  }

  public long nPoints() {
    return nPoints;
  }

  void setIntensity(double intensity) {
    this.intensity = intensity;
  }

  void add(double dIntensity, long dPoints) {
    intensity += dIntensity;
    nPoints += dPoints;
  }

  /** Returns the value this pixel holds as a field of {@code type}, before any over-density transform. */
  double value(FieldType type) {
    return switch (type) {
      case SCALAR_FIELD -> intensity;
      case DENSITY_FIELD -> unmaskedArea() > 0 ? intensity / unmaskedArea() : 0;
      case SAMPLED_FIELD -> nPoints > 0 ? intensity / nPoints : 0;
    };
  }

  /** Returns the intensity that gives this pixel {@code value} as a field of {@code type}. */
  double intensityForValue(FieldType type, double value) {
    return switch (type) {
      case SCALAR_FIELD -> value;
      case DENSITY_FIELD -> value * unmaskedArea();
      case SAMPLED_FIELD -> value * nPoints;
    };
  }

  @Override
  public String toString() {
    return "FieldPixel{" + pixel + " intensity=" + intensity + " points=" + nPoints + '}';
  }
}
