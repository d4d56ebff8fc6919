package com.onthegomap.skycorr.correlation;

import com.carrotsearch.hppc.LongObjectHashMap;
import com.onthegomap.skycorr.collection.Hppc;
import com.onthegomap.skycorr.geo.Footprint;
import com.onthegomap.skycorr.geo.PixelScheme;
import com.onthegomap.skycorr.geo.SkyPixel;
import com.onthegomap.skycorr.geo.SkyUtils;
import com.onthegomap.skycorr.regions.RegionMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;
import javax.annotation.concurrent.NotThreadSafe;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A field sampled on every pixel of a footprint at a single level, used to measure correlations from products of
 * pixel over-densities instead of counting pairs.
 * <p>
 * Raw intensities accumulate through {@link #addPoint(Coordinate, double)}. {@link #convertToOverDensity()} replaces
 * each pixel's intensity with {@code (value - mean) / mean} and {@link #convertFromOverDensity()} restores it. Totals
 * always describe the raw field.
 */
@NotThreadSafe
public class FieldUnion {

  private static final Logger LOGGER = LoggerFactory.getLogger(FieldUnion.class);

  private final FieldType type;
  private final int level;
  private final int resolution;
  private final List<FieldPixel> pixels = new ArrayList<>();
  private LongObjectHashMap<FieldPixel> index = Hppc.newLongObjectHashMap(16);
  private double area = 0;
  private double totalIntensity = 0;
  private long totalPoints = 0;
  private double meanIntensity = 0;
  private boolean meanCalculated = false;
  private boolean overDensity = false;

  private FieldUnion(FieldType type, int level) {
    this.type = type;
    this.level = level;
    this.resolution = PixelScheme.resolutionForLevel(level);
  }

  /** Returns an empty field covering every pixel of {@code footprint} at {@code level}. */
  public static FieldUnion fromFootprint(Footprint footprint, int level, FieldType type) {
    FieldUnion result = new FieldUnion(type, level);
    List<SkyPixel> coverage = footprint.coverage(result.resolution);
    List<FieldPixel> empty = new ArrayList<>(coverage.size());
    for (SkyPixel pixel : coverage) {
      empty.add(FieldPixel.empty(pixel));
    }
    result.init(empty);
    return result;
  }

  /**
   * Returns a field made of {@code fieldPixels}, which must all have the same resolution.
   *
   * @throws IllegalArgumentException if {@code fieldPixels} is empty, mixes resolutions, or repeats a pixel
   */
  public static FieldUnion fromPixels(Collection<FieldPixel> fieldPixels, FieldType type) {
    if (fieldPixels.isEmpty()) {
      throw new IllegalArgumentException("Cannot build a field from no pixels");
    }
    int res = fieldPixels.iterator().next().resolution();
    for (FieldPixel pixel : fieldPixels) {
      if (pixel.resolution() != res) {
        throw new IllegalArgumentException("Mixed pixel resolutions " + res + " and " + pixel.resolution());
      }
    }
    FieldUnion result = new FieldUnion(type, PixelScheme.levelForResolution(res));
    result.init(new ArrayList<>(fieldPixels));
    if (result.index.size() != result.pixels.size()) {
      throw new IllegalArgumentException("Duplicate pixels in field");
    }
    for (FieldPixel pixel : result.pixels) {
      result.totalIntensity += pixel.intensity();
      result.totalPoints += pixel.nPoints();
    }
    return result;
  }

  /**
   * Returns a copy of {@code source} aggregated up to the coarser {@code newLevel}. Intensities and point counts add,
   * except for scalar fields where the new intensity is the unmasked-area weighted mean of the children.
   *
   * @throws IllegalArgumentException if {@code newLevel} is finer than the source level
   * @throws IllegalStateException    if {@code source} holds over-densities
   */
  public static FieldUnion resample(FieldUnion source, int newLevel) {
    if (newLevel > source.level) {
      throw new IllegalArgumentException("Cannot resample level " + source.level + " to finer level " + newLevel);
    }
    source.requireRaw();
    int newResolution = PixelScheme.resolutionForLevel(newLevel);
    // id -> {unmasked area, intensity, points}
    TreeMap<Long, double[]> sums = new TreeMap<>();
    for (FieldPixel pixel : source.pixels) {
      double[] sum = sums.computeIfAbsent(pixel.pixel().superPixelId(newResolution), id -> new double[3]);
      double unmasked = pixel.unmaskedArea();
      sum[0] += unmasked;
      sum[1] += source.type == FieldType.SCALAR_FIELD ? pixel.intensity() * unmasked : pixel.intensity();
      sum[2] += pixel.nPoints();
    }
    List<FieldPixel> result = new ArrayList<>(sums.size());
    double pixelArea = PixelScheme.pixelArea(newResolution);
    sums.forEach((id, sum) -> {
      double intensity = source.type == FieldType.SCALAR_FIELD ? (sum[0] > 0 ? sum[1] / sum[0] : 0) : sum[1];
      double weight = Math.min(1.0, sum[0] / pixelArea);
      result.add(new FieldPixel(new SkyPixel(id, newResolution, weight), intensity, (long) sum[2]));
    });
    return fromPixels(result, source.type);
  }

  private void init(List<FieldPixel> fieldPixels) {
    fieldPixels.sort(Comparator.comparingLong(FieldPixel::id));
    pixels.addAll(fieldPixels);
    index = Hppc.newLongObjectHashMap(fieldPixels.size());
    for (FieldPixel pixel : fieldPixels) {
      index.put(pixel.id(), pixel);
      area += pixel.unmaskedArea();
    }
  }

  private void requireRaw() {
    if (overDensity) {
      throw new IllegalStateException("Field holds over-densities, convert it back first");
    }
  }

  /** Adds a point with unit intensity. */
  public boolean addPoint(Coordinate lonLat) {
    return addPoint(lonLat, 1.0);
  }

  /**
   * Adds {@code intensity} to the pixel containing {@code lonLat}.
   *
   * @return false if no pixel of this field contains the point
   * @throws IllegalStateException if the field holds over-densities
   */
  public boolean addPoint(Coordinate lonLat, double intensity) {
    requireRaw();
    FieldPixel pixel = index.get(PixelScheme.pixelId(lonLat, resolution));
    if (pixel == null) {
      return false;
    }
    pixel.add(intensity, 1);
    totalIntensity += intensity;
    totalPoints++;
    meanCalculated = false;
    return true;
  }

  private List<FieldPixel> overlapping(SkyPixel pixel) {
    if (pixel.resolution() > resolution) {
      FieldPixel parent = index.get(pixel.superPixelId(resolution));
      return parent == null ? List.of() : List.of(parent);
    }
    List<FieldPixel> result = new ArrayList<>();
    for (FieldPixel candidate : pixels) {
      if (candidate.pixel().superPixelId(pixel.resolution()) == pixel.id()) {
        result.add(candidate);
      }
    }
    return result;
  }

  /**
   * Returns the intensity inside {@code pixel}: the sum over this field's pixels it contains, or the share of the
   * containing pixel's intensity for a finer pixel (the containing value itself for scalar fields).
   */
  public double findIntensity(SkyPixel pixel) {
    requireRaw();
    if (pixel.resolution() > resolution) {
      List<FieldPixel> parent = overlapping(pixel);
      if (parent.isEmpty()) {
        return 0;
      }
      FieldPixel p = parent.get(0);
      return type == FieldType.SCALAR_FIELD ? p.intensity() : p.intensity() * pixel.area() / p.pixel().area();
    }
    double sum = 0;
    for (FieldPixel p : overlapping(pixel)) {
      sum += p.intensity();
    }
    return sum;
  }

  /** Returns the field value averaged over the unmasked part of {@code pixel}, or 0 if it does not overlap. */
  public double findDensity(SkyPixel pixel) {
    requireRaw();
    double weighted = 0;
    double unmasked = 0;
    double intensity = 0;
    long points = 0;
    for (FieldPixel p : overlapping(pixel)) {
      weighted += p.value(type) * p.unmaskedArea();
      unmasked += p.unmaskedArea();
      intensity += p.intensity();
      points += p.nPoints();
    }
    if (type == FieldType.SAMPLED_FIELD) {
      return points > 0 ? intensity / points : 0;
    }
    return unmasked > 0 ? weighted / unmasked : 0;
  }

  /** Returns the number of points per unmasked square degree inside {@code pixel}. */
  public double findPointDensity(SkyPixel pixel) {
    double unmasked = 0;
    long points = 0;
    for (FieldPixel p : overlapping(pixel)) {
      unmasked += p.unmaskedArea();
      points += p.nPoints();
    }
    return unmasked > 0 ? points / unmasked : 0;
  }

  /** Recomputes the mean field value over the whole union. */
  public double calculateMeanIntensity() {
    meanIntensity = switch (type) {
      case SCALAR_FIELD -> {
        double weighted = 0;
        for (FieldPixel pixel : pixels) {
          weighted += pixel.value(type) * pixel.unmaskedArea();
        }
        yield area > 0 ? weighted / area : 0;
      }
      case DENSITY_FIELD -> area > 0 ? totalIntensity / area : 0;
      case SAMPLED_FIELD -> totalPoints > 0 ? totalIntensity / totalPoints : 0;
    };
    meanCalculated = true;
    return meanIntensity;
  }

  /**
   * Replaces each pixel's intensity with its over-density. Does nothing if already converted.
   *
   * @throws IllegalStateException if the mean field value is 0
   */
  public void convertToOverDensity() {
    if (overDensity) {
      return;
    }
    if (!meanCalculated) {
      calculateMeanIntensity();
    }
    if (meanIntensity == 0) {
      throw new IllegalStateException("Mean intensity of " + type + " field is 0");
    }
    for (FieldPixel pixel : pixels) {
      pixel.setIntensity((pixel.value(type) - meanIntensity) / meanIntensity);
    }
    overDensity = true;
  }

  /** Restores raw intensities after {@link #convertToOverDensity()}. Does nothing if not converted. */
  public void convertFromOverDensity() {
    if (!overDensity) {
      return;
    }
    for (FieldPixel pixel : pixels) {
      double value = pixel.intensity() * meanIntensity + meanIntensity;
      pixel.setIntensity(pixel.intensityForValue(type, value));
    }
    overDensity = false;
  }

  /* Correlation */

  public boolean autoCorrelate(AngularBin bin) {
    return correlate(this, null, bin);
  }

  public boolean autoCorrelateWithRegions(RegionMap regions, AngularBin bin) {
    return correlate(this, regions, bin);
  }

  public boolean crossCorrelate(FieldUnion other, AngularBin bin) {
    return correlate(other, null, bin);
  }

  public boolean crossCorrelateWithRegions(FieldUnion other, RegionMap regions, AngularBin bin) {
    return correlate(other, regions, bin);
  }

  /**
   * Adds the over-density products of every ordered pair of pixels whose centers are separated by an angle inside
   * {@code bin}. Both fields are left converted to over-densities.
   *
   * @return false without touching the bin if it does not sum pixel products at this field's level
   */
  private boolean correlate(FieldUnion other, RegionMap regions, AngularBin bin) {
    if (!bin.isPixelMode() || bin.level().orElse(-1) != level || other.level != level) {
      return false;
    }
    convertToOverDensity();
    other.convertToOverDensity();
    Prepared a = prepare(regions);
    Prepared b = other == this ? a : other.prepare(regions);
    boolean same = other == this;
    for (int i = 0; i < a.size(); i++) {
      for (int j = 0; j < b.size(); j++) {
        if (same && i == j) {
          continue;
        }
        if (bin.isWithinCosBounds(SkyUtils.cosAngle(a.vectors[i], b.vectors[j]))) {
          double weight = a.weights[i] * b.weights[j];
          bin.addToPixelWtheta(weight * a.deltas[i] * b.deltas[j], weight, a.regions[i], b.regions[j]);
        }
      }
    }
    LOGGER.debug("Correlated {} x {} pixels at level {} for {}", a.size(), b.size(), level, bin);
    return true;
  }

  private record Prepared(double[][] vectors, double[] weights, double[] deltas, int[] regions) {

    int size() {
      return weights.length;
    }
  }

  private Prepared prepare(RegionMap regions) {
    int n = pixels.size();
    double[][] vectors = new double[n][];
    double[] weights = new double[n];
    double[] deltas = new double[n];
    int[] regionIds = new int[n];
    for (int i = 0; i < n; i++) {
      FieldPixel pixel = pixels.get(i);
      vectors[i] = SkyUtils.unitVector(pixel.pixel().center());
      weights[i] = pixel.weight();
      deltas[i] = pixel.intensity();
      regionIds[i] = regions == null ? AngularBin.GLOBAL : regions.findRegion(pixel.pixel());
    }
    return new Prepared(vectors, weights, deltas, regionIds);
  }

  /** Removes every pixel and resets the totals. */
  public void clear() {
    pixels.clear();
    index = Hppc.newLongObjectHashMap(16);
    area = 0;
    totalIntensity = 0;
    totalPoints = 0;
    meanIntensity = 0;
    meanCalculated = false;
    overDensity = false;
  }

  public boolean contains(Coordinate lonLat) {
    FieldPixel pixel = index.get(PixelScheme.pixelId(lonLat, resolution));
    return pixel != null && pixel.weight() > 0;
  }

  public List<FieldPixel> pixels() {
    return Collections.unmodifiableList(pixels);
  }

  public FieldType type() {
    return type;
  }

  public int level() {
    return level;
  }

  public int resolution() {
    return resolution;
  }

  public double area() {
    return area;
  }

  public int size() {
    return pixels.size();
  }

  public boolean isEmpty() {
    return pixels.isEmpty();
  }

  public double intensity() {
    return totalIntensity;
  }

  public long nPoints() {
    return totalPoints;
  }

  /** Mean intensity per point, or the total intensity if no points have been added. */
  public double density() {
    return totalPoints > 0 ? totalIntensity / totalPoints : totalIntensity;
  }

  public double pointDensity() {
    return area > 0 ? totalPoints / area : 0;
  }

  public double meanIntensity() {
    return meanCalculated ? meanIntensity : calculateMeanIntensity();
  }

  public boolean isOverDensity() {
    return overDensity;
  }
}
