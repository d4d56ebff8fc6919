package com.onthegomap.skycorr.correlation;

import com.onthegomap.skycorr.geo.PixelScheme;
import java.util.Arrays;
import java.util.Comparator;
import java.util.OptionalInt;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Accumulates the data for one angular annulus {@code [thetaMin, thetaMax]} (in degrees) of an angular correlation
 * measurement, over the whole survey and for each jackknife region.
 * <p>
 * A bin either counts pairs ({@link BinMode.PairCounting}) and combines them with the Landy-Szalay estimator, or sums
 * products of pixel over-densities at a fixed level ({@link BinMode.PixelProduct}). The mode is chosen once when the
 * bin is created.
 * <p>
 * Every increment that carries two region indices is "leave-two-out": it is added to the global counters and to every
 * region except those two, so that each region's counters describe the survey with that region left out. An
 * increment where either region is {@link #GLOBAL} only touches the global counters.
 * <p>
 * Accumulation is additive, so partial bins computed over separate parts of the workload can be combined with
 * {@link #merge(AngularBin)}. The estimator values are not linear and should only be read after every increment has
 * been merged.
 */
@NotThreadSafe
public class AngularBin {

  /** Region index that refers to the whole survey, also used for pairs that fall outside the region map. */
  public static final int GLOBAL = -1;
  /** Returned by per-region accessors for a region index that does not exist. */
  public static final double INVALID = -1.0;

  public static final Comparator<AngularBin> THETA_ORDER = Comparator.comparingDouble(AngularBin::thetaMin);
  public static final Comparator<AngularBin> SIN_THETA_ORDER = Comparator.comparingDouble(AngularBin::sin2ThetaMin);
  /** Finest pixel level first, pair-counting bins last. */
  public static final Comparator<AngularBin> REVERSE_LEVEL_ORDER =
    Comparator.comparingInt((AngularBin bin) -> bin.mode().sortLevel()).reversed();

  private static final double EPSILON = 1e-10;
  private static final int N_TYPES = PairType.values().length;

  private final double thetaMin;
  private final double thetaMax;
  private final double sin2ThetaMin;
  private final double sin2ThetaMax;
  private final double cosThetaMin;
  private final double cosThetaMax;
  private final BinMode mode;
  private final int nRegion;
  private double theta;

  private double pairWeight = 0;
  private long pairCount = 0;
  private final double[] pairTypeWeight = new double[N_TYPES];
  private double pixelWtheta = 0;
  private double pixelWeight = 0;

  private final double[] pairWeightRegion;
  private final long[] pairCountRegion;
  private final double[][] pairTypeWeightRegion;
  private final double[] pixelWthetaRegion;
  private final double[] pixelWeightRegion;

  private boolean wthetaSet = false;
  private boolean wthetaErrorSet = false;
  private double wtheta = 0;
  private double wthetaError = 0;
  private final double[] wthetaRegion;
  private final double[] wthetaErrorRegion;

  /**
   * @param thetaMin inner radius in degrees
   * @param thetaMax outer radius in degrees
   * @param nRegion  number of jackknife regions, 0 for none
   * @param mode     pair counting or pixel product at a level
   * @throws IllegalArgumentException if {@code thetaMin >= thetaMax}, {@code thetaMin < 0} or {@code nRegion < 0}
   */
  public AngularBin(double thetaMin, double thetaMax, int nRegion, BinMode mode) {
    if (!(thetaMin < thetaMax) || thetaMin < 0) {
      throw new IllegalArgumentException("Invalid angular bin [" + thetaMin + ", " + thetaMax + "]");
    }
    if (nRegion < 0) {
      throw new IllegalArgumentException("Number of regions must be >= 0, was " + nRegion);
    }
    this.thetaMin = thetaMin;
    this.thetaMax = thetaMax;
    this.theta = 0.5 * (thetaMin + thetaMax);
    double sinMin = Math.sin(Math.toRadians(thetaMin));
    double sinMax = Math.sin(Math.toRadians(thetaMax));
    this.sin2ThetaMin = sinMin * sinMin;
    this.sin2ThetaMax = sinMax * sinMax;
    // larger angle = smaller cosine
    this.cosThetaMin = Math.cos(Math.toRadians(thetaMax));
    this.cosThetaMax = Math.cos(Math.toRadians(thetaMin));
    this.mode = mode;
    this.nRegion = nRegion;
    this.pairWeightRegion = new double[nRegion];
    this.pairCountRegion = new long[nRegion];
    this.pairTypeWeightRegion = new double[N_TYPES][nRegion];
    this.pixelWthetaRegion = new double[nRegion];
    this.pixelWeightRegion = new double[nRegion];
    this.wthetaRegion = new double[nRegion];
    this.wthetaErrorRegion = new double[nRegion];
  }

  public static AngularBin pairs(double thetaMin, double thetaMax) {
    return new AngularBin(thetaMin, thetaMax, 0, BinMode.pairs());
  }

  public static AngularBin pairs(double thetaMin, double thetaMax, int nRegion) {
    return new AngularBin(thetaMin, thetaMax, nRegion, BinMode.pairs());
  }

  public static AngularBin pixels(double thetaMin, double thetaMax, int level, int nRegion) {
    return new AngularBin(thetaMin, thetaMax, nRegion, BinMode.pixels(level));
  }

  /**
   * Returns a bin in pixel mode at the level from {@link #findLevel(double, double)}, or in pair mode if no level
   * resolves the scale.
   */
  public static AngularBin atScaleLevel(double thetaMin, double thetaMax, int nRegion) {
    OptionalInt level = findLevel(thetaMin, thetaMax);
    return new AngularBin(thetaMin, thetaMax, nRegion,
      level.isPresent() ? BinMode.pixels(level.getAsInt()) : BinMode.pairs());
  }

  /**
   * Returns the coarsest level whose characteristic pixel scale {@code sqrt(2 * average_area(level))} falls inside
   * {@code [thetaMin, thetaMax]} or below {@code thetaMin}, or empty if even the finest level is too coarse.
   * <p>
   * The ratio of largest to smallest pixel area at a level is below 2, so {@code sqrt(2 * area)} bounds the largest
   * scale a pixel at that level spans.
   */
  public static OptionalInt findLevel(double thetaMin, double thetaMax) {
    for (int level = PixelScheme.HPIX_LEVEL; level <= PixelScheme.MAX_LEVEL; level++) {
      double scale = Math.sqrt(2.0 * PixelScheme.averageArea(level));
      if (withinBounds(scale, thetaMin, thetaMax) || scale < thetaMin) {
        return OptionalInt.of(level);
      }
    }
    return OptionalInt.empty();
  }

  /** Returns a new, empty bin with the same angular range and mode sized for {@code regions} regions. */
  public AngularBin withRegions(int regions) {
    return withModeAndRegions(mode, regions);
  }

  /** Returns a new, empty bin with the same angular range and regions that counts pairs. */
  public AngularBin asPairBin() {
    return withModeAndRegions(BinMode.pairs(), nRegion);
  }

  /** Returns a new, empty bin with the same angular range in {@code newMode} sized for {@code regions} regions. */
  public AngularBin withModeAndRegions(BinMode newMode, int regions) {
    AngularBin result = new AngularBin(thetaMin, thetaMax, regions, newMode);
    result.setTheta(theta);
    return result;
  }

  private static boolean withinBounds(double value, double min, double max) {
    return value >= min - EPSILON && value <= max + EPSILON;
  }

  /**
   * Returns true if {@code thetaDegrees} falls in the half-open annulus {@code [thetaMin, thetaMax)}, so a separation on
   * the edge shared by two adjacent bins belongs only to the wider one.
   */
  public boolean isWithinBounds(double thetaDegrees) {
    return thetaDegrees >= thetaMin && thetaDegrees < thetaMax;
  }

  // near theta = 0 cosine changes too slowly for a tolerance, so compare exactly
  public boolean isWithinSin2Bounds(double sin2Theta) {
    return sin2Theta >= sin2ThetaMin && sin2Theta < sin2ThetaMax;
  }

  /** Same half-open test as {@link #isWithinBounds(double)} on the cosine of the separation. */
  public boolean isWithinCosBounds(double cosTheta) {
    return cosTheta > cosThetaMin && cosTheta <= cosThetaMax;
  }

  /** Area of the annulus in square degrees. */
  public double area() {
    return (cosThetaMax - cosThetaMin) * 2.0 * Math.PI * PixelScheme.STRAD_TO_DEG2;
  }

  /** Expected shot noise on w(theta) for a survey of {@code surveyArea} square degrees at a given object density. */
  public double poissonNoise(double objectsPerSquareDegree, double surveyArea) {
    return 1.0 / Math.sqrt(objectsPerSquareDegree * objectsPerSquareDegree * surveyArea * area());
  }

  /* Accumulation */

  private boolean leavesRegionsOut(int regionA, int regionB) {
    return regionA != GLOBAL && regionB != GLOBAL;
  }

  /** Adds the product of two pixel over-densities and their combined weight to the global counters only. */
  public void addToPixelWtheta(double dwtheta, double dweight) {
    pixelWtheta += dwtheta;
    pixelWeight += dweight;
  }

  /**
   * Adds the product of two pixel over-densities and their combined weight to the global counters and to every region
   * other than {@code regionA} and {@code regionB}.
   */
  public void addToPixelWtheta(double dwtheta, double dweight, int regionA, int regionB) {
    pixelWtheta += dwtheta;
    pixelWeight += dweight;
    if (leavesRegionsOut(regionA, regionB)) {
      for (int k = 0; k < nRegion; k++) {
        if (k != regionA && k != regionB) {
          pixelWthetaRegion[k] += dwtheta;
          pixelWeightRegion[k] += dweight;
        }
      }
    }
  }

  public void addToWeight(double weight) {
    pairWeight += weight;
  }

  public void addToWeight(double weight, int regionA, int regionB) {
    pairWeight += weight;
    if (leavesRegionsOut(regionA, regionB)) {
      for (int k = 0; k < nRegion; k++) {
        if (k != regionA && k != regionB) {
          pairWeightRegion[k] += weight;
        }
      }
    }
  }

  public void addToCounter(long step) {
    pairCount += step;
  }

  public void addToCounter(long step, int regionA, int regionB) {
    pairCount += step;
    if (leavesRegionsOut(regionA, regionB)) {
      for (int k = 0; k < nRegion; k++) {
        if (k != regionA && k != regionB) {
          pairCountRegion[k] += step;
        }
      }
    }
  }

  public void addToPairWtheta(double weight, long step) {
    pairWeight += weight;
    pairCount += step;
  }

  public void addToPairWtheta(double weight, long step, int regionA, int regionB) {
    pairWeight += weight;
    pairCount += step;
    if (leavesRegionsOut(regionA, regionB)) {
      for (int k = 0; k < nRegion; k++) {
        if (k != regionA && k != regionB) {
          pairWeightRegion[k] += weight;
          pairCountRegion[k] += step;
        }
      }
    }
  }

  /**
   * Adds the pair weight accumulated so far, globally and in every region, to the {@code type} component and resets
   * the accumulated pair weight to zero.
   */
  public void moveWeight(PairType type) {
    int t = type.ordinal();
    pairTypeWeight[t] += pairWeight;
    pairWeight = 0;
    for (int k = 0; k < nRegion; k++) {
      pairTypeWeightRegion[t][k] += pairWeightRegion[k];
      pairWeightRegion[k] = 0;
    }
  }

  /** Divides the {@code type} component, globally and in every region, by {@code scale}. */
  public void rescalePairCounts(PairType type, double scale) {
    int t = type.ordinal();
    pairTypeWeight[t] /= scale;
    for (int k = 0; k < nRegion; k++) {
      pairTypeWeightRegion[t][k] /= scale;
    }
  }

  /**
   * Adds the raw counters of {@code other} to this bin.
   *
   * @throws IllegalArgumentException if {@code other} has a different angular range, mode, or number of regions
   */
  public void merge(AngularBin other) {
    if (other.thetaMin != thetaMin || other.thetaMax != thetaMax || !other.mode.equals(mode) ||
      other.nRegion != nRegion) {
      throw new IllegalArgumentException("Cannot merge " + other + " into " + this);
    }
    pairWeight += other.pairWeight;
    pairCount += other.pairCount;
    pixelWtheta += other.pixelWtheta;
    pixelWeight += other.pixelWeight;
    for (int t = 0; t < N_TYPES; t++) {
      pairTypeWeight[t] += other.pairTypeWeight[t];
    }
    for (int k = 0; k < nRegion; k++) {
      pairWeightRegion[k] += other.pairWeightRegion[k];
      pairCountRegion[k] += other.pairCountRegion[k];
      pixelWthetaRegion[k] += other.pixelWthetaRegion[k];
      pixelWeightRegion[k] += other.pixelWeightRegion[k];
      for (int t = 0; t < N_TYPES; t++) {
        pairTypeWeightRegion[t][k] += other.pairTypeWeightRegion[t][k];
      }
    }
  }

  /* Resetting */

  /** Zeroes every counter and drops any explicitly set w(theta) and error values. */
  public void reset() {
    resetWeight();
    resetCounter();
    resetPixelWtheta();
    for (PairType type : PairType.values()) {
      resetPairCounts(type);
    }
    wthetaSet = wthetaErrorSet = false;
    wtheta = wthetaError = 0;
    Arrays.fill(wthetaRegion, 0);
    Arrays.fill(wthetaErrorRegion, 0);
  }

  public void resetPixelWtheta() {
    pixelWtheta = pixelWeight = 0;
    Arrays.fill(pixelWthetaRegion, 0);
    Arrays.fill(pixelWeightRegion, 0);
  }

  public void resetWeight() {
    pairWeight = 0;
    Arrays.fill(pairWeightRegion, 0);
  }

  public void resetCounter() {
    pairCount = 0;
    Arrays.fill(pairCountRegion, 0);
  }

  public void resetPairCounts(PairType type) {
    pairTypeWeight[type.ordinal()] = 0;
    Arrays.fill(pairTypeWeightRegion[type.ordinal()], 0);
  }

  /* Overrides */

  /** Sets the survey-wide w(theta) explicitly instead of deriving it from the counters. */
  public void setWtheta(double value) {
    wthetaSet = true;
    wtheta = value;
  }

  /** Sets w(theta) for {@code region} explicitly, switching every w(theta) accessor to explicit values. */
  public void setWtheta(int region, double value) {
    if (region == GLOBAL) {
      setWtheta(value);
    } else if (isValidRegion(region)) {
      wthetaSet = true;
      wthetaRegion[region] = value;
    }
  }

  public void setWthetaError(double value) {
    wthetaErrorSet = true;
    wthetaError = value;
  }

  public void setWthetaError(int region, double value) {
    if (region == GLOBAL) {
      setWthetaError(value);
    } else if (isValidRegion(region)) {
      wthetaErrorSet = true;
      wthetaErrorRegion[region] = value;
    }
  }

  public void setTheta(double theta) {
    this.theta = theta;
  }

  /* Estimators */

  private boolean isValidRegion(int region) {
    return region >= 0 && region < nRegion;
  }

  private static double landySzalay(double dd, double dr, double rd, double rr) {
    return (dd - dr - rd + rr) / rr;
  }

  /**
   * Returns w(theta) for the whole survey: {@code (DD - DR - RD + RR) / RR} for pair counting or
   * {@code pixel_wtheta / pixel_weight} for pixel products, unless a value was set explicitly.
   */
  public double wtheta() {
    if (wthetaSet) {
      return wtheta;
    }
    return mode.isPixelMode() ? pixelWtheta / pixelWeight : landySzalay(
      pairTypeWeight[0], pairTypeWeight[1], pairTypeWeight[2], pairTypeWeight[3]);
  }

  /** Returns w(theta) with {@code region} left out, {@link #wtheta()} for {@link #GLOBAL}, or {@link #INVALID}. */
  public double wtheta(int region) {
    if (region == GLOBAL) {
      return wtheta();
    }
    if (!isValidRegion(region)) {
      return INVALID;
    }
    if (wthetaSet) {
      return wthetaRegion[region];
    }
    return mode.isPixelMode() ? pixelWthetaRegion[region] / pixelWeightRegion[region] : landySzalay(
      pairTypeWeightRegion[0][region], pairTypeWeightRegion[1][region], pairTypeWeightRegion[2][region],
      pairTypeWeightRegion[3][region]);
  }

  /** Returns the explicitly set error, or {@code 1/sqrt(N)} where N is DD for pair counting or the pixel weight. */
  public double wthetaError() {
    if (wthetaErrorSet) {
      return wthetaError;
    }
    return 1.0 / Math.sqrt(mode.isPixelMode() ? pixelWeight : pairTypeWeight[PairType.GAL_GAL.ordinal()]);
  }

  public double wthetaError(int region) {
    if (region == GLOBAL) {
      return wthetaError();
    }
    if (!isValidRegion(region)) {
      return INVALID;
    }
    if (wthetaErrorSet) {
      return wthetaErrorRegion[region];
    }
    return 1.0 / Math.sqrt(
      mode.isPixelMode() ? pixelWeightRegion[region] : pairTypeWeightRegion[PairType.GAL_GAL.ordinal()][region]);
  }

  /** Returns the mean pair weight per pair: accumulated pair weight over the raw pair count. */
  public double weightedCrossCorrelation() {
    return pairWeight / pairCount;
  }

  public double weightedCrossCorrelation(int region) {
    if (region == GLOBAL) {
      return weightedCrossCorrelation();
    }
    return isValidRegion(region) ? pairWeightRegion[region] / pairCountRegion[region] : INVALID;
  }

  /** Returns the average over regions of the leave-out w(theta) values. */
  public double meanWtheta() {
    double mean = 0;
    for (int k = 0; k < nRegion; k++) {
      mean += wtheta(k) / nRegion;
    }
    return mean;
  }

  /**
   * Returns {@code (n-1)/n * sqrt(sum_k (mean - w_k)^2)} over the region values, or 0 without regions.
   * <p>
   * The {@code (n-1)/n} factor multiplies the square root of the summed squared deviations.
   */
  public double meanWthetaError() {
    double mean = meanWtheta();
    double sum = 0;
    for (int k = 0; k < nRegion; k++) {
      double diff = mean - wtheta(k);
      sum += diff * diff;
    }
    return jackknifeScale(sum);
  }

  public double meanWeightedCrossCorrelation() {
    double mean = 0;
    for (int k = 0; k < nRegion; k++) {
      mean += weightedCrossCorrelation(k) / nRegion;
    }
    return mean;
  }

  public double meanWeightedCrossCorrelationError() {
    double mean = meanWeightedCrossCorrelation();
    double sum = 0;
    for (int k = 0; k < nRegion; k++) {
      double diff = mean - weightedCrossCorrelation(k);
      sum += diff * diff;
    }
    return jackknifeScale(sum);
  }

  private double jackknifeScale(double sumOfSquares) {
    return nRegion == 0 ? 0.0 : (nRegion - 1.0) * Math.sqrt(sumOfSquares) / nRegion;
  }

  public double meanWeight() {
    double mean = 0;
    for (int k = 0; k < nRegion; k++) {
      mean += pairWeightRegion[k] / nRegion;
    }
    return mean;
  }

  public double meanCounter() {
    double mean = 0;
    for (int k = 0; k < nRegion; k++) {
      mean += (double) pairCountRegion[k] / nRegion;
    }
    return mean;
  }

  public double meanPairCounts(PairType type) {
    double mean = 0;
    for (int k = 0; k < nRegion; k++) {
      mean += pairTypeWeightRegion[type.ordinal()][k] / nRegion;
    }
    return mean;
  }

  /* Counters */

  public double pixelWtheta() {
    return pixelWtheta;
  }

  public double pixelWtheta(int region) {
    return region == GLOBAL ? pixelWtheta : isValidRegion(region) ? pixelWthetaRegion[region] : INVALID;
  }

  public double pixelWeight() {
    return pixelWeight;
  }

  public double pixelWeight(int region) {
    return region == GLOBAL ? pixelWeight : isValidRegion(region) ? pixelWeightRegion[region] : INVALID;
  }

  public double pairWeight() {
    return pairWeight;
  }

  public double pairWeight(int region) {
    return region == GLOBAL ? pairWeight : isValidRegion(region) ? pairWeightRegion[region] : INVALID;
  }

  public long pairCounts() {
    return pairCount;
  }

  public long pairCounts(int region) {
    return region == GLOBAL ? pairCount : isValidRegion(region) ? pairCountRegion[region] : -1;
  }

  public double pairWeight(PairType type) {
    return pairTypeWeight[type.ordinal()];
  }

  public double pairWeight(PairType type, int region) {
    return region == GLOBAL ? pairTypeWeight[type.ordinal()] :
      isValidRegion(region) ? pairTypeWeightRegion[type.ordinal()][region] : INVALID;
  }

  /* Configuration */

  public BinMode mode() {
    return mode;
  }

  public boolean isPixelMode() {
    return mode.isPixelMode();
  }

  /** Returns the pixel level of a pixel-mode bin, or empty for pair counting. */
  public OptionalInt level() {
    return mode instanceof BinMode.PixelProduct pixels ? OptionalInt.of(pixels.level()) : OptionalInt.empty();
  }

  public int nRegion() {
    return nRegion;
  }

  public double theta() {
    return theta;
  }

  public double thetaMin() {
    return thetaMin;
  }

  public double thetaMax() {
    return thetaMax;
  }

  public double sin2ThetaMin() {
    return sin2ThetaMin;
  }

  public double sin2ThetaMax() {
    return sin2ThetaMax;
  }

  /** Cosine of {@link #thetaMax()}, the lower bound on {@code cos(theta)} for this bin. */
  public double cosThetaMin() {
    return cosThetaMin;
  }

  /** Cosine of {@link #thetaMin()}, the upper bound on {@code cos(theta)} for this bin. */
  public double cosThetaMax() {
    return cosThetaMax;
  }

  @Override
  public String toString() {
    return "AngularBin{theta=[" + thetaMin + ", " + thetaMax + "] mode=" + mode + " nRegion=" + nRegion + '}';
  }
}
