package com.onthegomap.skycorr.correlation;

import com.onthegomap.skycorr.config.CorrelationConfig;
import com.onthegomap.skycorr.geo.Footprint;
import com.onthegomap.skycorr.geo.PixelScheme;
import com.onthegomap.skycorr.geo.WeightedPoint;
import com.onthegomap.skycorr.regions.RegionMap;
import com.onthegomap.skycorr.regions.RegionationException;
import com.onthegomap.skycorr.util.LogUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;
import java.util.random.RandomGenerator;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures the angular correlation function over a set of {@link AngularBin AngularBins}, on large scales from
 * products of pixel over-densities and on small scales by counting pairs of objects against random catalogs.
 * <p>
 * Jackknife errors come from a {@link RegionMap} built over the footprint: every pair or pixel pair is tagged with the
 * regions of its two members and fed to the bins with leave-two-out accumulation.
 */
@NotThreadSafe
public class AngularCorrelation {

  private static final Logger LOGGER = LoggerFactory.getLogger(AngularCorrelation.class);
  // avoids dropping a boundary bin when log10 of a round number is off by an ulp
  private static final double LOG_EPSILON = 1e-9;

  private final List<AngularBin> bins;
  private final PairFinder pairFinder;
  private final RegionMap regionMap = new RegionMap();
  private int regionResolution = 0;

  public AngularCorrelation(List<AngularBin> bins, PairFinder pairFinder) {
    if (bins.isEmpty()) {
      throw new IllegalArgumentException("Need at least one angular bin");
    }
    this.bins = new ArrayList<>(bins);
    this.bins.sort(AngularBin.THETA_ORDER);
    this.pairFinder = pairFinder;
  }

  public AngularCorrelation(List<AngularBin> bins) {
    this(bins, PairFinder.bruteForce());
  }

  /**
   * Returns a correlation with {@code binsPerDecade} logarithmic bins per decade covering {@code [thetaMin, thetaMax]}.
   * <p>
   * Bin edges fall on {@code 10^(k/binsPerDecade)} and each bin's nominal angle is the logarithmic midpoint
   * {@code 10^((k+0.5)/binsPerDecade)}. Each bin uses pixel products at the level from
   * {@link AngularBin#findLevel(double, double)}, or pair counting when no level resolves it.
   */
  public static AngularCorrelation logBinned(double thetaMin, double thetaMax, int binsPerDecade) {
    if (!(thetaMin > 0) || !(thetaMin < thetaMax)) {
      throw new IllegalArgumentException("Need 0 < theta_min < theta_max, got " + thetaMin + " and " + thetaMax);
    }
    if (binsPerDecade < 1) {
      throw new IllegalArgumentException("Bins per decade must be >= 1, was " + binsPerDecade);
    }
    int kMin = (int) Math.floor(Math.log10(thetaMin) * binsPerDecade + LOG_EPSILON);
    int kMax = (int) Math.ceil(Math.log10(thetaMax) * binsPerDecade - LOG_EPSILON);
    List<AngularBin> bins = new ArrayList<>(kMax - kMin);
    for (int k = kMin; k < kMax; k++) {
      AngularBin bin = AngularBin.atScaleLevel(Math.pow(10, (double) k / binsPerDecade),
        Math.pow(10, (k + 1.0) / binsPerDecade), 0);
      bin.setTheta(Math.pow(10, (k + 0.5) / binsPerDecade));
      bins.add(bin);
    }
    return new AngularCorrelation(bins);
  }

  /** Returns log-spaced bins with the scale, level, and region resolution settings from {@code config}. */
  public static AngularCorrelation from(CorrelationConfig config) {
    AngularCorrelation result = logBinned(config.thetaMin(), config.thetaMax(), config.binsPerDecade());
    if (config.useOnlyPairs()) {
      result.usingOnlyPairs();
    } else if (config.maxLevel() != CorrelationConfig.AUTO_LEVEL) {
      result.withMaxLevel(config.maxLevel());
    }
    result.regionResolution = config.regionResolution();
    return result;
  }

  /** Switches every pixel-mode bin finer than {@code level} to pair counting. */
  public AngularCorrelation withMaxLevel(int level) {
    for (int i = 0; i < bins.size(); i++) {
      AngularBin bin = bins.get(i);
      if (bin.level().orElse(Integer.MIN_VALUE) > level) {
        bins.set(i, bin.asPairBin());
      }
    }
    LOGGER.debug("Pixel products limited to level {}", level);
    return this;
  }

  /**
   * Limits pixel products to the finest level where an average pixel still holds at least one of {@code nObjects}
   * objects spread over {@code area} square degrees, or switches every bin to pair counting if even the coarsest
   * level is too sparse.
   */
  public AngularCorrelation autoMaxLevel(long nObjects, double area) {
    double areaPerObject = area / nObjects;
    for (int level = PixelScheme.MAX_LEVEL; level >= PixelScheme.HPIX_LEVEL; level--) {
      if (PixelScheme.averageArea(level) >= areaPerObject) {
        LOGGER.info("Setting maximum level to {} for {} objects over {} sq. deg.", level, nObjects, area);
        return withMaxLevel(level);
      }
    }
    LOGGER.warn("{} objects over {} sq. deg. are too sparse for pixel products", nObjects, area);
    return usingOnlyPairs();
  }

  /** Switches every bin to pair counting. */
  public AngularCorrelation usingOnlyPairs() {
    bins.replaceAll(bin -> bin.isPixelMode() ? bin.asPairBin() : bin);
    return this;
  }

  /** Sets the resolution jackknife regions are built at, 0 to choose one automatically. */
  public AngularCorrelation withRegionResolution(int resolution) {
    this.regionResolution = resolution;
    return this;
  }

  /* Measurement */

  /** Measures the auto-correlation of {@code galaxies} without jackknife regions. */
  public void findAutoCorrelation(Footprint footprint, List<WeightedPoint> galaxies, int nRandom,
    RandomGenerator random) {
    regionMap.clear();
    resizeBins(footprint, 0, null);
    findPixelCorrelation(footprint, galaxies, galaxies, null);
    findPairCorrelation(footprint, galaxies, galaxies, nRandom, null, random);
  }

  /**
   * Measures the auto-correlation of {@code galaxies} with jackknife errors from {@code nRegion} regions of
   * {@code footprint}.
   *
   * @param nRegion regions to request, or 0 for twice the number of bins
   * @return the number of regions actually used
   * @throws RegionationException if the footprint cannot be divided into regions
   */
  public int findAutoCorrelationWithRegions(Footprint footprint, List<WeightedPoint> galaxies, int nRandom,
    int nRegion, RandomGenerator random) throws RegionationException {
    int actual = initializeRegions(footprint, nRegion);
    findPixelCorrelation(footprint, galaxies, galaxies, regionMap);
    findPairCorrelation(footprint, galaxies, galaxies, nRandom, regionMap, random);
    return actual;
  }

  /**
   * Measures the cross-correlation between {@code galaxiesA} and {@code galaxiesB} with jackknife errors from
   * {@code nRegion} regions of {@code footprint}.
   *
   * @return the number of regions actually used
   * @throws RegionationException if the footprint cannot be divided into regions
   */
  public int findCrossCorrelationWithRegions(Footprint footprint, List<WeightedPoint> galaxiesA,
    List<WeightedPoint> galaxiesB, int nRandom, int nRegion, RandomGenerator random) throws RegionationException {
    int actual = initializeRegions(footprint, nRegion);
    findPixelCorrelation(footprint, galaxiesA, galaxiesB, regionMap);
    findPairCorrelation(footprint, galaxiesA, galaxiesB, nRandom, regionMap, random);
    return actual;
  }

  private int initializeRegions(Footprint footprint, int nRegion) throws RegionationException {
    LogUtil.setStage("regions");
    try {
      int requested = nRegion == 0 ? 2 * bins.size() : nRegion;
      int actual = regionMap.initialize(requested, regionResolution, footprint);
      LOGGER.info("Using {} jackknife regions at resolution {}", actual, regionMap.resolution());
      resizeBins(footprint, actual, regionMap);
      return actual;
    } finally {
      LogUtil.clearStage();
    }
  }

  /**
   * Replaces every bin with an empty one sized for {@code nRegion} regions, switching pixel-mode bins to pair counting
   * when the footprint is not described finely enough for their level or their pixels are too coarse to fall inside
   * a single region.
   */
  private void resizeBins(Footprint footprint, int nRegion, RegionMap regions) {
    for (int i = 0; i < bins.size(); i++) {
      AngularBin bin = bins.get(i);
      BinMode mode = bin.mode();
      if (mode instanceof BinMode.PixelProduct pixels) {
        if (pixels.resolution() > footprint.maxResolution()) {
          LOGGER.warn("Footprint resolution {} is too coarse for {}, counting pairs instead",
            footprint.maxResolution(), bin);
          mode = BinMode.pairs();
        } else if (regions != null && pixels.resolution() < regions.resolution()) {
          LOGGER.warn("Pixels of {} are coarser than the region resolution {}, counting pairs instead", bin,
            regions.resolution());
          mode = BinMode.pairs();
        }
      }
      bins.set(i, bin.withModeAndRegions(mode, nRegion));
    }
  }

  private void findPixelCorrelation(Footprint footprint, List<WeightedPoint> galaxiesA,
    List<WeightedPoint> galaxiesB, RegionMap regions) {
    TreeMap<Integer, List<AngularBin>> byLevel = new TreeMap<>(Collections.reverseOrder());
    for (AngularBin bin : bins) {
      bin.level().ifPresent(level -> byLevel.computeIfAbsent(level, l -> new ArrayList<>()).add(bin));
    }
    if (byLevel.isEmpty()) {
      return;
    }
    boolean auto = galaxiesA == galaxiesB;
    LogUtil.setStage("pixels");
    try {
      int finest = byLevel.firstKey();
      FieldUnion fieldA = densityField(footprint, finest, galaxiesA);
      FieldUnion fieldB = auto ? fieldA : densityField(footprint, finest, galaxiesB);
      for (var entry : byLevel.entrySet()) {
        int level = entry.getKey();
        if (fieldA.level() != level) {
          fieldA = resampled(fieldA, level);
          fieldB = auto ? fieldA : resampled(fieldB, level);
        }
        for (AngularBin bin : entry.getValue()) {
          if (regions == null) {
            fieldA.crossCorrelate(fieldB, bin);
          } else {
            fieldA.crossCorrelateWithRegions(fieldB, regions, bin);
          }
          LOGGER.debug("Finished {}: w={}", bin, bin.wtheta());
        }
      }
    } finally {
      LogUtil.clearStage();
    }
  }

  private static FieldUnion densityField(Footprint footprint, int level, List<WeightedPoint> galaxies) {
    FieldUnion field = FieldUnion.fromFootprint(footprint, level, FieldType.DENSITY_FIELD);
    int missed = 0;
    for (WeightedPoint galaxy : galaxies) {
      if (!field.addPoint(galaxy.lonLat(), galaxy.weight())) {
        missed++;
      }
    }
    if (missed > 0) {
      LOGGER.debug("{} of {} objects fell outside the level {} field", missed, galaxies.size(), level);
    }
    return field;
  }

  private static FieldUnion resampled(FieldUnion field, int level) {
    field.convertFromOverDensity();
    return FieldUnion.resample(field, level);
  }

  private void findPairCorrelation(Footprint footprint, List<WeightedPoint> galaxiesA, List<WeightedPoint> galaxiesB,
    int nRandom, RegionMap regions, RandomGenerator random) {
    List<AngularBin> pairBins = bins.stream().filter(bin -> !bin.isPixelMode()).toList();
    if (pairBins.isEmpty()) {
      return;
    }
    if (nRandom < 1) {
      throw new IllegalArgumentException("Number of random catalogs must be >= 1, was " + nRandom);
    }
    boolean auto = galaxiesA == galaxiesB;
    IndexedCatalog dataA = IndexedCatalog.of(galaxiesA, regions);
    IndexedCatalog dataB = auto ? dataA : IndexedCatalog.of(galaxiesB, regions);
    try {
      LogUtil.setStage("pairs", PairType.GAL_GAL.id());
      for (AngularBin bin : pairBins) {
        pairFinder.findPairs(dataA, dataB, bin);
        bin.moveWeight(PairType.GAL_GAL);
      }
      for (int r = 0; r < nRandom; r++) {
        IndexedCatalog randomA = IndexedCatalog.of(randomCatalog(footprint, galaxiesA, random), regions);
        IndexedCatalog randomB = auto ? randomA :
          IndexedCatalog.of(randomCatalog(footprint, galaxiesB, random), regions);
        LOGGER.debug("Random catalog {} of {}", r + 1, nRandom);
        for (AngularBin bin : pairBins) {
          LogUtil.setStage("pairs", PairType.GAL_RAND.id());
          pairFinder.findPairs(dataA, randomB, bin);
          bin.moveWeight(PairType.GAL_RAND);
          LogUtil.setStage("pairs", PairType.RAND_GAL.id());
          pairFinder.findPairs(randomA, dataB, bin);
          bin.moveWeight(PairType.RAND_GAL);
          LogUtil.setStage("pairs", PairType.RAND_RAND.id());
          pairFinder.findPairs(randomA, randomB, bin);
          bin.moveWeight(PairType.RAND_RAND);
        }
      }
      for (AngularBin bin : pairBins) {
        bin.rescalePairCounts(PairType.GAL_RAND, nRandom);
        bin.rescalePairCounts(PairType.RAND_GAL, nRandom);
        bin.rescalePairCounts(PairType.RAND_RAND, nRandom);
        LOGGER.debug("Finished {}: w={}", bin, bin.wtheta());
      }
    } finally {
      LogUtil.clearStage();
    }
  }

  /** Returns points spread uniformly over {@code footprint} carrying the weights of {@code galaxies}. */
  private static List<WeightedPoint> randomCatalog(Footprint footprint, List<WeightedPoint> galaxies,
    RandomGenerator random) {
    List<WeightedPoint> positions = footprint.randomPoints(galaxies.size(), random);
    List<WeightedPoint> result = new ArrayList<>(positions.size());
    for (int i = 0; i < positions.size(); i++) {
      result.add(new WeightedPoint(positions.get(i).lonLat(), galaxies.get(i).weight()));
    }
    return result;
  }

  /* Results */

  /**
   * Returns the jackknife covariance between bins:
   * {@code C_ij = (n-1)/n * sum_k (w_i(k) - mean_i) * (w_j(k) - mean_j)} over the {@code n} regions.
   *
   * @throws IllegalStateException if the bins were not measured with jackknife regions
   */
  public double[][] covariance() {
    int nRegion = nRegion();
    if (nRegion == 0) {
      throw new IllegalStateException("Covariance needs a measurement with jackknife regions");
    }
    int n = bins.size();
    double[] means = new double[n];
    for (int i = 0; i < n; i++) {
      means[i] = bins.get(i).meanWtheta();
    }
    double[][] result = new double[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = i; j < n; j++) {
        double sum = 0;
        for (int k = 0; k < nRegion; k++) {
          sum += (bins.get(i).wtheta(k) - means[i]) * (bins.get(j).wtheta(k) - means[j]);
        }
        result[i][j] = result[j][i] = (nRegion - 1.0) / nRegion * sum;
      }
    }
    return result;
  }

  public List<AngularBin> bins() {
    return Collections.unmodifiableList(bins);
  }

  public int size() {
    return bins.size();
  }

  public double thetaMin() {
    return bins.get(0).thetaMin();
  }

  public double thetaMax() {
    return bins.get(bins.size() - 1).thetaMax();
  }

  /** Number of jackknife regions the bins are sized for. */
  public int nRegion() {
    return bins.get(0).nRegion();
  }

  public RegionMap regionMap() {
    return regionMap;
  }

  /** Finest pixel level in use, or -1 if every bin counts pairs. */
  public int maxLevel() {
    return bins.stream().mapToInt(bin -> bin.level().orElse(-1)).max().orElse(-1);
  }

  /** Coarsest pixel level in use, or -1 if every bin counts pairs. */
  public int minLevel() {
    return bins.stream().filter(AngularBin::isPixelMode).mapToInt(bin -> bin.level().getAsInt()).min().orElse(-1);
  }
}
