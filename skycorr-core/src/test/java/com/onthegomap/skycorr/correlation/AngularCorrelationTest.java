package com.onthegomap.skycorr.correlation;

import static com.onthegomap.skycorr.TestUtils.assertClose;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.skycorr.TestUtils;
import com.onthegomap.skycorr.config.Arguments;
import com.onthegomap.skycorr.config.CorrelationConfig;
import com.onthegomap.skycorr.geo.BoundsFootprint;
import com.onthegomap.skycorr.geo.WeightedPoint;
import com.onthegomap.skycorr.regions.RegionationException;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.Envelope;

class AngularCorrelationTest {

  private static final BoundsFootprint FOOTPRINT = new BoundsFootprint(new Envelope(10, 30, -10, 10), 64);
  private static final List<WeightedPoint> GALAXIES = TestUtils.uniformPoints(300, 10, 30, -10, 10, 1);

  @Test
  void testLogBinned() {
    AngularCorrelation correlation = AngularCorrelation.logBinned(0.001, 10, 5);
    assertEquals(20, correlation.size());
    assertClose(0.001, correlation.thetaMin());
    assertClose(10, correlation.thetaMax());
    List<AngularBin> bins = correlation.bins();
    for (int i = 1; i < bins.size(); i++) {
      assertClose(bins.get(i - 1).thetaMax(), bins.get(i).thetaMin());
    }
    AngularBin first = bins.get(0);
    assertClose(Math.sqrt(first.thetaMin() * first.thetaMax()), first.theta());
    assertEquals(0, correlation.nRegion());
    assertThrows(UnsupportedOperationException.class, () -> bins.remove(0));
  }

  @ParameterizedTest
  @CsvSource({
    "0.002, 0.5, 5, 13",
    "1, 10, 1, 1",
    "0.5, 5, 2, 3",
  })
  void testLogBinnedCoversRange(double min, double max, int binsPerDecade, int expectedBins) {
    AngularCorrelation correlation = AngularCorrelation.logBinned(min, max, binsPerDecade);
    assertEquals(expectedBins, correlation.size());
    assertTrue(correlation.thetaMin() <= min * (1 + 1e-9));
    assertTrue(correlation.thetaMax() >= max * (1 - 1e-9));
  }

  @Test
  void testInvalidBinning() {
    assertThrows(IllegalArgumentException.class, () -> AngularCorrelation.logBinned(1, 0.1, 5));
    assertThrows(IllegalArgumentException.class, () -> AngularCorrelation.logBinned(0, 1, 5));
    assertThrows(IllegalArgumentException.class, () -> AngularCorrelation.logBinned(0.1, 1, 0));
    assertThrows(IllegalArgumentException.class, () -> new AngularCorrelation(List.of()));
  }

  @Test
  void testBinsSortedByTheta() {
    AngularCorrelation correlation = new AngularCorrelation(List.of(
      AngularBin.pairs(1, 2),
      AngularBin.pairs(0.1, 0.2)
    ));
    assertEquals(0.1, correlation.thetaMin());
    assertEquals(2, correlation.thetaMax());
  }

  @Test
  void testLevels() {
    AngularCorrelation correlation = AngularCorrelation.logBinned(0.001, 10, 5);
    int finest = correlation.maxLevel();
    assertTrue(finest > 5);
    assertEquals(2, correlation.minLevel());

    correlation.withMaxLevel(5);
    assertEquals(5, correlation.maxLevel());
    assertEquals(20, correlation.size());
    assertFalse(correlation.bins().get(0).isPixelMode());

    correlation.usingOnlyPairs();
    assertEquals(-1, correlation.maxLevel());
    assertEquals(-1, correlation.minLevel());
  }

  @Test
  void testAutoMaxLevel() {
    // 0.1 sq. deg. per object: level 4 pixels hold 0.34 sq. deg., level 5 only 0.086
    AngularCorrelation correlation = AngularCorrelation.logBinned(0.001, 10, 5).autoMaxLevel(1000, 100);
    assertEquals(4, correlation.maxLevel());

    AngularCorrelation sparse = AngularCorrelation.logBinned(0.001, 10, 5).autoMaxLevel(1, 1e6);
    assertEquals(-1, sparse.maxLevel());
  }

  @Test
  void testFromConfig() {
    AngularCorrelation pairsOnly = AngularCorrelation.from(CorrelationConfig.from(Arguments.of(
      "theta_min", "0.01",
      "theta_max", "1",
      "bins_per_decade", "4",
      "use_only_pairs", "true"
    )));
    assertEquals(8, pairsOnly.size());
    assertEquals(-1, pairsOnly.maxLevel());

    AngularCorrelation limited = AngularCorrelation.from(CorrelationConfig.from(Arguments.of(
      "theta_min", "0.01",
      "theta_max", "1",
      "max_level", "6"
    )));
    assertEquals(6, limited.maxLevel());
  }

  @Test
  void testPairCountingWithRegions() throws RegionationException {
    AngularCorrelation correlation = AngularCorrelation.logBinned(0.5, 5, 2).usingOnlyPairs();
    int nRegion = correlation.findAutoCorrelationWithRegions(FOOTPRINT, GALAXIES, 1, 4, new Random(2));
    assertEquals(4, nRegion);
    assertEquals(4, correlation.nRegion());
    assertTrue(correlation.regionMap().isInitialized());

    for (AngularBin bin : correlation.bins()) {
      assertFalse(bin.isPixelMode());
      assertEquals(4, bin.nRegion());
      assertTrue(bin.pairWeight(PairType.GAL_GAL) > 0, bin.toString());
      assertTrue(bin.pairWeight(PairType.RAND_RAND) > 0, bin.toString());
      assertClose(bin.pairWeight(PairType.GAL_RAND), bin.pairWeight(PairType.RAND_GAL));
      assertTrue(Math.abs(bin.wtheta()) < 0.5, bin.toString());
      for (int region = 0; region < 4; region++) {
        assertTrue(Double.isFinite(bin.wtheta(region)), bin.toString());
        assertTrue(bin.pairWeight(PairType.GAL_GAL, region) < bin.pairWeight(PairType.GAL_GAL));
      }
      assertTrue(bin.meanWthetaError() > 0);
    }

    double[][] covariance = correlation.covariance();
    assertEquals(3, covariance.length);
    for (int i = 0; i < 3; i++) {
      AngularBin bin = correlation.bins().get(i);
      double error = bin.meanWthetaError();
      assertClose(error * error, covariance[i][i] * 3 / 4);
      for (int j = 0; j < 3; j++) {
        assertEquals(covariance[i][j], covariance[j][i]);
      }
    }
  }

  @Test
  void testRandomCatalogsAreRescaled() {
    AngularCorrelation one = AngularCorrelation.logBinned(1, 10, 1).usingOnlyPairs();
    one.findAutoCorrelation(FOOTPRINT, GALAXIES, 1, new Random(3));
    AngularCorrelation three = AngularCorrelation.logBinned(1, 10, 1).usingOnlyPairs();
    three.findAutoCorrelation(FOOTPRINT, GALAXIES, 3, new Random(3));

    AngularBin a = one.bins().get(0);
    AngularBin b = three.bins().get(0);
    assertEquals(a.pairWeight(PairType.GAL_GAL), b.pairWeight(PairType.GAL_GAL));
    // both are averages over realizations of the same size, so they agree to within sampling noise
    assertEquals(1, b.pairWeight(PairType.RAND_RAND) / a.pairWeight(PairType.RAND_RAND), 0.2);
  }

  @Test
  void testPixelProductsWithoutRegions() {
    AngularCorrelation correlation = AngularCorrelation.logBinned(1, 10, 2);
    assertEquals(3, correlation.maxLevel());
    assertEquals(2, correlation.minLevel());
    correlation.findAutoCorrelation(FOOTPRINT, GALAXIES, 1, new Random(4));

    for (AngularBin bin : correlation.bins()) {
      assertTrue(bin.isPixelMode());
      assertTrue(bin.pixelWeight() > 0, bin.toString());
      assertTrue(Double.isFinite(bin.wtheta()), bin.toString());
      assertEquals(0, bin.pairCounts());
    }
    assertThrows(IllegalStateException.class, correlation::covariance);
  }

  @Test
  void testCoarsePixelsFallBackToPairsWithRegions() throws RegionationException {
    AngularCorrelation correlation = AngularCorrelation.logBinned(1, 10, 2);
    assertEquals(4, correlation.findAutoCorrelationWithRegions(FOOTPRINT, GALAXIES, 1, 4, new Random(5)));
    // regions are built at resolution 8 here, so level 2 pixels straddle regions
    assertEquals(8, correlation.regionMap().resolution());
    AngularBin fine = correlation.bins().get(0);
    AngularBin coarse = correlation.bins().get(1);
    assertTrue(fine.isPixelMode());
    assertTrue(fine.pixelWeight() > 0);
    assertTrue(fine.pixelWeight(0) < fine.pixelWeight());
    assertFalse(coarse.isPixelMode());
    assertTrue(coarse.pairWeight(PairType.GAL_GAL) > 0);
  }

  @Test
  void testCoarseFootprintFallsBackToPairs() {
    BoundsFootprint coarseFootprint = new BoundsFootprint(new Envelope(10, 30, -10, 10), 4);
    AngularCorrelation correlation = AngularCorrelation.logBinned(1, 10, 2);
    correlation.findAutoCorrelation(coarseFootprint, GALAXIES, 1, new Random(6));
    assertFalse(correlation.bins().get(0).isPixelMode());
    assertTrue(correlation.bins().get(1).isPixelMode());
  }

  @Test
  void testCrossCorrelation() throws RegionationException {
    List<WeightedPoint> others = TestUtils.uniformPoints(200, 10, 30, -10, 10, 7);
    AngularCorrelation correlation = AngularCorrelation.logBinned(1, 10, 2);
    int nRegion = correlation.findCrossCorrelationWithRegions(FOOTPRINT, GALAXIES, others, 1, 4, new Random(8));
    assertEquals(4, nRegion);
    for (AngularBin bin : correlation.bins()) {
      assertTrue(Double.isFinite(bin.wtheta()), bin.toString());
    }
    AngularBin pairs = correlation.bins().get(1);
    assertTrue(pairs.pairWeight(PairType.GAL_RAND) > 0);
    assertTrue(pairs.pairWeight(PairType.RAND_GAL) > 0);
  }

  @Test
  void testRegionResolutionCeiling() {
    AngularCorrelation correlation = AngularCorrelation.logBinned(0.5, 5, 2).usingOnlyPairs()
      .withRegionResolution(4096);
    BoundsFootprint fine = new BoundsFootprint(new Envelope(10, 11, 0, 1), 4096);
    RegionationException e = assertThrows(RegionationException.class,
      () -> correlation.findAutoCorrelationWithRegions(fine, GALAXIES, 1, 4, new Random(9)));
    assertEquals("region_resolution_ceiling", e.stat());
  }

  @Test
  void testDefaultRegionCountIsTwiceTheBins() throws RegionationException {
    AngularCorrelation correlation = AngularCorrelation.logBinned(0.5, 5, 2).usingOnlyPairs();
    assertEquals(6, correlation.findAutoCorrelationWithRegions(FOOTPRINT, GALAXIES, 1, 0, new Random(10)));
  }
}
