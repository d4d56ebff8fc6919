package com.onthegomap.skycorr.correlation;

import static com.onthegomap.skycorr.TestUtils.assertClose;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.skycorr.geo.PixelScheme;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AngularBinTest {

  @Test
  void testLeaveTwoOutPixelIncrement() {
    AngularBin bin = AngularBin.pixels(0.1, 0.2, 8, 10);
    bin.addToPixelWtheta(1.0, 2.0, 2, 5);

    assertEquals(1.0, bin.pixelWtheta());
    assertEquals(2.0, bin.pixelWeight());
    for (int region = 0; region < 10; region++) {
      boolean leftOut = region == 2 || region == 5;
      assertEquals(leftOut ? 0.0 : 1.0, bin.pixelWtheta(region), "region " + region);
      assertEquals(leftOut ? 0.0 : 2.0, bin.pixelWeight(region), "region " + region);
    }
  }

  @Test
  void testSameRegionLeavesOnlyThatRegionOut() {
    AngularBin bin = AngularBin.pairs(0.1, 0.2, 4);
    bin.addToPairWtheta(0.5, 1, 3, 3);

    assertEquals(0.5, bin.pairWeight());
    assertEquals(1, bin.pairCounts());
    assertEquals(0.0, bin.pairWeight(3));
    assertEquals(0, bin.pairCounts(3));
    for (int region = 0; region < 3; region++) {
      assertEquals(0.5, bin.pairWeight(region));
      assertEquals(1, bin.pairCounts(region));
    }
  }

  @ParameterizedTest
  @CsvSource({
    "-1, 3",
    "3, -1",
    "-1, -1",
  })
  void testNoRegionIsGlobalOnly(int regionA, int regionB) {
    AngularBin bin = AngularBin.pixels(0.1, 0.2, 8, 5);
    bin.addToPixelWtheta(1.0, 2.0, regionA, regionB);
    bin.addToWeight(3.0, regionA, regionB);
    bin.addToCounter(4, regionA, regionB);
    bin.addToPairWtheta(5.0, 6, regionA, regionB);

    assertEquals(1.0, bin.pixelWtheta());
    assertEquals(2.0, bin.pixelWeight());
    assertEquals(8.0, bin.pairWeight());
    assertEquals(10, bin.pairCounts());
    for (int region = 0; region < 5; region++) {
      assertEquals(0.0, bin.pixelWtheta(region));
      assertEquals(0.0, bin.pixelWeight(region));
      assertEquals(0.0, bin.pairWeight(region));
      assertEquals(0, bin.pairCounts(region));
    }
  }

  @Test
  void testLandySzalay() {
    AngularBin bin = AngularBin.pairs(0.01, 0.02);
    bin.addToPairWtheta(100, 100);
    bin.moveWeight(PairType.GAL_GAL);
    bin.addToPairWtheta(40, 40);
    bin.moveWeight(PairType.GAL_RAND);
    bin.addToPairWtheta(40, 40);
    bin.moveWeight(PairType.RAND_GAL);
    bin.addToPairWtheta(50, 50);
    bin.moveWeight(PairType.RAND_RAND);

    assertEquals(0.0, bin.pairWeight());
    assertEquals(100, bin.pairWeight(PairType.GAL_GAL));
    assertEquals(40, bin.pairWeight(PairType.GAL_RAND));
    assertEquals(40, bin.pairWeight(PairType.RAND_GAL));
    assertEquals(50, bin.pairWeight(PairType.RAND_RAND));
    assertClose(1.4, bin.wtheta());
    assertClose(0.1, bin.wthetaError());
  }

  @Test
  void testMoveWeightAddsAcrossRealizationsAndRescale() {
    AngularBin bin = AngularBin.pairs(0.01, 0.02, 3);
    for (int i = 0; i < 2; i++) {
      bin.addToPairWtheta(30, 30, 0, 1);
      bin.moveWeight(PairType.RAND_RAND);
    }
    assertEquals(60, bin.pairWeight(PairType.RAND_RAND));
    assertEquals(60, bin.pairWeight(PairType.RAND_RAND, 2));
    assertEquals(0, bin.pairWeight(PairType.RAND_RAND, 0));

    bin.rescalePairCounts(PairType.RAND_RAND, 2);
    assertEquals(30, bin.pairWeight(PairType.RAND_RAND));
    assertEquals(30, bin.pairWeight(PairType.RAND_RAND, 2));
  }

  @Test
  void testPerRegionLandySzalay() {
    AngularBin bin = AngularBin.pairs(0.01, 0.02, 3);
    bin.addToPairWtheta(100, 100, 0, 0);
    bin.moveWeight(PairType.GAL_GAL);
    bin.addToPairWtheta(40, 40, 0, 0);
    bin.moveWeight(PairType.GAL_RAND);
    bin.addToPairWtheta(40, 40, 0, 0);
    bin.moveWeight(PairType.RAND_GAL);
    bin.addToPairWtheta(50, 50, 0, 0);
    bin.moveWeight(PairType.RAND_RAND);

    assertClose(1.4, bin.wtheta(1));
    assertClose(1.4, bin.wtheta(2));
    assertTrue(Double.isNaN(bin.wtheta(0)));
  }

  @Test
  void testPixelEstimator() {
    AngularBin bin = AngularBin.pixels(0.1, 0.2, 8, 0);
    bin.addToPixelWtheta(1.5, 4);
    bin.addToPixelWtheta(0.5, 4);
    assertClose(0.25, bin.wtheta());
    assertClose(1 / Math.sqrt(8), bin.wthetaError());
  }

  @Test
  void testJackknifeMeanAndError() {
    AngularBin bin = AngularBin.pairs(0.1, 0.2, 5);
    for (int region = 0; region < 5; region++) {
      bin.setWtheta(region, region + 1);
    }
    assertClose(3, bin.meanWtheta());
    assertClose(0.8 * Math.sqrt(10), bin.meanWthetaError());
  }

  @Test
  void testJackknifeFromPixelCounters() {
    AngularBin bin = AngularBin.pixels(0.1, 0.2, 8, 5);
    // each increment leaves out regions k and k, so region k misses exactly one unit of weight
    for (int region = 0; region < 5; region++) {
      bin.addToPixelWtheta(region + 1, 1, region, region);
    }
    // region k sees 15 - (k+1) over weight 4
    double[] expected = {14 / 4d, 13 / 4d, 12 / 4d, 11 / 4d, 10 / 4d};
    double mean = 0;
    for (int region = 0; region < 5; region++) {
      assertClose(expected[region], bin.wtheta(region));
      mean += expected[region] / 5;
    }
    assertClose(mean, bin.meanWtheta());
    double sum = 0;
    for (double value : expected) {
      sum += (mean - value) * (mean - value);
    }
    assertClose(0.8 * Math.sqrt(sum), bin.meanWthetaError());
    assertClose(3, bin.wtheta());
  }

  @Test
  void testNoRegionsGivesZeroJackknifeError() {
    AngularBin bin = AngularBin.pairs(0.1, 0.2);
    assertEquals(0, bin.meanWtheta());
    assertEquals(0, bin.meanWthetaError());
  }

  @Test
  void testInvalidRegionReturnsSentinel() {
    AngularBin bin = AngularBin.pixels(0.1, 0.2, 8, 3);
    bin.addToPixelWtheta(1, 1, 0, 1);
    assertEquals(AngularBin.INVALID, bin.wtheta(3));
    assertEquals(AngularBin.INVALID, bin.wthetaError(3));
    assertEquals(AngularBin.INVALID, bin.pixelWtheta(-2));
    assertEquals(AngularBin.INVALID, bin.pixelWeight(10));
    assertEquals(AngularBin.INVALID, bin.pairWeight(3));
    assertEquals(AngularBin.INVALID, bin.pairWeight(PairType.GAL_GAL, 3));
    assertEquals(AngularBin.INVALID, bin.weightedCrossCorrelation(3));
    assertEquals(-1, bin.pairCounts(3));
    assertEquals(bin.wtheta(), bin.wtheta(AngularBin.GLOBAL));
  }

  @Test
  void testOverrides() {
    AngularBin bin = AngularBin.pairs(0.1, 0.2, 2);
    bin.setWtheta(0.3);
    bin.setWthetaError(0.05);
    bin.setWthetaError(1, 0.07);
    assertEquals(0.3, bin.wtheta());
    assertEquals(0.05, bin.wthetaError());
    assertEquals(0.07, bin.wthetaError(1));

    bin.reset();
    bin.addToPixelWtheta(1, 1);
    assertTrue(Double.isNaN(bin.wtheta()));
  }

  @Test
  void testResets() {
    AngularBin bin = AngularBin.pairs(0.1, 0.2, 2);
    bin.addToPairWtheta(2, 1, 0, 0);
    bin.addToPixelWtheta(2, 1, 0, 0);
    bin.moveWeight(PairType.GAL_GAL);
    bin.addToPairWtheta(2, 1, 0, 0);

    bin.resetWeight();
    assertEquals(0, bin.pairWeight());
    assertEquals(0, bin.pairWeight(1));
    assertEquals(2, bin.pairCounts());
    bin.resetCounter();
    assertEquals(0, bin.pairCounts(1));
    bin.resetPixelWtheta();
    assertEquals(0, bin.pixelWtheta(1));
    bin.resetPairCounts(PairType.GAL_GAL);
    assertEquals(0, bin.pairWeight(PairType.GAL_GAL, 1));
  }

  @Test
  void testWeightedCrossCorrelation() {
    AngularBin bin = AngularBin.pairs(0.1, 0.2, 3);
    bin.addToWeight(3.0, 0, 1);
    bin.addToCounter(2, 0, 1);
    assertEquals(1.5, bin.weightedCrossCorrelation());
    assertEquals(1.5, bin.weightedCrossCorrelation(2));
    assertEquals(1.0, bin.meanWeight());
    assertEquals(2 / 3d, bin.meanCounter(), 1e-12);
  }

  @Test
  void testMerge() {
    AngularBin a = AngularBin.pixels(0.1, 0.2, 8, 4);
    AngularBin b = AngularBin.pixels(0.1, 0.2, 8, 4);
    a.addToPixelWtheta(1, 2, 0, 1);
    b.addToPixelWtheta(3, 2, 2, 3);
    a.merge(b);
    assertEquals(4, a.pixelWtheta());
    assertEquals(1, a.wtheta());
    assertEquals(3, a.pixelWtheta(0));
    assertEquals(1, a.pixelWtheta(2));

    assertThrows(IllegalArgumentException.class, () -> a.merge(AngularBin.pixels(0.1, 0.2, 8, 3)));
    assertThrows(IllegalArgumentException.class, () -> a.merge(AngularBin.pairs(0.1, 0.2, 4)));
    assertThrows(IllegalArgumentException.class, () -> a.merge(AngularBin.pixels(0.1, 0.3, 8, 4)));
  }

  @Test
  void testBounds() {
    AngularBin bin = AngularBin.pairs(1, 2);
    assertTrue(bin.isWithinBounds(1));
    assertTrue(bin.isWithinBounds(1.5));
    assertFalse(bin.isWithinBounds(2));
    assertFalse(bin.isWithinBounds(2.1));
    assertFalse(bin.isWithinBounds(0.9));
    assertTrue(bin.isWithinCosBounds(Math.cos(Math.toRadians(1.5))));
    assertFalse(bin.isWithinCosBounds(Math.cos(Math.toRadians(0.5))));
    assertFalse(bin.isWithinCosBounds(Math.cos(Math.toRadians(2.5))));
    double sin = Math.sin(Math.toRadians(1.5));
    assertTrue(bin.isWithinSin2Bounds(sin * sin));
    assertTrue(bin.cosThetaMin() < bin.cosThetaMax());
    assertEquals(1.5, bin.theta());
  }

  @Test
  void testSharedEdgeBelongsToOneBin() {
    AngularBin inner = AngularBin.pairs(1, 2);
    AngularBin outer = AngularBin.pairs(2, 4);
    double cosEdge = Math.cos(Math.toRadians(2));
    assertFalse(inner.isWithinCosBounds(cosEdge));
    assertTrue(outer.isWithinCosBounds(cosEdge));
    double sinEdge = Math.sin(Math.toRadians(2));
    assertFalse(inner.isWithinSin2Bounds(sinEdge * sinEdge));
    assertTrue(outer.isWithinSin2Bounds(sinEdge * sinEdge));
    assertFalse(inner.isWithinBounds(2));
    assertTrue(outer.isWithinBounds(2));
  }

  @Test
  void testAreaOfAnnulus() {
    AngularBin bin = AngularBin.pairs(0, 90);
    assertClose(PixelScheme.SPHERE_AREA_DEG2 / 2, bin.area());
  }

  @Test
  void testInvalidConstruction() {
    assertThrows(IllegalArgumentException.class, () -> AngularBin.pairs(2, 1));
    assertThrows(IllegalArgumentException.class, () -> AngularBin.pairs(1, 1));
    assertThrows(IllegalArgumentException.class, () -> AngularBin.pairs(-1, 1));
    assertThrows(IllegalArgumentException.class, () -> AngularBin.pairs(1, 2, -1));
    assertThrows(IllegalArgumentException.class, () -> AngularBin.pixels(1, 2, 1, 0));
  }

  @Test
  void testFindLevel() {
    // coarse scales resolve at the coarsest level
    assertEquals(OptionalInt.of(PixelScheme.HPIX_LEVEL), AngularBin.findLevel(5, 10));
    OptionalInt level = AngularBin.findLevel(0.1, 0.2);
    assertTrue(level.isPresent());
    double scale = Math.sqrt(2 * PixelScheme.averageArea(level.getAsInt()));
    assertTrue(scale <= 0.2);
    double coarserScale = Math.sqrt(2 * PixelScheme.averageArea(level.getAsInt() - 1));
    assertTrue(coarserScale > 0.2);
    // below the finest pixel scale
    assertEquals(OptionalInt.empty(), AngularBin.findLevel(1e-5, 2e-5));
  }

  @Test
  void testAtScaleLevelAndModeChanges() {
    AngularBin pixel = AngularBin.atScaleLevel(0.1, 0.2, 0);
    assertTrue(pixel.isPixelMode());
    assertEquals(AngularBin.findLevel(0.1, 0.2), pixel.level());
    pixel.setTheta(0.15);

    AngularBin pairs = pixel.asPairBin();
    assertFalse(pairs.isPixelMode());
    assertEquals(OptionalInt.empty(), pairs.level());
    assertEquals(0.15, pairs.theta());

    AngularBin resized = pixel.withRegions(7);
    assertEquals(7, resized.nRegion());
    assertEquals(pixel.mode(), resized.mode());
    assertFalse(AngularBin.atScaleLevel(1e-5, 2e-5, 0).isPixelMode());
  }

  @Test
  void testReverseLevelOrder() {
    List<AngularBin> bins = new ArrayList<>(List.of(
      AngularBin.pairs(0.001, 0.002),
      AngularBin.pixels(1, 2, 4, 0),
      AngularBin.pixels(0.1, 0.2, 9, 0)
    ));
    bins.sort(AngularBin.REVERSE_LEVEL_ORDER);
    assertEquals(OptionalInt.of(9), bins.get(0).level());
    assertEquals(OptionalInt.of(4), bins.get(1).level());
    assertFalse(bins.get(2).isPixelMode());
  }

  @Test
  void testPoissonNoise() {
    AngularBin bin = AngularBin.pairs(0.1, 0.2);
    assertClose(1 / Math.sqrt(100 * 10 * bin.area()), bin.poissonNoise(10, 10));
  }
}
