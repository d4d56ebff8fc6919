package com.onthegomap.skycorr.correlation;

import com.onthegomap.skycorr.geo.SkyUtils;

/**
 * Finds pairs of points separated by an angle inside a bin and feeds each one into the bin's running pair weight.
 * <p>
 * Implementations call {@link AngularBin#addToPairWtheta(double, long, int, int)} once per ordered pair with the
 * product of the two weights and the region of each point. When {@code first} and {@code second} are the same catalog
 * a point is never paired with itself.
 */
@FunctionalInterface
public interface PairFinder {

  /** Returns a pair finder that tests every pair of points. */
  static PairFinder bruteForce() {
    return PairFinder::findAllPairs;
  }

  void findPairs(IndexedCatalog first, IndexedCatalog second, AngularBin bin);

  private static void findAllPairs(IndexedCatalog first, IndexedCatalog second, AngularBin bin) {
    boolean same = first == second;
    for (int i = 0; i < first.size(); i++) {
      double[] a = first.vector(i);
      double weightA = first.weight(i);
      int regionA = first.region(i);
      for (int j = 0; j < second.size(); j++) {
        if (same && i == j) {
          continue;
        }
        if (bin.isWithinCosBounds(SkyUtils.cosAngle(a, second.vector(j)))) {
          bin.addToPairWtheta(weightA * second.weight(j), 1, regionA, second.region(j));
        }
      }
    }
  }
}
