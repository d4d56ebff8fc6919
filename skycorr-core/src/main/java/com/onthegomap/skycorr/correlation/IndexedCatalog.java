package com.onthegomap.skycorr.correlation;

import com.onthegomap.skycorr.geo.SkyUtils;
import com.onthegomap.skycorr.geo.WeightedPoint;
import com.onthegomap.skycorr.regions.RegionMap;
import java.util.List;

/**
 * A catalog of weighted points prepared for pair finding: unit vectors, weights, and the region of each point looked up
 * once instead of for every bin.
 * <p>
 * Nothing changes a catalog after it is built, but {@link #vector(int)} hands out the backing array to keep the pair
 * loop free of copies, so callers must treat it as read-only.
 */
public class IndexedCatalog {

  private final double[][] vectors;
  private final double[] weights;
  private final int[] regions;

  private IndexedCatalog(double[][] vectors, double[] weights, int[] regions) {
    this.vectors = vectors;
    this.weights = weights;
    this.regions = regions;
  }

  /** Returns a catalog where every point is outside of any region. */
  public static IndexedCatalog of(List<WeightedPoint> points) {
    return of(points, null);
  }

  /**
   * Returns a catalog with each point's region looked up from {@code regionMap}, or {@link AngularBin#GLOBAL} for every
   * point if {@code regionMap} is null.
   */
  public static IndexedCatalog of(List<WeightedPoint> points, RegionMap regionMap) {
    int n = points.size();
    double[][] vectors = new double[n][];
    double[] weights = new double[n];
    int[] regions = new int[n];
    for (int i = 0; i < n; i++) {
      WeightedPoint point = points.get(i);
      vectors[i] = SkyUtils.unitVector(point.lonLat());
      weights[i] = point.weight();
      regions[i] = regionMap == null ? AngularBin.GLOBAL : regionMap.findRegion(point.lonLat());
    }
    return new IndexedCatalog(vectors, weights, regions);
  }

  public int size() {
    return weights.length;
  }

  /** Returns the unit vector of point {@code i}; the array is shared with this catalog and must not be modified. */
  public double[] vector(int i) {
    return vectors[i];
  }

  public double weight(int i) {
    return weights[i];
  }

  public int region(int i) {
    return regions[i];
  }

  /** Sum of all point weights. */
  public double totalWeight() {
    double total = 0;
    for (double weight : weights) {
      total += weight;
    }
    return total;
  }
}
