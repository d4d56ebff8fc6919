package com.onthegomap.skycorr.regions;

import com.carrotsearch.hppc.LongIntHashMap;
import com.carrotsearch.hppc.cursors.LongIntCursor;
import com.carrotsearch.hppc.procedures.LongIntProcedure;
import com.onthegomap.skycorr.collection.Hppc;
import com.onthegomap.skycorr.geo.Footprint;
import com.onthegomap.skycorr.geo.PixelScheme;
import com.onthegomap.skycorr.geo.SkyPixel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Divides the area of a {@link Footprint} into contiguous, roughly equal-area regions for jackknife resampling and maps
 * pixels back to the region that contains them.
 * <p>
 * The footprint is covered with pixels at a "region resolution", then the covering is walked in stripe order,
 * section by section, filling one region until it reaches its share of the total area before moving on to the next.
 * Sections never span a gap in stripes, so the scan never fills a region across masked sky in the middle of a
 * section.
 * <p>
 * A map is built once by one of the {@code initialize} methods and is read-only afterward until {@link #clear()}. Its
 * fields are not volatile, so other threads may only look up regions after receiving the map through a happens-before
 * edge that follows {@code initialize} (a final field, {@link Thread#start()}, an executor submission, a concurrent
 * collection), and nothing may re-initialize it while they do.
 */
public class RegionMap {

  /** Region index returned for points and pixels outside of the mapped footprint. */
  public static final int NO_REGION = -1;
  /** Resolutions above this are an unrecoverable configuration error. */
  public static final int MAX_REGION_RESOLUTION = 2048;
  /** Automatic resolution selection stops doubling here. */
  static final int AUTO_RESOLUTION_LIMIT = 1024;
  /** Resolutions above this work, but cover a lot of pixels. */
  static final int WARN_RESOLUTION = 256;
  static final int TARGET_PIXELS_PER_REGION = 50;
  /** A region closes once adding another average-sized pixel would push it this far past its area break. */
  static final double BREAK_FRACTION = 0.75;

  private static final Logger LOGGER = LoggerFactory.getLogger(RegionMap.class);

  private LongIntHashMap regions = Hppc.newLongIntHashMap();
  private double[] regionAreas = new double[0];
  private int resolution = 0;
  private int nRegion = 0;

  /**
   * Divides {@code footprint} into {@code nRegion} regions at an automatically chosen resolution.
   *
   * @see #initialize(int, int, Footprint)
   */
  public int initialize(int nRegion, Footprint footprint) throws RegionationException {
    return initialize(nRegion, 0, footprint);
  }

  /**
   * Divides {@code footprint} into {@code nRegion} contiguous, roughly equal-area regions.
   *
   * @param nRegion    number of regions requested
   * @param resolution resolution of the pixels to build regions from, or 0 to pick one that gives about
   *                   {@value #TARGET_PIXELS_PER_REGION} pixels per region
   * @param footprint  the area to divide up
   * @return the number of regions actually created, which is lower than requested when the covering has fewer pixels
   *         than {@code nRegion} or when the area runs out before the last region starts
   * @throws RegionationException     if the resolution is above {@value #MAX_REGION_RESOLUTION} or the partition
   *                                  produced a region index outside {@code [0, n_region)}; the map is left cleared
   * @throws IllegalArgumentException if {@code nRegion < 1}, {@code resolution} is not a valid resolution, or the
   *                                  footprint covers no pixels
   */
  public int initialize(int nRegion, int resolution, Footprint footprint) throws RegionationException {
    clear();
    if (nRegion < 1) {
      throw new IllegalArgumentException("Number of regions must be >= 1, was " + nRegion);
    }
    int regionResolution = findRegionResolution(footprint, nRegion, resolution);
    List<SkyPixel> coverage = footprint.coverage(regionResolution);
    if (coverage.isEmpty()) {
      throw new IllegalArgumentException("Footprint has no pixels at resolution " + regionResolution);
    }

    if (nRegion > coverage.size()) {
      LOGGER.warn("Exceeded maximum possible regions, setting to {} regions", coverage.size());
      nRegion = coverage.size();
    }

    LongIntHashMap assignments = Hppc.newLongIntHashMap(coverage.size());
    double[] areas;
    if (nRegion == coverage.size()) {
      LOGGER.warn("Number of regions matches number of pixels at resolution {}, " +
        "assigning one pixel per region without equal areas", regionResolution);
      areas = assignOnePerPixel(coverage, assignments);
    } else {
      long[] uniqueStripes = coverage.stream().mapToLong(SkyPixel::stripe).distinct().sorted().toArray();
      List<Section> sections = findSections(uniqueStripes, footprint.area(), nRegion, regionResolution);
      areas = regionate(coverage, sections, nRegion, assignments);
    }

    verifyRegionation(assignments, areas.length);

    this.regions = assignments;
    this.regionAreas = areas;
    this.resolution = regionResolution;
    this.nRegion = areas.length;
    LOGGER.debug("Divided {} pixels at resolution {} into {} regions", coverage.size(), regionResolution,
      this.nRegion);
    return this.nRegion;
  }

  /**
   * Re-uses the regions of {@code reference} for a different {@code footprint}: every pixel covering
   * {@code footprint} at the reference resolution gets the region that {@code reference} assigns it.
   *
   * @return {@code true} if every pixel was found in {@code reference}, or {@code false} if the footprints are not
   *         compatibly covered, in which case this map is left cleared
   */
  public boolean initialize(RegionMap reference, Footprint footprint) {
    clear();
    if (!reference.isInitialized() || footprint.maxResolution() < reference.resolution()) {
      return false;
    }
    int referenceResolution = reference.resolution();
    List<SkyPixel> coverage = footprint.coverage(referenceResolution);
    LongIntHashMap assignments = Hppc.newLongIntHashMap(coverage.size());
    double[] areas = new double[reference.nRegion()];
    for (SkyPixel pixel : coverage) {
      int region = reference.region(pixel.id());
      if (region == NO_REGION) {
        LOGGER.debug("Pixel {} missing from reference region map, unable to share regions", pixel);
        return false;
      }
      assignments.put(pixel.id(), region);
      areas[region] += pixel.weightedArea();
    }
    this.regions = assignments;
    this.regionAreas = areas;
    this.resolution = referenceResolution;
    this.nRegion = reference.nRegion();
    return true;
  }

  static int findRegionResolution(Footprint footprint, int nRegion, int requested) throws RegionationException {
    int resolution = requested;
    if (resolution == 0) {
      double targetArea = footprint.area() / (TARGET_PIXELS_PER_REGION * nRegion);
      resolution = PixelScheme.HPIX_RESOLUTION;
      while (PixelScheme.pixelArea(resolution) > targetArea && resolution < AUTO_RESOLUTION_LIMIT) {
        resolution <<= 1;
      }
      LOGGER.debug("Automatically setting region resolution to {} for {} regions", resolution, nRegion);
    } else if (!PixelScheme.isValidResolution(resolution)) {
      throw new IllegalArgumentException("Invalid region resolution: " + resolution);
    }

    if (resolution > MAX_REGION_RESOLUTION) {
      throw new RegionationException("region_resolution_ceiling",
        "Region resolution " + resolution + " is above the limit of " + MAX_REGION_RESOLUTION);
    }
    if (resolution > WARN_RESOLUTION) {
      LOGGER.warn("Generating region map with resolution {} above {}, this may use a lot of memory", resolution,
        WARN_RESOLUTION);
    }
    if (resolution > footprint.maxResolution()) {
      LOGGER.warn("Re-setting region map resolution to {} to satisfy input map limits", footprint.maxResolution());
      resolution = footprint.maxResolution();
    }
    return resolution;
  }

  private static double[] assignOnePerPixel(List<SkyPixel> coverage, LongIntHashMap assignments) {
    double[] areas = new double[coverage.size()];
    for (int i = 0; i < coverage.size(); i++) {
      SkyPixel pixel = coverage.get(i);
      assignments.put(pixel.id(), i);
      areas[i] = pixel.weightedArea();
    }
    return areas;
  }

  /**
   * Splits the stripes into contiguous sections, then re-slices those into sub-sections about as wide as a region
   * would be if the regions were square.
   */
  static List<Section> findSections(long[] uniqueStripes, double area, int nRegion, int resolution) {
    double regionLength = Math.sqrt(area / nRegion);
    long width = Math.max(1, (long) Math.floor(regionLength * PixelScheme.stripesPerDegree(resolution)));
    return Section.slice(Section.contiguous(uniqueStripes), width);
  }

  /**
   * Walks the sub-sections in stripe order and the pixels within each in coverage order, accumulating area into the
   * current region until the running total reaches that region's area break.
   *
   * @return the area of each region created, indexed by region
   */
  static double[] regionate(List<SkyPixel> coverage, List<Section> sections, int nRegion,
    LongIntHashMap assignments) {
    List<List<SkyPixel>> bySection = bucketBySection(coverage, sections);

    double totalArea = 0;
    for (SkyPixel pixel : coverage) {
      totalArea += pixel.weightedArea();
    }
    double meanArea = totalArea / coverage.size();
    double areaBreak = totalArea / nRegion;

    double[] areas = new double[nRegion];
    int region = 0;
    double cumulativeArea = 0;
    double regionArea = 0;
    for (List<SkyPixel> section : bySection) {
      for (SkyPixel pixel : section) {
        double pixelArea = pixel.weightedArea();
        if (cumulativeArea + BREAK_FRACTION * meanArea < areaBreak * (region + 1) || region == nRegion - 1) {
          regionArea += pixelArea;
        } else {
          areas[region] = regionArea;
          region++;
          regionArea = pixelArea;
        }
        cumulativeArea += pixelArea;
        assignments.put(pixel.id(), region);
      }
    }
    areas[region] = regionArea;
    if (region < nRegion - 1) {
      LOGGER.warn("Only able to create {} of {} requested regions", region + 1, nRegion);
    }
    return Arrays.copyOf(areas, region + 1);
  }

  private static List<List<SkyPixel>> bucketBySection(List<SkyPixel> coverage, List<Section> sections) {
    long[] starts = sections.stream().mapToLong(Section::minStripe).toArray();
    List<List<SkyPixel>> result = new ArrayList<>(sections.size());
    for (int i = 0; i < sections.size(); i++) {
      result.add(new ArrayList<>());
    }
    for (SkyPixel pixel : coverage) {
      long stripe = pixel.stripe();
      int idx = Arrays.binarySearch(starts, stripe);
      idx = idx >= 0 ? idx : -idx - 2;
      if (idx >= 0 && sections.get(idx).contains(stripe)) {
        result.get(idx).add(pixel);
      }
    }
    return result;
  }

  /**
   * Checks that every assigned region index is in {@code [0, nRegion)}.
   *
   * @throws RegionationException if any index is out of range
   */
  static void verifyRegionation(LongIntHashMap assignments, int nRegion) throws RegionationException {
    for (LongIntCursor cursor : assignments) {
      if (cursor.value < 0 || cursor.value >= nRegion) {
        throw new RegionationException("illegal_region_index",
          "Encountered illegal region index " + cursor.value + " for pixel " + cursor.key + " with " + nRegion +
            " regions");
      }
    }
  }

  /** Returns the region containing a longitude/latitude coordinate, or {@link #NO_REGION} if it is not mapped. */
  public int findRegion(Coordinate lonLat) {
    if (!isInitialized()) {
      return NO_REGION;
    }
    return region(PixelScheme.pixelId(lonLat, resolution));
  }

  /**
   * Returns the region containing {@code pixel}, or {@link #NO_REGION} if it is not mapped or is coarser than the
   * region resolution.
   */
  public int findRegion(SkyPixel pixel) {
    if (!isInitialized() || pixel.resolution() < resolution) {
      return NO_REGION;
    }
    return region(pixel.superPixelId(resolution));
  }

  /** Returns the region of a pixel id at the region resolution, or {@link #NO_REGION} if it is not mapped. */
  public int region(long pixelId) {
    return regions.getOrDefault(pixelId, NO_REGION);
  }

  /** Returns every pixel at the region resolution assigned to {@code region}, sorted by pixel id. */
  public List<SkyPixel> regionCovering(int region) {
    List<SkyPixel> result = new ArrayList<>();
    for (LongIntCursor cursor : regions) {
      if (cursor.value == region) {
        result.add(SkyPixel.of(cursor.key, resolution));
      }
    }
    result.sort(Comparator.comparingLong(SkyPixel::id));
    return result;
  }

  /** Returns the area in square degrees assigned to {@code region}, or 0 if no such region exists. */
  public double regionArea(int region) {
    return region >= 0 && region < regionAreas.length ? regionAreas[region] : 0.0;
  }

  /** Calls {@code procedure} with each (pixel id, region) assignment in no particular order. */
  public void forEach(LongIntProcedure procedure) {
    regions.forEach(procedure);
  }

  /** Resets this map to the uninitialized state with resolution 0 and no regions. */
  public void clear() {
    regions = Hppc.newLongIntHashMap();
    regionAreas = new double[0];
    resolution = 0;
    nRegion = 0;
  }

  public int nRegion() {
    return nRegion;
  }

  public int resolution() {
    return resolution;
  }

  /** Returns the number of pixels assigned to regions. */
  public int size() {
    return regions.size();
  }

  public boolean isInitialized() {
    return nRegion > 0;
  }

  @Override
  public String toString() {
    return "RegionMap{nRegion=" + nRegion + " resolution=" + resolution + " pixels=" + regions.size() + '}';
  }
}
