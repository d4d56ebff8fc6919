package com.onthegomap.skycorr.regions;

import java.util.ArrayList;
import java.util.List;

/**
 * An inclusive range of contiguous stripes.
 *
 * @param minStripe first stripe in the section
 * @param maxStripe last stripe in the section
 */
public record Section(long minStripe, long maxStripe) {

  public Section {
    if (maxStripe < minStripe) {
      throw new IllegalArgumentException("maxStripe " + maxStripe + " < minStripe " + minStripe);
    }
  }

  public boolean contains(long stripe) {
    return stripe >= minStripe && stripe <= maxStripe;
  }

  public long width() {
    return maxStripe - minStripe + 1;
  }

  /**
   * Merges sorted, unique stripe indices into maximal runs of consecutive stripes, so a section never spans a gap in
   * coverage.
   */
  public static List<Section> contiguous(long[] sortedStripes) {
    List<Section> result = new ArrayList<>();
    if (sortedStripes.length == 0) {
      return result;
    }
    long start = sortedStripes[0];
    long end = sortedStripes[0];
    for (int i = 1; i < sortedStripes.length; i++) {
      if (sortedStripes[i] == end + 1) {
        end = sortedStripes[i];
      } else {
        result.add(new Section(start, end));
        start = end = sortedStripes[i];
      }
    }
    result.add(new Section(start, end));
    return result;
  }

  /**
   * Re-slices each of {@code sections} into sub-sections {@code width} stripes wide, starting from the first stripe of
   * each section. A trailing remainder narrower than {@code width} folds into the last sub-section of its section, and a
   * section narrower than {@code width} is kept whole.
   */
  public static List<Section> slice(List<Section> sections, long width) {
    if (width < 1) {
      throw new IllegalArgumentException("Section width must be >= 1, was " + width);
    }
    List<Section> result = new ArrayList<>();
    for (Section section : sections) {
      long start = section.minStripe;
      while (section.maxStripe - start + 1 >= 2 * width) {
        result.add(new Section(start, start + width - 1));
        start += width;
      }
      result.add(new Section(start, section.maxStripe));
    }
    return result;
  }
}
