package com.onthegomap.skycorr.correlation;

/**
 * What the intensity stored in each pixel of a {@link FieldUnion} means.
 */
public enum FieldType {
  /** A value measured across the area, like temperature, where the pixel value is its intensity. */
  SCALAR_FIELD,
  /** Counts of objects, where the pixel value is intensity per unmasked square degree. */
  DENSITY_FIELD,
  /** Samples of a value at object positions, where the pixel value is the mean intensity per point. */
  SAMPLED_FIELD
}
