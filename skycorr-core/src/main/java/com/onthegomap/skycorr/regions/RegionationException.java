package com.onthegomap.skycorr.regions;

/**
 * An unrecoverable failure while dividing a footprint into regions, caused either by a resolution above the absolute
 * ceiling or by a partition that assigned a region index outside {@code [0, n_region)}.
 * <p>
 * The region map that threw it is left cleared so a corrupted partition can never be used.
 */
public class RegionationException extends Exception {

  private final String stat;

  /**
   * @param stat    short code that identifies the failure
   * @param message description of the failure
   */
  public RegionationException(String stat, String message) {
    super(message);
    this.stat = stat;
  }

  /** Returns the short code that identifies this failure. */
  public String stat() {
    return stat;
  }
}
