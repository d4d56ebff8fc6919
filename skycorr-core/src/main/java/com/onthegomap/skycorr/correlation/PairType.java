package com.onthegomap.skycorr.correlation;

/**
 * The four pair-count components of the Landy-Szalay estimator.
 * <p>
 * For an auto-correlation {@link #GAL_RAND} and {@link #RAND_GAL} hold the same pairs counted from either side.
 */
public enum PairType {
  GAL_GAL("gal_gal"),
  GAL_RAND("gal_rand"),
  RAND_GAL("rand_gal"),
  RAND_RAND("rand_rand");

  private final String id;

  PairType(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }
}
