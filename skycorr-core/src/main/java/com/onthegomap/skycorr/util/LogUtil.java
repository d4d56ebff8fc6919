package com.onthegomap.skycorr.util;

import org.slf4j.MDC;

/**
 * Puts the current correlation stage in the SLF4J {@link MDC} so the log pattern prints it as {@code [stage]}.
 */
public class LogUtil {

  private static final String STAGE_KEY = "stage";

  private LogUtil() {}

  /** Tags subsequent logs from this thread with {@code [stage]}. */
  public static void setStage(String stage) {
    MDC.put(STAGE_KEY, "[" + stage + "] ");
  }

  /** Tags subsequent logs from this thread with {@code [stage:component]}, or just the component without a stage. */
  public static void setStage(String stage, String component) {
    setStage(stage == null ? component : stage + ":" + component);
  }

  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the stage logs from this thread are tagged with, or null outside of any stage. */
  public static String getStage() {
    String tag = MDC.get(STAGE_KEY);
    return tag == null ? null : tag.substring(1, tag.length() - 2);
  }
}
