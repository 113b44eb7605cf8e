package com.codeheadsystems.provision.server.model;

import java.util.Locale;

/**
 * How a batch rotation treats a failing item. There is no default; callers choose.
 */
public enum BatchMode {
  /**
   * Every item is attempted independently; failures do not affect the others.
   */
  BEST_EFFORT,
  /**
   * Every item is staged first and committed only if all staged; a failed commit is
   * compensated so every credential ends unchanged.
   */
  ALL_OR_NOTHING;

  public static BatchMode fromWireName(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Batch mode is required: best_effort or all_or_nothing");
    }
    return BatchMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
