package com.codeheadsystems.provision.server.model;

import java.util.List;

/**
 * Aggregate of a batch rotation. {@code rolledBack} is only ever true in
 * {@link BatchMode#ALL_OR_NOTHING}.
 */
public record BatchRotationResult(int totalKeys,
                                  int successCount,
                                  int failureCount,
                                  boolean rolledBack,
                                  List<RotationResult> results) {

  public static BatchRotationResult of(List<RotationResult> results, boolean rolledBack) {
    int successes = (int) results.stream().filter(RotationResult::success).count();
    return new BatchRotationResult(results.size(), successes, results.size() - successes, rolledBack,
        List.copyOf(results));
  }
}
