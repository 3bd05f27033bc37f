package com.mk.fx.qa.codepage.execution.reporting;

import java.util.Arrays;

/** Order statistics over small frozen samples. Inputs are never modified. */
public final class Percentiles {

  private Percentiles() {}

  /**
   * Nearest-rank percentile: the value at {@code ceil(p/100 * n) - 1}, clamped to the sample.
   *
   * @return 0 for an empty sample
   */
  public static long nearestRank(long[] values, int p) {
    if (p < 0 || p > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    if (values.length == 0) {
      return 0L;
    }
    long[] copy = sortedCopy(values);
    int c = copy.length;
    // ceil(p * c / 100) - 1 without floating-point rounding
    int idx = Math.min(c - 1, Math.max(0, (int) ((p * (long) c + 99) / 100) - 1));
    return copy[idx];
  }

  /** Middle value, or the mean of the two middle values for an even sample; 0 when empty. */
  public static double median(long[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    long[] copy = sortedCopy(values);
    int mid = copy.length / 2;
    return copy.length % 2 == 0 ? (copy[mid - 1] + copy[mid]) / 2.0 : copy[mid];
  }

  private static long[] sortedCopy(long[] values) {
    long[] copy = Arrays.copyOf(values, values.length);
    Arrays.sort(copy);
    return copy;
  }
}
