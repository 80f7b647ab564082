package net.larse.seasonality.helper;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Doubles;
import org.apache.commons.math.stat.StatUtils;

/** Static series manipulation functions. */
public class SeriesHelper {
  private SeriesHelper() {}

  /**
   * Check that series is usable as a signal: at least one sample, and every sample finite.
   * Returns the series for chaining.
   */
  public static double[] checkSignal(double[] series) {
    Preconditions.checkArgument(series != null && series.length > 0, "signal must not be empty");
    for (int i = 0; i < series.length; i++) {
      Preconditions.checkArgument(Doubles.isFinite(series[i]),
          "signal sample %s is not finite: %s", i, Double.valueOf(series[i]));
    }
    return series;
  }

  /** True if n is a positive power of two (1 counts). */
  public static boolean isPowerOfTwo(int n) {
    return n > 0 && (n & (n - 1)) == 0;
  }

  /** The smallest power of two that is greater than or equal to n, for n >= 1. */
  public static int nextPowerOfTwo(int n) {
    Preconditions.checkArgument(n >= 1 && n <= (1 << 30), "length out of range: %s", n);
    int size = 1;
    while (size < n) {
      size <<= 1;
    }
    return size;
  }

  /**
   * (1/len) * sum(x[i]^2). Unlike a variance, the mean is not removed first. Empty input has a
   * mean square of zero.
   */
  public static double meanSquare(double[] series) {
    if (series.length == 0) {
      return 0.0;
    }
    return StatUtils.sumSq(series) / series.length;
  }

  /** Arithmetic mean of series[start..end] inclusive. */
  public static double windowMean(double[] series, int start, int end) {
    return StatUtils.mean(series, start, end - start + 1);
  }
}
