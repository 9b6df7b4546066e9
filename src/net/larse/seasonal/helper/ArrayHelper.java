package net.larse.seasonal.helper;

import com.google.common.base.Preconditions;

import java.util.List;

/** Static array manipulation functions. */
public class ArrayHelper {
  /** Element-wise a - b. */
  public static double[] subtract(double[] a, double[] b) {
    Preconditions.checkArgument(a.length == b.length, "length mismatch: %s vs %s", a.length, b.length);
    double[] result = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      result[i] = a[i] - b[i];
    }
    return result;
  }

  /** Element-wise a + b. */
  public static double[] add(double[] a, double[] b) {
    Preconditions.checkArgument(a.length == b.length, "length mismatch: %s vs %s", a.length, b.length);
    double[] result = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      result[i] = a[i] + b[i];
    }
    return result;
  }

  /**
   * Element-wise sum of every array in components except the one at index
   * skip (pass -1 to sum all of them).  Returns zeros of length n when there
   * is nothing to add.
   */
  public static double[] sumExcept(List<double[]> components, int skip, int n) {
    double[] result = new double[n];
    for (int k = 0; k < components.size(); k++) {
      if (k == skip) {
        continue;
      }
      double[] component = components.get(k);
      Preconditions.checkArgument(component.length == n,
          "component %s has length %s, expected %s", k, component.length, n);
      for (int i = 0; i < n; i++) {
        result[i] += component[i];
      }
    }
    return result;
  }

  /**
   * Trailing moving average with the given window: entry i is the mean of
   * x[i], ..., x[i + window - 1].  The result has x.length - window + 1
   * entries.
   */
  public static double[] movingAverage(double[] x, int window) {
    Preconditions.checkArgument(window >= 1 && window <= x.length,
        "window %s outside [1, %s]", window, x.length);
    double[] result = new double[x.length - window + 1];
    double sum = 0;
    for (int i = 0; i < window; i++) {
      sum += x[i];
    }
    result[0] = sum / window;
    for (int i = 1; i < result.length; i++) {
      sum += x[i + window - 1] - x[i - 1];
      result[i] = sum / window;
    }
    return result;
  }

  /** Smallest odd integer not less than value. */
  public static int nextOdd(int value) {
    return value % 2 == 0 ? value + 1 : value;
  }
}
