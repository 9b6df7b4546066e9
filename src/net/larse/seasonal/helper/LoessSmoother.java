/*
 * Copyright (c) 2026 Seasonal Decomposition Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.seasonal.helper;

import com.google.common.base.Preconditions;
import net.larse.seasonal.timeseries.InvalidConfigurationException;

/**
 * Locally weighted linear regression (LOESS, local degree 1).
 *
 * <p>For each target x the {@code span} nearest samples are selected (ties go
 * to the lower index), weighted by the tricube of their distance normalized
 * by the farthest selected sample, optionally multiplied by an external
 * robustness weight, and a weighted straight line is fitted through them.
 * Near the ends of the data the window is one-sided; nothing is reflected.
 *
 * <p>Follows the stlest routine of Cleveland et al. (1990):
 * R. B. Cleveland, W. S. Cleveland, J.E. McRae, and I. Terpenning, STL: A
 * Seasonal-Trend Decomposition Procedure Based on Loess. Journal of Official
 * Statistics, 6, 3-73.
 *
 * <p>x values must be sorted ascending.
 */
public class LoessSmoother {
  private final int span;

  public LoessSmoother(int span) {
    if (span < 2) {
      throw new InvalidConfigurationException("LOESS span must be at least 2, got %d", span);
    }
    this.span = span;
  }

  public int getSpan() {
    return span;
  }

  /** Smooths y observed at x = 0, 1, ..., n-1 without robustness weights. */
  public double[] smooth(double[] y) {
    return smooth(index(y.length), y, null);
  }

  /** Smooths y observed at x = 0, 1, ..., n-1. */
  public double[] smooth(double[] y, double[] robustWeights) {
    return smooth(index(y.length), y, robustWeights);
  }

  /**
   * Returns the smoothed value at every x.  robustWeights may be null, in
   * which case every sample has weight 1.  A window whose robustness weights
   * are all zero is fitted with the tricube weights alone.
   */
  public double[] smooth(double[] x, double[] y, double[] robustWeights) {
    checkInputs(x, y, robustWeights);

    int n = x.length;
    double[] smoothed = new double[n];
    int left = 0;
    for (int i = 0; i < n; i++) {
      left = slideWindow(x, left, x[i]);
      double value = fitWindow(x, y, robustWeights, left, x[i]);
      smoothed[i] = Double.isNaN(value) ? y[i] : value;
    }
    return smoothed;
  }

  /**
   * Evaluates the local fit at an arbitrary position, which may lie outside
   * the range of x (STL uses this to extend each cycle-subseries by one
   * point at either end).  Returns NaN if the window carries no weight.
   */
  public double fitAt(double[] x, double[] y, double[] robustWeights, double target) {
    checkInputs(x, y, robustWeights);
    int left = slideWindow(x, 0, target);
    return fitWindow(x, y, robustWeights, left, target);
  }

  private void checkInputs(double[] x, double[] y, double[] robustWeights) {
    Preconditions.checkNotNull(x);
    Preconditions.checkNotNull(y);
    Preconditions.checkArgument(x.length == y.length,
        "x and y differ in length: %s vs %s", x.length, y.length);
    Preconditions.checkArgument(robustWeights == null || robustWeights.length == y.length,
        "robustness weights must match the data length");
    if (span > x.length) {
      throw new InvalidConfigurationException(
          "LOESS span %d exceeds the number of samples %d", span, x.length);
    }
  }

  // Moves the window right while the sample just past it is strictly closer
  // to the target than the leftmost sample in it.
  private int slideWindow(double[] x, int left, double target) {
    while (left + span < x.length && target - x[left] > x[left + span] - target) {
      left++;
    }
    return left;
  }

  private double fitWindow(double[] x, double[] y, double[] robustWeights, int left, double target) {
    int right = left + span - 1;
    double h = Math.max(Math.abs(target - x[left]), Math.abs(x[right] - target));

    double sumW = 0;
    double sumWx = 0;
    double sumWy = 0;
    double[] w = new double[span];
    for (int j = left; j <= right; j++) {
      double weight = h > 0 ? tricube(Math.abs(x[j] - target) / h) : 1.0;
      if (robustWeights != null) {
        weight *= robustWeights[j];
      }
      w[j - left] = weight;
      sumW += weight;
      sumWx += weight * x[j];
      sumWy += weight * y[j];
    }
    if (sumW <= 0) {
      return robustWeights != null ? fitWindow(x, y, null, left, target) : Double.NaN;
    }

    double xMean = sumWx / sumW;
    double yMean = sumWy / sumW;
    double sxx = 0;
    double sxy = 0;
    for (int j = left; j <= right; j++) {
      double dx = x[j] - xMean;
      sxx += w[j - left] * dx * dx;
      sxy += w[j - left] * dx * (y[j] - yMean);
    }

    // fall back to the weighted mean when the weighted x spread is negligible
    double range = x[right] - x[left];
    if (Math.sqrt(sxx / sumW) <= 0.001 * range || sxx <= 0) {
      return yMean;
    }
    return yMean + sxy / sxx * (target - xMean);
  }

  static double tricube(double u) {
    if (u >= 1.0) {
      return 0.0;
    }
    double t = 1.0 - u * u * u;
    return t * t * t;
  }

  static double[] index(int n) {
    double[] x = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = i;
    }
    return x;
  }
}
