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

import org.apache.commons.math.stat.descriptive.moment.Variance;
import org.apache.commons.math.stat.descriptive.rank.Median;

/**
 * Summary statistics shared by the decompositions and the analyzer.
 */
public final class SeriesStatistics {
  // Denominator variances at or below this are treated as a degenerate series.
  static final double DEGENERATE_VARIANCE = 1e-12;

  // Residuals beyond this many median absolute residuals get zero weight.
  static final double BISQUARE_SCALE = 6.0;

  private SeriesStatistics() {}

  /** Population variance; 0 for an empty array. */
  public static double variance(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    return new Variance(false).evaluate(values);
  }

  public static double median(double[] values) {
    Preconditions.checkArgument(values.length > 0, "median of an empty array");
    return new Median().evaluate(values);
  }

  /** Root mean square; 0 for an empty array. */
  public static double rms(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    double sum = 0;
    for (double v : values) {
      sum += v * v;
    }
    return Math.sqrt(sum / values.length);
  }

  /**
   * Strength of a component against the remainder:
   * {@code max(0, 1 - Var(remainder) / Var(component + remainder))}.
   * Returns 0 when the denominator variance vanishes, so a constant series
   * never yields NaN or infinity.
   */
  public static double strength(double[] component, double[] remainder) {
    double total = variance(ArrayHelper.add(component, remainder));
    if (!(total > DEGENERATE_VARIANCE)) {
      return 0.0;
    }
    double value = 1.0 - variance(remainder) / total;
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }

  /**
   * Bisquare robustness weights of the residuals, scaled by six times their
   * median absolute value: {@code (1 - (r / h)^2)^2} for {@code |r| < h},
   * 0 beyond.  If the median absolute residual is 0 every weight is 1.
   */
  public static double[] bisquareWeights(double[] residuals) {
    double[] abs = new double[residuals.length];
    for (int i = 0; i < residuals.length; i++) {
      abs[i] = Math.abs(residuals[i]);
    }
    double h = BISQUARE_SCALE * median(abs);

    double[] weights = new double[residuals.length];
    for (int i = 0; i < residuals.length; i++) {
      if (h <= 0) {
        weights[i] = 1.0;
        continue;
      }
      double u = abs[i] / h;
      if (u < 1.0) {
        double t = 1.0 - u * u;
        weights[i] = t * t;
      } else {
        weights[i] = 0.0;
      }
    }
    return weights;
  }
}
