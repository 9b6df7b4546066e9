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

package net.larse.seasonal.timeseries;

import com.google.common.base.Preconditions;
import net.larse.seasonal.helper.ArrayHelper;
import net.larse.seasonal.helper.LoessSmoother;
import net.larse.seasonal.helper.SeriesStatistics;
import org.apache.commons.lang3.ArrayUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements Seasonal Decomposition of Time Series by Loess:
 * R. B. Cleveland, W. S. Cleveland, J.E. McRae, and I. Terpenning (1990) STL:
 * A Seasonal-Trend Decomposition Procedure Based on Loess. Journal of Official
 * Statistics, 6, 3-73.
 *
 * <p>Each outer pass detrends the series, smooths every cycle-subseries,
 * removes the low-frequency leakage from the result with a low-pass filter,
 * and re-estimates the trend from the deseasonalized series.  In robust mode
 * the bisquare weights of the remainder feed the smoothers of the next pass.
 *
 * <p>The decomposition holds only its immutable config; every call to
 * {@link #fit(double[])} allocates a fresh {@link STLResult}, so one instance
 * may be shared between threads.
 */
public class STLDecomposition {
  private static final Logger logger = LoggerFactory.getLogger(STLDecomposition.class);

  private final STLConfig config;

  public STLDecomposition(STLConfig config) {
    this.config = Preconditions.checkNotNull(config);
  }

  public STLConfig getConfig() {
    return config;
  }

  /**
   * Decomposes an evenly spaced series.
   *
   * @throws InsufficientDataException if the series holds fewer than two
   *     full periods
   */
  public STLResult fit(double[] y) {
    Preconditions.checkNotNull(y);
    int n = y.length;
    int period = config.getPeriod();
    if (n < 2 * period) {
      throw new InsufficientDataException("STL with period " + period, 2 * period, n);
    }

    double[] trend = new double[n];
    double[] seasonal = new double[n];
    // null until the first robustness pass: every point has weight 1
    double[] weights = null;

    for (int iter = 0; iter < config.getIterations(); iter++) {
      seasonal = seasonalComponent(ArrayHelper.subtract(y, trend), weights);
      trend = trendComponent(ArrayHelper.subtract(y, seasonal), weights);

      if (config.isRobust() && iter < config.getIterations() - 1) {
        weights = SeriesStatistics.bisquareWeights(remainder(y, trend, seasonal));
      }
      if (logger.isDebugEnabled()) {
        logger.debug("STL period {} pass {}: remainder rms {}",
            period, iter, SeriesStatistics.rms(remainder(y, trend, seasonal)));
      }
    }

    STLResult result = new STLResult(period, trend, seasonal, remainder(y, trend, seasonal));
    logger.debug("STL decomposition of {} points with period {} using {} iterations",
        n, period, config.getIterations());
    return result;
  }

  /** Convenience for {@code new STLDecomposition(config).fit(y)}. */
  public static STLResult decompose(STLConfig config, double[] y) {
    return new STLDecomposition(config).fit(y);
  }

  private double[] seasonalComponent(double[] detrended, double[] weights) {
    int n = detrended.length;
    int period = config.getPeriod();

    double[] cycle = cycleSubseries(detrended, weights);

    // moving averages of period, period and 3 take n + 2 * period points
    // down to exactly n, centered on cycle[period .. period + n - 1]
    double[] lowPass = ArrayHelper.movingAverage(cycle, period);
    lowPass = ArrayHelper.movingAverage(lowPass, period);
    lowPass = ArrayHelper.movingAverage(lowPass, 3);
    lowPass = new LoessSmoother(Math.min(config.getLowPassSmoother(), n)).smooth(lowPass);

    return ArrayHelper.subtract(ArrayUtils.subarray(cycle, period, period + n), lowPass);
  }

  /**
   * Smooths each cycle-subseries and extends it by one fitted point at either
   * end.  The result has n + 2 * period entries; entry period + i belongs to
   * observation i.
   */
  private double[] cycleSubseries(double[] detrended, double[] weights) {
    int n = detrended.length;
    int period = config.getPeriod();
    double[] cycle = new double[n + 2 * period];

    for (int phase = 0; phase < period; phase++) {
      int k = (n - phase - 1) / period + 1;
      double[] xs = new double[k];
      double[] ys = new double[k];
      double[] ws = weights == null ? null : new double[k];
      for (int m = 0; m < k; m++) {
        xs[m] = m;
        ys[m] = detrended[phase + m * period];
        if (ws != null) {
          ws[m] = weights[phase + m * period];
        }
      }

      LoessSmoother smoother = new LoessSmoother(Math.min(config.getSeasonalSmoother(), k));
      double[] smoothed = smoother.smooth(xs, ys, ws);

      double before = smoother.fitAt(xs, ys, ws, -1);
      double after = smoother.fitAt(xs, ys, ws, k);
      cycle[phase] = Double.isNaN(before) ? smoothed[0] : before;
      for (int m = 0; m < k; m++) {
        cycle[period + phase + m * period] = smoothed[m];
      }
      cycle[period + phase + k * period] = Double.isNaN(after) ? smoothed[k - 1] : after;
    }
    return cycle;
  }

  private double[] trendComponent(double[] deseasonalized, double[] weights) {
    int span = Math.min(config.getTrendSmoother(), deseasonalized.length);
    return new LoessSmoother(span).smooth(deseasonalized, weights);
  }

  static double[] remainder(double[] y, double[] trend, double[] seasonal) {
    double[] remainder = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      remainder[i] = y[i] - trend[i] - seasonal[i];
    }
    return remainder;
  }
}
