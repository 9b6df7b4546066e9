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

import net.larse.seasonal.helper.SeriesStatistics;

/**
 * Output of one STL fit: trend, seasonal and remainder arrays of the input's
 * length with {@code trend[i] + seasonal[i] + remainder[i] == original[i]}.
 * Accessors hand out copies, so a result can be shared freely.
 */
public final class STLResult {
  private final int period;
  private final double[] trend;
  private final double[] seasonal;
  private final double[] remainder;
  private final double seasonalStrength;
  private final double trendStrength;

  STLResult(int period, double[] trend, double[] seasonal, double[] remainder) {
    this.period = period;
    this.trend = trend;
    this.seasonal = seasonal;
    this.remainder = remainder;
    this.seasonalStrength = SeriesStatistics.strength(seasonal, remainder);
    this.trendStrength = SeriesStatistics.strength(trend, remainder);
  }

  public int getPeriod() {
    return period;
  }

  public int size() {
    return trend.length;
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public double[] getSeasonal() {
    return seasonal.clone();
  }

  public double[] getRemainder() {
    return remainder.clone();
  }

  /** {@code max(0, 1 - Var(remainder) / Var(seasonal + remainder))}, in [0, 1]. */
  public double getSeasonalStrength() {
    return seasonalStrength;
  }

  /** {@code max(0, 1 - Var(remainder) / Var(trend + remainder))}, in [0, 1]. */
  public double getTrendStrength() {
    return trendStrength;
  }
}
