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
import com.google.common.collect.ImmutableList;
import net.larse.seasonal.helper.ArrayHelper;
import net.larse.seasonal.helper.SeriesStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one MSTL fit: a trend, one seasonal component per configured
 * period (in configured order) and a remainder, with
 * {@code trend[i] + sum_k seasonal_k[i] + remainder[i] == original[i]}.
 */
public final class MSTLResult {
  private final ImmutableList<Integer> periods;
  private final double[] trend;
  private final List<double[]> seasonals;
  private final double[] remainder;
  private final double seasonalStrength;
  private final double trendStrength;

  MSTLResult(ImmutableList<Integer> periods, double[] trend, List<double[]> seasonals,
             double[] remainder) {
    this.periods = periods;
    this.trend = trend;
    this.seasonals = new ArrayList<>(seasonals);
    this.remainder = remainder;
    this.seasonalStrength = SeriesStatistics.strength(aggregate(), remainder);
    this.trendStrength = SeriesStatistics.strength(trend, remainder);
  }

  public ImmutableList<Integer> getPeriods() {
    return periods;
  }

  public int size() {
    return trend.length;
  }

  public double[] getTrend() {
    return trend.clone();
  }

  /** Seasonal component of the index-th configured period. */
  public double[] getSeasonal(int index) {
    return seasonals.get(index).clone();
  }

  /** Seasonal component of the given period. */
  public double[] getSeasonalForPeriod(int period) {
    int index = periods.indexOf(period);
    Preconditions.checkArgument(index >= 0, "period %s was not decomposed", period);
    return getSeasonal(index);
  }

  public List<double[]> getSeasonals() {
    List<double[]> copy = new ArrayList<>(seasonals.size());
    for (double[] seasonal : seasonals) {
      copy.add(seasonal.clone());
    }
    return copy;
  }

  public double[] getRemainder() {
    return remainder.clone();
  }

  /** Element-wise sum of every seasonal component. */
  public double[] getAggregateSeasonal() {
    return aggregate();
  }

  /** Seasonal strength of the aggregated seasonal against the remainder. */
  public double getSeasonalStrength() {
    return seasonalStrength;
  }

  public double getTrendStrength() {
    return trendStrength;
  }

  private double[] aggregate() {
    return ArrayHelper.sumExcept(seasonals, -1, trend.length);
  }
}
