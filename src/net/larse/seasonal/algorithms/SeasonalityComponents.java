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

package net.larse.seasonal.algorithms;

import com.google.common.base.Preconditions;
import net.larse.seasonal.helper.ArrayHelper;

import java.util.ArrayList;
import java.util.List;

/**
 * Trend, seasonal components (possibly none) and remainder of an analyzed
 * series.  Accessors return copies.
 */
public final class SeasonalityComponents {
  private final double[] trend;
  private final List<double[]> seasonals;
  private final double[] remainder;

  SeasonalityComponents(double[] trend, List<double[]> seasonals, double[] remainder) {
    Preconditions.checkArgument(trend.length == remainder.length,
        "trend and remainder differ in length");
    this.trend = trend;
    this.seasonals = new ArrayList<>(seasonals);
    this.remainder = remainder;
  }

  public int size() {
    return trend.length;
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public int getSeasonalCount() {
    return seasonals.size();
  }

  public double[] getSeasonal(int index) {
    return seasonals.get(index).clone();
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

  /**
   * Element-wise sum of the seasonal components; all zeros when there are
   * none.
   */
  public double[] aggregateSeasonal() {
    return ArrayHelper.sumExcept(seasonals, -1, trend.length);
  }
}
