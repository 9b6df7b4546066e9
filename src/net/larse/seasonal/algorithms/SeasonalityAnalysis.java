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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import net.larse.seasonal.timeseries.MSTLResult;
import net.larse.seasonal.timeseries.STLResult;

import java.util.OptionalInt;

/**
 * Result of {@link SeasonalityAnalyzer#analyze}: the periods found (strongest
 * first), the decomposition they led to and its strength scores.
 *
 * <p>The underlying STL or MSTL result is available according to
 * {@link #getKind()}.
 */
public final class SeasonalityAnalysis {
  // Seasonal strength above which a series with periods counts as seasonal.
  static final double SEASONAL_STRENGTH_CUTOFF = 0.1;

  private final DecompositionKind kind;
  private final ImmutableList<Integer> periods;
  private final ImmutableList<Double> periodStrengths;
  private final SeasonalityComponents components;
  private final double seasonalStrength;
  private final double trendStrength;
  private final STLResult stlResult;
  private final MSTLResult mstlResult;

  SeasonalityAnalysis(DecompositionKind kind,
                      ImmutableList<Integer> periods,
                      ImmutableList<Double> periodStrengths,
                      SeasonalityComponents components,
                      double seasonalStrength,
                      double trendStrength,
                      STLResult stlResult,
                      MSTLResult mstlResult) {
    Preconditions.checkArgument(periods.size() == periodStrengths.size());
    this.kind = kind;
    this.periods = periods;
    this.periodStrengths = periodStrengths;
    this.components = components;
    this.seasonalStrength = seasonalStrength;
    this.trendStrength = trendStrength;
    this.stlResult = stlResult;
    this.mstlResult = mstlResult;
  }

  public DecompositionKind getKind() {
    return kind;
  }

  /** Periods in decreasing strength; empty when no seasonality was found. */
  public ImmutableList<Integer> getPeriods() {
    return periods;
  }

  /**
   * Strength of each period in {@link #getPeriods()}: its periodogram power
   * when detected, the STL seasonal strength when the period was supplied by
   * the caller.
   */
  public ImmutableList<Double> getPeriodStrengths() {
    return periodStrengths;
  }

  /** The strongest period, if any. */
  public OptionalInt getPrimaryPeriod() {
    return periods.isEmpty() ? OptionalInt.empty() : OptionalInt.of(periods.get(0));
  }

  public SeasonalityComponents getComponents() {
    return components;
  }

  /** Strength of the aggregated seasonal against the remainder, in [0, 1]. */
  public double getSeasonalStrength() {
    return seasonalStrength;
  }

  /** Strength of the trend against the remainder, in [0, 1]. */
  public double getTrendStrength() {
    return trendStrength;
  }

  public boolean isSeasonal() {
    return !periods.isEmpty() && seasonalStrength > SEASONAL_STRENGTH_CUTOFF;
  }

  public STLResult getStlResult() {
    Preconditions.checkState(kind == DecompositionKind.STL, "analysis used %s, not STL", kind);
    return stlResult;
  }

  public MSTLResult getMstlResult() {
    Preconditions.checkState(kind == DecompositionKind.MSTL, "analysis used %s, not MSTL", kind);
    return mstlResult;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("periods", periods)
        .add("seasonalStrength", seasonalStrength)
        .add("trendStrength", trendStrength)
        .toString();
  }
}
