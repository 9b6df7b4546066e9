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

import com.google.common.base.MoreObjects;
import net.larse.seasonal.helper.ArrayHelper;

/**
 * Immutable parameters of a single-period STL decomposition.  Instances come
 * from {@link #builder()}; every span is validated when the builder runs, so
 * a config that exists is always usable.
 */
public final class STLConfig {
  private final int period;
  private final int seasonalSmoother;
  private final int trendSmoother;
  private final int lowPassSmoother;
  private final int iterations;
  private final boolean robust;

  private STLConfig(Builder builder, int trendSmoother, int lowPassSmoother) {
    this.period = builder.period;
    this.seasonalSmoother = builder.seasonalSmoother;
    this.trendSmoother = trendSmoother;
    this.lowPassSmoother = lowPassSmoother;
    this.iterations = builder.iterations;
    this.robust = builder.robust;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Shorthand for a config with the given period and default spans. */
  public static STLConfig forPeriod(int period) {
    return builder().period(period).build();
  }

  public int getPeriod() {
    return period;
  }

  /** Span of the LOESS applied to every cycle-subseries. */
  public int getSeasonalSmoother() {
    return seasonalSmoother;
  }

  /** Span of the LOESS that produces the trend. */
  public int getTrendSmoother() {
    return trendSmoother;
  }

  /** Span of the LOESS that finishes the low-pass filter of the seasonal. */
  public int getLowPassSmoother() {
    return lowPassSmoother;
  }

  public int getIterations() {
    return iterations;
  }

  public boolean isRobust() {
    return robust;
  }

  public Builder toBuilder() {
    return new Builder()
        .period(period)
        .seasonalSmoother(seasonalSmoother)
        .trendSmoother(trendSmoother)
        .lowPassSmoother(lowPassSmoother)
        .iterations(iterations)
        .robust(robust);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("period", period)
        .add("seasonalSmoother", seasonalSmoother)
        .add("trendSmoother", trendSmoother)
        .add("lowPassSmoother", lowPassSmoother)
        .add("iterations", iterations)
        .add("robust", robust)
        .toString();
  }

  public static final class Builder {
    private int period = 12;
    private int seasonalSmoother = 7;
    // derived from the period and the seasonal span when left unset
    private Integer trendSmoother;
    private Integer lowPassSmoother;
    private int iterations = 2;
    private boolean robust = false;

    private Builder() {}

    public Builder period(int period) {
      this.period = period;
      return this;
    }

    public Builder seasonalSmoother(int span) {
      this.seasonalSmoother = span;
      return this;
    }

    public Builder trendSmoother(int span) {
      this.trendSmoother = span;
      return this;
    }

    public Builder lowPassSmoother(int span) {
      this.lowPassSmoother = span;
      return this;
    }

    public Builder iterations(int iterations) {
      this.iterations = iterations;
      return this;
    }

    public Builder robust(boolean robust) {
      this.robust = robust;
      return this;
    }

    /**
     * Validates the parameters and returns the config.
     *
     * @throws InvalidConfigurationException if the period is below 2, a span
     *     is even or too small, or iterations is not positive
     */
    public STLConfig build() {
      if (period < 2) {
        throw new InvalidConfigurationException("STL period must be at least 2, got %d", period);
      }
      if (seasonalSmoother < 3 || seasonalSmoother % 2 == 0) {
        throw new InvalidConfigurationException(
            "seasonal smoother span must be odd and at least 3, got %d", seasonalSmoother);
      }
      if (iterations < 1) {
        throw new InvalidConfigurationException(
            "iterations must be positive, got %d", iterations);
      }
      int trend = trendSmoother != null ? trendSmoother : defaultTrendSmoother(period, seasonalSmoother);
      checkPeriodSpan("trend", trend);
      int lowPass = lowPassSmoother != null ? lowPassSmoother : ArrayHelper.nextOdd(period + 1);
      checkPeriodSpan("low-pass", lowPass);
      return new STLConfig(this, trend, lowPass);
    }

    private void checkPeriodSpan(String name, int span) {
      if (span <= 0 || span % 2 == 0 || span < period + 1) {
        throw new InvalidConfigurationException(
            "%s smoother span must be odd and at least period + 1 = %d, got %d",
            name, period + 1, span);
      }
    }
  }

  // Cleveland et al. (1990): the smallest odd integer >= 1.5 * np / (1 - 1.5 / ns).
  static int defaultTrendSmoother(int period, int seasonalSmoother) {
    double span = 1.5 * period / (1.0 - 1.5 / seasonalSmoother);
    return ArrayHelper.nextOdd((int) Math.ceil(span));
  }
}
