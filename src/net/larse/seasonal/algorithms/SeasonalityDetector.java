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
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.larse.seasonal.helper.LinearLeastSquares;
import net.larse.seasonal.timeseries.InvalidConfigurationException;
import org.apache.commons.math.stat.descriptive.DescriptiveStatistics;
import org.ejml.data.DenseMatrix64F;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * Finds seasonal periods by scanning every integer candidate period, scoring
 * it (see {@link PeriodMethod}) and keeping the local maxima of the resulting
 * periodogram whose power exceeds the threshold.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class SeasonalityDetector {
  private static final Logger logger = LoggerFactory.getLogger(SeasonalityDetector.class);

  /** Number of periods {@link #detect(double[])} reports. */
  public static final int DEFAULT_MAX_PEAKS = 3;

  // Below this the centered series is rounding noise around a constant.
  private static final double ZERO_SUM_OF_SQUARES = 1e-12;

  private final int minPeriod;
  private final OptionalInt maxPeriod;
  private final double threshold;
  private final PeriodMethod method;

  private SeasonalityDetector(Builder builder) {
    this.minPeriod = builder.minPeriod;
    this.maxPeriod = builder.maxPeriod;
    this.threshold = builder.threshold;
    this.method = builder.method;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int getMinPeriod() {
    return minPeriod;
  }

  /** The configured largest candidate; when empty it follows the series length. */
  public OptionalInt getMaxPeriod() {
    return maxPeriod;
  }

  public double getThreshold() {
    return threshold;
  }

  public PeriodMethod getMethod() {
    return method;
  }

  /**
   * Largest candidate period scanned for a series of length n: the configured
   * maximum, or n / 2 (but never below the minimum period).
   */
  public int resolveMaxPeriod(int n) {
    return maxPeriod.orElse(Math.max(minPeriod, n / 2));
  }

  /**
   * Scores every integer period in [minPeriod, resolveMaxPeriod(n)].  Returns
   * an empty periodogram for a series shorter than two minimum periods or
   * without variance.
   */
  public Periodogram periodogram(double[] data) {
    Preconditions.checkNotNull(data);
    int n = data.length;
    if (n < 2 * minPeriod) {
      logger.warn("Seasonality detection skipped: data length {} < {}", n, 2 * minPeriod);
      return Periodogram.empty();
    }

    double mean = new DescriptiveStatistics(data).getMean();
    double[] centered = new double[n];
    double totalSumOfSquares = 0;
    for (int i = 0; i < n; i++) {
      centered[i] = data[i] - mean;
      totalSumOfSquares += centered[i] * centered[i];
    }
    // absolute on the centered data: the level of the series does not matter
    if (!(totalSumOfSquares > ZERO_SUM_OF_SQUARES)) {
      logger.warn("Seasonality detection skipped: variance is zero");
      return Periodogram.empty();
    }
    double variance = totalSumOfSquares / n;

    int upper = resolveMaxPeriod(n);
    IntArrayList periods = new IntArrayList();
    DoubleArrayList powers = new DoubleArrayList();
    SinusoidFit fit = new SinusoidFit();
    for (int period = minPeriod; period <= upper; period++) {
      double power;
      switch (method) {
        case AUTOCORRELATION:
          power = autocorrelation(centered, period, variance);
          break;
        case SINUSOID_FIT:
        default:
          power = fit.explainedVariance(centered, period, totalSumOfSquares);
          break;
      }
      periods.add(period);
      powers.add(power);
    }
    return new Periodogram(periods.toIntArray(), powers.toDoubleArray());
  }

  /**
   * Peaks of the periodogram of data above this detector's threshold,
   * strongest first (ties to the shorter period), at most maxPeaks of them.
   */
  public ImmutableList<PeriodogramPeak> detectPeaks(double[] data, int maxPeaks) {
    Preconditions.checkArgument(maxPeaks >= 0, "maxPeaks must be non-negative, got %s", maxPeaks);
    ImmutableList<PeriodogramPeak> peaks = periodogram(data).peaks(threshold);
    return peaks.size() > maxPeaks ? peaks.subList(0, maxPeaks) : peaks;
  }

  /**
   * Periods of the strongest peaks, strongest first.  An empty list means no
   * seasonality was found.
   */
  public ImmutableList<Integer> detect(double[] data, int maxPeaks) {
    ImmutableList.Builder<Integer> periods = ImmutableList.builder();
    for (PeriodogramPeak peak : detectPeaks(data, maxPeaks)) {
      periods.add(peak.getPeriod());
    }
    return periods.build();
  }

  public ImmutableList<Integer> detect(double[] data) {
    return detect(data, DEFAULT_MAX_PEAKS);
  }

  // Lag-p autocorrelation normalized by the overlap length.
  private static double autocorrelation(double[] centered, int period, double variance) {
    int n = centered.length;
    if (period >= n) {
      return 0.0;
    }
    double sum = 0;
    for (int i = period; i < n; i++) {
      sum += centered[i] * centered[i - period];
    }
    double corr = sum / ((n - period) * variance);
    return Math.max(0.0, Math.min(1.0, corr));
  }

  /**
   * Least-squares fit of a * sin(2 pi i / p) + b * cos(2 pi i / p) to the
   * centered series.  The solvers are reused across candidate periods.
   */
  private static final class SinusoidFit {
    private final LinearLeastSquares sinCos = new LinearLeastSquares(2, 1);
    private final LinearLeastSquares cosOnly = new LinearLeastSquares(1, 1);
    private final DenseMatrix64F coefficients = new DenseMatrix64F(2, 1);
    private final double[] regressors = new double[2];
    private final double[] residual = new double[1];

    double explainedVariance(double[] centered, int period, double totalSumOfSquares) {
      sinCos.reset();
      cosOnly.reset();
      for (int i = 0; i < centered.length; i++) {
        double angle = 2.0 * Math.PI * i / period;
        regressors[0] = Math.cos(angle);
        regressors[1] = Math.sin(angle);
        sinCos.addInput(regressors, 0, centered, i);
        cosOnly.addInput(regressors, 0, centered, i);
      }

      // at period 2 the sine regressor vanishes on every sample
      LinearLeastSquares solver = sinCos.getSolution(coefficients) ? sinCos : cosOnly;
      if (solver == cosOnly && !cosOnly.getSolution(coefficients)) {
        return 0.0;
      }
      solver.getResidualSumOfSquares(coefficients, residual);
      double power = 1.0 - residual[0] / totalSumOfSquares;
      return Math.max(0.0, Math.min(1.0, power));
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("minPeriod", minPeriod)
        .add("maxPeriod", maxPeriod)
        .add("threshold", threshold)
        .add("method", method)
        .toString();
  }

  public static final class Builder {
    private int minPeriod = 2;
    private OptionalInt maxPeriod = OptionalInt.empty();
    private double threshold = 0.5;
    private PeriodMethod method = PeriodMethod.SINUSOID_FIT;

    private Builder() {}

    public Builder minPeriod(int minPeriod) {
      this.minPeriod = minPeriod;
      return this;
    }

    public Builder maxPeriod(int maxPeriod) {
      this.maxPeriod = OptionalInt.of(maxPeriod);
      return this;
    }

    public Builder threshold(double threshold) {
      this.threshold = threshold;
      return this;
    }

    public Builder method(PeriodMethod method) {
      this.method = Preconditions.checkNotNull(method);
      return this;
    }

    /**
     * Validates the parameters and returns the detector.
     *
     * @throws InvalidConfigurationException if minPeriod is below 2, maxPeriod
     *     is below minPeriod, or threshold lies outside (0, 1]
     */
    public SeasonalityDetector build() {
      if (minPeriod < 2) {
        throw new InvalidConfigurationException("minPeriod must be at least 2, got %d", minPeriod);
      }
      if (maxPeriod.isPresent() && maxPeriod.getAsInt() < minPeriod) {
        throw new InvalidConfigurationException(
            "maxPeriod %d is below minPeriod %d", maxPeriod.getAsInt(), minPeriod);
      }
      if (!(threshold > 0.0 && threshold <= 1.0)) {
        throw new InvalidConfigurationException("threshold must lie in (0, 1], got %s", threshold);
      }
      return new SeasonalityDetector(this);
    }
  }
}
