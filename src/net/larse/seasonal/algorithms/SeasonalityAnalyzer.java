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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import net.larse.seasonal.helper.ArrayHelper;
import net.larse.seasonal.helper.LoessSmoother;
import net.larse.seasonal.helper.SeriesStatistics;
import net.larse.seasonal.timeseries.InsufficientDataException;
import net.larse.seasonal.timeseries.InvalidConfigurationException;
import net.larse.seasonal.timeseries.MSTLConfig;
import net.larse.seasonal.timeseries.MSTLDecomposition;
import net.larse.seasonal.timeseries.MSTLResult;
import net.larse.seasonal.timeseries.STLConfig;
import net.larse.seasonal.timeseries.STLDecomposition;
import net.larse.seasonal.timeseries.STLResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Turns a raw series into a full decomposition: detects the seasonal periods,
 * then runs STL for a single period, MSTL for several, or only a broad trend
 * smoother when there is no seasonality.
 *
 * <p>The analyzer keeps no state between calls; each analysis owns its
 * result.
 */
public final class SeasonalityAnalyzer {
  private static final Logger logger = LoggerFactory.getLogger(SeasonalityAnalyzer.class);

  /** Shortest series {@link #analyze} accepts. */
  public static final int MIN_LENGTH = 4;

  private static final int MSTL_ITERATIONS = 2;

  private final SeasonalityDetector detector;
  private final int maxPeaks;

  public SeasonalityAnalyzer() {
    this(SeasonalityDetector.builder().build());
  }

  public SeasonalityAnalyzer(SeasonalityDetector detector) {
    this(detector, SeasonalityDetector.DEFAULT_MAX_PEAKS);
  }

  public SeasonalityAnalyzer(SeasonalityDetector detector, int maxPeaks) {
    Preconditions.checkArgument(maxPeaks >= 1, "maxPeaks must be positive, got %s", maxPeaks);
    this.detector = Preconditions.checkNotNull(detector);
    this.maxPeaks = maxPeaks;
  }

  public SeasonalityDetector getDetector() {
    return detector;
  }

  /** Detects the periods of series and decomposes it accordingly. */
  public SeasonalityAnalysis analyze(double[] series) {
    return analyze(series, OptionalInt.empty());
  }

  /** Decomposes series with STL at the given period, skipping detection. */
  public SeasonalityAnalysis analyze(double[] series, int overridePeriod) {
    return analyze(series, OptionalInt.of(overridePeriod));
  }

  /**
   * @throws InsufficientDataException if series is shorter than
   *     {@link #MIN_LENGTH} or than two cycles of the override period
   * @throws InvalidConfigurationException if the override period is below 2
   */
  public SeasonalityAnalysis analyze(double[] series, OptionalInt overridePeriod) {
    Preconditions.checkNotNull(series);
    if (series.length < MIN_LENGTH) {
      throw new InsufficientDataException("Seasonality analysis", MIN_LENGTH, series.length);
    }

    SeasonalityAnalysis analysis;
    if (overridePeriod.isPresent()) {
      int period = overridePeriod.getAsInt();
      if (period < 2) {
        throw new InvalidConfigurationException("override period must be at least 2, got %d", period);
      }
      STLResult stl = runStl(series, period);
      analysis = fromStl(stl, ImmutableList.of(period), ImmutableList.of(stl.getSeasonalStrength()));
    } else {
      analysis = detectAndDecompose(series);
    }

    logger.info("Seasonality analysis of {} points: {} with periods {}",
        series.length, analysis.getKind(), analysis.getPeriods());
    return analysis;
  }

  private SeasonalityAnalysis detectAndDecompose(double[] series) {
    int n = series.length;
    ImmutableList.Builder<Integer> periods = ImmutableList.builder();
    ImmutableList.Builder<Double> strengths = ImmutableList.builder();
    // unusable periods go before the cut to maxPeaks so they cannot crowd
    // out shorter ones
    int kept = 0;
    for (PeriodogramPeak peak : detector.periodogram(series).peaks(detector.getThreshold())) {
      if (kept == maxPeaks) {
        break;
      }
      if (2 * peak.getPeriod() > n) {
        logger.warn("Dropping detected period {}: {} points cover fewer than two cycles",
            peak.getPeriod(), n);
        continue;
      }
      periods.add(peak.getPeriod());
      strengths.add(peak.getPower());
      kept++;
    }
    ImmutableList<Integer> detected = periods.build();

    switch (detected.size()) {
      case 0:
        return trendOnly(series);
      case 1:
        return fromStl(runStl(series, detected.get(0)), detected, strengths.build());
      default:
        List<Integer> ascending = Ordering.natural().sortedCopy(detected);
        MSTLResult mstl = MSTLDecomposition.decompose(
            MSTLConfig.builder().periods(ascending).iterations(MSTL_ITERATIONS).build(), series);
        return fromMstl(mstl, detected, strengths.build());
    }
  }

  private static STLResult runStl(double[] series, int period) {
    STLConfig config = STLConfig.builder()
        .period(period)
        .seasonalSmoother(ArrayHelper.nextOdd(Math.max(3, period)))
        .trendSmoother(Math.max(7, ArrayHelper.nextOdd(3 * period)))
        .build();
    return STLDecomposition.decompose(config, series);
  }

  private static SeasonalityAnalysis fromStl(STLResult stl, ImmutableList<Integer> periods,
                                             ImmutableList<Double> strengths) {
    SeasonalityComponents components = new SeasonalityComponents(
        stl.getTrend(), Collections.singletonList(stl.getSeasonal()), stl.getRemainder());
    return new SeasonalityAnalysis(DecompositionKind.STL, periods, strengths, components,
        stl.getSeasonalStrength(), stl.getTrendStrength(), stl, null);
  }

  // The MSTL components are in ascending period order, the detected list is
  // by strength; the components follow the MSTL order.
  private static SeasonalityAnalysis fromMstl(MSTLResult mstl, ImmutableList<Integer> periods,
                                              ImmutableList<Double> strengths) {
    SeasonalityComponents components =
        new SeasonalityComponents(mstl.getTrend(), mstl.getSeasonals(), mstl.getRemainder());
    return new SeasonalityAnalysis(DecompositionKind.MSTL, periods, strengths, components,
        SeriesStatistics.strength(components.aggregateSeasonal(), components.getRemainder()),
        SeriesStatistics.strength(components.getTrend(), components.getRemainder()),
        null, mstl);
  }

  private static SeasonalityAnalysis trendOnly(double[] series) {
    int n = series.length;
    int span = Math.min(n, ArrayHelper.nextOdd(Math.max(7, n / 3)));
    double[] trend = new LoessSmoother(span).smooth(series);
    double[] remainder = ArrayHelper.subtract(series, trend);

    SeasonalityComponents components =
        new SeasonalityComponents(trend, Collections.<double[]>emptyList(), remainder);
    return new SeasonalityAnalysis(DecompositionKind.NONE, ImmutableList.<Integer>of(),
        ImmutableList.<Double>of(), components,
        SeriesStatistics.strength(components.aggregateSeasonal(), remainder),
        SeriesStatistics.strength(trend, remainder),
        null, null);
  }
}
