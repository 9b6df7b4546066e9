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
import net.larse.seasonal.helper.LoessSmoother;
import net.larse.seasonal.helper.SeriesStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Multiple seasonal-trend decomposition by backfitting STL passes:
 * K. Bandara, R. J. Hyndman, C. Bergmeir (2021) MSTL: A Seasonal-Trend
 * Decomposition Algorithm for Time Series with Multiple Seasonal Patterns.
 *
 * <p>Every outer round visits the periods in configured order.  Each period's
 * seasonal is re-estimated by an STL pass over the series with the trend and
 * all other seasonals removed; the trend is then re-smoothed once from the
 * fully deseasonalized series.
 */
public class MSTLDecomposition {
  private static final Logger logger = LoggerFactory.getLogger(MSTLDecomposition.class);

  // Inner STL passes per period and round.
  private static final int INNER_ITERATIONS = 2;

  private final MSTLConfig config;
  private final List<STLDecomposition> inner;

  public MSTLDecomposition(MSTLConfig config) {
    this.config = Preconditions.checkNotNull(config);
    List<STLDecomposition> decompositions = new ArrayList<>();
    List<Integer> periods = config.getPeriods();
    for (int k = 0; k < periods.size(); k++) {
      decompositions.add(new STLDecomposition(innerConfig(periods.get(k), k, config.isRobust())));
    }
    this.inner = Collections.unmodifiableList(decompositions);
  }

  public MSTLConfig getConfig() {
    return config;
  }

  /**
   * Decomposes an evenly spaced series.  Periods longer than half the series
   * cannot be estimated; their seasonal component stays zero.
   *
   * @throws InsufficientDataException if the series holds fewer than two
   *     cycles of the shortest period
   */
  public MSTLResult fit(double[] y) {
    Preconditions.checkNotNull(y);
    int n = y.length;
    ImmutableList<Integer> periods = config.getPeriods();
    int shortest = Collections.min(periods);
    if (n < 2 * shortest) {
      throw new InsufficientDataException("MSTL with shortest period " + shortest, 2 * shortest, n);
    }

    int longestFitted = 0;
    for (int period : periods) {
      if (2 * period > n) {
        logger.warn("MSTL period {} skipped: {} observations cover fewer than two cycles",
            period, n);
      } else {
        longestFitted = Math.max(longestFitted, period);
      }
    }
    LoessSmoother trendSmoother =
        new LoessSmoother(Math.min(ArrayHelper.nextOdd(2 * longestFitted), n));

    List<double[]> seasonals = new ArrayList<>(periods.size());
    for (int k = 0; k < periods.size(); k++) {
      seasonals.add(new double[n]);
    }
    double[] trend = new double[n];

    for (int round = 0; round < config.getIterations(); round++) {
      for (int k = 0; k < periods.size(); k++) {
        if (2 * periods.get(k) > n) {
          continue;
        }
        double[] working =
            ArrayHelper.subtract(ArrayHelper.subtract(y, trend), ArrayHelper.sumExcept(seasonals, k, n));
        seasonals.set(k, inner.get(k).fit(working).getSeasonal());
      }
      trend = trendSmoother.smooth(ArrayHelper.subtract(y, ArrayHelper.sumExcept(seasonals, -1, n)));

      if (logger.isDebugEnabled()) {
        logger.debug("MSTL round {}: remainder rms {}", round,
            SeriesStatistics.rms(remainder(y, trend, seasonals)));
      }
    }

    logger.debug("MSTL decomposition of {} points with periods {} using {} iterations",
        n, periods, config.getIterations());
    return new MSTLResult(periods, trend, seasonals, remainder(y, trend, seasonals));
  }

  /** Convenience for {@code new MSTLDecomposition(config).fit(y)}. */
  public static MSTLResult decompose(MSTLConfig config, double[] y) {
    return new MSTLDecomposition(config).fit(y);
  }

  // Seasonal spans widen with the position of the period, as in R's mstl().
  static STLConfig innerConfig(int period, int position, boolean robust) {
    return STLConfig.builder()
        .period(period)
        .seasonalSmoother(7 + 4 * (position + 1))
        .trendSmoother(Math.max(7, ArrayHelper.nextOdd(3 * period)))
        .iterations(INNER_ITERATIONS)
        .robust(robust)
        .build();
  }

  private static double[] remainder(double[] y, double[] trend, List<double[]> seasonals) {
    return STLDecomposition.remainder(y, trend, ArrayHelper.sumExcept(seasonals, -1, y.length));
  }
}
