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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Candidate periods in increasing order paired with their power, the share of
 * the series' variance a single cycle of that period accounts for.
 */
public final class Periodogram {
  private static final Periodogram EMPTY = new Periodogram(new int[0], new double[0]);

  // Strongest first; equal powers go to the shorter period.
  static final Comparator<PeriodogramPeak> BY_POWER =
      Comparator.comparingDouble(PeriodogramPeak::getPower).reversed()
          .thenComparingInt(PeriodogramPeak::getPeriod);

  private final int[] periods;
  private final double[] powers;

  public Periodogram(int[] periods, double[] powers) {
    Preconditions.checkArgument(periods.length == powers.length,
        "periods and powers differ in length: %s vs %s", periods.length, powers.length);
    for (int i = 1; i < periods.length; i++) {
      Preconditions.checkArgument(periods[i] > periods[i - 1],
          "periods must be strictly increasing at index %s", i);
    }
    this.periods = periods.clone();
    this.powers = powers.clone();
  }

  public static Periodogram empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return periods.length == 0;
  }

  public int size() {
    return periods.length;
  }

  public int getPeriod(int index) {
    return periods[index];
  }

  public double getPower(int index) {
    return powers[index];
  }

  public int[] getPeriods() {
    return periods.clone();
  }

  public double[] getPowers() {
    return powers.clone();
  }

  /** Power of the given candidate period, if it was scanned. */
  public OptionalDouble powerOf(int period) {
    for (int i = 0; i < periods.length; i++) {
      if (periods[i] == period) {
        return OptionalDouble.of(powers[i]);
      }
    }
    return OptionalDouble.empty();
  }

  /**
   * Returns the candidates whose power exceeds threshold and is at least the
   * power of each adjacent candidate (the end points have one neighbor),
   * strongest first.
   */
  public ImmutableList<PeriodogramPeak> peaks(double threshold) {
    List<PeriodogramPeak> result = new ArrayList<>();
    for (int i = 0; i < periods.length; i++) {
      double power = powers[i];
      if (!(power > threshold)) {
        continue;
      }
      boolean first = i == 0;
      boolean last = i == periods.length - 1;
      if ((first || power >= powers[i - 1]) && (last || power >= powers[i + 1])) {
        result.add(new PeriodogramPeak(periods[i], power,
            first ? periods[i] : periods[i - 1],
            last ? periods[i] : periods[i + 1]));
      }
    }
    result.sort(BY_POWER);
    return ImmutableList.copyOf(result);
  }
}
