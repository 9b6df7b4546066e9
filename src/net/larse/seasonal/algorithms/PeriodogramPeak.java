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

/**
 * A local maximum of a periodogram.  The neighbor periods are the adjacent
 * candidates (the peak's own period at either end of the range).
 */
public final class PeriodogramPeak {
  private final int period;
  private final double power;
  private final int previousPeriod;
  private final int nextPeriod;

  public PeriodogramPeak(int period, double power, int previousPeriod, int nextPeriod) {
    this.period = period;
    this.power = power;
    this.previousPeriod = previousPeriod;
    this.nextPeriod = nextPeriod;
  }

  public int getPeriod() {
    return period;
  }

  public double getPower() {
    return power;
  }

  public int getPreviousPeriod() {
    return previousPeriod;
  }

  public int getNextPeriod() {
    return nextPeriod;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("period", period)
        .add("power", power)
        .add("previousPeriod", previousPeriod)
        .add("nextPeriod", nextPeriod)
        .toString();
  }
}
