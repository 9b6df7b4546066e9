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
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable parameters of a multi-period (MSTL) decomposition.  The periods
 * keep the order they were given in; results report one seasonal component
 * per period in that same order.
 */
public final class MSTLConfig {
  private final ImmutableList<Integer> periods;
  private final int iterations;
  private final boolean robust;

  private MSTLConfig(Builder builder) {
    this.periods = ImmutableList.copyOf(builder.periods);
    this.iterations = builder.iterations;
    this.robust = builder.robust;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableList<Integer> getPeriods() {
    return periods;
  }

  public int getIterations() {
    return iterations;
  }

  public boolean isRobust() {
    return robust;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("periods", periods)
        .add("iterations", iterations)
        .add("robust", robust)
        .toString();
  }

  public static final class Builder {
    private List<Integer> periods = ImmutableList.of();
    private int iterations = 2;
    private boolean robust = false;

    private Builder() {}

    public Builder periods(int... periods) {
      this.periods = Ints.asList(periods);
      return this;
    }

    public Builder periods(List<Integer> periods) {
      this.periods = periods;
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
     * @throws InvalidConfigurationException if no period is given, a period
     *     is below 2 or repeated, or iterations is not positive
     */
    public MSTLConfig build() {
      if (periods == null || periods.isEmpty()) {
        throw new InvalidConfigurationException("MSTL requires at least one seasonal period");
      }
      Set<Integer> seen = new HashSet<>();
      for (Integer period : periods) {
        if (period == null || period < 2) {
          throw new InvalidConfigurationException(
              "MSTL periods must be at least 2, got %s", period);
        }
        if (!seen.add(period)) {
          throw new InvalidConfigurationException("duplicate MSTL period %d", period);
        }
      }
      if (iterations < 1) {
        throw new InvalidConfigurationException(
            "iterations must be positive, got %d", iterations);
      }
      return new MSTLConfig(this);
    }
  }
}
