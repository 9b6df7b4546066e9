package net.larse.seasonal.algorithms;

import com.google.common.collect.ImmutableList;
import net.larse.seasonal.timeseries.InvalidConfigurationException;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SeasonalityDetectorTest {
  static double[] sine(int n, int period, double amplitude) {
    double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      y[i] = amplitude * Math.sin(2 * Math.PI * i / period);
    }
    return y;
  }

  @Test
  public void testDetectsSinglePeriod() {
    SeasonalityDetector detector =
        SeasonalityDetector.builder().minPeriod(2).threshold(0.6).build();
    ImmutableList<Integer> periods = detector.detect(sine(72, 12, 1.0), 5);
    assertTrue(periods.toString(), periods.contains(12));
    assertEquals(Integer.valueOf(12), periods.get(0));
  }

  @Test
  public void testDetectsPeriodOnHighLevel() {
    double[] y = sine(72, 12, 0.5);
    for (int i = 0; i < y.length; i++) {
      y[i] += 1e6;
    }
    SeasonalityDetector detector =
        SeasonalityDetector.builder().minPeriod(2).threshold(0.6).build();
    Periodogram periodogram = detector.periodogram(y);
    assertEquals(35, periodogram.size());
    assertEquals(1.0, periodogram.powerOf(12).getAsDouble(), 1e-6);
    assertEquals(ImmutableList.of(12), detector.detect(y, 5));
  }

  @Test
  public void testConstantHighLevelHasNoPeriods() {
    double[] y = new double[72];
    Arrays.fill(y, 1e6);
    assertTrue(SeasonalityDetector.builder().build().periodogram(y).isEmpty());
  }

  @Test
  public void testPowerOfExactPeriod() {
    Periodogram periodogram = SeasonalityDetector.builder().build().periodogram(sine(72, 12, 3.0));
    assertEquals(1.0, periodogram.powerOf(12).getAsDouble(), 1e-9);
    assertTrue(periodogram.powerOf(11).getAsDouble() < 1.0);
    assertTrue(periodogram.powerOf(24).getAsDouble() < 0.01);
  }

  @Test
  public void testPowersAreBounded() {
    double[] y = sine(60, 7, 1.0);
    for (int i = 0; i < y.length; i++) {
      y[i] += 0.05 * i + ((i * 37) % 11 - 5) * 0.1;
    }
    for (double power : SeasonalityDetector.builder().build().periodogram(y).getPowers()) {
      assertTrue(power >= 0.0 && power <= 1.0);
    }
  }

  @Test
  public void testDefaultCandidateRange() {
    Periodogram periodogram = SeasonalityDetector.builder().build().periodogram(sine(72, 12, 1.0));
    assertEquals(35, periodogram.size());
    assertEquals(2, periodogram.getPeriod(0));
    assertEquals(36, periodogram.getPeriod(34));
  }

  @Test
  public void testConfiguredMaxPeriod() {
    SeasonalityDetector detector = SeasonalityDetector.builder().minPeriod(3).maxPeriod(10).build();
    assertEquals(10, detector.resolveMaxPeriod(1000));
    assertEquals(8, detector.periodogram(sine(72, 12, 1.0)).size());
  }

  @Test
  public void testAlternatingSeries() {
    double[] y = new double[20];
    for (int i = 0; i < y.length; i++) {
      y[i] = i % 2 == 0 ? 1.0 : -1.0;
    }
    Periodogram periodogram = SeasonalityDetector.builder().build().periodogram(y);
    assertEquals(1.0, periodogram.powerOf(2).getAsDouble(), 1e-6);
    assertEquals(ImmutableList.of(2), SeasonalityDetector.builder().build().detect(y, 1));
  }

  @Test
  public void testConstantSeriesHasNoPeriods() {
    double[] y = new double[50];
    Arrays.fill(y, 4.2);
    SeasonalityDetector detector = SeasonalityDetector.builder().build();
    assertTrue(detector.periodogram(y).isEmpty());
    assertTrue(detector.detect(y).isEmpty());
  }

  @Test
  public void testShortSeriesHasNoPeriods() {
    SeasonalityDetector detector = SeasonalityDetector.builder().minPeriod(4).build();
    assertTrue(detector.periodogram(new double[] {1, 2, 3, 1, 2, 3, 1}).isEmpty());
  }

  @Test
  public void testMaxPeaksLimitsResult() {
    double[] y = sine(168, 7, 1.0);
    double[] slow = sine(168, 12, 0.8);
    for (int i = 0; i < y.length; i++) {
      y[i] += slow[i];
    }
    SeasonalityDetector detector = SeasonalityDetector.builder().threshold(0.2).build();
    assertEquals(ImmutableList.of(7), detector.detect(y, 1));
    assertTrue(detector.detect(y, 3).contains(12));
    assertTrue(detector.detect(y, 0).isEmpty());
  }

  @Test
  public void testAutocorrelationMethod() {
    SeasonalityDetector detector = SeasonalityDetector.builder()
        .threshold(0.6)
        .method(PeriodMethod.AUTOCORRELATION)
        .build();
    // lags 12, 24 and 36 all correlate perfectly with a pure cycle
    ImmutableList<Integer> periods = detector.detect(sine(72, 12, 1.0), 5);
    assertTrue(periods.toString(), periods.contains(12));
    assertTrue(periods.toString(), !periods.contains(6));
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testMinPeriodBelowTwo() {
    SeasonalityDetector.builder().minPeriod(1).build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testMaxPeriodBelowMinPeriod() {
    SeasonalityDetector.builder().minPeriod(6).maxPeriod(5).build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testZeroThreshold() {
    SeasonalityDetector.builder().threshold(0.0).build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testThresholdAboveOne() {
    SeasonalityDetector.builder().threshold(1.5).build();
  }
}
