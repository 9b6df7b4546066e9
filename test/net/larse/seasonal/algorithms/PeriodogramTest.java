package net.larse.seasonal.algorithms;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PeriodogramTest {
  @Test
  public void testSinglePeak() {
    Periodogram periodogram =
        new Periodogram(new int[] {2, 3, 4, 5}, new double[] {0.1, 0.4, 0.8, 0.2});
    ImmutableList<PeriodogramPeak> peaks = periodogram.peaks(0.5);

    assertEquals(1, peaks.size());
    PeriodogramPeak peak = peaks.get(0);
    assertEquals(4, peak.getPeriod());
    assertEquals(0.8, peak.getPower(), 0.0);
    assertEquals(3, peak.getPreviousPeriod());
    assertEquals(5, peak.getNextPeriod());
  }

  @Test
  public void testEndPointPeaks() {
    Periodogram periodogram =
        new Periodogram(new int[] {2, 3, 4}, new double[] {0.9, 0.3, 0.6});
    ImmutableList<PeriodogramPeak> peaks = periodogram.peaks(0.5);

    assertEquals(2, peaks.size());
    assertEquals(2, peaks.get(0).getPeriod());
    assertEquals(2, peaks.get(0).getPreviousPeriod());
    assertEquals(3, peaks.get(0).getNextPeriod());
    assertEquals(4, peaks.get(1).getPeriod());
    assertEquals(3, peaks.get(1).getPreviousPeriod());
    assertEquals(4, peaks.get(1).getNextPeriod());
  }

  @Test
  public void testPeaksOrderedByPowerThenPeriod() {
    Periodogram periodogram = new Periodogram(
        new int[] {2, 3, 4, 5, 6}, new double[] {0.7, 0.1, 0.9, 0.1, 0.9});
    ImmutableList<PeriodogramPeak> peaks = periodogram.peaks(0.5);

    assertEquals(3, peaks.size());
    assertEquals(4, peaks.get(0).getPeriod());
    assertEquals(6, peaks.get(1).getPeriod());
    assertEquals(2, peaks.get(2).getPeriod());
  }

  @Test
  public void testThresholdIsExclusive() {
    Periodogram periodogram = new Periodogram(new int[] {2, 3, 4}, new double[] {0.1, 0.5, 0.1});
    assertTrue(periodogram.peaks(0.5).isEmpty());
    assertEquals(1, periodogram.peaks(0.49).size());
  }

  @Test
  public void testPlateauReportsEveryPoint() {
    Periodogram periodogram = new Periodogram(new int[] {2, 3, 4}, new double[] {0.8, 0.8, 0.1});
    ImmutableList<PeriodogramPeak> peaks = periodogram.peaks(0.5);
    assertEquals(2, peaks.size());
    assertEquals(2, peaks.get(0).getPeriod());
  }

  @Test
  public void testEmpty() {
    Periodogram empty = Periodogram.empty();
    assertTrue(empty.isEmpty());
    assertEquals(0, empty.size());
    assertTrue(empty.peaks(0.1).isEmpty());
  }

  @Test
  public void testPowerOf() {
    Periodogram periodogram = new Periodogram(new int[] {2, 3}, new double[] {0.25, 0.75});
    assertEquals(0.75, periodogram.powerOf(3).getAsDouble(), 0.0);
    assertFalse(periodogram.powerOf(7).isPresent());
    assertFalse(periodogram.isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLengthMismatch() {
    new Periodogram(new int[] {2, 3}, new double[] {0.5});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPeriodsMustIncrease() {
    new Periodogram(new int[] {3, 3}, new double[] {0.5, 0.5});
  }
}
