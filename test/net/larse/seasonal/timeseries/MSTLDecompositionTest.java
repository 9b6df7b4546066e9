package net.larse.seasonal.timeseries;

import net.larse.seasonal.helper.SeriesStatistics;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MSTLDecompositionTest {
  double[] y;

  @Before
  public void setUp() throws Exception {
    y = new double[140];
    for (int i = 0; i < y.length; i++) {
      y[i] = 0.02 * i
          + Math.sin(2 * Math.PI * i / 7)
          + 0.5 * Math.sin(2 * Math.PI * i / 12);
    }
  }

  static void assertReconstructs(double[] y, MSTLResult result) {
    double[] trend = result.getTrend();
    List<double[]> seasonals = result.getSeasonals();
    double[] remainder = result.getRemainder();
    for (int i = 0; i < y.length; i++) {
      double sum = trend[i] + remainder[i];
      for (double[] seasonal : seasonals) {
        sum += seasonal[i];
      }
      assertEquals("index " + i, y[i], sum, 1e-9);
    }
  }

  @Test
  public void testTwoSeasonalities() {
    MSTLConfig config = MSTLConfig.builder().periods(7, 12).build();
    MSTLResult result = new MSTLDecomposition(config).fit(y);

    assertEquals(2, result.getSeasonals().size());
    assertEquals(140, result.getTrend().length);
    assertEquals(140, result.getSeasonal(0).length);
    assertEquals(140, result.getSeasonal(1).length);
    assertEquals(140, result.getRemainder().length);

    double rms = SeriesStatistics.rms(result.getRemainder());
    assertTrue("remainder rms " + rms, rms < 0.3);
    assertReconstructs(y, result);
  }

  @Test
  public void testComponentsFollowConfiguredOrder() {
    MSTLResult result = MSTLDecomposition.decompose(MSTLConfig.builder().periods(12, 7).build(), y);
    assertEquals(Integer.valueOf(12), result.getPeriods().get(0));
    // the period-7 cycle has twice the amplitude of the period-12 one
    double amplitude7 = Math.sqrt(SeriesStatistics.variance(result.getSeasonalForPeriod(7)));
    double amplitude12 = Math.sqrt(SeriesStatistics.variance(result.getSeasonalForPeriod(12)));
    assertTrue(amplitude7 > amplitude12);
    assertArrayEquals(result.getSeasonal(1), result.getSeasonalForPeriod(7), 0.0);
  }

  @Test
  public void testStrengths() {
    MSTLResult result = MSTLDecomposition.decompose(MSTLConfig.builder().periods(7, 12).build(), y);
    assertTrue(result.getSeasonalStrength() > 0.9);
    assertTrue(result.getSeasonalStrength() <= 1.0);
    assertTrue(result.getTrendStrength() >= 0.0 && result.getTrendStrength() <= 1.0);
  }

  @Test
  public void testRobustReconstruction() {
    double[] spiked = y.clone();
    spiked[33] += 10;
    MSTLConfig config = MSTLConfig.builder().periods(7, 12).iterations(3).robust(true).build();
    assertReconstructs(spiked, MSTLDecomposition.decompose(config, spiked));
  }

  @Test
  public void testDeterminism() {
    MSTLDecomposition mstl = new MSTLDecomposition(MSTLConfig.builder().periods(7, 12).build());
    MSTLResult first = mstl.fit(y);
    MSTLResult second = mstl.fit(y);
    assertArrayEquals(first.getTrend(), second.getTrend(), 0.0);
    assertArrayEquals(first.getSeasonal(0), second.getSeasonal(0), 0.0);
    assertArrayEquals(first.getSeasonal(1), second.getSeasonal(1), 0.0);
    assertArrayEquals(first.getRemainder(), second.getRemainder(), 0.0);
  }

  @Test
  public void testSinglePeriod() {
    MSTLResult result = MSTLDecomposition.decompose(MSTLConfig.builder().periods(7).build(), y);
    assertEquals(1, result.getSeasonals().size());
    assertReconstructs(y, result);
  }

  @Test
  public void testPeriodTooLongForSeriesStaysZero() {
    double[] shortSeries = new double[30];
    System.arraycopy(y, 0, shortSeries, 0, 30);
    MSTLResult result = MSTLDecomposition.decompose(MSTLConfig.builder().periods(7, 20).build(),
        shortSeries);
    assertArrayEquals(new double[30], result.getSeasonal(1), 0.0);
    assertTrue(SeriesStatistics.variance(result.getSeasonal(0)) > 0.1);
    assertReconstructs(shortSeries, result);
  }

  @Test
  public void testInsufficientData() {
    try {
      MSTLDecomposition.decompose(MSTLConfig.builder().periods(7, 12).build(), new double[10]);
      fail("expected InsufficientDataException");
    } catch (InsufficientDataException e) {
      assertEquals(14, e.getRequired());
    }
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testPeriodBelowTwo() {
    MSTLConfig.builder().periods(1).build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testDuplicatePeriods() {
    MSTLConfig.builder().periods(7, 12, 7).build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testNoPeriods() {
    MSTLConfig.builder().build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testZeroIterations() {
    MSTLConfig.builder().periods(7).iterations(0).build();
  }

  @Test
  public void testInnerConfigSpans() {
    STLConfig first = MSTLDecomposition.innerConfig(7, 0, false);
    STLConfig second = MSTLDecomposition.innerConfig(12, 1, true);
    assertEquals(11, first.getSeasonalSmoother());
    assertEquals(15, second.getSeasonalSmoother());
    assertEquals(21, first.getTrendSmoother());
    assertEquals(37, second.getTrendSmoother());
    assertTrue(second.isRobust());
  }
}
