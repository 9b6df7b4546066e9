package net.larse.seasonal.timeseries;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class STLConfigTest {
  @Test
  public void testDefaults() {
    STLConfig config = STLConfig.builder().build();
    assertEquals(12, config.getPeriod());
    assertEquals(7, config.getSeasonalSmoother());
    // ceil(1.5 * 12 / (1 - 1.5 / 7)) = 23
    assertEquals(23, config.getTrendSmoother());
    assertEquals(13, config.getLowPassSmoother());
    assertEquals(2, config.getIterations());
    assertFalse(config.isRobust());
  }

  @Test
  public void testDerivedSpansFollowThePeriod() {
    STLConfig config = STLConfig.forPeriod(7);
    assertEquals(9, config.getLowPassSmoother());
    assertEquals(1, config.getTrendSmoother() % 2);
  }

  @Test
  public void testToBuilderRoundTrip() {
    STLConfig config = STLConfig.builder().period(5).seasonalSmoother(9).trendSmoother(11)
        .iterations(3).robust(true).build();
    STLConfig copy = config.toBuilder().build();
    assertEquals(config.toString(), copy.toString());
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testPeriodBelowTwo() {
    STLConfig.builder().period(1).build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testEvenSeasonalSmoother() {
    STLConfig.builder().seasonalSmoother(8).build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testTinySeasonalSmoother() {
    STLConfig.builder().seasonalSmoother(1).build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testEvenTrendSmoother() {
    STLConfig.builder().period(4).trendSmoother(10).build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testTrendSmootherNotLongerThanPeriod() {
    STLConfig.builder().period(12).trendSmoother(11).build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testNonPositiveTrendSmoother() {
    STLConfig.builder().period(2).trendSmoother(-3).build();
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testZeroIterations() {
    STLConfig.builder().iterations(0).build();
  }
}
