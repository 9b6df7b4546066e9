package net.larse.seasonal.helper;

import net.larse.seasonal.timeseries.InvalidConfigurationException;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LoessSmootherTest {
  private static final double EPS = 1e-9;

  @Test
  public void testLineIsReproducedIncludingEnds() {
    double[] y = new double[20];
    for (int i = 0; i < y.length; i++) {
      y[i] = 2.0 * i + 1.0;
    }
    double[] smoothed = new LoessSmoother(5).smooth(y);
    assertArrayEquals(y, smoothed, EPS);
  }

  @Test
  public void testFitAtExtrapolatesBeyondTheData() {
    double[] x = {0, 1, 2, 3, 4, 5};
    double[] y = {1, 3, 5, 7, 9, 11};
    LoessSmoother smoother = new LoessSmoother(4);
    assertEquals(-1.0, smoother.fitAt(x, y, null, -1), EPS);
    assertEquals(13.0, smoother.fitAt(x, y, null, 6), EPS);
  }

  @Test
  public void testConstantSeriesStaysConstant() {
    double[] y = new double[15];
    Arrays.fill(y, 3.25);
    assertArrayEquals(y, new LoessSmoother(7).smooth(y), EPS);
  }

  @Test
  public void testSmoothingReducesNoise() {
    java.util.Random random = new java.util.Random(7);
    double[] y = new double[200];
    for (int i = 0; i < y.length; i++) {
      y[i] = random.nextGaussian();
    }
    double[] smoothed = new LoessSmoother(31).smooth(y);
    assertTrue(SeriesStatistics.variance(smoothed) < 0.5 * SeriesStatistics.variance(y));
  }

  @Test
  public void testZeroRobustnessWeightIgnoresOutlier() {
    double[] y = new double[11];
    y[5] = 10.0;
    double[] weights = new double[11];
    Arrays.fill(weights, 1.0);
    weights[5] = 0.0;

    double[] smoothed = new LoessSmoother(5).smooth(y, weights);
    assertEquals(0.0, smoothed[5], EPS);
    // without the weights the spike leaks into the fit
    assertTrue(new LoessSmoother(5).smooth(y)[5] > 1.0);
  }

  @Test
  public void testAllZeroWeightsFallBackToKernelWeights() {
    double[] y = {1, 4, 2, 8, 5};
    double[] weights = new double[5];
    LoessSmoother smoother = new LoessSmoother(3);
    assertArrayEquals(smoother.smooth(y), smoother.smooth(y, weights), EPS);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testSpanBelowTwoIsRejected() {
    new LoessSmoother(1);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testSpanLongerThanDataIsRejected() {
    new LoessSmoother(9).smooth(new double[] {1, 2, 3, 4});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMismatchedWeightsAreRejected() {
    new LoessSmoother(3).smooth(new double[] {1, 2, 3, 4}, new double[] {1, 1});
  }
}
