package net.larse.seasonal.helper;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ArrayHelperTest {
  @Test
  public void testMovingAverage() {
    double[] ma = ArrayHelper.movingAverage(new double[] {1, 2, 3, 4, 5}, 3);
    assertArrayEquals(new double[] {2, 3, 4}, ma, 1e-12);
  }

  @Test
  public void testSumExcept() {
    ImmutableList<double[]> parts = ImmutableList.of(
        new double[] {1, 1}, new double[] {2, 2}, new double[] {4, 4});
    assertArrayEquals(new double[] {7, 7}, ArrayHelper.sumExcept(parts, -1, 2), 0.0);
    assertArrayEquals(new double[] {5, 5}, ArrayHelper.sumExcept(parts, 1, 2), 0.0);
    assertArrayEquals(new double[] {0, 0, 0},
        ArrayHelper.sumExcept(ImmutableList.<double[]>of(), -1, 3), 0.0);
  }

  @Test
  public void testNextOdd() {
    assertEquals(13, ArrayHelper.nextOdd(12));
    assertEquals(13, ArrayHelper.nextOdd(13));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSubtractRejectsLengthMismatch() {
    ArrayHelper.subtract(new double[2], new double[3]);
  }
}
