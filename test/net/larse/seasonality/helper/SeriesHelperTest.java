package net.larse.seasonality.helper;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class SeriesHelperTest {

  @Test
  public void testNextPowerOfTwo() {
    assertEquals(1, SeriesHelper.nextPowerOfTwo(1));
    assertEquals(2, SeriesHelper.nextPowerOfTwo(2));
    assertEquals(4, SeriesHelper.nextPowerOfTwo(3));
    assertEquals(64, SeriesHelper.nextPowerOfTwo(48));
    assertEquals(64, SeriesHelper.nextPowerOfTwo(64));
    assertEquals(128, SeriesHelper.nextPowerOfTwo(65));
    assertEquals(4096, SeriesHelper.nextPowerOfTwo(2160));
  }

  @Test
  public void testIsPowerOfTwo() {
    assertTrue(SeriesHelper.isPowerOfTwo(1));
    assertTrue(SeriesHelper.isPowerOfTwo(1024));
    assertFalse(SeriesHelper.isPowerOfTwo(0));
    assertFalse(SeriesHelper.isPowerOfTwo(6));
    assertFalse(SeriesHelper.isPowerOfTwo(-8));
  }

  @Test
  public void testMeanSquareKeepsTheMean() {
    // variance would be 0 here
    assertEquals(4.0, SeriesHelper.meanSquare(new double[] {2, 2, 2}), 1e-12);
    assertEquals(2.5, SeriesHelper.meanSquare(new double[] {1, -2}), 1e-12);
    assertEquals(0.0, SeriesHelper.meanSquare(new double[0]), 0.0);
  }

  @Test
  public void testWindowMean() {
    double[] x = {1, 2, 3, 4, 5};
    assertEquals(1.5, SeriesHelper.windowMean(x, 0, 1), 1e-12);
    assertEquals(3.0, SeriesHelper.windowMean(x, 0, 4), 1e-12);
    assertEquals(5.0, SeriesHelper.windowMean(x, 4, 4), 1e-12);
  }

  @Test
  public void testCheckSignalReturnsInput() {
    double[] x = {0.1, 0.2};
    assertSame(x, SeriesHelper.checkSignal(x));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckSignalNull() {
    SeriesHelper.checkSignal(null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckSignalNaN() {
    SeriesHelper.checkSignal(new double[] {0.1, Double.NaN});
  }

  @Test
  public void testCheckSignalNamesSample() {
    try {
      SeriesHelper.checkSignal(new double[] {0.1, 0.2, Double.POSITIVE_INFINITY});
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertEquals("signal sample 2 is not finite: Infinity", e.getMessage());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNextPowerOfTwoOfZero() {
    SeriesHelper.nextPowerOfTwo(0);
  }
}
