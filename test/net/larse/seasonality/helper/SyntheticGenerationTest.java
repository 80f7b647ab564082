package net.larse.seasonality.helper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.junit.Test;

public class SyntheticGenerationTest {

  @Test
  public void testSameSeedSameSeries() {
    double[] a = SyntheticGeneration.hourlyCapacityFactor(500, 42L);
    double[] b = SyntheticGeneration.hourlyCapacityFactor(500, 42L);
    double[] c = SyntheticGeneration.hourlyCapacityFactor(500, 43L);

    assertEquals(500, a.length);
    assertArrayEquals(a, b, 0.0);
    assertFalse(Arrays.equals(a, c));
  }

  @Test
  public void testValueRanges() {
    double[] x = SyntheticGeneration.hourlyCapacityFactor(24 * 90, 1L);
    for (int i = 0; i < x.length; i++) {
      assertTrue("value out of range at " + i + ": " + x[i], x[i] >= -0.05 && x[i] <= 1.05);
    }
  }

  @Test
  public void testDailyShape() {
    double[] x = SyntheticGeneration.hourlyCapacityFactor(24, 5L);
    // day 0 has no annual term; night is the base level plus noise, noon adds the full peak.
    assertEquals(0.2, x[0], 0.05);
    assertEquals(0.2, x[3], 0.05);
    assertEquals(0.8, x[12], 0.05);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoHours() {
    SyntheticGeneration.hourlyCapacityFactor(0, 1L);
  }
}
