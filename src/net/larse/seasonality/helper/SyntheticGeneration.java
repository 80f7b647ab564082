/*
 * Copyright (c) 2015 LCMS Project Authors.
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
package net.larse.seasonality.helper;

import com.google.common.base.Preconditions;
import org.apache.commons.math.random.JDKRandomGenerator;
import org.apache.commons.math.random.RandomGenerator;

/**
 * Synthetic hourly capacity factor series, used when no measured data is supplied.
 */
public class SyntheticGeneration {
  private static final int HOURS_PER_DAY = 24;
  private static final double DAYS_PER_YEAR = 365.0;

  // Solar-like daily shape: zero at night, peak of DAILY_AMPLITUDE at noon.
  private static final double DAILY_AMPLITUDE = 0.6;
  private static final double ANNUAL_AMPLITUDE = 0.2;
  private static final double NOISE_RANGE = 0.1;
  private static final double BASE_LEVEL = 0.2;

  private SyntheticGeneration() {}

  /**
   * value[i] = max(0, sin((hour - 6) * pi / 12)) * 0.6 + 0.2 * sin(2 * pi * day / 365)
   *            + (u - 0.5) * 0.1 + 0.2
   *
   * where hour = i % 24, day = i / 24 and u is uniform in [0, 1).
   *
   * @param hours number of hourly samples, at least 1
   * @param seed seed of the noise generator, the same seed gives the same series
   */
  public static double[] hourlyCapacityFactor(int hours, long seed) {
    Preconditions.checkArgument(hours >= 1, "hours must be positive: %s", hours);
    RandomGenerator random = new JDKRandomGenerator();
    random.setSeed(seed);

    double[] data = new double[hours];
    for (int i = 0; i < hours; i++) {
      int hour = i % HOURS_PER_DAY;
      int day = i / HOURS_PER_DAY;

      double solar = Math.max(0.0, Math.sin((hour - 6) * Math.PI / 12)) * DAILY_AMPLITUDE;
      double annual = ANNUAL_AMPLITUDE * Math.sin(2 * Math.PI * day / DAYS_PER_YEAR);
      double noise = (random.nextDouble() - 0.5) * NOISE_RANGE;

      data[i] = solar + annual + noise + BASE_LEVEL;
    }
    return data;
  }
}
