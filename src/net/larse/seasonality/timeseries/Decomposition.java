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
package net.larse.seasonality.timeseries;

import net.larse.seasonality.helper.SeriesHelper;

/**
 * The result of a seasonal decomposition: trend, seasonal and residual series, each aligned with
 * the original series, so that original[i] = trend[i] + seasonal[i] + residual[i].
 *
 * <p>The getters return copies.
 */
public final class Decomposition {
  private final double[] original;
  private final double[] trend;
  private final double[] seasonal;
  private final double[] residual;
  private final int period;

  Decomposition(double[] original, double[] trend, double[] seasonal, double[] residual,
      int period) {
    this.original = original.clone();
    this.trend = trend.clone();
    this.seasonal = seasonal.clone();
    this.residual = residual.clone();
    this.period = period;
  }

  public int size() {
    return original.length;
  }

  public int getPeriod() {
    return period;
  }

  public double[] getOriginal() {
    return original.clone();
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public double[] getSeasonal() {
    return seasonal.clone();
  }

  public double[] getResidual() {
    return residual.clone();
  }

  /**
   * meanSquare(seasonal) / (meanSquare(seasonal) + meanSquare(residual)).
   *
   * <p>Seasonal has zero mean, so its mean square is its variance. The residual mean is not
   * removed, so a residual with a non-zero mean lowers the score more than its variance alone
   * would. When both mean squares are zero (a flat input) the strength is 0.
   */
  public double getSeasonalityStrength() {
    double seasonalPower = SeriesHelper.meanSquare(seasonal);
    double residualPower = SeriesHelper.meanSquare(residual);
    double total = seasonalPower + residualPower;
    if (total == 0.0) {
      return 0.0;
    }
    return seasonalPower / total;
  }
}
