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

import com.google.common.base.Preconditions;
import java.util.List;
import net.larse.seasonality.helper.SeriesHelper;
import org.apache.commons.math.stat.StatUtils;

/**
 * Splits a series into trend, seasonal and residual components.
 *
 * <ul>
 *   <li>trend: centered moving average over period/2 samples each side, truncated at the ends.
 *   <li>seasonal: the three strongest non-DC bins of the detrended series, rebuilt as cosines and
 *       shifted to zero mean.
 *   <li>residual: whatever remains.
 * </ul>
 *
 * The stages run in that order and each needs the previous one. Calling a stage out of order is
 * an IllegalStateException. decompose() runs the remaining stages and returns the result.
 *
 * <p>Rebuilt cosine amplitudes are magnitude / n, where n is the unpadded length, while the
 * magnitudes come from a transform over the padded length N. This normalization and the cosine
 * only (zero phase) rebuild are kept as is so that results match existing outputs; do not change
 * one without the other.
 */
public class SeasonalDecomposition {
  /** Number of dominant frequencies used to rebuild the seasonal component. */
  public static final int SEASONAL_FREQUENCIES = 3;

  enum Stage {
    UNINITIALIZED,
    TREND_COMPUTED,
    SEASONAL_COMPUTED,
    COMPLETE
  }

  private final double[] original;
  private final int period;

  private double[] trend;
  private double[] seasonal;
  private double[] residual;
  private Stage stage = Stage.UNINITIALIZED;
  private Decomposition result;

  /**
   * @param signal the series to decompose, non-empty and finite. It is copied.
   * @param period samples per cycle, eg: 24 for hourly data with a daily cycle.
   */
  public SeasonalDecomposition(double[] signal, int period) {
    SeriesHelper.checkSignal(signal);
    Preconditions.checkArgument(period > 0, "period must be positive: %s", period);
    this.original = signal.clone();
    this.period = period;
  }

  /** Decompose signal in one call. */
  public static Decomposition of(double[] signal, int period) {
    return new SeasonalDecomposition(signal, period).decompose();
  }

  public int getPeriod() {
    return period;
  }

  Stage getStage() {
    return stage;
  }

  /** Run every stage that has not run yet and return the decomposition. */
  public Decomposition decompose() {
    if (stage == Stage.UNINITIALIZED) {
      extractTrend();
    }
    if (stage == Stage.TREND_COMPUTED) {
      extractSeasonal();
    }
    if (stage == Stage.SEASONAL_COMPUTED) {
      extractResidual();
    }
    return result;
  }

  /**
   * trend[i] = mean(original[j]) for j in [i - period/2, i + period/2] clipped to the series. Near
   * the ends the window simply holds fewer samples; nothing is padded or wrapped.
   */
  public void extractTrend() {
    Preconditions.checkState(stage == Stage.UNINITIALIZED, "trend already extracted");
    int n = original.length;
    int halfWindow = period / 2;

    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      int start = Math.max(0, i - halfWindow);
      int end = Math.min(n - 1, i + halfWindow);
      values[i] = SeriesHelper.windowMean(original, start, end);
    }

    trend = values;
    stage = Stage.TREND_COMPUTED;
  }

  /**
   * Transform the detrended series, keep the three strongest bins and rebuild
   * seasonal[i] = sum(magnitude / n * cos(2 * pi * bin * i / n)), then remove its mean.
   */
  public void extractSeasonal() {
    Preconditions.checkState(stage == Stage.TREND_COMPUTED,
        "seasonal extraction needs the trend and runs once, stage is %s", stage);
    int n = original.length;

    double[] detrended = new double[n];
    for (int i = 0; i < n; i++) {
      detrended[i] = original[i] - trend[i];
    }

    SpectralTransform transform = new SpectralTransform(detrended);
    transform.compute();
    List<DominantFrequency> dominant = transform.getDominantFrequencies(SEASONAL_FREQUENCIES);

    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      double sum = 0.0;
      for (DominantFrequency frequency : dominant) {
        double amplitude = frequency.magnitude / n;
        sum += amplitude * Math.cos(2 * Math.PI * frequency.bin * i / n);
      }
      values[i] = sum;
    }

    double mean = StatUtils.mean(values);
    for (int i = 0; i < n; i++) {
      values[i] -= mean;
    }

    seasonal = values;
    stage = Stage.SEASONAL_COMPUTED;
  }

  /** residual[i] = original[i] - trend[i] - seasonal[i]. */
  public void extractResidual() {
    Preconditions.checkState(stage == Stage.SEASONAL_COMPUTED,
        "residual extraction needs trend and seasonal and runs once, stage is %s", stage);
    int n = original.length;

    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = original[i] - trend[i] - seasonal[i];
    }

    residual = values;
    result = new Decomposition(original, trend, seasonal, residual, period);
    stage = Stage.COMPLETE;
  }

  public double[] getOriginal() {
    return original.clone();
  }

  public double[] getTrend() {
    Preconditions.checkState(stage != Stage.UNINITIALIZED, "trend has not been extracted");
    return trend.clone();
  }

  public double[] getSeasonal() {
    Preconditions.checkState(stage == Stage.SEASONAL_COMPUTED || stage == Stage.COMPLETE,
        "seasonal component has not been extracted");
    return seasonal.clone();
  }

  public double[] getResidual() {
    Preconditions.checkState(stage == Stage.COMPLETE, "residual has not been extracted");
    return residual.clone();
  }

  /** See Decomposition.getSeasonalityStrength(). */
  public double getSeasonalityStrength() {
    Preconditions.checkState(stage == Stage.COMPLETE, "decomposition has not completed");
    return result.getSeasonalityStrength();
  }
}
