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
package net.larse.seasonality.algorithms;

import com.google.common.base.Preconditions;
import java.util.List;
import net.larse.seasonality.timeseries.Decomposition;
import net.larse.seasonality.timeseries.DominantFrequency;
import net.larse.seasonality.timeseries.SeasonalDecomposition;
import net.larse.seasonality.timeseries.SpectralTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seasonality analysis of a generation series: the dominant frequencies of the raw series, and a
 * trend / seasonal / residual decomposition with its seasonality strength.
 */
public final class SeasonalityAnalysis {
  private static final Logger logger = LoggerFactory.getLogger(SeasonalityAnalysis.class);

  public static class Args {
    // Samples per cycle, eg: 24 for hourly data with a daily cycle.
    public int period = 24;

    // Number of dominant frequencies to report for the raw series.
    public int dominantCount = 5;

    // Number of leading rows to export.
    public int exportRows = 168;
  }

  /** Output of a single run. */
  public static class Result {
    /**
     * Strongest non-DC bins of the raw series, strongest first.
     */
    public final List<DominantFrequency> dominantFrequencies;

    /**
     * The padded transform length the bins refer to.
     */
    public final int transformLength;

    public final Decomposition decomposition;

    public Result(List<DominantFrequency> dominantFrequencies, int transformLength,
        Decomposition decomposition) {
      this.dominantFrequencies = dominantFrequencies;
      this.transformLength = transformLength;
      this.decomposition = decomposition;
    }

    public double getSeasonalityStrength() {
      return decomposition.getSeasonalityStrength();
    }
  }

  private final Args args;

  public SeasonalityAnalysis() {
    this(new Args());
  }

  public SeasonalityAnalysis(Args args) {
    Preconditions.checkArgument(args.period > 0, "period must be positive: %s", args.period);
    Preconditions.checkArgument(args.dominantCount >= 0,
        "dominantCount must not be negative: %s", args.dominantCount);
    Preconditions.checkArgument(args.exportRows >= 0,
        "exportRows must not be negative: %s", args.exportRows);
    this.args = args;
  }

  public Args getArgs() {
    return args;
  }

  /**
   * Run the analysis over signal. Both the transform and the decomposition check the signal before
   * doing any work, so an invalid signal fails before anything is computed.
   */
  public Result getResult(double[] signal) {
    SpectralTransform transform = new SpectralTransform(signal);
    SeasonalDecomposition decomposition = new SeasonalDecomposition(signal, args.period);

    logger.debug("Transforming {} samples (padded to {})",
        signal.length, transform.getTransformLength());
    transform.compute();
    List<DominantFrequency> dominant = transform.getDominantFrequencies(args.dominantCount);

    logger.debug("Decomposing with period {}", args.period);
    Decomposition result = decomposition.decompose();

    logger.info("Analysed {} samples: {} dominant frequencies, seasonality strength {}",
        signal.length, dominant.size(), String.format("%.4f", result.getSeasonalityStrength()));
    return new Result(dominant, transform.getTransformLength(), result);
  }
}
