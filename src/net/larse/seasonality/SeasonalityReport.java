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
package net.larse.seasonality;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.larse.seasonality.algorithms.DecompositionWriter;
import net.larse.seasonality.algorithms.SeasonalityAnalysis;
import net.larse.seasonality.config.AnalysisConfig;
import net.larse.seasonality.helper.CsvColumnReader;
import net.larse.seasonality.helper.SyntheticGeneration;
import net.larse.seasonality.timeseries.DominantFrequency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line report: dominant frequencies and seasonality strength of a generation series, and
 * a CSV export of the first rows of its decomposition.
 *
 * <p>Settings come from {@link AnalysisConfig}, eg:
 * <pre>
 *   java -Dseasonality.input.file=plant.csv -Dseasonality.input.column=cf \
 *       -jar energy-seasonality.jar
 * </pre>
 */
public class SeasonalityReport {
  private static final Logger logger = LoggerFactory.getLogger(SeasonalityReport.class);

  private final AnalysisConfig config;

  public SeasonalityReport(AnalysisConfig config) {
    this.config = config;
  }

  public SeasonalityAnalysis.Result run() throws IOException {
    double[] signal = loadSignal();

    SeasonalityAnalysis.Args args = config.toArgs();
    SeasonalityAnalysis.Result result = new SeasonalityAnalysis(args).getResult(signal);

    logger.info("Dominant frequencies:");
    int rank = 1;
    for (DominantFrequency frequency : result.dominantFrequencies) {
      logger.info(String.format("Frequency %d: %d (Period: %.1f samples, Magnitude: %.2f)",
          rank++, frequency.bin, frequency.getPeriod(signal.length), frequency.magnitude));
    }
    logger.info(String.format("Seasonality Strength: %.3f%%",
        result.getSeasonalityStrength() * 100));

    Path output = Paths.get(config.getOutputFile());
    DecompositionWriter writer = new DecompositionWriter(args.exportRows);
    writer.write(result.decomposition, output);
    logger.info("Exported {} rows to {}", writer.rowCount(result.decomposition), output);
    return result;
  }

  private double[] loadSignal() throws IOException {
    if (config.hasInputFile()) {
      Path input = Paths.get(config.getInputFile());
      double[] signal = new CsvColumnReader(config.getInputDelimiter())
          .read(input, config.getInputColumn());
      logger.info("Read {} samples of column {} from {}",
          signal.length, config.getInputColumn(), input);
      return signal;
    }
    double[] signal = SyntheticGeneration.hourlyCapacityFactor(
        config.getSyntheticHours(), config.getSyntheticSeed());
    logger.info("Generated {} hours of synthetic data", signal.length);
    return signal;
  }

  public static void main(String[] argv) {
    try {
      new SeasonalityReport(new AnalysisConfig()).run();
    } catch (IOException | RuntimeException e) {
      logger.error("Seasonality report failed", e);
      System.exit(1);
    }
  }
}
