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
package net.larse.seasonality.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import net.larse.seasonality.algorithms.SeasonalityAnalysis;

/**
 * Typed view of the "seasonality" configuration block. Defaults are in reference.conf; any key
 * can be overridden by application.conf or a system property, eg:
 * -Dseasonality.input.file=generation.csv
 */
public class AnalysisConfig {
  private final Config config;

  public AnalysisConfig() {
    this(ConfigFactory.load());
  }

  public AnalysisConfig(Config config) {
    this.config = config.getConfig("seasonality");
  }

  public int getPeriod() {
    return config.getInt("period");
  }

  public int getDominantCount() {
    return config.getInt("dominant-count");
  }

  public int getExportRows() {
    return config.getInt("export-rows");
  }

  /** Input CSV path, empty when synthetic data should be used. */
  public String getInputFile() {
    return config.getString("input.file");
  }

  public boolean hasInputFile() {
    return !getInputFile().trim().isEmpty();
  }

  public String getInputColumn() {
    return config.getString("input.column");
  }

  public String getInputDelimiter() {
    return config.getString("input.delimiter");
  }

  public String getOutputFile() {
    return config.getString("output.file");
  }

  public int getSyntheticHours() {
    return config.getInt("synthetic.hours");
  }

  public long getSyntheticSeed() {
    return config.getLong("synthetic.seed");
  }

  public SeasonalityAnalysis.Args toArgs() {
    SeasonalityAnalysis.Args args = new SeasonalityAnalysis.Args();
    args.period = getPeriod();
    args.dominantCount = getDominantCount();
    args.exportRows = getExportRows();
    return args;
  }
}
