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
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.larse.seasonality.timeseries.Decomposition;

/**
 * Writes the leading rows of a decomposition as CSV:
 * <pre>
 *   Hour,Original,Trend,Seasonal,Residual
 *   0,0.21,0.34,-0.12,-0.01
 *   ...
 * </pre>
 */
public class DecompositionWriter {
  static final String HEADER = "Hour,Original,Trend,Seasonal,Residual";

  private final int maxRows;

  public DecompositionWriter(int maxRows) {
    Preconditions.checkArgument(maxRows >= 0, "maxRows must not be negative: %s", maxRows);
    this.maxRows = maxRows;
  }

  /** Number of rows write() produces for decomposition, excluding the header. */
  public int rowCount(Decomposition decomposition) {
    return Math.min(maxRows, decomposition.size());
  }

  public void write(Decomposition decomposition, Path file) throws IOException {
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      write(decomposition, writer);
    }
  }

  /** Write to out, which is flushed but not closed. */
  public void write(Decomposition decomposition, Writer out) throws IOException {
    BufferedWriter writer = out instanceof BufferedWriter ? (BufferedWriter) out
        : new BufferedWriter(out);

    double[] original = decomposition.getOriginal();
    double[] trend = decomposition.getTrend();
    double[] seasonal = decomposition.getSeasonal();
    double[] residual = decomposition.getResidual();

    writer.write(HEADER);
    writer.newLine();
    int rows = rowCount(decomposition);
    for (int i = 0; i < rows; i++) {
      writer.write(i + "," + original[i] + "," + trend[i] + "," + seasonal[i] + ","
          + residual[i]);
      writer.newLine();
    }
    writer.flush();
  }
}
