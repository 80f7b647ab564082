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
import com.google.common.primitives.Doubles;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.regex.Pattern;
import org.apache.commons.lang3.ArrayUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one named column of a delimited text file as a series of doubles.
 *
 * <p>The first line is the header and is used to find the column position; names are matched
 * exactly, surrounding whitespace included. Every following line contributes the cell at that
 * position. Empty cells and cells that are not finite numbers become 0.0 rather than failing the
 * read. A single delimiter at the end of a line does not start another cell. Blank lines and lines
 * with too few cells contribute nothing.
 */
public class CsvColumnReader {
  private static final Logger logger = LoggerFactory.getLogger(CsvColumnReader.class);

  public static final String DEFAULT_DELIMITER = ",";

  private final String delimiter;
  private final Pattern separator;

  public CsvColumnReader() {
    this(DEFAULT_DELIMITER);
  }

  public CsvColumnReader(String delimiter) {
    Preconditions.checkArgument(delimiter != null && !delimiter.isEmpty(),
        "delimiter must not be empty");
    this.delimiter = delimiter;
    this.separator = Pattern.compile(Pattern.quote(delimiter));
  }

  public double[] read(Path file, String column) throws IOException {
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader, column);
    }
  }

  /**
   * Read column from source. The reader is consumed but not closed.
   *
   * @throws IllegalArgumentException if the source is empty or the header has no such column
   */
  public double[] read(Reader source, String column) throws IOException {
    BufferedReader reader =
        source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);

    String header = reader.readLine();
    Preconditions.checkArgument(header != null, "no header line, cannot find column %s", column);
    int index = columnIndex(header, column);
    logger.debug("Column {} resolved to position {}", column, index);

    DoubleArrayList values = new DoubleArrayList();
    int nonNumeric = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      if (line.isEmpty()) {
        continue;
      }
      String[] cells = split(line);
      if (index >= cells.length) {
        continue;
      }
      Double value = Doubles.tryParse(cells[index].trim());
      if (value == null || !Doubles.isFinite(value)) {
        nonNumeric++;
        values.add(0.0);
      } else {
        values.add(value.doubleValue());
      }
    }

    if (nonNumeric > 0) {
      logger.warn("{} non-numeric cells in column {} were read as 0.0", nonNumeric, column);
    }
    return values.toDoubleArray();
  }

  /**
   * Split line on the delimiter, keeping empty cells. "a,,b" and "a,," both have an empty second
   * cell; "a,b," has two cells.
   */
  private String[] split(String line) {
    String[] cells = separator.split(line, -1);
    if (cells.length > 1 && line.endsWith(delimiter)) {
      return Arrays.copyOf(cells, cells.length - 1);
    }
    return cells;
  }

  private int columnIndex(String header, String column) {
    String[] names = split(header);
    int index = ArrayUtils.indexOf(names, column);
    Preconditions.checkArgument(index != ArrayUtils.INDEX_NOT_FOUND,
        "column %s not found in header [%s]", column, header);
    return index;
  }
}
