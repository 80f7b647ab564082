package net.larse.seasonality.helper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CsvColumnReaderTest {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static final String CSV =
      "timestamp,capacity_factor,wind_speed\n"
          + "2024-01-01T00,0.5,3.1\n"
          + "2024-01-01T01,abc,2.9\n"
          + "2024-01-01T02, 0.25 ,2.0\n"
          + "2024-01-01T03\n"
          + "2024-01-01T04,,1.0\n"
          + "2024-01-01T05,NaN,1.0\n"
          + "2024-01-01T06,1e-1,1.0\n";

  @Test
  public void testReadColumn() throws Exception {
    double[] values = new CsvColumnReader().read(new StringReader(CSV), "capacity_factor");
    // short row skipped, unparseable and non-finite cells read as 0.0
    assertArrayEquals(new double[] {0.5, 0.0, 0.25, 0.0, 0.0, 0.1}, values, 1e-12);
  }

  @Test
  public void testReadOtherColumn() throws Exception {
    double[] values = new CsvColumnReader().read(new StringReader(CSV), "wind_speed");
    assertArrayEquals(new double[] {3.1, 2.9, 2.0, 1.0, 1.0, 1.0}, values, 1e-12);
  }

  @Test
  public void testTrailingEmptyCellsKeepRowAlignment() throws Exception {
    String csv = "time,capacity_factor,wind\n"
        + "t0,0.5,3.0\n"
        + "t1,,\n"
        + "t2,0.7,2.0\n";

    double[] values = new CsvColumnReader().read(new StringReader(csv), "capacity_factor");
    assertArrayEquals(new double[] {0.5, 0.0, 0.7}, values, 1e-12);

    // "t1,," has no third cell, so the row is skipped for the last column
    values = new CsvColumnReader().read(new StringReader(csv), "wind");
    assertArrayEquals(new double[] {3.0, 2.0}, values, 1e-12);
  }

  @Test
  public void testBlankLinesSkipped() throws Exception {
    double[] values =
        new CsvColumnReader().read(new StringReader("output\n0.1\n\n0.3\n"), "output");
    assertArrayEquals(new double[] {0.1, 0.3}, values, 1e-12);
  }

  @Test
  public void testHeaderNamesMatchExactly() throws Exception {
    String csv = "time, capacity_factor\nt0,0.5\n";
    double[] values = new CsvColumnReader().read(new StringReader(csv), " capacity_factor");
    assertArrayEquals(new double[] {0.5}, values, 1e-12);

    try {
      new CsvColumnReader().read(new StringReader(csv), "capacity_factor");
      fail("expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("column capacity_factor not found"));
    }
  }

  @Test
  public void testReadFileWithDelimiter() throws Exception {
    File file = folder.newFile("generation.csv");
    Files.write(file.toPath(),
        "hour;output\r\n0;0.1\r\n1;0.2\r\n2;0.3\r\n".getBytes(StandardCharsets.UTF_8));

    double[] values = new CsvColumnReader(";").read(file.toPath(), "output");
    assertArrayEquals(new double[] {0.1, 0.2, 0.3}, values, 1e-12);
  }

  @Test
  public void testHeaderOnly() throws Exception {
    double[] values = new CsvColumnReader().read(new StringReader("a,b\n"), "b");
    assertEquals(0, values.length);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingColumn() throws Exception {
    new CsvColumnReader().read(new StringReader(CSV), "solar_irradiance");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptySource() throws Exception {
    new CsvColumnReader().read(new StringReader(""), "capacity_factor");
  }

  @Test(expected = java.nio.file.NoSuchFileException.class)
  public void testMissingFile() throws Exception {
    new CsvColumnReader().read(new File(folder.getRoot(), "absent.csv").toPath(), "x");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyDelimiter() {
    new CsvColumnReader("");
  }
}
