package net.larse.seasonality.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.typesafe.config.ConfigFactory;
import net.larse.seasonality.algorithms.SeasonalityAnalysis;
import org.junit.Test;

public class AnalysisConfigTest {

  @Test
  public void testDefaults() {
    AnalysisConfig config = new AnalysisConfig(ConfigFactory.defaultReference());

    assertEquals(24, config.getPeriod());
    assertEquals(5, config.getDominantCount());
    assertEquals(168, config.getExportRows());
    assertFalse(config.hasInputFile());
    assertEquals("capacity_factor", config.getInputColumn());
    assertEquals(",", config.getInputDelimiter());
    assertEquals("fourier_analysis.csv", config.getOutputFile());
    assertEquals(2160, config.getSyntheticHours());
    assertEquals(42L, config.getSyntheticSeed());
  }

  @Test
  public void testOverrides() {
    AnalysisConfig config = new AnalysisConfig(ConfigFactory
        .parseString("seasonality { period = 12, input.file = \"plant.csv\", dominant-count = 3 }")
        .withFallback(ConfigFactory.defaultReference()));

    assertEquals(12, config.getPeriod());
    assertTrue(config.hasInputFile());
    assertEquals("plant.csv", config.getInputFile());

    SeasonalityAnalysis.Args args = config.toArgs();
    assertEquals(12, args.period);
    assertEquals(3, args.dominantCount);
    assertEquals(168, args.exportRows);
  }
}
