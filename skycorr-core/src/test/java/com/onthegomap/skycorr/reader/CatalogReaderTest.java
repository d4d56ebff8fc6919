package com.onthegomap.skycorr.reader;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.skycorr.config.Arguments;
import com.onthegomap.skycorr.geo.BoundsFootprint;
import com.onthegomap.skycorr.geo.WeightedPoint;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;

class CatalogReaderTest {

  private static final BoundsFootprint ALL_SKY = new BoundsFootprint(Arguments.FULL_SKY, 256);

  @Test
  void testWhitespaceAndCommas(@TempDir Path tempDir) throws IOException {
    Path file = tempDir.resolve("galaxies.dat");
    Files.writeString(file, """
      # lon lat weight
      10.5 -3.25 0.9
        11\t4
      12,5,0.5

      13 ,  6 , 1 , extra
      """);
    CatalogReader reader = new CatalogReader(ALL_SKY, 0.2, 1.00001);
    List<WeightedPoint> points = reader.read(file);
    assertEquals(List.of(
      WeightedPoint.of(10.5, -3.25, 0.9),
      WeightedPoint.of(11, 4, 1.0),
      WeightedPoint.of(12, 5, 0.5),
      WeightedPoint.of(13, 6, 1.0)
    ), points);
    assertEquals(4, reader.rowsRead());
  }

  @Test
  void testFiltersWeightAndFootprint() throws IOException {
    CatalogReader reader = new CatalogReader(new BoundsFootprint(new Envelope(0, 20, 0, 20), 64), 0.2, 1.00001);
    List<WeightedPoint> points = reader.parse("""
      5,5,0.1
      5,5,1.5
      30,5,1
      5,-5,1
      5,5,0.2
      """);
    assertEquals(List.of(WeightedPoint.of(5, 5, 0.2)), points);
    assertEquals(5, reader.rowsRead());
  }

  @Test
  void testMissingFile(@TempDir Path tempDir) {
    CatalogReader reader = new CatalogReader(ALL_SKY, 0, 1);
    assertThrows(IOException.class, () -> reader.read(tempDir.resolve("missing.dat")));
  }

  @Test
  void testInvalidWeightRange() {
    assertThrows(IllegalArgumentException.class, () -> new CatalogReader(ALL_SKY, 1, 0.5));
  }
}
