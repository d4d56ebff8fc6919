package com.onthegomap.skycorr;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.skycorr.config.Arguments;
import com.onthegomap.skycorr.geo.WeightedPoint;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SkyCorrTest {

  private static Path writeCatalog(Path dir, List<WeightedPoint> points) throws IOException {
    Path file = dir.resolve("galaxies.dat");
    Files.writeString(file, points.stream()
      .map(p -> p.lon() + " " + p.lat() + " " + p.weight())
      .collect(Collectors.joining("\n", "# lon lat weight\n", "\n")));
    return file;
  }

  @Test
  void testRunWritesResults(@TempDir Path tempDir) throws Exception {
    Path catalog = writeCatalog(tempDir, TestUtils.uniformPoints(300, 10, 30, -10, 10, 11));
    Path output = tempDir.resolve("out");
    SkyCorr.run(Arguments.of(Map.of(
      "galaxy_file", catalog.toString(),
      "output", output.toString(),
      "output_tag", "test",
      "bounds", "10,-10,30,10",
      "theta_min", "0.5",
      "theta_max", "5",
      "bins_per_decade", "2",
      "use_only_pairs", "true",
      "n_jackknife", "4",
      "map_resolution", "64"
    )));

    List<String> wtheta = Files.readAllLines(output.resolve("Wtheta_test"));
    assertEquals(4, wtheta.size());
    assertTrue(wtheta.get(0).startsWith("theta\t"));
    for (String line : wtheta.subList(1, wtheta.size())) {
      double w = Double.parseDouble(line.split("\t")[3]);
      assertTrue(Double.isFinite(w), line);
    }
    assertEquals(10, Files.readAllLines(output.resolve("Wcovar_test")).size());
  }

  @Test
  void testEmptyCatalogFails(@TempDir Path tempDir) throws IOException {
    Path catalog = writeCatalog(tempDir, List.of(WeightedPoint.of(200, 50)));
    Arguments arguments = Arguments.of(Map.of(
      "galaxy_file", catalog.toString(),
      "output", tempDir.toString(),
      "bounds", "10,-10,30,10"
    ));
    assertThrows(IllegalArgumentException.class, () -> SkyCorr.run(arguments));
  }

  @Test
  void testMissingCatalogFails(@TempDir Path tempDir) {
    Arguments arguments = Arguments.of(Map.of("galaxy_file", tempDir.resolve("missing.dat").toString()));
    assertThrows(IllegalArgumentException.class, () -> SkyCorr.run(arguments));
  }
}
