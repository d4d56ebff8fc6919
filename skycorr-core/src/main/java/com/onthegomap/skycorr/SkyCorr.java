package com.onthegomap.skycorr;

import com.onthegomap.skycorr.config.Arguments;
import com.onthegomap.skycorr.config.CorrelationConfig;
import com.onthegomap.skycorr.correlation.AngularCorrelation;
import com.onthegomap.skycorr.geo.BoundsFootprint;
import com.onthegomap.skycorr.geo.Footprint;
import com.onthegomap.skycorr.geo.WeightedPoint;
import com.onthegomap.skycorr.reader.CatalogReader;
import com.onthegomap.skycorr.regions.RegionationException;
import com.onthegomap.skycorr.writer.CorrelationWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entrypoint that measures the angular auto-correlation of a galaxy catalog inside a rectangular
 * footprint with jackknife errors.
 * <p>
 * Writes {@code Wtheta_<tag>} and {@code Wcovar_<tag>} tab-separated files to the {@code output} directory.
 */
public class SkyCorr {

  private static final Logger LOGGER = LoggerFactory.getLogger(SkyCorr.class);

  private SkyCorr() {}

  public static void main(String... args) throws IOException, RegionationException {
    run(Arguments.fromArgsOrConfigFile(args).withExactlyOnceLogging());
  }

  static void run(Arguments arguments) throws IOException, RegionationException {
    var config = CorrelationConfig.from(arguments);
    Path galaxyFile = arguments.inputFile("galaxy_file", "catalog with lon lat [weight] columns");
    Path output = arguments.file("output", "directory to write results to", Path.of("."));
    String tag = arguments.getString("output_tag", "suffix for output file names", "skycorr");
    Footprint footprint = new BoundsFootprint(
      arguments.bounds("bounds", "footprint as min_lon,min_lat,max_lon,max_lat", Arguments.FULL_SKY),
      config.mapResolution());

    List<WeightedPoint> galaxies = new CatalogReader(footprint, config.minWeight(), config.maxWeight())
      .read(galaxyFile);
    if (galaxies.isEmpty()) {
      throw new IllegalArgumentException("No objects from " + galaxyFile + " inside " + footprint);
    }

    AngularCorrelation wtheta = AngularCorrelation.from(config);
    if (!config.useOnlyPairs() && config.maxLevel() == CorrelationConfig.AUTO_LEVEL) {
      wtheta.autoMaxLevel(galaxies.size(), footprint.area());
    }
    LOGGER.info("Measuring {} bins over [{}, {}] degrees", wtheta.size(), wtheta.thetaMin(), wtheta.thetaMax());
    int nRegion = wtheta.findAutoCorrelationWithRegions(footprint, galaxies, config.nRandom(), config.nJackknife(),
      new Random(config.seed()));
    LOGGER.info("Finished with {} jackknife regions", nRegion);

    Files.createDirectories(output);
    CorrelationWriter.write(wtheta, output.resolve("Wtheta_" + tag));
    CorrelationWriter.writeCovariance(wtheta, output.resolve("Wcovar_" + tag));
  }
}
