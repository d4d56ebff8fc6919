package com.onthegomap.skycorr.writer;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.onthegomap.skycorr.correlation.AngularBin;
import com.onthegomap.skycorr.correlation.AngularCorrelation;
import com.onthegomap.skycorr.correlation.PairType;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the bins of an {@link AngularCorrelation} and their jackknife covariance to tab-separated files.
 */
public class CorrelationWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CorrelationWriter.class);
  private static final CsvMapper MAPPER = new CsvMapper();
  private static final ObjectWriter BIN_WRITER = MAPPER.writer(tsv(BinRow.class));
  private static final ObjectWriter COVARIANCE_WRITER = MAPPER.writer(tsv(CovarianceRow.class));

  private CorrelationWriter() {}

  private static CsvSchema tsv(Class<?> rowType) {
    return MAPPER
      .schemaFor(rowType)
      .withHeader()
      .withColumnSeparator('\t')
      .withLineSeparator("\n");
  }

  /**
   * Writes one row per bin with the angular range, survey-wide and jackknife w(theta), and the raw counters behind
   * them.
   */
  public static void write(AngularCorrelation correlation, Path path) throws IOException {
    try (
      var output = new BufferedOutputStream(Files.newOutputStream(path, CREATE, TRUNCATE_EXISTING, WRITE));
      var writer = BIN_WRITER.writeValues(output)
    ) {
      for (AngularBin bin : correlation.bins()) {
        writer.write(BinRow.of(bin));
      }
    }
    LOGGER.info("Wrote {} bins to {}", correlation.size(), path);
  }

  /** Writes the jackknife covariance matrix as {@code theta_a, theta_b, covariance} rows. */
  public static void writeCovariance(AngularCorrelation correlation, Path path) throws IOException {
    double[][] covariance = correlation.covariance();
    List<AngularBin> bins = correlation.bins();
    try (
      var output = new BufferedOutputStream(Files.newOutputStream(path, CREATE, TRUNCATE_EXISTING, WRITE));
      var writer = COVARIANCE_WRITER.writeValues(output)
    ) {
      for (int i = 0; i < bins.size(); i++) {
        for (int j = 0; j < bins.size(); j++) {
          writer.write(new CovarianceRow(bins.get(i).theta(), bins.get(j).theta(), covariance[i][j]));
        }
      }
    }
    LOGGER.info("Wrote {}x{} covariance to {}", bins.size(), bins.size(), path);
  }

  @JsonPropertyOrder({"theta", "theta_min", "theta_max", "wtheta", "wtheta_error", "mean_wtheta",
    "mean_wtheta_error", "gal_gal", "gal_rand", "rand_gal", "rand_rand", "pixel_weight"})
  record BinRow(
    @JsonProperty("theta") double theta,
    @JsonProperty("theta_min") double thetaMin,
    @JsonProperty("theta_max") double thetaMax,
    @JsonProperty("wtheta") double wtheta,
    @JsonProperty("wtheta_error") double wthetaError,
    @JsonProperty("mean_wtheta") double meanWtheta,
    @JsonProperty("mean_wtheta_error") double meanWthetaError,
    @JsonProperty("gal_gal") double galGal,
    @JsonProperty("gal_rand") double galRand,
    @JsonProperty("rand_gal") double randGal,
    @JsonProperty("rand_rand") double randRand,
    @JsonProperty("pixel_weight") double pixelWeight
  ) {

    static BinRow of(AngularBin bin) {
      return new BinRow(bin.theta(), bin.thetaMin(), bin.thetaMax(), bin.wtheta(), bin.wthetaError(),
        bin.meanWtheta(), bin.meanWthetaError(), bin.pairWeight(PairType.GAL_GAL), bin.pairWeight(PairType.GAL_RAND),
        bin.pairWeight(PairType.RAND_GAL), bin.pairWeight(PairType.RAND_RAND), bin.pixelWeight());
    }
  }

  @JsonPropertyOrder({"theta_a", "theta_b", "covariance"})
  record CovarianceRow(
    @JsonProperty("theta_a") double thetaA,
    @JsonProperty("theta_b") double thetaB,
    @JsonProperty("covariance") double covariance
  ) {}
}
