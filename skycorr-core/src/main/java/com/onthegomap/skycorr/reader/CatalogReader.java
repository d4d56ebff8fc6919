package com.onthegomap.skycorr.reader;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.onthegomap.skycorr.geo.Footprint;
import com.onthegomap.skycorr.geo.WeightedPoint;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads object catalogs with {@code lon lat [weight]} columns in degrees, separated by whitespace or commas.
 * <p>
 * Lines starting with {@code #} are skipped, as are any columns after the weight. Objects without a weight get weight
 * 1.
 */
public class CatalogReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(CatalogReader.class);
  private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");
  private static final CsvMapper MAPPER = new CsvMapper();
  private static final CsvSchema SCHEMA = MAPPER
    .schemaFor(Row.class)
    .withoutHeader()
    .withComments();
  private static final ObjectReader READER = MAPPER.readerFor(Row.class)
    .with(SCHEMA)
    .with(CsvParser.Feature.SKIP_EMPTY_LINES)
    .with(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE);

  private final Footprint footprint;
  private final double minWeight;
  private final double maxWeight;
  private long read = 0;

  /** Keeps objects inside {@code footprint} with a weight in {@code [minWeight, maxWeight]}. */
  public CatalogReader(Footprint footprint, double minWeight, double maxWeight) {
    if (minWeight > maxWeight) {
      throw new IllegalArgumentException("min weight " + minWeight + " > max weight " + maxWeight);
    }
    this.footprint = footprint;
    this.minWeight = minWeight;
    this.maxWeight = maxWeight;
  }

  /** Returns the objects from {@code path} that pass the footprint and weight filters. */
  public List<WeightedPoint> read(Path path) throws IOException {
    String normalized;
    try (var lines = Files.lines(path)) {
      normalized = lines
        .map(String::strip)
        .map(line -> line.startsWith("#") ? line : SEPARATORS.matcher(line).replaceAll(","))
        .collect(Collectors.joining("\n"));
    }
    List<WeightedPoint> result = parse(normalized);
    LOGGER.info("Read {} objects from {}; kept {}", read, path, result.size());
    return result;
  }

  List<WeightedPoint> parse(String csv) throws IOException {
    List<WeightedPoint> result = new ArrayList<>();
    try (var rows = READER.<Row>readValues(csv)) {
      while (rows.hasNext()) {
        Row row = rows.next();
        read++;
        WeightedPoint point = WeightedPoint.of(row.lon(), row.lat(), row.weight() == null ? 1.0 : row.weight());
        if (point.weight() >= minWeight && point.weight() <= maxWeight && footprint.contains(point.lonLat())) {
          result.add(point);
        }
      }
    }
    return result;
  }

  /** Number of rows read so far, including dropped ones. */
  public long rowsRead() {
    return read;
  }

  @JsonPropertyOrder({"lon", "lat", "weight"})
  private record Row(double lon, double lat, Double weight) {}
}
