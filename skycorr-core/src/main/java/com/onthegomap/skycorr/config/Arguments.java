package com.onthegomap.skycorr.config;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value arguments for a correlation run, read from the command line, JVM properties, environmental variables, or a
 * config file.
 * <p>
 * Keys are matched ignoring case and separators, so {@code "THETA_MIN"} matches {@code "theta-min"} and
 * {@code "theta.min"}. A key of {@code "new_name|old_name"} reads {@code new_name} and falls back to the deprecated
 * {@code old_name}.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);
  /** Longitude/latitude box of the whole sky: {@code minX=minLon, maxX=maxLon, minY=minLat, maxY=maxLat}. */
  public static final Envelope FULL_SKY = new Envelope(0, 360, -90, 90);

  private final UnaryOperator<String> provider;

  private Arguments(UnaryOperator<String> provider) {
    this.provider = provider;
  }

  /**
   * Returns arguments from JVM system properties prefixed with {@code skycorr.}, for example
   * {@code java -Dskycorr.theta_max=5 -jar ...}
   */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty);
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter) {
    return fromPrefixed(getter, "skycorr", ".", false);
  }

  /**
   * Returns arguments from environmental variables prefixed with {@code SKYCORR_}, for example
   * {@code SKYCORR_THETA_MAX=5 java -jar ...}
   */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter) {
    return fromPrefixed(getter, "SKYCORR", "_", true);
  }

  public static Arguments from(Properties properties) {
    return new Arguments(properties::getProperty);
  }

  /**
   * Returns arguments parsed from {@code key=value}, {@code --key value} or {@code --flag} command-line arguments,
   * where a bare flag means {@code true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i].strip();
      String[] kv = arg.split("=", 2);
      String key = kv[0].replaceAll("^[\\s-]+", "");
      if (kv.length == 2) {
        parsed.put(key, kv[1]);
      } else if (arg.startsWith("-")) {
        if (i >= args.length - 1 || args[i + 1].strip().startsWith("-")) {
          parsed.put(key, "true");
        } else {
          parsed.put(key, args[++i].strip());
        }
      } else {
        parsed.put(key, "true");
      }
    }
    return of(parsed);
  }

  /** Returns arguments loaded from a {@code .properties} file. */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
      return from(properties);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
  }

  /**
   * Returns arguments from, in priority order: the command line, JVM properties, environmental variables, then the
   * config file named by a {@code config} argument from any of those.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments fromArgsOrEnv = fromEnvOrArgs(args);
    Path configFile = fromArgsOrEnv.file("config", "path to config file", null);
    if (configFile != null) {
      return fromArgsOrEnv.orElse(fromConfigFile(configFile));
    } else {
      return fromArgsOrEnv;
    }
  }

  /** Returns arguments from the command line, then JVM properties, then environmental variables. */
  public static Arguments fromEnvOrArgs(String... args) {
    return fromArgs(args)
      .orElse(fromJvmProperties())
      .orElse(fromEnvironment());
  }

  private static String normalize(String key, String separator, boolean upperCase) {
    String result = key.replaceAll("[._-]", separator);
    return upperCase ? result.toUpperCase(Locale.ROOT) : result.toLowerCase(Locale.ROOT);
  }

  private static String normalize(String key) {
    return normalize(key, "_", false);
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> updated = new HashMap<>();
    for (var entry : map.entrySet()) {
      updated.put(normalize(entry.getKey()), entry.getValue());
    }
    return new Arguments(updated::get);
  }

  /** Shorthand for {@link #of(Map)} from alternating keys and values. */
  public static Arguments of(Object... args) {
    Map<String, String> map = new TreeMap<>();
    for (int i = 0; i < args.length; i += 2) {
      map.put(args[i].toString(), args[i + 1].toString());
    }
    return of(map);
  }

  private static Arguments fromPrefixed(UnaryOperator<String> provider, String prefix, String separator,
    boolean upperCase) {
    return new Arguments(key -> provider.apply(normalize(prefix + separator + key, separator, upperCase)));
  }

  private String get(String key) {
    String[] options = key.split("\\|");
    for (int i = 0; i < options.length; i++) {
      String option = options[i].strip();
      String value = provider.apply(normalize(option));
      if (value != null) {
        if (i != 0) {
          LOGGER.warn("Argument '{}' is deprecated", option);
        }
        return value;
      }
    }
    return null;
  }

  /** Returns arguments that check {@code this} first and fall back to {@code other}. */
  public Arguments orElse(Arguments other) {
    return new Arguments(key -> {
      String ourResult = get(key);
      return ourResult != null ? ourResult : other.get(key);
    });
  }

  String getArg(String key) {
    String value = get(key);
    return value == null ? null : value.trim();
  }

  String getArg(String key, String defaultValue) {
    String value = getArg(key);
    return value == null ? defaultValue : value;
  }

  /**
   * Returns a longitude/latitude box parsed from {@code minLon,minLat,maxLon,maxLat}, {@link #FULL_SKY} for
   * {@code "all"}, or {@code defaultValue} if missing.
   *
   * @throws IllegalArgumentException if the value does not have 4 numbers
   */
  public Envelope bounds(String key, String description, Envelope defaultValue) {
    String input = getArg(key);
    Envelope result = defaultValue;
    if ("all".equalsIgnoreCase(input) || "sky".equalsIgnoreCase(input)) {
      result = FULL_SKY;
    } else if (input != null) {
      double[] bounds = Stream.of(input.split("[\\s,]+")).mapToDouble(Double::parseDouble).toArray();
      if (bounds.length != 4) {
        throw new IllegalArgumentException("bounds must have 4 coordinates, got: " + input);
      }
      result = new Envelope(bounds[0], bounds[2], bounds[1], bounds[3]);
    }
    logArgValue(key, description, result);
    return result;
  }

  protected void logArgValue(String key, String description, Object result) {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("argument: {}={} ({})", key.replaceFirst("\\|.*$", ""), result, description);
    }
  }

  public String getString(String key, String description, String defaultValue) {
    String value = getArg(key, defaultValue);
    logArgValue(key, description, value);
    return value;
  }

  public String getString(String key, String description) {
    String value = getRequiredArg(key, description);
    logArgValue(key, description, value);
    return value;
  }

  /** Returns a {@link Path} from {@code key}, or {@code defaultValue} if not set. */
  public Path file(String key, String description, Path defaultValue) {
    String value = getArg(key);
    Path file = value == null ? defaultValue : Path.of(value);
    logArgValue(key, description, file);
    return file;
  }

  /** Returns a {@link Path} from a required {@code key} which may or may not exist. */
  public Path file(String key, String description) {
    Path file = Path.of(getRequiredArg(key, description));
    logArgValue(key, description, file);
    return file;
  }

  private String getRequiredArg(String key, String description) {
    String value = getArg(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing required parameter: " + key + " (" + description + ")");
    }
    return value;
  }

  /**
   * Returns a {@link Path} from a required {@code key} that must exist.
   *
   * @throws IllegalArgumentException if the file does not exist or the parameter is not provided
   */
  public Path inputFile(String key, String description) {
    Path path = file(key, description);
    if (!Files.exists(path)) {
      throw new IllegalArgumentException(path + " does not exist");
    }
    return path;
  }

  /** Returns true if {@code key} is {@code "true"}, false for any other value. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    boolean value = "true".equalsIgnoreCase(getArg(key, Boolean.toString(defaultValue)));
    logArgValue(key, description, value);
    return value;
  }

  /** @throws NumberFormatException if the argument cannot be parsed as an integer */
  public int getInteger(String key, String description, int defaultValue) {
    int parsed = Integer.parseInt(getArg(key, Integer.toString(defaultValue)));
    logArgValue(key, description, parsed);
    return parsed;
  }

  /** @throws NumberFormatException if the argument cannot be parsed as a double */
  public double getDouble(String key, String description, double defaultValue) {
    double parsed = Double.parseDouble(getArg(key, Double.toString(defaultValue)));
    logArgValue(key, description, parsed);
    return parsed;
  }

  /** @throws NumberFormatException if the argument cannot be parsed as a long */
  public long getLong(String key, String description, long defaultValue) {
    long parsed = Long.parseLong(getArg(key, Long.toString(defaultValue)));
    logArgValue(key, description, parsed);
    return parsed;
  }

  /** Returns a copy that logs each argument value the first time it is read. */
  public Arguments withExactlyOnceLogging() {
    Multiset<String> logged = HashMultiset.create();
    return new Arguments(this.provider) {
      @Override
      protected void logArgValue(String key, String description, Object result) {
        if (logged.add(key, 1) == 0) {
          super.logArgValue(key, description, result);
        }
      }
    };
  }
}
