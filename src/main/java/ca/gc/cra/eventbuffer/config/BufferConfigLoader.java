package ca.gc.cra.eventbuffer.config;

import ca.gc.cra.eventbuffer.application.buffer.EventBufferOptions;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Builds {@link BufferConfig} instances from YAML or properties files.
 * <p><strong>Keys:</strong> {@code channel} (required), {@code capacity}, {@code metricPrefix}, {@code metrics}.
 * Any other key is rejected so typos surface at startup.</p>
 * <p><strong>YAML layout:</strong> the root mapping holds an optional {@code common} section of shared defaults and one
 * section per named buffer. Section names match case-insensitively and the named section wins over {@code common}.
 * <pre>{@code
 * common:
 *   metrics: otel
 * orders:
 *   channel: orderPlaced
 *   capacity: 1e4
 * }</pre>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class BufferConfigLoader {
  static final String CHANNEL = "channel";
  static final String CAPACITY = "capacity";
  static final String METRIC_PREFIX = "metricPrefix";
  static final String METRICS = "metrics";
  static final String COMMON_SECTION = "common";

  private static final Set<String> KEYS = Set.of(CHANNEL, CAPACITY, METRIC_PREFIX, METRICS);

  private BufferConfigLoader() {}

  /**
   * Reads the {@code common} section merged with the {@code bufferName} section of a YAML file.
   *
   * @param path YAML file location
   * @param bufferName section naming the buffer
   * @return configuration, or empty when the file does not exist
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if the YAML is malformed, the buffer section is absent, a key is unknown,
   *     {@code channel} is missing, or a value has the wrong shape
   */
  public static Optional<BufferConfig> fromYaml(Path path, String bufferName) throws IOException {
    if (path == null || !Files.exists(path)) {
      return Optional.empty();
    }
    String name = bufferName == null ? "" : bufferName.trim().toLowerCase(Locale.ROOT);
    if (name.isEmpty() || name.equals(COMMON_SECTION)) {
      throw new IllegalArgumentException("buffer name must be non-blank and not '" + COMMON_SECTION + "'");
    }
    String origin = path + " [" + bufferName + "]";

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException(path + " must contain a mapping of buffer sections");
    }

    Map<?, ?> common = null;
    Map<?, ?> named = null;
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String section = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
      if (section.equals(COMMON_SECTION)) {
        common = section(entry.getValue(), path + " [" + COMMON_SECTION + "]");
      } else if (section.equals(name)) {
        named = section(entry.getValue(), origin);
      }
    }
    if (named == null) {
      throw new IllegalArgumentException("no section for buffer '" + bufferName + "' in " + path);
    }

    Map<String, Object> merged = new LinkedHashMap<>();
    if (common != null) {
      copySettings(common, merged, path + " [" + COMMON_SECTION + "]");
    }
    copySettings(named, merged, origin);
    return Optional.of(fromMap(merged, origin));
  }

  /**
   * Reads settings from a properties file.
   *
   * @param path properties file location
   * @return configuration, or empty when the file does not exist
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if a key is unknown, {@code channel} is missing, or a number is invalid
   */
  public static Optional<BufferConfig> fromProperties(Path path) throws IOException {
    if (path == null || !Files.exists(path)) {
      return Optional.empty();
    }
    Properties props = new Properties();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    Map<String, Object> values = new LinkedHashMap<>();
    for (String name : props.stringPropertyNames()) {
      values.put(name, props.getProperty(name));
    }
    return Optional.of(fromMap(values, path.toString()));
  }

  static BufferConfig fromMap(Map<String, ?> values, String origin) {
    for (String key : values.keySet()) {
      requireKnown(key, origin);
    }
    String channel = text(values.get(CHANNEL));
    if (channel == null || channel.isBlank()) {
      throw new IllegalArgumentException("channel is required in " + origin);
    }
    return new BufferConfig(
        channel,
        capacity(values.get(CAPACITY), origin),
        text(values.get(METRIC_PREFIX)),
        BufferConfig.MetricsMode.parse(text(values.get(METRICS))));
  }

  private static Map<?, ?> section(Object node, String origin) {
    if (node == null) {
      return Map.of();
    }
    if (!(node instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(origin + " must be a mapping");
    }
    return map;
  }

  private static void copySettings(Map<?, ?> section, Map<String, Object> target, String origin) {
    for (Map.Entry<?, ?> entry : section.entrySet()) {
      String key = String.valueOf(entry.getKey());
      requireKnown(key, origin);
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException(key + " must be a scalar in " + origin);
      }
      target.put(key, value);
    }
  }

  private static void requireKnown(String key, String origin) {
    if (!KEYS.contains(key)) {
      throw new IllegalArgumentException("unknown key '" + key + "' in " + origin + " (expected one of " + KEYS + ")");
    }
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }

  private static int capacity(Object raw, String origin) {
    if (raw == null || (raw instanceof String s && s.isBlank())) {
      return EventBufferOptions.DEFAULT_CAPACITY;
    }
    if (raw instanceof Integer value) {
      return value;
    }
    if (raw instanceof Number value) {
      return wholeNumber(value.doubleValue(), raw, origin);
    }
    String normalized = raw.toString().trim().replace("_", "");
    try {
      // 1e6 style values are accepted as long as they are whole numbers
      return wholeNumber(Double.parseDouble(normalized), raw, origin);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("capacity must be numeric in " + origin + " (was " + raw + ")", ex);
    }
  }

  private static int wholeNumber(double parsed, Object raw, String origin) {
    if (parsed != Math.rint(parsed) || parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
      throw new IllegalArgumentException("capacity must be a whole number in " + origin + " (was " + raw + ")");
    }
    return (int) parsed;
  }
}
