package ca.gc.cra.scopelabel.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads {@link LabelingConfig} instances from properties or YAML files.
 * <p><strong>Why:</strong> Allows applications to override naming defaults without code changes.</p>
 * <p><strong>Role:</strong> Configuration helper used when the default labeling context is created.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 * <p><strong>Observability:</strong> Logs the resolved source at DEBUG.</p>
 *
 * <p>Recognized keys:</p>
 * <ul>
 *   <li>{@code label.globalScope} fallback scope name</li>
 *   <li>{@code label.defaultNamespace} namespace of {@code uid()}</li>
 *   <li>{@code label.forbidUnderscore} {@code true|false}</li>
 *   <li>{@code label.warnOnGlobalFallback} {@code true|false}</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  /** System property naming a configuration file for the default labeling context. */
  public static final String CONFIG_PROPERTY = "scopelabel.config";

  static final String PREFIX = "label.";
  static final String GLOBAL_SCOPE = PREFIX + "globalScope";
  static final String DEFAULT_NAMESPACE = PREFIX + "defaultNamespace";
  static final String FORBID_UNDERSCORE = PREFIX + "forbidUnderscore";
  static final String WARN_ON_GLOBAL_FALLBACK = PREFIX + "warnOnGlobalFallback";

  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

  private ConfigLoader() {}

  /**
   * Loads configuration from {@code path}, choosing YAML for {@code .yaml}/{@code .yml} files and
   * properties otherwise.
   *
   * @param path configuration file; may be {@code null} or non-existent to use defaults
   * @return configuration populated with file values overriding defaults
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if a value is malformed
   */
  public static LabelingConfig load(Path path) throws IOException {
    if (path == null) {
      return LabelingConfig.defaults();
    }
    String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
      return YamlConfigLoader.load(path).map(ConfigLoader::fromMap).orElseGet(LabelingConfig::defaults);
    }
    return fromProperties(path);
  }

  /**
   * Reads optional configuration properties from the given path and builds a {@link LabelingConfig}.
   *
   * @param path properties file path; may be {@code null} or non-existent to use defaults
   * @return configuration populated with file values overriding defaults
   * @throws IOException if the file exists but cannot be read
   */
  public static LabelingConfig fromProperties(Path path) throws IOException {
    Properties props = new Properties();
    if (path != null && Files.exists(path)) {
      try (var reader = Files.newBufferedReader(path)) {
        props.load(reader);
      }
      log.debug("Loaded labeling configuration from {}", path);
    }
    return fromMap(Map.of(
        GLOBAL_SCOPE, props.getProperty(GLOBAL_SCOPE, LabelingConfig.DEFAULT_GLOBAL_SCOPE),
        DEFAULT_NAMESPACE, props.getProperty(DEFAULT_NAMESPACE, LabelingConfig.DEFAULT_NAMESPACE),
        FORBID_UNDERSCORE, props.getProperty(FORBID_UNDERSCORE, "false"),
        WARN_ON_GLOBAL_FALLBACK, props.getProperty(WARN_ON_GLOBAL_FALLBACK, "true")));
  }

  /**
   * Builds configuration from flat {@code label.*} entries; missing keys keep their defaults.
   *
   * @param values flat key/value map; must not be {@code null}
   * @return merged configuration
   * @throws IllegalArgumentException if a boolean is malformed or the global scope name is invalid
   */
  public static LabelingConfig fromMap(Map<String, String> values) {
    LabelingConfig defaults = LabelingConfig.defaults();
    return new LabelingConfig(
        values.getOrDefault(GLOBAL_SCOPE, defaults.globalScopeName()),
        values.getOrDefault(DEFAULT_NAMESPACE, defaults.defaultNamespace()),
        parseBoolean(FORBID_UNDERSCORE, values.get(FORBID_UNDERSCORE), defaults.forbidUnderscore()),
        parseBoolean(WARN_ON_GLOBAL_FALLBACK, values.get(WARN_ON_GLOBAL_FALLBACK),
            defaults.warnOnGlobalFallback()));
  }

  /**
   * Loads the file named by the {@value #CONFIG_PROPERTY} system property, or defaults when unset.
   *
   * @return resolved configuration
   * @throws IOException if the named file exists but cannot be read
   */
  public static LabelingConfig fromSystemProperty() throws IOException {
    String location = System.getProperty(CONFIG_PROPERTY);
    if (location == null || location.isBlank()) {
      return LabelingConfig.defaults();
    }
    return load(Paths.get(location.trim()));
  }

  private static boolean parseBoolean(String key, String raw, boolean fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false but was " + raw);
    };
  }
}
