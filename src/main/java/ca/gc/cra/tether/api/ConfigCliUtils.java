package ca.gc.cra.tether.api;

import ca.gc.cra.tether.config.ConfigMerger;
import ca.gc.cra.tether.config.PipelineConfig;
import ca.gc.cra.tether.config.YamlConfigLoader;
import ca.gc.cra.tether.validation.Numbers;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Helpers shared by the commands for mixing {@code key=value} arguments with a YAML {@code pipeline} section.
 */
final class ConfigCliUtils {
  static final String YAML_SECTION = "pipeline";

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Layers defaults, the optional YAML file and command-line settings, then builds the pipeline settings.
   *
   * @param configPath YAML path, or {@code null} when none was given
   * @param cli command-line settings; keys the pipeline does not know are ignored
   * @param warn sink for override warnings
   * @return effective pipeline configuration
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the file is missing, malformed or holds invalid values
   */
  static PipelineConfig loadPipelineConfig(String configPath, Map<String, String> cli, Consumer<String> warn)
      throws IOException {
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, YAML_SECTION);
    }
    Map<String, String> effective =
        ConfigMerger.buildEffectiveConfig(yaml, cli, PipelineConfig.defaults().asFlatMap(), warn);
    return PipelineConfig.fromMap(effective);
  }

  static long longValue(Map<String, String> args, String key, long defaultValue, long min, long max) {
    String value = args.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(value.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a whole number (was '" + value + "')", ex);
    }
  }

  static String required(Map<String, String> args, String key) {
    String value = args.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("missing required argument " + key);
    }
    return value.trim();
  }
}
