package ca.gc.cra.tether.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and command-line settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings map.
   *
   * @param yaml settings loaded from YAML, if any
   * @param cli command-line {@code key=value} settings
   * @param defaults embedded defaults
   * @param warn receives a note for every CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged map
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        if (warn != null && yamlValues.containsKey(key)) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, value);
      });
    }
    return Map.copyOf(merged);
  }
}
