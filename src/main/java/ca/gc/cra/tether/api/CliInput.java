package ca.gc.cra.tether.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into flags ({@code --verbose}) and {@code key=value} settings. The first bare word
 * (a command name) stays with the settings so the dispatcher can pick it off.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> settings;
  private final Set<String> flags;

  private CliInput(List<String> settings, Set<String> flags) {
    this.settings = List.copyOf(settings);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Partitions raw arguments. Help and verbose aliases normalize to {@code --help} and {@code --verbose}.
   *
   * @param args raw arguments; may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        settings.add(arg);
      }
    }
    return new CliInput(settings, flags);
  }

  /**
   * Arguments that are not flags.
   *
   * @return copy of the remaining arguments in order
   */
  public String[] keyValueArgs() {
    return settings.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks for a flag such as {@code --x509}.
   *
   * @param flag flag name, case-insensitive
   * @return {@code true} when present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return "CliInput[settings=" + Arrays.toString(keyValueArgs()) + ", flags=" + flags + "]";
  }
}
