package ca.gc.cra.tether.validation;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by TETHER operations, configuration and CLI layers.
 * <p><strong>Why:</strong> Operations validate their mandatory fields at construction so malformed work is
 * rejected at the caller instead of failing deep inside a stage.</p>
 * <p><strong>Role:</strong> Domain support utilities invoked by operation constructors and configuration loaders.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via constructors, CLI or config files.</li>
 *   <li>Validate publish topics and subscription filters before they reach a transport.</li>
 *   <li>Verify printable ASCII constraints for identifiers embedded in topics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final int MAX_TOPIC_BYTES = 65_535;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a publish topic: non-blank, no wildcards, no control characters and at most 65535 UTF-8 bytes.
   *
   * @param name logical parameter name included in exception messages
   * @param topic candidate topic
   * @return the validated topic, untrimmed content preserved apart from outer whitespace
   * @throws NullPointerException if {@code topic} is {@code null}
   * @throws IllegalArgumentException if the topic is blank, contains {@code +} or {@code #}, or is too long
   */
  public static String requireTopicName(String name, String topic) {
    String sanitized = requireTopicFilter(name, topic);
    if (sanitized.indexOf('+') >= 0 || sanitized.indexOf('#') >= 0) {
      throw new IllegalArgumentException(message(name, "must not contain wildcard characters"));
    }
    return sanitized;
  }

  /**
   * Validates a subscription filter. Wildcards are allowed; length and control-character rules apply.
   *
   * @param name logical parameter name included in exception messages
   * @param filter candidate filter
   * @return the validated filter
   * @throws NullPointerException if {@code filter} is {@code null}
   * @throws IllegalArgumentException if the filter is blank or too long
   */
  public static String requireTopicFilter(String name, String filter) {
    String sanitized = requireNonBlank(name, filter);
    if (sanitized.getBytes(StandardCharsets.UTF_8).length > MAX_TOPIC_BYTES) {
      throw new IllegalArgumentException(message(name, "must be at most " + MAX_TOPIC_BYTES + " bytes"));
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value exceeds {@code maxLength} or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive");
    }
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
