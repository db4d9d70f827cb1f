package ca.gc.cra.tether.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Log hygiene helpers for credentials and payload dumps.
 * <p><strong>Why:</strong> SAS tokens, private keys and large message bodies must not reach operator logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final Pattern SAS_SIGNATURE = Pattern.compile("(?i)(\\bsig=)[^&\\s\"]+");
  private static final Pattern SHARED_ACCESS_KEY = Pattern.compile("(?i)(SharedAccessKey=)[^;\\s\"]+");
  private static final Pattern PEM_BLOCK =
      Pattern.compile("-----BEGIN ([A-Z ]+)-----.*?-----END \\1-----", Pattern.DOTALL);

  private Logs() {}

  /**
   * Truncates a string to the requested UTF-8 byte length and notes the original length.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes bytes to keep; must be positive
   * @return {@code value} when it fits, otherwise its prefix plus {@code "... (truncated, X of Y)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    String prefix;
    try {
      CharBuffer decoded = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.IGNORE)
          .onUnmappableCharacter(CodingErrorAction.IGNORE)
          .decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      prefix = decoded.toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
  }

  /**
   * Placeholder printed instead of a secret value.
   *
   * @param value secret; ignored
   * @return {@code "[REDACTED]"}, or {@code "<none>"} when {@code value} is {@code null}
   */
  public static String redact(Object value) {
    return value == null ? "<none>" : REDACTED_PLACEHOLDER;
  }

  /**
   * Masks credential material embedded in free text: SAS signatures, shared access keys and PEM blocks.
   *
   * @param text text about to be logged; may be {@code null}
   * @return text with secrets replaced by {@code [REDACTED]}
   */
  public static String scrub(String text) {
    if (text == null) {
      return NULL_PLACEHOLDER;
    }
    String scrubbed = SAS_SIGNATURE.matcher(text).replaceAll("$1" + REDACTED_PLACEHOLDER);
    scrubbed = SHARED_ACCESS_KEY.matcher(scrubbed).replaceAll("$1" + REDACTED_PLACEHOLDER);
    return PEM_BLOCK.matcher(scrubbed).replaceAll("-----$1 " + REDACTED_PLACEHOLDER + "-----");
  }
}
