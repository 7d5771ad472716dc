package ca.gc.cra.eventbuffer.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for identifiers such as channel ids and metric prefixes.
 * <p><strong>Why:</strong> Rejects blank or control-character inputs before a subscription is registered or a
 * configuration value is accepted.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 */
public final class Strings {
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
   * Returns the trimmed value, or {@code fallback} when the value is {@code null} or blank.
   *
   * @param value candidate text; may be {@code null}
   * @param fallback value used when {@code value} is absent
   * @return trimmed value or {@code fallback}
   * @throws IllegalArgumentException if a present value contains ISO control characters
   */
  public static String orDefault(String value, String fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return requireNonBlank("value", value);
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
