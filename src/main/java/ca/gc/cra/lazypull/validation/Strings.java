package ca.gc.cra.lazypull.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI and settings files.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and free of control characters.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
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
   * Returns the trimmed value, or {@code null} when it is absent or blank.
   *
   * @param value candidate text; may be {@code null}
   * @return trimmed value or {@code null}
   */
  public static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
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
