package ca.gc.cra.lazypull.domain.registry;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * <strong>What:</strong> Resolved registry credentials for one host/image pair.
 * <p><strong>Why:</strong> The daemon authenticates blob pulls either with a basic-auth pair or with a
 * bearer token; this value decides which configuration field receives the material.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 * <p><strong>Security:</strong> {@link #toString()} never renders the password.</p>
 *
 * @param username registry user; empty for token-based credentials
 * @param password registry password or token
 * @since 0.1.0
 */
public record Keychain(String username, String password) {
  private static final Keychain EMPTY = new Keychain("", "");

  public Keychain {
    username = username == null ? "" : username;
    password = password == null ? "" : password;
  }

  /**
   * Returns the keychain used when no credentials were found.
   *
   * @return keychain with no username and no password
   */
  public static Keychain empty() {
    return EMPTY;
  }

  /**
   * Indicates that no credential material is present.
   *
   * @return {@code true} when both username and password are blank
   */
  public boolean isEmpty() {
    return username.isBlank() && password.isBlank();
  }

  /**
   * Indicates a bare token: blank username, a non-blank password.
   *
   * @return {@code true} when the password should be sent as a registry token
   */
  public boolean isTokenBased() {
    return username.isBlank() && !password.isBlank();
  }

  /**
   * Encodes the pair for HTTP basic authentication.
   *
   * @return base64 of {@code username:password}, or an empty string when the keychain is empty
   */
  public String toBase64() {
    if (isEmpty()) {
      return "";
    }
    return Base64.getEncoder()
        .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public String toString() {
    return "Keychain[username=" + username + ", password=" + (password.isEmpty() ? "" : "[REDACTED]") + "]";
  }
}
