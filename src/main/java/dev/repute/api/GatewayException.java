/* Repute © 2025 Repute Devs — MIT */
package dev.repute.api;

/** Raised by {@link ChatGateway} implementations when the chat platform rejects a call. */
public class GatewayException extends Exception {
  private static final long serialVersionUID = 1L;

  private final boolean forbidden;

  public GatewayException(String message) {
    this(message, false, null);
  }

  public GatewayException(String message, Throwable cause) {
    this(message, false, cause);
  }

  /**
   * Creates an exception.
   *
   * @param message description of the failed call
   * @param forbidden whether the platform refused the call for permission/privacy reasons (for
   *     example a user with closed direct messages)
   * @param cause underlying error, may be {@code null}
   */
  public GatewayException(String message, boolean forbidden, Throwable cause) {
    super(message, cause);
    this.forbidden = forbidden;
  }

  /** Whether the platform refused the call rather than failing to reach it. */
  public boolean forbidden() {
    return forbidden;
  }
}
