/* Repute © 2025 Repute Devs — MIT */
package dev.repute.persist;

import dev.repute.api.ErrorCode;
import java.util.Objects;

/** Raised when a {@link BlobStore} cannot read or write a record. */
public class StorageException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorCode code;

  public StorageException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  public ErrorCode code() {
    return code;
  }
}
