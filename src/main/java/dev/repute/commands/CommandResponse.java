/* Repute © 2025 Repute Devs — MIT */
package dev.repute.commands;

import dev.repute.api.ErrorCode;
import java.util.Objects;

/**
 * Reply to a command.
 *
 * @param ok whether the command took effect
 * @param code failure code, {@code null} on success
 * @param text rendered reply text
 * @param ephemeral whether only the caller should see the reply
 */
public record CommandResponse(boolean ok, ErrorCode code, String text, boolean ephemeral) {

  public CommandResponse {
    text = text == null ? "" : text;
    if (!ok && code == null) {
      throw new IllegalArgumentException("failure responses require an error code");
    }
  }

  static CommandResponse success(String text, boolean ephemeral) {
    return new CommandResponse(true, null, text, ephemeral);
  }

  static CommandResponse failure(ErrorCode code, String text, boolean ephemeral) {
    return new CommandResponse(false, Objects.requireNonNull(code, "code"), text, ephemeral);
  }
}
