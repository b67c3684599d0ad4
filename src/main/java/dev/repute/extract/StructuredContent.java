/* Repute © 2025 Repute Devs — MIT */
package dev.repute.extract;

import java.util.List;

/**
 * Structured message content (an embed) scanned for token addresses.
 *
 * @param title heading, may be {@code null}
 * @param description body text, may be {@code null}
 * @param fields name/value pairs in display order
 * @param footer footer text, may be {@code null}
 */
public record StructuredContent(
    String title, String description, List<Field> fields, String footer) {

  public StructuredContent {
    fields = fields == null ? List.of() : List.copyOf(fields);
  }

  /**
   * Single name/value field.
   *
   * @param name field label
   * @param value field text, may be {@code null}
   */
  public record Field(String name, String value) {}
}
