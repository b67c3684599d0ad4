/* Repute © 2025 Repute Devs — MIT */
package dev.repute.persist;

import java.util.Optional;

/**
 * Durable name to document store holding the snapshot records.
 *
 * <p>Each {@link #write} replaces the whole document atomically: a reader sees either the previous
 * or the new body, never a partial one.
 */
public interface BlobStore extends AutoCloseable {

  /**
   * Reads a record.
   *
   * @param name record name, e.g. {@code reputation.json}
   * @return the body, or empty when the record was never written
   * @throws StorageException if the medium cannot be read
   */
  Optional<String> read(String name) throws StorageException;

  /**
   * Replaces a record.
   *
   * @param name record name
   * @param body complete new document
   * @throws StorageException if the write did not complete
   */
  void write(String name, String body) throws StorageException;

  @Override
  default void close() {}
}
