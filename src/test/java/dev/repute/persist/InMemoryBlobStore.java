/* Repute © 2025 Repute Devs — MIT */
package dev.repute.persist;

import dev.repute.api.ErrorCode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Map-backed store that can be told to fail writes or reads. */
final class InMemoryBlobStore implements BlobStore {
  final Map<String, String> records = new LinkedHashMap<>();
  final List<String> writes = new ArrayList<>();
  String failWritesOf;
  boolean failReads;

  @Override
  public synchronized Optional<String> read(String name) throws StorageException {
    if (failReads) {
      throw new StorageException(ErrorCode.CONNECTION_LOST, "read refused", null);
    }
    return Optional.ofNullable(records.get(name));
  }

  @Override
  public synchronized void write(String name, String body) throws StorageException {
    if (name.equals(failWritesOf)) {
      throw new StorageException(ErrorCode.PERSISTENCE_FAILURE, "disk full", null);
    }
    writes.add(name);
    records.put(name, body);
  }
}
