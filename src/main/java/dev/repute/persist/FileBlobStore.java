/* Repute © 2025 Repute Devs — MIT */
package dev.repute.persist;

import dev.repute.api.ErrorCode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Keeps each record as a file in one directory, replaced via write-temp-then-rename. */
public final class FileBlobStore implements BlobStore {
  private static final Logger LOG = LoggerFactory.getLogger("repute");

  private final Path dir;

  public FileBlobStore(Path dir) {
    this.dir = Objects.requireNonNull(dir, "dir");
  }

  public Path dir() {
    return dir;
  }

  @Override
  public Optional<String> read(String name) throws StorageException {
    Path file = resolve(name);
    try {
      return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new StorageException(
          ErrorCode.PERSISTENCE_FAILURE, "failed to read " + file + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void write(String name, String body) throws StorageException {
    Path target = resolve(name);
    Path temp = null;
    try {
      Files.createDirectories(dir);
      temp = Files.createTempFile(dir, name + ".", ".tmp");
      Files.writeString(temp, body, StandardCharsets.UTF_8);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      temp = null;
    } catch (IOException e) {
      throw new StorageException(
          ErrorCode.PERSISTENCE_FAILURE, "failed to write " + target + ": " + e.getMessage(), e);
    } finally {
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
          LOG.debug(
              "(repute) op={} temp={} message={}",
              "persist.file.cleanup",
              temp,
              cleanup.getMessage());
        }
      }
    }
  }

  private Path resolve(String name) {
    if (name == null || name.isBlank() || name.contains("/") || name.contains("\\")) {
      throw new IllegalArgumentException("invalid record name: " + name);
    }
    return dir.resolve(name);
  }
}
