package com.gentoro.optiflow.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.optiflow.exception.StoreException;
import com.gentoro.optiflow.utility.JacksonUtility;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * File-backed {@link StoreRepository}.
 *
 * <p>Saving never truncates the target in place. The document is first written to a temporary
 * file next to the target and forced to disk, then moved over the target with {@link
 * StandardCopyOption#ATOMIC_MOVE}. File systems without atomic rename support fall back to a
 * replacing move. When backups are enabled, the previous document is copied to {@code
 * <file><suffix>} before it is replaced.
 */
public class JsonFileStoreRepository implements StoreRepository {

  private static final org.slf4j.Logger log =
      com.gentoro.optiflow.logging.LoggingService.getLogger(JsonFileStoreRepository.class);

  public static final String DEFAULT_BACKUP_SUFFIX = ".bak";

  private final Path file;
  private final boolean keepBackup;
  private final String backupSuffix;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public JsonFileStoreRepository(Path file) {
    this(file, false, DEFAULT_BACKUP_SUFFIX);
  }

  public JsonFileStoreRepository(Path file, boolean keepBackup, String backupSuffix) {
    if (file == null) {
      throw new StoreException("Store document path must not be null");
    }
    this.file = file.toAbsolutePath().normalize();
    this.keepBackup = keepBackup;
    this.backupSuffix =
        backupSuffix == null || backupSuffix.isBlank() ? DEFAULT_BACKUP_SUFFIX : backupSuffix;
  }

  @Override
  public ObjectNode load() {
    if (!Files.isRegularFile(file)) {
      throw new StoreException("Store document not found: " + file);
    }
    try {
      byte[] content = Files.readAllBytes(file);
      if (content.length == 0) {
        throw new StoreException("Store document is empty: " + file);
      }
      JsonNode root = mapper.readTree(content);
      if (root == null || !root.isObject()) {
        throw new StoreException("Store document must contain a JSON object: " + file);
      }
      return (ObjectNode) root;
    } catch (IOException e) {
      throw new StoreException("Failed to read store document " + file, e);
    }
  }

  @Override
  public void save(ObjectNode document) {
    Path staged = stage(document);
    commit(staged);
  }

  @Override
  public String location() {
    return file.toString();
  }

  public Path backupFile() {
    return file.resolveSibling(file.getFileName() + backupSuffix);
  }

  /** Write {@code document} to a fresh temporary file in the target directory and sync it. */
  Path stage(ObjectNode document) {
    if (document == null) {
      throw new StoreException("Refusing to persist a null store document");
    }
    Path directory = file.getParent();
    Path staged = null;
    try {
      Files.createDirectories(directory);
      staged = Files.createTempFile(directory, file.getFileName() + ".", ".tmp");
      byte[] content = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
      try (FileChannel channel =
          FileChannel.open(
              staged, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        ByteBuffer buffer = ByteBuffer.wrap(content);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      return staged;
    } catch (IOException e) {
      deleteQuietly(staged);
      throw new StoreException("Failed to stage store document for " + file, e);
    }
  }

  /** Replace the target with a staged file produced by {@link #stage(ObjectNode)}. */
  void commit(Path staged) {
    try {
      if (keepBackup && Files.exists(file)) {
        Files.copy(file, backupFile(), StandardCopyOption.REPLACE_EXISTING);
      }
      try {
        Files.move(
            staged, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.warn("Atomic move not supported for {}, falling back to replacing move", file);
        Files.move(staged, file, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Flushed store document {}", file);
    } catch (IOException e) {
      deleteQuietly(staged);
      throw new StoreException("Failed to replace store document " + file, e);
    }
  }

  private void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not delete temporary store file {}: {}", path, e.getMessage());
    }
  }
}
