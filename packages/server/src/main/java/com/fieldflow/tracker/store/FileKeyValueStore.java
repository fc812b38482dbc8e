package com.fieldflow.tracker.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fieldflow.tracker.exception.PersistenceException;
import com.fieldflow.tracker.logging.LoggingService;
import com.fieldflow.tracker.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * {@link KeyValueStore} keeping every key in one JSON document on disk.
 *
 * <p>Each write rewrites the whole document into a sibling temp file and moves it into
 * place, so a crash leaves either the previous or the new document, never a torn one. A file
 * that cannot be parsed is moved aside as {@code <name>.corrupt-<millis>} and the store starts
 * empty.
 */
public final class FileKeyValueStore implements KeyValueStore {
  private static final Logger log = LoggingService.getLogger(FileKeyValueStore.class);

  static final String CORRUPT_SUFFIX = ".corrupt-";

  private final Path file;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private final Object lock = new Object();
  private ObjectNode document;

  public FileKeyValueStore(Path file) {
    this.file = file.toAbsolutePath();
    this.document = load();
  }

  public Path file() {
    return file;
  }

  @Override
  public Optional<String> read(String key) {
    synchronized (lock) {
      JsonNode node = document.get(key);
      if (node == null || node.isNull()) {
        return Optional.empty();
      }
      return Optional.of(node.toString());
    }
  }

  @Override
  public void write(String key, String value) {
    JsonNode node;
    try {
      node = mapper.readTree(value);
    } catch (IOException e) {
      throw new PersistenceException("Value for key '" + key + "' is not valid JSON", e);
    }
    synchronized (lock) {
      ObjectNode next = document.deepCopy();
      next.set(key, node);
      flush(next);
      document = next;
    }
  }

  @Override
  public void delete(String key) {
    synchronized (lock) {
      if (!document.has(key)) {
        return;
      }
      ObjectNode next = document.deepCopy();
      next.remove(key);
      flush(next);
      document = next;
    }
  }

  private ObjectNode load() {
    if (!Files.exists(file)) {
      log.debug("State file {} does not exist yet", file);
      return mapper.createObjectNode();
    }
    try {
      JsonNode root = mapper.readTree(file.toFile());
      if (root instanceof ObjectNode obj) {
        return obj;
      }
      log.error("State file {} does not hold a JSON object", file);
    } catch (IOException e) {
      log.error("State file {} is unreadable: {}", file, e.getMessage());
    }
    quarantine();
    return mapper.createObjectNode();
  }

  /** Move an unusable state file aside so the next write does not overwrite it. */
  private void quarantine() {
    Path target =
        file.resolveSibling(file.getFileName() + CORRUPT_SUFFIX + Instant.now().toEpochMilli());
    try {
      Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
      log.warn("Moved unusable state file to {}, starting with empty state", target);
    } catch (IOException e) {
      log.error("Could not move unusable state file {} aside, starting with empty state", file, e);
    }
  }

  private void flush(ObjectNode next) {
    Path parent = file.getParent();
    try {
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
      try {
        mapper.writeValue(tmp.toFile(), next);
        move(tmp);
      } finally {
        Files.deleteIfExists(tmp);
      }
    } catch (IOException e) {
      throw new PersistenceException("Failed to write state file " + file, e);
    }
  }

  private void move(Path tmp) throws IOException {
    try {
      Files.move(
          tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, falling back to replace", file);
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
