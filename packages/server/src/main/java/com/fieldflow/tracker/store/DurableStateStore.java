package com.fieldflow.tracker.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldflow.tracker.logging.LoggingService;
import com.fieldflow.tracker.utility.JacksonUtility;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Typed, failure-tolerant facade over a {@link KeyValueStore}.
 *
 * <p>Reads that fail or hold unreadable data fall back to the caller's default. Writes are
 * last-write-wins; a failed write is logged and never propagates, since the in-memory state of the
 * caller stays authoritative until the next successful write.
 */
public class DurableStateStore {
  private static final Logger log = LoggingService.getLogger(DurableStateStore.class);

  private final KeyValueStore store;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public DurableStateStore(KeyValueStore store) {
    this.store = store;
  }

  public <T> T get(String key, Class<T> type, T defaultValue) {
    try {
      Optional<String> raw = store.read(key);
      if (raw.isEmpty()) {
        return defaultValue;
      }
      return mapper.readValue(raw.get(), type);
    } catch (Exception e) {
      log.warn("Could not read '{}' from state store, using default: {}", key, e.getMessage());
      log.debug("State store read failure", e);
      return defaultValue;
    }
  }

  /** Store {@code value}; returns {@code false} when the write failed. */
  public boolean set(String key, Object value) {
    try {
      store.write(key, JacksonUtility.toJson(value));
      return true;
    } catch (Exception e) {
      log.error("Failed to persist '{}' to state store", key, e);
      return false;
    }
  }

  public boolean remove(String key) {
    try {
      store.delete(key);
      return true;
    } catch (Exception e) {
      log.error("Failed to remove '{}' from state store", key, e);
      return false;
    }
  }
}
