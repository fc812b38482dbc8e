package com.fieldflow.tracker.store;

import java.util.Optional;

/** Raw persistent key/value storage. Values are opaque JSON text. */
public interface KeyValueStore {
  Optional<String> read(String key);

  void write(String key, String value);

  void delete(String key);
}
