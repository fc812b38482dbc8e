package com.fieldflow.tracker.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Simple in-memory KeyValueStore implementation. Lost when the process exits. */
public final class InMemoryKeyValueStore implements KeyValueStore {
  private final Map<String, String> map = new ConcurrentHashMap<>();

  @Override
  public Optional<String> read(String key) {
    return Optional.ofNullable(map.get(key));
  }

  @Override
  public void write(String key, String value) {
    map.put(key, value);
  }

  @Override
  public void delete(String key) {
    map.remove(key);
  }
}
