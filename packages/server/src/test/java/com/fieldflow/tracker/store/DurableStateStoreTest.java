package com.fieldflow.tracker.store;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.fieldflow.tracker.exception.PersistenceException;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurableStateStoreTest {

  @Test
  void missingKeyYieldsDefault() {
    DurableStateStore store = new DurableStateStore(new InMemoryKeyValueStore());

    assertNull(store.get("k", TrackerState.class, null));
    assertEquals("fallback", store.get("k", String.class, "fallback"));
  }

  @Test
  void writtenValueIsReadBack() {
    DurableStateStore store = new DurableStateStore(new InMemoryKeyValueStore());
    TrackerState state = TrackerState.empty().withVersion(3).withActiveJob("J1", true);

    assertTrue(store.set("state", state));

    TrackerState read = store.get("state", TrackerState.class, TrackerState.empty());
    assertEquals(3, read.version());
    assertEquals("J1", read.activeJobId());
    assertTrue(read.polling());
  }

  @Test
  void unreadableValueYieldsDefault() {
    KeyValueStore raw = new InMemoryKeyValueStore();
    raw.write("state", "{\"version\": \"not a number\"");
    DurableStateStore store = new DurableStateStore(raw);

    TrackerState fallback = TrackerState.empty();
    assertSame(fallback, store.get("state", TrackerState.class, fallback));
  }

  @Test
  void failedWritesAreReportedNotThrown() {
    KeyValueStore raw = mock(KeyValueStore.class);
    doThrow(new PersistenceException("disk full")).when(raw).write(anyString(), anyString());
    doThrow(new PersistenceException("read only")).when(raw).delete(anyString());
    when(raw.read(anyString())).thenThrow(new PersistenceException("io"));
    DurableStateStore store = new DurableStateStore(raw);

    assertFalse(store.set("state", TrackerState.empty()));
    assertFalse(store.remove("state"));
    assertEquals("default", store.get("state", String.class, "default"));
  }

  @Test
  void removeDeletesTheKey() {
    KeyValueStore raw = new InMemoryKeyValueStore();
    DurableStateStore store = new DurableStateStore(raw);
    store.set("state", TrackerState.empty());

    assertTrue(store.remove("state"));

    assertEquals(Optional.empty(), raw.read("state"));
  }
}
