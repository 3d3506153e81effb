package io.agentmcp.session;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for SessionRegistry admission, eviction, removal and drain. */
class SessionRegistryTest {

  private MutableClock clock;
  private SessionRegistry registry;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    registry = new SessionRegistry(5, Duration.ZERO, clock, SessionRegistry.DEFAULT_SWEEP_INTERVAL);
  }

  @AfterEach
  void tearDown() {
    registry.drainAll();
  }

  private static WorkHandle handle(boolean busy) {
    WorkHandle handle = mock(WorkHandle.class);
    when(handle.isBusy()).thenReturn(busy);
    when(handle.cancel()).thenReturn(CompletableFuture.completedFuture(null));
    return handle;
  }

  private static SessionRecord record(String id, boolean busy, long lastAccessed) {
    return new SessionRecord(id, handle(busy), mock(Subscription.class), lastAccessed);
  }

  private SessionRecord record(String id) {
    return record(id, false, clock.millis());
  }

  @Test
  void storesAndRetrievesSessions() throws Exception {
    SessionRecord a = record("a");
    registry.put("a", a);

    assertTrue(registry.contains("a"));
    assertSame(a, registry.get("a").orElseThrow());
    assertEquals(1, registry.size());
  }

  @Test
  void getReturnsEmptyForMissingSession() {
    assertTrue(registry.get("missing").isEmpty());
    assertFalse(registry.contains("missing"));
  }

  @Test
  void getRefreshesLastAccessed() throws Exception {
    SessionRecord a = record("a", false, 1000);
    registry.put("a", a);

    clock.advance(Duration.ofSeconds(5));
    registry.get("a");

    assertEquals(clock.millis(), a.lastAccessed());
  }

  @Test
  void containsDoesNotRefreshLastAccessed() throws Exception {
    SessionRecord a = record("a", false, 1000);
    registry.put("a", a);

    registry.contains("a");

    assertEquals(1000, a.lastAccessed());
  }

  @Test
  void putRejectsMismatchedId() {
    assertThrows(IllegalArgumentException.class, () -> registry.put("b", record("a")));
  }

  @Test
  void removeDisposesSession() throws Exception {
    SessionRecord a = record("a");
    registry.put("a", a);

    assertTrue(registry.remove("a"));

    assertFalse(registry.contains("a"));
    assertTrue(a.isDisposed());
    verify(a.workHandle()).cancel();
    verify(a.workHandle()).release();
  }

  @Test
  void removeIsNoOpForMissingSession() {
    assertDoesNotThrow(() -> registry.remove("missing"));
    assertFalse(registry.remove("missing"));
  }

  @Test
  void evictsOldestIdleSessionAtCapacity() throws Exception {
    List<SessionRecord> records = new ArrayList<>();
    List<Subscription> subscriptions = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      Subscription subscription = mock(Subscription.class);
      SessionRecord r = new SessionRecord("s" + i, handle(false), subscription, 1000 + i);
      records.add(r);
      subscriptions.add(subscription);
      registry.put("s" + i, r);
    }
    assertEquals(5, registry.size());

    registry.put("s5", record("s5"));

    assertEquals(5, registry.size());
    assertFalse(registry.contains("s0"));
    assertTrue(registry.contains("s5"));
    verify(subscriptions.get(0)).unsubscribe();
    verify(records.get(0).workHandle()).cancel();
    verify(records.get(0).workHandle()).release();
    for (int i = 1; i < 5; i++) {
      assertFalse(records.get(i).isDisposed());
      verify(subscriptions.get(i), never()).unsubscribe();
      verify(records.get(i).workHandle(), never()).cancel();
      verify(records.get(i).workHandle(), never()).release();
    }
  }

  @Test
  void evictionSkipsBusySessions() throws Exception {
    registry.put("busy", record("busy", true, 1));
    for (int i = 0; i < 4; i++) {
      registry.put("s" + i, record("s" + i, false, 100 + i));
    }

    registry.put("new", record("new"));

    assertTrue(registry.contains("busy"));
    assertFalse(registry.contains("s0"));
    assertTrue(registry.contains("new"));
  }

  @Test
  void throwsWhenAllSessionsAreBusyAtCapacity() throws Exception {
    for (int i = 0; i < 5; i++) {
      registry.put("s" + i, record("s" + i, true, 1000 + i));
    }
    SessionRecord overflow = record("overflow");

    CapacityExhaustedException e =
        assertThrows(CapacityExhaustedException.class, () -> registry.put("overflow", overflow));

    assertTrue(e.getMessage().contains("Maximum sessions (5) reached"));
    assertEquals(5, e.getMaxSessions());
    assertEquals(5, registry.size());
    assertFalse(registry.contains("overflow"));
    for (int i = 0; i < 5; i++) {
      assertTrue(registry.contains("s" + i));
    }
    assertFalse(overflow.isDisposed());
  }

  @Test
  void replacingExistingIdDoesNotEvict() throws Exception {
    for (int i = 0; i < 5; i++) {
      registry.put("s" + i, record("s" + i, true, 1000 + i));
    }

    SessionRecord replacement = record("s0", true, 2000);
    registry.put("s0", replacement);

    assertEquals(5, registry.size());
    assertSame(replacement, registry.get("s0").orElseThrow());
  }

  @Test
  void replacingExistingIdDisposesPreviousRecord() throws Exception {
    SessionRecord first = record("a");
    registry.put("a", first);

    registry.put("a", record("a"));

    assertTrue(first.isDisposed());
  }

  @Test
  void sizeNeverExceedsMaxSessions() throws Exception {
    for (int i = 0; i < 20; i++) {
      clock.advance(Duration.ofMillis(1));
      registry.put("s" + i, record("s" + i));
      assertTrue(registry.size() <= 5);
      if (i % 3 == 0) {
        registry.remove("s" + (i - 1));
      }
    }
  }

  @Test
  void removeContinuesCleanupWhenUnsubscribeThrows() throws Exception {
    Subscription failing = mock(Subscription.class);
    doThrow(new IllegalStateException("unsubscribe failed")).when(failing).unsubscribe();
    WorkHandle handle = handle(false);
    registry.put("a", new SessionRecord("a", handle, failing, clock.millis()));

    assertDoesNotThrow(() -> registry.remove("a"));

    assertFalse(registry.contains("a"));
    verify(failing).unsubscribe();
    verify(handle).cancel();
    verify(handle).release();
  }

  @Test
  void removeContinuesCleanupWhenCancelThrowsSynchronously() throws Exception {
    WorkHandle handle = handle(false);
    when(handle.cancel()).thenThrow(new IllegalStateException("cancel failed"));
    registry.put("a", new SessionRecord("a", handle, null, clock.millis()));

    assertDoesNotThrow(() -> registry.remove("a"));

    verify(handle).release();
  }

  @Test
  void removeAbsorbsAsynchronousCancelFailure() throws Exception {
    WorkHandle handle = handle(false);
    when(handle.cancel())
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("abort rejected")));
    registry.put("a", new SessionRecord("a", handle, null, clock.millis()));

    assertDoesNotThrow(() -> registry.remove("a"));

    verify(handle).release();
  }

  @Test
  void removeAbsorbsReleaseFailure() throws Exception {
    WorkHandle handle = handle(false);
    doThrow(new IllegalStateException("release failed")).when(handle).release();
    registry.put("a", new SessionRecord("a", handle, null, clock.millis()));

    assertDoesNotThrow(() -> registry.remove("a"));
    assertFalse(registry.contains("a"));
  }

  @Test
  void drainAllDisposesEverySessionOnceEvenWhenCleanupThrows() throws Exception {
    List<SessionRecord> records = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      Subscription subscription = mock(Subscription.class);
      if (i == 1) {
        doThrow(new IllegalStateException("boom")).when(subscription).unsubscribe();
      }
      SessionRecord r = new SessionRecord("s" + i, handle(false), subscription, clock.millis());
      records.add(r);
      registry.put("s" + i, r);
    }

    registry.drainAll();

    assertEquals(0, registry.size());
    for (SessionRecord r : records) {
      assertTrue(r.isDisposed());
      verify(r.workHandle(), times(1)).release();
    }
  }

  @Test
  void disposeRunsOnlyOnce() {
    SessionRecord a = record("a");

    assertTrue(a.dispose());
    assertFalse(a.dispose());

    verify(a.workHandle(), times(1)).release();
  }

  @Test
  void lastAccessedNeverMovesBackwards() {
    SessionRecord a = record("a", false, 5000);

    a.touch(4000);

    assertEquals(5000, a.lastAccessed());
  }

  @Test
  void fullRegistryScenarioEvictsFirstIdleSession() throws Exception {
    for (int i = 1; i <= 5; i++) {
      clock.advance(Duration.ofSeconds(1));
      registry.put("t" + i, record("t" + i));
    }

    clock.advance(Duration.ofSeconds(1));
    registry.put("t6", record("t6"));

    assertFalse(registry.contains("t1"));
    assertTrue(registry.contains("t6"));
    assertEquals(5, registry.size());
  }
}
