package io.agentmcp.session;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for per-session serialization of work. */
class AccessSerializerTest {

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  /** Starts {@code task} on its own thread and returns once it is parked waiting for its turn. */
  private Thread startWaiting(Runnable task) throws InterruptedException {
    Thread t = new Thread(task);
    t.start();
    long deadline = System.currentTimeMillis() + 5000;
    while (t.getState() != Thread.State.WAITING && System.currentTimeMillis() < deadline) {
      Thread.sleep(1);
    }
    assertEquals(Thread.State.WAITING, t.getState());
    return t;
  }

  @Test
  void runsWorkImmediatelyWhenUncontended() throws Exception {
    AccessSerializer serializer = new AccessSerializer();

    String result = serializer.runExclusive("s", () -> true, () -> "done");

    assertEquals("done", result);
    assertFalse(serializer.isHeld());
  }

  @Test
  void waitersRunInArrivalOrder() throws Exception {
    AccessSerializer serializer = new AccessSerializer();
    List<String> order = new CopyOnWriteArrayList<>();
    CountDownLatch holderStarted = new CountDownLatch(1);
    CountDownLatch releaseHolder = new CountDownLatch(1);

    Future<?> holder =
        executor.submit(
            () ->
                serializer.runExclusive(
                    "s",
                    () -> true,
                    () -> {
                      order.add("first-start");
                      holderStarted.countDown();
                      releaseHolder.await();
                      order.add("first-end");
                      return null;
                    }));
    assertTrue(holderStarted.await(5, TimeUnit.SECONDS));

    Thread second = startWaiting(() -> runQuietly(serializer, order, "second"));
    Thread third = startWaiting(() -> runQuietly(serializer, order, "third"));
    assertEquals(List.of("first-start"), order);

    releaseHolder.countDown();
    holder.get(5, TimeUnit.SECONDS);
    second.join(5000);
    third.join(5000);

    assertEquals(
        List.of("first-start", "first-end", "second-start", "second-end", "third-start",
            "third-end"),
        order);
  }

  private static void runQuietly(AccessSerializer serializer, List<String> order, String name) {
    try {
      serializer.runExclusive(
          "s",
          () -> true,
          () -> {
            order.add(name + "-start");
            order.add(name + "-end");
            return null;
          });
    } catch (Exception e) {
      order.add(name + "-failed");
    }
  }

  @Test
  void failedWorkReleasesNextWaiter() throws Exception {
    AccessSerializer serializer = new AccessSerializer();

    assertThrows(
        WorkException.class,
        () ->
            serializer.runExclusive(
                "s",
                () -> true,
                () -> {
                  throw new WorkException("agent failed");
                }));
    assertThrows(
        IllegalStateException.class,
        () ->
            serializer.runExclusive(
                "s",
                () -> true,
                () -> {
                  throw new IllegalStateException("unexpected");
                }));

    assertEquals("next", serializer.runExclusive("s", () -> true, () -> "next"));
  }

  @Test
  void skipsWorkWhenSessionIsGoneAfterWait() {
    AccessSerializer serializer = new AccessSerializer();
    AtomicInteger runs = new AtomicInteger();

    SessionNotFoundException e =
        assertThrows(
            SessionNotFoundException.class,
            () -> serializer.runExclusive("s", () -> false, runs::incrementAndGet));

    assertEquals(0, runs.get());
    assertTrue(e.getMessage().startsWith(SessionNotFoundException.PREFIX));
    assertFalse(serializer.isHeld());
  }

  @Test
  void interruptedWaiterKeepsLaterWaitersBehindHolder() throws Exception {
    AccessSerializer serializer = new AccessSerializer();
    List<String> order = new CopyOnWriteArrayList<>();
    CountDownLatch holderStarted = new CountDownLatch(1);
    CountDownLatch releaseHolder = new CountDownLatch(1);

    Future<?> holder =
        executor.submit(
            () ->
                serializer.runExclusive(
                    "s",
                    () -> true,
                    () -> {
                      holderStarted.countDown();
                      releaseHolder.await();
                      order.add("holder-end");
                      return null;
                    }));
    assertTrue(holderStarted.await(5, TimeUnit.SECONDS));

    Thread interrupted = startWaiting(() -> runQuietly(serializer, order, "interrupted"));
    Thread last = startWaiting(() -> runQuietly(serializer, order, "last"));

    interrupted.interrupt();
    interrupted.join(5000);
    Thread.sleep(50);
    assertEquals(List.of("interrupted-failed"), order);

    releaseHolder.countDown();
    holder.get(5, TimeUnit.SECONDS);
    last.join(5000);

    assertEquals(List.of("interrupted-failed", "holder-end", "last-start", "last-end"), order);
  }

  @Test
  void waiterFailsWithNotFoundWhenSessionRemovedWhileWaiting() throws Exception {
    SessionRegistry registry = new SessionRegistry(5, Duration.ZERO);
    WorkHandle handle = mock(WorkHandle.class);
    when(handle.cancel()).thenReturn(CompletableFuture.completedFuture(null));
    CountDownLatch holderStarted = new CountDownLatch(1);
    CountDownLatch releaseHolder = new CountDownLatch(1);
    when(handle.submit("first"))
        .thenAnswer(
            invocation -> {
              holderStarted.countDown();
              releaseHolder.await();
              return "one";
            });
    registry.put("a", new SessionRecord("a", handle, null, System.currentTimeMillis()));

    Future<String> first = executor.submit(() -> registry.withSession("a", h -> h.submit("first")));
    assertTrue(holderStarted.await(5, TimeUnit.SECONDS));

    CompletableFuture<Throwable> waiterOutcome = new CompletableFuture<>();
    startWaiting(
        () -> {
          try {
            registry.withSession("a", h -> h.submit("second"));
            waiterOutcome.complete(null);
          } catch (Exception e) {
            waiterOutcome.complete(e);
          }
        });

    registry.remove("a");
    releaseHolder.countDown();

    assertEquals("one", first.get(5, TimeUnit.SECONDS));
    Throwable outcome = waiterOutcome.get(5, TimeUnit.SECONDS);
    assertInstanceOf(SessionNotFoundException.class, outcome);
    assertTrue(outcome.getMessage().contains("evicted while waiting"));
    verify(handle, never()).submit("second");
    registry.drainAll();
  }

  @Test
  void withSessionFailsForMissingSession() {
    SessionRegistry registry = new SessionRegistry(5, Duration.ZERO);

    SessionNotFoundException e =
        assertThrows(
            SessionNotFoundException.class, () -> registry.withSession("nope", h -> "x"));

    assertTrue(e.getMessage().startsWith("Session not found: nope"));
    registry.drainAll();
  }

  @Test
  void withSessionRefreshesAccessTimeAfterWork() throws Exception {
    SessionRegistry registry = new SessionRegistry(5, Duration.ZERO);
    WorkHandle handle = mock(WorkHandle.class);
    when(handle.submit("go")).thenThrow(new WorkException("agent failed"));
    SessionRecord record = new SessionRecord("a", handle, null, 1000);
    registry.put("a", record);

    assertThrows(WorkException.class, () -> registry.withSession("a", h -> h.submit("go")));

    assertTrue(record.lastAccessed() > 1000);
    assertEquals("ok", registry.withSession("a", h -> "ok"));
    registry.drainAll();
  }
}
