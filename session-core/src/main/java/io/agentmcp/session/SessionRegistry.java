package io.agentmcp.session;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded registry of agent sessions.
 *
 * <p>Thread-safe. Holds at most {@code maxSessions} records. Admitting a new id at capacity evicts
 * the least recently used idle session; if every session is busy the admission is refused. Sessions
 * idle for longer than the configured timeout are disposed by a background sweep. Every path that
 * takes a record out of the registry disposes it through {@link SessionRecord#dispose()}.
 */
public final class SessionRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);

  static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

  /** Work performed against a session's handle while holding the session. */
  @FunctionalInterface
  public interface SessionWork<T> {
    T run(WorkHandle handle) throws WorkException, InterruptedException;
  }

  private final int maxSessions;
  private final Duration idleTimeout;
  private final Clock clock;
  private final Map<String, SessionRecord> sessions = new LinkedHashMap<>();
  private final ScheduledExecutorService sweeper;
  private volatile boolean sweepStopped;

  /**
   * @param maxSessions maximum number of stored sessions, positive
   * @param idleTimeout idle time after which a session expires; zero disables expiry
   */
  public SessionRegistry(int maxSessions, Duration idleTimeout) {
    this(maxSessions, idleTimeout, Clock.systemUTC(), DEFAULT_SWEEP_INTERVAL);
  }

  SessionRegistry(int maxSessions, Duration idleTimeout, Clock clock, Duration sweepInterval) {
    if (maxSessions < 1) {
      throw new IllegalArgumentException("maxSessions must be positive: " + maxSessions);
    }
    if (idleTimeout.isNegative()) {
      throw new IllegalArgumentException("idleTimeout must not be negative: " + idleTimeout);
    }
    this.maxSessions = maxSessions;
    this.idleTimeout = idleTimeout;
    this.clock = clock;

    if (idleTimeout.isZero()) {
      this.sweeper = null;
    } else {
      this.sweeper =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "session-idle-sweep");
                t.setDaemon(true);
                return t;
              });
      long intervalMs = sweepInterval.toMillis();
      sweeper.scheduleWithFixedDelay(
          this::sweepIdle, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    LOG.info(
        "SessionRegistry created (maxSessions={}, idleTimeout={})",
        maxSessions,
        idleTimeout.isZero() ? "disabled" : idleTimeout);
  }

  /** Checks whether a session is stored under {@code id}. Does not count as a use. */
  public synchronized boolean contains(String id) {
    return sessions.containsKey(id);
  }

  /**
   * Looks up a session and marks it as used now.
   *
   * @param id session id
   * @return the record, or empty if absent
   */
  public synchronized Optional<SessionRecord> get(String id) {
    SessionRecord record = sessions.get(id);
    if (record != null) {
      record.touch(clock.millis());
    }
    return Optional.ofNullable(record);
  }

  /**
   * Stores a session.
   *
   * <p>Replacing an existing id never evicts. Adding a new id at capacity evicts the idle session
   * with the oldest access time.
   *
   * @param id session id
   * @param record session record
   * @throws CapacityExhaustedException if at capacity and every stored session is busy; the record
   *     is not stored and stays the caller's to dispose
   */
  public void put(String id, SessionRecord record) throws CapacityExhaustedException {
    if (!id.equals(record.id())) {
      throw new IllegalArgumentException(
          "Record id " + record.id() + " does not match session id " + id);
    }
    SessionRecord evicted = null;
    SessionRecord replaced;

    synchronized (this) {
      if (!sessions.containsKey(id) && sessions.size() >= maxSessions) {
        String oldestId = null;
        long oldestTime = Long.MAX_VALUE;
        for (Map.Entry<String, SessionRecord> entry : sessions.entrySet()) {
          SessionRecord candidate = entry.getValue();
          if (!isBusy(candidate) && candidate.lastAccessed() < oldestTime) {
            oldestTime = candidate.lastAccessed();
            oldestId = entry.getKey();
          }
        }

        if (oldestId == null) {
          throw new CapacityExhaustedException(maxSessions);
        }
        evicted = sessions.remove(oldestId);
      }
      replaced = sessions.put(id, record);
    }

    if (evicted != null) {
      LOG.info("Evicted idle session {} to admit {}", evicted.id(), id);
      evicted.dispose();
    }
    if (replaced != null && replaced != record) {
      replaced.dispose();
    }
  }

  /**
   * Removes and disposes a session. Absent ids are ignored.
   *
   * @param id session id
   * @return true if a session was removed
   */
  public boolean remove(String id) {
    SessionRecord record;
    synchronized (this) {
      record = sessions.remove(id);
    }
    if (record == null) {
      return false;
    }
    record.dispose();
    LOG.info("Removed session {}", id);
    return true;
  }

  /**
   * Removes and disposes every stored session, continuing past failures.
   *
   * @return number of sessions removed
   */
  public int removeAll() {
    List<String> ids;
    synchronized (this) {
      ids = new ArrayList<>(sessions.keySet());
    }

    int removed = 0;
    for (String id : ids) {
      try {
        if (remove(id)) {
          removed++;
        }
      } catch (RuntimeException e) {
        LOG.warn("Error disposing session {}: {}", id, e.getMessage(), e);
      }
    }
    return removed;
  }

  /**
   * Stops the idle sweep, then disposes every stored session. Meant for shutdown; the sweep is not
   * restarted.
   */
  public void drainAll() {
    stopSweep();
    int count = size();
    LOG.info("Draining SessionRegistry, disposing {} sessions", count);
    removeAll();
  }

  /**
   * Runs {@code work} against a session, after every earlier caller on the same session is done.
   *
   * <p>The session's access time is refreshed when the work completes, so long-running work does
   * not make the session look idle.
   *
   * @param id session id
   * @param work work to perform against the session's handle
   * @return the work's result
   * @throws SessionNotFoundException if the session is absent, or was removed while waiting
   * @throws WorkException if the work fails
   * @throws InterruptedException if interrupted while waiting or working
   */
  public <T> T withSession(String id, SessionWork<T> work)
      throws SessionNotFoundException, WorkException, InterruptedException {
    SessionRecord record = get(id).orElseThrow(() -> SessionNotFoundException.missing(id));

    return record
        .serializer()
        .runExclusive(
            id,
            () -> isLive(id, record),
            () -> {
              try {
                return work.run(record.workHandle());
              } finally {
                record.touch(clock.millis());
              }
            });
  }

  /** Returns the number of stored sessions. */
  public synchronized int size() {
    return sessions.size();
  }

  public int maxSessions() {
    return maxSessions;
  }

  public Duration idleTimeout() {
    return idleTimeout;
  }

  /** Disposes every session idle for longer than the timeout. */
  void sweepIdle() {
    if (sweepStopped || idleTimeout.isZero()) {
      return;
    }

    List<SessionRecord> snapshot;
    synchronized (this) {
      snapshot = new ArrayList<>(sessions.values());
    }

    long now = clock.millis();
    long timeoutMs = idleTimeout.toMillis();
    for (SessionRecord record : snapshot) {
      if (now - record.lastAccessed() <= timeoutMs) {
        continue;
      }
      try {
        if (removeIfSame(record)) {
          LOG.info("Session {} expired after {} idle", record.id(), idleTimeout);
        }
      } catch (RuntimeException e) {
        LOG.warn("Session {}: expiry disposal failed: {}", record.id(), e.getMessage(), e);
      }
    }
  }

  boolean isSweepScheduled() {
    return sweeper != null && !sweeper.isShutdown();
  }

  private synchronized boolean isLive(String id, SessionRecord record) {
    return sessions.get(id) == record;
  }

  private boolean removeIfSame(SessionRecord record) {
    synchronized (this) {
      if (!sessions.remove(record.id(), record)) {
        return false;
      }
    }
    record.dispose();
    return true;
  }

  private void stopSweep() {
    sweepStopped = true;
    if (sweeper != null) {
      sweeper.shutdownNow();
    }
  }

  private static boolean isBusy(SessionRecord record) {
    try {
      return record.workHandle().isBusy();
    } catch (RuntimeException e) {
      LOG.warn("Session {}: busy check failed, treating as busy: {}", record.id(), e.getMessage());
      return true;
    }
  }
}
