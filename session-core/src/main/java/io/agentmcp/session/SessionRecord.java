package io.agentmcp.session;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One admitted session: the work handle, the event subscription tied to it, its last access time
 * and the serializer guarding it.
 */
public final class SessionRecord {

  private static final Logger LOG = LoggerFactory.getLogger(SessionRecord.class);

  private final String id;
  private final WorkHandle workHandle;
  private final Subscription subscription;
  private final AtomicLong lastAccessed;
  private final AccessSerializer serializer = new AccessSerializer();
  private final AtomicBoolean disposed = new AtomicBoolean();

  /**
   * @param id session id, fixed for the lifetime of the record
   * @param workHandle the work unit
   * @param subscription event subscription to cancel on disposal
   * @param lastAccessed initial access time in epoch millis
   */
  public SessionRecord(
      String id, WorkHandle workHandle, Subscription subscription, long lastAccessed) {
    this.id = Objects.requireNonNull(id, "id");
    this.workHandle = Objects.requireNonNull(workHandle, "workHandle");
    this.subscription = subscription != null ? subscription : Subscription.none();
    this.lastAccessed = new AtomicLong(lastAccessed);
  }

  public String id() {
    return id;
  }

  public WorkHandle workHandle() {
    return workHandle;
  }

  public AccessSerializer serializer() {
    return serializer;
  }

  public long lastAccessed() {
    return lastAccessed.get();
  }

  /** Moves the access time forward to {@code nowMillis}; never moves it back. */
  public void touch(long nowMillis) {
    lastAccessed.accumulateAndGet(nowMillis, Math::max);
  }

  public boolean isDisposed() {
    return disposed.get();
  }

  /**
   * Releases the record's resources: cancels the event subscription, cancels in-flight work and
   * releases the handle. Each step is guarded on its own, so a failure is logged and the next step
   * still runs. Only the first call does anything.
   *
   * @return true if this call performed the release
   */
  public boolean dispose() {
    if (!disposed.compareAndSet(false, true)) {
      return false;
    }

    try {
      subscription.unsubscribe();
    } catch (RuntimeException e) {
      LOG.warn("Session {}: unsubscribe failed: {}", id, e.getMessage(), e);
    }

    try {
      var cancelled = workHandle.cancel();
      if (cancelled != null) {
        cancelled.whenComplete(
            (ignored, error) -> {
              if (error != null) {
                LOG.warn("Session {}: cancel failed: {}", id, error.getMessage(), error);
              }
            });
      }
    } catch (RuntimeException e) {
      LOG.warn("Session {}: cancel threw synchronously: {}", id, e.getMessage(), e);
    }

    try {
      workHandle.release();
    } catch (RuntimeException e) {
      LOG.warn("Session {}: release failed: {}", id, e.getMessage(), e);
    }

    LOG.debug("Disposed session {}", id);
    return true;
  }

  @Override
  public String toString() {
    return "SessionRecord[" + id + "]";
  }
}
