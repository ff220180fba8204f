package io.tabdeck.status.channel;

import io.tabdeck.status.ResourceKey;
import io.tabdeck.status.WorkloadStatus;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single observer's registration on a {@link BroadcastChannel}.
 * <p>
 * Each subscription owns a bounded queue of pending states. When the consumer falls behind, the
 * oldest pending state is dropped so the queue never grows past its capacity; the newest state is
 * always kept. Heartbeat timing is local to the subscription and only advances while the consumer
 * waits in {@link #next(Duration)}.
 * <p>
 * Closing the subscription (directly, via try-with-resources, or through
 * {@link BroadcastChannel#unsubscribe(Subscription)}) releases the channel registration exactly once.
 */
public final class Subscription implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(Subscription.class);

  private final long id;
  private final BroadcastChannel channel;
  private final int capacity;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final ArrayDeque<WorkloadStatus> pending;
  private final AtomicBoolean released = new AtomicBoolean(false);

  private long lastDeliveryNanos;
  private long dropped;
  private boolean closed;

  Subscription(long id, BroadcastChannel channel, int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1");
    }
    this.id = id;
    this.channel = Objects.requireNonNull(channel, "channel");
    this.capacity = capacity;
    this.pending = new ArrayDeque<>(capacity);
    this.lastDeliveryNanos = System.nanoTime();
  }

  public long id() {
    return id;
  }

  public ResourceKey key() {
    return channel.key();
  }

  BroadcastChannel channel() {
    return channel;
  }

  /**
   * Waits for the next state without ever producing heartbeats.
   */
  public DeliveryEvent next() throws InterruptedException {
    return awaitNext(0L);
  }

  /**
   * Waits for the next state, or emits a heartbeat once {@code heartbeatInterval} has passed since
   * the last delivery.
   */
  public DeliveryEvent next(Duration heartbeatInterval) throws InterruptedException {
    Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
    if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
      throw new IllegalArgumentException("heartbeatInterval must be positive");
    }
    return awaitNext(heartbeatInterval.toNanos());
  }

  private DeliveryEvent awaitNext(long heartbeatNanos) throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (true) {
        if (closed) {
          return DeliveryEvent.closed();
        }
        WorkloadStatus status = pending.pollFirst();
        if (status != null) {
          lastDeliveryNanos = System.nanoTime();
          return DeliveryEvent.status(status);
        }
        if (heartbeatNanos <= 0L) {
          changed.await();
          continue;
        }
        long remaining = lastDeliveryNanos + heartbeatNanos - System.nanoTime();
        if (remaining <= 0L) {
          lastDeliveryNanos = System.nanoTime();
          return DeliveryEvent.heartbeat();
        }
        changed.await(remaining, TimeUnit.NANOSECONDS);
      }
    } finally {
      lock.unlock();
    }
  }

  void offer(WorkloadStatus status) {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      if (pending.size() >= capacity) {
        pending.pollFirst();
        dropped++;
        log.debug("Subscription {} on {} is lagging; dropped oldest pending state (dropped={})",
            id, channel.key(), dropped);
      }
      pending.addLast(status);
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  boolean release() {
    return released.compareAndSet(false, true);
  }

  void markClosed() {
    lock.lock();
    try {
      closed = true;
      pending.clear();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  public int pendingCount() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  public long droppedCount() {
    lock.lock();
    try {
      return dropped;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    channel.unsubscribe(this);
  }

  @Override
  public String toString() {
    return "Subscription{id=" + id + ", key=" + channel.key() + "}";
  }
}
