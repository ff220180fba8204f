package io.tabdeck.status.channel;

import io.tabdeck.status.ResourceKey;
import io.tabdeck.status.WorkloadStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publish/subscribe channel for the status of one resource.
 * <p>
 * The channel keeps the last published state and hands it to every new subscriber as its first
 * event. The current state and the subscriber set are guarded by one lock per channel, which also
 * serializes publishes so every subscriber sees them in the same order.
 */
public final class BroadcastChannel {

  public static final int DEFAULT_QUEUE_CAPACITY = 32;

  private static final Logger log = LoggerFactory.getLogger(BroadcastChannel.class);

  private final ResourceKey key;
  private final int queueCapacity;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Long, Subscription> subscribers = new LinkedHashMap<>();

  private WorkloadStatus current = WorkloadStatus.running();
  private long nextSubscriptionId;

  public BroadcastChannel(ResourceKey key) {
    this(key, DEFAULT_QUEUE_CAPACITY);
  }

  public BroadcastChannel(ResourceKey key, int queueCapacity) {
    this.key = Objects.requireNonNull(key, "key");
    if (queueCapacity < 1) {
      throw new IllegalArgumentException("queueCapacity must be at least 1");
    }
    this.queueCapacity = queueCapacity;
  }

  public ResourceKey key() {
    return key;
  }

  public Subscription subscribe() {
    Subscription subscription;
    int count;
    lock.lock();
    try {
      subscription = new Subscription(++nextSubscriptionId, this, queueCapacity);
      subscription.offer(current);
      subscribers.put(subscription.id(), subscription);
      count = subscribers.size();
    } finally {
      lock.unlock();
    }
    log.debug("[STREAM] subscribe key={} subscription={} subscribers={}", key, subscription.id(), count);
    return subscription;
  }

  public void publish(WorkloadStatus status) {
    Objects.requireNonNull(status, "status");
    int delivered;
    lock.lock();
    try {
      current = status;
      for (Subscription subscription : subscribers.values()) {
        subscription.offer(status);
      }
      delivered = subscribers.size();
    } finally {
      lock.unlock();
    }
    log.debug("[STREAM] publish key={} state={} subscribers={}", key, status.state(), delivered);
  }

  public DeliveryEvent nextEvent(Subscription subscription) throws InterruptedException {
    return requireOwned(subscription).next();
  }

  public DeliveryEvent nextEvent(Subscription subscription, Duration heartbeatInterval)
      throws InterruptedException {
    return requireOwned(subscription).next(heartbeatInterval);
  }

  /**
   * Removes the subscription from this channel and wakes its consumer with a closed event.
   *
   * @return {@code true} if this call released the registration, {@code false} if it had already
   *     been released
   */
  public boolean unsubscribe(Subscription subscription) {
    requireOwned(subscription);
    if (!subscription.release()) {
      return false;
    }
    int remaining;
    lock.lock();
    try {
      subscribers.remove(subscription.id());
      remaining = subscribers.size();
    } finally {
      lock.unlock();
    }
    subscription.markClosed();
    log.debug("[STREAM] unsubscribe key={} subscription={} subscribers={}",
        key, subscription.id(), remaining);
    return true;
  }

  /**
   * Ends every active subscription. Consumers blocked in {@code nextEvent} observe a closed event.
   */
  public void closeAll() {
    List<Subscription> snapshot;
    lock.lock();
    try {
      snapshot = new ArrayList<>(subscribers.values());
    } finally {
      lock.unlock();
    }
    for (Subscription subscription : snapshot) {
      unsubscribe(subscription);
    }
    if (!snapshot.isEmpty()) {
      log.info("[STREAM] closed {} subscription(s) for {}", snapshot.size(), key);
    }
  }

  public WorkloadStatus current() {
    lock.lock();
    try {
      return current;
    } finally {
      lock.unlock();
    }
  }

  public int subscriberCount() {
    lock.lock();
    try {
      return subscribers.size();
    } finally {
      lock.unlock();
    }
  }

  private Subscription requireOwned(Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    if (subscription.channel() != this) {
      throw new IllegalArgumentException(
          "subscription " + subscription.id() + " belongs to " + subscription.key() + ", not " + key);
    }
    return subscription;
  }
}
