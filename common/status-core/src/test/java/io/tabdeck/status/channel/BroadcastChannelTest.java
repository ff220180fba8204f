package io.tabdeck.status.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tabdeck.status.ResourceKey;
import io.tabdeck.status.StatusState;
import io.tabdeck.status.WorkloadStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BroadcastChannelTest {

  private final ResourceKey key = ResourceKey.of("apps", "z2m");
  private final ExecutorService pool = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void freshChannelDeliversRunningFirst() throws Exception {
    BroadcastChannel channel = new BroadcastChannel(key);

    try (Subscription subscription = channel.subscribe()) {
      DeliveryEvent first = channel.nextEvent(subscription);

      assertThat(first.kind()).isEqualTo(DeliveryEvent.Kind.STATUS);
      assertThat(first.status()).isEqualTo(WorkloadStatus.running());
    }
  }

  @Test
  void lateSubscriberReceivesCurrentStateForEveryState() throws Exception {
    List<WorkloadStatus> states = List.of(
        WorkloadStatus.running(),
        WorkloadStatus.restarting(),
        WorkloadStatus.error("deployment rollout failed: crash loop"));
    for (WorkloadStatus state : states) {
      BroadcastChannel channel = new BroadcastChannel(key);
      channel.publish(WorkloadStatus.restarting());
      channel.publish(state);

      try (Subscription subscription = channel.subscribe()) {
        assertThat(subscription.next().status()).isEqualTo(state);
        assertThat(subscription.pendingCount()).isZero();
      }
    }
  }

  @Test
  void publishFansOutToAllSubscribersInOrder() throws Exception {
    BroadcastChannel channel = new BroadcastChannel(key);
    List<Subscription> subscriptions = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      subscriptions.add(channel.subscribe());
    }

    channel.publish(WorkloadStatus.restarting());
    channel.publish(WorkloadStatus.error("boom"));

    for (Subscription subscription : subscriptions) {
      assertThat(subscription.next().status().state()).isEqualTo(StatusState.RUNNING);
      assertThat(subscription.next().status().state()).isEqualTo(StatusState.RESTARTING);
      assertThat(subscription.next().status()).isEqualTo(WorkloadStatus.error("boom"));
      subscription.close();
    }
    assertThat(channel.subscriberCount()).isZero();
  }

  @Test
  void concurrentPublishersAreSeenInTheSameOrderByEverySubscriber() throws Exception {
    BroadcastChannel channel = new BroadcastChannel(key, 1024);
    Subscription a = channel.subscribe();
    Subscription b = channel.subscribe();
    a.next();
    b.next();

    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> publishers = new ArrayList<>();
    for (int p = 0; p < 4; p++) {
      int publisher = p;
      publishers.add(pool.submit(() -> {
        start.await();
        for (int i = 0; i < 50; i++) {
          channel.publish(WorkloadStatus.error(publisher + ":" + i));
        }
        return null;
      }));
    }
    start.countDown();
    for (Future<?> publisher : publishers) {
      publisher.get(5, TimeUnit.SECONDS);
    }

    List<String> seenByA = drainMessages(a, 200);
    List<String> seenByB = drainMessages(b, 200);
    assertThat(seenByA).hasSize(200).isEqualTo(seenByB);
    assertThat(channel.current().message()).isEqualTo(seenByA.get(199));
  }

  @Test
  void blockedConsumerWakesOnPublish() throws Exception {
    BroadcastChannel channel = new BroadcastChannel(key);
    Subscription subscription = channel.subscribe();
    subscription.next();

    Future<DeliveryEvent> pending = pool.submit(() -> subscription.next());
    Thread.sleep(50);
    channel.publish(WorkloadStatus.restarting());

    assertThat(pending.get(2, TimeUnit.SECONDS).status()).isEqualTo(WorkloadStatus.restarting());
  }

  @Test
  void unsubscribeIsIdempotentAndStopsDelivery() throws Exception {
    BroadcastChannel channel = new BroadcastChannel(key);
    Subscription subscription = channel.subscribe();
    Subscription other = channel.subscribe();
    assertThat(channel.subscriberCount()).isEqualTo(2);

    assertThat(channel.unsubscribe(subscription)).isTrue();
    assertThat(channel.unsubscribe(subscription)).isFalse();
    subscription.close();
    channel.publish(WorkloadStatus.restarting());

    assertThat(channel.subscriberCount()).isEqualTo(1);
    assertThat(subscription.isClosed()).isTrue();
    assertThat(subscription.pendingCount()).isZero();
    assertThat(subscription.next().kind()).isEqualTo(DeliveryEvent.Kind.CLOSED);
    assertThat(other.pendingCount()).isEqualTo(2);
  }

  @Test
  void unsubscribeWakesConsumerBlockedOnHeartbeatWait() throws Exception {
    BroadcastChannel channel = new BroadcastChannel(key);
    Subscription subscription = channel.subscribe();
    subscription.next();

    Future<DeliveryEvent> pending = pool.submit(() -> subscription.next(Duration.ofMinutes(5)));
    Thread.sleep(50);
    channel.unsubscribe(subscription);

    assertThat(pending.get(2, TimeUnit.SECONDS).kind()).isEqualTo(DeliveryEvent.Kind.CLOSED);
  }

  @Test
  void unsubscribeRacingWithPublishesReleasesExactlyOnce() throws Exception {
    BroadcastChannel channel = new BroadcastChannel(key);
    for (int round = 0; round < 50; round++) {
      Subscription subscription = channel.subscribe();
      CountDownLatch start = new CountDownLatch(1);
      Future<?> publisher = pool.submit(() -> {
        start.await();
        for (int i = 0; i < 20; i++) {
          channel.publish(WorkloadStatus.restarting());
        }
        return null;
      });
      Future<Boolean> first = pool.submit(() -> {
        start.await();
        return channel.unsubscribe(subscription);
      });
      Future<Boolean> second = pool.submit(() -> {
        start.await();
        return channel.unsubscribe(subscription);
      });
      start.countDown();
      publisher.get(2, TimeUnit.SECONDS);

      assertThat(List.of(first.get(2, TimeUnit.SECONDS), second.get(2, TimeUnit.SECONDS)))
          .containsExactlyInAnyOrder(true, false);
      assertThat(subscription.pendingCount()).isZero();
    }
    assertThat(channel.subscriberCount()).isZero();
  }

  @Test
  void idleSubscriptionEmitsSpacedHeartbeats() throws Exception {
    BroadcastChannel channel = new BroadcastChannel(key);
    Duration interval = Duration.ofMillis(100);

    try (Subscription subscription = channel.subscribe()) {
      assertThat(channel.nextEvent(subscription, interval).isStatus()).isTrue();

      long previous = System.nanoTime();
      for (int i = 0; i < 3; i++) {
        DeliveryEvent event = channel.nextEvent(subscription, interval);
        long now = System.nanoTime();

        assertThat(event.kind()).isEqualTo(DeliveryEvent.Kind.HEARTBEAT);
        assertThat(Duration.ofNanos(now - previous)).isGreaterThanOrEqualTo(interval.minusMillis(5));
        previous = now;
      }
    }
  }

  @Test
  void statusDeliveryResetsHeartbeatTimer() throws Exception {
    BroadcastChannel channel = new BroadcastChannel(key);
    Duration interval = Duration.ofMillis(300);
    Subscription subscription = channel.subscribe();
    subscription.next(interval);

    Thread.sleep(200);
    channel.publish(WorkloadStatus.restarting());
    assertThat(subscription.next(interval).status()).isEqualTo(WorkloadStatus.restarting());

    long before = System.nanoTime();
    assertThat(subscription.next(interval).kind()).isEqualTo(DeliveryEvent.Kind.HEARTBEAT);
    assertThat(Duration.ofNanos(System.nanoTime() - before)).isGreaterThanOrEqualTo(Duration.ofMillis(250));
    subscription.close();
  }

  @Test
  void laggingSubscriberKeepsOnlyMostRecentStates() throws Exception {
    BroadcastChannel channel = new BroadcastChannel(key, 3);
    Subscription subscription = channel.subscribe();

    for (int i = 1; i <= 10; i++) {
      channel.publish(WorkloadStatus.error("e" + i));
    }

    assertThat(subscription.pendingCount()).isEqualTo(3);
    assertThat(subscription.droppedCount()).isEqualTo(8);
    assertThat(drainMessages(subscription, 3)).containsExactly("e8", "e9", "e10");
  }

  @Test
  void closeAllEndsEverySubscription() throws Exception {
    BroadcastChannel channel = new BroadcastChannel(key);
    Subscription a = channel.subscribe();
    Subscription b = channel.subscribe();

    channel.closeAll();

    assertThat(channel.subscriberCount()).isZero();
    assertThat(a.next().kind()).isEqualTo(DeliveryEvent.Kind.CLOSED);
    assertThat(b.next(Duration.ofSeconds(1)).kind()).isEqualTo(DeliveryEvent.Kind.CLOSED);
  }

  @Test
  void rejectsSubscriptionFromAnotherChannel() {
    BroadcastChannel channel = new BroadcastChannel(key);
    BroadcastChannel other = new BroadcastChannel(ResourceKey.of("apps", "other"));
    Subscription foreign = other.subscribe();

    assertThatThrownBy(() -> channel.unsubscribe(foreign))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("apps/other");
  }

  @Test
  void rejectsNonPositiveHeartbeat() {
    BroadcastChannel channel = new BroadcastChannel(key);
    Subscription subscription = channel.subscribe();

    assertThatThrownBy(() -> subscription.next(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> subscription.next(Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static List<String> drainMessages(Subscription subscription, int count) throws InterruptedException {
    List<String> messages = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      messages.add(subscription.next().status().message());
    }
    return messages;
  }
}
