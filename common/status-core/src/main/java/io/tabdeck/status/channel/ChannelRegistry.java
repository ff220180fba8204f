package io.tabdeck.status.channel;

import io.tabdeck.status.ResourceKey;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one {@link BroadcastChannel} per resource. Channels are created on first use and live for
 * the lifetime of the process.
 */
public class ChannelRegistry {

  private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

  private final Map<ResourceKey, BroadcastChannel> channels = new ConcurrentHashMap<>();
  private final int queueCapacity;

  public ChannelRegistry() {
    this(BroadcastChannel.DEFAULT_QUEUE_CAPACITY);
  }

  public ChannelRegistry(int queueCapacity) {
    if (queueCapacity < 1) {
      throw new IllegalArgumentException("queueCapacity must be at least 1");
    }
    this.queueCapacity = queueCapacity;
  }

  public BroadcastChannel channelFor(ResourceKey key) {
    return channels.computeIfAbsent(key, k -> {
      log.debug("Creating status channel for {}", k);
      return new BroadcastChannel(k, queueCapacity);
    });
  }

  public Optional<BroadcastChannel> find(ResourceKey key) {
    return Optional.ofNullable(channels.get(key));
  }

  public Collection<BroadcastChannel> channels() {
    return Collections.unmodifiableCollection(channels.values());
  }

  public int subscriberCount() {
    return channels.values().stream().mapToInt(BroadcastChannel::subscriberCount).sum();
  }

  public void closeAll() {
    channels.values().forEach(BroadcastChannel::closeAll);
  }

  public int count() {
    return channels.size();
  }
}
