package io.tabdeck.status.restart;

import io.tabdeck.status.ResourceKey;
import io.tabdeck.status.WorkloadStatus;
import io.tabdeck.status.channel.BroadcastChannel;
import io.tabdeck.status.channel.ChannelRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts restart requests, runs at most one rollout watcher per resource, and publishes the
 * resulting state transitions on the resource's {@link BroadcastChannel}.
 * <p>
 * {@code restarting} is published before {@link #requestRestart} returns, so any subscriber that is
 * already attached sees it before the watcher's terminal state. Once accepted, a restart always
 * ends in {@code running} or {@code error} and its job is cleared, including when the orchestrator
 * call throws. The timeout runs from acceptance and covers the trigger call as well as the rollout
 * watch; orchestrator calls run on a separate thread so a hung call cannot outlive it.
 */
public final class RestartCoordinator implements AutoCloseable {

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(180);
  public static final String TIMEOUT_MESSAGE = "timeout";

  private static final Logger log = LoggerFactory.getLogger(RestartCoordinator.class);

  private final ChannelRegistry channels;
  private final RolloutClient rollouts;
  private final Duration timeout;
  private final RestartMetrics metrics;
  private final ExecutorService executor;
  private final ExecutorService rolloutExecutor =
      Executors.newCachedThreadPool(new WatcherThreadFactory("restart-rollout-"));
  private final Map<ResourceKey, RestartJob> jobs = new ConcurrentHashMap<>();

  public RestartCoordinator(ChannelRegistry channels, RolloutClient rollouts) {
    this(channels, rollouts, DEFAULT_TIMEOUT, RestartMetrics.noop());
  }

  public RestartCoordinator(ChannelRegistry channels,
                            RolloutClient rollouts,
                            Duration timeout,
                            RestartMetrics metrics) {
    this(channels, rollouts, timeout, metrics, Executors.newCachedThreadPool(new WatcherThreadFactory("restart-watcher-")));
  }

  public RestartCoordinator(ChannelRegistry channels,
                            RolloutClient rollouts,
                            Duration timeout,
                            RestartMetrics metrics,
                            ExecutorService executor) {
    this.channels = Objects.requireNonNull(channels, "channels");
    this.rollouts = Objects.requireNonNull(rollouts, "rollouts");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public RestartDecision requestRestart(ResourceKey key, WorkloadRef workload) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(workload, "workload");
    long acceptedNanos = System.nanoTime();
    RestartJob job = new RestartJob(UUID.randomUUID().toString(), key, workload, Instant.now());
    RestartJob existing = jobs.putIfAbsent(key, job);
    if (existing != null) {
      log.info("[RESTART] already in progress key={} job={} since={}", key, existing.id(), existing.acceptedAt());
      metrics.requestRejected(key);
      return RestartDecision.REJECTED_IN_PROGRESS;
    }

    BroadcastChannel channel = channels.channelFor(key);
    channel.publish(WorkloadStatus.restarting());
    try {
      executor.execute(() -> runWatcher(job, channel, acceptedNanos));
    } catch (RejectedExecutionException e) {
      jobs.remove(key, job);
      channel.publish(WorkloadStatus.error("restart failed: watcher could not be scheduled"));
      log.error("[RESTART] unable to schedule watcher key={} job={}", key, job.id(), e);
      throw new RestartUnavailableException("Restart watcher for " + key + " could not be scheduled", e);
    }
    metrics.requestAccepted(key);
    log.info("[RESTART] scheduled key={} workload={} job={}", key, workload, job.id());
    return RestartDecision.ACCEPTED;
  }

  public boolean inFlight(ResourceKey key) {
    return jobs.containsKey(key);
  }

  public Optional<RestartJob> job(ResourceKey key) {
    return Optional.ofNullable(jobs.get(key));
  }

  public Collection<RestartJob> activeJobs() {
    return Collections.unmodifiableCollection(jobs.values());
  }

  public Duration timeout() {
    return timeout;
  }

  private void runWatcher(RestartJob job, BroadcastChannel channel, long acceptedNanos) {
    ResourceKey key = job.key();
    WorkloadRef workload = job.workload();
    long deadline = acceptedNanos + timeout.toNanos();
    RestartOutcome outcome = RestartOutcome.ERROR;
    Future<Completion> rollout = null;
    log.debug("[RESTART] watcher started key={} workload={} job={}", key, workload, job.id());
    try {
      rollout = rolloutExecutor.submit(() -> performRollout(key, workload, deadline));
      Completion completion = awaitCompletion(rollout, deadline);
      outcome = completion.outcome();
      switch (outcome) {
        case RUNNING -> log.info("[RESTART] completed key={} workload={}", key, workload);
        case TIMEOUT -> log.error("[RESTART] timed out key={} workload={} after {}s",
            key, workload, timeout.toSeconds());
        case ERROR -> log.error("[RESTART] rollout failed key={} workload={}: {}",
            key, workload, completion.status().message());
      }
      channel.publish(completion.status());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[RESTART] watcher interrupted key={} job={}", key, job.id());
      channel.publish(WorkloadStatus.error("restart interrupted"));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      if (cause instanceof RolloutException) {
        log.error("[RESTART] orchestrator error key={} workload={}: {}", key, workload, cause.getMessage(), cause);
        channel.publish(WorkloadStatus.error(cause.getMessage()));
      } else {
        log.error("[RESTART] unexpected error key={} workload={}", key, workload, cause);
        channel.publish(WorkloadStatus.error("restart failed: " + describe(cause)));
      }
    } catch (RuntimeException e) {
      log.error("[RESTART] unexpected error key={} workload={}", key, workload, e);
      channel.publish(WorkloadStatus.error("restart failed: " + describe(e)));
    } catch (Error e) {
      log.error("[RESTART] watcher failed key={} workload={}", key, workload, e);
      channel.publish(WorkloadStatus.error("restart failed: " + describe(e)));
      throw e;
    } finally {
      if (rollout != null) {
        rollout.cancel(true);
      }
      jobs.remove(key, job);
      metrics.restartFinished(key, outcome, Duration.ofNanos(System.nanoTime() - acceptedNanos));
      log.debug("[RESTART] watcher finished key={} job={} outcome={}", key, job.id(), outcome);
    }
  }

  private Completion awaitCompletion(Future<Completion> rollout, long deadline)
      throws InterruptedException, ExecutionException {
    try {
      return rollout.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      rollout.cancel(true);
      return new Completion(RestartOutcome.TIMEOUT, WorkloadStatus.error(TIMEOUT_MESSAGE));
    }
  }

  private Completion performRollout(ResourceKey key, WorkloadRef workload, long deadline)
      throws InterruptedException {
    RolloutTrigger trigger = rollouts.triggerRestart(workload);
    log.debug("[RESTART] trigger acknowledged key={} revision={}", key, trigger.revision());
    return awaitRollout(workload, trigger, deadline);
  }

  private Completion awaitRollout(WorkloadRef workload, RolloutTrigger trigger, long deadline)
      throws InterruptedException {
    try (RolloutWatch watch = rollouts.watch(workload, trigger)) {
      long remaining;
      while ((remaining = deadline - System.nanoTime()) > 0L) {
        Optional<RolloutSignal> next = watch.next(Duration.ofNanos(remaining));
        if (next.isEmpty()) {
          continue;
        }
        RolloutSignal signal = next.get();
        switch (signal.kind()) {
          case READY:
            return new Completion(RestartOutcome.RUNNING, WorkloadStatus.running());
          case FAILED:
            return new Completion(RestartOutcome.ERROR, WorkloadStatus.error(signal.message()));
          case NOT_READY:
            log.trace("Rollout of {} not ready yet: {}", workload, signal.message());
            break;
        }
      }
    }
    return new Completion(RestartOutcome.TIMEOUT, WorkloadStatus.error(TIMEOUT_MESSAGE));
  }

  private static String describe(Throwable e) {
    String message = e.getMessage();
    if (message == null || message.isBlank()) {
      return e.getClass().getSimpleName();
    }
    return message;
  }

  /**
   * Stops accepting watchers and interrupts the ones still running.
   */
  @Override
  public void close() {
    executor.shutdownNow();
    rolloutExecutor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("[RESTART] {} watcher(s) still running at shutdown", jobs.size());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private record Completion(RestartOutcome outcome, WorkloadStatus status) {
  }

  private static final class WatcherThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    private WatcherThreadFactory(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = new Thread(r, prefix + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
