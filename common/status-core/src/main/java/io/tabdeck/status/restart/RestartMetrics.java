package io.tabdeck.status.restart;

import io.tabdeck.status.ResourceKey;
import java.time.Duration;

/**
 * Abstraction for metrics emitted by the {@link RestartCoordinator}.
 */
public interface RestartMetrics {

  void requestAccepted(ResourceKey key);

  void requestRejected(ResourceKey key);

  /**
   * Records a finished watcher.
   *
   * @param key     restarted resource
   * @param outcome terminal outcome
   * @param elapsed time from acceptance to the terminal outcome
   */
  void restartFinished(ResourceKey key, RestartOutcome outcome, Duration elapsed);

  static RestartMetrics noop() {
    return new RestartMetrics() {
      @Override
      public void requestAccepted(ResourceKey key) {
      }

      @Override
      public void requestRejected(ResourceKey key) {
      }

      @Override
      public void restartFinished(ResourceKey key, RestartOutcome outcome, Duration elapsed) {
      }
    };
  }
}
