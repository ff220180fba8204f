package io.tabdeck.status.restart;

import java.time.Duration;
import java.util.Optional;

/**
 * Sequence of rollout condition signals for one triggered restart.
 */
public interface RolloutWatch extends AutoCloseable {

  /**
   * Returns the next signal, waiting at most {@code maxWait}. An empty result means no signal was
   * observed in time; the caller decides whether to keep waiting.
   *
   * @throws RolloutException when the orchestrator cannot be queried
   */
  Optional<RolloutSignal> next(Duration maxWait) throws InterruptedException;

  @Override
  void close();
}
