package io.tabdeck.status.restart;

/**
 * How a restart watcher finished.
 */
public enum RestartOutcome {
  RUNNING,
  ERROR,
  TIMEOUT
}
