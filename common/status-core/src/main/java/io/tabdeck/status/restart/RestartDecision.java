package io.tabdeck.status.restart;

public enum RestartDecision {
  ACCEPTED,
  REJECTED_IN_PROGRESS
}
