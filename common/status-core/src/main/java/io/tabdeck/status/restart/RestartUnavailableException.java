package io.tabdeck.status.restart;

/**
 * Raised when an accepted restart cannot be handed to a watcher, typically because the
 * coordinator is shutting down. The job is already cleared when this is thrown.
 */
public class RestartUnavailableException extends RuntimeException {

  public RestartUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
