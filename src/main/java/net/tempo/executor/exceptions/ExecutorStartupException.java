package net.tempo.executor.exceptions;

/**
 * Thrown when the executor thread or its event loop cannot be started.
 */
public class ExecutorStartupException extends TempoException {
  public ExecutorStartupException() {
    super("executor failed to start");
  }

  public ExecutorStartupException(String message) {
    super(message);
  }

  public ExecutorStartupException(String message, Throwable cause) {
    super(message, cause);
  }

  public ExecutorStartupException(Throwable cause) {
    super(cause);
  }
}
