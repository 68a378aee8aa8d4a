package net.tempo.executor.exceptions;

/**
 * Generic Tempo related exception.
 */
public class TempoException extends RuntimeException {
  public TempoException() {
  }

  public TempoException(String message) {
    super(message);
  }

  public TempoException(String message, Throwable cause) {
    super(message, cause);
  }

  public TempoException(Throwable cause) {
    super(cause);
  }
}
