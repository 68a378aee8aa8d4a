package net.tempo.executor;

/**
 * What happens when a scheduled callback throws.
 */
public enum CallbackFailurePolicy {
  /**
   * Log the failure and keep the task on its schedule.
   */
  CONTINUE,

  /**
   * Log the failure and stop the executor, ending every task scheduled on it.
   */
  STOP_EXECUTOR,
}
