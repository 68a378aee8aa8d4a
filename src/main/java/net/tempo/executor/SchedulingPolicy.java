package net.tempo.executor;

/**
 * Timing discipline of a scheduled task.
 */
public enum SchedulingPolicy {
  /**
   * Wait a constant gap after each run finishes. A slow run shifts every later run.
   */
  FIXED_INTERVAL,

  /**
   * Keep a constant long-run trigger frequency, catching up after slow runs.
   */
  FIXED_RATE,
}
