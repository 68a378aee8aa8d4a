package net.tempo.executor;

import io.netty.channel.EventLoop;

/**
 * Work run on every iteration of a scheduled task.
 */
@FunctionalInterface
public interface ScheduledCallback {
  /**
   * Runs one iteration. Runs on the executor thread and blocks every other task of the same
   * executor until it returns.
   *
   * @param context the executor's event loop, usable for submitting further work
   */
  void run(EventLoop context) throws Exception;
}
