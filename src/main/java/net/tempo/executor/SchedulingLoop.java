package net.tempo.executor;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import io.netty.channel.EventLoop;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single iteration of a scheduled task. Running it invokes the callback, measures how long
 * the callback took, and arms a timer on the event loop for the following iteration.
 *
 * <p>Iterations are immutable. State carried between iterations (the fixed-rate debt) is
 * handed to a fresh iteration object rather than updated in place.
 */
abstract class SchedulingLoop implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(SchedulingLoop.class);

  private final ScheduledTask task;
  private final EventLoop eventLoop;
  private final Ticker ticker;
  private final FailureListener failureListener;

  SchedulingLoop(
      ScheduledTask task,
      EventLoop eventLoop,
      Ticker ticker,
      FailureListener failureListener) {
    this.task = Preconditions.checkNotNull(task);
    this.eventLoop = Preconditions.checkNotNull(eventLoop);
    this.ticker = Preconditions.checkNotNull(ticker);
    this.failureListener = Preconditions.checkNotNull(failureListener);
  }

  SchedulingLoop(SchedulingLoop previous) {
    this(previous.task, previous.eventLoop, previous.ticker, previous.failureListener);
  }

  /**
   * Returns the first iteration of the loop matching the task's policy.
   */
  static SchedulingLoop start(
      ScheduledTask task,
      EventLoop eventLoop,
      Ticker ticker,
      FailureListener failureListener) {
    switch (task.policy()) {
      case FIXED_INTERVAL:
        return new FixedIntervalLoop(task, eventLoop, ticker, failureListener);
      case FIXED_RATE:
        return new FixedRateLoop(task, eventLoop, ticker, failureListener, Duration.ZERO);
    }
    throw new IllegalArgumentException("unsupported policy: " + task.policy());
  }

  ScheduledTask task() {
    return task;
  }

  @Override
  public void run() {
    if (eventLoop.isShuttingDown()) {
      return;
    }

    var delay = runOnce();

    // Termination may have been requested while the callback was running.
    if (eventLoop.isShuttingDown()) {
      log.debug("Event loop shutting down, not re-arming; task={}", task);
      return;
    }

    var next = next(delay);
    try {
      eventLoop.schedule(next, delay.nextWait().toNanos(), NANOSECONDS);
    } catch (RejectedExecutionException e) {
      if (eventLoop.isShuttingDown()) {
        return;
      }
      log.error("Failed to arm timer for next iteration; task={}", task, e);
      throw e;
    }
  }

  /**
   * Invokes the callback once and returns the delay before the next iteration.
   */
  @VisibleForTesting
  Delay runOnce() {
    var stopwatch = Stopwatch.createStarted(ticker);
    try {
      task.callback().run(eventLoop);
    } catch (Exception e) {
      failureListener.callbackFailed(task, e);
    } catch (Error e) {
      failureListener.callbackFailed(task, e);
      throw e;
    }
    return nextDelay(stopwatch.elapsed());
  }

  /**
   * Delay before the next iteration given how long this iteration's callback ran.
   */
  abstract Delay nextDelay(Duration execution);

  /**
   * The iteration that follows this one, given this iteration's delay.
   */
  abstract SchedulingLoop next(Delay delay);

  /**
   * Notified, on the event loop thread, when a callback throws.
   */
  @FunctionalInterface
  interface FailureListener {
    void callbackFailed(ScheduledTask task, Throwable failure);
  }
}
