package net.tempo.executor;

import com.google.common.base.Ticker;
import io.netty.channel.EventLoop;
import java.time.Duration;

/**
 * Waits {@code interval} minus the execution time after every run. Overruns are not made up.
 */
final class FixedIntervalLoop extends SchedulingLoop {
  FixedIntervalLoop(
      ScheduledTask task,
      EventLoop eventLoop,
      Ticker ticker,
      FailureListener failureListener) {
    super(task, eventLoop, ticker, failureListener);
  }

  private FixedIntervalLoop(FixedIntervalLoop previous) {
    super(previous);
  }

  @Override
  Delay nextDelay(Duration execution) {
    return DelayCalculator.fixedInterval(task().interval(), execution);
  }

  @Override
  SchedulingLoop next(Delay delay) {
    return new FixedIntervalLoop(this);
  }
}
