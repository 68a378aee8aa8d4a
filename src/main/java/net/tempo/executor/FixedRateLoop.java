package net.tempo.executor;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import io.netty.channel.EventLoop;
import java.time.Duration;

/**
 * Keeps the long-run trigger rate at one per {@code interval}. Each iteration knows how far
 * behind schedule the task is and passes the updated amount on to the next iteration.
 */
final class FixedRateLoop extends SchedulingLoop {
  private final Duration debt;

  FixedRateLoop(
      ScheduledTask task,
      EventLoop eventLoop,
      Ticker ticker,
      FailureListener failureListener,
      Duration debt) {
    super(task, eventLoop, ticker, failureListener);
    this.debt = checkDebt(debt);
  }

  private FixedRateLoop(FixedRateLoop previous, Duration debt) {
    super(previous);
    this.debt = checkDebt(debt);
  }

  private static Duration checkDebt(Duration debt) {
    Preconditions.checkArgument(!debt.isNegative(), "debt must be non-negative: %s", debt);
    return debt;
  }

  Duration debt() {
    return debt;
  }

  @Override
  Delay nextDelay(Duration execution) {
    return DelayCalculator.calculate(task().interval(), execution, debt);
  }

  @Override
  SchedulingLoop next(Delay delay) {
    return new FixedRateLoop(this, delay.debt());
  }
}
