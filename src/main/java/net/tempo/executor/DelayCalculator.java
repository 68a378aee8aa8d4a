package net.tempo.executor;

import com.google.common.base.Preconditions;
import java.time.Duration;

/**
 * Computes the wait before the next iteration of a periodic task.
 */
public final class DelayCalculator {
  private DelayCalculator() {
  }

  /**
   * Fixed-rate delay. Any overrun of {@code interval} is added to {@code debt}; any slack left
   * before the next nominal trigger is used to pay the debt down before it is spent waiting.
   *
   * @param interval nominal time between triggers
   * @param execution time the last execution took
   * @param debt accumulated lateness carried from previous iterations
   */
  public static Delay calculate(Duration interval, Duration execution, Duration debt) {
    checkNonNegative(interval, "interval");
    checkNonNegative(execution, "execution");
    checkNonNegative(debt, "debt");

    if (execution.compareTo(interval) >= 0) {
      return ImmutableDelay.of(Duration.ZERO, debt.plus(execution.minus(interval)));
    }

    var gap = interval.minus(execution);
    if (debt.isZero()) {
      return ImmutableDelay.of(gap, Duration.ZERO);
    }

    if (debt.compareTo(gap) < 0) {
      return ImmutableDelay.of(gap.minus(debt), Duration.ZERO);
    }

    return ImmutableDelay.of(Duration.ZERO, debt.minus(gap));
  }

  /**
   * Fixed-interval delay, {@code max(0, interval - execution)}. Overruns are never remembered.
   */
  public static Delay fixedInterval(Duration interval, Duration execution) {
    checkNonNegative(interval, "interval");
    checkNonNegative(execution, "execution");

    if (execution.compareTo(interval) >= 0) {
      return Delay.NONE;
    }

    return ImmutableDelay.of(interval.minus(execution), Duration.ZERO);
  }

  private static void checkNonNegative(Duration duration, String name) {
    Preconditions.checkNotNull(duration, "%s", name);
    Preconditions.checkArgument(!duration.isNegative(), "%s must be non-negative: %s",
        name, duration);
  }
}
