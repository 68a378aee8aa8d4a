package net.tempo.executor;

import com.google.common.base.Preconditions;
import java.time.Duration;
import org.immutables.value.Value;

/**
 * Outcome of a single delay calculation: how long to wait before the next iteration, and how
 * far behind the nominal schedule the task remains afterwards.
 */
@Value.Immutable
public interface Delay {
  Delay NONE = ImmutableDelay.of(Duration.ZERO, Duration.ZERO);

  @Value.Parameter
  Duration nextWait();

  @Value.Parameter
  Duration debt();

  @Value.Check
  default void check() {
    Preconditions.checkArgument(!nextWait().isNegative(), "nextWait must be non-negative");
    Preconditions.checkArgument(!debt().isNegative(), "debt must be non-negative");
  }
}
