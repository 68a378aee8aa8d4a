package net.tempo.executor;

import com.google.common.base.Preconditions;
import java.time.Duration;
import org.immutables.value.Value;

@Value.Immutable
public interface ScheduledTask {
  @Value.Parameter
  ScheduledCallback callback();

  @Value.Parameter
  Duration interval();

  @Value.Parameter
  SchedulingPolicy policy();

  @Value.Check
  default void check() {
    Preconditions.checkArgument(!interval().isNegative(), "interval must be non-negative: %s",
        interval());
  }
}
