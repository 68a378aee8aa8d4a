package net.tempo.executor.util;

import static org.junit.Assert.assertEquals;

import java.time.Duration;
import org.junit.Test;

public class DurationsTest {
  @Test
  public void fromString_noUnit() {
    assertEquals(Duration.ofMillis(1234), Durations.fromString("1234"));
  }

  @Test
  public void fromString_ms() {
    assertEquals(Duration.ofMillis(250), Durations.fromString("250ms"));
  }

  @Test
  public void fromString_s_withWhitespace() {
    assertEquals(Duration.ofSeconds(30), Durations.fromString(" 30 s"));
  }

  @Test
  public void fromString_m() {
    assertEquals(Duration.ofMinutes(5), Durations.fromString("5m"));
  }

  @Test
  public void fromString_h() {
    assertEquals(Duration.ofHours(2), Durations.fromString("2h"));
  }

  @Test
  public void fromString_iso() {
    assertEquals(Duration.ofSeconds(90), Durations.fromString("PT1M30S"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromString_unknownUnit() {
    Durations.fromString("3d");
  }
}
