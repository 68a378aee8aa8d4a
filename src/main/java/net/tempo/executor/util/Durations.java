package net.tempo.executor.util;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Durations {
  private static final Pattern PARSER = Pattern.compile("(\\d+)\\s*([a-z]*)$");

  private Durations() {
  }

  /**
   * Parses either an ISO-8601 duration ({@code PT30S}) or a number with an optional unit
   * ({@code 500ms}, {@code 30s}, {@code 5m}, {@code 1h}). A bare number is milliseconds.
   */
  public static Duration fromString(String value) {
    var stripped = value.strip();
    if (stripped.startsWith("P") || stripped.startsWith("p")) {
      return Duration.parse(stripped);
    }

    Matcher matcher = PARSER.matcher(stripped);
    Preconditions.checkArgument(matcher.matches(), "unsupported format: %s", value);
    long amount = Long.parseLong(matcher.group(1));
    switch (matcher.group(2)) {
      case "":
      case "ms":
        return Duration.ofMillis(amount);
      case "s":
        return Duration.ofSeconds(amount);
      case "m":
        return Duration.ofMinutes(amount);
      case "h":
        return Duration.ofHours(amount);
    }
    throw new IllegalArgumentException("unknown unit: " + matcher.group(2));
  }
}
