package com.flamingo.ai.slunk.service.query;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time range {@code [start, end)}.
 *
 * @param start inclusive lower bound
 * @param end exclusive upper bound; never before {@code start}
 */
public record DateRange(Instant start, Instant end) {

  /** Upper bound used for ranges open to the future; still representable in epoch millis. */
  public static final Instant FAR_FUTURE = Instant.parse("9999-12-31T23:59:59Z");

  public DateRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("Range end " + end + " is before start " + start);
    }
  }

  /** A range from optional bounds; a missing start is the epoch, a missing end is open. */
  public static DateRange between(Instant from, Instant to) {
    return new DateRange(from != null ? from : Instant.EPOCH, to != null ? to : FAR_FUTURE);
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  /** Returns this range grown by {@code tolerance} on both sides. */
  public DateRange widen(Duration tolerance) {
    return new DateRange(start.minus(tolerance), end.plus(tolerance));
  }

  /** Distance from the instant to the nearest edge; zero when inside. */
  public Duration distanceTo(Instant instant) {
    if (instant.isBefore(start)) {
      return Duration.between(instant, start);
    }
    if (!instant.isBefore(end)) {
      return Duration.between(end, instant);
    }
    return Duration.ZERO;
  }
}
