package com.flamingo.ai.slunk.service.query;

import java.time.LocalDate;

/**
 * Time reference found in a query.
 *
 * @param kind whether the phrase was relative ("yesterday") or absolute ("March 3")
 * @param rawValue the phrase as written
 * @param resolvedDate the day referred to, for single-day hints; {@code null} for spans
 * @param range the resolved time range
 */
public record TemporalHint(Kind kind, String rawValue, LocalDate resolvedDate, DateRange range) {

  /** How the phrase expressed time. */
  public enum Kind {
    RELATIVE,
    ABSOLUTE
  }

  /** Whether this hint names a single day rather than a span. */
  public boolean isPointInTime() {
    return resolvedDate != null;
  }
}
