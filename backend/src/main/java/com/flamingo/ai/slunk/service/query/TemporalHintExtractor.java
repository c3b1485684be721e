package com.flamingo.ai.slunk.service.query;

import com.flamingo.ai.slunk.service.query.TemporalHint.Kind;
import com.google.common.collect.ImmutableMap;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Month;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves time phrases in query text to concrete ranges.
 *
 * <p>Relative phrases are tried first, in dictionary order, then absolute dates. Ranges that run
 * up to "now" end at the start of tomorrow in the clock's zone so messages from later today are
 * still inside them.
 */
@Component
@RequiredArgsConstructor
public class TemporalHintExtractor {

  private static final Map<String, Month> MONTHS =
      ImmutableMap.<String, Month>builder()
          .put("january", Month.JANUARY)
          .put("jan", Month.JANUARY)
          .put("february", Month.FEBRUARY)
          .put("feb", Month.FEBRUARY)
          .put("march", Month.MARCH)
          .put("mar", Month.MARCH)
          .put("april", Month.APRIL)
          .put("apr", Month.APRIL)
          .put("may", Month.MAY)
          .put("june", Month.JUNE)
          .put("jun", Month.JUNE)
          .put("july", Month.JULY)
          .put("jul", Month.JULY)
          .put("august", Month.AUGUST)
          .put("aug", Month.AUGUST)
          .put("september", Month.SEPTEMBER)
          .put("sept", Month.SEPTEMBER)
          .put("sep", Month.SEPTEMBER)
          .put("october", Month.OCTOBER)
          .put("oct", Month.OCTOBER)
          .put("november", Month.NOVEMBER)
          .put("nov", Month.NOVEMBER)
          .put("december", Month.DECEMBER)
          .put("dec", Month.DECEMBER)
          .build();

  private static final String MONTH_ALTERNATION = String.join("|", MONTHS.keySet());

  private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
  private static final Pattern MONTH_DAY =
      Pattern.compile(
          "\\b("
              + MONTH_ALTERNATION
              + ")\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b(?:,?\\s+(\\d{4})\\b)?");
  private static final Pattern MONTH_YEAR =
      Pattern.compile("\\b(" + MONTH_ALTERNATION + ")\\.?,?\\s+(\\d{4})\\b");
  private static final Pattern BARE_MONTH =
      Pattern.compile(
          "\\b(january|february|march|april|june|july|august"
              + "|september|october|november|december)\\b");
  private static final Pattern LAST_N_DAYS =
      Pattern.compile("\\b(?:past|last)\\s+(\\d{1,3})\\s+days?\\b");

  /** Relative phrases in match order; the first hit wins. */
  private static final List<String> RELATIVE_PHRASES =
      List.of(
          "this morning",
          "this afternoon",
          "this week",
          "this month",
          "last week",
          "last month",
          "last year",
          "yesterday",
          "today");

  private static final Map<String, Pattern> RELATIVE_PATTERNS =
      RELATIVE_PHRASES.stream()
          .collect(
              ImmutableMap.toImmutableMap(
                  phrase -> phrase, phrase -> Pattern.compile("\\b" + phrase + "\\b")));

  private final Clock clock;

  /**
   * Finds the first temporal hint in the text.
   *
   * @param text query text, any case
   * @return the resolved hint, or empty when the text has no time reference
   */
  public Optional<TemporalHint> extract(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String lower = text.toLowerCase(Locale.ROOT);
    ZonedDateTime now = ZonedDateTime.now(clock);
    LocalDate today = now.toLocalDate();
    ZoneId zone = now.getZone();

    Matcher lastDays = LAST_N_DAYS.matcher(lower);
    if (lastDays.find()) {
      int days = Math.max(Integer.parseInt(lastDays.group(1)), 1);
      DateRange range =
          new DateRange(startOfDay(today.minusDays(days - 1L), zone), endOfDay(today, zone));
      return Optional.of(new TemporalHint(Kind.RELATIVE, lastDays.group(), null, range));
    }

    for (String phrase : RELATIVE_PHRASES) {
      if (RELATIVE_PATTERNS.get(phrase).matcher(lower).find()) {
        return Optional.of(resolveRelative(phrase, now));
      }
    }

    return extractAbsolute(lower, today, zone);
  }

  private TemporalHint resolveRelative(String phrase, ZonedDateTime now) {
    LocalDate today = now.toLocalDate();
    ZoneId zone = now.getZone();
    Instant endOfToday = endOfDay(today, zone);
    return switch (phrase) {
      case "this morning" ->
          relative(phrase, null, atHour(today, 0, zone), atHour(today, 12, zone));
      case "this afternoon" ->
          relative(phrase, null, atHour(today, 12, zone), atHour(today, 18, zone));
      case "this week" ->
          relative(
              phrase,
              null,
              startOfDay(today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)), zone),
              endOfToday);
      case "this month" ->
          relative(phrase, null, startOfDay(today.withDayOfMonth(1), zone), endOfToday);
      case "last week" -> relative(phrase, null, now.minusWeeks(1).toInstant(), endOfToday);
      case "last month" -> relative(phrase, null, now.minusMonths(1).toInstant(), endOfToday);
      case "last year" -> relative(phrase, null, now.minusYears(1).toInstant(), endOfToday);
      case "yesterday" -> {
        LocalDate yesterday = today.minusDays(1);
        yield relative(phrase, yesterday, startOfDay(yesterday, zone), startOfDay(today, zone));
      }
      case "today" -> relative(phrase, today, startOfDay(today, zone), endOfToday);
      default -> throw new IllegalStateException("Unhandled relative phrase: " + phrase);
    };
  }

  private static TemporalHint relative(String phrase, LocalDate day, Instant start, Instant end) {
    return new TemporalHint(Kind.RELATIVE, phrase, day, new DateRange(start, end));
  }

  private Optional<TemporalHint> extractAbsolute(String lower, LocalDate today, ZoneId zone) {
    Matcher iso = ISO_DATE.matcher(lower);
    while (iso.find()) {
      Optional<LocalDate> date =
          safeDate(
              Integer.parseInt(iso.group(1)),
              Integer.parseInt(iso.group(2)),
              Integer.parseInt(iso.group(3)));
      if (date.isPresent()) {
        return Optional.of(pointHint(iso.group(), date.get(), zone));
      }
    }

    Matcher monthDay = MONTH_DAY.matcher(lower);
    while (monthDay.find()) {
      Month month = MONTHS.get(monthDay.group(1));
      int day = Integer.parseInt(monthDay.group(2));
      String explicitYear = monthDay.group(3);
      int year = explicitYear != null ? Integer.parseInt(explicitYear) : today.getYear();
      Optional<LocalDate> date = safeDate(year, month.getValue(), day);
      if (date.isPresent() && explicitYear == null && date.get().isAfter(today)) {
        date = safeDate(year - 1, month.getValue(), day);
      }
      if (date.isPresent()) {
        return Optional.of(pointHint(monthDay.group(), date.get(), zone));
      }
    }

    Matcher monthYear = MONTH_YEAR.matcher(lower);
    if (monthYear.find()) {
      YearMonth yearMonth =
          YearMonth.of(Integer.parseInt(monthYear.group(2)), MONTHS.get(monthYear.group(1)));
      return Optional.of(monthHint(monthYear.group(), yearMonth, zone));
    }

    Matcher bareMonth = BARE_MONTH.matcher(lower);
    if (bareMonth.find()) {
      Month month = MONTHS.get(bareMonth.group(1));
      int year = month.getValue() > today.getMonthValue() ? today.getYear() - 1 : today.getYear();
      return Optional.of(monthHint(bareMonth.group(), YearMonth.of(year, month), zone));
    }
    return Optional.empty();
  }

  private static TemporalHint pointHint(String raw, LocalDate date, ZoneId zone) {
    return new TemporalHint(
        Kind.ABSOLUTE, raw, date, new DateRange(startOfDay(date, zone), endOfDay(date, zone)));
  }

  private static TemporalHint monthHint(String raw, YearMonth month, ZoneId zone) {
    DateRange range =
        new DateRange(startOfDay(month.atDay(1), zone), endOfDay(month.atEndOfMonth(), zone));
    return new TemporalHint(Kind.ABSOLUTE, raw, null, range);
  }

  private static Optional<LocalDate> safeDate(int year, int month, int day) {
    try {
      return Optional.of(LocalDate.of(year, month, day));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  private static Instant startOfDay(LocalDate date, ZoneId zone) {
    return date.atStartOfDay(zone).toInstant();
  }

  private static Instant endOfDay(LocalDate date, ZoneId zone) {
    return startOfDay(date.plusDays(1), zone);
  }

  private static Instant atHour(LocalDate date, int hour, ZoneId zone) {
    return date.atTime(LocalTime.of(hour, 0)).atZone(zone).toInstant();
  }
}
