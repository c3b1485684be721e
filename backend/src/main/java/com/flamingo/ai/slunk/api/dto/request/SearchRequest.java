package com.flamingo.ai.slunk.api.dto.request;

import com.flamingo.ai.slunk.service.query.DateRange;
import com.flamingo.ai.slunk.service.search.SearchFilters;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a hybrid search. Also used for conversational search turns. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 1000, message = "Query must not exceed 1000 characters")
  private String query;

  @Min(value = 1, message = "Limit must be at least 1")
  @Max(value = 100, message = "Limit must not exceed 100")
  private Integer limit;

  private List<String> channels;

  private List<String> users;

  /** Inclusive lower bound of an explicit date filter. */
  private Instant from;

  /** Exclusive upper bound of an explicit date filter. */
  private Instant to;

  private boolean includeChunks;

  @Positive(message = "Timeout must be positive")
  private Long timeoutMillis;

  /** Missing bounds default the way {@link DateRange#between} fills them. */
  @AssertTrue(message = "'from' must not be after 'to', and 'to' must not be before 1970")
  private boolean isDateRangeOrdered() {
    if (from == null && to == null) {
      return true;
    }
    Instant start = from != null ? from : Instant.EPOCH;
    Instant end = to != null ? to : DateRange.FAR_FUTURE;
    return !start.isAfter(end);
  }

  /** Builds the hard filters this request names. */
  public SearchFilters toFilters() {
    DateRange range = from != null || to != null ? DateRange.between(from, to) : null;
    return new SearchFilters(
        channels != null ? new LinkedHashSet<>(channels) : null,
        users != null ? new LinkedHashSet<>(users) : null,
        range,
        includeChunks);
  }

  public int limitOrZero() {
    return limit != null ? limit : 0;
  }
}
