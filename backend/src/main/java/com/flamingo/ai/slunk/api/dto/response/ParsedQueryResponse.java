package com.flamingo.ai.slunk.api.dto.response;

import com.flamingo.ai.slunk.domain.enums.QueryIntent;
import com.flamingo.ai.slunk.service.query.ParsedQuery;
import com.flamingo.ai.slunk.service.query.RecognizedEntity;
import com.flamingo.ai.slunk.service.query.TemporalHint;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a parsed query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedQueryResponse {

  private String originalText;
  private QueryIntent intent;
  private List<String> keywords;
  private List<RecognizedEntity> entities;
  private List<String> channels;
  private List<String> users;
  private TemporalHintResponse temporalHint;

  /** Creates a ParsedQueryResponse from a ParsedQuery. */
  public static ParsedQueryResponse fromQuery(ParsedQuery query) {
    return ParsedQueryResponse.builder()
        .originalText(query.originalText())
        .intent(query.intent())
        .keywords(query.keywords())
        .entities(query.entities())
        .channels(query.channels())
        .users(query.users())
        .temporalHint(
            query.hasTemporalHint() ? TemporalHintResponse.fromHint(query.temporalHint()) : null)
        .build();
  }

  /** Resolved time reference of a query. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class TemporalHintResponse {
    private TemporalHint.Kind kind;
    private String rawValue;
    private LocalDate resolvedDate;
    private Instant start;
    private Instant end;

    static TemporalHintResponse fromHint(TemporalHint hint) {
      return TemporalHintResponse.builder()
          .kind(hint.kind())
          .rawValue(hint.rawValue())
          .resolvedDate(hint.resolvedDate())
          .start(hint.range().start())
          .end(hint.range().end())
          .build();
    }
  }
}
