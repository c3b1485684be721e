package com.flamingo.ai.slunk.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for parsing a query without running it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 1000, message = "Query must not exceed 1000 characters")
  private String query;
}
