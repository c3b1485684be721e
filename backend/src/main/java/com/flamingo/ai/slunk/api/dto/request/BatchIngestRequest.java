package com.flamingo.ai.slunk.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting a batch of messages, such as one captured conversation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestRequest {

  @NotEmpty(message = "At least one message is required")
  @Size(max = 1000, message = "A batch must not exceed 1000 messages")
  private List<@Valid MessageRequest> messages;
}
