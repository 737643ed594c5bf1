package com.flamingo.ai.contextengine.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for assembling a context window. Unset limits fall back to configuration. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildContextRequest {

  @NotBlank(message = "Channel id is required")
  private String channelId;

  private String query;

  private String threadId;

  @Min(value = 100, message = "Max tokens must be at least 100")
  @Max(value = 32000, message = "Max tokens must be at most 32000")
  private Integer maxTokens;

  @Min(value = 0, message = "Recent limit must not be negative")
  @Max(value = 200, message = "Recent limit must be at most 200")
  private Integer recentLimit;

  @Min(value = 0, message = "Relevant limit must not be negative")
  @Max(value = 100, message = "Relevant limit must be at most 100")
  private Integer relevantLimit;
}
