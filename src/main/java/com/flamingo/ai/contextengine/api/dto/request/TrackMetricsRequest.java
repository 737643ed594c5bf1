package com.flamingo.ai.contextengine.api.dto.request;

import com.flamingo.ai.contextengine.service.prompt.MetricsUpdate;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for reporting outcome signals of a prompt variant. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackMetricsRequest {

  private boolean engagement;

  @DecimalMin(value = "0.0", message = "Quality must be at least 0.0")
  @DecimalMax(value = "1.0", message = "Quality must be at most 1.0")
  private Double quality;

  @Min(value = 0, message = "Response time must not be negative")
  private Long responseTimeMs;

  @Min(value = 0, message = "Tokens must not be negative")
  private Integer tokens;

  private boolean error;

  private boolean conversion;

  public MetricsUpdate toUpdate() {
    return MetricsUpdate.builder()
        .engagement(engagement)
        .quality(quality)
        .responseTimeMs(responseTimeMs)
        .tokens(tokens)
        .error(error)
        .conversion(conversion)
        .build();
  }
}
