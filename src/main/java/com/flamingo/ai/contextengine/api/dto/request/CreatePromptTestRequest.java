package com.flamingo.ai.contextengine.api.dto.request;

import com.flamingo.ai.contextengine.domain.enums.PromptType;
import com.flamingo.ai.contextengine.service.prompt.PromptVariant;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a prompt test. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePromptTestRequest {

  @NotBlank(message = "Name is required")
  private String name;

  @NotNull(message = "Type is required")
  private PromptType type;

  @NotEmpty(message = "At least one variant is required")
  @Valid
  private List<Variant> variants;

  /** Percentage of users per variant id; must sum to 100. */
  @NotEmpty(message = "Allocation is required")
  private Map<String, Integer> allocation;

  public List<PromptVariant> toVariants() {
    return variants.stream()
        .map(v -> new PromptVariant(v.getId(), v.getName(), v.getSystemPrompt(), v.getTemplate()))
        .toList();
  }

  /** One variant of the test. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Variant {

    @NotBlank(message = "Variant id is required")
    private String id;

    private String name;

    private String systemPrompt;

    private String template;
  }
}
