package com.flamingo.ai.contextengine.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for generating a reply to a chat message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateResponseRequest {

  @NotBlank(message = "Message is required")
  @Size(max = 4000, message = "Message must not exceed 4000 characters")
  private String message;

  @NotBlank(message = "Channel id is required")
  private String channelId;

  @NotBlank(message = "User id is required")
  private String userId;

  private String userName;

  private String threadId;
}
