package com.flamingo.ai.voicecompanion.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one recognizer event. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UtteranceRequest {

  @NotBlank(message = "Segment id is required")
  @Size(max = 200, message = "Segment id must not exceed 200 characters")
  private String segmentId;

  @NotNull(message = "Text is required")
  @Size(max = 10000, message = "Text must not exceed 10000 characters")
  private String text;

  @NotNull(message = "isFinal is required")
  private Boolean isFinal;

  /** Optional speaker identity as reported by the recognizer; never used for labeling. */
  @Size(max = 200, message = "Participant id must not exceed 200 characters")
  private String participantId;
}
