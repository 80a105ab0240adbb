package com.flamingo.ai.voicecompanion.api.dto.response;

import com.flamingo.ai.voicecompanion.service.transcript.TranscriptLine;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one transcript line. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptLineResponse {

  private String lineId;
  private String speakerLabel;
  private String text;
  private Boolean isFinal;
  private Instant lastUpdatedAt;

  public static TranscriptLineResponse fromLine(TranscriptLine line) {
    return TranscriptLineResponse.builder()
        .lineId(line.lineId())
        .speakerLabel(line.speakerLabel())
        .text(line.text())
        .isFinal(line.isFinal())
        .lastUpdatedAt(line.lastUpdatedAt())
        .build();
  }
}
