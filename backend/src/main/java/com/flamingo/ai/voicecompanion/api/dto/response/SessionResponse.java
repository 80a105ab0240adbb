package com.flamingo.ai.voicecompanion.api.dto.response;

import com.flamingo.ai.voicecompanion.service.conversation.ConversationSession;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a conversation session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

  private UUID sessionId;
  private Instant startedAt;

  public static SessionResponse fromSession(ConversationSession session) {
    return SessionResponse.builder()
        .sessionId(session.getId())
        .startedAt(session.getStartedAt())
        .build();
  }
}
