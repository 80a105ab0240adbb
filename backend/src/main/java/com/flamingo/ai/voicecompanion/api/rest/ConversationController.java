package com.flamingo.ai.voicecompanion.api.rest;

import com.flamingo.ai.voicecompanion.api.dto.request.UtteranceRequest;
import com.flamingo.ai.voicecompanion.api.dto.response.SessionResponse;
import com.flamingo.ai.voicecompanion.api.dto.response.TranscriptLineResponse;
import com.flamingo.ai.voicecompanion.service.conversation.ConversationService;
import com.flamingo.ai.voicecompanion.service.transcript.UtteranceEvent;
import com.flamingo.ai.voicecompanion.service.transcript.UtteranceSource;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for live conversations: sessions, utterance events and transcripts. */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

  private final ConversationService conversationService;

  /** Starts a session. */
  @PostMapping
  public ResponseEntity<SessionResponse> startSession() {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(SessionResponse.fromSession(conversationService.startSession()));
  }

  /** Ends a session and discards its transcript. */
  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> endSession(@PathVariable UUID sessionId) {
    conversationService.endSession(sessionId);
    return ResponseEntity.noContent().build();
  }

  /** Event from the client-local recognizer. */
  @PostMapping("/{sessionId}/utterances/local")
  public ResponseEntity<Void> localUtterance(
      @PathVariable UUID sessionId, @Valid @RequestBody UtteranceRequest request) {
    return submit(sessionId, UtteranceSource.LOCAL, request);
  }

  /** Event from the room-level transcription stream. */
  @PostMapping("/{sessionId}/utterances/remote")
  public ResponseEntity<Void> remoteUtterance(
      @PathVariable UUID sessionId, @Valid @RequestBody UtteranceRequest request) {
    return submit(sessionId, UtteranceSource.REMOTE, request);
  }

  /** Ordered transcript at the moment of the call. */
  @GetMapping("/{sessionId}/transcript")
  public ResponseEntity<List<TranscriptLineResponse>> transcript(@PathVariable UUID sessionId) {
    List<TranscriptLineResponse> lines =
        conversationService.getTranscript(sessionId).stream()
            .map(TranscriptLineResponse::fromLine)
            .toList();
    return ResponseEntity.ok(lines);
  }

  private ResponseEntity<Void> submit(
      UUID sessionId, UtteranceSource source, UtteranceRequest request) {
    UtteranceEvent event =
        UtteranceEvent.of(
            source,
            request.getParticipantId(),
            request.getSegmentId(),
            request.getText(),
            request.getIsFinal(),
            Instant.now());
    conversationService.submitUtterance(sessionId, event);
    return ResponseEntity.accepted().build();
  }
}
