package com.flamingo.ai.voicecompanion.service.conversation;

import com.flamingo.ai.voicecompanion.service.transcript.TranscriptAggregator;
import com.flamingo.ai.voicecompanion.service.transcript.TranscriptLine;
import com.flamingo.ai.voicecompanion.service.transcript.UtteranceEvent;
import dev.langchain4j.data.message.ChatMessage;
import java.util.List;
import java.util.UUID;

/** Service interface for live conversation sessions. */
public interface ConversationService {

  /** Starts a new session with an empty transcript. */
  ConversationSession startSession();

  /**
   * Returns a live session.
   *
   * @throws com.flamingo.ai.voicecompanion.exception.SessionNotFoundException if unknown or ended
   */
  ConversationSession getSession(UUID sessionId);

  /** Ends a session, discarding its transcript and any pending context. */
  void endSession(UUID sessionId);

  /**
   * Feeds one recognizer event into the session's transcript. Returns immediately; retrieval for a
   * finalized utterance runs asynchronously.
   */
  TranscriptAggregator.Outcome submitUtterance(UUID sessionId, UtteranceEvent event);

  /** Ordered snapshot of the session's transcript. */
  List<TranscriptLine> getTranscript(UUID sessionId);

  /**
   * Messages for the session's next generation turn. Consumes the pending side-context, so a
   * context block is attached to exactly one turn.
   */
  List<ChatMessage> prepareGenerationTurn(UUID sessionId, String userText);

  int activeSessionCount();
}
