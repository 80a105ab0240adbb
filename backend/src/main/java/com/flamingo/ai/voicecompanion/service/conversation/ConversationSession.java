package com.flamingo.ai.voicecompanion.service.conversation;

import com.flamingo.ai.voicecompanion.service.retrieval.InjectedContext;
import com.flamingo.ai.voicecompanion.service.retrieval.RetrievalOutcome;
import com.flamingo.ai.voicecompanion.service.transcript.TranscriptAggregator;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State owned by one live conversation: its transcript and the side-context waiting for the next
 * generation turn. Never shared across sessions.
 */
public class ConversationSession {

  private final UUID id;
  private final Instant startedAt;
  private final TranscriptAggregator transcript;
  private final AtomicBoolean ended = new AtomicBoolean(false);
  private final AtomicReference<InjectedContext> pendingContext = new AtomicReference<>();
  private final AtomicReference<RetrievalOutcome> lastRetrieval = new AtomicReference<>();

  public ConversationSession(UUID id, TranscriptAggregator transcript) {
    this.id = id;
    this.startedAt = Instant.now();
    this.transcript = transcript;
  }

  public UUID getId() {
    return id;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public TranscriptAggregator getTranscript() {
    return transcript;
  }

  public boolean isEnded() {
    return ended.get();
  }

  /**
   * Stores context for the next turn, replacing an unconsumed older one.
   *
   * @return {@code false} if the session already ended and the context was dropped
   */
  boolean offerContext(InjectedContext context) {
    if (ended.get()) {
      return false;
    }
    pendingContext.set(context);
    // end() may have run between the check and the set
    if (ended.get()) {
      pendingContext.set(null);
      return false;
    }
    return true;
  }

  /** Removes and returns the pending context; each context is handed out at most once. */
  public InjectedContext takePendingContext() {
    return pendingContext.getAndSet(null);
  }

  public boolean hasPendingContext() {
    return pendingContext.get() != null;
  }

  void recordRetrieval(RetrievalOutcome outcome) {
    lastRetrieval.set(outcome);
  }

  /** Outcome of the most recent retrieval, {@code null} before the first one. */
  public RetrievalOutcome getLastRetrieval() {
    return lastRetrieval.get();
  }

  /** Ends the session and discards its transcript and pending context. Idempotent. */
  boolean end() {
    if (!ended.compareAndSet(false, true)) {
      return false;
    }
    pendingContext.set(null);
    transcript.close();
    return true;
  }
}
