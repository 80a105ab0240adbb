package com.flamingo.ai.voicecompanion.service.conversation;

import com.flamingo.ai.voicecompanion.config.CompanionConfig;
import com.flamingo.ai.voicecompanion.exception.SessionNotFoundException;
import com.flamingo.ai.voicecompanion.service.retrieval.RetrievalInjector;
import com.flamingo.ai.voicecompanion.service.retrieval.RetrievalOutcome;
import com.flamingo.ai.voicecompanion.service.transcript.TranscriptAggregator;
import com.flamingo.ai.voicecompanion.service.transcript.TranscriptLine;
import com.flamingo.ai.voicecompanion.service.transcript.UtteranceEvent;
import dev.langchain4j.data.message.ChatMessage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** In-memory implementation of the ConversationService. */
@Service
@Slf4j
public class ConversationServiceImpl implements ConversationService {

  private final Map<UUID, ConversationSession> sessions = new ConcurrentHashMap<>();

  private final RetrievalInjector retrievalInjector;
  private final GenerationContextAssembler generationContextAssembler;
  private final CompanionConfig companionConfig;
  private final MeterRegistry meterRegistry;
  private final Executor retrievalExecutor;

  public ConversationServiceImpl(
      RetrievalInjector retrievalInjector,
      GenerationContextAssembler generationContextAssembler,
      CompanionConfig companionConfig,
      MeterRegistry meterRegistry,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor) {
    this.retrievalInjector = retrievalInjector;
    this.generationContextAssembler = generationContextAssembler;
    this.companionConfig = companionConfig;
    this.meterRegistry = meterRegistry;
    this.retrievalExecutor = retrievalExecutor;
  }

  @Override
  @Timed(value = "conversation.start", description = "Time to start a conversation session")
  public ConversationSession startSession() {
    UUID sessionId = UUID.randomUUID();
    CompanionConfig.Transcript labels = companionConfig.getTranscript();

    // The listener needs the session, which needs the aggregator
    ConversationSession[] holder = new ConversationSession[1];
    TranscriptAggregator aggregator =
        new TranscriptAggregator(
            labels.getLocalLabel(),
            labels.getRemoteLabel(),
            meterRegistry,
            line -> onFinalized(holder[0], line));
    ConversationSession session = new ConversationSession(sessionId, aggregator);
    holder[0] = session;

    sessions.put(sessionId, session);
    meterRegistry.counter("conversation.started").increment();
    log.info("Started conversation session {}", sessionId);
    return session;
  }

  @Override
  public ConversationSession getSession(UUID sessionId) {
    ConversationSession session = sessions.get(sessionId);
    if (session == null) {
      throw new SessionNotFoundException(sessionId);
    }
    return session;
  }

  @Override
  public void endSession(UUID sessionId) {
    ConversationSession session = sessions.remove(sessionId);
    if (session == null) {
      throw new SessionNotFoundException(sessionId);
    }
    session.end();
    meterRegistry.counter("conversation.ended").increment();
    log.info("Ended conversation session {}", sessionId);
  }

  @Override
  public TranscriptAggregator.Outcome submitUtterance(UUID sessionId, UtteranceEvent event) {
    ConversationSession session = getSession(sessionId);
    TranscriptAggregator.Outcome outcome = session.getTranscript().apply(event);
    // endSession may have run after the lookup; the closed transcript refused the event
    if (outcome == TranscriptAggregator.Outcome.IGNORED_ENDED) {
      throw new SessionNotFoundException(sessionId);
    }
    log.debug(
        "Session {}: {} event {} -> {}",
        sessionId,
        event.source(),
        event.segmentId(),
        outcome);
    return outcome;
  }

  @Override
  public List<TranscriptLine> getTranscript(UUID sessionId) {
    return getSession(sessionId).getTranscript().snapshot();
  }

  @Override
  public List<ChatMessage> prepareGenerationTurn(UUID sessionId, String userText) {
    ConversationSession session = getSession(sessionId);
    return generationContextAssembler.assemble(session.takePendingContext(), userText);
  }

  @Override
  public int activeSessionCount() {
    return sessions.size();
  }

  private void onFinalized(ConversationSession session, TranscriptLine line) {
    if (session == null || session.isEnded()) {
      return;
    }
    if (!companionConfig.getRetrieval().getTriggerSources().contains(line.source().name())) {
      return;
    }
    try {
      retrievalExecutor.execute(() -> retrieveFor(session, line));
    } catch (RejectedExecutionException e) {
      log.warn(
          "RetrievalDegraded: executor saturated, skipping retrieval for {}", line.lineId());
      meterRegistry.counter("retrieval.degraded").increment();
      session.recordRetrieval(RetrievalOutcome.degraded("retrieval executor saturated"));
    }
  }

  private void retrieveFor(ConversationSession session, TranscriptLine line) {
    RetrievalOutcome outcome = retrievalInjector.retrieve(line.text());
    if (session.isEnded()) {
      log.debug(
          "Session {} ended during retrieval for {}, discarding result",
          session.getId(),
          line.lineId());
      return;
    }
    session.recordRetrieval(outcome);
    if (outcome.hasContext() && session.offerContext(outcome.context())) {
      log.debug(
          "Session {}: context from {} passages queued for the next turn",
          session.getId(),
          outcome.context().passages().size());
    }
  }
}
