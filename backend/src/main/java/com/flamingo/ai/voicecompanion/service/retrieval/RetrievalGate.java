package com.flamingo.ai.voicecompanion.service.retrieval;

/**
 * Decides per finalized utterance whether the knowledge store should be queried. Implementations
 * are pure predicates and may be swapped (for example for an intent classifier) without changing
 * the injector.
 */
public interface RetrievalGate {

  boolean shouldRetrieve(String utteranceText);
}
