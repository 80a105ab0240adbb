package com.flamingo.ai.voicecompanion.service.transcript;

import java.time.Instant;

/**
 * An event the aggregator refused to apply. Recorded for diagnostics, never thrown.
 *
 * @param type what was wrong
 * @param lineId line the event addressed
 * @param ignoredText text of the ignored event
 * @param observedAt when the event was rejected
 */
public record TranscriptAnomaly(Type type, String lineId, String ignoredText, Instant observedAt) {

  public enum Type {
    /** A second final event for a closed segment. */
    DUPLICATE_FINAL_EVENT,
    /** A partial event for a closed segment. */
    EVENT_AFTER_FINAL
  }
}
