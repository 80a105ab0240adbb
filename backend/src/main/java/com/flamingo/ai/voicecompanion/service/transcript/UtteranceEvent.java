package com.flamingo.ai.voicecompanion.service.transcript;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * A recognizer callback, validated into one of two fixed shapes. Identity is the pair (source,
 * segmentId); the same segmentId from two sources denotes two different utterances.
 */
public sealed interface UtteranceEvent permits UtteranceEvent.Partial, UtteranceEvent.Final {

  UtteranceSource source();

  String participantId();

  String segmentId();

  String text();

  Instant emittedAt();

  boolean isFinal();

  default SegmentKey key() {
    return new SegmentKey(source(), segmentId());
  }

  static UtteranceEvent of(
      UtteranceSource source,
      String participantId,
      String segmentId,
      String text,
      boolean isFinal,
      Instant emittedAt) {
    return isFinal
        ? new Final(source, participantId, segmentId, text, emittedAt)
        : new Partial(source, participantId, segmentId, text, emittedAt);
  }

  /** Interim hypothesis; may still change. */
  record Partial(
      UtteranceSource source,
      String participantId,
      String segmentId,
      String text,
      Instant emittedAt)
      implements UtteranceEvent {

    public Partial {
      Objects.requireNonNull(source, "source");
      Objects.requireNonNull(segmentId, "segmentId");
      text = text == null ? "" : text;
      emittedAt = emittedAt == null ? Instant.now() : emittedAt;
    }

    @Override
    public boolean isFinal() {
      return false;
    }
  }

  /** Last word on a segment; freezes its line. */
  record Final(
      UtteranceSource source,
      String participantId,
      String segmentId,
      String text,
      Instant emittedAt)
      implements UtteranceEvent {

    public Final {
      Objects.requireNonNull(source, "source");
      Objects.requireNonNull(segmentId, "segmentId");
      text = text == null ? "" : text;
      emittedAt = emittedAt == null ? Instant.now() : emittedAt;
    }

    @Override
    public boolean isFinal() {
      return true;
    }
  }

  /** Identity of a transcript line. */
  record SegmentKey(UtteranceSource source, String segmentId) {

    /** Line id as exposed to clients, {@code source:segmentId}. */
    public String lineId() {
      return source.name().toLowerCase(Locale.ROOT) + ":" + segmentId;
    }
  }
}
