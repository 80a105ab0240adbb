package com.flamingo.ai.voicecompanion.service.transcript;

import java.time.Instant;

/**
 * One line of the merged transcript.
 *
 * @param lineId {@code source:segmentId}
 * @param source recognition source the line belongs to
 * @param speakerLabel label derived from the source
 * @param text latest text
 * @param isFinal whether the text is frozen
 * @param lastUpdatedAt emission time of the last applied event
 */
public record TranscriptLine(
    String lineId,
    UtteranceSource source,
    String speakerLabel,
    String text,
    boolean isFinal,
    Instant lastUpdatedAt) {}
