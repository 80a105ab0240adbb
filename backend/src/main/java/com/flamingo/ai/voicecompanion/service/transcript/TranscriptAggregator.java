package com.flamingo.ai.voicecompanion.service.transcript;

import com.flamingo.ai.voicecompanion.service.transcript.UtteranceEvent.SegmentKey;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Merges utterance events from both recognition sources into one ordered transcript.
 *
 * <p>Each (source, segmentId) key owns one line. A line is open until its first final event and
 * frozen afterwards; later events for a frozen line are ignored and recorded as anomalies. Lines
 * keep the order in which their keys were first seen. Events for different keys never contend;
 * events for one key are applied atomically in arrival order. Safe to call from both producers
 * concurrently without blocking either.
 */
@Slf4j
public class TranscriptAggregator {

  /** What {@link #apply} did with an event. */
  public enum Outcome {
    CREATED,
    UPDATED,
    FINALIZED,
    /** Blank text for a line that does not exist yet. */
    IGNORED_EMPTY,
    /** The line was already final. */
    IGNORED_CLOSED,
    /** The transcript was closed with {@link #close()}. */
    IGNORED_ENDED
  }

  /** A hidden entry closes a key whose only final event was blank; it is never listed. */
  private record Entry(long order, TranscriptLine line, boolean hidden) {}

  private final Map<SegmentKey, Entry> lines = new ConcurrentHashMap<>();
  private final AtomicLong firstSeen = new AtomicLong();
  private final Queue<TranscriptAnomaly> anomalies = new ConcurrentLinkedQueue<>();
  private final String localLabel;
  private final String remoteLabel;
  private final MeterRegistry meterRegistry;
  private final Consumer<TranscriptLine> finalizedListener;
  private volatile boolean closed;

  public TranscriptAggregator(
      String localLabel,
      String remoteLabel,
      MeterRegistry meterRegistry,
      Consumer<TranscriptLine> finalizedListener) {
    this.localLabel = localLabel;
    this.remoteLabel = remoteLabel;
    this.meterRegistry = meterRegistry;
    this.finalizedListener = finalizedListener == null ? line -> {} : finalizedListener;
  }

  /**
   * Applies one event. Never throws for out-of-protocol events; those are ignored and recorded.
   *
   * @param event validated recognizer event
   * @return what happened to the addressed line
   */
  public Outcome apply(UtteranceEvent event) {
    SegmentKey key = event.key();
    Outcome[] outcome = new Outcome[1];
    TranscriptLine[] result = new TranscriptLine[1];

    lines.compute(
        key,
        (k, existing) -> {
          // Checked under the key's lock so nothing lands after close() has cleared the map
          if (closed) {
            outcome[0] = Outcome.IGNORED_ENDED;
            return existing;
          }
          if (existing == null) {
            if (event.text().isBlank()) {
              outcome[0] = Outcome.IGNORED_EMPTY;
              return event.isFinal()
                  ? new Entry(firstSeen.getAndIncrement(), toLine(k, "", event), true)
                  : null;
            }
            TranscriptLine created = toLine(k, event.text(), event);
            outcome[0] = event.isFinal() ? Outcome.FINALIZED : Outcome.CREATED;
            result[0] = created;
            return new Entry(firstSeen.getAndIncrement(), created, false);
          }
          if (existing.line().isFinal()) {
            outcome[0] = Outcome.IGNORED_CLOSED;
            result[0] = existing.line();
            return existing;
          }
          // Last writer wins; a blank update keeps the previous hypothesis
          String text = event.text().isBlank() ? existing.line().text() : event.text();
          TranscriptLine updated = toLine(k, text, event);
          outcome[0] = event.isFinal() ? Outcome.FINALIZED : Outcome.UPDATED;
          result[0] = updated;
          return new Entry(existing.order(), updated, false);
        });

    if (outcome[0] == Outcome.IGNORED_CLOSED) {
      recordAnomaly(event, key);
    } else if (outcome[0] == Outcome.FINALIZED) {
      notifyFinalized(result[0]);
    }
    return outcome[0];
  }

  /** Ordered, immutable copy of the transcript at the moment of the call. */
  public List<TranscriptLine> snapshot() {
    List<Entry> entries = new ArrayList<>(lines.values());
    entries.sort(Comparator.comparingLong(Entry::order));
    List<TranscriptLine> ordered = new ArrayList<>(entries.size());
    for (Entry entry : entries) {
      if (!entry.hidden()) {
        ordered.add(entry.line());
      }
    }
    return List.copyOf(ordered);
  }

  public List<TranscriptAnomaly> anomalies() {
    return List.copyOf(anomalies);
  }

  /** Number of listed lines. */
  public int size() {
    int count = 0;
    for (Entry entry : lines.values()) {
      if (!entry.hidden()) {
        count++;
      }
    }
    return count;
  }

  /** Discards all lines and anomalies. */
  public void clear() {
    lines.clear();
    anomalies.clear();
  }

  /** Discards all state and refuses every later event with {@link Outcome#IGNORED_ENDED}. */
  public void close() {
    closed = true;
    clear();
  }

  public boolean isClosed() {
    return closed;
  }

  private TranscriptLine toLine(SegmentKey key, String text, UtteranceEvent event) {
    return new TranscriptLine(
        key.lineId(),
        key.source(),
        labelFor(key.source()),
        text,
        event.isFinal(),
        event.emittedAt());
  }

  private String labelFor(UtteranceSource source) {
    return source == UtteranceSource.LOCAL ? localLabel : remoteLabel;
  }

  private void recordAnomaly(UtteranceEvent event, SegmentKey key) {
    TranscriptAnomaly.Type type =
        event.isFinal()
            ? TranscriptAnomaly.Type.DUPLICATE_FINAL_EVENT
            : TranscriptAnomaly.Type.EVENT_AFTER_FINAL;
    anomalies.add(new TranscriptAnomaly(type, key.lineId(), event.text(), Instant.now()));
    meterRegistry.counter("transcript.anomalies", "type", type.name()).increment();
    log.warn("{} for line {} ignored (text: '{}')", type, key.lineId(), event.text());
  }

  private void notifyFinalized(TranscriptLine line) {
    try {
      finalizedListener.accept(line);
    } catch (RuntimeException e) {
      log.error("Finalized-line listener failed for {}: {}", line.lineId(), e.getMessage(), e);
    }
  }
}
