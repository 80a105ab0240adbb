package com.flamingo.ai.voicecompanion.domain.enums;

/** Defines the ingestion status of an uploaded document. */
public enum DocumentStatus {
  /** Document has been received but not yet ingested. */
  PENDING,

  /** Document was extracted, chunked, embedded and merged into the knowledge store. */
  PROCESSED,

  /** Ingestion failed; the knowledge store was left untouched. */
  FAILED
}
