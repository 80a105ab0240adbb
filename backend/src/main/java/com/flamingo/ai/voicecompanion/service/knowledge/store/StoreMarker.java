package com.flamingo.ai.voicecompanion.service.knowledge.store;

/**
 * Modification marker of the persisted store: the snapshot generation plus the manifest's
 * modification time. Two markers differ whenever the persisted store was rewritten.
 *
 * @param generation monotonic snapshot generation, 0 when nothing is persisted
 * @param modifiedAtMillis manifest modification time, 0 when nothing is persisted
 */
public record StoreMarker(long generation, long modifiedAtMillis) {

  /** Marker of a store that has never been persisted. */
  public static final StoreMarker ABSENT = new StoreMarker(0, 0);
}
