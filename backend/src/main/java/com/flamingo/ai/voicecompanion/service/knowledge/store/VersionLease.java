package com.flamingo.ai.voicecompanion.service.knowledge.store;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A reader's hold on one knowledge store version. While any lease is open the version is not
 * reclaimed, even after it has been swapped out. Close exactly once, preferably via
 * try-with-resources.
 */
public final class VersionLease implements AutoCloseable {

  private final KnowledgeStoreVersion version;
  private final KnowledgeStoreManager manager;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  VersionLease(KnowledgeStoreVersion version, KnowledgeStoreManager manager) {
    this.version = version;
    this.manager = manager;
  }

  public KnowledgeStoreVersion version() {
    return version;
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      manager.release(version);
    }
  }
}
