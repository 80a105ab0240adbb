package com.flamingo.ai.voicecompanion.service.retrieval;

import com.flamingo.ai.voicecompanion.service.knowledge.store.ScoredRecord;
import java.util.List;

/**
 * Side-context for exactly one generation turn.
 *
 * @param block the composed, length-bounded text
 * @param passages hits that contributed to the block, in score order
 * @param versionId knowledge store version the hits came from
 */
public record InjectedContext(String block, List<ScoredRecord> passages, long versionId) {}
