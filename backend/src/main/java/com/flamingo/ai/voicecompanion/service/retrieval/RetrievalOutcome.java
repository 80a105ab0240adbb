package com.flamingo.ai.voicecompanion.service.retrieval;

/**
 * Result of one retrieval attempt. Never an exception: failures are reported as {@link
 * Status#DEGRADED}.
 */
public record RetrievalOutcome(Status status, InjectedContext context, String detail) {

  public enum Status {
    /** The gate did not trigger. */
    SKIPPED,
    /** Triggered, but the store had nothing to return. */
    EMPTY,
    /** Context was produced. */
    INJECTED,
    /** Embedding or search failed; the turn proceeds without context. */
    DEGRADED
  }

  public static RetrievalOutcome skipped() {
    return new RetrievalOutcome(Status.SKIPPED, null, null);
  }

  public static RetrievalOutcome empty() {
    return new RetrievalOutcome(Status.EMPTY, null, null);
  }

  public static RetrievalOutcome injected(InjectedContext context) {
    return new RetrievalOutcome(Status.INJECTED, context, null);
  }

  public static RetrievalOutcome degraded(String detail) {
    return new RetrievalOutcome(Status.DEGRADED, null, detail);
  }

  public boolean hasContext() {
    return context != null;
  }
}
