package com.zengcode.kafka.consumer;

import java.util.Objects;

/** Terminal result of processing one message. Produced once, consumed once by {@link ResultHandler}. */
public final class ProcessingOutcome {

  public enum Kind { SUCCESS, SKIPPED, PERMANENT, EXHAUSTED }

  private static final ProcessingOutcome SUCCESS = new ProcessingOutcome(Kind.SUCCESS, null);

  private final Kind kind;
  private final Throwable cause;

  private ProcessingOutcome(Kind kind, Throwable cause) {
    this.kind = kind;
    this.cause = cause;
  }

  public static ProcessingOutcome success() {
    return SUCCESS;
  }

  public static ProcessingOutcome skipped(Throwable reason) {
    return new ProcessingOutcome(Kind.SKIPPED, reason);
  }

  public static ProcessingOutcome permanent(Throwable cause) {
    return new ProcessingOutcome(Kind.PERMANENT, Objects.requireNonNull(cause, "cause"));
  }

  public static ProcessingOutcome exhausted(Throwable cause) {
    return new ProcessingOutcome(Kind.EXHAUSTED, Objects.requireNonNull(cause, "cause"));
  }

  public Kind kind() {
    return kind;
  }

  /** Null for {@link Kind#SUCCESS}. */
  public Throwable cause() {
    return cause;
  }

  public boolean isFailure() {
    return kind == Kind.PERMANENT || kind == Kind.EXHAUSTED;
  }

  @Override
  public String toString() {
    return cause == null ? kind.name() : kind + "(" + cause + ")";
  }
}
