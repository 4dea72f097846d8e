package com.zengcode.kafka.consumer;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * An {@link Error} that escaped user code while handling a message. It points at a bug rather than
 * a transient condition, so it is always permanent.
 */
public class PanicException extends PermanentProcessingException {

  private final transient Throwable panic;
  private final String stack;

  public PanicException(Throwable panic) {
    super("panic: " + panic, panic);
    this.panic = panic;
    this.stack = render(panic);
  }

  public Throwable getPanic() {
    return panic;
  }

  public String getStack() {
    return stack;
  }

  private static String render(Throwable t) {
    var out = new StringWriter();
    t.printStackTrace(new PrintWriter(out));
    return out.toString();
  }
}
