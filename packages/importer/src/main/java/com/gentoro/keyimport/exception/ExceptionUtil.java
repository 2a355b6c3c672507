package com.gentoro.keyimport.exception;

/** Helpers for turning failures into loggable or user-facing text. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Single-line stack summary, e.g. {@code a.B.run (B.java:42) > a.C.main (C.java:10)}.
   *
   * @param t throwable to summarize (null returns empty string)
   * @param maxFrames maximum number of top frames; if <= 0 all frames are included
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Message for display next to a file name. Uses the outermost non-blank message of the cause
   * chain and falls back to the exception type.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    Throwable current = t;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        return message;
      }
      current = current.getCause();
    }
    return t.getClass().getSimpleName();
  }
}
