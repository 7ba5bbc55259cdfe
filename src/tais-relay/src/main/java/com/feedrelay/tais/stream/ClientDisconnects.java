package com.feedrelay.tais.stream;

import java.util.Locale;

/** Classifies transport failures raised while writing to a stream client. */
final class ClientDisconnects {
  private ClientDisconnects() {}

  static boolean isExpectedClientDisconnect(Throwable error) {
    Throwable current = error;
    while (current != null) {
      String className = current.getClass().getName();
      if (className.endsWith("ClientAbortException")
          || className.endsWith("EofException")
          || className.endsWith("AsyncRequestNotUsableException")) {
        return true;
      }
      if (hasDisconnectMessage(current.getMessage())) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static boolean hasDisconnectMessage(String message) {
    if (message == null || message.isBlank()) {
      return false;
    }
    String normalized = message.toLowerCase(Locale.ROOT);
    return normalized.contains("broken pipe")
        || normalized.contains("connection reset")
        || normalized.contains("socket closed")
        || normalized.contains("stream closed")
        || normalized.contains("connection abort")
        || normalized.contains("already completed")
        || normalized.contains("forcibly closed by the remote host");
  }

  static String rootCauseSummary(Throwable error) {
    Throwable current = error;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    String message = current.getMessage();
    if (message == null || message.isBlank()) {
      return current.getClass().getSimpleName();
    }
    return current.getClass().getSimpleName() + ": " + message;
  }
}
