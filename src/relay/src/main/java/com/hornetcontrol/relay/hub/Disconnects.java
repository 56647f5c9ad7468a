package com.hornetcontrol.relay.hub;

import java.util.Locale;

/** Classifies socket send failures so that routine client drop-offs stay out of warn logs. */
final class Disconnects {
  private Disconnects() {}

  static boolean isExpectedClientDisconnect(Throwable error) {
    Throwable current = error;
    while (current != null) {
      String className = current.getClass().getName();
      if (className.endsWith("ClientAbortException") || className.endsWith("EofException")) {
        return true;
      }
      if (hasDisconnectMessage(current.getMessage())) {
        return true;
      }
      current = current.getCause();
    }
    return false;
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

  private static boolean hasDisconnectMessage(String message) {
    if (message == null || message.isBlank()) {
      return false;
    }
    String normalized = message.toLowerCase(Locale.ROOT);
    return normalized.contains("broken pipe")
        || normalized.contains("connection reset")
        || normalized.contains("socket closed")
        || normalized.contains("session closed")
        || normalized.contains("connection abort");
  }
}
