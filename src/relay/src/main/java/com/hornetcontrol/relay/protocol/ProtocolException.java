package com.hornetcontrol.relay.protocol;

/**
 * Raised when an inbound message cannot be parsed or lacks a mandatory field.
 *
 * <p>The hub drops such messages with a log entry and keeps the connection open.
 */
public class ProtocolException extends RuntimeException {
  public ProtocolException(String message) {
    super(message);
  }

  public ProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
