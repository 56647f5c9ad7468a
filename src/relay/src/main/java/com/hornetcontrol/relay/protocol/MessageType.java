package com.hornetcontrol.relay.protocol;

/** Values of the {@code type} field carried by every relay message. */
public final class MessageType {
  public static final String INITIAL_STATE = "initial_state";
  public static final String STATE_UPDATE = "state_update";
  public static final String COMMAND = "command";
  public static final String COMMAND_RESPONSE = "command_response";
  public static final String ERROR = "error";

  private MessageType() {}
}
