package com.hornetcontrol.mission.protocol;

/** Message types received from the relay. */
public final class RelayMessageType {
  public static final String INITIAL_STATE = "initial_state";
  public static final String STATE_UPDATE = "state_update";
  public static final String COMMAND_RESPONSE = "command_response";
  public static final String ERROR = "error";

  private RelayMessageType() {}
}
