package com.hornetcontrol.mission.protocol;

/** Fire-and-forget transport for command envelopes. */
public interface CommandSender {
  /**
   * Sends one command.
   *
   * @param command command to send
   * @throws TransportException when the transport is not open or the send fails
   */
  void send(Command command);
}
