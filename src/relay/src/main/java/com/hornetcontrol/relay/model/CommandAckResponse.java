package com.hornetcontrol.relay.model;

/** Response contract for {@code POST /api/command}. */
public record CommandAckResponse(boolean success, String message) {}
