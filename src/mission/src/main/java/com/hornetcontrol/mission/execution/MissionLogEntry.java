package com.hornetcontrol.mission.execution;

public record MissionLogEntry(String timestamp, LogSeverity severity, String message) {}
