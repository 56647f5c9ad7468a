package com.hornetcontrol.mission.relay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.hornetcontrol.mission.geometry.Position;

/**
 * Fields of one relay vehicle the orchestrator reads. Other fields are ignored.
 *
 * @param id vehicle id
 * @param swarm swarm id
 * @param position last reported position
 * @param status flight status as sent by the simulator
 * @param armed armed flag
 * @param battery battery percent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VehicleSnapshot(
    String id,
    String swarm,
    Position position,
    String status,
    Boolean armed,
    Double battery) {}
