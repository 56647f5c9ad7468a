package com.hornetcontrol.relay.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Parses inbound relay messages and renders the ones the relay originates itself.
 */
@Component
public class RelayMessages {
  private final ObjectMapper objectMapper;

  public RelayMessages(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses a raw text frame into a JSON object.
   *
   * @param payload raw frame
   * @return parsed object
   * @throws ProtocolException when the frame is not a JSON object
   */
  public ObjectNode parse(String payload) {
    JsonNode node;
    try {
      node = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      throw new ProtocolException("payload is not valid JSON", ex);
    }
    if (node == null || !node.isObject()) {
      throw new ProtocolException("payload is not a JSON object");
    }
    return (ObjectNode) node;
  }

  /**
   * Checks the command envelope contract: a {@code command} message must name its verb and an
   * explicit {@code targetId}. Other message types are relayed untouched.
   *
   * @param message parsed observer message
   * @throws ProtocolException when the envelope breaks the contract
   */
  public void requireValidCommand(JsonNode message) {
    if (!MessageType.COMMAND.equals(message.path("type").asText())) {
      return;
    }
    if (isBlank(message.get("command"))) {
      throw new ProtocolException("command message without a verb");
    }
    if (isBlank(message.get("targetId"))) {
      throw new ProtocolException("command message without an explicit targetId");
    }
  }

  public String initialState(ObjectNode snapshot) {
    ObjectNode message = objectMapper.createObjectNode();
    message.put("type", MessageType.INITIAL_STATE);
    message.set("data", snapshot);
    return write(message);
  }

  public String error(String text) {
    ObjectNode message = objectMapper.createObjectNode();
    message.put("type", MessageType.ERROR);
    message.put("message", text);
    return write(message);
  }

  public String write(JsonNode message) {
    try {
      return objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialize relay message", ex);
    }
  }

  private static boolean isBlank(JsonNode node) {
    return node == null || !node.isTextual() || node.asText().isBlank();
  }
}
