package com.hornetcontrol.relay.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class RelayMessagesTest {
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final RelayMessages messages = new RelayMessages(objectMapper);

  @Test
  void parse_rejectsNonObjectPayloads() {
    assertThatThrownBy(() -> messages.parse("[1,2]"))
        .isInstanceOf(ProtocolException.class)
        .hasMessageContaining("not a JSON object");
    assertThatThrownBy(() -> messages.parse("{\"type\":"))
        .isInstanceOf(ProtocolException.class)
        .hasMessageContaining("not valid JSON");
  }

  @Test
  void requireValidCommand_needsVerbAndTarget() {
    JsonNode missingTarget = messages.parse("{\"type\":\"command\",\"command\":\"land\",\"targetId\":\" \"}");
    JsonNode missingVerb = messages.parse("{\"type\":\"command\",\"targetId\":\"HORNET-1\"}");

    assertThatThrownBy(() -> messages.requireValidCommand(missingTarget))
        .isInstanceOf(ProtocolException.class)
        .hasMessageContaining("targetId");
    assertThatThrownBy(() -> messages.requireValidCommand(missingVerb))
        .isInstanceOf(ProtocolException.class)
        .hasMessageContaining("verb");
  }

  @Test
  void requireValidCommand_ignoresOtherMessageTypes() {
    JsonNode ping = messages.parse("{\"type\":\"ping\"}");

    assertThatCode(() -> messages.requireValidCommand(ping)).doesNotThrowAnyException();
  }

  @Test
  void error_rendersErrorEnvelope() throws Exception {
    JsonNode error = objectMapper.readTree(messages.error("simulator not connected"));

    assertThat(error.path("type").asText()).isEqualTo("error");
    assertThat(error.path("message").asText()).isEqualTo("simulator not connected");
  }
}
