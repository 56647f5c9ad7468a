package com.hornetcontrol.relay.hub;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class DisconnectsTest {

  @Test
  void isExpectedClientDisconnect_matchesBrokenPipe() {
    assertThat(Disconnects.isExpectedClientDisconnect(new IOException("Broken pipe"))).isTrue();
    assertThat(Disconnects.isExpectedClientDisconnect(new IOException("Connection reset by peer"))).isTrue();
  }

  @Test
  void isExpectedClientDisconnect_followsNestedCauses() {
    IOException root = new IOException("The WebSocket session [3] has been closed: Session closed");
    Throwable wrapped = new IllegalStateException("send failed", new UncheckedIOException(root));

    assertThat(Disconnects.isExpectedClientDisconnect(wrapped)).isTrue();
  }

  @Test
  void isExpectedClientDisconnect_rejectsOtherFailures() {
    assertThat(Disconnects.isExpectedClientDisconnect(new IllegalArgumentException("bad frame"))).isFalse();
    assertThat(Disconnects.isExpectedClientDisconnect(new IOException())).isFalse();
    assertThat(Disconnects.isExpectedClientDisconnect(null)).isFalse();
  }

  @Test
  void rootCauseSummary_reportsInnermostCause() {
    Throwable wrapped = new IllegalStateException("outer", new IOException("Broken pipe"));

    assertThat(Disconnects.rootCauseSummary(wrapped)).isEqualTo("IOException: Broken pipe");
    assertThat(Disconnects.rootCauseSummary(new IllegalStateException())).isEqualTo("IllegalStateException");
  }
}
