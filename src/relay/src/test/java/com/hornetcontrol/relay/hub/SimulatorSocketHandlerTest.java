package com.hornetcontrol.relay.hub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.hornetcontrol.relay.config.RelayProperties;
import java.net.URI;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

class SimulatorSocketHandlerTest {

  @Test
  void announcedVehicleId_readsIdQueryParameter() {
    assertThat(SimulatorSocketHandler.announcedVehicleId(URI.create("ws://localhost:3001/ws/simulator?id=HORNET-4")))
        .isEqualTo("HORNET-4");
    assertThat(SimulatorSocketHandler.announcedVehicleId(URI.create("ws://localhost:3001/ws/simulator?id=")))
        .isNull();
    assertThat(SimulatorSocketHandler.announcedVehicleId(URI.create("ws://localhost:3001/ws/simulator")))
        .isNull();
    assertThat(SimulatorSocketHandler.announcedVehicleId(null)).isNull();
  }

  @Test
  void connectionLifecycle_registersDecoratedSessionThenUnregisters() throws Exception {
    StateSyncHub hub = mock(StateSyncHub.class);
    WebSocketSession session = mock(WebSocketSession.class);
    when(session.getUri()).thenReturn(URI.create("ws://localhost:3001/ws/simulator?id=HORNET-2"));
    SimulatorSocketHandler handler = new SimulatorSocketHandler(hub, new RelayProperties());

    handler.afterConnectionEstablished(session);
    handler.afterConnectionClosed(session, CloseStatus.NORMAL);

    verify(hub).registerSimulator(any(ConcurrentWebSocketSessionDecorator.class), eq("HORNET-2"));
    verify(hub).unregisterSimulator(session);
  }
}
