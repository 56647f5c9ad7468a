package com.hornetcontrol.mission.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hornetcontrol.mission.config.MissionPropertiesFixtures;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FleetRepositionClientTest {
  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private FleetRepositionClient client;

  @BeforeEach
  void setUp() {
    client = new FleetRepositionClient(httpClient, objectMapper, MissionPropertiesFixtures.defaults());
  }

  @Test
  void reposition_postsCircleToResetPositions() throws Exception {
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(httpResponse);

    assertTrue(client.reposition(RepositionRequest.circle(12.5, -3.0, 5.0)));

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    HttpRequest request = captor.getValue();
    assertEquals("POST", request.method());
    assertEquals("http://relay.test/api/reset-positions", request.uri().toString());
    JsonNode body = objectMapper.readTree(readBody(request));
    assertEquals(12.5, body.path("centerX").asDouble());
    assertEquals(-3.0, body.path("centerY").asDouble());
    assertEquals(5.0, body.path("radius").asDouble());
    assertFalse(body.has("uavId"));
    assertFalse(body.has("swarmId"));
  }

  @Test
  void reposition_returnsFalseOnErrorStatus() throws Exception {
    when(httpResponse.statusCode()).thenReturn(500);
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(httpResponse);

    assertFalse(client.reposition(RepositionRequest.swarm("SWARM-1")));
  }

  @Test
  void reposition_returnsFalseWhenUnreachable() throws Exception {
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenThrow(new IOException("Connection refused"));

    assertFalse(client.reposition(RepositionRequest.vehicle("HORNET-1")));
  }

  private static String readBody(HttpRequest request) throws InterruptedException {
    List<ByteBuffer> chunks = new ArrayList<>();
    CountDownLatch done = new CountDownLatch(1);
    request.bodyPublisher().orElseThrow().subscribe(new Flow.Subscriber<>() {
      @Override
      public void onSubscribe(Flow.Subscription subscription) {
        subscription.request(Long.MAX_VALUE);
      }

      @Override
      public void onNext(ByteBuffer item) {
        chunks.add(item);
      }

      @Override
      public void onError(Throwable throwable) {
        done.countDown();
      }

      @Override
      public void onComplete() {
        done.countDown();
      }
    });
    done.await(1, TimeUnit.SECONDS);
    StringBuilder body = new StringBuilder();
    for (ByteBuffer chunk : chunks) {
      body.append(StandardCharsets.UTF_8.decode(chunk));
    }
    return body.toString();
  }
}
