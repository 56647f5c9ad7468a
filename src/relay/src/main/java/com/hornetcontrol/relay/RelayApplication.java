package com.hornetcontrol.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RelayApplication {
  // Main entrypoint: boots Spring and exposes the observer and simulator WebSocket channels.
  public static void main(String[] args) {
    SpringApplication.run(RelayApplication.class, args);
  }
}
