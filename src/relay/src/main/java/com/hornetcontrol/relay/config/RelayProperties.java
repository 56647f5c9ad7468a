package com.hornetcontrol.relay.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the relay service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code relay.*} prefix.
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {
  private String observerPath = "/ws/client";
  private String simulatorPath = "/ws/simulator";
  private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
  private int sendTimeLimitMs = 5_000;
  private int sendBufferSizeLimit = 512 * 1024;
  private final Fleet fleet = new Fleet();

  public String getObserverPath() {
    return observerPath;
  }

  public void setObserverPath(String observerPath) {
    this.observerPath = observerPath;
  }

  public String getSimulatorPath() {
    return simulatorPath;
  }

  public void setSimulatorPath(String simulatorPath) {
    this.simulatorPath = simulatorPath;
  }

  public List<String> getAllowedOrigins() {
    return allowedOrigins;
  }

  public void setAllowedOrigins(List<String> allowedOrigins) {
    this.allowedOrigins = allowedOrigins;
  }

  public int getSendTimeLimitMs() {
    return sendTimeLimitMs;
  }

  public void setSendTimeLimitMs(int sendTimeLimitMs) {
    this.sendTimeLimitMs = sendTimeLimitMs;
  }

  public int getSendBufferSizeLimit() {
    return sendBufferSizeLimit;
  }

  public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
    this.sendBufferSizeLimit = sendBufferSizeLimit;
  }

  public Fleet getFleet() {
    return fleet;
  }

  /** Canonical fleet bootstrap settings. */
  public static class Fleet {
    private boolean seedDefaults = true;

    public boolean isSeedDefaults() {
      return seedDefaults;
    }

    public void setSeedDefaults(boolean seedDefaults) {
      this.seedDefaults = seedDefaults;
    }
  }
}
