package com.hornetcontrol.mission.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Point on a mission path, in planar meters ({@code x,y}) or map degrees ({@code lng,lat}).
 *
 * @param x planar north offset in meters
 * @param y planar east offset in meters
 * @param lng longitude in degrees
 * @param lat latitude in degrees
 * @param altitude authored altitude, informational only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Waypoint(Double x, Double y, Double lng, Double lat, Double altitude) {

  public static Waypoint planar(double x, double y) {
    return new Waypoint(x, y, null, null, null);
  }

  public static Waypoint geographic(double lng, double lat) {
    return new Waypoint(null, null, lng, lat, null);
  }

  @JsonIgnore
  public boolean hasPlanar() {
    return x != null && y != null;
  }

  @JsonIgnore
  public boolean hasGeographic() {
    return lng != null && lat != null;
  }
}
