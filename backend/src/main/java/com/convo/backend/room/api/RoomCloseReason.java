package com.convo.backend.room.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RoomCloseReason {
  SUMMARIZED("summarized"),
  INACTIVE("inactive");

  private final String value;

  RoomCloseReason(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
