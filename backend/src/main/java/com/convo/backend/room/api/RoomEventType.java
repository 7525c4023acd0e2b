package com.convo.backend.room.api;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Kind of event pushed on a room event stream.", enumAsRef = true)
public enum RoomEventType {
  JOINED("joined"),
  USER_JOINED("user-joined"),
  USER_LEFT("user-left"),
  RECEIVE_MESSAGE("receive-message"),
  SUMMARY_GENERATING("summary-generating"),
  SUMMARY_GENERATED("summary-generated"),
  ROOM_CLOSED("room-closed");

  private final String value;

  RoomEventType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
