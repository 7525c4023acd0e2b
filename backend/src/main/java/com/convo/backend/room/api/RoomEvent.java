package com.convo.backend.room.api;

import com.convo.backend.room.domain.RoomMessage;
import com.convo.backend.room.domain.RoomSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Event delivered to the members of a room.")
public record RoomEvent(
    RoomEventType type,
    String roomCode,
    @Schema(description = "Display name the event refers to, if any.") String username,
    @Schema(description = "Connection the event refers to, if any.") String connectionId,
    @Schema(description = "Message payload for receive-message events.") RoomMessage message,
    @Schema(description = "Summary payload for summary-generated events.") RoomSummary summary,
    @Schema(description = "Why the room was closed, for room-closed events.") RoomCloseReason reason) {

  public static RoomEvent joined(String roomCode, String connectionId, String username) {
    return new RoomEvent(
        RoomEventType.JOINED, roomCode, username, connectionId, null, null, null);
  }

  public static RoomEvent userJoined(String roomCode, String connectionId, String username) {
    return new RoomEvent(
        RoomEventType.USER_JOINED, roomCode, username, connectionId, null, null, null);
  }

  public static RoomEvent userLeft(String roomCode, String connectionId, String username) {
    return new RoomEvent(
        RoomEventType.USER_LEFT, roomCode, username, connectionId, null, null, null);
  }

  public static RoomEvent message(String roomCode, RoomMessage message) {
    return new RoomEvent(
        RoomEventType.RECEIVE_MESSAGE,
        roomCode,
        message.username(),
        null,
        message,
        null,
        null);
  }

  public static RoomEvent summaryGenerating(String roomCode) {
    return new RoomEvent(
        RoomEventType.SUMMARY_GENERATING, roomCode, null, null, null, null, null);
  }

  public static RoomEvent summaryGenerated(String roomCode, RoomSummary summary) {
    return new RoomEvent(
        RoomEventType.SUMMARY_GENERATED, roomCode, null, null, null, summary, null);
  }

  public static RoomEvent roomClosed(String roomCode, RoomCloseReason reason) {
    return new RoomEvent(RoomEventType.ROOM_CLOSED, roomCode, null, null, null, null, reason);
  }
}
