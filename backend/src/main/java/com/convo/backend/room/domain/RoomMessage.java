package com.convo.backend.room.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.Objects;

@Schema(description = "Chat message stored in a room.")
public record RoomMessage(
    @Schema(description = "Display name of the author.", example = "Alice") String username,
    @Schema(description = "Trimmed message text.", example = "hi") String message,
    @Schema(description = "UTC timestamp when the message was accepted.") Instant timestamp) {

  public RoomMessage {
    Objects.requireNonNull(username, "username must not be null");
    Objects.requireNonNull(message, "message must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
  }
}
