package com.convo.backend.room.summary;

import com.convo.backend.room.domain.RoomMessage;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Renders a transcript as one {@code [timestamp] author: text} line per message. */
public class TranscriptFormatter {

  static final String EMPTY_TRANSCRIPT = "No messages in this conversation.";

  private final DateTimeFormatter timestampFormat;

  public TranscriptFormatter(ZoneId zone) {
    this.timestampFormat =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(Objects.requireNonNull(zone, "zone must not be null"));
  }

  public String format(List<RoomMessage> messages) {
    if (messages == null || messages.isEmpty()) {
      return EMPTY_TRANSCRIPT;
    }
    return messages.stream().map(this::formatLine).collect(Collectors.joining("\n"));
  }

  private String formatLine(RoomMessage message) {
    return "["
        + timestampFormat.format(message.timestamp())
        + "] "
        + message.username()
        + ": "
        + message.message();
  }
}
