package com.convo.backend.room.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Structured summary of a room transcript.")
public record RoomSummary(
    @Schema(description = "Short overview of the conversation. Empty when the model did not provide one.")
        String summary,
    @Schema(description = "False when the overview was missing from the model reply.")
        boolean summaryAvailable,
    @Schema(description = "Key points in the order the model returned them.") List<String> keyPoints,
    @Schema(description = "Action items, empty when there are none.") List<String> actionItems,
    @Schema(description = "Number of messages that were summarized.", example = "12")
        int messageCount) {

  public RoomSummary {
    summary = summary != null ? summary : "";
    keyPoints = keyPoints != null ? List.copyOf(keyPoints) : List.of();
    actionItems = actionItems != null ? List.copyOf(actionItems) : List.of();
  }
}
