package com.convo.backend.room.summary;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import java.util.List;

/** Reply shape requested from the model. Only used to derive the JSON schema instruction. */
public record SummaryPayload(
    @JsonPropertyDescription("A concise overall summary of the conversation (2-3 sentences)")
        String summary,
    @JsonPropertyDescription("The key points of the conversation") List<String> keyPoints,
    @JsonPropertyDescription("Action items agreed in the conversation, empty if there are none")
        List<String> actionItems) {}
