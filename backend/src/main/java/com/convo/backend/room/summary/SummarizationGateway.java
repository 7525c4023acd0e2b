package com.convo.backend.room.summary;

import com.convo.backend.room.domain.RoomMessage;
import com.convo.backend.room.domain.RoomSummary;
import java.util.List;

/**
 * Turns a room transcript into a structured summary using an external summarization service.
 * Implementations block for the duration of the remote call and never retry on their own.
 */
public interface SummarizationGateway {

  /**
   * @param messages transcript in chronological order, never empty
   * @throws SummarizationException if the provider fails or its reply cannot be parsed
   */
  RoomSummary summarize(List<RoomMessage> messages);
}
