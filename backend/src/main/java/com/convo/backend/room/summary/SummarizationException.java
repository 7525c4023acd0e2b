package com.convo.backend.room.summary;

/** The summarization provider failed or replied with something that is not a summary. */
public class SummarizationException extends RuntimeException {

  public SummarizationException(String message) {
    super(message);
  }

  public SummarizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
