package com.convo.backend.room.validation;

public record MessageValidationResult(MessageRejectionReason reason, String message) {

  private static final MessageValidationResult OK = new MessageValidationResult(null, null);

  public static MessageValidationResult ok() {
    return OK;
  }

  public static MessageValidationResult rejected(MessageRejectionReason reason, String message) {
    if (reason == null) {
      throw new IllegalArgumentException("reason must not be null");
    }
    return new MessageValidationResult(reason, message);
  }

  public boolean valid() {
    return reason == null;
  }
}
