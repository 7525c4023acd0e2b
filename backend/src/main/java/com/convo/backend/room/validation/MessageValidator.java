package com.convo.backend.room.validation;

import com.convo.backend.room.config.RoomProperties;
import org.springframework.stereotype.Component;

/**
 * Checks raw message input before it reaches a room. The length limit applies to the raw string;
 * trimming happens when the message is stored.
 */
@Component
public class MessageValidator {

  private final int maxLength;

  public MessageValidator(RoomProperties properties) {
    this.maxLength = properties.getMaxMessageLength();
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxMessageLength must be positive");
    }
  }

  public MessageValidationResult validate(Object rawText) {
    if (rawText == null) {
      return MessageValidationResult.rejected(
          MessageRejectionReason.EMPTY, "Message must be a non-empty string");
    }
    if (!(rawText instanceof String text)) {
      return MessageValidationResult.rejected(
          MessageRejectionReason.WRONG_TYPE, "Message must be a non-empty string");
    }
    if (text.isBlank()) {
      return MessageValidationResult.rejected(
          MessageRejectionReason.EMPTY, "Message cannot be empty");
    }
    if (text.length() > maxLength) {
      return MessageValidationResult.rejected(
          MessageRejectionReason.TOO_LONG,
          "Message exceeds maximum length of " + maxLength + " characters");
    }
    return MessageValidationResult.ok();
  }

  public int maxLength() {
    return maxLength;
  }
}
