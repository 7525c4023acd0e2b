package com.convo.backend.room.service;

import com.convo.backend.room.validation.MessageRejectionReason;
import com.convo.backend.room.validation.MessageValidationResult;

/** A per-request room error. Reported to the requesting connection only. */
public class RoomOperationException extends RuntimeException {

  private final RoomErrorCode code;
  private final MessageRejectionReason rejectionReason;

  public RoomOperationException(RoomErrorCode code, String message) {
    this(code, message, null);
  }

  private RoomOperationException(
      RoomErrorCode code, String message, MessageRejectionReason rejectionReason) {
    super(message);
    this.code = code;
    this.rejectionReason = rejectionReason;
  }

  public static RoomOperationException roomNotFound() {
    return new RoomOperationException(RoomErrorCode.ROOM_NOT_FOUND, "Room does not exist");
  }

  public static RoomOperationException invalidMessage(MessageValidationResult validation) {
    return new RoomOperationException(
        RoomErrorCode.INVALID_MESSAGE, validation.message(), validation.reason());
  }

  public static RoomOperationException roomFull(int maxMessages) {
    return new RoomOperationException(
        RoomErrorCode.ROOM_FULL,
        "Room has reached maximum message limit of " + maxMessages);
  }

  public static RoomOperationException emptyRoom() {
    return new RoomOperationException(RoomErrorCode.EMPTY_ROOM, "No messages to summarize");
  }

  public static RoomOperationException alreadySummarizing() {
    return new RoomOperationException(
        RoomErrorCode.ALREADY_SUMMARIZING, "A summary is already being generated for this room");
  }

  public RoomErrorCode code() {
    return code;
  }

  /** Validator verdict for {@link RoomErrorCode#INVALID_MESSAGE}, otherwise {@code null}. */
  public MessageRejectionReason rejectionReason() {
    return rejectionReason;
  }
}
