package com.convo.backend.room.validation;

public enum MessageRejectionReason {
  EMPTY,
  TOO_LONG,
  WRONG_TYPE
}
