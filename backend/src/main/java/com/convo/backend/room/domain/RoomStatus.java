package com.convo.backend.room.domain;

public enum RoomStatus {
  /** Accepting joins and messages. */
  ACTIVE,
  /** A summary request is in flight; messages and further summary requests are rejected. */
  SUMMARIZING,
  /** Removed from the store. Terminal. */
  CLOSED
}
