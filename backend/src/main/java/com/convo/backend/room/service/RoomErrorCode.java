package com.convo.backend.room.service;

import org.springframework.http.HttpStatus;

public enum RoomErrorCode {
  ROOM_NOT_FOUND(HttpStatus.NOT_FOUND, "Room not found"),
  INVALID_MESSAGE(HttpStatus.BAD_REQUEST, "Invalid message"),
  ROOM_FULL(HttpStatus.CONFLICT, "Room is full"),
  EMPTY_ROOM(HttpStatus.CONFLICT, "Nothing to summarize"),
  ALREADY_SUMMARIZING(HttpStatus.CONFLICT, "Summary in progress");

  private final HttpStatus status;
  private final String title;

  RoomErrorCode(HttpStatus status, String title) {
    this.status = status;
    this.title = title;
  }

  public HttpStatus status() {
    return status;
  }

  public String title() {
    return title;
  }
}
