package com.convo.backend.room.store;

@FunctionalInterface
public interface RoomCodeGenerator {

  String nextCode();
}
