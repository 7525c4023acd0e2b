package com.convo.backend.room.api;

public record RoomExistsResponse(boolean exists) {}
