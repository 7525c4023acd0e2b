package com.convo.backend.room.api;

import io.swagger.v3.oas.annotations.media.Schema;

public record CreateRoomResponse(
    @Schema(description = "Code participants use to join the room.", example = "K3Q9ZT")
        String roomCode) {}
