package com.convo.backend.room.controller;

import com.convo.backend.room.api.CreateRoomResponse;
import com.convo.backend.room.api.RoomExistsResponse;
import com.convo.backend.room.api.SendMessageRequest;
import com.convo.backend.room.domain.RoomMessage;
import com.convo.backend.room.domain.RoomSummary;
import com.convo.backend.room.service.RoomSessionCoordinator;
import jakarta.validation.Valid;
import java.util.concurrent.CompletableFuture;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class RoomController {

  private final RoomSessionCoordinator coordinator;

  public RoomController(RoomSessionCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  @PostMapping({"/create-room", "/rooms"})
  public CreateRoomResponse createRoom() {
    return new CreateRoomResponse(coordinator.createRoom());
  }

  @GetMapping({"/room-exists/{roomCode}", "/rooms/{roomCode}/exists"})
  public RoomExistsResponse roomExists(@PathVariable String roomCode) {
    return new RoomExistsResponse(coordinator.roomExists(roomCode));
  }

  @PostMapping("/rooms/{roomCode}/messages")
  public RoomMessage sendMessage(
      @PathVariable String roomCode, @Valid @RequestBody SendMessageRequest request) {
    return coordinator.sendMessage(roomCode, request.username(), request.message());
  }

  /** Completes once the summary was broadcast to the room; the room closes shortly after. */
  @PostMapping("/rooms/{roomCode}/summary")
  public CompletableFuture<RoomSummary> requestSummary(@PathVariable String roomCode) {
    return coordinator.requestSummary(roomCode);
  }
}
