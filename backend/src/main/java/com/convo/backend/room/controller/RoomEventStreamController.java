package com.convo.backend.room.controller;

import com.convo.backend.room.api.RoomEvent;
import com.convo.backend.room.broadcast.SseRoomBroadcastSink;
import com.convo.backend.room.service.RoomOperationException;
import com.convo.backend.room.service.RoomSessionCoordinator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Opening the stream joins the room; the stream ending for any reason leaves it. Each stream is
 * one connection with its own id.
 */
@RestController
@Slf4j
@RequestMapping("/api/rooms")
public class RoomEventStreamController {

  private final RoomSessionCoordinator coordinator;
  private final SseRoomBroadcastSink broadcastSink;

  public RoomEventStreamController(
      RoomSessionCoordinator coordinator, SseRoomBroadcastSink broadcastSink) {
    this.coordinator = coordinator;
    this.broadcastSink = broadcastSink;
  }

  @GetMapping(value = "/{roomCode}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter join(
      @PathVariable String roomCode,
      @RequestParam @NotBlank @Size(max = 64) String username) {
    if (!coordinator.roomExists(roomCode)) {
      throw RoomOperationException.roomNotFound();
    }
    String connectionId = UUID.randomUUID().toString();
    SseEmitter emitter = new SseEmitter(0L);
    emitter.onTimeout(emitter::complete);
    emitter.onCompletion(() -> disconnect(roomCode, connectionId));

    broadcastSink.register(roomCode, connectionId, emitter);
    broadcastSink.sendTo(
        roomCode, connectionId, emitter, RoomEvent.joined(roomCode, connectionId, username));
    try {
      coordinator.join(roomCode, connectionId, username);
    } catch (RuntimeException ex) {
      broadcastSink.unregister(roomCode, connectionId);
      throw ex;
    }
    log.debug("Opened event stream {} for room {}", connectionId, roomCode);
    return emitter;
  }

  private void disconnect(String roomCode, String connectionId) {
    broadcastSink.unregister(roomCode, connectionId);
    coordinator.leave(roomCode, connectionId);
    log.debug("Closed event stream {} for room {}", connectionId, roomCode);
  }
}
