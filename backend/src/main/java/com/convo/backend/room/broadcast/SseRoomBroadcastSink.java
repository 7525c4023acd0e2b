package com.convo.backend.room.broadcast;

import com.convo.backend.room.api.RoomEvent;
import com.convo.backend.room.api.RoomEventType;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Fans room events out to the SSE connections registered for each room. A connection whose send
 * fails is dropped; its stream completes with the error, which the transport treats as a
 * disconnect.
 */
@Slf4j
public class SseRoomBroadcastSink implements RoomBroadcastSink {

  private final ConcurrentMap<String, ConcurrentMap<String, SseEmitter>> emittersByRoom =
      new ConcurrentHashMap<>();

  public void register(String roomCode, String connectionId, SseEmitter emitter) {
    emittersByRoom
        .computeIfAbsent(roomCode, key -> new ConcurrentHashMap<>())
        .put(connectionId, emitter);
  }

  public void unregister(String roomCode, String connectionId) {
    emittersByRoom.computeIfPresent(
        roomCode,
        (key, emitters) -> {
          emitters.remove(connectionId);
          return emitters.isEmpty() ? null : emitters;
        });
  }

  @Override
  public void publish(String roomCode, RoomEvent event) {
    Map<String, SseEmitter> emitters = emittersByRoom.get(roomCode);
    if (emitters != null) {
      emitters.forEach(
          (connectionId, emitter) -> {
            if (!isOwnJoin(event, connectionId)) {
              send(roomCode, connectionId, emitter, event);
            }
          });
    }
    if (event.type() == RoomEventType.ROOM_CLOSED) {
      completeRoom(roomCode);
    }
  }

  /** Sends a single event to one connection, e.g. the greeting right after it joined. */
  public boolean sendTo(String roomCode, String connectionId, SseEmitter emitter, RoomEvent event) {
    return send(roomCode, connectionId, emitter, event);
  }

  /** Keep-alive comment on every open connection. */
  public void heartbeat() {
    emittersByRoom.forEach(
        (roomCode, emitters) ->
            emitters.forEach(
                (connectionId, emitter) -> {
                  try {
                    emitter.send(SseEmitter.event().comment("keep-alive"));
                  } catch (IOException | IllegalStateException ex) {
                    drop(roomCode, connectionId, emitter, ex);
                  }
                }));
  }

  public int connectionCount(String roomCode) {
    Map<String, SseEmitter> emitters = emittersByRoom.get(roomCode);
    return emitters != null ? emitters.size() : 0;
  }

  // The joining connection gets the "joined" greeting instead of its own user-joined.
  private static boolean isOwnJoin(RoomEvent event, String connectionId) {
    return event.type() == RoomEventType.USER_JOINED && connectionId.equals(event.connectionId());
  }

  private boolean send(String roomCode, String connectionId, SseEmitter emitter, RoomEvent event) {
    try {
      emitter.send(SseEmitter.event().name(event.type().value()).data(event));
      return true;
    } catch (IOException | IllegalStateException ex) {
      drop(roomCode, connectionId, emitter, ex);
      return false;
    }
  }

  private void drop(String roomCode, String connectionId, SseEmitter emitter, Exception cause) {
    log.debug("Dropping SSE connection {} of room {}", connectionId, roomCode, cause);
    unregister(roomCode, connectionId);
    emitter.completeWithError(cause);
  }

  private void completeRoom(String roomCode) {
    Map<String, SseEmitter> emitters = emittersByRoom.remove(roomCode);
    if (emitters == null) {
      return;
    }
    emitters.values().forEach(SseEmitter::complete);
  }
}
