package com.convo.backend.room.broadcast;

import com.convo.backend.room.api.RoomEvent;

/**
 * Delivers room events to the members currently connected to a room. Delivery is best effort:
 * implementations must not throw when a member cannot be reached.
 */
@FunctionalInterface
public interface RoomBroadcastSink {

  void publish(String roomCode, RoomEvent event);
}
