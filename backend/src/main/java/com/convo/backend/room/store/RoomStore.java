package com.convo.backend.room.store;

import com.convo.backend.room.domain.Room;
import java.util.Collection;
import java.util.Optional;

/** Owner of all live rooms, keyed by room code. */
public interface RoomStore {

  /** Creates an empty room under a fresh code that is unique among live rooms. */
  String create();

  boolean exists(String roomCode);

  Optional<Room> get(String roomCode);

  /** Removes the room under the code, if any. */
  void remove(String roomCode);

  /**
   * Removes the mapping only if it still points at {@code room}. Returns {@code false} when the
   * code is absent or already bound to another room.
   */
  boolean remove(String roomCode, Room room);

  /** Point-in-time copy of the live rooms. */
  Collection<Room> snapshot();

  int size();
}
