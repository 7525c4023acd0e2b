package com.convo.backend.room.store;

import com.convo.backend.room.domain.Room;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class InMemoryRoomStore implements RoomStore {

  static final int MAX_CODE_ATTEMPTS = 100;

  private final ConcurrentMap<String, Room> rooms = new ConcurrentHashMap<>();
  private final RoomCodeGenerator codeGenerator;
  private final Clock clock;

  public InMemoryRoomStore(RoomCodeGenerator codeGenerator, Clock clock) {
    this.codeGenerator = Objects.requireNonNull(codeGenerator, "codeGenerator must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public String create() {
    for (int attempt = 1; attempt <= MAX_CODE_ATTEMPTS; attempt++) {
      String code = codeGenerator.nextCode();
      Room room = new Room(code, clock.instant());
      if (rooms.putIfAbsent(code, room) == null) {
        return code;
      }
      log.debug("Room code {} is taken, retrying (attempt {})", code, attempt);
    }
    throw new IllegalStateException(
        "Could not allocate a free room code after " + MAX_CODE_ATTEMPTS + " attempts");
  }

  @Override
  public boolean exists(String roomCode) {
    return roomCode != null && rooms.containsKey(roomCode);
  }

  @Override
  public Optional<Room> get(String roomCode) {
    if (roomCode == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(rooms.get(roomCode));
  }

  @Override
  public void remove(String roomCode) {
    if (roomCode != null) {
      rooms.remove(roomCode);
    }
  }

  @Override
  public boolean remove(String roomCode, Room room) {
    if (roomCode == null || room == null) {
      return false;
    }
    return rooms.remove(roomCode, room);
  }

  @Override
  public Collection<Room> snapshot() {
    return List.copyOf(rooms.values());
  }

  @Override
  public int size() {
    return rooms.size();
  }
}
