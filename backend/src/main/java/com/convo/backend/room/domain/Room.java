package com.convo.backend.room.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of a single chat room.
 *
 * <p>Instances are owned by the room store. Every accessor and mutator other than {@link #code()}
 * and {@link #createdAt()} must be called while holding the room lock ({@link #lock()} /
 * {@link #unlock()}); rooms are independent units of concurrency, so no other lock is ever taken
 * together with this one.
 */
public class Room {

  private final String code;
  private final Instant createdAt;
  private final ReentrantLock lock = new ReentrantLock();
  private final List<Participant> participants = new ArrayList<>();
  private final List<RoomMessage> messages = new ArrayList<>();

  private Instant lastActivityAt;
  private RoomStatus status = RoomStatus.ACTIVE;
  private ScheduledFuture<?> pendingClose;

  public Room(String code, Instant createdAt) {
    this.code = Objects.requireNonNull(code, "code must not be null");
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    this.lastActivityAt = createdAt;
  }

  public String code() {
    return code;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public void lock() {
    lock.lock();
  }

  public void unlock() {
    lock.unlock();
  }

  public Instant lastActivityAt() {
    return lastActivityAt;
  }

  public void touch(Instant now) {
    if (now.isAfter(lastActivityAt)) {
      lastActivityAt = now;
    }
  }

  public RoomStatus status() {
    return status;
  }

  public boolean isClosed() {
    return status == RoomStatus.CLOSED;
  }

  public void markSummarizing() {
    requireStatus(RoomStatus.ACTIVE);
    status = RoomStatus.SUMMARIZING;
  }

  public void markActive() {
    requireStatus(RoomStatus.SUMMARIZING);
    status = RoomStatus.ACTIVE;
  }

  /**
   * Moves the room to {@link RoomStatus#CLOSED}, cancels a pending close task and drops the
   * transcript and member list. Returns {@code false} if the room was already closed.
   */
  public boolean close() {
    if (status == RoomStatus.CLOSED) {
      return false;
    }
    status = RoomStatus.CLOSED;
    if (pendingClose != null) {
      pendingClose.cancel(false);
      pendingClose = null;
    }
    messages.clear();
    participants.clear();
    return true;
  }

  public void schedulePendingClose(ScheduledFuture<?> future) {
    if (pendingClose != null) {
      pendingClose.cancel(false);
    }
    pendingClose = future;
  }

  public boolean hasPendingClose() {
    return pendingClose != null && !pendingClose.isDone();
  }

  public void addParticipant(Participant participant) {
    participants.add(Objects.requireNonNull(participant, "participant must not be null"));
  }

  /** Removes the first participant bound to the given connection. */
  public Optional<Participant> removeParticipant(String connectionId) {
    for (int i = 0; i < participants.size(); i++) {
      if (participants.get(i).connectionId().equals(connectionId)) {
        return Optional.of(participants.remove(i));
      }
    }
    return Optional.empty();
  }

  public List<Participant> participants() {
    return List.copyOf(participants);
  }

  public void appendMessage(RoomMessage message) {
    messages.add(Objects.requireNonNull(message, "message must not be null"));
  }

  public int messageCount() {
    return messages.size();
  }

  public List<RoomMessage> messages() {
    return List.copyOf(messages);
  }

  private void requireStatus(RoomStatus expected) {
    if (status != expected) {
      throw new IllegalStateException(
          "Room " + code + " is " + status + ", expected " + expected);
    }
  }
}
