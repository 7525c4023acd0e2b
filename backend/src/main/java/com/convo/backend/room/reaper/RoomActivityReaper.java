package com.convo.backend.room.reaper;

import com.convo.backend.room.api.RoomCloseReason;
import com.convo.backend.room.api.RoomEvent;
import com.convo.backend.room.broadcast.RoomBroadcastSink;
import com.convo.backend.room.config.RoomProperties;
import com.convo.backend.room.domain.Room;
import com.convo.backend.room.store.RoomStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/** Periodically removes rooms that have been idle for longer than the inactivity timeout. */
@Component
@Slf4j
public class RoomActivityReaper {

  private final RoomStore roomStore;
  private final RoomBroadcastSink broadcastSink;
  private final RoomProperties properties;
  private final Clock clock;
  private final TaskScheduler taskScheduler;
  private final Counter reapedCounter;

  public RoomActivityReaper(
      RoomStore roomStore,
      RoomBroadcastSink broadcastSink,
      RoomProperties properties,
      Clock clock,
      TaskScheduler taskScheduler,
      MeterRegistry meterRegistry) {
    this.roomStore = roomStore;
    this.broadcastSink = broadcastSink;
    this.properties = properties;
    this.clock = clock;
    this.taskScheduler = taskScheduler;
    this.reapedCounter =
        meterRegistry != null
            ? Counter.builder("room_reaped_total")
                .description("Number of rooms removed for inactivity")
                .register(meterRegistry)
            : null;
  }

  @PostConstruct
  void scheduleReaping() {
    Duration interval = properties.getReaperInterval();
    if (interval.isZero() || interval.isNegative()) {
      log.info("Room reaper disabled (interval={})", interval);
      return;
    }
    taskScheduler.scheduleWithFixedDelay(
        this::safeReap, clock.instant().plus(interval), interval);
    log.info(
        "Room reaper started with interval {} and inactivity timeout {}",
        interval,
        properties.getInactivityTimeout());
  }

  /** Returns the number of rooms removed by this pass. */
  public int reapInactiveRooms() {
    Instant threshold = clock.instant().minus(properties.getInactivityTimeout());
    int reaped = 0;
    for (Room room : roomStore.snapshot()) {
      if (reapIfIdle(room, threshold)) {
        reaped++;
      }
    }
    if (reaped > 0) {
      log.info("Expired {} inactive room(s)", reaped);
      if (reapedCounter != null) {
        reapedCounter.increment(reaped);
      }
    }
    return reaped;
  }

  private boolean reapIfIdle(Room room, Instant threshold) {
    room.lock();
    try {
      if (room.isClosed() || !room.lastActivityAt().isBefore(threshold)) {
        return false;
      }
      room.close();
      roomStore.remove(room.code(), room);
      broadcastSink.publish(room.code(), RoomEvent.roomClosed(room.code(), RoomCloseReason.INACTIVE));
    } finally {
      room.unlock();
    }
    log.info("Auto-expired inactive room {}", room.code());
    return true;
  }

  private void safeReap() {
    try {
      reapInactiveRooms();
    } catch (Exception exception) {
      log.warn("Room reaper pass failed", exception);
    }
  }
}
