package com.convo.backend.room.service;

import com.convo.backend.room.api.RoomCloseReason;
import com.convo.backend.room.api.RoomEvent;
import com.convo.backend.room.broadcast.RoomBroadcastSink;
import com.convo.backend.room.config.RoomProperties;
import com.convo.backend.room.domain.Participant;
import com.convo.backend.room.domain.Room;
import com.convo.backend.room.domain.RoomMessage;
import com.convo.backend.room.domain.RoomStatus;
import com.convo.backend.room.domain.RoomSummary;
import com.convo.backend.room.store.RoomStore;
import com.convo.backend.room.summary.SummarizationException;
import com.convo.backend.room.summary.SummarizationGateway;
import com.convo.backend.room.validation.MessageValidationResult;
import com.convo.backend.room.validation.MessageValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Runs join, leave, send and summarize against the room store.
 *
 * <p>Each room moves {@code ACTIVE -> SUMMARIZING -> CLOSED}; a failed summary moves it back to
 * {@code ACTIVE}. All state changes of a room, and the events they produce, happen under that
 * room's lock so members observe events in the order the room recorded them. The summarization
 * call is the only blocking step and runs on {@code summaryExecutor} without the lock.
 */
@Service
@Slf4j
public class RoomSessionCoordinator {

  private final RoomStore roomStore;
  private final MessageValidator messageValidator;
  private final SummarizationGateway summarizationGateway;
  private final RoomBroadcastSink broadcastSink;
  private final Clock clock;
  private final TaskScheduler taskScheduler;
  private final Executor summaryExecutor;
  private final int maxMessages;
  private final Duration closeGracePeriod;

  private final Counter roomsCreatedCounter;
  private final Counter messagesCounter;
  private final Counter summaryRunsCounter;
  private final Counter summaryFailuresCounter;
  private final Timer summaryTimer;

  public RoomSessionCoordinator(
      RoomStore roomStore,
      MessageValidator messageValidator,
      SummarizationGateway summarizationGateway,
      RoomBroadcastSink broadcastSink,
      RoomProperties properties,
      Clock clock,
      TaskScheduler taskScheduler,
      @Qualifier("summaryExecutor") Executor summaryExecutor,
      MeterRegistry meterRegistry) {
    this.roomStore = Objects.requireNonNull(roomStore, "roomStore must not be null");
    this.messageValidator =
        Objects.requireNonNull(messageValidator, "messageValidator must not be null");
    this.summarizationGateway =
        Objects.requireNonNull(summarizationGateway, "summarizationGateway must not be null");
    this.broadcastSink = Objects.requireNonNull(broadcastSink, "broadcastSink must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler must not be null");
    this.summaryExecutor =
        Objects.requireNonNull(summaryExecutor, "summaryExecutor must not be null");
    this.maxMessages = properties.getMaxMessages();
    this.closeGracePeriod = properties.getCloseGracePeriod();

    if (meterRegistry != null) {
      Gauge.builder("room_active", roomStore, RoomStore::size)
          .description("Number of live rooms")
          .register(meterRegistry);
      this.roomsCreatedCounter =
          Counter.builder("room_created_total")
              .description("Number of rooms created")
              .register(meterRegistry);
      this.messagesCounter =
          Counter.builder("room_messages_total")
              .description("Number of messages accepted across all rooms")
              .register(meterRegistry);
      this.summaryRunsCounter =
          Counter.builder("room_summary_runs_total")
              .description("Number of room summaries delivered")
              .register(meterRegistry);
      this.summaryFailuresCounter =
          Counter.builder("room_summary_failures_total")
              .description("Number of failed room summarization attempts")
              .register(meterRegistry);
      this.summaryTimer =
          Timer.builder("room_summary_duration_seconds")
              .description("Latency of the summarization call")
              .register(meterRegistry);
    } else {
      this.roomsCreatedCounter = null;
      this.messagesCounter = null;
      this.summaryRunsCounter = null;
      this.summaryFailuresCounter = null;
      this.summaryTimer = null;
    }
  }

  public String createRoom() {
    String roomCode = roomStore.create();
    increment(roomsCreatedCounter);
    log.info("Room {} created", roomCode);
    return roomCode;
  }

  public boolean roomExists(String roomCode) {
    return roomStore.exists(roomCode);
  }

  public int activeRoomCount() {
    return roomStore.size();
  }

  public Participant join(String roomCode, String connectionId, String displayName) {
    Room room = requireRoom(roomCode);
    Participant participant = new Participant(connectionId, displayName);
    room.lock();
    try {
      requireOpen(room);
      room.addParticipant(participant);
      room.touch(clock.instant());
      broadcastSink.publish(roomCode, RoomEvent.userJoined(roomCode, connectionId, displayName));
    } finally {
      room.unlock();
    }
    log.debug("Connection {} joined room {}", connectionId, roomCode);
    return participant;
  }

  /** Removes the participant bound to the connection. Silently ignores rooms that are gone. */
  public void leave(String roomCode, String connectionId) {
    Optional<Room> candidate = roomStore.get(roomCode);
    if (candidate.isEmpty()) {
      return;
    }
    Room room = candidate.get();
    room.lock();
    try {
      if (room.isClosed()) {
        return;
      }
      Optional<Participant> removed = room.removeParticipant(connectionId);
      if (removed.isEmpty()) {
        return;
      }
      room.touch(clock.instant());
      broadcastSink.publish(
          roomCode, RoomEvent.userLeft(roomCode, connectionId, removed.get().displayName()));
    } finally {
      room.unlock();
    }
    log.debug("Connection {} left room {}", connectionId, roomCode);
  }

  public RoomMessage sendMessage(String roomCode, String displayName, Object rawText) {
    Room room = requireRoom(roomCode);
    MessageValidationResult validation = messageValidator.validate(rawText);
    if (!validation.valid()) {
      throw RoomOperationException.invalidMessage(validation);
    }
    String text = ((String) rawText).strip();

    room.lock();
    try {
      requireOpen(room);
      if (room.status() == RoomStatus.SUMMARIZING) {
        throw RoomOperationException.alreadySummarizing();
      }
      if (room.messageCount() >= maxMessages) {
        throw RoomOperationException.roomFull(maxMessages);
      }
      Instant now = clock.instant();
      RoomMessage message = new RoomMessage(displayName, text, now);
      room.appendMessage(message);
      room.touch(now);
      increment(messagesCounter);
      broadcastSink.publish(roomCode, RoomEvent.message(roomCode, message));
      return message;
    } finally {
      room.unlock();
    }
  }

  /**
   * Starts summarizing the room. Errors detectable up front are thrown; the returned future
   * completes with the summary once it was broadcast, or exceptionally with a
   * {@link SummarizationException} after which the room accepts messages and summary requests
   * again.
   */
  public CompletableFuture<RoomSummary> requestSummary(String roomCode) {
    Room room = requireRoom(roomCode);
    List<RoomMessage> transcript;
    room.lock();
    try {
      requireOpen(room);
      if (room.status() == RoomStatus.SUMMARIZING) {
        throw RoomOperationException.alreadySummarizing();
      }
      if (room.messageCount() == 0) {
        throw RoomOperationException.emptyRoom();
      }
      room.markSummarizing();
      room.touch(clock.instant());
      transcript = room.messages();
      broadcastSink.publish(roomCode, RoomEvent.summaryGenerating(roomCode));
    } finally {
      room.unlock();
    }

    log.info("Summarizing room {} ({} messages)", roomCode, transcript.size());
    CompletableFuture<RoomSummary> result = new CompletableFuture<>();
    try {
      summaryExecutor.execute(() -> summarize(room, transcript, result));
    } catch (RejectedExecutionException ex) {
      SummarizationException failure =
          new SummarizationException("Summarization capacity exhausted, try again later", ex);
      handleSummaryFailure(room, failure, result);
    }
    return result;
  }

  private void summarize(
      Room room, List<RoomMessage> transcript, CompletableFuture<RoomSummary> result) {
    long started = System.nanoTime();
    RoomSummary summary;
    try {
      summary = summarizationGateway.summarize(transcript);
    } catch (SummarizationException ex) {
      handleSummaryFailure(room, ex, result);
      return;
    } catch (RuntimeException ex) {
      handleSummaryFailure(
          room, new SummarizationException("Failed to generate summary", ex), result);
      return;
    } finally {
      if (summaryTimer != null) {
        summaryTimer.record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
      }
    }
    handleSummarySuccess(room, summary, result);
  }

  private void handleSummarySuccess(
      Room room, RoomSummary summary, CompletableFuture<RoomSummary> result) {
    String roomCode = room.code();
    room.lock();
    try {
      if (room.isClosed()) {
        log.info("Room {} closed while its summary was generated, discarding summary", roomCode);
        result.completeExceptionally(RoomOperationException.roomNotFound());
        return;
      }
      broadcastSink.publish(roomCode, RoomEvent.summaryGenerated(roomCode, summary));
      ScheduledFuture<?> close =
          taskScheduler.schedule(
              () -> closeAfterSummary(room), clock.instant().plus(closeGracePeriod));
      room.schedulePendingClose(close);
    } finally {
      room.unlock();
    }
    increment(summaryRunsCounter);
    log.info("Summary delivered for room {}, closing in {}", roomCode, closeGracePeriod);
    result.complete(summary);
  }

  private void handleSummaryFailure(
      Room room, SummarizationException failure, CompletableFuture<RoomSummary> result) {
    room.lock();
    try {
      if (room.status() == RoomStatus.SUMMARIZING) {
        room.markActive();
      }
    } finally {
      room.unlock();
    }
    increment(summaryFailuresCounter);
    log.warn("Summarization failed for room {}: {}", room.code(), failure.getMessage(), failure);
    result.completeExceptionally(failure);
  }

  void closeAfterSummary(Room room) {
    try {
      room.lock();
      try {
        if (!room.close()) {
          return;
        }
        roomStore.remove(room.code(), room);
        broadcastSink.publish(
            room.code(), RoomEvent.roomClosed(room.code(), RoomCloseReason.SUMMARIZED));
      } finally {
        room.unlock();
      }
      log.info("Room {} cleaned up and deleted", room.code());
    } catch (RuntimeException ex) {
      log.warn("Closing room {} after summary failed", room.code(), ex);
    }
  }

  private Room requireRoom(String roomCode) {
    return roomStore.get(roomCode).orElseThrow(RoomOperationException::roomNotFound);
  }

  private static void requireOpen(Room room) {
    if (room.isClosed()) {
      throw RoomOperationException.roomNotFound();
    }
  }

  private static void increment(Counter counter) {
    if (counter != null) {
      counter.increment();
    }
  }
}
