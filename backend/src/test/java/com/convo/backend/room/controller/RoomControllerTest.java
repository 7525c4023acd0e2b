package com.convo.backend.room.controller;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.convo.backend.room.broadcast.SseRoomBroadcastSink;
import com.convo.backend.room.domain.RoomMessage;
import com.convo.backend.room.domain.RoomSummary;
import com.convo.backend.room.service.RoomOperationException;
import com.convo.backend.room.service.RoomSessionCoordinator;
import com.convo.backend.room.summary.SummarizationException;
import com.convo.backend.room.validation.MessageRejectionReason;
import com.convo.backend.room.validation.MessageValidationResult;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@WebMvcTest({RoomController.class, RoomEventStreamController.class})
@AutoConfigureMockMvc(addFilters = false)
class RoomControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private RoomSessionCoordinator coordinator;

  @MockBean private SseRoomBroadcastSink broadcastSink;

  @Test
  void createRoomReturnsCodeOnBothPaths() throws Exception {
    when(coordinator.createRoom()).thenReturn("K3Q9ZT", "ABC123");

    mockMvc
        .perform(post("/api/create-room"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.roomCode").value("K3Q9ZT"));
    mockMvc
        .perform(post("/api/rooms"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.roomCode").value("ABC123"));
  }

  @Test
  void roomExistsReportsStoreState() throws Exception {
    when(coordinator.roomExists("K3Q9ZT")).thenReturn(true);

    mockMvc
        .perform(get("/api/room-exists/K3Q9ZT"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.exists").value(true));
    mockMvc
        .perform(get("/api/rooms/NOPE00/exists"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.exists").value(false));
  }

  @Test
  void sendMessageReturnsStoredMessage() throws Exception {
    when(coordinator.sendMessage("K3Q9ZT", "Alice", "  hi  "))
        .thenReturn(new RoomMessage("Alice", "hi", Instant.parse("2024-05-01T10:00:00Z")));

    mockMvc
        .perform(
            post("/api/rooms/K3Q9ZT/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"Alice\",\"message\":\"  hi  \"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.username").value("Alice"))
        .andExpect(jsonPath("$.message").value("hi"));
  }

  @Test
  void invalidMessageMapsToBadRequest() throws Exception {
    when(coordinator.sendMessage(eq("K3Q9ZT"), eq("Alice"), any()))
        .thenThrow(
            RoomOperationException.invalidMessage(
                MessageValidationResult.rejected(
                    MessageRejectionReason.TOO_LONG,
                    "Message exceeds maximum length of 5000 characters")));

    mockMvc
        .perform(
            post("/api/rooms/K3Q9ZT/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"Alice\",\"message\":\"x\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_MESSAGE"))
        .andExpect(jsonPath("$.reason").value("TOO_LONG"))
        .andExpect(jsonPath("$.detail").value("Message exceeds maximum length of 5000 characters"));
  }

  @Test
  void fullRoomMapsToConflict() throws Exception {
    when(coordinator.sendMessage(eq("K3Q9ZT"), eq("Alice"), any()))
        .thenThrow(RoomOperationException.roomFull(1000));

    mockMvc
        .perform(
            post("/api/rooms/K3Q9ZT/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"Alice\",\"message\":\"hi\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ROOM_FULL"));
  }

  @Test
  void missingUsernameIsRejectedBeforeReachingRoom() throws Exception {
    mockMvc
        .perform(
            post("/api/rooms/K3Q9ZT/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\":\"hi\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

    verify(coordinator, never()).sendMessage(anyString(), anyString(), any());
  }

  @Test
  void summaryIsReturnedAsynchronously() throws Exception {
    RoomSummary summary =
        new RoomSummary("They said hi.", true, List.of("greeting"), List.of(), 2);
    when(coordinator.requestSummary("K3Q9ZT"))
        .thenReturn(CompletableFuture.completedFuture(summary));

    MvcResult result =
        mockMvc
            .perform(post("/api/rooms/K3Q9ZT/summary"))
            .andExpect(request().asyncStarted())
            .andReturn();

    mockMvc
        .perform(asyncDispatch(result))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.summary").value("They said hi."))
        .andExpect(jsonPath("$.summaryAvailable").value(true))
        .andExpect(jsonPath("$.keyPoints[0]").value("greeting"))
        .andExpect(jsonPath("$.messageCount").value(2));
  }

  @Test
  void gatewayFailureMapsToBadGateway() throws Exception {
    when(coordinator.requestSummary("K3Q9ZT"))
        .thenReturn(
            CompletableFuture.failedFuture(
                new SummarizationException("Model reply does not contain a JSON object")));

    MvcResult result =
        mockMvc
            .perform(post("/api/rooms/K3Q9ZT/summary"))
            .andExpect(request().asyncStarted())
            .andReturn();

    mockMvc
        .perform(asyncDispatch(result))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("GATEWAY_ERROR"))
        .andExpect(jsonPath("$.detail").value(containsString("JSON object")));
  }

  @Test
  void emptyRoomSummaryMapsToConflict() throws Exception {
    when(coordinator.requestSummary("K3Q9ZT")).thenThrow(RoomOperationException.emptyRoom());

    mockMvc
        .perform(post("/api/rooms/K3Q9ZT/summary"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("EMPTY_ROOM"))
        .andExpect(jsonPath("$.detail").value("No messages to summarize"));
  }

  @Test
  void summaryForUnknownRoomMapsToNotFound() throws Exception {
    when(coordinator.requestSummary("NOPE00")).thenThrow(RoomOperationException.roomNotFound());

    mockMvc
        .perform(post("/api/rooms/NOPE00/summary"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ROOM_NOT_FOUND"));
  }

  @Test
  void openingEventStreamJoinsRoom() throws Exception {
    when(coordinator.roomExists("K3Q9ZT")).thenReturn(true);

    mockMvc
        .perform(get("/api/rooms/K3Q9ZT/events").param("username", "Alice"))
        .andExpect(request().asyncStarted());

    verify(broadcastSink).register(eq("K3Q9ZT"), anyString(), any());
    verify(coordinator).join(eq("K3Q9ZT"), anyString(), eq("Alice"));
  }

  @Test
  void eventStreamForUnknownRoomIsNotFound() throws Exception {
    when(coordinator.roomExists("NOPE00")).thenReturn(false);

    mockMvc
        .perform(get("/api/rooms/NOPE00/events").param("username", "Alice"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ROOM_NOT_FOUND"));

    verify(coordinator, never()).join(anyString(), anyString(), anyString());
  }

  @Test
  void failedJoinUnregistersStream() throws Exception {
    when(coordinator.roomExists("K3Q9ZT")).thenReturn(true);
    when(coordinator.join(eq("K3Q9ZT"), anyString(), eq("Alice")))
        .thenThrow(RoomOperationException.roomNotFound());

    mockMvc
        .perform(get("/api/rooms/K3Q9ZT/events").param("username", "Alice"))
        .andExpect(status().isNotFound());

    verify(broadcastSink).unregister(eq("K3Q9ZT"), anyString());
  }
}
