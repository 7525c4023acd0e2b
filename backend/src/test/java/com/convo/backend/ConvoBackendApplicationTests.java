package com.convo.backend;

import static org.assertj.core.api.Assertions.assertThat;

import com.convo.backend.room.reaper.RoomActivityReaper;
import com.convo.backend.room.service.RoomSessionCoordinator;
import com.convo.backend.room.summary.SummarizationGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "app.summary.api-key=test-key")
class ConvoBackendApplicationTests {

  @Autowired private RoomSessionCoordinator coordinator;
  @Autowired private RoomActivityReaper reaper;
  @Autowired private SummarizationGateway summarizationGateway;

  @Test
  void contextLoadsAndRoomsCanBeCreated() {
    String code = coordinator.createRoom();

    assertThat(code).matches("[A-Z0-9]{6}");
    assertThat(coordinator.roomExists(code)).isTrue();
    assertThat(reaper.reapInactiveRooms()).isZero();
    assertThat(summarizationGateway).isNotNull();
  }
}
