package com.convo.backend.room.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class RoomStartupReporter {

  private final RoomProperties roomProperties;
  private final SummaryProperties summaryProperties;
  private final Environment environment;

  public RoomStartupReporter(
      RoomProperties roomProperties, SummaryProperties summaryProperties, Environment environment) {
    this.roomProperties = roomProperties;
    this.summaryProperties = summaryProperties;
    this.environment = environment;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void reportLimits() {
    log.info(
        "Room server running on port {}",
        environment.getProperty("local.server.port", environment.getProperty("server.port")));
    log.info("Room inactivity timeout: {}", roomProperties.getInactivityTimeout());
    log.info("Max messages per room: {}", roomProperties.getMaxMessages());
    log.info("Max characters per message: {}", roomProperties.getMaxMessageLength());
    log.info("Summaries generated with model {}", summaryProperties.getModel());
  }
}
