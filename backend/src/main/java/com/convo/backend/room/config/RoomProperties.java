package com.convo.backend.room.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.room")
@Validated
public class RoomProperties {

  /**
   * Maximum number of messages a room accepts. Further sends are rejected until the room is
   * summarized or expires.
   */
  @Min(1)
  private int maxMessages = 1000;

  /**
   * Maximum number of characters in a single message, measured on the raw (untrimmed) text.
   */
  @Min(1)
  private int maxMessageLength = 5000;

  /**
   * Rooms without any join, leave, message or summary activity for longer than this are removed
   * by the reaper.
   */
  @NotNull private Duration inactivityTimeout = Duration.ofMinutes(30);

  /**
   * How often the reaper scans for inactive rooms. A zero or negative value disables the reaper.
   */
  @NotNull private Duration reaperInterval = Duration.ofMinutes(5);

  /**
   * Delay between delivering a summary and destroying the room, so that in-flight events reach
   * every participant.
   */
  @NotNull private Duration closeGracePeriod = Duration.ofSeconds(2);

  /**
   * Interval of SSE keep-alive comments. Dead connections are detected on the next send.
   */
  @NotNull private Duration heartbeatInterval = Duration.ofSeconds(15);

  @Min(4)
  @Max(32)
  private int codeLength = 6;

  /** Zone used to render timestamps in the transcript sent to the summarizer. */
  @NotNull private ZoneId transcriptZone = ZoneId.of("UTC");

  public int getMaxMessages() {
    return maxMessages;
  }

  public void setMaxMessages(int maxMessages) {
    this.maxMessages = maxMessages;
  }

  public int getMaxMessageLength() {
    return maxMessageLength;
  }

  public void setMaxMessageLength(int maxMessageLength) {
    this.maxMessageLength = maxMessageLength;
  }

  public Duration getInactivityTimeout() {
    return inactivityTimeout;
  }

  public void setInactivityTimeout(Duration inactivityTimeout) {
    this.inactivityTimeout = inactivityTimeout;
  }

  public Duration getReaperInterval() {
    return reaperInterval;
  }

  public void setReaperInterval(Duration reaperInterval) {
    this.reaperInterval = reaperInterval;
  }

  public Duration getCloseGracePeriod() {
    return closeGracePeriod;
  }

  public void setCloseGracePeriod(Duration closeGracePeriod) {
    this.closeGracePeriod = closeGracePeriod;
  }

  public Duration getHeartbeatInterval() {
    return heartbeatInterval;
  }

  public void setHeartbeatInterval(Duration heartbeatInterval) {
    this.heartbeatInterval = heartbeatInterval;
  }

  public int getCodeLength() {
    return codeLength;
  }

  public void setCodeLength(int codeLength) {
    this.codeLength = codeLength;
  }

  public ZoneId getTranscriptZone() {
    return transcriptZone;
  }

  public void setTranscriptZone(ZoneId transcriptZone) {
    this.transcriptZone = transcriptZone;
  }
}
