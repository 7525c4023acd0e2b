package com.convo.backend.room.config;

import com.convo.backend.room.broadcast.SseRoomBroadcastSink;
import com.convo.backend.room.store.InMemoryRoomStore;
import com.convo.backend.room.store.RandomRoomCodeGenerator;
import com.convo.backend.room.store.RoomCodeGenerator;
import com.convo.backend.room.store.RoomStore;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableScheduling
@EnableConfigurationProperties({RoomProperties.class, CorsProperties.class})
public class RoomConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RoomCodeGenerator roomCodeGenerator(RoomProperties properties) {
    return new RandomRoomCodeGenerator(properties.getCodeLength());
  }

  @Bean
  public RoomStore roomStore(RoomCodeGenerator roomCodeGenerator, Clock clock) {
    return new InMemoryRoomStore(roomCodeGenerator, clock);
  }

  @Bean
  public SseRoomBroadcastSink roomBroadcastSink(
      RoomProperties properties, TaskScheduler taskScheduler) {
    SseRoomBroadcastSink sink = new SseRoomBroadcastSink();
    Duration heartbeat = properties.getHeartbeatInterval();
    if (!heartbeat.isZero() && !heartbeat.isNegative()) {
      taskScheduler.scheduleWithFixedDelay(sink::heartbeat, heartbeat);
    }
    return sink;
  }

  @Bean
  public WebMvcConfigurer roomCorsConfigurer(CorsProperties corsProperties) {
    String[] origins = corsProperties.getAllowedOrigins().toArray(String[]::new);
    return new WebMvcConfigurer() {
      @Override
      public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**").allowedOriginPatterns(origins).allowedMethods("GET", "POST");
      }
    };
  }
}
