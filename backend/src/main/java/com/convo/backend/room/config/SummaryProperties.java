package com.convo.backend.room.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the OpenAI-compatible completions endpoint used to summarize rooms.
 * The defaults target the Gemini OpenAI-compatible API.
 */
@ConfigurationProperties(prefix = "app.summary")
@Validated
public class SummaryProperties {

  /** Credential for the summarization provider. The application refuses to start without it. */
  @NotBlank private String apiKey;

  @NotBlank private String baseUrl = "https://generativelanguage.googleapis.com/v1beta/openai";

  @NotBlank private String completionsPath = "/chat/completions";

  @NotBlank private String model = "gemini-2.0-flash";

  private Double temperature = 0.2d;

  private Integer maxTokens = 1024;

  /**
   * Requests {@code response_format=json_object} from the provider. Turn off for endpoints that
   * reject the parameter; the schema instruction in the prompt still applies.
   */
  private boolean jsonMode = true;

  @NotNull private Duration timeout = Duration.ofSeconds(60);

  @Valid private Executor executor = new Executor();

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getCompletionsPath() {
    return completionsPath;
  }

  public void setCompletionsPath(String completionsPath) {
    this.completionsPath = completionsPath;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public Double getTemperature() {
    return temperature;
  }

  public void setTemperature(Double temperature) {
    this.temperature = temperature;
  }

  public Integer getMaxTokens() {
    return maxTokens;
  }

  public void setMaxTokens(Integer maxTokens) {
    this.maxTokens = maxTokens;
  }

  public boolean isJsonMode() {
    return jsonMode;
  }

  public void setJsonMode(boolean jsonMode) {
    this.jsonMode = jsonMode;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public Executor getExecutor() {
    return executor;
  }

  public void setExecutor(Executor executor) {
    this.executor = executor;
  }

  public static class Executor {

    /** Number of summaries generated concurrently. */
    @Min(1)
    private int poolSize = 4;

    /** Summary requests waiting for a worker before new ones are refused. */
    @Min(0)
    private int queueCapacity = 100;

    public int getPoolSize() {
      return poolSize;
    }

    public void setPoolSize(int poolSize) {
      this.poolSize = poolSize;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }
  }
}
