package com.convo.backend.room.config;

import com.convo.backend.room.summary.ChatClientSummarizationGateway;
import com.convo.backend.room.summary.SummarizationGateway;
import com.convo.backend.room.summary.SummaryPayload;
import com.convo.backend.room.summary.SummaryResponseParser;
import com.convo.backend.room.summary.TranscriptFormatter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(SummaryProperties.class)
public class SummaryConfiguration {

  @Bean
  public OpenAiApi summaryOpenAiApi(SummaryProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.getTimeout());
    requestFactory.setReadTimeout(properties.getTimeout());
    return OpenAiApi.builder()
        .baseUrl(properties.getBaseUrl())
        .apiKey(properties.getApiKey())
        .completionsPath(properties.getCompletionsPath())
        .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
        .build();
  }

  @Bean
  public OpenAiChatOptions summaryChatOptions(SummaryProperties properties) {
    OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder().model(properties.getModel());
    if (properties.getTemperature() != null) {
      builder.temperature(properties.getTemperature());
    }
    if (properties.getMaxTokens() != null) {
      builder.maxTokens(properties.getMaxTokens());
    }
    if (properties.isJsonMode()) {
      builder.responseFormat(
          ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build());
    }
    return builder.build();
  }

  @Bean
  public ChatModel summaryChatModel(OpenAiApi summaryOpenAiApi, OpenAiChatOptions summaryChatOptions) {
    // Retrying is the caller's decision; the model makes exactly one attempt.
    return OpenAiChatModel.builder()
        .openAiApi(summaryOpenAiApi)
        .defaultOptions(summaryChatOptions)
        .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
        .build();
  }

  @Bean
  public BeanOutputConverter<SummaryPayload> summaryOutputConverter() {
    return new BeanOutputConverter<>(SummaryPayload.class);
  }

  @Bean
  public SummarizationGateway summarizationGateway(
      ChatModel summaryChatModel,
      OpenAiChatOptions summaryChatOptions,
      BeanOutputConverter<SummaryPayload> summaryOutputConverter,
      RoomProperties roomProperties,
      ObjectMapper objectMapper) {
    return new ChatClientSummarizationGateway(
        ChatClient.builder(summaryChatModel).build(),
        summaryChatOptions,
        summaryOutputConverter,
        new TranscriptFormatter(roomProperties.getTranscriptZone()),
        new SummaryResponseParser(objectMapper));
  }

  @Bean
  public ThreadPoolTaskExecutor summaryExecutor(SummaryProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getExecutor().getPoolSize());
    executor.setMaxPoolSize(properties.getExecutor().getPoolSize());
    executor.setQueueCapacity(properties.getExecutor().getQueueCapacity());
    executor.setThreadNamePrefix("room-summary-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }
}
