package com.convo.backend.room.summary;

import com.convo.backend.room.domain.RoomMessage;
import com.convo.backend.room.domain.RoomSummary;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.util.StringUtils;

/** Summarizes transcripts through a Spring AI {@link ChatClient}. */
@Slf4j
public class ChatClientSummarizationGateway implements SummarizationGateway {

  private static final String SYSTEM_INSTRUCTION_TEMPLATE =
      """
      You are analyzing a conversation between two users in a chat room.
      Reply with strict JSON and no text before or after it. Use this schema:
      %s
      If there are no action items, return an empty array for "actionItems".
      """;

  private static final String USER_PROMPT_TEMPLATE =
      """
      Provide a structured summary of the following conversation.

      Conversation:
      %s

      Respond with ONLY valid JSON, no additional text or markdown formatting.
      """;

  private final ChatClient chatClient;
  private final ChatOptions chatOptions;
  private final BeanOutputConverter<SummaryPayload> outputConverter;
  private final TranscriptFormatter transcriptFormatter;
  private final SummaryResponseParser responseParser;

  public ChatClientSummarizationGateway(
      ChatClient chatClient,
      ChatOptions chatOptions,
      BeanOutputConverter<SummaryPayload> outputConverter,
      TranscriptFormatter transcriptFormatter,
      SummaryResponseParser responseParser) {
    this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
    this.chatOptions = chatOptions;
    this.outputConverter =
        Objects.requireNonNull(outputConverter, "outputConverter must not be null");
    this.transcriptFormatter =
        Objects.requireNonNull(transcriptFormatter, "transcriptFormatter must not be null");
    this.responseParser = Objects.requireNonNull(responseParser, "responseParser must not be null");
  }

  @Override
  public RoomSummary summarize(List<RoomMessage> messages) {
    if (messages == null || messages.isEmpty()) {
      throw new IllegalArgumentException("messages must not be empty");
    }
    String systemInstruction =
        SYSTEM_INSTRUCTION_TEMPLATE.formatted(outputConverter.getFormat().trim());
    String userPrompt = USER_PROMPT_TEMPLATE.formatted(transcriptFormatter.format(messages));

    ChatResponse response;
    try {
      var prompt = chatClient.prompt().system(systemInstruction).user(userPrompt);
      if (chatOptions != null) {
        prompt = prompt.options(chatOptions);
      }
      response = prompt.call().chatResponse();
    } catch (RuntimeException ex) {
      throw new SummarizationException("Summarization provider call failed", ex);
    }

    String content = extractContent(response);
    RoomSummary summary = responseParser.parse(content, messages.size());
    if (!summary.summaryAvailable()) {
      log.info("Summarization reply for {} messages had no overview", messages.size());
    }
    return summary;
  }

  String extractContent(ChatResponse response) {
    if (response == null || response.getResults() == null) {
      return null;
    }
    StringBuilder builder = new StringBuilder();
    for (Generation generation : response.getResults()) {
      if (generation == null || generation.getOutput() == null) {
        continue;
      }
      String text = generation.getOutput().getText();
      if (StringUtils.hasText(text)) {
        builder.append(text);
      }
    }
    return builder.toString();
  }
}
