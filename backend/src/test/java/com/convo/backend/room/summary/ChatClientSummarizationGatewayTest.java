package com.convo.backend.room.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.convo.backend.room.domain.RoomMessage;
import com.convo.backend.room.domain.RoomSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.converter.BeanOutputConverter;

class ChatClientSummarizationGatewayTest {

  private static final List<RoomMessage> TRANSCRIPT =
      List.of(
          new RoomMessage("Alice", "Shall we meet on Friday?", Instant.parse("2024-05-01T10:00:00Z")),
          new RoomMessage("Bob", "Friday works, I'll book a table.", Instant.parse("2024-05-01T10:01:00Z")));

  private StubChatModel chatModel;
  private ChatClientSummarizationGateway gateway;

  @BeforeEach
  void setUp() {
    chatModel = new StubChatModel();
    gateway =
        new ChatClientSummarizationGateway(
            ChatClient.builder(chatModel).build(),
            null,
            new BeanOutputConverter<>(SummaryPayload.class),
            new TranscriptFormatter(ZoneOffset.UTC),
            new SummaryResponseParser(new ObjectMapper()));
  }

  @Test
  void sendsTranscriptAndSchemaAndParsesReply() {
    chatModel.reply =
        "{\"summary\": \"They plan dinner on Friday.\", \"keyPoints\": [\"Friday\"], \"actionItems\": [\"Bob books a table\"]}";

    RoomSummary summary = gateway.summarize(TRANSCRIPT);

    assertThat(summary.summary()).isEqualTo("They plan dinner on Friday.");
    assertThat(summary.actionItems()).containsExactly("Bob books a table");
    assertThat(summary.messageCount()).isEqualTo(2);

    Prompt prompt = chatModel.prompts.get(0);
    String system =
        prompt.getInstructions().stream()
            .filter(message -> message.getMessageType() == MessageType.SYSTEM)
            .map(message -> message.getText())
            .findFirst()
            .orElseThrow();
    String user =
        prompt.getInstructions().stream()
            .filter(message -> message.getMessageType() == MessageType.USER)
            .map(message -> message.getText())
            .findFirst()
            .orElseThrow();
    assertThat(system).contains("keyPoints").contains("actionItems");
    assertThat(user)
        .contains("[2024-05-01 10:00:00] Alice: Shall we meet on Friday?")
        .contains("[2024-05-01 10:01:00] Bob: Friday works, I'll book a table.");
  }

  @Test
  void fencedReplyIsAccepted() {
    chatModel.reply = "```json\n{\"summary\": \"Dinner.\", \"keyPoints\": []}\n```";

    assertThat(gateway.summarize(TRANSCRIPT).summary()).isEqualTo("Dinner.");
  }

  @Test
  void unstructuredReplyIsGatewayError() {
    chatModel.reply = "They talked about dinner.";

    assertThatThrownBy(() -> gateway.summarize(TRANSCRIPT))
        .isInstanceOf(SummarizationException.class);
  }

  @Test
  void providerFailureIsWrapped() {
    chatModel.failure = new IllegalStateException("503 from provider");

    assertThatThrownBy(() -> gateway.summarize(TRANSCRIPT))
        .isInstanceOf(SummarizationException.class)
        .hasMessage("Summarization provider call failed")
        .hasRootCauseMessage("503 from provider");
  }

  @Test
  void emptyTranscriptIsRefused() {
    assertThatThrownBy(() -> gateway.summarize(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(chatModel.prompts).isEmpty();
  }

  @Test
  void extractContentJoinsGenerations() {
    ChatResponse response =
        new ChatResponse(
            List.of(
                new Generation(new AssistantMessage("{\"summary\":")),
                new Generation(new AssistantMessage(" \"x\"}"))));

    assertThat(gateway.extractContent(response)).isEqualTo("{\"summary\": \"x\"}");
    assertThat(gateway.extractContent(null)).isNull();
  }

  static class StubChatModel implements ChatModel {

    private final List<Prompt> prompts = new ArrayList<>();
    private String reply = "{}";
    private RuntimeException failure;

    @Override
    public ChatResponse call(Prompt prompt) {
      prompts.add(prompt);
      if (failure != null) {
        throw failure;
      }
      return new ChatResponse(List.of(new Generation(new AssistantMessage(reply))));
    }
  }
}
