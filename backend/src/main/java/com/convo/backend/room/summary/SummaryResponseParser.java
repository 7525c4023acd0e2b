package com.convo.backend.room.summary;

import com.convo.backend.room.domain.RoomSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Reads the model reply into a {@link RoomSummary}. Markdown fences and prose around the JSON
 * object are ignored. Missing or mistyped fields fall back to empty values; only a reply without
 * a readable JSON object is an error.
 */
public class SummaryResponseParser {

  private static final Pattern LEADING_FENCE = Pattern.compile("^```[a-zA-Z0-9_-]*\\s*");
  private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");

  private final ObjectMapper objectMapper;

  public SummaryResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public RoomSummary parse(String content, int messageCount) {
    if (!StringUtils.hasText(content)) {
      throw new SummarizationException("Model returned empty response");
    }
    JsonNode root = readReply(content);

    String overview = textOrNull(root.get("summary"));
    return new RoomSummary(
        overview != null ? overview : "",
        overview != null,
        textList(root.get("keyPoints")),
        textList(root.get("actionItems")),
        messageCount);
  }

  /**
   * Reads the first JSON object found in the reply. Candidates are tried in order: the whole
   * reply, the reply without an enclosing Markdown fence, then the text from each {@code '{'}
   * onward. Tokens after a complete object are ignored.
   */
  JsonNode readReply(String content) {
    String text = content.strip();
    String unfenced =
        TRAILING_FENCE.matcher(LEADING_FENCE.matcher(text).replaceFirst("")).replaceFirst("");
    if (unfenced.indexOf('{') < 0) {
      throw new SummarizationException("Model reply does not contain a JSON object");
    }

    List<String> candidates = new ArrayList<>();
    candidates.add(text);
    candidates.add(unfenced);
    for (int start = unfenced.indexOf('{'); start >= 0; start = unfenced.indexOf('{', start + 1)) {
      candidates.add(unfenced.substring(start));
    }

    JsonProcessingException lastFailure = null;
    for (String candidate : candidates) {
      try {
        JsonNode root = objectMapper.readTree(candidate);
        if (root != null && root.isObject()) {
          return root;
        }
      } catch (JsonProcessingException ex) {
        lastFailure = ex;
      }
    }
    throw new SummarizationException("Model reply is not valid JSON", lastFailure);
  }

  private static String textOrNull(JsonNode node) {
    if (node == null || !node.isTextual() || !StringUtils.hasText(node.asText())) {
      return null;
    }
    return node.asText().strip();
  }

  private static List<String> textList(JsonNode node) {
    if (node == null || !node.isArray()) {
      return List.of();
    }
    List<String> values = new ArrayList<>(node.size());
    for (JsonNode element : node) {
      String value = textOrNull(element);
      if (value != null) {
        values.add(value);
      }
    }
    return values;
  }
}
