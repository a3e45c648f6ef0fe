package io.agentmesh.bus.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * Serialises {@link Message} instances field-for-field while keeping {@code params} opaque.
 */
public final class MessageCodec {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

  private final ObjectMapper mapper;

  public MessageCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper").findAndRegisterModules();
  }

  public String encode(Message message) {
    try {
      return mapper.writeValueAsString(encodeToJson(message));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Unable to serialise message " + message.id(), ex);
    }
  }

  public Message decode(String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("json must not be null or blank");
    }
    try {
      return decode(mapper.readTree(json));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Message payload is not valid JSON", ex);
    }
  }

  public Map<String, Object> encodeToMap(Message message) {
    return mapper.convertValue(encodeToJson(message), MAP_TYPE);
  }

  public Message decode(Map<String, Object> document) {
    Objects.requireNonNull(document, "document");
    JsonNode tree = mapper.valueToTree(document);
    return decode(tree);
  }

  public ObjectNode encodeToJson(Message message) {
    Objects.requireNonNull(message, "message");
    ObjectNode node = mapper.createObjectNode();
    node.put("id", message.id());
    node.put("method", message.method());
    node.set("params", mapper.valueToTree(message.params()));
    node.put("kind", message.kind().wireName());
    node.put("timestamp", message.timestamp().toString());
    putIfNotNull(node, "sender", message.sender());
    putIfNotNull(node, "recipient", message.recipient());
    return node;
  }

  public Message decode(JsonNode node) {
    Objects.requireNonNull(node, "node");
    if (!node.isObject()) {
      throw new IllegalArgumentException("message must be a JSON object");
    }
    JsonNode paramsNode = node.get("params");
    Map<String, Object> params = null;
    if (paramsNode != null && !paramsNode.isNull()) {
      if (!paramsNode.isObject()) {
        throw new IllegalArgumentException("params must be a JSON object");
      }
      params = mapper.convertValue(paramsNode, MAP_TYPE);
    }
    String kind = textOrNull(node.get("kind"));
    String timestamp = textOrNull(node.get("timestamp"));
    return new Message(
        textOrNull(node.get("id")),
        textOrNull(node.get("method")),
        params,
        kind == null ? MessageKind.REQUEST : MessageKind.fromWireName(kind),
        textOrNull(node.get("sender")),
        textOrNull(node.get("recipient")),
        timestamp == null ? null : parseTimestamp(timestamp));
  }

  private static void putIfNotNull(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }

  private static Instant parseTimestamp(String value) {
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("timestamp must be an ISO-8601 instant", ex);
    }
  }

  private static String textOrNull(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    String text = node.asText();
    return text != null && text.isBlank() ? null : text;
  }
}
