package io.agentmesh.bus.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable unit of communication on the bus.
 *
 * <p>{@code params} is opaque to the bus: its schema belongs to the handler. The map is copied at
 * construction and exposed read-only. A {@code null} recipient means the message is addressed to
 * every agent whose role matches {@link #method()}.</p>
 *
 * <p>Responses are new messages. {@link #reply(String, String, Map)} builds one whose id is
 * {@code prefix + "_" + id} and whose recipient is this message's sender.</p>
 */
public record Message(String id,
                      String method,
                      Map<String, Object> params,
                      MessageKind kind,
                      String sender,
                      String recipient,
                      Instant timestamp) {

  public Message {
    id = requireText(id, "id");
    method = requireText(method, "method");
    params = params == null || params.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    kind = kind == null ? MessageKind.REQUEST : kind;
    sender = blankToNull(sender);
    recipient = blankToNull(recipient);
    timestamp = timestamp == null ? Instant.now() : timestamp;
  }

  public static Message request(String id, String method, Map<String, Object> params) {
    return new Message(id, method, params, MessageKind.REQUEST, null, null, null);
  }

  public static Builder builder(String id, String method) {
    return new Builder(id, method);
  }

  public boolean isBroadcast() {
    return recipient == null;
  }

  /**
   * Returns a string parameter, or {@code null} when absent.
   */
  public String param(String key) {
    Object value = params.get(key);
    return value == null ? null : value.toString();
  }

  public Message reply(String idPrefix, String replyMethod, Map<String, Object> replyParams) {
    return reply(idPrefix, replyMethod, replyParams, MessageKind.RESPONSE);
  }

  public Message reply(String idPrefix, String replyMethod, Map<String, Object> replyParams, MessageKind replyKind) {
    String prefix = requireText(idPrefix, "idPrefix");
    return new Message(prefix + "_" + id, replyMethod, replyParams, replyKind, recipient, sender, null);
  }

  public Message withRecipient(String newRecipient) {
    return new Message(id, method, params, kind, sender, newRecipient, timestamp);
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be null or blank");
    }
    return value;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }

  public static final class Builder {

    private final String id;
    private final String method;
    private final Map<String, Object> params = new LinkedHashMap<>();
    private MessageKind kind = MessageKind.REQUEST;
    private String sender;
    private String recipient;
    private Instant timestamp;

    private Builder(String id, String method) {
      this.id = id;
      this.method = method;
    }

    public Builder param(String key, Object value) {
      params.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder params(Map<String, Object> values) {
      if (values != null) {
        params.putAll(values);
      }
      return this;
    }

    public Builder kind(MessageKind value) {
      this.kind = value;
      return this;
    }

    public Builder sender(String value) {
      this.sender = value;
      return this;
    }

    public Builder recipient(String value) {
      this.recipient = value;
      return this;
    }

    public Builder timestamp(Instant value) {
      this.timestamp = value;
      return this;
    }

    public Message build() {
      return new Message(id, method, params, kind, sender, recipient, timestamp);
    }
  }
}
