package org.waabox.chorus.feed;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class for serializing and deserializing
 * {@link ChangePayload} instances to and from JSON strings.
 *
 * <p>Uses Jackson's tree model ({@link JsonNode}) for lightweight
 * JSON processing without requiring full object binding or additional
 * modules. {@link Instant} values are stored as ISO-8601 strings.
 *
 * <p>The {@code version} and {@code attributes} fields are optional when
 * reading: change records produced by other systems often carry neither.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangePayloadCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private ChangePayloadCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a {@link ChangePayload} into a JSON string.
   *
   * <p>The resulting JSON contains the fields {@code resource},
   * {@code action}, {@code version}, {@code occurredAt} and
   * {@code attributes}.
   *
   * @param payload the payload to serialize, never null.
   * @return the JSON representation of the payload, never null.
   */
  public static String serialize(final ChangePayload payload) {
    Objects.requireNonNull(payload, "payload cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("resource", payload.resource());
    node.put("action", payload.action());
    node.put("version", payload.version());
    node.put("occurredAt", payload.occurredAt().toString());

    final ObjectNode attributes = node.putObject("attributes");
    payload.attributes().forEach(attributes::put);

    return node.toString();
  }

  /**
   * Deserializes a JSON string into a {@link ChangePayload}.
   *
   * <p>The JSON must contain the fields {@code resource}, {@code action}
   * and {@code occurredAt}.
   *
   * @param json the JSON string to parse, never null.
   * @return the parsed {@link ChangePayload}, never null.
   * @throws IllegalArgumentException if the JSON is malformed or missing
   *     required fields.
   */
  public static ChangePayload deserialize(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    try {
      final JsonNode node = MAPPER.readTree(json);

      final String resource = requireField(node, "resource").asText();
      final String action = requireField(node, "action").asText();
      final Instant occurredAt = Instant.parse(
          requireField(node, "occurredAt").asText());
      final JsonNode versionNode = node.get("version");
      final long version = versionNode == null || versionNode.isNull()
          ? 0L : versionNode.asLong();

      final Map<String, String> attributes = new LinkedHashMap<>();
      final JsonNode attributesNode = node.get("attributes");
      if (attributesNode != null && attributesNode.isObject()) {
        final Iterator<Map.Entry<String, JsonNode>> fields =
            attributesNode.fields();
        while (fields.hasNext()) {
          final Map.Entry<String, JsonNode> field = fields.next();
          attributes.put(field.getKey(), field.getValue().asText());
        }
      }

      return new ChangePayload(resource, action, version, occurredAt,
          attributes);
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize ChangePayload from JSON: " + json, e);
    }
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node);
    }
    return value;
  }
}
