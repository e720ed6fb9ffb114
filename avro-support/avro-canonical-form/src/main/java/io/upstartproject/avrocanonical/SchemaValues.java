package io.upstartproject.avrocanonical;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.avro.Schema;

import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Adapters from decoded JSON representations to {@link SchemaValue} trees.
 */
public final class SchemaValues {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private SchemaValues() {
  }

  /**
   * Decodes a schema document.
   * @throws UncheckedIOException if the text is not well-formed JSON
   * @throws InvalidSchemaTypeException if the text holds no JSON value at all
   */
  public static SchemaValue parse(String schemaJson) {
    JsonNode node;
    try {
      node = OBJECT_MAPPER.readTree(schemaJson);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
    return fromJsonNode(node);
  }

  public static SchemaValue fromAvroSchema(Schema schema) {
    return parse(schema.toString());
  }

  public static SchemaValue fromJsonNode(JsonNode node) {
    switch (node.getNodeType()) {
      case OBJECT:
        ImmutableMap.Builder<String, SchemaValue> members = ImmutableMap.builderWithExpectedSize(node.size());
        for (Iterator<Map.Entry<String, JsonNode>> fields = node.fields(); fields.hasNext(); ) {
          Map.Entry<String, JsonNode> field = fields.next();
          members.put(field.getKey(), fromJsonNode(field.getValue()));
        }
        return SchemaValue.object(members.build());
      case ARRAY:
        ImmutableList.Builder<SchemaValue> elements = ImmutableList.builderWithExpectedSize(node.size());
        for (JsonNode element : node) {
          elements.add(fromJsonNode(element));
        }
        return SchemaValue.array(elements.build());
      case STRING:
        return SchemaValue.string(node.textValue());
      case NUMBER:
        return SchemaValue.number(node.doubleValue());
      case BOOLEAN:
        return SchemaValue.bool(node.booleanValue());
      case NULL:
        return SchemaValue.nullValue();
      default: // BINARY, MISSING, POJO
        throw new InvalidSchemaTypeException(node);
    }
  }
}
