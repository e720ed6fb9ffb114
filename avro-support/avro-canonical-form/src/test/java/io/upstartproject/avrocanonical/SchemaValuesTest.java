package io.upstartproject.avrocanonical;

import com.fasterxml.jackson.databind.node.BinaryNode;
import com.google.common.collect.ImmutableMap;
import org.apache.avro.Schema;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SchemaValuesTest {
  @Test
  void decodesEveryJsonKind() {
    SchemaValue value = SchemaValues.parse("{\"a\": [\"x\", 16, 2.5, true, null], \"b\": {}}");

    assertThat(value).isEqualTo(SchemaValue.object(ImmutableMap.of(
            "a", SchemaValue.array(
                    SchemaValue.string("x"),
                    SchemaValue.number(16),
                    SchemaValue.number(2.5),
                    SchemaValue.bool(true),
                    SchemaValue.nullValue()),
            "b", SchemaValue.object(ImmutableMap.of())
    )));
  }

  @Test
  void memberLookupFindsStringValues() {
    SchemaValue.ObjectValue object = (SchemaValue.ObjectValue) SchemaValues.parse("{\"type\": \"fixed\", \"size\": 4}");

    assertThat(object.member("type").flatMap(SchemaValue::asString).orElseThrow()).isEqualTo("fixed");
    assertThat(object.member("size").flatMap(SchemaValue::asString).isPresent()).isFalse();
    assertThat(object.member("doc").isPresent()).isFalse();
  }

  @Test
  void malformedJsonIsReportedAsIoFailure() {
    assertThrows(UncheckedIOException.class, () -> SchemaValues.parse("{\"type\": "));
  }

  @Test
  void emptyDocumentHasNoSchemaValue() {
    assertThrows(InvalidSchemaTypeException.class, () -> SchemaValues.parse(""));
  }

  @Test
  void binaryNodesAreRejected() {
    InvalidSchemaTypeException e = assertThrows(InvalidSchemaTypeException.class,
            () -> SchemaValues.fromJsonNode(BinaryNode.valueOf(new byte[]{1, 2})));
    assertThat(e.getOffendingValue()).isInstanceOf(BinaryNode.class);
  }

  @Test
  void nonFiniteNumbersCannotBeConstructed() {
    assertThrows(IllegalArgumentException.class, () -> SchemaValue.number(Double.NaN));
  }

  @Test
  void avroSchemaRoundTripsThroughItsJson() {
    Schema schema = new Schema.Parser().parse("{\"type\": \"fixed\", \"name\": \"Hash\", \"size\": 16}");

    SchemaValue.ObjectValue value = (SchemaValue.ObjectValue) SchemaValues.fromAvroSchema(schema);

    assertThat(value.member("name").flatMap(SchemaValue::asString).orElseThrow()).isEqualTo("Hash");
    assertThat(value.member("size").orElseThrow()).isEqualTo(SchemaValue.number(16));
  }
}
