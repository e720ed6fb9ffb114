package io.upstartproject.avrocanonical;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.upstartproject.avrocanonical.annotations.Tuple;
import org.immutables.value.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A node of a parsed avro schema document.
 * <p/>
 * Objects, arrays, strings and numbers make up a well-formed schema. Booleans and nulls are representable because a
 * JSON decoder will happily produce them, but no schema construct accepts them: {@link SchemaCanonicalizer} rejects
 * them with an {@link InvalidSchemaTypeException}.
 * <p/>
 * Dispatch over the variants goes through {@link #accept(Visitor)}, so every consumer must handle each of them.
 */
public sealed interface SchemaValue {

  <R> R accept(Visitor<R> visitor);

  /**
   * @return the text of this value, if it is a {@link StringValue}
   */
  default Optional<String> asString() {
    return Optional.empty();
  }

  static ObjectValue object(Map<String, ? extends SchemaValue> members) {
    Map<String, SchemaValue> copy = ImmutableMap.copyOf(members);
    return ImmutableObjectValue.of(copy);
  }

  static ArrayValue array(List<? extends SchemaValue> elements) {
    List<SchemaValue> copy = ImmutableList.copyOf(elements);
    return ImmutableArrayValue.of(copy);
  }

  static ArrayValue array(SchemaValue... elements) {
    return array(ImmutableList.copyOf(elements));
  }

  static StringValue string(String value) {
    return ImmutableStringValue.of(value);
  }

  static NumberValue number(double value) {
    return ImmutableNumberValue.of(value);
  }

  static BooleanValue bool(boolean value) {
    return ImmutableBooleanValue.of(value);
  }

  static NullValue nullValue() {
    return NullValue.INSTANCE;
  }

  interface Visitor<R> {
    R visitObject(ObjectValue object);

    R visitArray(ArrayValue array);

    R visitString(StringValue string);

    R visitNumber(NumberValue number);

    R visitBoolean(BooleanValue bool);

    R visitNull(NullValue nullValue);
  }

  @Value.Immutable
  @Tuple
  non-sealed interface ObjectValue extends SchemaValue {
    Map<String, SchemaValue> members();

    default Optional<SchemaValue> member(String key) {
      return Optional.ofNullable(members().get(key));
    }

    @Override
    default <R> R accept(Visitor<R> visitor) {
      return visitor.visitObject(this);
    }
  }

  @Value.Immutable
  @Tuple
  non-sealed interface ArrayValue extends SchemaValue {
    List<SchemaValue> elements();

    @Override
    default <R> R accept(Visitor<R> visitor) {
      return visitor.visitArray(this);
    }
  }

  @Value.Immutable
  @Tuple
  non-sealed interface StringValue extends SchemaValue {
    String value();

    @Override
    default Optional<String> asString() {
      return Optional.of(value());
    }

    @Override
    default <R> R accept(Visitor<R> visitor) {
      return visitor.visitString(this);
    }
  }

  @Value.Immutable
  @Tuple
  non-sealed interface NumberValue extends SchemaValue {
    double value();

    @Value.Check
    default void check() {
      checkArgument(Double.isFinite(value()), "JSON numbers must be finite: %s", value());
    }

    @Override
    default <R> R accept(Visitor<R> visitor) {
      return visitor.visitNumber(this);
    }
  }

  @Value.Immutable
  @Tuple
  non-sealed interface BooleanValue extends SchemaValue {
    boolean value();

    @Override
    default <R> R accept(Visitor<R> visitor) {
      return visitor.visitBoolean(this);
    }
  }

  enum NullValue implements SchemaValue {
    INSTANCE;

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNull(this);
    }

    @Override
    public String toString() {
      return "null";
    }
  }
}
