package io.upstartproject.avrocanonical;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.CharMatcher;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.UnsignedLong;
import com.google.common.primitives.UnsignedLongs;
import org.apache.avro.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Computes the avro "Parsing Canonical Form" of a schema document: the whitespace-free rendering which keeps only the
 * attributes relevant to reading data (name, type, fields, symbols, items, values, size), in that order, with names
 * qualified by their enclosing namespace. Two schemas that differ only in formatting, attribute order, documentation
 * or aliases share one canonical form, which makes it suitable for fingerprinting and equality checks.
 * <p/>
 * Unlike {@link org.apache.avro.SchemaNormalization#toParsingForm}, this works directly on the JSON document rather
 * than a parsed {@link Schema}, so it also accepts documents that refer to types it cannot resolve.
 * <p/>
 * Instances are immutable and may be shared between threads.
 */
public class SchemaCanonicalizer {
  private static final Supplier<SchemaCanonicalizer> DEFAULT_INSTANCE = Suppliers.memoize(
          () -> create(CanonicalFormConfig.load()));
  private static final CharMatcher ASCII_DIGITS = CharMatcher.inRange('0', '9');
  private static final ImmutableSet<String> NAME_BEARING_TYPES = ImmutableSet.of("record", "enum");

  private final CanonicalFormConfig config;

  private SchemaCanonicalizer(CanonicalFormConfig config) {
    this.config = config;
  }

  /**
   * @return a canonicalizer configured from the application config (see {@link CanonicalFormConfig#load})
   */
  public static SchemaCanonicalizer defaultInstance() {
    return DEFAULT_INSTANCE.get();
  }

  public static SchemaCanonicalizer create(CanonicalFormConfig config) {
    return new SchemaCanonicalizer(config);
  }

  public CanonicalFormConfig config() {
    return config;
  }

  public String canonicalize(SchemaValue schema) {
    return canonicalize(schema, CanonicalContext.ROOT);
  }

  public String canonicalize(String schemaJson) {
    return canonicalize(SchemaValues.parse(schemaJson));
  }

  public String canonicalize(JsonNode schemaNode) {
    return canonicalize(SchemaValues.fromJsonNode(schemaNode));
  }

  public String canonicalize(Schema schema) {
    return canonicalize(SchemaValues.fromAvroSchema(schema));
  }

  public CanonicalSchema canonicalSchema(SchemaValue schema) {
    return CanonicalSchema.ofCanonicalForm(canonicalize(schema));
  }

  String canonicalize(SchemaValue value, CanonicalContext context) {
    if (context.depth() > config.maxNestingDepth()) throw new SchemaNestingTooDeepException(config.maxNestingDepth());
    return value.accept(new Renderer(context));
  }

  private static String quote(String value) {
    return '"' + value + '"';
  }

  private static boolean startsWithUpperCase(String value) {
    return !value.isEmpty() && Character.isUpperCase(value.codePointAt(0));
  }

  private static SchemaValue coerceSize(SchemaValue size) {
    Optional<String> sizeText = size.asString();
    if (sizeText.isEmpty()) return size;
    if (!ASCII_DIGITS.matchesAllOf(sizeText.get())) throw new InvalidSizeValueException(sizeText.get());
    try {
      long bits = UnsignedLongs.parseUnsignedLong(sizeText.get());
      return SchemaValue.number(UnsignedLong.fromLongBits(bits).doubleValue());
    } catch (NumberFormatException e) {
      throw new InvalidSizeValueException(sizeText.get(), e);
    }
  }

  /**
   * Renders one node under a fixed context; children are rendered by fresh instances with their own contexts.
   */
  private class Renderer implements SchemaValue.Visitor<String> {
    private final CanonicalContext context;

    Renderer(CanonicalContext context) {
      this.context = context;
    }

    @Override
    public String visitObject(SchemaValue.ObjectValue object) {
      Map<String, SchemaValue> members = object.members();
      CanonicalContext scope = object.member("namespace")
              .flatMap(SchemaValue::asString)
              .map(context::inNamespace)
              .orElse(context);

      Optional<String> declaredType = object.member(FieldOrder.TYPE.key()).flatMap(SchemaValue::asString);

      // primitive shorthand: {"type":"int"} is just "int"
      if (members.size() == 1 && declaredType.isPresent()) return quote(declaredType.get());

      List<CanonicalMember> retained = new ArrayList<>(members.size());
      for (Map.Entry<String, SchemaValue> entry : members.entrySet()) {
        Optional<FieldOrder> order = FieldOrder.forKey(entry.getKey());
        if (order.isEmpty()) continue;

        FieldOrder attribute = order.get();
        SchemaValue value = entry.getValue();
        if (attribute == FieldOrder.NAME && scope.hasNamespace() && !scope.fieldNamePosition()) {
          value = value.asString()
                  .filter(name -> name.indexOf('.') < 0)
                  .<SchemaValue>map(name -> SchemaValue.string(scope.qualify(name)))
                  .orElse(value);
        } else if (attribute == FieldOrder.SIZE) {
          value = coerceSize(value);
        }

        String renderedKey = renderString(attribute.key(), scope);
        String renderedValue = canonicalize(value, scope.forAttribute(attribute));

        // named types other than records and enums carry no name when they appear in a type slot
        if (scope.typePosition()
                && attribute == FieldOrder.NAME
                && declaredType.isPresent()
                && !NAME_BEARING_TYPES.contains(declaredType.get())) {
          continue;
        }
        retained.add(CanonicalMember.of(attribute, renderedKey + ":" + renderedValue));
      }

      return retained.stream()
              .sorted(CanonicalMember.BY_FIELD_ORDER)
              .map(CanonicalMember::rendered)
              .collect(Collectors.joining(",", "{", "}"));
    }

    @Override
    public String visitArray(SchemaValue.ArrayValue array) {
      CanonicalContext elementContext = context.nested();
      return array.elements().stream()
              .map(element -> canonicalize(element, elementContext))
              .collect(Collectors.joining(",", "[", "]"));
    }

    @Override
    public String visitString(SchemaValue.StringValue string) {
      return renderString(string.value(), context);
    }

    @Override
    public String visitNumber(SchemaValue.NumberValue number) {
      return CanonicalNumbers.format(number.value());
    }

    @Override
    public String visitBoolean(SchemaValue.BooleanValue bool) {
      throw new InvalidSchemaTypeException(bool);
    }

    @Override
    public String visitNull(SchemaValue.NullValue nullValue) {
      throw new InvalidSchemaTypeException(nullValue);
    }

    private String renderString(String value, CanonicalContext position) {
      if (position.typePosition() && startsWithUpperCase(value) && position.hasNamespace()) {
        return quote(position.qualify(value));
      }
      return quote(value);
    }
  }
}
