package io.upstartproject.avrocanonical;

import org.apache.avro.Schema;
import org.immutables.value.Value;

/**
 * A schema reduced to its parsing canonical form. Two schemas are interchangeable for reading exactly when their
 * {@link CanonicalSchema}s are equal, however differently their documents were written.
 * @see SchemaCanonicalizer
 */
@Value.Immutable(builder = false, intern = true)
@Value.Style(allParameters = true)
public interface CanonicalSchema {
  /**
   * Wraps a form that is already canonical; use {@link #parse} for an arbitrary schema document.
   */
  static CanonicalSchema ofCanonicalForm(String canonicalForm) {
    return ImmutableCanonicalSchema.of(canonicalForm);
  }

  static CanonicalSchema parse(String schemaJson) {
    return ofCanonicalForm(SchemaCanonicalizer.defaultInstance().canonicalize(schemaJson));
  }

  static CanonicalSchema of(SchemaValue schema) {
    return SchemaCanonicalizer.defaultInstance().canonicalSchema(schema);
  }

  static CanonicalSchema of(Schema schema) {
    return ofCanonicalForm(SchemaCanonicalizer.defaultInstance().canonicalize(schema));
  }

  String canonicalForm();

  default boolean isEquivalentTo(String schemaJson) {
    return equals(parse(schemaJson));
  }
}
