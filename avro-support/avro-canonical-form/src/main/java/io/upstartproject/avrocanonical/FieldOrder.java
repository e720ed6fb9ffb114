package io.upstartproject.avrocanonical;

import com.google.common.collect.ImmutableMap;

import java.util.Optional;
import java.util.stream.Stream;

import static com.google.common.collect.ImmutableMap.toImmutableMap;

/**
 * The schema attributes which survive canonicalization, declared in the order they must appear in the canonical form:
 * name, type, fields, symbols, items, values, size. Every other attribute (doc, aliases, namespace, default, ...) is
 * stripped.
 */
public enum FieldOrder {
  NAME("name"),
  TYPE("type"),
  FIELDS("fields"),
  SYMBOLS("symbols"),
  ITEMS("items"),
  VALUES("values"),
  SIZE("size");

  private static final ImmutableMap<String, FieldOrder> BY_KEY = Stream.of(values())
          .collect(toImmutableMap(FieldOrder::key, field -> field));

  private final String key;

  FieldOrder(String key) {
    this.key = key;
  }

  public static Optional<FieldOrder> forKey(String key) {
    return Optional.ofNullable(BY_KEY.get(key));
  }

  public String key() {
    return key;
  }

  public int precedence() {
    return ordinal() + 1;
  }

  /**
   * @return true if the value of this attribute is itself a schema (or a reference to one)
   */
  public boolean opensTypePosition() {
    return this == TYPE || this == ITEMS || this == VALUES;
  }

  /**
   * @return true if the value of this attribute holds record fields, whose names are never namespace-qualified
   */
  public boolean opensFieldNamePosition() {
    return this == FIELDS;
  }
}
