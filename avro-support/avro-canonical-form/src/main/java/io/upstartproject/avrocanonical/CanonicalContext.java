package io.upstartproject.avrocanonical;

import io.upstartproject.avrocanonical.annotations.Tuple;
import org.immutables.value.Value;

/**
 * The position of a schema node within the document being canonicalized: the namespace in effect, whether the node
 * sits inside a record's {@code fields}, whether it fills a {@code type}/{@code items}/{@code values} slot, and how
 * deeply it is nested.
 * <p/>
 * Each descent derives a fresh context, so nothing a child does can leak into its parent or siblings.
 */
@Value.Immutable
@Tuple
public interface CanonicalContext {
  CanonicalContext ROOT = of("", false, false, 0);

  static CanonicalContext of(String namespace, boolean fieldNamePosition, boolean typePosition, int depth) {
    return ImmutableCanonicalContext.of(namespace, fieldNamePosition, typePosition, depth);
  }

  /**
   * The enclosing namespace, or the empty string when there is none.
   */
  String namespace();

  boolean fieldNamePosition();

  boolean typePosition();

  int depth();

  default boolean hasNamespace() {
    return !namespace().isEmpty();
  }

  default String qualify(String name) {
    return namespace() + "." + name;
  }

  default CanonicalContext inNamespace(String namespace) {
    return of(namespace, fieldNamePosition(), typePosition(), depth());
  }

  /**
   * @return the context for an element of an array at this position: same namespace and role, one level deeper
   */
  default CanonicalContext nested() {
    return of(namespace(), fieldNamePosition(), typePosition(), depth() + 1);
  }

  /**
   * @return the context for the value of the given attribute of an object at this position
   */
  default CanonicalContext forAttribute(FieldOrder attribute) {
    return of(namespace(), attribute.opensFieldNamePosition(), attribute.opensTypePosition(), depth() + 1);
  }
}
