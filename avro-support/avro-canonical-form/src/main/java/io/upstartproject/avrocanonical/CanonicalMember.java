package io.upstartproject.avrocanonical;

import io.upstartproject.avrocanonical.annotations.Tuple;
import org.immutables.value.Value;

import java.util.Comparator;

/**
 * One rendered {@code "key":value} member of a canonical object, remembered with its attribute so the members can be
 * put into {@link FieldOrder} before they are joined.
 */
@Value.Immutable
@Tuple
interface CanonicalMember {
  Comparator<CanonicalMember> BY_FIELD_ORDER = Comparator.comparing(CanonicalMember::attribute);

  static CanonicalMember of(FieldOrder attribute, String rendered) {
    return ImmutableCanonicalMember.of(attribute, rendered);
  }

  FieldOrder attribute();

  String rendered();
}
