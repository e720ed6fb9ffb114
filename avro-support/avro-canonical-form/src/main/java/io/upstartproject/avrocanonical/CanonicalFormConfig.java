package io.upstartproject.avrocanonical;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.upstartproject.avrocanonical.annotations.Tuple;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Settings for {@link SchemaCanonicalizer}, read from the {@value #CONFIG_PATH} section of the application config
 * (defaults in this module's {@code reference.conf}).
 */
@Value.Immutable
@Tuple
public interface CanonicalFormConfig {
  String CONFIG_PATH = "upstart.avro.canonical-form";

  static CanonicalFormConfig of(int maxNestingDepth) {
    return ImmutableCanonicalFormConfig.of(maxNestingDepth);
  }

  static CanonicalFormConfig load() {
    return fromConfig(ConfigFactory.load());
  }

  static CanonicalFormConfig fromConfig(Config config) {
    Config section = config.getConfig(CONFIG_PATH);
    return of(section.getInt("max-nesting-depth"));
  }

  int maxNestingDepth();

  @Value.Check
  default void check() {
    checkArgument(maxNestingDepth() > 0, "max-nesting-depth must be positive: %s", maxNestingDepth());
  }
}
