package io.upstartproject.avrocanonical.cli;

import com.google.common.collect.Maps;
import com.google.common.io.CharStreams;
import com.google.common.io.MoreFiles;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import io.upstartproject.avrocanonical.CanonicalFormConfig;
import io.upstartproject.avrocanonical.InvalidSchemaException;
import io.upstartproject.avrocanonical.SchemaCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;
import static picocli.CommandLine.Parameters;

/**
 * Prints the parsing canonical form of avro schema files, or checks whether several files describe the same schema.
 */
@Command(
        name = "avro-pcf",
        mixinStandardHelpOptions = true,
        description = "Prints the avro Parsing Canonical Form of each schema, one per line."
)
public class CanonicalFormCommand implements Callable<Integer> {
  static final int EXIT_MISMATCH = 1;
  static final int EXIT_INVALID = 2;
  static final String STDIN = "-";

  private static final Logger LOG = LoggerFactory.getLogger(CanonicalFormCommand.class);

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  @Option(names = "--compare", description = "Report MATCH (exit 0) if all schemas share one canonical form, MISMATCH (exit 1) otherwise")
  boolean compare;

  @Option(names = "--config", paramLabel = "FILE", description = "HOCON file overriding the " + CanonicalFormConfig.CONFIG_PATH + " settings")
  Path configFile;

  @Parameters(paramLabel = "FILE", description = "Schema files (.avsc); reads stdin when none are given, or for '-'")
  List<String> sources = new ArrayList<>();

  private final Supplier<InputStream> stdin;

  public CanonicalFormCommand() {
    this(() -> System.in);
  }

  CanonicalFormCommand(Supplier<InputStream> stdin) {
    this.stdin = stdin;
  }

  public static void main(String... args) {
    System.exit(new CommandLine(new CanonicalFormCommand()).execute(args));
  }

  static Config buildAppConfig(Path configFile) {
    Config config = ConfigFactory.load();
    if (configFile == null) return config;
    ConfigParseOptions options = ConfigParseOptions.defaults().setAllowMissing(false);
    return ConfigFactory.parseFile(configFile.toAbsolutePath().toFile(), options).withFallback(config).resolve();
  }

  @Override
  public Integer call() {
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();

    SchemaCanonicalizer canonicalizer;
    try {
      canonicalizer = SchemaCanonicalizer.create(CanonicalFormConfig.fromConfig(buildAppConfig(configFile)));
    } catch (ConfigException | IllegalArgumentException e) {
      LOG.debug("Invalid configuration", e);
      err.println(String.format("invalid configuration: %s", e.getMessage()));
      return EXIT_INVALID;
    }
    LOG.debug("Canonicalizing with {}", canonicalizer.config());

    List<String> inputs = sources.isEmpty() ? List.of(STDIN) : sources;
    List<Map.Entry<String, String>> canonicalForms = new ArrayList<>(inputs.size());
    for (String source : inputs) {
      String schemaJson;
      try {
        schemaJson = read(source);
      } catch (IOException e) {
        LOG.debug("Failed to read {}", source, e);
        err.println(String.format("%s: unable to read schema: %s", source, e));
        return EXIT_INVALID;
      }

      try {
        canonicalForms.add(Maps.immutableEntry(source, canonicalizer.canonicalize(schemaJson)));
      } catch (InvalidSchemaException | UncheckedIOException e) {
        LOG.debug("Rejected schema from {}", source, e);
        err.println(String.format("%s: invalid schema: %s", source, e.getMessage()));
        return EXIT_INVALID;
      }
    }

    if (!compare) {
      canonicalForms.forEach(entry -> out.println(entry.getValue()));
      out.flush();
      return 0;
    }

    boolean match = canonicalForms.stream().map(Map.Entry::getValue).distinct().count() <= 1;
    if (match) {
      out.println("MATCH");
    } else {
      out.println("MISMATCH");
      canonicalForms.forEach(entry -> out.println(entry.getKey() + "\t" + entry.getValue()));
    }
    out.flush();
    LOG.debug("Compared {} schemas: {}", canonicalForms.size(), match ? "match" : "mismatch");
    return match ? 0 : EXIT_MISMATCH;
  }

  private String read(String source) throws IOException {
    if (STDIN.equals(source)) {
      return CharStreams.toString(new InputStreamReader(stdin.get(), StandardCharsets.UTF_8));
    }
    return MoreFiles.asCharSource(Path.of(source), StandardCharsets.UTF_8).read();
  }
}
