package knotwidth.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import knotwidth.WidthBoundCalculator;
import knotwidth.cli.CliParsers.NamedCode;
import knotwidth.cli.CliParsers.OptionSpec;
import knotwidth.core.GaussCode;
import knotwidth.parse.GaussCodeParser;
import knotwidth.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the primary `run` command: one Gauss code in, one bound out. */
final class RunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

  private final PrintStream out;

  RunCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = parseArgs(args);
    NamedCode input =
        options.hasCode()
            ? new NamedCode("code", 0, options.code())
            : CliParsers.firstCode(Path.of(options.file()));

    GaussCode code = GaussCodeParser.parseText(input.code());
    SearchResult result = WidthBoundCalculator.compute(code, options.searchOptions());
    LOG.info(
        "{}: {} strands, {} crossings, {}",
        input.name(),
        result.diagram().strandCount(),
        result.diagram().crossingCount(),
        result.run());

    if (options.json()) {
      out.println(new JsonReportBuilder().build(input.name(), result));
    } else {
      out.println(result.value());
    }
    return 0;
  }

  private CliOptions parseArgs(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    CliOptions.Builder builder = CliOptions.builder();
    CliParsers.parseOptions(effectiveArgs, optionSpecs(), builder);
    return builder.build(true);
  }

  static Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--code", OptionSpec.withValue((b, raw) -> b.code(raw)));
    specs.put("--file", OptionSpec.withValue((b, raw) -> b.file(raw)));
    specs.put("--parallel", OptionSpec.flag(b -> b.parallel(true)));
    specs.put(
        "--parallelism",
        OptionSpec.withValue(
            (b, raw) -> b.parallelism(CliParsers.parseInt(raw, 0, "--parallelism"))));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    return specs;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("run".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }
}
