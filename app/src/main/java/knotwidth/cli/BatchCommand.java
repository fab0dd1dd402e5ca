package knotwidth.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import knotwidth.WidthBoundCalculator;
import knotwidth.cli.CliParsers.NamedCode;
import knotwidth.core.KnotWidthException;
import knotwidth.core.SearchOptions;
import knotwidth.parse.GaussCodeParser;
import knotwidth.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Computes the bound for every Gauss code listed in a file, one per line. */
final class BatchCommand {
  private static final Logger LOG = LoggerFactory.getLogger(BatchCommand.class);

  private final PrintStream out;

  BatchCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    if (args.length == 0 || !"batch".equalsIgnoreCase(args[0])) {
      throw new IllegalArgumentException("Unknown command: " + (args.length == 0 ? "" : args[0]));
    }
    CliOptions.Builder builder = CliOptions.builder();
    CliParsers.parseOptions(
        Arrays.copyOfRange(args, 1, args.length), RunCommand.optionSpecs(), builder);
    CliOptions options = builder.build(false);

    List<NamedCode> codes = CliParsers.readCodes(Path.of(options.file()));
    if (codes.isEmpty()) {
      LOG.warn("No Gauss codes found in {}.", options.file());
      return 1;
    }

    SearchOptions searchOptions = options.searchOptions();
    JsonReportBuilder json = new JsonReportBuilder();
    List<Map<String, Object>> entries = new ArrayList<>();
    int failures = 0;
    for (NamedCode code : codes) {
      try {
        SearchResult result =
            WidthBoundCalculator.compute(GaussCodeParser.parseText(code.code()), searchOptions);
        if (options.json()) {
          entries.add(json.report(code.name(), result));
        } else {
          out.println(code.name() + "\t" + result.value());
        }
      } catch (KnotWidthException ex) {
        failures++;
        LOG.error("{} (line {}) failed: {}", code.name(), code.lineNumber(), ex.getMessage());
        if (options.json()) {
          entries.add(json.failure(code.name(), ex.getMessage()));
        } else {
          out.println(code.name() + "\tERROR " + ex.getMessage());
        }
      }
    }
    if (options.json()) {
      out.println(json.buildBatch(entries));
    }
    LOG.info("Processed {} Gauss codes, {} failed", codes.size(), failures);
    return failures > 0 ? 1 : 0;
  }
}
