package knotwidth.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import knotwidth.core.KnotWidthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entrypoint.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code run --code "-1 2 -3 1 -2 3" [--parallel] [--parallelism N] [--json]}
 *   <li>{@code run --file code.txt} reads the first Gauss code in the file
 *   <li>{@code batch --file codes.txt [--json]} one Gauss code per line, optionally {@code name:}
 *       prefixed
 * </ul>
 *
 * <p>Results go to stdout, logging to stderr. Exit codes: 0 on success, 1 when a batch entry
 * failed, 2 on bad usage or an unusable Gauss code.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 2;

  private Main() {}

  public static void main(String[] args) {
    int exit = run(args, System.out);
    if (exit != EXIT_OK) {
      System.exit(exit);
    }
  }

  static int run(String[] args, PrintStream out) {
    String[] effective = args == null ? new String[0] : args;
    String command = effective.length > 0 ? effective[0].toLowerCase(Locale.ROOT) : "";
    try {
      return switch (command) {
        case "batch" -> new BatchCommand(out).execute(effective);
        case "help", "--help", "-h" -> {
          printUsage(out);
          yield EXIT_OK;
        }
        default -> new RunCommand(out).execute(effective);
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      printUsage(out);
      return EXIT_USAGE;
    } catch (KnotWidthException ex) {
      LOG.error("Cannot compute width bound: {}", ex.getMessage());
      return EXIT_USAGE;
    } catch (IOException ex) {
      LOG.error("Failed to read input: {}", ex.getMessage(), ex);
      return EXIT_USAGE;
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage:");
    out.println("  run --code \"<gauss code>\" | --file <path>");
    out.println("      [--parallel] [--parallelism N] [--json]");
    out.println("  batch --file <path> [--parallel] [--parallelism N] [--json]");
  }
}
