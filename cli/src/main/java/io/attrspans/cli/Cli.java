// file: cli/src/main/java/io/attrspans/cli/Cli.java
package io.attrspans.cli;

import io.attrspans.cli.dto.EditScript;
import io.attrspans.core.AttributedSpans;

import java.io.PrintStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replays a JSON edit script against the attributed spans engine and prints
 * the result.
 *
 * Usage:
 *   attrspans [--content-length n] [--verbose] markers  <script.json>
 *   attrspans [--content-length n] [--verbose] collapse <script.json>
 *
 * Examples:
 *   attrspans markers edits.json
 *   attrspans -l 40 collapse edits.json
 *
 * Exit codes: 0 success, 1 usage or script error, 2 unexpected failure.
 */
public final class Cli {

    private static final String ENGINE_LOGGER = "io.attrspans.core";

    private final ScriptRunner runner;
    private final PrintStream out;

    private Cli(ScriptRunner runner, PrintStream out) {
        this.runner = runner;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            CliOptions options;
            try {
                options = CliOptions.fromArgs(args);
            } catch (IllegalArgumentException e) {
                throw new CliException(e.getMessage());
            }
            if (options.help()) {
                out.println(CliOptions.USAGE);
                return 0;
            }
            if (options.verbose()) {
                enableVerboseLogging();
            }

            Cli cli = new Cli(new ScriptRunner(), out);
            EditScript script = cli.runner.load(options.scriptPath());
            AttributedSpans spans = cli.runner.replay(script);

            switch (options.command()) {
                case "markers" -> cli.printMarkers(spans);
                case "collapse" -> {
                    Integer length = options.contentLength() != null ? options.contentLength() : script.contentLength;
                    if (length == null) {
                        throw new CliException("collapse requires a content length (--content-length or \"contentLength\")");
                    }
                    cli.printCollapsed(spans, length);
                }
                default -> throw new CliException("unknown command: " + options.command());
            }
            return 0;
        } catch (CliException | ScriptException e) {
            err.println("error: " + e.getMessage());
            if (e instanceof CliException) {
                err.println(CliOptions.USAGE);
            }
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    private void printMarkers(AttributedSpans spans) {
        if (spans.isEmpty()) {
            out.println("(no markers)");
            return;
        }
        runner.describeMarkers(spans).forEach(out::println);
    }

    private void printCollapsed(AttributedSpans spans, int contentLength) {
        out.println(runner.collapsedJson(spans, contentLength));
    }

    private static void enableVerboseLogging() {
        Logger engine = Logger.getLogger(ENGINE_LOGGER);
        engine.setLevel(Level.FINE);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        engine.addHandler(handler);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
