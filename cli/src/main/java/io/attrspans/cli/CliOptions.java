// file: cli/src/main/java/io/attrspans/cli/CliOptions.java
package io.attrspans.cli;

import java.nio.file.Path;

/**
 * Command-line options for the attrspans tool.
 *
 * Supports:
 *  - command:        "markers" or "collapse"
 *  - scriptPath:     JSON edit script to replay
 *  - contentLength:  overrides the script's contentLength (null when absent)
 *  - verbose:        route engine FINE logging to stderr
 *  - help:           print usage and exit
 */
public record CliOptions(
        String command,
        Path scriptPath,
        Integer contentLength,
        boolean verbose,
        boolean help
) {

    static final String USAGE = """
            Usage:
              attrspans [options] markers  <script.json>
              attrspans [options] collapse <script.json>

            Options:
              --content-length, -l <n>   Content length for collapse (overrides the script)
              --verbose,        -v       Log engine traces to stderr
              --help,           -h       Show this help message
            """;

    /**
     * Very small CLI parser. Options may appear anywhere; the first two
     * positional arguments are the command and the script path.
     *
     * @throws IllegalArgumentException on unknown options, missing values or a bad command
     */
    public static CliOptions fromArgs(String[] args) {
        String command = null;
        String script = null;
        Integer contentLength = null;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new CliOptions(null, null, null, false, true);
                }

                case "--verbose", "-v" -> verbose = true;

                case "--content-length", "-l" -> {
                    ensureValue(args, i);
                    String raw = args[++i];
                    try {
                        contentLength = Integer.parseInt(raw);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid content-length: " + raw);
                    }
                    if (contentLength < 0) {
                        throw new IllegalArgumentException("content-length must be >= 0: " + raw);
                    }
                }

                default -> {
                    if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                    if (command == null) {
                        command = args[i];
                    } else if (script == null) {
                        script = args[i];
                    } else {
                        throw new IllegalArgumentException("Unexpected argument: " + args[i]);
                    }
                }
            }
        }

        if (command == null) {
            throw new IllegalArgumentException("missing command");
        }
        if (!command.equals("markers") && !command.equals("collapse")) {
            throw new IllegalArgumentException("unknown command: " + command);
        }
        if (script == null) {
            throw new IllegalArgumentException(command + " requires <script.json>");
        }
        return new CliOptions(command, Path.of(script), contentLength, verbose, false);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }
}
