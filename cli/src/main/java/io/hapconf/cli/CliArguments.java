package io.hapconf.cli;

import java.nio.file.Path;

/**
 * Parsed command line of {@code hapconf}.
 *
 * <pre>
 * hapconf [--settings FILE] [-o|--output OUT] [--script-dir DIR] [--validate] [--dump-ir]
 *         [--format ID] INPUT
 * </pre>
 *
 * @param settings     settings file, or {@code null} for defaults
 * @param output       output file, or {@code null} to print to standard output
 * @param scriptDir    script directory override, or {@code null}
 * @param validateOnly only validate, write nothing
 * @param dumpIr       print the final IR as JSON instead of the configuration
 * @param format       explicit source format id, or {@code null} to detect it
 * @param input        the DSL file to translate
 */
public record CliArguments(
        Path settings,
        Path output,
        String scriptDir,
        boolean validateOnly,
        boolean dumpIr,
        String format,
        Path input) {

    static final String USAGE = "Usage: hapconf [--settings FILE] [-o OUT] [--script-dir DIR] [--validate] "
            + "[--dump-ir] [--format ID] INPUT";

    /** Thrown for a malformed command line; the caller prints the message and the usage line. */
    public static final class UsageException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public UsageException(String message) {
            super(message);
        }
    }

    /**
     * Parses {@code args}.
     *
     * @throws UsageException for unknown options, missing option values, a missing input file
     *     argument or conflicting modes
     */
    public static CliArguments parse(String[] args) {
        Path settings = null;
        Path output = null;
        String scriptDir = null;
        boolean validateOnly = false;
        boolean dumpIr = false;
        String format = null;
        Path input = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--settings":
                    settings = Path.of(valueOf(args, ++i, arg));
                    break;
                case "-o":
                case "--output":
                    output = Path.of(valueOf(args, ++i, arg));
                    break;
                case "--script-dir":
                    scriptDir = valueOf(args, ++i, arg);
                    break;
                case "--format":
                    format = valueOf(args, ++i, arg);
                    break;
                case "--validate":
                    validateOnly = true;
                    break;
                case "--dump-ir":
                    dumpIr = true;
                    break;
                default:
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new UsageException("Unknown option: " + arg);
                    }
                    if (input != null) {
                        throw new UsageException("Only one input file may be given, got '" + input + "' and '"
                                + arg + "'");
                    }
                    input = Path.of(arg);
            }
        }
        if (input == null) {
            throw new UsageException("Missing input file");
        }
        if (validateOnly && dumpIr) {
            throw new UsageException("--validate and --dump-ir cannot be combined");
        }
        return new CliArguments(settings, output, scriptDir, validateOnly, dumpIr, format, input);
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new UsageException(option + " requires a value");
        }
        return args[index];
    }
}
