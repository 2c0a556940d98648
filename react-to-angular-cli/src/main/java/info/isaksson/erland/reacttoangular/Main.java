package info.isaksson.erland.reacttoangular;

import info.isaksson.erland.reacttoangular.core.TranspileOptions;
import info.isaksson.erland.reacttoangular.core.TranspileResult;
import info.isaksson.erland.reacttoangular.core.TranspileService;
import info.isaksson.erland.reacttoangular.io.FileSystemHelper;
import info.isaksson.erland.reacttoangular.ir.ModelValidationError;
import info.isaksson.erland.reacttoangular.parse.ParseError;
import info.isaksson.erland.reacttoangular.rules.UnsupportedConstructWarning;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI entrypoint: {@code transpile <input-file> <output-directory> [options]}.
 *
 * <p>Exit codes: 0 success (warnings allowed), 1 usage error, 2 parse error, 3 model validation
 * error, 4 read or write error.</p>
 */
public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_PARSE = 2;
    static final int EXIT_VALIDATION = 3;
    static final int EXIT_IO = 4;

    private static final TranspileService SERVICE = new TranspileService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            return usageError(ex.getMessage());
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return EXIT_OK;
        }
        if (parsed.input == null || parsed.output == null) {
            return usageError("<input-file> and <output-directory> are required.");
        }

        final Path input = Paths.get(parsed.input).toAbsolutePath().normalize();
        final Path outDir = Paths.get(parsed.output).toAbsolutePath().normalize();

        final TranspileOptions options;
        try {
            options = toCoreOptions(parsed);
            options.toEmitterOptions();
        } catch (IllegalArgumentException ex) {
            return usageError(ex.getMessage());
        } catch (IOException ex) {
            System.err.println("Error: could not read options file: " + parsed.config + " (" + ex.getMessage() + ")");
            return EXIT_IO;
        }

        final TranspileResult res;
        try {
            res = SERVICE.transpile(input, outDir, options);
        } catch (ParseError e) {
            System.err.println("Error: " + input.getFileName() + ":" + e.describe());
            return EXIT_PARSE;
        } catch (ModelValidationError e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_VALIDATION;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_IO;
        }

        System.out.println(
                "react-to-angular\n" +
                "- Input: " + input + "\n" +
                "- Output: " + outDir + "\n" +
                "- Component: " + res.emitted.className + "\n" +
                "- Files: " + res.writtenFiles.size() + "\n" +
                "- Warnings: " + res.warnings.size()
        );
        for (UnsupportedConstructWarning w : res.warnings) {
            System.err.println("Warning: " + w.describe());
        }
        return EXIT_OK;
    }

    private static int usageError(String message) {
        System.err.println("Error: " + message);
        System.err.println();
        CliArgs.printHelp();
        return EXIT_USAGE;
    }

    /** Options file first, explicit flags on top. */
    static TranspileOptions toCoreOptions(CliArgs parsed) throws IOException {
        TranspileOptions o = new TranspileOptions();
        if (parsed.config != null) {
            Path config = Paths.get(parsed.config).toAbsolutePath().normalize();
            o.applyJson(new FileSystemHelper().read(config), config.toString());
        }
        if (parsed.indent != null) o.indentWidth = parsed.indent;
        if (parsed.spec != null) o.emitSpec = parsed.spec;
        o.name = parsed.name;
        if (parsed.writeIr != null) o.irOutput = Paths.get(parsed.writeIr).toAbsolutePath().normalize();
        return o;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String input;
        String output;

        Integer indent;
        Boolean spec;
        String config;
        String writeIr;
        String name;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--indent":
                        out.indent = parseInt(requireValue(args, ++i, "--indent"), "--indent");
                        break;
                    case "--spec":
                        out.spec = parseBoolean(requireValue(args, ++i, "--spec"), "--spec");
                        break;
                    case "--config":
                        out.config = requireValue(args, ++i, "--config");
                        break;
                    case "--write-ir":
                        out.writeIr = requireValue(args, ++i, "--write-ir");
                        break;
                    case "--name":
                        out.name = requireValue(args, ++i, "--name");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        if (out.input == null) {
                            out.input = a;
                        } else if (out.output == null) {
                            out.output = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static int parseInt(String v, String flag) {
            try {
                return Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + flag + ": " + v, e);
            }
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            System.out.println(
                    "react-to-angular\n" +
                    "\n" +
                    "Usage:\n" +
                    "  transpile <input-file> <output-directory> [options]\n" +
                    "\n" +
                    "Converts one React function component (.jsx/.js/.tsx) into an Angular standalone\n" +
                    "component: <Name>.component.ts, .html and .css in the output directory.\n" +
                    "\n" +
                    "Options:\n" +
                    "  --indent <n>           Spaces per indentation level, 1..8 (default: 2)\n" +
                    "  --spec <bool>          Also emit a <Name>.component.spec.ts scaffold (default: false)\n" +
                    "  --config <file.json>   Options file with keys indentWidth and emitSpec.\n" +
                    "                         Flags given on the command line win over the file.\n" +
                    "  --write-ir <file.json> Also write the intermediate component model as JSON\n" +
                    "  --name <Name>          Component name to use instead of the declared one\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Exit codes:\n" +
                    "  0 success (warnings allowed), 1 usage error, 2 parse error,\n" +
                    "  3 model validation error, 4 read or write error\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/react-to-angular.jar samples/TodoBox.jsx out\n" +
                    "  java -jar target/react-to-angular.jar samples/Timer.jsx out --indent 4 --spec true\n"
            );
        }
    }
}
