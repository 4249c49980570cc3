package info.isaksson.erland.reacttoangular;

import info.isaksson.erland.reacttoangular.core.ConversionResult;
import info.isaksson.erland.reacttoangular.core.ReactToAngularOptions;
import info.isaksson.erland.reacttoangular.core.ReactToAngularService;
import info.isaksson.erland.reacttoangular.io.SourceScanner;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.Angular;
import info.isaksson.erland.reacttoangular.ir.IrJson;
import info.isaksson.erland.reacttoangular.transform.TransformWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entrypoint: converts JSON syntax trees of React components (one file or a directory of them)
 * or a saved IR document into Angular component files.
 *
 * <p>Exit codes: 0 success, 1 bad arguments, 2 unreadable input or I/O failure, 3 missing component
 * with {@code --fail-on-missing-component true}.</p>
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static final ReactToAngularService SERVICE = new ReactToAngularService();

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
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.ir == null && parsed.source == null) {
            System.err.println("Error: --source or --ir is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path outDir = Paths.get(parsed.output).toAbsolutePath().normalize();
        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            System.err.println("Error: could not create output directory: " + outDir);
            System.err.println(e.getMessage());
            return 2;
        }

        ReactToAngularOptions opts = toCoreOptions(parsed);

        // IR-first mode: read a saved IR document and generate from it directly.
        if (parsed.ir != null) {
            return runIrMode(parsed, opts, outDir);
        }

        final Path sourcePath = Paths.get(parsed.source).toAbsolutePath().normalize();
        if (!Files.exists(sourcePath)) {
            System.err.println("Error: --source does not exist: " + sourcePath);
            return 1;
        }

        final List<Path> inputs;
        if (Files.isDirectory(sourcePath)) {
            if (parsed.name != null) {
                System.err.println("Error: --name cannot be used when --source is a directory.");
                return 1;
            }
            try {
                inputs = SourceScanner.scan(sourcePath, parsed.excludes);
            } catch (IOException e) {
                System.err.println("Error: could not scan source directory: " + sourcePath);
                System.err.println(e.getMessage());
                return 2;
            }
            if (inputs.isEmpty()) {
                System.err.println("Error: no syntax tree (.json) files found under: " + sourcePath);
                return 1;
            }
        } else {
            inputs = List.of(sourcePath);
        }

        int failed = 0;
        int missing = 0;
        List<String> written = new ArrayList<>();
        for (Path input : inputs) {
            final ConversionResult res;
            try {
                res = SERVICE.convertFile(input, parsed.name, opts);
            } catch (IOException | RuntimeException e) {
                System.err.println("Error: could not convert " + input);
                System.err.println(e.getMessage());
                LOG.debug("Conversion of {} failed", input, e);
                failed++;
                continue;
            }

            if (res.isMissingComponent()) {
                missing++;
                System.err.println("Warning: no component found in " + input);
            }

            try {
                written.addAll(writeArtifacts(res, outDir, parsed.writeIr));
            } catch (IOException e) {
                System.err.println("Error: could not write output for " + input + " to " + outDir);
                System.err.println(e.getMessage());
                failed++;
                continue;
            }
            printWarnings(input, res.warnings);
        }

        System.out.println(
                "react-to-angular\n" +
                "- Source: " + sourcePath + "\n" +
                "- Output: " + outDir + "\n" +
                "- Inputs: " + inputs.size() + "\n" +
                "- Converted: " + (inputs.size() - failed) + "\n" +
                "- Failed: " + failed + "\n" +
                "- Missing component: " + missing + "\n" +
                "- Files written: " + written.size()
        );

        // Exit code rules
        if (failed > 0) return 2;
        if (parsed.failOnMissingComponent && missing > 0) {
            System.err.println("No component found in " + missing + " input(s) and --fail-on-missing-component is set.");
            return 3;
        }
        return 0;
    }

    private static int runIrMode(CliArgs parsed, ReactToAngularOptions opts, Path outDir) {
        final Path irPath = Paths.get(parsed.ir).toAbsolutePath().normalize();
        if (!Files.exists(irPath) || Files.isDirectory(irPath)) {
            System.err.println("Error: --ir must point to an existing IR JSON file: " + irPath);
            return 1;
        }

        final ConversionResult res;
        try {
            res = SERVICE.generateFromIrFile(irPath, parsed.name, opts);
        } catch (IOException e) {
            System.err.println("Error: could not read IR JSON: " + irPath);
            System.err.println(e.getMessage());
            return 2;
        }

        final List<String> written;
        try {
            written = writeArtifacts(res, outDir, false);
        } catch (IOException e) {
            System.err.println("Error: could not write output to: " + outDir);
            System.err.println(e.getMessage());
            return 2;
        }

        System.out.println(
                "react-to-angular (IR mode)\n" +
                "- IR: " + irPath + "\n" +
                "- Output: " + outDir + "\n" +
                "- Component: " + res.componentName + "\n" +
                "- Files written: " + written.size()
        );
        return 0;
    }

    /** Writes the generated files (and optionally the IR snapshot); returns the file names written. */
    private static List<String> writeArtifacts(ConversionResult res, Path outDir, boolean writeIr) throws IOException {
        List<String> names = new ArrayList<>();
        Files.writeString(outDir.resolve(res.typescriptFileName()), res.typescript);
        names.add(res.typescriptFileName());
        Files.writeString(outDir.resolve(res.htmlFileName()), res.html);
        names.add(res.htmlFileName());
        Files.writeString(outDir.resolve(res.cssFileName()), res.css);
        names.add(res.cssFileName());
        if (writeIr) {
            IrJson.write(res.ir, outDir.resolve(res.irFileName()));
            names.add(res.irFileName());
        }
        LOG.info("Wrote {} for {}", names, res.componentName);
        return names;
    }

    private static void printWarnings(Path input, List<TransformWarning> warnings) {
        if (warnings.isEmpty()) return;
        System.out.println("Warnings for " + input.getFileName() + ":");
        for (TransformWarning w : warnings) {
            System.out.println("  " + w);
        }
    }

    private static ReactToAngularOptions toCoreOptions(CliArgs parsed) {
        ReactToAngularOptions o = new ReactToAngularOptions();
        o.selectorPrefix = parsed.selectorPrefix;
        o.formsNote = parsed.formsNote;
        o.handlerStubs = parsed.handlerStubs;
        o.failOnMissingComponent = parsed.failOnMissingComponent;
        return o;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String source;
        String output = "./output";
        String name;

        // IR mode
        String ir;
        boolean writeIr = false;

        String selectorPrefix = Angular.DEFAULT_SELECTOR_PREFIX;
        boolean formsNote = true;
        boolean handlerStubs = true;
        boolean failOnMissingComponent = false;

        final List<String> excludes = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --exclude=glob
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--source":
                        out.source = requireValue(args, ++i, "--source");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--name":
                        out.name = requireValue(args, ++i, "--name");
                        break;
                    case "--ir":
                        out.ir = requireValue(args, ++i, "--ir");
                        break;
                    case "--write-ir":
                        out.writeIr = true;
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--selector-prefix":
                        out.selectorPrefix = requireValue(args, ++i, "--selector-prefix");
                        break;
                    case "--forms-note":
                        out.formsNote = parseBoolean(requireValue(args, ++i, "--forms-note"), "--forms-note");
                        break;
                    case "--handler-stubs":
                        out.handlerStubs = parseBoolean(requireValue(args, ++i, "--handler-stubs"), "--handler-stubs");
                        break;
                    case "--fail-on-missing-component":
                        out.failOnMissingComponent = parseBoolean(
                                requireValue(args, ++i, "--fail-on-missing-component"), "--fail-on-missing-component");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --source
                        if (out.source == null) {
                            out.source = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            if (out.source != null && out.ir != null) {
                throw new IllegalArgumentException("--source and --ir cannot be combined");
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
                    "  java -jar react-to-angular.jar --source <ast.json|dir> [--output <dir>] [options]\n" +
                    "  java -jar react-to-angular.jar --ir <ir.json> [--output <dir>] [--name <Component>]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --source <path>        JSON syntax tree (ESTree or Babel) of one component, or a folder of them\n" +
                    "  --ir <path>            Generate from a saved IR JSON document instead of a syntax tree\n" +
                    "  --output <dir>         Output folder (default: ./output)\n" +
                    "  --name <Component>     Component name (default: input file name without .json/.jsx/.tsx/.js/.ast).\n" +
                    "                         Single-file inputs only.\n" +
                    "  --exclude <glob>       Exclude paths matching glob (repeatable). Matches are evaluated\n" +
                    "                         against paths *relative to --source* using '/' separators.\n" +
                    "                         Also supports --exclude=<glob>.\n" +
                    "  --write-ir             Also write <Name>.ir.json next to the generated files\n" +
                    "  --selector-prefix <p>  Component selector prefix (default: app)\n" +
                    "  --forms-note <bool>    Emit the FormsModule reminder for [(ngModel)] (default: true)\n" +
                    "  --handler-stubs <bool> Emit stub methods for undeclared event handlers (default: true)\n" +
                    "  --fail-on-missing-component <bool>\n" +
                    "                         Exit with code 3 when an input has no component (default: false)\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Exit codes: 0 ok, 1 bad arguments, 2 unreadable input or I/O error, 3 missing component\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/react-to-angular.jar --source Counter.jsx.json --output out\n" +
                    "  java -jar target/react-to-angular.jar --source trees/ --exclude \"legacy/**\" --write-ir\n" +
                    "  java -jar target/react-to-angular.jar --ir out/Counter.ir.json --output regenerated\n"
            );
        }
    }
}
