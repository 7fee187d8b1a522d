package info.isaksson.erland.mappinglint;

import com.fasterxml.jackson.core.JsonProcessingException;
import info.isaksson.erland.mappinglint.analysis.MappingRule;
import info.isaksson.erland.mappinglint.analysis.Severity;
import info.isaksson.erland.mappinglint.core.MappingLintOptions;
import info.isaksson.erland.mappinglint.core.MappingLintResult;
import info.isaksson.erland.mappinglint.core.MappingLintService;
import info.isaksson.erland.mappinglint.fix.AccessorStyle;
import info.isaksson.erland.mappinglint.model.MappingModel;
import info.isaksson.erland.mappinglint.model.ModelJson;
import info.isaksson.erland.mappinglint.report.ReportGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CLI entrypoint: reads a mapping snapshot, writes {@code findings.json} and {@code report.md}.
 */
public final class Main {

    private static final MappingLintService SERVICE = new MappingLintService();

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

        if (parsed.input == null) {
            System.err.println("Error: --input is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path inputPath = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.exists(inputPath) || Files.isDirectory(inputPath)) {
            System.err.println("Error: --input must point to an existing snapshot JSON file: " + inputPath);
            return 1;
        }

        final Path findingsOut = resolveFindingsOutput(parsed.output);
        final Path reportOut = resolveReportOutput(parsed.report, findingsOut);

        try {
            Files.createDirectories(findingsOut.toAbsolutePath().normalize().getParent());
            Files.createDirectories(reportOut.toAbsolutePath().normalize().getParent());
        } catch (IOException e) {
            System.err.println("Error: could not create output directory.");
            System.err.println(e.getMessage());
            return 2;
        }

        final MappingModel model;
        try {
            model = ModelJson.read(inputPath);
        } catch (JsonProcessingException e) {
            System.err.println("Error: snapshot is not valid mapping JSON: " + inputPath);
            System.err.println(e.getOriginalMessage());
            return 2;
        } catch (IOException e) {
            System.err.println("Error: could not read snapshot: " + inputPath);
            System.err.println(e.getMessage());
            return 2;
        }

        final MappingLintResult res;
        try {
            res = SERVICE.analyze(model, toCoreOptions(parsed));
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            System.err.println("Error: analysis failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        try {
            ModelJson.writeValue(res, findingsOut);
        } catch (IOException e) {
            System.err.println("Error: could not write findings to: " + findingsOut);
            System.err.println(e.getMessage());
            return 2;
        }

        try {
            ReportGenerator.writeMarkdown(reportOut, inputPath, findingsOut, res, parsed.disabled,
                    parsed.failOn == null ? "never" : parsed.failOn.name().toLowerCase(Locale.ROOT));
        } catch (IOException e) {
            System.err.println("Error: could not write report to: " + reportOut);
            System.err.println(e.getMessage());
            return 2;
        }

        System.out.println(
                "mapping-lint\n" +
                "- Snapshot: " + inputPath + "\n" +
                "- Findings: " + findingsOut + "\n" +
                "- Report: " + reportOut + "\n" +
                "- Units: " + model.units.size() + "\n" +
                "- Errors: " + res.count(Severity.ERROR) + "\n" +
                "- Warnings: " + res.count(Severity.WARNING) + "\n" +
                "- Info: " + res.count(Severity.INFO) + "\n" +
                "- Analysis warnings: " + res.warnings.size()
        );

        // Exit code rules
        if (parsed.failOn != null && res.countAtLeast(parsed.failOn) > 0) {
            System.err.println("Findings at or above " + parsed.failOn.name().toLowerCase(Locale.ROOT)
                    + " present (" + res.countAtLeast(parsed.failOn) + ") and --fail-on is set.");
            System.err.println("See report: " + reportOut);
            return 3;
        }
        return 0;
    }

    private static MappingLintOptions toCoreOptions(CliArgs parsed) {
        MappingLintOptions o = new MappingLintOptions();
        o.disabledRules.addAll(parsed.disabled);
        o.severityOverrides.putAll(parsed.severities);
        o.performanceRules = !parsed.noPerformance;
        o.nonNullableReferencesRequired = parsed.requiredNonNull;
        o.accessorStyle = parsed.accessorStyle;
        o.sourceParameterName = parsed.sourceParam;
        o.parallel = parsed.parallel;
        o.synthesizeFixes = !parsed.noFixes;
        return o;
    }

    private static Path resolveFindingsOutput(String outputArg) {
        // A path ending with .json is the findings file; anything else is an output directory.
        if (outputArg != null && outputArg.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return Paths.get(outputArg).toAbsolutePath().normalize();
        }
        String dir = (outputArg == null || outputArg.isBlank()) ? "./output" : outputArg;
        return Paths.get(dir).toAbsolutePath().normalize().resolve("findings.json");
    }

    private static Path resolveReportOutput(String reportArg, Path findingsOut) {
        if (reportArg != null && !reportArg.isBlank()) {
            return Paths.get(reportArg).toAbsolutePath().normalize();
        }
        return findingsOut.getParent().resolve("report.md");
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String input;
        String output = "./output";
        String report;

        // Rule settings
        final List<String> disabled = new ArrayList<>();
        final Map<String, Severity> severities = new LinkedHashMap<>();
        boolean noPerformance = false;
        boolean requiredNonNull = false;

        // Fix generation
        boolean noFixes = false;
        AccessorStyle accessorStyle = AccessorStyle.GETTER;
        String sourceParam = "src";

        boolean parallel = false;

        // Null means never fail on findings.
        Severity failOn = null;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --disable=ML001,ML050
                if (a.startsWith("--disable=")) {
                    out.addDisabled(a.substring("--disable=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--input":
                        out.input = requireValue(args, ++i, "--input");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--disable":
                        out.addDisabled(requireValue(args, ++i, "--disable"));
                        break;
                    case "--severity":
                        out.addSeverity(requireValue(args, ++i, "--severity"));
                        break;
                    case "--no-performance":
                        out.noPerformance = true;
                        break;
                    case "--required-non-null":
                        out.requiredNonNull = parseBoolean(requireValue(args, ++i, "--required-non-null"), "--required-non-null");
                        break;
                    case "--accessors":
                        out.accessorStyle = AccessorStyle.parse(requireValue(args, ++i, "--accessors"));
                        break;
                    case "--source-param":
                        out.sourceParam = requireValue(args, ++i, "--source-param");
                        break;
                    case "--parallel":
                        out.parallel = parseBoolean(requireValue(args, ++i, "--parallel"), "--parallel");
                        break;
                    case "--fail-on":
                        out.failOn = parseFailOn(requireValue(args, ++i, "--fail-on"));
                        break;
                    case "--no-fixes":
                        out.noFixes = true;
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --input
                        if (out.input == null) {
                            out.input = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        private void addDisabled(String list) {
            for (String part : list.split(",")) {
                String key = part.trim();
                if (key.isEmpty()) continue;
                if (MappingRule.fromKey(key) == null) throw new IllegalArgumentException("Unknown rule: " + key);
                disabled.add(key);
            }
        }

        private void addSeverity(String assignment) {
            int eq = assignment.indexOf('=');
            if (eq <= 0 || eq == assignment.length() - 1) {
                throw new IllegalArgumentException("Invalid value for --severity (expected <rule>=<level>): " + assignment);
            }
            String key = assignment.substring(0, eq).trim();
            if (MappingRule.fromKey(key) == null) throw new IllegalArgumentException("Unknown rule: " + key);
            severities.put(key, Severity.parse(assignment.substring(eq + 1)));
        }

        static Severity parseFailOn(String v) {
            if ("never".equalsIgnoreCase(v.trim())) return null;
            return Severity.parse(v);
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
            String s = v.trim().toLowerCase(Locale.ROOT);
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            System.out.println(
                    "mapping-lint\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar mapping-lint.jar --input <snapshot.json> [--output <dir|file.json>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --input <path>         Mapping snapshot JSON (required; a bare path also works)\n" +
                    "  --output <path>        Output folder for findings.json, or a .json file (default: ./output)\n" +
                    "  --report <path>        Markdown report path (default: report.md next to the findings)\n" +
                    "  --disable <rules>      Comma-separated rule ids or names to skip (repeatable).\n" +
                    "                         Also supports --disable=<rules>.\n" +
                    "  --severity <rule>=<level>  Report a rule as error | warning | info (repeatable)\n" +
                    "  --no-performance       Skip the expression hazard rules (ML031-ML034)\n" +
                    "  --required-non-null <bool>  Treat non-nullable reference members as required.\n" +
                    "                         Default: false.\n" +
                    "  --accessors <style>    How fixes read source members: getter | field (default: getter)\n" +
                    "  --source-param <name>  Lambda parameter name used in fixes (default: src)\n" +
                    "  --no-fixes             Do not compute fixes\n" +
                    "  --parallel <bool>      Analyze declarations in parallel. Default: false.\n" +
                    "  --fail-on <level>      Exit with code 3 when findings at or above the level exist:\n" +
                    "                         error | warning | info | never (default: never)\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/mapping-lint.jar --input mappings.json --output out\n" +
                    "  java -jar target/mapping-lint.jar mappings.json --disable ML050 --fail-on error\n"
            );
        }
    }
}
