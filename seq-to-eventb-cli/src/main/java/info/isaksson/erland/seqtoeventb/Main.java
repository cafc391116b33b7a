package info.isaksson.erland.seqtoeventb;

import info.isaksson.erland.seqtoeventb.advisor.AdvisorOptions;
import info.isaksson.erland.seqtoeventb.advisor.Advisories;
import info.isaksson.erland.seqtoeventb.advisor.AdvisoryRequest;
import info.isaksson.erland.seqtoeventb.advisor.AdvisoryResult;
import info.isaksson.erland.seqtoeventb.advisor.LangChainPropertyAdvisor;
import info.isaksson.erland.seqtoeventb.core.SeqToEventBOptions;
import info.isaksson.erland.seqtoeventb.core.SeqToEventBResult;
import info.isaksson.erland.seqtoeventb.core.SeqToEventBService;
import info.isaksson.erland.seqtoeventb.extract.ExtractionWarning;
import info.isaksson.erland.seqtoeventb.io.DecodeException;
import info.isaksson.erland.seqtoeventb.ir.IrInteraction;
import info.isaksson.erland.seqtoeventb.ir.IrJson;
import info.isaksson.erland.seqtoeventb.report.ReportWriter;
import info.isaksson.erland.seqtoeventb.rodin.RodinBundleWriter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI entrypoint: compiles a draw.io sequence diagram (or a previously written IR file) into an
 * Event-B context and machine.
 */
public final class Main {

    private static final SeqToEventBService SERVICE = new SeqToEventBService();

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

        if (parsed.ir == null && parsed.input == null) {
            System.err.println("Error: --input (or --ir) is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }
        if (parsed.ir != null && parsed.input != null) {
            System.err.println("Error: use either --input or --ir, not both.");
            return 1;
        }

        final boolean irMode = parsed.ir != null;
        final Path inputPath = Paths.get(irMode ? parsed.ir : parsed.input).toAbsolutePath().normalize();
        if (!Files.exists(inputPath) || Files.isDirectory(inputPath)) {
            System.err.println("Error: " + (irMode ? "--ir" : "--input") + " must point to an existing file: " + inputPath);
            return 1;
        }

        SeqToEventBOptions opts = toCoreOptions(parsed);
        final SeqToEventBResult res;
        if (irMode) {
            final IrInteraction interaction;
            try {
                interaction = IrJson.read(inputPath);
            } catch (IOException e) {
                System.err.println("Error: could not read IR JSON: " + inputPath);
                System.err.println(e.getMessage());
                return 2;
            }
            res = SERVICE.compileInteraction(interaction, opts);
        } else {
            try {
                res = SERVICE.compileDiagram(inputPath, opts);
            } catch (DecodeException e) {
                System.err.println("Error: not a readable diagram: " + inputPath);
                System.err.println(e.getMessage());
                return 2;
            } catch (IOException e) {
                System.err.println("Error: could not read diagram: " + inputPath);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        for (ExtractionWarning w : res.warnings) {
            System.err.println("Warning: " + w);
        }

        final Path eventBOut = resolveEventBOutput(parsed.output, res.formalModel.machineName);
        try {
            Files.createDirectories(eventBOut.getParent());
            Files.writeString(eventBOut, res.eventBText);
        } catch (IOException e) {
            System.err.println("Error: could not write Event-B to: " + eventBOut);
            System.err.println(e.getMessage());
            return 2;
        }

        Path bundleOut = null;
        if (parsed.bundle != null) {
            bundleOut = Paths.get(parsed.bundle).toAbsolutePath().normalize();
            try {
                Files.createDirectories(bundleOut.getParent());
                RodinBundleWriter.write(res.formalModel, bundleOut);
            } catch (IOException e) {
                System.err.println("Error: could not write Rodin bundle to: " + bundleOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        Path irOut = null;
        if (parsed.writeIr != null) {
            irOut = resolveIrOutput(parsed.writeIr, res.interaction.baseName);
            try {
                Files.createDirectories(irOut.getParent());
                IrJson.write(res.interaction, irOut);
            } catch (IOException e) {
                System.err.println("Error: could not write IR to: " + irOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        // Advisory output never changes the exit code.
        AdvisoryResult advisory = null;
        if (parsed.advise) {
            advisory = advise(parsed, res);
            if (!advisory.ok) {
                System.err.println(advisory.display());
            }
        }

        Path reportOut = null;
        if (parsed.report != null) {
            reportOut = Paths.get(parsed.report).toAbsolutePath().normalize();
            try {
                ReportWriter.writeMarkdown(reportOut, inputPath, eventBOut, res, advisory);
            } catch (IOException e) {
                System.err.println("Error: could not write report to: " + reportOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        System.out.println(
                "seq-to-eventb" + (irMode ? " (IR mode)" : "") + "\n" +
                "- Input: " + inputPath + "\n" +
                "- Event-B: " + eventBOut + "\n" +
                (bundleOut != null ? "- Rodin bundle: " + bundleOut + "\n" : "") +
                (irOut != null ? "- IR: " + irOut + "\n" : "") +
                (reportOut != null ? "- Report: " + reportOut + "\n" : "") +
                "- Machine: " + res.formalModel.machineName + "\n" +
                "- Participants: " + res.formalModel.participants.size() + "\n" +
                "- Message flows: " + res.interaction.flows.size() + "\n" +
                "- Guard variables: " + res.interaction.guardVariables.size() + "\n" +
                "- Warnings: " + res.warnings.size()
        );
        if (advisory != null && advisory.ok) {
            System.out.println();
            System.out.println("Suggested properties:");
            System.out.println(advisory.text);
        }
        return 0;
    }

    private static SeqToEventBOptions toCoreOptions(CliArgs parsed) {
        SeqToEventBOptions o = new SeqToEventBOptions();
        o.machineVersion = parsed.version;
        o.modelName = parsed.name;
        if (parsed.lifelineThreshold != null) o.lifelineDistanceThreshold = parsed.lifelineThreshold;
        if (parsed.guardTolerance != null) o.guardLabelTolerance = parsed.guardTolerance;
        return o;
    }

    private static AdvisoryResult advise(CliArgs parsed, SeqToEventBResult res) {
        AdvisorOptions options = AdvisorOptions.fromEnvironment();
        if (parsed.advisorModel != null) options.modelName = parsed.advisorModel;
        if (parsed.advisorBaseUrl != null) options.baseUrl = parsed.advisorBaseUrl;
        if (!options.hasApiKey()) {
            return AdvisoryResult.failed("no API key; set " + AdvisorOptions.API_KEY_ENV);
        }
        try {
            return Advisories.run(LangChainPropertyAdvisor.openAi(options), AdvisoryRequest.from(res.interaction));
        } catch (RuntimeException e) {
            return AdvisoryResult.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    static Path resolveEventBOutput(String outputArg, String machineName) {
        // A path ending with .eventb is the file itself; anything else is a directory.
        if (outputArg != null && outputArg.toLowerCase().endsWith(".eventb")) {
            return Paths.get(outputArg).toAbsolutePath().normalize();
        }
        String dir = (outputArg == null || outputArg.isBlank()) ? "./output" : outputArg;
        return Paths.get(dir).toAbsolutePath().normalize().resolve(machineName + ".eventb");
    }

    static Path resolveIrOutput(String irArg, String baseName) {
        if (irArg.toLowerCase().endsWith(".json")) {
            return Paths.get(irArg).toAbsolutePath().normalize();
        }
        return Paths.get(irArg).toAbsolutePath().normalize().resolve(baseName + ".ir.json");
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String input;
        String output = "./output";
        String report;
        String bundle;

        // IR mode
        String ir;
        String writeIr;

        int version = 1;
        String name;
        Double lifelineThreshold;
        Double guardTolerance;

        boolean advise = false;
        String advisorModel;
        String advisorBaseUrl;

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
                    case "--input":
                        out.input = requireValue(args, ++i, "--input");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--bundle":
                        out.bundle = requireValue(args, ++i, "--bundle");
                        break;
                    case "--ir":
                        out.ir = requireValue(args, ++i, "--ir");
                        break;
                    case "--write-ir":
                        out.writeIr = requireValue(args, ++i, "--write-ir");
                        break;
                    case "--version":
                        out.version = parsePositiveInt(requireValue(args, ++i, "--version"), "--version");
                        break;
                    case "--name":
                        out.name = requireValue(args, ++i, "--name");
                        break;
                    case "--lifeline-threshold":
                        out.lifelineThreshold = parsePositiveDouble(requireValue(args, ++i, "--lifeline-threshold"), "--lifeline-threshold");
                        break;
                    case "--guard-tolerance":
                        out.guardTolerance = parsePositiveDouble(requireValue(args, ++i, "--guard-tolerance"), "--guard-tolerance");
                        break;
                    case "--advise":
                        out.advise = true;
                        break;
                    case "--advisor-model":
                        out.advisorModel = requireValue(args, ++i, "--advisor-model");
                        break;
                    case "--advisor-base-url":
                        out.advisorBaseUrl = requireValue(args, ++i, "--advisor-base-url");
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

        static int parsePositiveInt(String v, String flag) {
            try {
                int n = Integer.parseInt(v.trim());
                if (n < 1) throw new IllegalArgumentException(flag + " must be positive: " + v);
                return n;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + flag + ": " + v, e);
            }
        }

        static double parsePositiveDouble(String v, String flag) {
            try {
                double d = Double.parseDouble(v.trim());
                if (!(d > 0) || Double.isInfinite(d)) throw new IllegalArgumentException(flag + " must be positive: " + v);
                return d;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v, e);
            }
        }

        static void printHelp() {
            System.out.println(
                    "seq-to-eventb\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar seq-to-eventb.jar --input <diagram.drawio> [--output <dir|file.eventb>] [options]\n" +
                    "  java -jar seq-to-eventb.jar --ir <interaction.ir.json> [--output <dir|file.eventb>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --input <path>             draw.io sequence diagram (.drawio or .xml)\n" +
                    "  --ir <file.json>           Compile a previously written IR file instead of a diagram\n" +
                    "  --output <path>            Output folder or .eventb file (default: ./output)\n" +
                    "  --write-ir <dir|file.json> Also write the extracted interaction as IR JSON\n" +
                    "  --bundle <file.zip>        Also write a Rodin project bundle\n" +
                    "  --report <file.md>         Write a markdown report\n" +
                    "  --version <n>              Machine version suffix (default: 1)\n" +
                    "  --name <name>              Override the base name taken from the diagram\n" +
                    "  --lifeline-threshold <px>  Max horizontal distance from a floating endpoint to a lifeline\n" +
                    "                             (default: 150)\n" +
                    "  --guard-tolerance <px>     How far above a frame a floating guard label may sit (default: 40)\n" +
                    "  --advise                   Ask a chat model for candidate properties. Needs " + AdvisorOptions.API_KEY_ENV + ".\n" +
                    "                             Failures are reported but never fail the run.\n" +
                    "  --advisor-model <name>     Chat model name (default: gpt-4o-mini)\n" +
                    "  --advisor-base-url <url>   OpenAI-compatible endpoint (default: https://api.openai.com/v1)\n" +
                    "  -h, --help                 Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/seq-to-eventb.jar --input login.drawio --output out\n" +
                    "  java -jar target/seq-to-eventb.jar login.drawio --write-ir out --report out/report.md\n" +
                    "  java -jar target/seq-to-eventb.jar --ir out/Login.ir.json --version 2 --bundle out/login.zip\n"
            );
        }
    }
}
