package com.modeldoc.tools;

import com.modeldoc.Version;
import com.modeldoc.loader.GrammarMismatchException;
import com.modeldoc.loader.LoaderException;
import com.modeldoc.loader.LoaderMessage;
import com.modeldoc.loader.ModelAstBuilder;
import com.modeldoc.model.Model;
import com.modeldoc.pipeline.ModelDocPipeline;
import com.modeldoc.pipeline.PipelineOptions;
import com.modeldoc.pipeline.PipelineResult;
import com.modeldoc.render.html.HtmlModelRenderer;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Command-line front end: builds the HTML documentation of a TROLL model file. */
public final class ModelDocCli {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String VERBOSE_PROPERTY = "modeldoc.verbose";
    private static final String VERBOSE_ENV = "MODELDOC_VERBOSE";

    // Held so the verbose configuration is not lost when the logger is garbage collected.
    private static final Logger MODELDOC_LOGGER = Logger.getLogger("com.modeldoc");

    private static final String USAGE =
            String.join(
                    System.lineSeparator(),
                    "Creates a html documentation for a model described in a TROLL input file.",
                    "Usage:",
                    "    modeldoc -i <troll_input_file.inp> -o <documentation_file.html>"
                            + " [-p <param_file.csv>] [-l <legend_file.csv>] [-v]",
                    "",
                    "    -i, --input       TROLL input file (mandatory)",
                    "    -o, --output      html output file (mandatory)",
                    "    -p, --paramfile   parameter values, key;value per line (optional)",
                    "    -l, --legendfile  equation legends, key;value per line (optional)",
                    "    -v, --verbose     prints debug information",
                    "    -h, --help        prints this message");

    private ModelDocCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, Clock.systemDefaultZone()));
    }

    static int run(String[] args, PrintStream out, PrintStream err, Clock clock) {
        PipelineOptions.Builder builder = PipelineOptions.builder();
        Path input = null;
        Path output = null;
        Boolean verbose = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String value = null;
            int equals = arg.indexOf('=');
            if (arg.startsWith("--") && equals > 0) {
                value = arg.substring(equals + 1);
                arg = arg.substring(0, equals);
            }
            switch (arg) {
                case "-h":
                case "--help":
                    out.println(USAGE);
                    return EXIT_OK;
                case "-v":
                case "--verbose":
                    verbose = Boolean.TRUE;
                    break;
                case "-i":
                case "--input":
                case "-o":
                case "--output":
                case "-p":
                case "--paramfile":
                case "-l":
                case "--legendfile":
                    if (value == null) {
                        if (i + 1 >= args.length) {
                            err.println("option " + arg + " requires argument");
                            err.println(USAGE);
                            return EXIT_USAGE;
                        }
                        value = args[++i];
                    }
                    Path path = Path.of(value);
                    if (arg.equals("-i") || arg.equals("--input")) {
                        input = path;
                    } else if (arg.equals("-o") || arg.equals("--output")) {
                        output = path;
                    } else if (arg.equals("-p") || arg.equals("--paramfile")) {
                        builder.parameterTable(path);
                    } else {
                        builder.legendTable(path);
                    }
                    break;
                default:
                    err.println("option " + arg + " not recognized");
                    err.println(USAGE);
                    return EXIT_USAGE;
            }
        }
        if (input == null || output == null) {
            err.println("Missing argument");
            err.println(USAGE);
            return EXIT_USAGE;
        }
        boolean verboseMode = verbose != null ? verbose : verboseFromEnvironment();
        if (verboseMode) {
            enableVerboseLogging();
            err.println("modeldoc " + Version.RUNTIME);
        }
        PipelineOptions options = builder.input(input).output(output).build();

        ModelDocPipeline pipeline = new ModelDocPipeline(new ModelAstBuilder(), new HtmlModelRenderer(), clock);
        PipelineResult result;
        try {
            result = pipeline.run(options);
        } catch (GrammarMismatchException ex) {
            err.println("No equation found in file: " + options.getInput());
            for (String diagnostic : ex.getDiagnostics()) {
                err.println("  " + diagnostic);
            }
            return EXIT_FAILURE;
        } catch (LoaderException ex) {
            err.println(ex.getMessage());
            return EXIT_FAILURE;
        }
        for (LoaderMessage message : result.getMessages()) {
            if (message.getLevel() != LoaderMessage.Level.INFO || verboseMode) {
                err.println(message);
            }
        }
        Model model = result.getDocument().getModel();
        out.println(
                model.getEquationCount() + " equations found in " + model.getRegions().size() + " regions.");
        out.println("Done. Output in file " + result.getOutput() + ".");
        return EXIT_OK;
    }

    /** Verbose default when no flag is given: system property, then environment. */
    private static boolean verboseFromEnvironment() {
        String value = System.getProperty(VERBOSE_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(VERBOSE_ENV));
    }

    private static void enableVerboseLogging() {
        Logger logger = MODELDOC_LOGGER;
        logger.setLevel(Level.FINE);
        boolean hasConsole = false;
        for (Handler handler : logger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(Level.FINE);
                hasConsole = true;
            }
        }
        if (!hasConsole) {
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            logger.addHandler(handler);
            logger.setUseParentHandlers(false);
        }
    }
}
