package com.benchy.queryplan.tools;

import com.benchy.queryplan.PlanTranslator;
import com.benchy.queryplan.config.ParserOptions;
import com.benchy.queryplan.config.PlanFormat;
import com.benchy.queryplan.exception.PlanTranslationException;
import com.benchy.queryplan.operator.DBMSType;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line interface for translating a captured explain output.
 *
 * <p>Usage examples:
 * <pre>
 * # Translate a PostgreSQL plan
 * java -jar benchy-queryplan-tools.jar --dbms postgres --plan q1.json --query q1.sql
 *
 * # Translate a DuckDB profile to XML without cleaning
 * java -jar benchy-queryplan-tools.jar --dbms duckdb --plan q1.json --format xml --no-clean
 * </pre>
 */
public class PlanTranslatorCommandLine {

    private static final Logger logger = LoggerFactory.getLogger(PlanTranslatorCommandLine.class);

    static final String USAGE =
        "Query Plan Translator\n\n" +
        "Usage: java -jar benchy-queryplan-tools.jar [OPTIONS]\n\n" +
        "Options:\n" +
        "  --dbms NAME                    Vendor of the plan: umbra, hyper, postgres or duckdb\n" +
        "  --plan FILE                    File with the EXPLAIN ANALYZE JSON output\n" +
        "  --query FILE                   File with the query text - optional\n" +
        "  --format FORMAT                Format of the encoded tree: json (default) or xml\n" +
        "  --no-clean                     Encode the plan as parsed\n" +
        "  --duplicate-shared-pipelines   Copy shared pipelines below every scan\n" +
        "  --no-system-representation     Do not retain the native plan fragments\n" +
        "  --help                         Show this help message\n\n" +
        "Examples:\n" +
        "  java -jar benchy-queryplan-tools.jar --dbms postgres --plan q1.json --query q1.sql\n";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the tool.
     *
     * @return the process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineArgs parsedArgs;
        try {
            parsedArgs = parseArguments(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage() + "\n");
            err.println(USAGE);
            return 1;
        }

        if (parsedArgs.help) {
            out.println(USAGE);
            return 0;
        }

        if (parsedArgs.dbms == null || parsedArgs.planPath == null) {
            err.println("Error: --dbms and --plan are required\n");
            err.println(USAGE);
            return 1;
        }

        try {
            String explainJson = Files.readString(Path.of(parsedArgs.planPath), StandardCharsets.UTF_8);
            String query = parsedArgs.queryPath == null
                ? ""
                : Files.readString(Path.of(parsedArgs.queryPath), StandardCharsets.UTF_8);

            // flags override the system properties only where given
            ParserOptions.Builder options = ParserOptions.fromSystemProperties().toBuilder();
            if (parsedArgs.duplicateSharedPipelines) {
                options.duplicateSharedPipelines(true);
            }
            if (!parsedArgs.includeSystemRepresentation) {
                options.includeSystemRepresentation(false);
            }
            PlanTranslator translator = new PlanTranslator(options.build(), parsedArgs.format, parsedArgs.clean);
            out.println(translator.translate(parsedArgs.dbms, query, explainJson));
            return 0;

        } catch (IOException e) {
            err.println("Error: Cannot read input: " + e.getMessage());
            return 1;
        } catch (PlanTranslationException e) {
            logger.debug("Translation failed", e);
            err.println("Error: " + e.getUserMessage());
            return 1;
        }
    }

    /**
     * Parses command-line arguments.
     *
     * @throws IllegalArgumentException on an unknown vendor or format, or a missing option value
     */
    static CommandLineArgs parseArguments(String[] args) {
        CommandLineArgs result = new CommandLineArgs();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dbms":
                    result.dbms = DBMSType.parse(value(args, ++i, "--dbms"));
                    break;
                case "--plan":
                    result.planPath = value(args, ++i, "--plan");
                    break;
                case "--query":
                    result.queryPath = value(args, ++i, "--query");
                    break;
                case "--format":
                    result.format = PlanFormat.parse(value(args, ++i, "--format"));
                    break;
                case "--no-clean":
                    result.clean = false;
                    break;
                case "--duplicate-shared-pipelines":
                    result.duplicateSharedPipelines = true;
                    break;
                case "--no-system-representation":
                    result.includeSystemRepresentation = false;
                    break;
                case "--help":
                case "-h":
                    result.help = true;
                    break;
                default:
                    logger.warn("Unknown option: {}", args[i]);
            }
        }

        return result;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    /**
     * Container for parsed command-line arguments.
     */
    static class CommandLineArgs {
        DBMSType dbms = null;
        String planPath = null;
        String queryPath = null;
        PlanFormat format = PlanFormat.JSON;
        boolean clean = true;
        boolean duplicateSharedPipelines = false;
        boolean includeSystemRepresentation = true;
        boolean help = false;
    }
}
