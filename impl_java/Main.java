import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proofGeneration.Heuristics;
import proofGeneration.proof.Proof;
import proofGeneration.proof.ProofScript;
import proofGeneration.proof.ValidationResult;
import proofGeneration.rules.InferenceRule;
import proofGeneration.rules.RuleCatalog;
import proofGeneration.rules.RuleForm;
import proofGeneration.search.NoProofFoundException;
import proofGeneration.search.ProofSearchEngine;
import proofGeneration.search.SearchLimits;
import prop.LogicEngine;
import prop.LogicException;
import prop.formula.Formula;
import prop.parser.Parser;
import truthTable.Semantics;
import truthTable.TruthTableGenerator;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String USAGE = String.join("\n",
            "usage:",
            "  table    <formula>...",
            "  classify <formula>...",
            "  prove    [--max-depth n] [--max-known n] [--timeout-ms n] [--workers n] <goal> [premise...]",
            "  validate <script file>",
            "  rules");

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return the process exit status: 0 on success, 1 when no proof or an invalid proof, 2 on bad input
     */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println(USAGE);
            return 2;
        }
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            switch (args[0]) {
                case "table":
                    return table(rest, out);
                case "classify":
                    return classify(rest, out);
                case "prove":
                    return prove(rest, out);
                case "validate":
                    return validate(rest, out);
                case "rules":
                    return rules(out);
                default:
                    logger.warn("Unknown command '{}'", args[0]);
                    out.println(USAGE);
                    return 2;
            }
        } catch (LogicException e) {
            out.println(e.getMessage());
            return 2;
        }
    }

    private static int table(List<String> args, PrintStream out) {
        if (args.isEmpty()) {
            out.println(USAGE);
            return 2;
        }
        LogicEngine engine = new LogicEngine();
        out.print(engine.generateTruthTable(parseAll(engine, args)));
        return 0;
    }

    private static int classify(List<String> args, PrintStream out) {
        if (args.isEmpty()) {
            out.println(USAGE);
            return 2;
        }
        LogicEngine engine = new LogicEngine();
        Semantics semantics = new Semantics(new TruthTableGenerator());
        for (Formula formula : parseAll(engine, args)) {
            out.println(formula.toCanonicalString() + ": " + semantics.classify(formula));
        }
        return 0;
    }

    private static int prove(List<String> args, PrintStream out) {
        SearchLimits limits = SearchLimits.DEFAULT;
        int workers = 1;
        long timeoutMs = 0;
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (!arg.startsWith("--")) {
                positional.add(arg);
                continue;
            }
            if (i + 1 >= args.size()) {
                logger.warn("Option {} needs a value, ignoring it", arg);
                continue;
            }
            String value = args.get(++i);
            switch (arg) {
                case "--max-depth":
                    limits = limits.withMaxDepth(number(arg, value, 0, limits.maxDepth()));
                    break;
                case "--max-known":
                    limits = limits.withMaxKnownSetSize(number(arg, value, 1, limits.maxKnownSetSize()));
                    break;
                case "--timeout-ms":
                    timeoutMs = number(arg, value, 0, 0);
                    break;
                case "--workers":
                    workers = number(arg, value, 1, 1);
                    break;
                default:
                    logger.warn("Unknown option {}, ignoring it", arg);
            }
        }
        if (positional.isEmpty()) {
            out.println(USAGE);
            return 2;
        }
        if (timeoutMs > 0) {
            limits = limits.withTimeout(Duration.ofMillis(timeoutMs));
        }
        final int poolSize = workers;
        LogicEngine engine = new LogicEngine(new Parser(), new TruthTableGenerator(),
                () -> new ProofSearchEngine(new Heuristics.GoalDistance(), poolSize));
        List<Formula> formulas = parseAll(engine, positional);
        Formula goal = formulas.get(0);
        List<Formula> premises = formulas.subList(1, formulas.size());
        try {
            Proof proof = engine.deriveProof(premises, goal, limits);
            out.print(proof);
            return 0;
        } catch (NoProofFoundException e) {
            out.println(e.getMessage());
            return 1;
        }
    }

    private static int validate(List<String> args, PrintStream out) {
        if (args.size() != 1) {
            out.println(USAGE);
            return 2;
        }
        Proof proof;
        try (Reader reader = Files.newBufferedReader(Path.of(args.get(0)), StandardCharsets.UTF_8)) {
            proof = new ProofScript().read(reader);
        } catch (IOException e) {
            out.println("Could not read " + args.get(0) + ": " + e.getMessage());
            return 2;
        }
        ValidationResult result = new LogicEngine().validateProof(proof);
        out.println(result);
        return result.isValid() ? 0 : 1;
    }

    private static int rules(PrintStream out) {
        out.println("Rule catalog version " + RuleCatalog.VERSION);
        for (InferenceRule rule : RuleCatalog.all()) {
            out.println(String.format("%-6s %s: %s", rule.getAbbreviation(), rule.getName(), rule.getDescription()));
            for (RuleForm form : rule.getForms()) {
                out.println("         " + form);
            }
        }
        return 0;
    }

    private static List<Formula> parseAll(LogicEngine engine, List<String> texts) {
        List<Formula> formulas = new ArrayList<>();
        for (String text : texts) {
            formulas.add(engine.parseFormula(text));
        }
        return formulas;
    }

    private static int number(String option, String value, int min, int fallback) {
        int n;
        try {
            n = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("{} must be an integer but was '{}'. Using default of {}.", option, value, fallback);
            return fallback;
        }
        if (n < min) {
            logger.warn("{} must be at least {} but was {}. Using default of {}.", option, min, n, fallback);
            return fallback;
        }
        return n;
    }
}
