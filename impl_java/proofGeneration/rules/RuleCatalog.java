package proofGeneration.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import prop.formula.Formula;
import prop.parser.Parser;

/**
 * The fixed catalog of inference rules. Rules are written as schemata over the pattern variables
 * p, q, r and s.
 * <p>
 * The catalog only grows: a new version may append rules but never changes the forms of an
 * existing name, so proofs checked against an older version stay valid.
 */
public final class RuleCatalog {

    public static final int VERSION = 1;

    private static final Parser PATTERNS = new Parser();

    public static final InferenceRule MODUS_PONENS = rule("Modus Ponens", "MP",
            "If P→Q and P are true, then Q is true",
            form("q", "p -> q", "p"));

    public static final InferenceRule MODUS_TOLLENS = rule("Modus Tollens", "MT",
            "If P→Q and ¬Q are true, then ¬P is true",
            form("!p", "p -> q", "!q"));

    public static final InferenceRule HYPOTHETICAL_SYLLOGISM = rule("Hypothetical Syllogism", "HS",
            "If P→Q and Q→R are true, then P→R is true",
            form("p -> r", "p -> q", "q -> r"));

    public static final InferenceRule DISJUNCTIVE_SYLLOGISM = rule("Disjunctive Syllogism", "DS",
            "If P∨Q and ¬P are true, then Q is true",
            form("q", "p | q", "!p"),
            form("p", "p | q", "!q"));

    public static final InferenceRule CONJUNCTION_INTRODUCTION = rule("Conjunction Introduction", "CI",
            "If P and Q are true, then P∧Q is true",
            form("p & q", "p", "q"));

    public static final InferenceRule CONJUNCTION_ELIMINATION = rule("Conjunction Elimination", "CE",
            "If P∧Q is true, then P and Q are each true individually",
            Set.of("Simplification", "SIMP"),
            form("p", "p & q"),
            form("q", "p & q"));

    public static final InferenceRule ADDITION = rule("Addition", "ADD",
            "If P is true, then P∨Q is true",
            Set.of("Disjunction Introduction"),
            form("p | q", "p"),
            form("q | p", "p"));

    public static final InferenceRule BICONDITIONAL_INTRODUCTION = rule("Biconditional Introduction", "BI",
            "If P→Q and Q→P are true, then P↔Q is true",
            form("p <-> q", "p -> q", "q -> p"));

    public static final InferenceRule BICONDITIONAL_ELIMINATION = rule("Biconditional Elimination", "BE",
            "If P↔Q is true, then P→Q and Q→P are true",
            form("p -> q", "p <-> q"),
            form("q -> p", "p <-> q"));

    public static final InferenceRule DOUBLE_NEGATION = rule("Double Negation", "DN",
            "¬¬P is equivalent to P",
            form("p", "!!p"),
            form("!!p", "p"));

    public static final InferenceRule DE_MORGAN_1 = rule("De Morgan's Law 1", "DML1",
            "¬(P∧Q) is equivalent to ¬P∨¬Q",
            form("!p | !q", "!(p & q)"),
            form("!(p & q)", "!p | !q"));

    public static final InferenceRule DE_MORGAN_2 = rule("De Morgan's Law 2", "DML2",
            "¬(P∨Q) is equivalent to ¬P∧¬Q",
            form("!p & !q", "!(p | q)"),
            form("!(p | q)", "!p & !q"));

    public static final InferenceRule TRANSPOSITION = rule("Transposition", "TRANS",
            "P→Q is equivalent to ¬Q→¬P",
            form("!q -> !p", "p -> q"),
            form("p -> q", "!q -> !p"));

    public static final InferenceRule IMPLICATION = rule("Implication", "IMPL",
            "P→Q is equivalent to ¬P∨Q",
            form("!p | q", "p -> q"),
            form("p -> q", "!p | q"));

    public static final InferenceRule EXPORTATION = rule("Exportation", "EXP",
            "P→(Q→R) is equivalent to (P∧Q)→R",
            form("p & q -> r", "p -> (q -> r)"),
            form("p -> (q -> r)", "p & q -> r"));

    public static final InferenceRule RESOLUTION = rule("Resolution", "RES",
            "If P∨Q and ¬P∨R are true, then Q∨R is true",
            form("q | r", "p | q", "!p | r"),
            form("q | r", "q | p", "!p | r"),
            form("q | r", "p | q", "r | !p"),
            form("q | r", "q | p", "r | !p"));

    public static final InferenceRule ABSORPTION = rule("Absorption", "ABS",
            "If P→Q is true, then P→(P∧Q) is true",
            form("p -> p & q", "p -> q"));

    public static final InferenceRule CONSTRUCTIVE_DILEMMA = rule("Constructive Dilemma", "CD",
            "If P→Q, R→S and P∨R are true, then Q∨S is true",
            form("q | s", "p -> q", "r -> s", "p | r"));

    private static final List<InferenceRule> RULES = List.of(
            MODUS_PONENS,
            MODUS_TOLLENS,
            HYPOTHETICAL_SYLLOGISM,
            DISJUNCTIVE_SYLLOGISM,
            CONJUNCTION_INTRODUCTION,
            CONJUNCTION_ELIMINATION,
            ADDITION,
            BICONDITIONAL_INTRODUCTION,
            BICONDITIONAL_ELIMINATION,
            DOUBLE_NEGATION,
            DE_MORGAN_1,
            DE_MORGAN_2,
            TRANSPOSITION,
            IMPLICATION,
            EXPORTATION,
            RESOLUTION,
            ABSORPTION,
            CONSTRUCTIVE_DILEMMA);

    private RuleCatalog() {
    }

    public static List<InferenceRule> all() {
        return RULES;
    }

    public static Optional<InferenceRule> lookup(String label) {
        if (label == null) return Optional.empty();
        return RULES.stream().filter(r -> r.isKnownAs(label)).findFirst();
    }

    private static InferenceRule rule(String name, String abbreviation, String description, RuleForm... forms) {
        return rule(name, abbreviation, description, Set.of(), forms);
    }

    private static InferenceRule rule(String name, String abbreviation, String description, Set<String> aliases,
            RuleForm... forms) {
        return new InferenceRule(name, abbreviation, description, Arrays.asList(forms), aliases);
    }

    private static RuleForm form(String conclusion, String... antecedents) {
        List<Formula> parsed = new ArrayList<>();
        for (String antecedent : antecedents) {
            parsed.add(PATTERNS.parse(antecedent));
        }
        return new RuleForm(parsed, PATTERNS.parse(conclusion));
    }
}
