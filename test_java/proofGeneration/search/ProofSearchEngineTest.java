package proofGeneration.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import proofGeneration.Heuristics;
import proofGeneration.proof.Justification;
import proofGeneration.proof.Proof;
import proofGeneration.proof.ProofLine;
import proofGeneration.proof.ProofValidator;
import prop.formula.Formula;
import prop.parser.Parser;
import truthTable.Semantics;

class ProofSearchEngineTest {
    private static final Parser PARSER = new Parser();
    private final ProofValidator validator = new ProofValidator();

    private static List<Formula> parseAll(List<String> texts) {
        List<Formula> out = new ArrayList<>();
        for (String text : texts) {
            out.add(PARSER.parse(text));
        }
        return out;
    }

    @Test
    void modusPonensInThreeLines() {
        try (ProofSearchEngine engine = new ProofSearchEngine()) {
            Proof proof = engine.derive(parseAll(List.of("P", "P -> Q")), PARSER.parse("Q"), SearchLimits.DEFAULT);
            assertEquals(3, proof.size());
            assertTrue(proof.line(1).isPremise());
            assertTrue(proof.line(2).isPremise());
            ProofLine last = proof.line(3);
            assertEquals(PARSER.parse("Q"), last.formula());
            assertEquals(new Justification.ByRule("Modus Ponens", List.of(2, 1)), last.justification());
            assertTrue(validator.validate(proof).isValid());
        }
    }

    static Stream<Arguments> derivable() {
        return Stream.of(
                Arguments.of(List.of("P & Q"), "Q"),
                Arguments.of(List.of("P", "Q"), "P & Q"),
                Arguments.of(List.of("P | Q", "!P"), "Q"),
                Arguments.of(List.of("P -> Q", "!Q"), "!P"),
                Arguments.of(List.of("P -> Q", "Q -> R"), "P -> R"),
                Arguments.of(List.of("P -> Q", "Q -> R", "P"), "R"),
                Arguments.of(List.of("P"), "P | Q"),
                Arguments.of(List.of("!(P & Q)"), "!P | !Q"),
                Arguments.of(List.of("P -> Q", "R -> S", "P | R"), "Q | S"),
                Arguments.of(List.of("P & Q", "P -> R"), "R & Q"),
                Arguments.of(List.of("P <-> Q", "Q"), "P"));
    }

    @ParameterizedTest(name = "{0} ⊢ {1}")
    @MethodSource("derivable")
    void foundProofsValidate(List<String> premises, String goal) {
        try (ProofSearchEngine engine = new ProofSearchEngine()) {
            Proof proof = engine.derive(parseAll(premises), PARSER.parse(goal), SearchLimits.DEFAULT);
            assertTrue(validator.validate(proof).isValid(), proof::toString);
            assertTrue(new Semantics().entails(proof.getPremises(), proof.getGoal()));
        }
    }

    @Test
    void premisesComeFirstAndGoalPremiseLast() {
        try (ProofSearchEngine engine = new ProofSearchEngine()) {
            Proof proof = engine.derive(parseAll(List.of("Q", "P", "R", "P")), PARSER.parse("Q"), SearchLimits.DEFAULT);
            assertEquals(List.of(PARSER.parse("P"), PARSER.parse("R"), PARSER.parse("Q")),
                    proof.getLines().stream().map(ProofLine::formula).toList());
            assertTrue(validator.validate(proof).isValid());
        }
    }

    @Test
    void underivableGoalExhaustsTheSearch() {
        try (ProofSearchEngine engine = new ProofSearchEngine()) {
            NoProofFoundException e = assertThrows(NoProofFoundException.class,
                    () -> engine.derive(parseAll(List.of("P")), PARSER.parse("Q"), new SearchLimits(5, 50, 0, null)));
            assertEquals(NoProofFoundException.Reason.SEARCH_EXHAUSTED, e.getReason());
            assertTrue(e.getRuleApplications() <= 5);
        }
    }

    @Test
    void knownSetLimitStopsTheSearch() {
        try (ProofSearchEngine engine = new ProofSearchEngine()) {
            NoProofFoundException e = assertThrows(NoProofFoundException.class,
                    () -> engine.derive(parseAll(List.of("P", "Q")), PARSER.parse("R"),
                            SearchLimits.DEFAULT.withMaxKnownSetSize(4)));
            assertEquals(NoProofFoundException.Reason.SEARCH_EXHAUSTED, e.getReason());
            assertTrue(e.getKnownFormulas() <= 4);
        }
    }

    @Test
    void cancelledTokenStopsTheSearch() {
        CancellationToken token = CancellationToken.none();
        token.cancel();
        try (ProofSearchEngine engine = new ProofSearchEngine()) {
            NoProofFoundException e = assertThrows(NoProofFoundException.class,
                    () -> engine.derive(parseAll(List.of("P -> Q", "Q -> R")), PARSER.parse("R"),
                            SearchLimits.DEFAULT, token));
            assertEquals(NoProofFoundException.Reason.CANCELLED, e.getReason());
        }
    }

    @Test
    void passedDeadlineStopsTheSearch() {
        SearchLimits limits = SearchLimits.DEFAULT.withDeadline(Instant.now().minusSeconds(1));
        try (ProofSearchEngine engine = new ProofSearchEngine()) {
            NoProofFoundException e = assertThrows(NoProofFoundException.class,
                    () -> engine.derive(parseAll(List.of("P")), PARSER.parse("Q"), limits));
            assertEquals(NoProofFoundException.Reason.DEADLINE_EXCEEDED, e.getReason());
        }
    }

    @Test
    void goalAmongPremisesNeedsNoRule() {
        try (ProofSearchEngine engine = new ProofSearchEngine()) {
            Proof proof = engine.derive(parseAll(List.of("P")), PARSER.parse("P"), SearchLimits.DEFAULT);
            assertEquals(1, proof.size());
            assertTrue(validator.validate(proof).isValid());
        }
    }

    @Test
    void workerPoolFindsTheSameKindOfProof() {
        try (ProofSearchEngine engine = new ProofSearchEngine(new Heuristics.BreadthFirst(), 4)) {
            Proof proof = engine.derive(parseAll(List.of("P -> Q", "P", "S & T")), PARSER.parse("Q"),
                    SearchLimits.DEFAULT);
            assertTrue(validator.validate(proof).isValid(), proof::toString);
        }
        List<Formula> premises = parseAll(List.of("P -> Q", "Q -> R", "P", "S & T"));
        Formula goal = PARSER.parse("R & S");
        try (ProofSearchEngine engine = new ProofSearchEngine(new Heuristics.GoalDistance(), 3)) {
            Proof first = engine.derive(premises, goal, SearchLimits.DEFAULT);
            Proof second = engine.derive(premises, goal, SearchLimits.DEFAULT);
            assertEquals(first.getLines(), second.getLines());
        }
    }

    @Test
    void limitsRejectNonsense() {
        assertThrows(IllegalArgumentException.class, () -> new SearchLimits(-1, 10, 0, null));
        assertThrows(IllegalArgumentException.class, () -> new SearchLimits(10, 0, 0, null));
        assertEquals(10, SearchLimits.DEFAULT.effectiveMaxFormulaSize(parseAll(List.of("P -> Q")), PARSER.parse("Q")));
        assertEquals(7, SearchLimits.DEFAULT.withMaxFormulaSize(7).effectiveMaxFormulaSize(List.of(), PARSER.parse("Q")));
    }
}
