package prop;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import proofGeneration.proof.Proof;
import proofGeneration.proof.ValidationResult;
import proofGeneration.search.CancellationToken;
import proofGeneration.search.NoProofFoundException;
import proofGeneration.search.SearchLimits;
import prop.formula.Formula;
import prop.parser.FormulaSyntaxException;
import truthTable.MixedVariableSetException;
import truthTable.Table;

class LogicEngineTest {
    private final LogicEngine engine = new LogicEngine();

    @Test
    void parseTabulateProveAndCheck() {
        Formula p = engine.parseFormula("P");
        Formula pq = engine.parseFormula("P -> Q");
        Formula q = engine.parseFormula("Q");

        Table table = engine.generateTruthTable(List.of(pq));
        assertEquals(List.of("P", "Q", "P → Q"), table.headers());

        Proof proof = engine.deriveProof(List.of(p, pq), q, SearchLimits.DEFAULT);
        assertEquals(3, proof.size());
        assertTrue(engine.validateProof(List.of(p, pq), q, proof.getLines()).isValid());
        assertTrue(engine.validateProof(proof).isValid());

        ValidationResult wrongGoal = engine.validateProof(List.of(p, pq), p, proof.getLines());
        assertFalse(wrongGoal.isValid());
    }

    @Test
    void failuresSurfaceAsLogicExceptions() {
        assertThrows(FormulaSyntaxException.class, () -> engine.parseFormula("P & (Q"));
        LogicException mixed = assertThrows(MixedVariableSetException.class, () -> engine.generateTruthTable(
                List.of(engine.parseFormula("P"), engine.parseFormula("Q")), true));
        assertTrue(mixed.getMessage().contains("Q"));

        CancellationToken token = CancellationToken.none();
        token.cancel();
        NoProofFoundException e = assertThrows(NoProofFoundException.class, () -> engine.deriveProof(
                List.of(engine.parseFormula("P")), engine.parseFormula("Q"), SearchLimits.DEFAULT, token));
        assertEquals(NoProofFoundException.Reason.CANCELLED, e.getReason());
    }
}
