package proofGeneration.proof;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import prop.parser.FormulaSyntaxException;
import prop.parser.Parser;

class ProofScriptTest {
    private final Parser parser = new Parser();
    private final ProofScript script = new ProofScript(parser);

    @Test
    void readsPremisesGoalAndLines() {
        Proof proof = script.read(String.join("\n",
                "# hypothetical syllogism, then modus ponens",
                "premise: P -> Q",
                "premise: Q -> R",
                "premise: P",
                "goal: R",
                "",
                "1. P -> Q ; Premise",
                "2. Q -> R ; Premise",
                "3. P ; Premise",
                "4. P -> R ; Hypothetical Syllogism 1, 2",
                "5. R ; MP 4,3"));
        assertEquals(List.of(parser.parse("P -> Q"), parser.parse("Q -> R"), parser.parse("P")), proof.getPremises());
        assertEquals(parser.parse("R"), proof.getGoal());
        assertEquals(5, proof.size());
        assertEquals(new Justification.ByRule("Hypothetical Syllogism", List.of(1, 2)), proof.line(4).justification());
        assertEquals(new Justification.ByRule("MP", List.of(4, 3)), proof.line(5).justification());
        assertTrue(new ProofValidator().validate(proof).isValid());
    }

    @Test
    void ruleNamesMayEndInDigits() {
        Proof proof = script.read(String.join("\n",
                "premise: !(A & B)",
                "goal: !A | !B",
                "1. !(A & B) ; premise",
                "2. !A | !B ; De Morgan's Law 1 1"));
        assertEquals(new Justification.ByRule("De Morgan's Law 1", List.of(1)), proof.line(2).justification());
        assertTrue(new ProofValidator().validate(proof).isValid());
    }

    @Test
    void missingGoalIsReported() {
        ProofScriptException e = assertThrows(ProofScriptException.class,
                () -> script.read("premise: P\n1. P ; Premise\n"));
        assertEquals(2, e.getScriptLine());
    }

    @Test
    void malformedLinesAreReportedWithTheirLineNumber() {
        ProofScriptException layout = assertThrows(ProofScriptException.class,
                () -> script.read("goal: P\nP because I said so\n"));
        assertEquals(2, layout.getScriptLine());

        ProofScriptException formula = assertThrows(ProofScriptException.class,
                () -> script.read("goal: P\n\n1. P & ; Premise\n"));
        assertEquals(3, formula.getScriptLine());
        assertInstanceOf(FormulaSyntaxException.class, formula.getCause());

        assertThrows(ProofScriptException.class, () -> script.read("goal: P\ngoal: Q\n"));
        assertThrows(ProofScriptException.class, () -> script.read("goal: P\n1. P ;\n"));
    }
}
