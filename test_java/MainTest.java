import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsTruthTable() {
        assertEquals(0, Main.run(new String[] {"table", "P & !P"}, out));
        assertEquals("P | P ∧ ¬P\nT | F\nF | F\n", output());
    }

    @Test
    void classifiesEachFormula() {
        assertEquals(0, Main.run(new String[] {"classify", "P | !P", "P -> Q"}, out));
        assertEquals("P ∨ ¬P: TAUTOLOGY\nP → Q: CONTINGENT\n", output());
    }

    @Test
    void provesGoalFromPremises() {
        assertEquals(0, Main.run(new String[] {"prove", "--workers", "two", "Q", "P", "P -> Q"}, out));
        assertTrue(output().contains("3. Q (Modus Ponens [2, 1])"), output());
    }

    @Test
    void reportsWhenNoProofIsFound() {
        assertEquals(1, Main.run(new String[] {"prove", "--max-depth", "3", "Q", "P"}, out));
        assertTrue(output().contains("SEARCH_EXHAUSTED"), output());
    }

    @Test
    void outOfRangeLimitsFallBackToDefaults() {
        assertEquals(0, Main.run(new String[] {"prove", "--max-depth", "-1", "--workers", "0", "Q", "P", "P -> Q"}, out));
        assertTrue(output().contains("3. Q (Modus Ponens [2, 1])"), output());

        assertEquals(1, Main.run(new String[] {"prove", "--max-known", "0", "--timeout-ms", "-5", "Q", "P"}, out));
        assertTrue(output().contains("SEARCH_EXHAUSTED"), output());
    }

    @Test
    void validatesScriptFiles(@TempDir Path dir) throws IOException {
        Path good = dir.resolve("good.proof");
        Files.writeString(good, "premise: P\npremise: P -> Q\ngoal: Q\n1. P ; Premise\n2. P -> Q ; Premise\n3. Q ; MP 1,2\n");
        assertEquals(0, Main.run(new String[] {"validate", good.toString()}, out));
        assertEquals("Valid\n", output());

        Path bad = dir.resolve("bad.proof");
        Files.writeString(bad, "premise: P\ngoal: Q\n1. P ; Premise\n2. Q ; MP 1\n");
        assertEquals(1, Main.run(new String[] {"validate", bad.toString()}, out));
        assertTrue(output().contains("RULE_DOES_NOT_APPLY"), output());
    }

    @Test
    void listsTheRuleCatalog() {
        assertEquals(0, Main.run(new String[] {"rules"}, out));
        assertTrue(output().startsWith("Rule catalog version 1\n"), output());
        assertTrue(output().contains("MP     Modus Ponens: If P→Q and P are true, then Q is true\n"), output());
        assertTrue(output().contains("         p → q, p ⊢ q\n"), output());
    }

    @Test
    void badInputIsReported() {
        assertEquals(2, Main.run(new String[] {}, out));
        assertEquals(2, Main.run(new String[] {"frobnicate"}, out));
        assertEquals(2, Main.run(new String[] {"table", "P &"}, out));
        assertTrue(output().contains("Syntax error at position 3"), output());
    }
}
