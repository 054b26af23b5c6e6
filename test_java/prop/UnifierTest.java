package prop;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import prop.formula.Formula;
import prop.formula.Variable;
import prop.parser.Parser;

class UnifierTest {
    private final Parser parser = new Parser();

    @Test
    void patternVariablesBindWholeSubformulas() {
        Optional<Substitution> theta = Unifier.match(parser.parse("p -> q"), parser.parse("(A & B) -> !C"));
        assertTrue(theta.isPresent());
        assertEquals(parser.parse("A & B"), theta.get().get(new Variable("p")).orElseThrow());
        assertEquals(parser.parse("!C"), theta.get().get(new Variable("q")).orElseThrow());
    }

    @Test
    void repeatedVariablesMustBindConsistently() {
        Formula pattern = parser.parse("p -> p & q");
        assertTrue(Unifier.match(pattern, parser.parse("A -> A & B")).isPresent());
        assertFalse(Unifier.match(pattern, parser.parse("A -> B & B")).isPresent());
    }

    @Test
    void connectivesMustAgree() {
        assertFalse(Unifier.match(parser.parse("p & q"), parser.parse("A | B")).isPresent());
        assertFalse(Unifier.match(parser.parse("!p"), parser.parse("A")).isPresent());
    }

    @Test
    void givenSubstitutionIsNotModified() {
        Substitution theta = new Substitution();
        theta.put(new Variable("p"), parser.parse("A"));
        Optional<Substitution> extended = Unifier.match(parser.parse("q"), parser.parse("B"), theta);
        assertTrue(extended.isPresent());
        assertTrue(extended.get().isBound(new Variable("q")));
        assertFalse(theta.isBound(new Variable("q")));
    }
}
