package truthTable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import prop.formula.Assignment;
import prop.parser.Parser;

class SemanticsTest {
    private final Parser parser = new Parser();
    private final Semantics semantics = new Semantics();

    @Test
    void classifiesFormulas() {
        assertEquals(Semantics.Classification.TAUTOLOGY, semantics.classify(parser.parse("P | !P")));
        assertEquals(Semantics.Classification.CONTRADICTION, semantics.classify(parser.parse("P & !P")));
        assertEquals(Semantics.Classification.CONTINGENT, semantics.classify(parser.parse("P -> Q")));
    }

    @Test
    void equivalenceComparesColumns() {
        assertTrue(semantics.equivalent(parser.parse("P -> Q"), parser.parse("!P | Q")));
        assertTrue(semantics.equivalent(parser.parse("!(P & Q)"), parser.parse("!P | !Q")));
        assertFalse(semantics.equivalent(parser.parse("P -> Q"), parser.parse("Q -> P")));
    }

    @Test
    void counterExampleFalsifiesInvalidArgument() {
        Optional<Assignment> counter = semantics.findCounterExample(
                List.of(parser.parse("P -> Q"), parser.parse("Q")), parser.parse("P"));
        assertEquals(Optional.of(Assignment.of("P", false, "Q", true)), counter);
        assertTrue(semantics.entails(List.of(parser.parse("P -> Q"), parser.parse("P")), parser.parse("Q")));
    }

    @Test
    void consistencyOfPremises() {
        assertTrue(semantics.consistent(List.of(parser.parse("P | Q"), parser.parse("!P"))));
        assertFalse(semantics.consistent(List.of(parser.parse("P"), parser.parse("!P"))));
        assertTrue(semantics.consistent(List.of()));
    }
}
