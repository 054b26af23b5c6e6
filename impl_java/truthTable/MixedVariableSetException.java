package truthTable;

import java.util.Set;
import prop.SemanticException;
import prop.formula.Formula;

public class MixedVariableSetException extends SemanticException {
    private final Formula formula;
    private final Set<String> expected;

    public MixedVariableSetException(Formula formula, Set<String> expected) {
        super("Formula " + formula + " uses variables " + formula.variables() + " but the table expects " + expected);
        this.formula = formula;
        this.expected = Set.copyOf(expected);
    }

    public Formula getFormula() {
        return formula;
    }

    public Set<String> getExpected() {
        return expected;
    }
}
