package prop.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import prop.Operator;
import prop.Substitution;

public record Not(Formula formula) implements Formula {

    public Not {
        Objects.requireNonNull(formula, "formula");
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Not(formula.applySub(substitution));
    }

    @Override
    public Set<String> variables() {
        return formula.variables();
    }

    @Override
    public boolean evaluate(Assignment assignment) {
        return !formula.evaluate(assignment);
    }

    @Override
    public String toCanonicalString() {
        int negations = 1;
        Formula inner = formula;
        while (inner instanceof Not not) {
            negations++;
            inner = not.formula();
        }
        String text = inner.toCanonicalString();
        // Only binary operands need a group, ¬¬P prints as is
        if (inner.precedence() < Operator.NOT.precedence()) {
            text = "(" + text + ")";
        }
        return Operator.NOT.symbol().repeat(negations) + text;
    }

    @Override
    public int precedence() {
        return Operator.NOT.precedence();
    }

    @Override
    public int size() {
        return 1 + formula.size();
    }

    @Override
    public List<Formula> subformulas() {
        List<Formula> out = new ArrayList<>();
        out.add(this);
        out.addAll(formula.subformulas());
        return out;
    }

    @Override
    public String toString() {
        return toCanonicalString();
    }
}
