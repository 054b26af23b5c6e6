package prop.formula;

import java.util.Objects;
import prop.Operator;

public record Implies(Formula left, Formula right) implements BinaryFormula {

    public Implies {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public Operator operator() {
        return Operator.IMPLIES;
    }

    @Override
    public BinaryFormula with(Formula left, Formula right) {
        return new Implies(left, right);
    }

    @Override
    public boolean combine(boolean left, boolean right) {
        return !left || right;
    }

    @Override
    public String toString() {
        return toCanonicalString();
    }
}
