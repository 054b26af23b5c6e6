package prop.formula;

import java.util.Objects;
import prop.Operator;

public record And(Formula left, Formula right) implements BinaryFormula {

    public And {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public Operator operator() {
        return Operator.AND;
    }

    @Override
    public BinaryFormula with(Formula left, Formula right) {
        return new And(left, right);
    }

    @Override
    public boolean combine(boolean left, boolean right) {
        return left && right;
    }

    @Override
    public String toString() {
        return toCanonicalString();
    }
}
