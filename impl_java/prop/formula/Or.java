package prop.formula;

import java.util.Objects;
import prop.Operator;

public record Or(Formula left, Formula right) implements BinaryFormula {

    public Or {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public Operator operator() {
        return Operator.OR;
    }

    @Override
    public BinaryFormula with(Formula left, Formula right) {
        return new Or(left, right);
    }

    @Override
    public boolean combine(boolean left, boolean right) {
        return left || right;
    }

    @Override
    public String toString() {
        return toCanonicalString();
    }
}
