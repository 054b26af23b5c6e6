package prop.formula;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import prop.Operator;
import prop.Substitution;

public sealed interface BinaryFormula extends Formula permits And, Or, Implies, Iff {

    Formula left();

    Formula right();

    Operator operator();

    /**
     * Build a formula with the same connective over new operands.
     */
    BinaryFormula with(Formula left, Formula right);

    /**
     * Truth function of the connective.
     */
    boolean combine(boolean left, boolean right);

    static BinaryFormula of(Operator operator, Formula left, Formula right) {
        return switch (operator) {
            case AND -> new And(left, right);
            case OR -> new Or(left, right);
            case IMPLIES -> new Implies(left, right);
            case IFF -> new Iff(left, right);
            case NOT -> throw new IllegalArgumentException("Negation is not a binary connective");
        };
    }

    @Override
    default Formula applySub(Substitution substitution) {
        return with(left().applySub(substitution), right().applySub(substitution));
    }

    @Override
    default Set<String> variables() {
        Set<String> out = new LinkedHashSet<>(left().variables());
        out.addAll(right().variables());
        return out;
    }

    @Override
    default boolean evaluate(Assignment assignment) {
        // Both sides are evaluated so a missing variable is reported regardless of short-circuiting
        boolean l = left().evaluate(assignment);
        boolean r = right().evaluate(assignment);
        return combine(l, r);
    }

    @Override
    default String toCanonicalString() {
        Operator op = operator();
        String l = left().toCanonicalString();
        String r = right().toCanonicalString();
        int lp = left().precedence();
        int rp = right().precedence();
        if (lp < op.precedence() || (lp == op.precedence() && op.isRightAssociative())) {
            l = "(" + l + ")";
        }
        if (rp < op.precedence() || (rp == op.precedence() && !op.isRightAssociative())) {
            r = "(" + r + ")";
        }
        return l + " " + op.symbol() + " " + r;
    }

    @Override
    default int precedence() {
        return operator().precedence();
    }

    @Override
    default int size() {
        return 1 + left().size() + right().size();
    }

    @Override
    default List<Formula> subformulas() {
        List<Formula> out = new ArrayList<>();
        out.add(this);
        out.addAll(left().subformulas());
        out.addAll(right().subformulas());
        return out;
    }
}
