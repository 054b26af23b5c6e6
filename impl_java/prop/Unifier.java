package prop;

import java.util.Optional;
import prop.formula.BinaryFormula;
import prop.formula.Formula;
import prop.formula.Not;
import prop.formula.Variable;

public class Unifier {
    public static Optional<Substitution> match(Formula pattern, Formula target) {
        return match(pattern, target, new Substitution());
    }

    /**
     * Extend {@code theta} so that the pattern instantiates to the target.
     * The given substitution is never modified.
     */
    public static Optional<Substitution> match(Formula pattern, Formula target, Substitution theta) {
        if (pattern instanceof Variable var) {
            return matchVar(var, target, theta);
        } else if (pattern instanceof Not p && target instanceof Not t) {
            return match(p.formula(), t.formula(), theta);
        } else if (pattern instanceof BinaryFormula p && target instanceof BinaryFormula t) {
            if (p.operator() != t.operator()) {
                return Optional.empty();
            }
            var res = match(p.left(), t.left(), theta);
            if (res.isEmpty()) return Optional.empty();
            return match(p.right(), t.right(), res.get());
        } else {
            return Optional.empty();
        }
    }

    private static Optional<Substitution> matchVar(Variable var, Formula target, Substitution theta) {
        var bound = theta.get(var);
        if (bound.isPresent()) {
            return bound.get().equals(target) ? Optional.of(theta) : Optional.empty();
        }
        Substitution sigma = theta.copy();
        sigma.put(var, target);
        return Optional.of(sigma);
    }
}
