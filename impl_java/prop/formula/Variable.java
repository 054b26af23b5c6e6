package prop.formula;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import prop.Operator;
import prop.Substitution;

public record Variable(String name) implements Formula {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    public Variable {
        Objects.requireNonNull(name, "name");
        if (!isIdentifier(name)) {
            throw new IllegalArgumentException("Not a valid variable name: '" + name + "'");
        }
    }

    public static boolean isIdentifier(String text) {
        return IDENTIFIER.matcher(text).matches();
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return substitution.getOrDefault(this, this);
    }

    @Override
    public Set<String> variables() {
        Set<String> out = new LinkedHashSet<>();
        out.add(name);
        return out;
    }

    @Override
    public boolean evaluate(Assignment assignment) {
        return assignment.valueOf(name);
    }

    @Override
    public String toCanonicalString() {
        return name;
    }

    @Override
    public int precedence() {
        return Operator.ATOM_PRECEDENCE;
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public List<Formula> subformulas() {
        return List.of(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
