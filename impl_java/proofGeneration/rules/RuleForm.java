package proofGeneration.rules;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import prop.Substitution;
import prop.Unifier;
import prop.formula.Formula;
import prop.formula.Variable;

public record RuleForm(List<Formula> antecedents, Formula conclusion) {

    public RuleForm {
        antecedents = List.copyOf(antecedents);
        if (antecedents.isEmpty()) {
            throw new IllegalArgumentException("A rule form needs at least one antecedent");
        }
    }

    public int arity() {
        return antecedents.size();
    }

    // Conclusion variables no antecedent binds, like the new disjunct of Addition
    public Set<Variable> freeVariables() {
        Set<String> bound = new LinkedHashSet<>();
        antecedents.forEach(a -> bound.addAll(a.variables()));
        Set<Variable> out = new LinkedHashSet<>();
        for (String name : conclusion.variables()) {
            if (!bound.contains(name)) out.add(new Variable(name));
        }
        return out;
    }

    public Optional<Substitution> matchAntecedents(List<Formula> formulas) {
        if (formulas.size() != antecedents.size()) {
            return Optional.empty();
        }
        Substitution theta = new Substitution();
        for (int i = 0; i < antecedents.size(); i++) {
            var res = Unifier.match(antecedents.get(i), formulas.get(i), theta);
            if (res.isEmpty()) return Optional.empty();
            theta = res.get();
        }
        return Optional.of(theta);
    }

    @Override
    public String toString() {
        return String.join(", ", antecedents.stream().map(Formula::toCanonicalString).toList())
                + " ⊢ " + conclusion.toCanonicalString();
    }
}
