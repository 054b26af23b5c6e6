package proofGeneration.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import prop.Substitution;
import prop.Unifier;
import prop.formula.Formula;
import prop.formula.Variable;

public final class InferenceRule {
    private final String name;
    private final String abbreviation;
    private final String description;
    private final List<RuleForm> forms;
    private final Set<String> aliases;

    public InferenceRule(String name, String abbreviation, String description, List<RuleForm> forms, Set<String> aliases) {
        this.name = Objects.requireNonNull(name);
        this.abbreviation = Objects.requireNonNull(abbreviation);
        this.description = description;
        this.forms = List.copyOf(forms);
        this.aliases = Set.copyOf(aliases);
        if (this.forms.isEmpty()) {
            throw new IllegalArgumentException("Rule " + name + " has no forms");
        }
        int arity = this.forms.get(0).arity();
        if (this.forms.stream().anyMatch(f -> f.arity() != arity)) {
            throw new IllegalArgumentException("Forms of rule " + name + " differ in arity");
        }
    }

    public String getName() {
        return name;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    public String getDescription() {
        return description;
    }

    public List<RuleForm> getForms() {
        return forms;
    }

    public Set<String> getAliases() {
        return aliases;
    }

    public int arity() {
        return forms.get(0).arity();
    }

    public boolean isKnownAs(String label) {
        String l = label.strip();
        return name.equalsIgnoreCase(l) || abbreviation.equalsIgnoreCase(l)
                || aliases.stream().anyMatch(a -> a.equalsIgnoreCase(l));
    }

    /**
     * Check whether the rule derives {@code conclusion} from {@code antecedents}. Conclusion
     * variables the antecedents leave open are bound by matching the conclusion itself.
     */
    public boolean derives(List<Formula> antecedents, Formula conclusion) {
        if (antecedents.size() != arity()) {
            return false;
        }
        for (List<Formula> ordering : orderings(antecedents)) {
            for (RuleForm form : forms) {
                var theta = form.matchAntecedents(ordering);
                if (theta.isPresent() && Unifier.match(form.conclusion(), conclusion, theta.get()).isPresent()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Every conclusion the rule yields for the antecedents. Conclusion variables the antecedents
     * leave open are filled from {@code choices}; forms with such variables yield nothing when
     * there are no choices.
     */
    public List<RuleApplication> apply(List<Formula> antecedents, Collection<Formula> choices) {
        if (antecedents.size() != arity()) {
            return List.of();
        }
        Set<Formula> seen = new LinkedHashSet<>();
        List<RuleApplication> out = new ArrayList<>();
        for (List<Formula> ordering : orderings(antecedents)) {
            for (RuleForm form : forms) {
                var theta = form.matchAntecedents(ordering);
                if (theta.isEmpty()) continue;
                for (Substitution full : fillFree(theta.get(), new ArrayList<>(form.freeVariables()), choices)) {
                    Formula conclusion = form.conclusion().applySub(full);
                    checkInstantiated(form, conclusion, full);
                    if (seen.add(conclusion)) {
                        out.add(new RuleApplication(this, ordering, conclusion));
                    }
                }
            }
        }
        return out;
    }

    /**
     * Every conclusion obtainable with {@code fresh} as one of the antecedents and the remaining
     * antecedents taken from {@code known}. Positions are filled one at a time, each candidate
     * has to match under the bindings made so far.
     */
    public List<RuleApplication> applyWith(Formula fresh, List<Formula> known, Collection<Formula> choices) {
        Set<Formula> seen = new LinkedHashSet<>();
        List<RuleApplication> out = new ArrayList<>();
        for (RuleForm form : forms) {
            for (int i = 0; i < form.arity(); i++) {
                var theta = Unifier.match(form.antecedents().get(i), fresh);
                if (theta.isEmpty()) continue;
                Formula[] chosen = new Formula[form.arity()];
                chosen[i] = fresh;
                join(form, i, 0, chosen, theta.get(), known, choices, seen, out);
            }
        }
        return out;
    }

    private void join(RuleForm form, int fixed, int position, Formula[] chosen, Substitution theta,
            List<Formula> known, Collection<Formula> choices, Set<Formula> seen, List<RuleApplication> out) {
        if (position == chosen.length) {
            for (Substitution full : fillFree(theta, new ArrayList<>(form.freeVariables()), choices)) {
                Formula conclusion = form.conclusion().applySub(full);
                checkInstantiated(form, conclusion, full);
                if (seen.add(conclusion)) {
                    out.add(new RuleApplication(this, List.of(chosen), conclusion));
                }
            }
            return;
        }
        if (position == fixed) {
            join(form, fixed, position + 1, chosen, theta, known, choices, seen, out);
            return;
        }
        Formula pattern = form.antecedents().get(position);
        for (Formula candidate : known) {
            var extended = Unifier.match(pattern, candidate, theta);
            if (extended.isEmpty()) continue;
            chosen[position] = candidate;
            join(form, fixed, position + 1, chosen, extended.get(), known, choices, seen, out);
        }
        chosen[position] = null;
    }

    private static List<Substitution> fillFree(Substitution theta, List<Variable> free, Collection<Formula> choices) {
        List<Substitution> out = new ArrayList<>();
        out.add(theta);
        for (Variable var : free) {
            List<Substitution> next = new ArrayList<>();
            for (Substitution partial : out) {
                for (Formula choice : choices) {
                    Substitution extended = partial.copy();
                    extended.put(var, choice);
                    next.add(extended);
                }
            }
            out = next;
        }
        return out;
    }

    private void checkInstantiated(RuleForm form, Formula conclusion, Substitution theta) {
        for (String var : form.conclusion().variables()) {
            if (!theta.isBound(new Variable(var))) {
                throw new IllegalStateException("Rule " + name + " left pattern variable " + var
                        + " unbound in " + conclusion);
            }
        }
    }

    // Given order first
    static List<List<Formula>> orderings(List<Formula> formulas) {
        List<List<Formula>> out = new ArrayList<>();
        permute(new ArrayList<>(formulas), 0, out);
        return out;
    }

    private static void permute(List<Formula> items, int k, List<List<Formula>> out) {
        if (k == items.size()) {
            out.add(List.copyOf(items));
            return;
        }
        for (int i = k; i < items.size(); i++) {
            Collections.swap(items, k, i);
            permute(items, k + 1, out);
            Collections.swap(items, k, i);
        }
    }

    @Override
    public String toString() {
        return name + " (" + abbreviation + ")";
    }
}
