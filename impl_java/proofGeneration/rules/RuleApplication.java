package proofGeneration.rules;

import java.util.List;
import prop.formula.Formula;

public record RuleApplication(InferenceRule rule, List<Formula> antecedents, Formula conclusion) {

    public RuleApplication {
        antecedents = List.copyOf(antecedents);
    }

    @Override
    public String toString() {
        return getString(0, "");
    }

    public String getString(int indentation, String delim) {
        String body = rule.getAbbreviation() + ": "
                + String.join(", ", antecedents.stream().map(Formula::toCanonicalString).toList())
                + " -> " + conclusion.toCanonicalString();
        if (indentation == 0)
            return body;
        return "  ".repeat(indentation) + delim + " " + body;
    }
}
