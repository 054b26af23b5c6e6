package proofGeneration.proof;

import java.util.List;
import java.util.Objects;

public sealed interface Justification {

    Premise PREMISE = new Premise();

    static Justification premise() {
        return PREMISE;
    }

    static Justification rule(String ruleName, Integer... antecedents) {
        return new ByRule(ruleName, List.of(antecedents));
    }

    record Premise() implements Justification {
        @Override
        public String toString() {
            return "Premise";
        }
    }

    /**
     * @param antecedents 1-based numbers of the lines the rule is applied to
     */
    record ByRule(String ruleName, List<Integer> antecedents) implements Justification {
        public ByRule {
            Objects.requireNonNull(ruleName, "ruleName");
            antecedents = List.copyOf(antecedents);
        }

        @Override
        public String toString() {
            if (antecedents.isEmpty()) return ruleName;
            return ruleName + " [" + String.join(", ", antecedents.stream().map(String::valueOf).toList()) + "]";
        }
    }
}
