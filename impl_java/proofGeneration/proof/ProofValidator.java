package proofGeneration.proof;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import proofGeneration.proof.ValidationResult.Reason;
import proofGeneration.rules.InferenceRule;
import proofGeneration.rules.RuleCatalog;
import prop.formula.Formula;

public class ProofValidator {

    public ValidationResult validate(Proof proof) {
        return validate(proof.getPremises(), proof.getGoal(), proof.getLines());
    }

    public ValidationResult validate(List<Formula> premises, Formula goal, List<ProofLine> lines) {
        for (int i = 0; i < lines.size(); i++) {
            ProofLine line = lines.get(i);
            int expected = i + 1;
            if (line.index() != expected) {
                return invalid(expected, Reason.MISNUMBERED_LINE,
                        "Line " + expected + " is numbered " + line.index());
            }
            Optional<ValidationResult> failure = checkLine(premises, lines, line);
            if (failure.isPresent()) {
                return failure.get();
            }
        }
        if (lines.isEmpty()) {
            return invalid(0, Reason.GOAL_NOT_REACHED, "The proof has no lines");
        }
        ProofLine last = lines.get(lines.size() - 1);
        if (!last.formula().equals(goal)) {
            return invalid(last.index(), Reason.GOAL_NOT_REACHED,
                    "Last line " + last.formula() + " is not the goal " + goal);
        }
        return ValidationResult.valid();
    }

    private Optional<ValidationResult> checkLine(List<Formula> premises, List<ProofLine> lines, ProofLine line) {
        if (line.justification() instanceof Justification.ByRule byRule) {
            Optional<InferenceRule> rule = RuleCatalog.lookup(byRule.ruleName());
            if (rule.isEmpty()) {
                return Optional.of(invalid(line.index(), Reason.UNKNOWN_RULE,
                        "Unknown rule '" + byRule.ruleName() + "'"));
            }
            List<Formula> antecedents = new ArrayList<>();
            for (int ref : byRule.antecedents()) {
                if (ref < 1 || ref >= line.index()) {
                    return Optional.of(invalid(line.index(), Reason.BAD_ANTECEDENT_REFERENCE,
                            "Line " + line.index() + " cites line " + ref + ", which is not an earlier line"));
                }
                antecedents.add(lines.get(ref - 1).formula());
            }
            if (!rule.get().derives(antecedents, line.formula())) {
                return Optional.of(invalid(line.index(), Reason.RULE_DOES_NOT_APPLY,
                        rule.get().getName() + " does not derive " + line.formula() + " from lines " + byRule.antecedents()));
            }
            return Optional.empty();
        }
        if (!premises.contains(line.formula())) {
            return Optional.of(invalid(line.index(), Reason.NOT_A_PREMISE,
                    line.formula() + " is not one of the premises"));
        }
        return Optional.empty();
    }

    private static ValidationResult invalid(int lineIndex, Reason reason, String message) {
        return new ValidationResult.Invalid(lineIndex, reason, message);
    }
}
