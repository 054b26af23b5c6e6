package proofGeneration.proof;

import java.util.Objects;
import prop.formula.Formula;

public record ProofLine(int index, Formula formula, Justification justification) {

    public ProofLine {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(justification, "justification");
    }

    public boolean isPremise() {
        return justification instanceof Justification.Premise;
    }

    public ProofLine withFormula(Formula replacement) {
        return new ProofLine(index, replacement, justification);
    }

    @Override
    public String toString() {
        return index + ". " + formula.toCanonicalString() + " (" + justification + ")";
    }
}
