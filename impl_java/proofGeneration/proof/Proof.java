package proofGeneration.proof;

import java.util.ArrayList;
import java.util.List;
import prop.formula.Formula;

public final class Proof {
    private final List<Formula> premises;
    private final Formula goal;
    private final List<ProofLine> lines;

    public Proof(List<Formula> premises, Formula goal, List<ProofLine> lines) {
        this.premises = List.copyOf(premises);
        this.goal = goal;
        this.lines = List.copyOf(lines);
    }

    public List<Formula> getPremises() {
        return premises;
    }

    public Formula getGoal() {
        return goal;
    }

    public List<ProofLine> getLines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    public ProofLine line(int index) {
        return lines.get(index - 1);
    }

    public Proof withLineFormula(int index, Formula replacement) {
        List<ProofLine> copy = new ArrayList<>(lines);
        copy.set(index - 1, copy.get(index - 1).withFormula(replacement));
        return new Proof(premises, goal, copy);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Premises: ")
                .append(String.join(", ", premises.stream().map(Formula::toCanonicalString).toList()))
                .append('\n');
        sb.append("Goal: ").append(goal.toCanonicalString()).append('\n');
        for (ProofLine line : lines) {
            sb.append("  ").append(line).append('\n');
        }
        return sb.toString();
    }
}
