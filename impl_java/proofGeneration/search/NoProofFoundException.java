package proofGeneration.search;

import prop.LogicException;

public class NoProofFoundException extends LogicException {

    public enum Reason {
        SEARCH_EXHAUSTED,
        DEADLINE_EXCEEDED,
        CANCELLED
    }

    private final Reason reason;
    private final int ruleApplications;
    private final int knownFormulas;

    public NoProofFoundException(Reason reason, int ruleApplications, int knownFormulas) {
        super("No proof found (%s) after %d rule applications with %d known formulas"
                .formatted(reason, ruleApplications, knownFormulas));
        this.reason = reason;
        this.ruleApplications = ruleApplications;
        this.knownFormulas = knownFormulas;
    }

    public Reason getReason() {
        return reason;
    }

    public int getRuleApplications() {
        return ruleApplications;
    }

    public int getKnownFormulas() {
        return knownFormulas;
    }
}
