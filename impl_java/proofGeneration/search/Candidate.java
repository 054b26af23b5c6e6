package proofGeneration.search;

import proofGeneration.rules.RuleApplication;
import prop.formula.Formula;

// goalOverlap counts shared sub-formulas as a multiset intersection, id is the creation order
public record Candidate(Formula formula, RuleApplication application, int depth, int goalOverlap, long id) {

    public boolean isPremise() {
        return application == null;
    }
}
