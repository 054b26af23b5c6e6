package proofGeneration.search;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import prop.formula.Formula;

/**
 * Bounds on one proof search.
 *
 * @param maxDepth        rule applications accepted into the known set before giving up
 * @param maxKnownSetSize known formulas, premises included, before giving up
 * @param maxFormulaSize  largest derived formula (in nodes) worth keeping, 0 picks
 *                        {@code 2 * largest input + 4}
 * @param deadline        wall-clock instant after which the search stops, or null
 */
public record SearchLimits(int maxDepth, int maxKnownSetSize, int maxFormulaSize, Instant deadline) {

    public static final SearchLimits DEFAULT = new SearchLimits(500, 2000, 0, null);

    public SearchLimits {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        if (maxKnownSetSize < 1) throw new IllegalArgumentException("maxKnownSetSize must be positive: " + maxKnownSetSize);
        if (maxFormulaSize < 0) throw new IllegalArgumentException("maxFormulaSize must not be negative: " + maxFormulaSize);
    }

    public SearchLimits withMaxDepth(int maxDepth) {
        return new SearchLimits(maxDepth, maxKnownSetSize, maxFormulaSize, deadline);
    }

    public SearchLimits withMaxKnownSetSize(int maxKnownSetSize) {
        return new SearchLimits(maxDepth, maxKnownSetSize, maxFormulaSize, deadline);
    }

    public SearchLimits withMaxFormulaSize(int maxFormulaSize) {
        return new SearchLimits(maxDepth, maxKnownSetSize, maxFormulaSize, deadline);
    }

    public SearchLimits withDeadline(Instant deadline) {
        return new SearchLimits(maxDepth, maxKnownSetSize, maxFormulaSize, deadline);
    }

    public SearchLimits withTimeout(Duration timeout) {
        return withDeadline(Instant.now().plus(timeout));
    }

    int effectiveMaxFormulaSize(Collection<Formula> premises, Formula goal) {
        if (maxFormulaSize > 0) {
            return maxFormulaSize;
        }
        int largest = goal.size();
        for (Formula premise : premises) {
            largest = Math.max(largest, premise.size());
        }
        return 2 * largest + 4;
    }

    boolean deadlinePassed() {
        return deadline != null && Instant.now().isAfter(deadline);
    }
}
