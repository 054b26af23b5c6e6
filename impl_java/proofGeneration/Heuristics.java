package proofGeneration;

import java.util.Comparator;
import proofGeneration.search.Candidate;

/**
 * Orderings of the search frontier. The smallest candidate is expanded first.
 */
public class Heuristics {

    public interface Heuristic extends Comparator<Candidate> {
        public String getName();

        /**
         * How many candidates are taken off the frontier per expansion step, -1 for one per worker.
         */
        public int getDrainSize();
    }

    public static class BreadthFirst implements Heuristic {
        @Override
        public int compare(Candidate candidate, Candidate t1) {
            return Long.compare(candidate.id(), t1.id());
        }

        @Override
        public String getName() {
            return "BFS";
        }

        @Override
        public int getDrainSize() {
            return -1;
        }
    }

    /**
     * Prefers small formulas that share many sub-formulas with the goal and were derived in few
     * steps. The weights are a tuning choice, not a contract.
     */
    public static class GoalDistance implements Heuristic {
        static final int OVERLAP_WEIGHT = 2;

        static int distance(Candidate candidate) {
            return candidate.formula().size() - OVERLAP_WEIGHT * candidate.goalOverlap() + candidate.depth();
        }

        @Override
        public int compare(Candidate candidate, Candidate t1) {
            int comp = Integer.compare(distance(candidate), distance(t1));
            if (comp != 0)
                return comp;
            // Then creation order, which keeps the search deterministic
            return Long.compare(candidate.id(), t1.id());
        }

        @Override
        public String getName() {
            return "Goal distance";
        }

        @Override
        public int getDrainSize() {
            return 1;
        }
    }
}
