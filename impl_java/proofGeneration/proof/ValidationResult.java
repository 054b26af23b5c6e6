package proofGeneration.proof;

public sealed interface ValidationResult {

    enum Reason {
        MISNUMBERED_LINE,
        NOT_A_PREMISE,
        UNKNOWN_RULE,
        BAD_ANTECEDENT_REFERENCE,
        RULE_DOES_NOT_APPLY,
        GOAL_NOT_REACHED
    }

    boolean isValid();

    static ValidationResult valid() {
        return Valid.INSTANCE;
    }

    final class Valid implements ValidationResult {
        private static final Valid INSTANCE = new Valid();

        private Valid() {
        }

        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public String toString() {
            return "Valid";
        }
    }

    /**
     * @param lineIndex 1-based line number, 0 when the proof has no lines
     */
    record Invalid(int lineIndex, Reason reason, String message) implements ValidationResult {
        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public String toString() {
            return "Invalid at line " + lineIndex + " (" + reason + "): " + message;
        }
    }
}
