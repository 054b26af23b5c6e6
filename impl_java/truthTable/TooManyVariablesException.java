package truthTable;

import prop.SemanticException;

public class TooManyVariablesException extends SemanticException {
    private final int variableCount;
    private final int maxVariables;

    public TooManyVariablesException(int variableCount, int maxVariables) {
        super("Truth table over %d variables exceeds the limit of %d (%d rows)"
                .formatted(variableCount, maxVariables, 1L << Math.min(variableCount, 62)));
        this.variableCount = variableCount;
        this.maxVariables = maxVariables;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getMaxVariables() {
        return maxVariables;
    }
}
