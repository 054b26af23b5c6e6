package prop.formula;

import prop.SemanticException;

public class UnboundVariableException extends SemanticException {
    private final String variable;

    public UnboundVariableException(String variable) {
        super("No truth value provided for variable " + variable);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
