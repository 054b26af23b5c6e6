package proofGeneration.proof;

import prop.LogicException;

public class ProofScriptException extends LogicException {
    private final int scriptLine;

    public ProofScriptException(int scriptLine, String message) {
        super("Script line " + scriptLine + ": " + message);
        this.scriptLine = scriptLine;
    }

    public ProofScriptException(int scriptLine, String message, Throwable cause) {
        super("Script line " + scriptLine + ": " + message, cause);
        this.scriptLine = scriptLine;
    }

    public int getScriptLine() {
        return scriptLine;
    }
}
