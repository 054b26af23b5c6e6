package prop.parser;

import prop.LogicException;

/**
 * Malformed formula text. The position is a 0-based character offset into the parsed text so the
 * offending span can be highlighted.
 */
public class FormulaSyntaxException extends LogicException {
    private final int position;
    private final String expected;
    private final String found;

    public FormulaSyntaxException(int position, String expected, String found) {
        super("Syntax error at position %d: expected %s but found %s".formatted(position, expected, found));
        this.position = position;
        this.expected = expected;
        this.found = found;
    }

    public int getPosition() {
        return position;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
