package prop.parser;

import prop.Operator;

// operator is only set for OPERATOR tokens
record Token(Kind kind, String text, int position, Operator operator) {

    enum Kind {
        VARIABLE,
        OPERATOR,
        LEFT,
        RIGHT,
        END
    }

    boolean is(Operator op) {
        return kind == Kind.OPERATOR && operator == op;
    }

    String describe() {
        return switch (kind) {
            case END -> "end of input";
            case VARIABLE -> "variable '" + text + "'";
            case OPERATOR, LEFT, RIGHT -> "'" + text + "'";
        };
    }
}
