package prop;

import java.util.List;

public enum Operator {
    IFF(1, "↔", true, List.of("<->", "<=>")),
    IMPLIES(2, "→", true, List.of("->", "=>")),
    OR(3, "∨", false, List.of("|", "||")),
    AND(4, "∧", false, List.of("&", "&&")),
    NOT(5, "¬", false, List.of("!", "~"));

    // Atoms and parenthesised groups
    public static final int ATOM_PRECEDENCE = 6;

    private final int precedence;
    private final String symbol;
    private final boolean rightAssociative;
    private final List<String> asciiSpellings;

    Operator(int precedence, String symbol, boolean rightAssociative, List<String> asciiSpellings) {
        this.precedence = precedence;
        this.symbol = symbol;
        this.rightAssociative = rightAssociative;
        this.asciiSpellings = asciiSpellings;
    }

    public int precedence() {
        return precedence;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isRightAssociative() {
        return rightAssociative;
    }

    public List<String> asciiSpellings() {
        return asciiSpellings;
    }
}
