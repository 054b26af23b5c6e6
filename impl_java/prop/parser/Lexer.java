package prop.parser;

import java.util.ArrayList;
import java.util.List;

class Lexer {
    private final SymbolTable symbols;

    Lexer(SymbolTable symbols) {
        this.symbols = symbols;
    }

    List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(Token.Kind.LEFT, "(", i, null));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(Token.Kind.RIGHT, ")", i, null));
                i++;
            } else if (isIdentifierStart(c)) {
                int start = i;
                while (i < text.length() && isIdentifierPart(text.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(Token.Kind.VARIABLE, text.substring(start, i), start, null));
            } else {
                final int start = i;
                var match = symbols.longestMatch(text, start)
                        .orElseThrow(() -> new FormulaSyntaxException(start, "operator, variable or parenthesis",
                                "'" + text.substring(start, text.offsetByCodePoints(start, 1)) + "'"));
                tokens.add(new Token(Token.Kind.OPERATOR, match.getKey(), start, match.getValue()));
                i += match.getKey().length();
            }
        }
        tokens.add(new Token(Token.Kind.END, "", text.length(), null));
        return tokens;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '_';
    }
}
