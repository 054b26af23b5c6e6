package prop.parser;

import java.util.ArrayList;
import java.util.List;
import prop.Operator;
import prop.formula.BinaryFormula;
import prop.formula.Formula;
import prop.formula.Not;
import prop.formula.Variable;

/**
 * Recursive descent parser for propositional formulas.
 *
 * <pre>
 * iff     := implies ( IFF iff )?
 * implies := or ( IMPLIES implies )?
 * or      := and ( OR and )*
 * and     := not ( AND not )*
 * not     := NOT not | atom
 * atom    := VARIABLE | '(' iff ')'
 * </pre>
 *
 * Operator chains and runs of negations are parsed with loops; only parentheses recurse, and
 * they may nest at most {@link #MAX_NESTING} deep.
 * <p>
 * A parser holds no state between calls and may be shared between threads.
 */
public class Parser {
    public static final int MAX_NESTING = 256;

    private final Lexer lexer;

    public Parser() {
        this(SymbolTable.defaults());
    }

    public Parser(SymbolTable symbols) {
        this.lexer = new Lexer(symbols);
    }

    public Formula parse(String text) {
        List<Token> tokens = lexer.tokenize(text);
        Cursor cursor = new Cursor(tokens);
        Formula result = cursor.iff();
        Token rest = cursor.peek();
        if (rest.kind() == Token.Kind.RIGHT) {
            throw new FormulaSyntaxException(rest.position(), "end of input", "unmatched ')'");
        }
        if (rest.kind() != Token.Kind.END) {
            throw new FormulaSyntaxException(rest.position(), "operator", rest.describe());
        }
        return result;
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int pos = 0;
        private int depth = 0;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(pos);
        }

        Token next() {
            return tokens.get(pos++);
        }

        // Right associative: A ↔ B ↔ C is A ↔ (B ↔ C)
        Formula iff() {
            List<Formula> operands = new ArrayList<>();
            operands.add(implies());
            while (peek().is(Operator.IFF)) {
                next();
                operands.add(implies());
            }
            return foldRight(Operator.IFF, operands);
        }

        Formula implies() {
            List<Formula> operands = new ArrayList<>();
            operands.add(or());
            while (peek().is(Operator.IMPLIES)) {
                next();
                operands.add(or());
            }
            return foldRight(Operator.IMPLIES, operands);
        }

        private static Formula foldRight(Operator op, List<Formula> operands) {
            Formula result = operands.get(operands.size() - 1);
            for (int i = operands.size() - 2; i >= 0; i--) {
                result = BinaryFormula.of(op, operands.get(i), result);
            }
            return result;
        }

        Formula or() {
            Formula left = and();
            while (peek().is(Operator.OR)) {
                next();
                left = BinaryFormula.of(Operator.OR, left, and());
            }
            return left;
        }

        Formula and() {
            Formula left = not();
            while (peek().is(Operator.AND)) {
                next();
                left = BinaryFormula.of(Operator.AND, left, not());
            }
            return left;
        }

        Formula not() {
            int negations = 0;
            while (peek().is(Operator.NOT)) {
                next();
                negations++;
            }
            Formula result = atom();
            for (int i = 0; i < negations; i++) {
                result = new Not(result);
            }
            return result;
        }

        Formula atom() {
            Token token = next();
            switch (token.kind()) {
                case VARIABLE:
                    return new Variable(token.text());
                case LEFT:
                    if (depth == MAX_NESTING) {
                        throw new FormulaSyntaxException(token.position(), "shallower nesting",
                                "more than " + MAX_NESTING + " nested groups");
                    }
                    depth++;
                    Formula inner = iff();
                    Token closing = peek();
                    if (closing.kind() != Token.Kind.RIGHT) {
                        throw new FormulaSyntaxException(closing.position(), "')'", closing.describe());
                    }
                    next();
                    depth--;
                    return inner;
                default:
                    // Empty group, dangling operator or missing operand
                    throw new FormulaSyntaxException(token.position(), "formula", token.describe());
            }
        }
    }
}
