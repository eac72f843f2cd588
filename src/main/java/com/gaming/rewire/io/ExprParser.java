package com.gaming.rewire.io;

import com.gaming.rewire.api.Expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses gating conditions written in prefix notation.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>A single name: {@code key_item}</li>
 * <li>{@code TRUE} and {@code FALSE}</li>
 * <li>Operators over names: {@code AND a b}, {@code OR a b}, {@code OR2 a b c}</li>
 * <li>Nesting in parentheses: {@code AND a ( OR b c )}</li>
 * </ul>
 */
public final class ExprParser {
    private final String input;
    private final List<String> tokens;
    private int pos;

    private ExprParser(String input) {
        this.input = input;
        this.tokens = tokenize(input);
    }

    /**
     * @return the parsed expression, or null for a null or blank string.
     * @throws IllegalArgumentException for a malformed condition.
     */
    public static Expr parse(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        ExprParser parser = new ExprParser(s);
        Expr expr = parser.parseTop();
        if (parser.pos != parser.tokens.size()) {
            throw parser.err("Trailing input");
        }
        return expr;
    }

    private static List<String> tokenize(String s) {
        List<String> out = new ArrayList<>();
        for (String word : s.trim().replace("(", " ( ").replace(")", " ) ").split("\\s+")) {
            if (!word.isEmpty()) {
                out.add(word);
            }
        }
        return out;
    }

    private Expr parseTop() {
        String first = tokens.get(pos);
        if (isOperator(first)) {
            pos++;
            return combine(first, parseOperands());
        }
        Expr single = parseOperand();
        if (pos < tokens.size()) {
            throw err("Expected an operator before multiple terms");
        }
        return single;
    }

    private List<Expr> parseOperands() {
        List<Expr> terms = new ArrayList<>();
        while (pos < tokens.size() && !tokens.get(pos).equals(")")) {
            terms.add(parseOperand());
        }
        if (terms.isEmpty()) {
            throw err("Operator without terms");
        }
        return terms;
    }

    private Expr parseOperand() {
        String token = tokens.get(pos++);
        if (token.equals("(")) {
            if (pos >= tokens.size() || !isOperator(tokens.get(pos))) {
                throw err("Expected an operator after '('");
            }
            String op = tokens.get(pos++);
            Expr inner = combine(op, parseOperands());
            if (pos >= tokens.size() || !tokens.get(pos).equals(")")) {
                throw err("Expected ')'");
            }
            pos++;
            return inner;
        }
        if (token.equals(")") || isOperator(token)) {
            throw err("Unexpected '" + token + "'");
        }
        if (token.equalsIgnoreCase("TRUE")) {
            return Expr.TRUE;
        }
        if (token.equalsIgnoreCase("FALSE")) {
            return Expr.FALSE;
        }
        return Expr.named(token);
    }

    private Expr combine(String op, List<Expr> terms) {
        if (op.equals("AND")) {
            return Expr.and(terms);
        }
        if (op.equals("OR")) {
            return Expr.or(terms);
        }
        return Expr.atLeast(Integer.parseInt(op.substring(2)), terms);
    }

    private static boolean isOperator(String token) {
        return token.equals("AND") || token.matches("OR\\d*");
    }

    private IllegalArgumentException err(String msg) {
        return new IllegalArgumentException("Badly formatted condition '" + input + "': " + msg + " at token " + pos);
    }
}
