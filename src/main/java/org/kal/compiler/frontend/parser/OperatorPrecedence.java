package org.kal.compiler.frontend.parser;

import org.kal.compiler.frontend.lexer.Token;
import org.kal.compiler.frontend.lexer.TokenType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The table of binary operators known to the parser and their precedences.
 * <p>
 * An operator is known if and only if it has a positive precedence. A higher value binds tighter.
 * Operators are left-associative unless they are explicitly listed as right-associative.
 * The table is built once before parsing starts and is immutable afterwards.
 */
public final class OperatorPrecedence {

    /** Returned for tokens that are not binary operators. */
    public static final int NOT_AN_OPERATOR = -1;

    private final Map<Character, Integer> precedences;
    private final Set<Character> rightAssociative;

    private OperatorPrecedence(Map<Character, Integer> precedences, Set<Character> rightAssociative) {
        this.precedences = Collections.unmodifiableMap(new LinkedHashMap<>(precedences));
        this.rightAssociative = Set.copyOf(rightAssociative);
    }

    /**
     * Creates the standard table: {@code <} 10, {@code +} 20, {@code -} 20, {@code *} 40, all left-associative.
     * @return The default table.
     */
    public static OperatorPrecedence defaults() {
        Map<Character, Integer> table = new LinkedHashMap<>();
        table.put('<', 10);
        table.put('+', 20);
        table.put('-', 20);
        table.put('*', 40);
        return new OperatorPrecedence(table, Set.of());
    }

    /**
     * Creates a table from explicit entries. Entries with a precedence of zero or less are kept
     * but do not make their character an operator.
     *
     * @param precedences Operator character to precedence.
     * @param rightAssociative Operators that group to the right at equal precedence.
     * @return The table.
     */
    public static OperatorPrecedence of(Map<Character, Integer> precedences, Set<Character> rightAssociative) {
        return new OperatorPrecedence(precedences, rightAssociative);
    }

    /**
     * Looks up the precedence of a character.
     * @param operator The operator character.
     * @return Its precedence, or {@link #NOT_AN_OPERATOR} if it is not a binary operator.
     */
    public int precedenceOf(char operator) {
        Integer precedence = precedences.get(operator);
        if (precedence == null || precedence <= 0) return NOT_AN_OPERATOR;
        return precedence;
    }

    /**
     * Looks up the precedence of a token.
     * @param token The token.
     * @return Its precedence, or {@link #NOT_AN_OPERATOR} if it is not a binary operator token.
     */
    public int precedenceOf(Token token) {
        if (token.type() != TokenType.CHARACTER) return NOT_AN_OPERATOR;
        return precedenceOf(token.character());
    }

    /**
     * @param operator The operator character.
     * @return true if the character is a known binary operator.
     */
    public boolean isOperator(char operator) {
        return precedenceOf(operator) != NOT_AN_OPERATOR;
    }

    /**
     * @param operator The operator character.
     * @return true if chains of this operator group to the right.
     */
    public boolean isRightAssociative(char operator) {
        return rightAssociative.contains(operator);
    }

    /**
     * @return The raw table, in insertion order.
     */
    public Map<Character, Integer> asMap() {
        return precedences;
    }

    @Override
    public String toString() {
        return "OperatorPrecedence" + precedences + (rightAssociative.isEmpty() ? "" : " right=" + rightAssociative);
    }
}
