package org.kal.compiler.frontend.lexer;

import org.kal.compiler.api.SourceInfo;

/**
 * Represents a single token read from the input by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., IDENTIFIER, NUMBER, CHARACTER).
 * @param text The exact text of the token from the source code. Empty for {@link TokenType#END_OF_FILE}.
 * @param value The processed value of the token (the {@link Double} value of a number), or null.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical name of the input the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * Checks whether this is a {@link TokenType#CHARACTER} token for the given character.
     * @param c The character to compare against.
     * @return true if this token is exactly that character.
     */
    public boolean isCharacter(char c) {
        return type == TokenType.CHARACTER && text.length() == 1 && text.charAt(0) == c;
    }

    /**
     * @return The single character of a {@link TokenType#CHARACTER} token.
     * @throws IllegalStateException if this token is of another type.
     */
    public char character() {
        if (type != TokenType.CHARACTER) {
            throw new IllegalStateException("Token " + type + " is not a character token");
        }
        return text.charAt(0);
    }

    /**
     * @return The numeric value of a {@link TokenType#NUMBER} token.
     */
    public double numberValue() {
        return (Double) value;
    }

    /**
     * @return The position of this token.
     */
    public SourceInfo source() {
        return new SourceInfo(fileName, line, column);
    }

    /**
     * @return A human readable form of this token for error messages.
     */
    public String describe() {
        return type == TokenType.END_OF_FILE ? "end of input" : "'" + text + "'";
    }
}
