package org.kal.compiler.frontend.lexer;

import org.kal.compiler.api.CompilerErrorCode;
import org.kal.compiler.api.SourceInfo;
import org.kal.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts a stream of characters into tokens,
 * one token per call to {@link #nextToken()}.
 * <p>
 * The lexer reads its input one character at a time and keeps exactly one character of
 * lookahead between calls, so it can sit directly on an interactive stream such as stdin.
 * It never throws: the only failure it signals is {@link TokenType#END_OF_FILE}.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);
    private static final int EOF = -1;

    private final Reader reader;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;

    private int lastChar = ' ';
    private int line = 1;
    private int column = 0;
    private boolean pendingNewline = false;

    /**
     * Creates a new Lexer over an in-memory source.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting problems.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(new StringReader(source), diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param reader The character source. It is read lazily, one character at a time.
     * @param diagnostics The engine for reporting problems.
     * @param logicalFileName The name of the input, for error reporting.
     */
    public Lexer(Reader reader, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.reader = reader;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Reads the next token from the input.
     * @return The next token; {@link TokenType#END_OF_FILE} once the input is exhausted.
     */
    public Token nextToken() {
        while (true) {
            while (isWhitespace(lastChar)) {
                lastChar = read();
            }

            int startLine = line;
            int startColumn = column;

            if (isAlpha(lastChar)) {
                return identifier(startLine, startColumn);
            }

            if (isDigit(lastChar) || lastChar == '.') {
                return number(startLine, startColumn);
            }

            if (lastChar == '#') {
                // A comment goes until the end of the line.
                do {
                    lastChar = read();
                } while (lastChar != EOF && lastChar != '\n' && lastChar != '\r');
                if (lastChar != EOF) {
                    continue;
                }
            }

            if (lastChar == EOF) {
                return new Token(TokenType.END_OF_FILE, "", null, startLine, startColumn, logicalFileName);
            }

            int thisChar = lastChar;
            lastChar = read();
            return new Token(TokenType.CHARACTER, String.valueOf((char) thisChar), null, startLine, startColumn, logicalFileName);
        }
    }

    /**
     * Drains the input into a list of tokens.
     * @return All remaining tokens, always terminated by an {@link TokenType#END_OF_FILE} token.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    private Token identifier(int startLine, int startColumn) {
        StringBuilder text = new StringBuilder();
        text.append((char) lastChar);
        while (isAlphaNumeric(lastChar = read())) {
            text.append((char) lastChar);
        }

        String identifier = text.toString();
        TokenType type = switch (identifier) {
            case "def" -> TokenType.DEF;
            case "extern" -> TokenType.EXTERN;
            default -> TokenType.IDENTIFIER;
        };
        return new Token(type, identifier, null, startLine, startColumn, logicalFileName);
    }

    private Token number(int startLine, int startColumn) {
        StringBuilder text = new StringBuilder();
        do {
            text.append((char) lastChar);
            lastChar = read();
        } while (isDigit(lastChar) || lastChar == '.');

        String numberString = text.toString();
        double value = parseLenient(numberString, new SourceInfo(logicalFileName, startLine, startColumn));
        return new Token(TokenType.NUMBER, numberString, value, startLine, startColumn, logicalFileName);
    }

    /**
     * Converts a run of digits and dots the way C's strtod does: the longest prefix that forms
     * a number is used and the rest is ignored. {@code 1.2.3} reads as 1.2, a lone {@code .} as 0.
     */
    private double parseLenient(String numberString, SourceInfo source) {
        int end = 0;
        boolean seenDot = false;
        boolean seenDigit = false;
        while (end < numberString.length()) {
            char c = numberString.charAt(end);
            if (c == '.') {
                if (seenDot) break;
                seenDot = true;
            } else {
                seenDigit = true;
            }
            end++;
        }

        double value = seenDigit ? Double.parseDouble(numberString.substring(0, end)) : 0.0;
        if (!seenDigit || end < numberString.length()) {
            diagnostics.reportWarning(CompilerErrorCode.MALFORMED_NUMBER_LITERAL,
                    "Malformed number literal '" + numberString + "' read as " + value + ".", source);
        }
        return value;
    }

    private int read() {
        try {
            int c = reader.read();
            if (pendingNewline) {
                line++;
                column = 0;
                pendingNewline = false;
            }
            column++;
            if (c == '\n') {
                pendingNewline = true;
            }
            return c;
        } catch (IOException e) {
            LOG.warn("Reading '{}' failed, treating it as end of input.", logicalFileName, e);
            diagnostics.reportError(CompilerErrorCode.IO_ERROR_READING_INPUT,
                    "Error reading input: " + e.getMessage(), new SourceInfo(logicalFileName, line, column));
            return EOF;
        }
    }

    private boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
    }

    private boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isAlphaNumeric(int c) {
        return isAlpha(c) || isDigit(c);
    }
}
