package org.kal.compiler.frontend.parser;

import org.kal.compiler.api.CompilerErrorCode;
import org.kal.compiler.api.SourceInfo;
import org.kal.compiler.diagnostics.DiagnosticsEngine;
import org.kal.compiler.frontend.lexer.Lexer;
import org.kal.compiler.frontend.lexer.Token;
import org.kal.compiler.frontend.lexer.TokenType;
import org.kal.compiler.frontend.parser.ast.BinaryNode;
import org.kal.compiler.frontend.parser.ast.CallNode;
import org.kal.compiler.frontend.parser.ast.ExprNode;
import org.kal.compiler.frontend.parser.ast.FunctionNode;
import org.kal.compiler.frontend.parser.ast.NumberLiteralNode;
import org.kal.compiler.frontend.parser.ast.PrototypeNode;
import org.kal.compiler.frontend.parser.ast.VariableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A recursive-descent parser for the expression language, with precedence climbing for binary operators.
 * It pulls tokens from the {@link Lexer} one at a time through a single "current token" cursor.
 * <p>
 * Each entry point parses exactly one top-level construct. On a syntax error the problem is reported
 * to the {@link DiagnosticsEngine} and an empty result is returned; the parser does not skip past the
 * offending token, that is left to the caller.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final OperatorPrecedence precedence;
    private final DiagnosticsEngine diagnostics;
    private Token current;

    /**
     * Constructs a new Parser. No input is read until the current token is first needed.
     * @param lexer The token source.
     * @param precedence The binary operator table.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(Lexer lexer, OperatorPrecedence precedence, DiagnosticsEngine diagnostics) {
        this.lexer = lexer;
        this.precedence = precedence;
        this.diagnostics = diagnostics;
    }

    /**
     * Returns the current token, reading the first one if nothing has been read yet.
     * @return The current token.
     */
    public Token currentToken() {
        if (current == null) {
            advance();
        }
        return current;
    }

    /**
     * Reads the next token and makes it the current one.
     * @return The new current token.
     */
    public Token advance() {
        current = lexer.nextToken();
        return current;
    }

    /**
     * Parses {@code definition := 'def' prototype expression}. The current token must be {@code def}.
     * @return The function definition, or empty if a syntax error was reported.
     */
    public Optional<FunctionNode> parseDefinition() {
        expectKeyword(TokenType.DEF);
        return attempt(() -> {
            advance(); // eat 'def'
            PrototypeNode proto = prototype();
            ExprNode body = expression();
            LOG.debug("Parsed definition of '{}'", proto.name());
            return new FunctionNode(proto, body);
        });
    }

    /**
     * Parses {@code extern := 'extern' prototype}. The current token must be {@code extern}.
     * @return The prototype, or empty if a syntax error was reported.
     */
    public Optional<PrototypeNode> parseExtern() {
        expectKeyword(TokenType.EXTERN);
        return attempt(() -> {
            advance(); // eat 'extern'
            PrototypeNode proto = prototype();
            LOG.debug("Parsed extern '{}'", proto.name());
            return proto;
        });
    }

    /**
     * Parses a top-level expression and wraps it into an anonymous function without parameters.
     * @return The wrapping function, or empty if a syntax error was reported.
     */
    public Optional<FunctionNode> parseTopLevelExpression() {
        return attempt(() -> {
            ExprNode body = expression();
            return new FunctionNode(new PrototypeNode("", List.of(), body.source()), body);
        });
    }

    /**
     * Parses a single expression.
     * @return The expression, or empty if a syntax error was reported.
     */
    public Optional<ExprNode> parseExpression() {
        return attempt(this::expression);
    }

    private <T> Optional<T> attempt(Supplier<T> rule) {
        try {
            return Optional.of(rule.get());
        } catch (SyntaxError e) {
            LOG.debug("Syntax error at {}: {}", e.source, e.getMessage());
            diagnostics.reportError(e.code, e.getMessage(), e.source);
            return Optional.empty();
        }
    }

    private void expectKeyword(TokenType keyword) {
        if (currentToken().type() != keyword) {
            throw new IllegalStateException("Expected current token " + keyword + " but was " + current.type());
        }
    }

    // expression := primary binOpRHS(0)
    private ExprNode expression() {
        ExprNode lhs = primary();
        return binOpRhs(0, lhs);
    }

    // binOpRHS := (operator primary)*
    private ExprNode binOpRhs(int minPrecedence, ExprNode lhs) {
        while (true) {
            int tokenPrecedence = precedence.precedenceOf(currentToken());

            // Also stops on anything that is not an operator, since those have a negative precedence.
            if (tokenPrecedence < minPrecedence) {
                return lhs;
            }

            Token operatorToken = current;
            char operator = operatorToken.character();
            advance(); // eat the operator

            ExprNode rhs = primary();

            int nextPrecedence = precedence.precedenceOf(currentToken());
            if (tokenPrecedence < nextPrecedence) {
                rhs = binOpRhs(tokenPrecedence + 1, rhs);
            } else if (tokenPrecedence == nextPrecedence && precedence.isRightAssociative(current.character())) {
                rhs = binOpRhs(tokenPrecedence, rhs);
            }

            lhs = new BinaryNode(operator, lhs, rhs, operatorToken.source());
        }
    }

    // primary := identifierExpr | numberExpr | parenExpr
    private ExprNode primary() {
        Token token = currentToken();
        if (token.type() == TokenType.IDENTIFIER) {
            return identifierExpression();
        }
        if (token.type() == TokenType.NUMBER) {
            advance();
            return new NumberLiteralNode(token.numberValue(), token.source());
        }
        if (token.isCharacter('(')) {
            return parenExpression();
        }
        throw new SyntaxError(CompilerErrorCode.EXPECTED_EXPRESSION,
                "Unknown token " + token.describe() + " when expecting an expression.", token.source());
    }

    // parenExpr := '(' expression ')'
    private ExprNode parenExpression() {
        advance(); // eat '('
        ExprNode inner = expression();
        if (!current.isCharacter(')')) {
            throw new SyntaxError(CompilerErrorCode.EXPECTED_CLOSING_PAREN,
                    "Expected ')' but found " + current.describe() + ".", current.source());
        }
        advance(); // eat ')'
        return inner;
    }

    // identifierExpr := identifier | identifier '(' (expression (',' expression)*)? ')'
    private ExprNode identifierExpression() {
        Token name = current;
        advance(); // eat identifier

        if (!current.isCharacter('(')) {
            return new VariableNode(name.text(), name.source());
        }

        advance(); // eat '('
        List<ExprNode> arguments = new ArrayList<>();
        if (!current.isCharacter(')')) {
            while (true) {
                arguments.add(expression());
                if (current.isCharacter(')')) {
                    break;
                }
                if (!current.isCharacter(',')) {
                    throw new SyntaxError(CompilerErrorCode.EXPECTED_ARGUMENT_SEPARATOR,
                            "Expected ')' or ',' in argument list but found " + current.describe() + ".", current.source());
                }
                advance(); // eat ','
            }
        }
        advance(); // eat ')'
        return new CallNode(name.text(), arguments, name.source());
    }

    // prototype := identifier '(' identifier* ')'
    private PrototypeNode prototype() {
        if (currentToken().type() != TokenType.IDENTIFIER) {
            throw new SyntaxError(CompilerErrorCode.EXPECTED_FUNCTION_NAME,
                    "Expected function name in prototype but found " + current.describe() + ".", current.source());
        }
        Token name = current;
        advance();

        if (!current.isCharacter('(')) {
            throw new SyntaxError(CompilerErrorCode.EXPECTED_PROTOTYPE_OPEN_PAREN,
                    "Expected '(' in prototype but found " + current.describe() + ".", current.source());
        }

        List<String> parameterNames = new ArrayList<>();
        while (advance().type() == TokenType.IDENTIFIER) {
            parameterNames.add(current.text());
        }
        if (!current.isCharacter(')')) {
            throw new SyntaxError(CompilerErrorCode.EXPECTED_PROTOTYPE_CLOSE_PAREN,
                    "Expected ')' in prototype but found " + current.describe() + ".", current.source());
        }
        advance(); // eat ')'

        return new PrototypeNode(name.text(), parameterNames, name.source());
    }

    /**
     * Unwinds the parse of the current construct. Caught by {@link #attempt(Supplier)}.
     */
    private static final class SyntaxError extends RuntimeException {
        private final CompilerErrorCode code;
        private final SourceInfo source;

        SyntaxError(CompilerErrorCode code, String message, SourceInfo source) {
            super(message, null, false, false);
            this.code = code;
            this.source = source;
        }
    }
}
