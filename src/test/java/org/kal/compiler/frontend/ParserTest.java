package org.kal.compiler.frontend;

import org.kal.compiler.api.CompilerErrorCode;
import org.kal.compiler.diagnostics.DiagnosticsEngine;
import org.kal.compiler.frontend.lexer.Lexer;
import org.kal.compiler.frontend.lexer.TokenType;
import org.kal.compiler.frontend.parser.OperatorPrecedence;
import org.kal.compiler.frontend.parser.Parser;
import org.kal.compiler.frontend.parser.ast.BinaryNode;
import org.kal.compiler.frontend.parser.ast.CallNode;
import org.kal.compiler.frontend.parser.ast.ExprNode;
import org.kal.compiler.frontend.parser.ast.ExprVisitor;
import org.kal.compiler.frontend.parser.ast.FunctionNode;
import org.kal.compiler.frontend.parser.ast.NumberLiteralNode;
import org.kal.compiler.frontend.parser.ast.PrototypeNode;
import org.kal.compiler.frontend.parser.ast.VariableNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify that the parser builds the expected tree for each top-level construct,
 * applies operator precedence and associativity, and reports syntax errors without
 * consuming the offending token.
 */
public class ParserTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private Parser parser(String source) {
        return parser(source, OperatorPrecedence.defaults());
    }

    private Parser parser(String source, OperatorPrecedence precedence) {
        return new Parser(new Lexer(source, diagnostics), precedence, diagnostics);
    }

    /**
     * Renders an expression as a fully parenthesized prefix form, e.g. {@code (+ 1.0 x)}.
     */
    private static String render(ExprNode node) {
        return node.accept(new ExprVisitor<String>() {
            @Override
            public String visitNumber(NumberLiteralNode n) {
                return Double.toString(n.value());
            }

            @Override
            public String visitVariable(VariableNode n) {
                return n.name();
            }

            @Override
            public String visitBinary(BinaryNode n) {
                return "(" + n.operator() + " " + n.left().accept(this) + " " + n.right().accept(this) + ")";
            }

            @Override
            public String visitCall(CallNode n) {
                return n.callee() + n.arguments().stream().map(a -> a.accept(this)).collect(Collectors.joining(" ", "[", "]"));
            }
        });
    }

    /**
     * Verifies that multiplication binds tighter than addition in a top-level expression,
     * and that the expression is wrapped into an anonymous function without parameters.
     */
    @Test
    @Tag("unit")
    void testTopLevelExpressionRespectsPrecedence() {
        // Arrange
        Parser parser = parser("3+4*5");

        // Act
        Optional<FunctionNode> result = parser.parseTopLevelExpression();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(result).isPresent();
        FunctionNode function = result.get();
        assertThat(function.prototype().isAnonymous()).isTrue();
        assertThat(function.prototype().parameterNames()).isEmpty();
        assertThat(function.body()).isInstanceOf(BinaryNode.class);

        BinaryNode add = (BinaryNode) function.body();
        assertThat(add.operator()).isEqualTo('+');
        assertThat(add.left()).isEqualTo(new NumberLiteralNode(3.0, add.left().source()));
        assertThat(add.right()).isInstanceOf(BinaryNode.class);
        assertThat(((BinaryNode) add.right()).operator()).isEqualTo('*');
        assertThat(render(function.body())).isEqualTo("(+ 3.0 (* 4.0 5.0))");
    }

    /**
     * Verifies that parentheses override precedence.
     */
    @Test
    @Tag("unit")
    void testParenthesesOverridePrecedence() {
        // Act
        Optional<ExprNode> result = parser("(3+4)*5").parseExpression();

        // Assert
        assertThat(result).map(ParserTest::render).contains("(* (+ 3.0 4.0) 5.0)");
    }

    /**
     * Verifies that operators of equal precedence group to the left.
     */
    @Test
    @Tag("unit")
    void testEqualPrecedenceIsLeftAssociative() {
        assertThat(parser("1-2-3").parseExpression()).map(ParserTest::render).contains("(- (- 1.0 2.0) 3.0)");
        assertThat(parser("1-2+3").parseExpression()).map(ParserTest::render).contains("(+ (- 1.0 2.0) 3.0)");
        assertThat(parser("1*2+3").parseExpression()).map(ParserTest::render).contains("(+ (* 1.0 2.0) 3.0)");
    }

    /**
     * Verifies the full precedence ladder: comparison is looser than addition, which is looser than multiplication.
     */
    @Test
    @Tag("unit")
    void testComparisonBindsLoosest() {
        // Act
        Optional<ExprNode> result = parser("a < b + c * d - e").parseExpression();

        // Assert
        assertThat(result).map(ParserTest::render).contains("(< a (- (+ b (* c d)) e))");
    }

    /**
     * Verifies that an operator listed as right-associative groups to the right at equal precedence,
     * while the other operators are unaffected.
     */
    @Test
    @Tag("unit")
    void testRightAssociativeOperatorFromCustomTable() {
        // Arrange
        OperatorPrecedence table = OperatorPrecedence.of(Map.of('+', 20, '^', 50), Set.of('^'));

        // Act & Assert
        assertThat(parser("2^3^2", table).parseExpression()).map(ParserTest::render).contains("(^ 2.0 (^ 3.0 2.0))");
        assertThat(parser("1+2^3^4+5", table).parseExpression()).map(ParserTest::render)
                .contains("(+ (+ 1.0 (^ 2.0 (^ 3.0 4.0))) 5.0)");
    }

    /**
     * Verifies that a character with a non-positive precedence is not an operator, so the
     * expression ends in front of it.
     */
    @Test
    @Tag("unit")
    void testDisabledOperatorEndsExpression() {
        // Arrange
        Parser parser = parser("1+2", OperatorPrecedence.of(Map.of('+', 0), Set.of()));

        // Act
        Optional<ExprNode> result = parser.parseExpression();

        // Assert
        assertThat(result).map(ParserTest::render).contains("1.0");
        assertThat(parser.currentToken().isCharacter('+')).isTrue();
    }

    /**
     * Verifies that a function definition yields its prototype and body.
     */
    @Test
    @Tag("unit")
    void testParseDefinition() {
        // Arrange
        Parser parser = parser("def foo(a b) a+b");
        assertThat(parser.currentToken().type()).isEqualTo(TokenType.DEF);

        // Act
        Optional<FunctionNode> result = parser.parseDefinition();

        // Assert
        assertThat(result).isPresent();
        PrototypeNode prototype = result.get().prototype();
        assertThat(prototype.name()).isEqualTo("foo");
        assertThat(prototype.parameterNames()).containsExactly("a", "b");
        assertThat(prototype.arity()).isEqualTo(2);
        assertThat(render(result.get().body())).isEqualTo("(+ a b)");
        assertThat(result.get().getChildren()).hasSize(2);
        assertThat(parser.currentToken().type()).isEqualTo(TokenType.END_OF_FILE);
    }

    /**
     * Verifies that an extern yields a bare prototype, including one without parameters.
     */
    @Test
    @Tag("unit")
    void testParseExtern() {
        // Arrange
        Parser parser = parser("extern sin(x) extern rand()");

        // Act
        Optional<PrototypeNode> first = parser.parseExtern();
        Optional<PrototypeNode> second = parser.parseExtern();

        // Assert
        assertThat(first).isPresent();
        assertThat(first.get().name()).isEqualTo("sin");
        assertThat(first.get().parameterNames()).containsExactly("x");
        assertThat(second).isPresent();
        assertThat(second.get().name()).isEqualTo("rand");
        assertThat(second.get().parameterNames()).isEmpty();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    /**
     * Verifies that call arguments are parsed left to right as full expressions.
     */
    @Test
    @Tag("unit")
    void testParseCalls() {
        assertThat(parser("foo(1, x, 2*3)").parseExpression()).map(ParserTest::render).contains("foo[1.0 x (* 2.0 3.0)]");
        assertThat(parser("foo()").parseExpression()).map(ParserTest::render).contains("foo[]");
        assertThat(parser("f(g(x)) + 1").parseExpression()).map(ParserTest::render).contains("(+ f[g[x]] 1.0)");
    }

    /**
     * Verifies that several constructs can be read one after the other from a single stream.
     */
    @Test
    @Tag("unit")
    void testSequentialConstructs() {
        // Arrange
        Parser parser = parser("def id(x) x extern g() id(2) < 3");

        // Act & Assert
        assertThat(parser.parseDefinition()).isPresent();
        assertThat(parser.parseExtern()).isPresent();
        assertThat(parser.parseTopLevelExpression()).map(f -> render(f.body())).contains("(< id[2.0] 3.0)");
        assertThat(parser.currentToken().type()).isEqualTo(TokenType.END_OF_FILE);
    }

    /**
     * Verifies that an unexpected token is reported and left in place for the caller to skip.
     */
    @Test
    @Tag("unit")
    void testUnexpectedTokenIsReportedAndNotConsumed() {
        // Arrange
        Parser parser = parser(")");

        // Act
        Optional<FunctionNode> result = parser.parseTopLevelExpression();

        // Assert
        assertThat(result).isEmpty();
        assertThat(diagnostics.hasError(CompilerErrorCode.EXPECTED_EXPRESSION)).isTrue();
        assertThat(diagnostics.getDiagnostics().get(0).message()).isEqualTo("Unknown token ')' when expecting an expression.");
        assertThat(parser.currentToken().isCharacter(')')).isTrue();
    }

    /**
     * Verifies the error code reported for each kind of malformed construct.
     */
    @Test
    @Tag("unit")
    void testSyntaxErrorCodes() {
        assertSyntaxError("(1+2", CompilerErrorCode.EXPECTED_CLOSING_PAREN);
        assertSyntaxError("foo(1 2)", CompilerErrorCode.EXPECTED_ARGUMENT_SEPARATOR);
        assertSyntaxError("1 +", CompilerErrorCode.EXPECTED_EXPRESSION);
        assertSyntaxError("def (x) x", CompilerErrorCode.EXPECTED_FUNCTION_NAME);
        assertSyntaxError("def foo x", CompilerErrorCode.EXPECTED_PROTOTYPE_OPEN_PAREN);
        assertSyntaxError("def foo(x, y) x", CompilerErrorCode.EXPECTED_PROTOTYPE_CLOSE_PAREN);
        assertSyntaxError("extern 42(x)", CompilerErrorCode.EXPECTED_FUNCTION_NAME);
        assertSyntaxError("def foo(x)", CompilerErrorCode.EXPECTED_EXPRESSION);
    }

    private void assertSyntaxError(String source, CompilerErrorCode expected) {
        DiagnosticsEngine local = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source, local), OperatorPrecedence.defaults(), local);
        Optional<?> result = switch (parser.currentToken().type()) {
            case DEF -> parser.parseDefinition();
            case EXTERN -> parser.parseExtern();
            default -> parser.parseTopLevelExpression();
        };
        assertThat(result).as(source).isEmpty();
        assertThat(local.getDiagnostics()).as(source).hasSize(1);
        assertThat(local.getDiagnostics().get(0).code()).as(source).isEqualTo(expected);
        assertThat(local.getDiagnostics().get(0).code().category()).as(source).isEqualTo(CompilerErrorCode.Category.SYNTAX);
    }

    /**
     * Verifies that calling a keyword entry point on the wrong token is a programming error.
     */
    @Test
    @Tag("unit")
    void testKeywordEntryPointRequiresKeyword() {
        // Arrange
        Parser parser = parser("1+2");

        // Act & Assert
        assertThatThrownBy(parser::parseDefinition).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(parser::parseExtern).isInstanceOf(IllegalStateException.class);
    }
}
