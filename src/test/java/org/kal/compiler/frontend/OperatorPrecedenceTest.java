package org.kal.compiler.frontend;

import org.kal.compiler.diagnostics.DiagnosticsEngine;
import org.kal.compiler.frontend.lexer.Lexer;
import org.kal.compiler.frontend.lexer.Token;
import org.kal.compiler.frontend.parser.OperatorPrecedence;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link OperatorPrecedence}.
 */
@Tag("unit")
class OperatorPrecedenceTest {

    @Test
    void defaultsContainTheFourBuiltInOperators() {
        OperatorPrecedence table = OperatorPrecedence.defaults();

        assertThat(table.precedenceOf('<')).isEqualTo(10);
        assertThat(table.precedenceOf('+')).isEqualTo(20);
        assertThat(table.precedenceOf('-')).isEqualTo(20);
        assertThat(table.precedenceOf('*')).isEqualTo(40);
        assertThat(table.asMap()).containsOnlyKeys('<', '+', '-', '*');
        assertThat(table.isRightAssociative('+')).isFalse();
    }

    @Test
    void unknownAndNonPositiveEntriesAreNotOperators() {
        OperatorPrecedence table = OperatorPrecedence.of(Map.of('+', 20, '%', 0, '/', -5), Set.of());

        assertThat(table.isOperator('+')).isTrue();
        assertThat(table.precedenceOf('%')).isEqualTo(OperatorPrecedence.NOT_AN_OPERATOR);
        assertThat(table.precedenceOf('/')).isEqualTo(OperatorPrecedence.NOT_AN_OPERATOR);
        assertThat(table.precedenceOf('?')).isEqualTo(OperatorPrecedence.NOT_AN_OPERATOR);
        assertThat(table.isOperator('%')).isFalse();
    }

    @Test
    void onlyCharacterTokensCanBeOperators() {
        List<Token> tokens = new Lexer("+ x 1 def", new DiagnosticsEngine()).scanTokens();
        OperatorPrecedence table = OperatorPrecedence.defaults();

        assertThat(table.precedenceOf(tokens.get(0))).isEqualTo(20);
        assertThat(tokens.subList(1, tokens.size()))
                .allSatisfy(t -> assertThat(table.precedenceOf(t)).isEqualTo(OperatorPrecedence.NOT_AN_OPERATOR));
    }

    @Test
    void tableIsImmutableAfterCreation() {
        Map<Character, Integer> source = new HashMap<>(Map.of('+', 20));
        OperatorPrecedence table = OperatorPrecedence.of(source, Set.of());

        source.put('*', 40);

        assertThat(table.isOperator('*')).isFalse();
        assertThatThrownBy(() -> table.asMap().put('*', 40)).isInstanceOf(UnsupportedOperationException.class);
    }
}
