package work.lcod.twine.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ExpressionLexerTest {
    @Test
    void readsPossessiveAfterVariable() {
        assertEquals(
            List.of(Token.Type.VARIABLE, Token.Type.POSSESSIVE, Token.Type.NUMBER),
            types("$items's 1")
        );
    }

    @Test
    void macroNameMayContainDashes() {
        var tokens = ExpressionLexer.tokenize("( else-if: $a)");
        assertEquals(Token.Type.MACRO, tokens.get(0).type());
        assertEquals("else-if", tokens.get(0).value());
        assertEquals("( else-if:", tokens.get(0).text());
    }

    @Test
    void parenthesisWithoutMacroNameIsGrouping() {
        assertEquals(
            List.of(Token.Type.LPAREN, Token.Type.VARIABLE, Token.Type.OPERATOR, Token.Type.NUMBER, Token.Type.RPAREN),
            types("($time - 900)")
        );
    }

    @Test
    void unterminatedStringDoesNotFail() {
        var tokens = ExpressionLexer.tokenize("$a is \"open");
        assertEquals(Token.Type.OTHER, tokens.get(tokens.size() - 1).type());
    }

    @Test
    void readsTwoCharacterOperators() {
        var tokens = ExpressionLexer.tokenize("$a>=5");
        assertEquals(">=", tokens.get(1).value());
        assertEquals(3, tokens.size());
    }

    @Test
    void apostropheInsideWordIsNotPossessive() {
        var tokens = ExpressionLexer.tokenize("\"it's\"");
        assertEquals(1, tokens.size());
        assertEquals("it's", tokens.get(0).value());
    }

    private static List<Token.Type> types(String source) {
        return ExpressionLexer.tokenize(source).stream().map(Token::type).collect(Collectors.toList());
    }
}
