package work.lcod.twine.expr;

/**
 * Lexical token with its source offsets ({@code [start, end)}).
 *
 * <p>{@code value} is the processed payload: the variable name without {@code $}, string content
 * without quotes, the macro name without {@code (} and {@code :}; otherwise the raw text.
 */
public record Token(Type type, String text, String value, int start, int end) {
    public enum Type {
        NUMBER,
        STRING,
        VARIABLE,
        IDENT,
        OPERATOR,
        MACRO,
        LPAREN,
        RPAREN,
        COMMA,
        POSSESSIVE,
        OTHER
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    public boolean isWord(String word) {
        return type == Type.IDENT && value.equals(word);
    }

    public boolean isOperator(String symbol) {
        return type == Type.OPERATOR && value.equals(symbol);
    }
}
