package work.lcod.twine.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Lenient tokenizer for macro arguments. Never throws: characters outside the grammar become
 * {@link Token.Type#OTHER} tokens and an unterminated string becomes one {@code OTHER} token.
 */
public final class ExpressionLexer {
    private final String input;
    private int position;
    private final List<Token> tokens = new ArrayList<>();

    private ExpressionLexer(String input) {
        this.input = input == null ? "" : input;
    }

    public static List<Token> tokenize(String input) {
        return new ExpressionLexer(input).run();
    }

    private List<Token> run() {
        while (position < input.length()) {
            char current = input.charAt(position);

            if (Character.isWhitespace(current)) {
                position++;
                continue;
            }
            if (current == '$' && position + 1 < input.length() && isWordChar(input.charAt(position + 1))) {
                readVariable();
                continue;
            }
            if (Character.isDigit(current)) {
                readNumber();
                continue;
            }
            if (current == '\'' && isPossessive()) {
                add(Token.Type.POSSESSIVE, position, position + 2, "'s");
                continue;
            }
            if (current == '"' || current == '\'') {
                readString(current);
                continue;
            }
            if (current == '(') {
                readParen();
                continue;
            }
            if (current == ')') {
                add(Token.Type.RPAREN, position, position + 1, ")");
                continue;
            }
            if (current == ',') {
                add(Token.Type.COMMA, position, position + 1, ",");
                continue;
            }
            if (Character.isLetter(current) || current == '_') {
                int start = position;
                int end = scanWord(position);
                add(Token.Type.IDENT, start, end, input.substring(start, end));
                continue;
            }
            if (readOperator()) {
                continue;
            }
            add(Token.Type.OTHER, position, position + 1, String.valueOf(current));
        }
        return tokens;
    }

    private void readVariable() {
        int start = position;
        int end = scanWord(position + 1);
        add(Token.Type.VARIABLE, start, end, input.substring(start + 1, end));
    }

    private void readNumber() {
        int start = position;
        int cursor = position;
        while (cursor < input.length() && Character.isDigit(input.charAt(cursor))) {
            cursor++;
        }
        if (cursor + 1 < input.length() && input.charAt(cursor) == '.' && Character.isDigit(input.charAt(cursor + 1))) {
            cursor++;
            while (cursor < input.length() && Character.isDigit(input.charAt(cursor))) {
                cursor++;
            }
        }
        add(Token.Type.NUMBER, start, cursor, input.substring(start, cursor));
    }

    private void readString(char quote) {
        int start = position;
        int close = input.indexOf(quote, start + 1);
        if (close < 0) {
            add(Token.Type.OTHER, start, input.length(), input.substring(start));
            return;
        }
        add(Token.Type.STRING, start, close + 1, input.substring(start + 1, close));
    }

    private void readParen() {
        int start = position;
        int cursor = position + 1;
        while (cursor < input.length() && input.charAt(cursor) == ' ') {
            cursor++;
        }
        if (cursor < input.length() && Character.isLetter(input.charAt(cursor))) {
            int nameStart = cursor;
            while (cursor < input.length() && (isWordChar(input.charAt(cursor)) || input.charAt(cursor) == '-')) {
                cursor++;
            }
            if (cursor < input.length() && input.charAt(cursor) == ':') {
                add(Token.Type.MACRO, start, cursor + 1, input.substring(nameStart, cursor));
                return;
            }
        }
        add(Token.Type.LPAREN, start, start + 1, "(");
    }

    private boolean readOperator() {
        int start = position;
        char current = input.charAt(position);
        char next = position + 1 < input.length() ? input.charAt(position + 1) : '\0';
        if ((current == '>' || current == '<' || current == '=') && next == '=') {
            add(Token.Type.OPERATOR, start, start + 2, input.substring(start, start + 2));
            return true;
        }
        if ("+-*/%<>".indexOf(current) >= 0) {
            add(Token.Type.OPERATOR, start, start + 1, String.valueOf(current));
            return true;
        }
        return false;
    }

    private boolean isPossessive() {
        if (tokens.isEmpty()) {
            return false;
        }
        var previous = tokens.get(tokens.size() - 1);
        if (previous.end() != position) {
            return false;
        }
        if (!previous.is(Token.Type.VARIABLE) && !previous.is(Token.Type.RPAREN) && !previous.is(Token.Type.IDENT)) {
            return false;
        }
        if (position + 1 >= input.length() || input.charAt(position + 1) != 's') {
            return false;
        }
        return position + 2 >= input.length() || !isWordChar(input.charAt(position + 2));
    }

    private int scanWord(int from) {
        int cursor = from;
        while (cursor < input.length() && isWordChar(input.charAt(cursor))) {
            cursor++;
        }
        return cursor;
    }

    private void add(Token.Type type, int start, int end, String value) {
        tokens.add(new Token(type, input.substring(start, end), value, start, end));
        position = end;
    }

    static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }
}
