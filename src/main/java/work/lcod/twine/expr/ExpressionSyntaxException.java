package work.lcod.twine.expr;

/**
 * Raised by {@link ExpressionParser} on input outside the expression grammar. Callers map it to
 * their neutral result; it never leaves the interpreter.
 */
public final class ExpressionSyntaxException extends RuntimeException {
    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(message + " at " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
