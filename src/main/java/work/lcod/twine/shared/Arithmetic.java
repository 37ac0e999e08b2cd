package work.lcod.twine.shared;

/**
 * Binary arithmetic over normalized story numbers ({@code Long} / {@code Double}).
 */
public final class Arithmetic {
    private Arithmetic() {}

    /**
     * How {@code /} treats two integral operands.
     */
    public enum Division {
        /** Integer quotient, truncated toward zero. */
        TRUNCATE,
        /** Integral result when exact, otherwise a {@code Double}. */
        EXACT
    }

    /**
     * Applies {@code operator}; returns {@code null} for an unknown operator or a zero divisor.
     */
    public static Number apply(String operator, Number left, Number right, Division division) {
        if (left == null || right == null || operator == null) {
            return null;
        }
        var l = Values.normalizeNumber(left);
        var r = Values.normalizeNumber(right);
        if (l instanceof Long a && r instanceof Long b) {
            return applyIntegral(operator, a, b, division);
        }
        double a = l.doubleValue();
        double b = r.doubleValue();
        switch (operator) {
            case "+":
                return a + b;
            case "-":
                return a - b;
            case "*":
                return a * b;
            case "/":
                return b == 0d ? null : a / b;
            case "%":
                if (b == 0d) {
                    return null;
                }
                double mod = a % b;
                return mod < 0 ? mod + Math.abs(b) : mod;
            default:
                return null;
        }
    }

    private static Number applyIntegral(String operator, long a, long b, Division division) {
        switch (operator) {
            case "+":
                return a + b;
            case "-":
                return a - b;
            case "*":
                return a * b;
            case "/":
                if (b == 0L) {
                    return null;
                }
                if (division == Division.TRUNCATE || a % b == 0L) {
                    return a / b;
                }
                return (double) a / (double) b;
            case "%":
                if (b == 0L) {
                    return null;
                }
                return Math.floorMod(a, Math.abs(b));
            default:
                return null;
        }
    }
}
