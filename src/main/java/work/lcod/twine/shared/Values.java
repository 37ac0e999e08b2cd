package work.lcod.twine.shared;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Helpers for story values.
 *
 * <p>Values are plain Java objects: {@link Long} or {@link Double} numbers, {@link Boolean},
 * {@link String}, {@link List} and {@link Map} (string keys). Everything that enters a variable store
 * goes through {@link #normalize(Object)} first so integral numbers are always {@code Long}.
 */
public final class Values {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Values() {}

    /**
     * Deep copy with numbers normalized; collections are rebuilt so the copy never aliases its source.
     */
    public static Object normalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(normalize(item));
            }
            return copy;
        }
        if (value instanceof Number number) {
            return normalizeNumber(number);
        }
        if (value instanceof Character ch) {
            return String.valueOf(ch);
        }
        return value;
    }

    public static Map<String, Object> normalizeMap(Map<String, ?> map) {
        if (map == null) {
            return new LinkedHashMap<>();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> copy = (Map<String, Object>) normalize(map);
        return copy;
    }

    public static Number normalizeNumber(Number number) {
        if (number instanceof Long || number instanceof Double) {
            return number;
        }
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        if (number instanceof BigInteger big) {
            if (big.bitLength() < 64) {
                return big.longValue();
            }
            return big.doubleValue();
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        return number.doubleValue();
    }

    /**
     * Parses a whole string as a number; {@code null} when it is not numeric.
     */
    public static Number parseNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (INTEGER.matcher(trimmed).matches()) {
            try {
                return Long.parseLong(trimmed.startsWith("+") ? trimmed.substring(1) : trimmed);
            } catch (NumberFormatException ex) {
                return Double.parseDouble(trimmed);
            }
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        return null;
    }

    /**
     * Numeric view of a value: numbers as-is, numeric text parsed, anything else {@code null}.
     */
    public static Number toNumber(Object value) {
        if (value instanceof Number number) {
            return normalizeNumber(number);
        }
        if (value instanceof String text) {
            return parseNumber(text);
        }
        return null;
    }

    public static boolean isIntegral(Number number) {
        return number instanceof Long;
    }

    public static int compareNumbers(Number left, Number right) {
        if (left instanceof Long l && right instanceof Long r) {
            return Long.compare(l, r);
        }
        return Double.compare(left.doubleValue(), right.doubleValue());
    }

    public static boolean numbersEqual(Number left, Number right) {
        if (left instanceof Long l && right instanceof Long r) {
            return l.longValue() == r.longValue();
        }
        return left.doubleValue() == right.doubleValue();
    }

    /**
     * Value equality used by state diffs: numbers numerically, lists element-wise, maps key-wise.
     */
    public static boolean looselyEqual(Object left, Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number l && right instanceof Number r) {
            return numbersEqual(normalizeNumber(l), normalizeNumber(r));
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            if (l.size() != r.size()) {
                return false;
            }
            Iterator<?> li = l.iterator();
            Iterator<?> ri = r.iterator();
            while (li.hasNext()) {
                if (!looselyEqual(li.next(), ri.next())) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof Map<?, ?> l && right instanceof Map<?, ?> r) {
            if (l.size() != r.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : l.entrySet()) {
                if (!r.containsKey(entry.getKey()) || !looselyEqual(entry.getValue(), r.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0d;
        }
        if (value instanceof String text) {
            return !text.isEmpty();
        }
        return true;
    }

    /**
     * Text form of a value as it appears in rendered passage content. {@code null} renders empty.
     */
    public static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof List<?> list) {
            var builder = new StringBuilder("[");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    builder.append(", ");
                }
                builder.append(render(list.get(i)));
            }
            return builder.append(']').toString();
        }
        if (value instanceof Map<?, ?> map) {
            var builder = new StringBuilder("{");
            var first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!first) {
                    builder.append(", ");
                }
                first = false;
                builder.append(entry.getKey()).append(": ").append(render(entry.getValue()));
            }
            return builder.append('}').toString();
        }
        if (value instanceof Number number) {
            return String.valueOf(normalizeNumber(number));
        }
        return String.valueOf(value);
    }
}
