package com.herzen.oracle.sandbox;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.*;

public final class SandboxValues {
    private static final long EXACT_DOUBLE_LIMIT = 1L << 53;

    private SandboxValues() {}

    public record Tuple(List<Object> items) {
        public Tuple {
            items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        @Override
        public String toString() {
            return repr(this);
        }
    }

    // ---- conversion ----

    public static Object normalize(Object value) {
        if (value == null || value instanceof Long || value instanceof Double || value instanceof Boolean
                || value instanceof String) {
            return value;
        }
        if (value instanceof Tuple tuple) {
            List<Object> items = new ArrayList<>(tuple.items().size());
            for (Object item : tuple.items()) items.add(normalize(item));
            return new Tuple(items);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new EvaluationException("integer value out of range: " + big);
            }
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof Character c) {
            return String.valueOf(c);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) items.add(normalize(item));
            return Collections.unmodifiableList(items);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(normalize(k), normalize(v)));
            return Collections.unmodifiableMap(copy);
        }
        throw new EvaluationException("unsupported value type: " + value.getClass().getSimpleName());
    }

    public static String typeName(Object value) {
        if (value == null) return "none";
        if (value instanceof Boolean) return "bool";
        if (value instanceof Long) return "int";
        if (value instanceof Double) return "float";
        if (value instanceof String) return "str";
        if (value instanceof Tuple) return "tuple";
        if (value instanceof List) return "list";
        if (value instanceof Map) return "dict";
        if (value instanceof SandboxEnvironment.BuiltinFunction) return "function";
        if (value instanceof SandboxEnvironment.Namespace) return "namespace";
        return value.getClass().getSimpleName();
    }

    public static boolean isInteger(Object value) {
        return value instanceof Long || value instanceof Boolean;
    }

    public static boolean isNumber(Object value) {
        return value instanceof Long || value instanceof Double || value instanceof Boolean;
    }

    public static long asLong(Object value) {
        if (value instanceof Long l) return l;
        if (value instanceof Boolean b) return b ? 1L : 0L;
        throw new EvaluationException("expected an integer, got '" + typeName(value) + "'");
    }

    public static double toDouble(Object value) {
        if (value instanceof Double d) return d;
        if (value instanceof Long l) return l.doubleValue();
        if (value instanceof Boolean b) return b ? 1.0 : 0.0;
        throw new EvaluationException("must be a real number, not '" + typeName(value) + "'");
    }

    public static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Long l) return l != 0L;
        if (value instanceof Double d) return d != 0.0;
        if (value instanceof String s) return !s.isEmpty();
        if (value instanceof Tuple t) return !t.items().isEmpty();
        if (value instanceof List<?> l) return !l.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    public static List<Object> iterate(Object value) {
        if (value instanceof Tuple t) return t.items();
        if (value instanceof List<?> list) return new ArrayList<>(list);
        if (value instanceof Map<?, ?> map) return new ArrayList<>(map.keySet());
        if (value instanceof String s) {
            List<Object> chars = new ArrayList<>(s.length());
            for (int i = 0; i < s.length(); i++) chars.add(String.valueOf(s.charAt(i)));
            return chars;
        }
        throw new EvaluationException("'" + typeName(value) + "' object is not iterable");
    }

    public static int length(Object value) {
        if (value instanceof String s) return s.length();
        if (value instanceof Tuple t) return t.items().size();
        if (value instanceof List<?> l) return l.size();
        if (value instanceof Map<?, ?> m) return m.size();
        throw new EvaluationException("object of type '" + typeName(value) + "' has no len()");
    }

    // ---- formatting ----

    public static String str(Object value) {
        if (value instanceof String s) return s;
        return repr(value);
    }

    public static String repr(Object value) {
        if (value == null) return "None";
        if (value instanceof Boolean b) return b ? "True" : "False";
        if (value instanceof Long l) return l.toString();
        if (value instanceof Double d) return formatFloat(d);
        if (value instanceof String s) return quote(s);
        if (value instanceof Tuple t) {
            if (t.items().size() == 1) return "(" + repr(t.items().get(0)) + ",)";
            return joinRepr(t.items(), "(", ")");
        }
        if (value instanceof List<?> list) return joinRepr(list, "[", "]");
        if (value instanceof Map<?, ?> map) {
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            map.forEach((k, v) -> joiner.add(repr(k) + ": " + repr(v)));
            return joiner.toString();
        }
        if (value instanceof SandboxEnvironment.BuiltinFunction f) return "<function " + f.name() + ">";
        if (value instanceof SandboxEnvironment.Namespace n) return "<namespace " + n.name() + ">";
        return String.valueOf(value);
    }

    private static String joinRepr(Collection<?> items, String open, String close) {
        StringJoiner joiner = new StringJoiner(", ", open, close);
        for (Object item : items) joiner.add(repr(item));
        return joiner.toString();
    }

    private static String quote(String s) {
        char q = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder().append(q);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c == q) sb.append('\\');
                    sb.append(c);
                }
            }
        }
        return sb.append(q).toString();
    }

    /**
     * Shortest round-trip form; integral values keep a trailing {@code .0} and exponent notation is used
     * outside {@code 1e-4 <= |x| < 1e16}.
     */
    public static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0.0) return (1.0 / d) < 0 ? "-0.0" : "0.0";

        BigDecimal decimal = new BigDecimal(Double.toString(d)).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent < -4 || exponent >= 16) {
            String digits = decimal.unscaledValue().abs().toString();
            StringBuilder sb = new StringBuilder();
            if (d < 0) sb.append('-');
            sb.append(digits.charAt(0));
            if (digits.length() > 1) sb.append('.').append(digits, 1, digits.length());
            sb.append('e').append(exponent < 0 ? '-' : '+');
            int abs = Math.abs(exponent);
            if (abs < 10) sb.append('0');
            sb.append(abs);
            return sb.toString();
        }
        String plain = decimal.toPlainString();
        return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }

    // ---- arithmetic ----

    public static Object add(Object a, Object b, int maxLength) {
        if (isInteger(a) && isInteger(b)) {
            try {
                return Math.addExact(asLong(a), asLong(b));
            } catch (ArithmeticException e) {
                throw overflow();
            }
        }
        if (isNumber(a) && isNumber(b)) return toDouble(a) + toDouble(b);
        if (a instanceof String x && b instanceof String y) {
            checkLength((long) x.length() + y.length(), maxLength);
            return x + y;
        }
        if (a instanceof Tuple x && b instanceof Tuple y) {
            checkLength((long) x.items().size() + y.items().size(), maxLength);
            List<Object> items = new ArrayList<>(x.items());
            items.addAll(y.items());
            return checkSize(new Tuple(items), maxLength);
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            checkLength((long) x.size() + y.size(), maxLength);
            List<Object> items = new ArrayList<>(x);
            items.addAll(y);
            return checkSize(Collections.unmodifiableList(items), maxLength);
        }
        throw unsupported("+", a, b);
    }

    public static Object subtract(Object a, Object b) {
        if (isInteger(a) && isInteger(b)) {
            try {
                return Math.subtractExact(asLong(a), asLong(b));
            } catch (ArithmeticException e) {
                throw overflow();
            }
        }
        if (isNumber(a) && isNumber(b)) return toDouble(a) - toDouble(b);
        throw unsupported("-", a, b);
    }

    public static Object multiply(Object a, Object b, int maxLength) {
        if (isInteger(a) && isInteger(b)) {
            try {
                return Math.multiplyExact(asLong(a), asLong(b));
            } catch (ArithmeticException e) {
                throw overflow();
            }
        }
        if (isNumber(a) && isNumber(b)) return toDouble(a) * toDouble(b);
        if (isInteger(a) && !isNumber(b)) return repeat(b, asLong(a), a, maxLength);
        if (isInteger(b) && !isNumber(a)) return repeat(a, asLong(b), b, maxLength);
        throw unsupported("*", a, b);
    }

    private static Object repeat(Object sequence, long times, Object count, int maxLength) {
        long n = Math.max(0, times);
        if (sequence instanceof String s) {
            if (s.isEmpty() || n == 0) return "";
            checkRepeat(s.length(), n, maxLength);
            return s.repeat((int) n);
        }
        if (sequence instanceof Tuple t) {
            if (t.items().isEmpty() || n == 0) return new Tuple(List.of());
            checkRepeat(size(t, maxLength), n, maxLength);
            return new Tuple(repeatItems(t.items(), n));
        }
        if (sequence instanceof List<?> list) {
            if (list.isEmpty() || n == 0) return List.of();
            checkRepeat(size(list, maxLength), n, maxLength);
            return Collections.unmodifiableList(repeatItems(list, n));
        }
        throw unsupported("*", sequence, count);
    }

    private static void checkRepeat(long size, long times, int maxLength) {
        if (times > maxLength / size) {
            throw new SandboxException(SandboxException.SEQUENCE_TOO_LONG,
                    "Repeating a sequence of size " + size + " " + times + " times exceeds the limit of " + maxLength);
        }
    }

    private static List<Object> repeatItems(List<?> items, long n) {
        List<Object> out = new ArrayList<>();
        for (long i = 0; i < n; i++) out.addAll(items);
        return out;
    }

    public static Object trueDivide(Object a, Object b) {
        if (!isNumber(a) || !isNumber(b)) throw unsupported("/", a, b);
        double divisor = toDouble(b);
        if (divisor == 0.0) throw new EvaluationException("division by zero");
        if (isInteger(a) && isInteger(b)) {
            long x = asLong(a);
            long y = asLong(b);
            if (Math.abs(x) <= EXACT_DOUBLE_LIMIT && Math.abs(y) <= EXACT_DOUBLE_LIMIT) return (double) x / (double) y;
            return new BigDecimal(x).divide(new BigDecimal(y), MathContext.DECIMAL128).doubleValue();
        }
        return toDouble(a) / divisor;
    }

    public static Object floorDivide(Object a, Object b) {
        if (isInteger(a) && isInteger(b)) {
            long y = asLong(b);
            if (y == 0) throw new EvaluationException("integer division or modulo by zero");
            long x = asLong(a);
            if (x == Long.MIN_VALUE && y == -1) throw overflow();
            return Math.floorDiv(x, y);
        }
        if (isNumber(a) && isNumber(b)) {
            double y = toDouble(b);
            if (y == 0.0) throw new EvaluationException("float floor division by zero");
            return Math.floor(toDouble(a) / y);
        }
        throw unsupported("//", a, b);
    }

    public static Object modulo(Object a, Object b) {
        if (isInteger(a) && isInteger(b)) {
            long y = asLong(b);
            if (y == 0) throw new EvaluationException("integer division or modulo by zero");
            return Math.floorMod(asLong(a), y);
        }
        if (isNumber(a) && isNumber(b)) {
            double y = toDouble(b);
            if (y == 0.0) throw new EvaluationException("float modulo by zero");
            double r = toDouble(a) % y;
            if (r != 0.0 && (r < 0) != (y < 0)) r += y;
            return r;
        }
        throw unsupported("%", a, b);
    }

    public static Object power(Object a, Object b) {
        if (!isNumber(a) || !isNumber(b)) throw unsupported("**", a, b);
        if (isInteger(a) && isInteger(b)) {
            long base = asLong(a);
            long exp = asLong(b);
            if (exp >= 0) return integerPower(base, exp);
            if (base == 0) throw new EvaluationException("zero cannot be raised to a negative power");
            return Math.pow(base, exp);
        }
        double base = toDouble(a);
        double exp = toDouble(b);
        if (base == 0.0 && exp < 0) throw new EvaluationException("zero cannot be raised to a negative power");
        if (base < 0 && exp != Math.rint(exp) && Double.isFinite(exp)) {
            throw new EvaluationException("negative number cannot be raised to a fractional power");
        }
        double result = Math.pow(base, exp);
        if (Double.isInfinite(result) && Double.isFinite(base) && Double.isFinite(exp)) {
            throw new EvaluationException("numerical result out of range");
        }
        return result;
    }

    private static long integerPower(long base, long exp) {
        long result = 1;
        long b = base;
        long e = exp;
        try {
            while (e > 0) {
                if ((e & 1) == 1) result = Math.multiplyExact(result, b);
                e >>= 1;
                if (e > 0) b = Math.multiplyExact(b, b);
            }
        } catch (ArithmeticException ex) {
            throw overflow();
        }
        return result;
    }

    public static Object negate(Object a) {
        if (a instanceof Double d) return -d;
        if (isInteger(a)) {
            try {
                return Math.negateExact(asLong(a));
            } catch (ArithmeticException e) {
                throw overflow();
            }
        }
        throw new EvaluationException("bad operand type for unary -: '" + typeName(a) + "'");
    }

    public static Object positive(Object a) {
        if (a instanceof Double) return a;
        if (isInteger(a)) return asLong(a);
        throw new EvaluationException("bad operand type for unary +: '" + typeName(a) + "'");
    }

    // ---- comparison ----

    public static boolean valueEquals(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (isNumber(a) && isNumber(b)) {
            if (isInteger(a) && isInteger(b)) return asLong(a) == asLong(b);
            return toDouble(a) == toDouble(b);
        }
        if (a instanceof Tuple x && b instanceof Tuple y) return sequenceEquals(x.items(), y.items());
        if (a instanceof Tuple || b instanceof Tuple) return false;
        if (a instanceof List<?> x && b instanceof List<?> y) return sequenceEquals(x, y);
        if (a instanceof Map<?, ?> x && b instanceof Map<?, ?> y) {
            if (x.size() != y.size()) return false;
            for (Map.Entry<?, ?> e : x.entrySet()) {
                Optional<Object> other = lookup(y, e.getKey());
                if (other.isEmpty() || !valueEquals(e.getValue(), other.get())) return false;
            }
            return true;
        }
        return a.equals(b);
    }

    private static boolean sequenceEquals(List<?> x, List<?> y) {
        if (x.size() != y.size()) return false;
        for (int i = 0; i < x.size(); i++) {
            if (!valueEquals(x.get(i), y.get(i))) return false;
        }
        return true;
    }

    /** Ordering for {@code < <= > >=}, {@code min} and {@code max}. */
    public static int order(Object a, Object b, String symbol) {
        if (isNumber(a) && isNumber(b)) {
            if (isInteger(a) && isInteger(b)) return Long.compare(asLong(a), asLong(b));
            return Double.compare(toDouble(a), toDouble(b));
        }
        if (a instanceof String x && b instanceof String y) return x.compareTo(y);
        if (a instanceof Tuple x && b instanceof Tuple y) return orderSequences(x.items(), y.items(), symbol);
        if (a instanceof List<?> x && b instanceof List<?> y) return orderSequences(x, y, symbol);
        throw new EvaluationException("'" + symbol + "' not supported between instances of '"
                + typeName(a) + "' and '" + typeName(b) + "'");
    }

    private static int orderSequences(List<?> x, List<?> y, String symbol) {
        for (int i = 0; i < Math.min(x.size(), y.size()); i++) {
            if (!valueEquals(x.get(i), y.get(i))) return order(x.get(i), y.get(i), symbol);
        }
        return Integer.compare(x.size(), y.size());
    }

    public static boolean contains(Object container, Object item) {
        if (container instanceof String s) {
            if (!(item instanceof String sub)) {
                throw new EvaluationException("'in <string>' requires string as left operand, not " + typeName(item));
            }
            return s.contains(sub);
        }
        if (container instanceof Map<?, ?> map) return lookup(map, item).isPresent();
        if (container instanceof Tuple || container instanceof List) {
            for (Object element : iterate(container)) {
                if (valueEquals(element, item)) return true;
            }
            return false;
        }
        throw new EvaluationException("argument of type '" + typeName(container) + "' is not iterable");
    }

    public static boolean identical(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Boolean && b instanceof Boolean) return a.equals(b);
        return a == b;
    }

    // ---- subscripts ----

    public static Optional<Object> lookup(Map<?, ?> map, Object key) {
        if (map.containsKey(key)) return Optional.ofNullable(map.get(key));
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (valueEquals(e.getKey(), key)) return Optional.ofNullable(e.getValue());
        }
        return Optional.empty();
    }

    public static boolean hasKey(Map<?, ?> map, Object key) {
        if (map.containsKey(key)) return true;
        return map.keySet().stream().anyMatch(k -> valueEquals(k, key));
    }

    public static Object index(Object value, Object index) {
        if (value instanceof Map<?, ?> map) {
            if (!hasKey(map, index)) throw new EvaluationException("key not found: " + repr(index));
            return lookup(map, index).orElse(null);
        }
        if (!isSequence(value)) {
            throw new EvaluationException("'" + typeName(value) + "' object is not subscriptable");
        }
        if (!isInteger(index)) {
            throw new EvaluationException(typeName(value) + " indices must be integers, not " + typeName(index));
        }
        int n = length(value);
        long i = asLong(index);
        if (i < 0) i += n;
        if (i < 0 || i >= n) throw new EvaluationException(typeName(value) + " index out of range");
        if (value instanceof String s) return String.valueOf(s.charAt((int) i));
        if (value instanceof Tuple t) return t.items().get((int) i);
        return ((List<?>) value).get((int) i);
    }

    public static Object slice(Object value, Object lower, Object upper, Object step) {
        if (!isSequence(value)) {
            throw new EvaluationException("'" + typeName(value) + "' object is not subscriptable");
        }
        long n = length(value);
        long stride = step == null ? 1 : sliceBound(step);
        if (stride == 0) throw new EvaluationException("slice step cannot be zero");
        long start;
        long stop;
        if (stride > 0) {
            start = lower == null ? 0 : clamp(sliceBound(lower), n, 0, n);
            stop = upper == null ? n : clamp(sliceBound(upper), n, 0, n);
        } else {
            start = lower == null ? n - 1 : clamp(sliceBound(lower), n, -1, n - 1);
            stop = upper == null ? -1 : clamp(sliceBound(upper), n, -1, n - 1);
        }
        List<Integer> positions = new ArrayList<>();
        for (long i = start; stride > 0 ? i < stop : i > stop; i += stride) {
            positions.add((int) i);
        }
        if (value instanceof String s) {
            StringBuilder sb = new StringBuilder();
            positions.forEach(p -> sb.append(s.charAt(p)));
            return sb.toString();
        }
        List<?> source = value instanceof Tuple t ? t.items() : (List<?>) value;
        List<Object> items = new ArrayList<>();
        positions.forEach(p -> items.add(source.get(p)));
        return value instanceof Tuple ? new Tuple(items) : Collections.unmodifiableList(items);
    }

    private static boolean isSequence(Object value) {
        return value instanceof String || value instanceof List || value instanceof Tuple;
    }

    private static long sliceBound(Object bound) {
        if (!isInteger(bound)) {
            throw new EvaluationException("slice indices must be integers or None, not " + typeName(bound));
        }
        return asLong(bound);
    }

    private static long clamp(long v, long n, long lo, long hi) {
        if (v < 0) v += n;
        if (v < lo) return lo;
        return Math.min(v, hi);
    }

    // ---- helpers ----

    public static void checkLength(long length, int maxLength) {
        if (length > maxLength) {
            throw new SandboxException(SandboxException.SEQUENCE_TOO_LONG,
                    "Sequence of length " + length + " exceeds the limit of " + maxLength);
        }
    }

    public static <T> T checkSize(T value, int maxLength) {
        if (size(value, maxLength) > maxLength) {
            throw new SandboxException(SandboxException.SEQUENCE_TOO_LONG,
                    "Value with nested elements exceeds the size limit of " + maxLength);
        }
        return value;
    }

    // string characters plus the elements of every nested container; stops once over budget
    private static long size(Object value, long budget) {
        if (value instanceof String s) return Math.max(1, s.length());
        Collection<?> items;
        if (value instanceof Tuple t) {
            items = t.items();
        } else if (value instanceof List<?> l) {
            items = l;
        } else if (value instanceof Map<?, ?> m) {
            List<Object> entries = new ArrayList<>(m.size() * 2);
            m.forEach((k, v) -> {
                entries.add(k);
                entries.add(v);
            });
            items = entries;
        } else {
            return 1;
        }
        long total = 0;
        for (Object item : items) {
            total += size(item, budget - total);
            if (total > budget) return total;
        }
        return Math.max(1, total);
    }

    private static EvaluationException overflow() {
        return new EvaluationException("integer overflow");
    }

    private static EvaluationException unsupported(String op, Object a, Object b) {
        return new EvaluationException("unsupported operand type(s) for " + op + ": '"
                + typeName(a) + "' and '" + typeName(b) + "'");
    }
}
