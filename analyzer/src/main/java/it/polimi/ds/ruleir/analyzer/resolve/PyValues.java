package it.polimi.ds.ruleir.analyzer.resolve;

import it.polimi.ds.ruleir.analyzer.fn.PredicateFunction;
import it.polimi.ds.ruleir.ir.ConstantNode;
import it.polimi.ds.ruleir.script.TreeRenderer;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.Array;
import java.lang.reflect.RecordComponent;
import java.math.BigInteger;
import java.util.*;

/**
 * Python semantics over the Java values found in predicate environments.
 * <p>
 * Booleans, integers ({@link Integer}, {@link Long}, {@link BigInteger}), floats ({@link Double}), strings, lists
 * and maps map to their Python counterparts. Enum constants behave like Python enum members whose {@code value} is
 * either their {@code value} attribute or their name, records behave like named tuples.
 */
public final class PyValues {

    private static final int MAX_POW_EXPONENT = 4096;
    /** Longest list or string a repetition is allowed to fold into. */
    public static final int MAX_SEQUENCE_LENGTH = 1 << 16;
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    public static final Comparator<@Nullable Object> SORT_ORDER = Comparator
            .comparing((@Nullable Object v) -> typeName(v))
            .thenComparing(PyValues::str);

    private PyValues() {
    }

    public static boolean isInt(@Nullable Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof BigInteger
                || value instanceof Short || value instanceof Byte;
    }

    public static boolean isNumber(@Nullable Object value) {
        return isInt(value) || value instanceof Double || value instanceof Float;
    }

    public static boolean isScalar(@Nullable Object value) {
        return value instanceof Boolean || isNumber(value) || value instanceof String || value instanceof Character;
    }

    /**
     * @return whether {@code value} can be emitted as a constant argument: a scalar, an enum constant, or a record,
     *         collection or map made of those
     */
    public static boolean isSimple(@Nullable Object value) {
        if (value == null)
            return false;
        return isSimpleOrNull(value);
    }

    private static boolean isSimpleOrNull(@Nullable Object value) {
        if (value == null || isScalar(value) || value instanceof Enum<?>)
            return true;
        if (value instanceof PredicateFunction)
            return false;
        if (value instanceof Record record)
            return components(record).stream().allMatch(PyValues::isSimpleOrNull);
        if (value instanceof Collection<?> collection)
            return collection.stream().allMatch(PyValues::isSimpleOrNull);
        if (value instanceof Map<?, ?> map)
            return map.entrySet().stream()
                    .allMatch(e -> isScalar(e.getKey()) && isSimpleOrNull(e.getValue()));
        if (value.getClass().isArray())
            return asList(value).stream().allMatch(PyValues::isSimpleOrNull);
        return false;
    }

    /**
     * Converts a name's value to a constant node, if it is one of the values names are folded into: {@code None},
     * scalars, enum constants with a scalar value and records.
     *
     * @return the constant, or null if the name has to stay symbolic
     */
    public static @Nullable ConstantNode nameConstant(@Nullable Object value) {
        if (value == null)
            return new ConstantNode(null);
        if (isScalar(value))
            return new ConstantNode(toJson(value));
        if (value instanceof Enum<?> constant) {
            final Object enumValue = enumValue(constant);
            return isScalar(enumValue) ? new ConstantNode(toJson(enumValue)) : null;
        }
        if (value instanceof Record)
            return new ConstantNode(toJson(value));
        return null;
    }

    /**
     * @return the constant an argument resolved to, unwrapping enum constants into their value
     */
    public static ConstantNode argumentConstant(Object value) {
        return new ConstantNode(toJson(value instanceof Enum<?> constant ? enumValue(constant) : value));
    }

    public static @Nullable Object enumValue(Enum<?> constant) {
        final Object value = Attributes.get(constant, "value");
        return value != null ? value : constant.name();
    }

    /**
     * Converts any value to a JSON-compatible one. Sets become lists sorted by {@link #SORT_ORDER}, records become
     * lists of their components, and anything without a JSON counterpart becomes its string form.
     */
    public static @Nullable Object toJson(@Nullable Object value) {
        if (value == null || value instanceof Boolean || value instanceof String
                || value instanceof Integer || value instanceof Long || value instanceof BigInteger
                || value instanceof Double)
            return value;
        if (value instanceof Short || value instanceof Byte)
            return ((Number) value).intValue();
        if (value instanceof Float f)
            return f.doubleValue();
        if (value instanceof Character c)
            return c.toString();
        if (value instanceof Enum<?> constant)
            return toJson(enumValue(constant));
        if (value instanceof Record record)
            return toJsonList(components(record));
        if (value instanceof Set<?> set) {
            final List<@Nullable Object> list = toJsonList(set);
            list.sort(SORT_ORDER);
            return list;
        }
        if (value instanceof Collection<?> collection)
            return toJsonList(collection);
        if (value.getClass().isArray())
            return toJsonList(asList(value));
        if (value instanceof Map<?, ?> map) {
            final Map<String, @Nullable Object> json = new LinkedHashMap<>();
            map.forEach((k, v) -> json.put(k instanceof String s ? s : str(k), toJson(v)));
            return json;
        }
        return String.valueOf(value);
    }

    private static List<@Nullable Object> toJsonList(Collection<?> collection) {
        final List<@Nullable Object> list = new ArrayList<>(collection.size());
        for (Object element : collection)
            list.add(toJson(element));
        return list;
    }

    public static BigInteger toBigInteger(Object value) {
        if (value instanceof BigInteger big)
            return big;
        if (value instanceof Boolean b)
            return b ? BigInteger.ONE : BigInteger.ZERO;
        return BigInteger.valueOf(((Number) value).longValue());
    }

    public static Object narrow(BigInteger value) {
        if (value.compareTo(INT_MIN) >= 0 && value.compareTo(INT_MAX) <= 0)
            return value.intValue();
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0)
            return value.longValue();
        return value;
    }

    public static String typeName(@Nullable Object value) {
        if (value == null)
            return "NoneType";
        if (value instanceof Boolean)
            return "bool";
        if (isInt(value))
            return "int";
        if (value instanceof Double || value instanceof Float)
            return "float";
        if (value instanceof String || value instanceof Character)
            return "str";
        if (value instanceof List<?> || value.getClass().isArray())
            return "list";
        if (value instanceof Set<?>)
            return "set";
        if (value instanceof Map<?, ?>)
            return "dict";
        return value.getClass().getSimpleName();
    }

    /**
     * @return Python's {@code str()} of the value
     */
    public static String str(@Nullable Object value) {
        return value instanceof String s ? s : repr(value);
    }

    /**
     * @return Python's {@code repr()} of the value
     */
    public static String repr(@Nullable Object value) {
        if (value == null || value instanceof Boolean || value instanceof String
                || value instanceof Integer || value instanceof Long || value instanceof BigInteger
                || value instanceof Double)
            return TreeRenderer.literal(value);
        if (isScalar(value))
            return repr(toJson(value));

        final StringJoiner joiner;
        if (value instanceof List<?> list) {
            joiner = new StringJoiner(", ", "[", "]");
            list.forEach(e -> joiner.add(repr(e)));
            return joiner.toString();
        }
        if (value instanceof Map<?, ?> map) {
            joiner = new StringJoiner(", ", "{", "}");
            map.forEach((k, v) -> joiner.add(repr(k) + ": " + repr(v)));
            return joiner.toString();
        }
        return String.valueOf(value);
    }

    /**
     * Applies a Python binary operator. Only {@code + - * / // % **} are supported.
     *
     * @return the result, or null if the operator is not supported for the operands or the operation fails
     */
    public static @Nullable Object binary(String op, @Nullable Object left, @Nullable Object right) {
        if (left == null || right == null)
            return null;

        final Object l = operand(left);
        final Object r = operand(right);
        if (l == null || r == null)
            return null;

        if (isNumber(l) && isNumber(r))
            return l instanceof Double || r instanceof Double
                    ? floatArithmetic(op, ((Number) l).doubleValue(), ((Number) r).doubleValue())
                    : intArithmetic(op, toBigInteger(l), toBigInteger(r));

        switch (op) {
            case "+" -> {
                if (l instanceof String ls && r instanceof String rs)
                    return ls + rs;
                if (l instanceof List<?> ll && r instanceof List<?> rl) {
                    final List<@Nullable Object> concat = new ArrayList<>(ll);
                    concat.addAll(rl);
                    return concat;
                }
            }
            case "*" -> {
                if (isInt(r))
                    return repeat(l, toBigInteger(r));
                if (isInt(l))
                    return repeat(r, toBigInteger(l));
            }
            default -> {
                // No other operator applies to sequences
            }
        }
        return null;
    }

    private static @Nullable Object operand(Object value) {
        if (value instanceof Boolean b)
            return b ? 1 : 0;
        if (isScalar(value))
            return toJson(value);
        if (value instanceof List<?>)
            return value;
        if (value instanceof Collection<?> || value.getClass().isArray())
            return toJson(value);
        return null;
    }

    private static @Nullable Object repeat(Object sequence, BigInteger times) {
        if (times.bitLength() > 31)
            return null;

        final int n = Math.max(0, times.intValue());
        if (sequence instanceof String s)
            return repeatedLength(s.length(), n) != null ? s.repeat(n) : null;
        if (sequence instanceof List<?> list) {
            final Integer length = repeatedLength(list.size(), n);
            if (length == null)
                return null;

            final List<@Nullable Object> repeated = new ArrayList<>(length);
            for (int i = 0; i < n; i++)
                repeated.addAll(list);
            return repeated;
        }
        return null;
    }

    /**
     * @return the length of a sequence of the given length repeated {@code times} times, or null if it would
     *         exceed {@link #MAX_SEQUENCE_LENGTH}
     */
    public static @Nullable Integer repeatedLength(int length, int times) {
        final long repeated = (long) length * Math.max(0, times);
        return repeated <= MAX_SEQUENCE_LENGTH ? (int) repeated : null;
    }

    private static @Nullable Object floatArithmetic(String op, double a, double b) {
        final double result = switch (op) {
            case "+" -> a + b;
            case "-" -> a - b;
            case "*" -> a * b;
            case "/" -> b == 0 ? Double.NaN : a / b;
            case "//" -> b == 0 ? Double.NaN : Math.floor(a / b);
            case "%" -> b == 0 ? Double.NaN : a - b * Math.floor(a / b);
            case "**" -> Math.pow(a, b);
            default -> Double.NaN;
        };
        return finite(result);
    }

    private static @Nullable Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private static @Nullable Object intArithmetic(String op, BigInteger a, BigInteger b) {
        switch (op) {
            case "+":
                return narrow(a.add(b));
            case "-":
                return narrow(a.subtract(b));
            case "*":
                return narrow(a.multiply(b));
            case "/":
                return b.signum() == 0 ? null : finite(a.doubleValue() / b.doubleValue());
            case "//":
                return b.signum() == 0 ? null : narrow(floorDiv(a, b));
            case "%":
                return b.signum() == 0 ? null : narrow(a.subtract(b.multiply(floorDiv(a, b))));
            case "**":
                if (b.signum() < 0)
                    return a.signum() == 0 ? null : finite(Math.pow(a.doubleValue(), b.doubleValue()));
                if (b.compareTo(BigInteger.valueOf(MAX_POW_EXPONENT)) > 0)
                    return null;
                return narrow(a.pow(b.intValue()));
            default:
                return null;
        }
    }

    private static BigInteger floorDiv(BigInteger a, BigInteger b) {
        final BigInteger[] qr = a.divideAndRemainder(b);
        return qr[1].signum() != 0 && qr[1].signum() != b.signum()
                ? qr[0].subtract(BigInteger.ONE)
                : qr[0];
    }

    /**
     * Python's {@code value[index]} over lists (negative indexes included), maps and strings.
     *
     * @return the element, or null if there is none
     */
    public static @Nullable Object subscript(Object value, Object index) {
        if (value instanceof Map<?, ?> map)
            return map.get(index);

        final List<?> list;
        if (value instanceof List<?> l)
            list = l;
        else if (value instanceof Record record)
            list = components(record);
        else if (value.getClass().isArray())
            list = asList(value);
        else if (value instanceof String s)
            list = s.codePoints().mapToObj(cp -> new String(Character.toChars(cp))).toList();
        else
            return null;

        if (!isInt(index) && !(index instanceof Boolean))
            return null;

        final BigInteger i = toBigInteger(index);
        final BigInteger actual = i.signum() < 0 ? i.add(BigInteger.valueOf(list.size())) : i;
        if (actual.signum() < 0 || actual.compareTo(BigInteger.valueOf(list.size())) >= 0)
            return null;
        return list.get(actual.intValue());
    }

    static List<@Nullable Object> components(Record record) {
        final RecordComponent[] components = record.getClass().getRecordComponents();
        final List<@Nullable Object> values = new ArrayList<>(components.length);
        for (RecordComponent component : components)
            values.add(Attributes.get(record, component.getName()));
        return values;
    }

    private static List<@Nullable Object> asList(Object array) {
        final int length = Array.getLength(array);
        final List<@Nullable Object> list = new ArrayList<>(length);
        for (int i = 0; i < length; i++)
            list.add(Array.get(array, i));
        return list;
    }
}
