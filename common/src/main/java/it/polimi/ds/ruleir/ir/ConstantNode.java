package it.polimi.ds.ruleir.ir;

import org.jspecify.annotations.Nullable;

import java.math.BigInteger;
import java.util.*;

/**
 * A value known at analysis time.
 * <p>
 * Only JSON-compatible values are accepted: {@code null}, {@link Boolean}, {@link Integer}, {@link Long},
 * {@link BigInteger}, {@link Double}, {@link String}, and {@link List}s or {@link Map}s with string keys of those.
 * Containers are copied into unmodifiable ones.
 */
public record ConstantNode(@Nullable Object value) implements RuleNode {

    public static final ConstantNode TRUE = new ConstantNode(true);
    public static final ConstantNode ONE = new ConstantNode(1);

    public ConstantNode {
        value = freeze(value);
    }

    @Override
    public Type getType() {
        return Type.CONSTANT;
    }

    public static boolean isJsonCompatible(@Nullable Object value) {
        if (value == null
                || value instanceof Boolean
                || value instanceof Integer
                || value instanceof Long
                || value instanceof BigInteger
                || value instanceof Double
                || value instanceof String)
            return true;

        if (value instanceof List<?> list)
            return list.stream().allMatch(ConstantNode::isJsonCompatible);

        if (value instanceof Map<?, ?> map)
            return map.entrySet().stream()
                    .allMatch(e -> e.getKey() instanceof String && isJsonCompatible(e.getValue()));

        return false;
    }

    private static @Nullable Object freeze(@Nullable Object value) {
        if (value instanceof List<?> list) {
            final List<@Nullable Object> copy = new ArrayList<>(list.size());
            for (Object element : list)
                copy.add(freeze(element));
            return Collections.unmodifiableList(copy);
        }

        if (value instanceof Map<?, ?> map) {
            final Map<String, @Nullable Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String key))
                    throw new IllegalArgumentException("Constant maps must have string keys, got " + e.getKey());
                copy.put(key, freeze(e.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }

        if (!isJsonCompatible(value))
            throw new IllegalArgumentException("Not a JSON-compatible constant: " + value +
                    " (" + value.getClass().getName() + ")");
        return value;
    }
}
