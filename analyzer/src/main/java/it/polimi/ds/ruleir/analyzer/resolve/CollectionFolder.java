package it.polimi.ds.ruleir.analyzer.resolve;

import it.polimi.ds.ruleir.analyzer.GameHandler;
import it.polimi.ds.ruleir.ir.*;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Folds list operations whose operands are known at analysis time.
 * <p>
 * Every method returns null when anything cannot be resolved: a partially folded result is never produced.
 */
public final class CollectionFolder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CollectionFolder.class);

    private final GameHandler handler;
    private final int player;

    public CollectionFolder(GameHandler handler, int player) {
        this.handler = handler;
        this.player = player;
    }

    /**
     * Folds {@code list * n}, {@code list * len(collection)} and {@code collection + collection}.
     */
    public @Nullable RuleNode foldBinary(RuleNode left, String op, RuleNode right) {
        if (op.equals("*") && left instanceof ListNode list) {
            final Integer times = right instanceof ConstantNode constant
                    ? positiveInt(constant.value())
                    : right instanceof HelperNode helper ? lenOf(helper) : null;
            if (times != null) {
                if (PyValues.repeatedLength(list.value().size(), times) == null) {
                    LOGGER.debug("Not folding {} * {}, the result would be too long", list.value(), times);
                    return null;
                }

                LOGGER.debug("Folded {} * {}", list.value(), times);
                return new ListNode(Collections.nCopies(times, list.value()).stream().flatMap(List::stream).toList());
            }
        }

        if (op.equals("+") && left instanceof NameNode && right instanceof NameNode) {
            final List<@Nullable Object> leftData = listData(left);
            final List<@Nullable Object> rightData = listData(right);
            if (leftData != null && rightData != null) {
                final List<@Nullable Object> concat = new ArrayList<>(leftData);
                concat.addAll(rightData);
                return new ConstantNode(concat);
            }
        }
        return null;
    }

    /**
     * Folds {@code len(x)} for named game collections, constant lists and literal lists of constants.
     */
    public @Nullable ConstantNode foldLen(RuleNode arg) {
        final Integer length = listLength(arg);
        if (length != null)
            return new ConstantNode(length);

        final List<@Nullable Object> data = arg instanceof NameNode ? null : listData(arg);
        return data != null ? new ConstantNode(data.size()) : null;
    }

    /**
     * Folds {@code zip(a, b)} into a constant list of pairs, as long as the result of zipping two lists.
     */
    public @Nullable ConstantNode foldZip(List<RuleNode> args) {
        if (args.size() != 2)
            return null;

        final List<@Nullable Object> first = listData(args.get(0));
        List<@Nullable Object> second = listData(args.get(1));
        if (first != null && second == null && args.get(1) instanceof BinaryOpNode binary)
            second = binaryData(binary);

        if (first == null || second == null)
            return null;

        final int size = Math.min(first.size(), second.size());
        final List<List<@Nullable Object>> zipped = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            final List<@Nullable Object> pair = new ArrayList<>(2);
            pair.add(first.get(i));
            pair.add(second.get(i));
            zipped.add(pair);
        }
        LOGGER.debug("Folded zip({}, {})", first, second);
        return new ConstantNode(zipped);
    }

    private @Nullable Integer listLength(RuleNode node) {
        return node instanceof NameNode name ? handler.getCollectionLength(name.name()) : null;
    }

    private @Nullable Integer lenOf(HelperNode helper) {
        if (!helper.name().equals("len") || helper.args().size() != 1)
            return null;

        final RuleNode arg = helper.args().get(0);
        final Integer length = listLength(arg);
        if (length != null)
            return length;
        return arg instanceof ConstantNode constant && constant.value() instanceof List<?> list ? list.size() : null;
    }

    /**
     * @return the elements of a named game collection, a constant list, or a literal list whose elements are
     *         constants or the player name
     */
    private @Nullable List<@Nullable Object> listData(RuleNode node) {
        if (node instanceof NameNode name) {
            final List<?> data = handler.getCollectionData(name.name());
            return data != null ? toJsonList(data) : null;
        }

        if (node instanceof ConstantNode constant)
            return constant.value() instanceof List<?> list ? new ArrayList<>(list) : null;

        if (node instanceof ListNode list) {
            final List<@Nullable Object> values = new ArrayList<>(list.value().size());
            for (RuleNode element : list.value()) {
                if (element instanceof ConstantNode constant)
                    values.add(constant.value());
                else if (element instanceof NameNode name && name.name().equals("player"))
                    values.add(player);
                else
                    return null;
            }
            return values;
        }
        return null;
    }

    private @Nullable List<@Nullable Object> binaryData(BinaryOpNode binary) {
        final RuleNode folded = foldBinary(binary.left(), binary.op(), binary.right());
        if (folded instanceof ListNode list)
            return listData(list);
        if (folded instanceof ConstantNode constant && constant.value() instanceof List<?> values)
            return new ArrayList<>(values);
        return null;
    }

    private static @Nullable Integer positiveInt(@Nullable Object value) {
        if (value instanceof Integer i && i > 0)
            return i;
        return null;
    }

    @SuppressWarnings("unchecked")
    private static List<@Nullable Object> toJsonList(List<?> data) {
        return (List<@Nullable Object>) PyValues.toJson(data);
    }
}
