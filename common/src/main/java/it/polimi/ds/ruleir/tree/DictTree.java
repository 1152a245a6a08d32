package it.polimi.ds.ruleir.tree;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A dict display. A null key marks a {@code **mapping} entry.
 */
public record DictTree(List<@Nullable ExpressionTree> keys, List<ExpressionTree> values, Span span)
        implements ExpressionTree {

    public DictTree {
        // List.copyOf rejects null elements
        keys = Collections.unmodifiableList(new ArrayList<>(keys));
        values = List.copyOf(values);
    }

    @Override
    public Kind getKind() {
        return Kind.DICT;
    }

    @Override
    public <R, P> R accept(TreeVisitor<R, P> visitor, P p) {
        return visitor.visitDict(this, p);
    }
}
