package it.polimi.ds.ruleir.analyzer;

import it.polimi.ds.ruleir.ir.RuleNode;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Per-game customization of the lowering. Every hook is optional.
 */
public interface GameHandler {

    GameHandler NONE = new GameHandler() {
    };

    /**
     * @param name name of the called helper
     * @param args lowered arguments, without the state and player ones
     * @return the node to use in place of the call, or null to let the analyzer lower it
     */
    default @Nullable RuleNode handleSpecialFunctionCall(String name, List<RuleNode> args) {
        return null;
    }

    /**
     * @return the name to emit in place of an unresolved {@code name}
     */
    default String replaceName(String name) {
        return name;
    }

    default @Nullable Integer getCollectionLength(String name) {
        return null;
    }

    /**
     * @return the elements of the named game collection, which must be JSON-compatible
     */
    default @Nullable List<?> getCollectionData(String name) {
        return null;
    }

    /**
     * @return whether calls to {@code name} are to be kept as {@code helper} nodes instead of being inlined
     */
    default boolean shouldPreserveAsHelper(String name) {
        return false;
    }
}
