package it.polimi.ds.ruleir.analyzer.env;

import it.polimi.ds.ruleir.analyzer.fn.ClosureCell;
import it.polimi.ds.ruleir.analyzer.fn.PredicateFunction;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds the environment a function is lowered in.
 * <p>
 * From the lowest to the highest precedence:
 * <ol>
 *     <li>module globals that are either whitelisted or enum classes</li>
 *     <li>bindings inherited from the caller, when the function is being inlined</li>
 *     <li>the bound cells of the function's own closure</li>
 *     <li>{@code self}, bound to the receiver of bound methods, unless something already defines it</li>
 *     <li>overrides given by the caller</li>
 * </ol>
 */
public final class EnvironmentBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnvironmentBuilder.class);

    private final Set<String> globalWhitelist;

    public EnvironmentBuilder(Set<String> globalWhitelist) {
        this.globalWhitelist = Set.copyOf(globalWhitelist);
    }

    public Environment build(PredicateFunction fn,
                             Environment inherited,
                             Map<String, @Nullable Object> overrides) {
        final Map<String, @Nullable Object> bindings = new LinkedHashMap<>();

        fn.globals().forEach((name, value) -> {
            if (globalWhitelist.contains(name) || value instanceof Class<?> clazz && clazz.isEnum())
                bindings.put(name, value);
        });

        bindings.putAll(inherited.asMap());

        for (ClosureCell cell : fn.closure()) {
            if (cell.isBound())
                bindings.put(cell.name(), cell.get());
            else
                LOGGER.debug("Skipping empty closure cell {} of {}", cell.name(), fn.name());
        }

        final Object receiver = fn.receiver();
        if (receiver != null && !bindings.containsKey("self"))
            bindings.put("self", receiver);

        bindings.putAll(overrides);
        return Environment.of(bindings);
    }

    public Environment build(Environment inherited, Map<String, @Nullable Object> overrides) {
        return inherited.layer(overrides);
    }
}
