package it.polimi.ds.ruleir.analyzer.resolve;

import it.polimi.ds.ruleir.analyzer.env.Environment;
import it.polimi.ds.ruleir.analyzer.fn.Parameter;
import it.polimi.ds.ruleir.analyzer.fn.SourcePredicate;
import it.polimi.ds.ruleir.ir.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionResolverTest {

    static final Environment ENV = Environment.of(Map.of(
            "counts", List.of(4, 5),
            "door", new PyValuesTest.Location("Cave", 16),
            "bonus", 1));

    static final SourcePredicate FN = SourcePredicate.builder("rule")
            .source("lambda state, extra=2: True")
            .parameter(Parameter.of("state"))
            .parameter(Parameter.withDefault("extra", 2))
            .global("extra", 9)
            .global("options", Map.of("goal", "ganon"))
            .build();

    static final ExpressionResolver RESOLVER = new ExpressionResolver(ENV, FN);

    @Test
    void variables() {
        assertEquals(1, RESOLVER.resolveVariable("bonus"));
        assertEquals(2, RESOLVER.resolveVariable("extra"));
        assertEquals(Map.of("goal", "ganon"), RESOLVER.resolveVariable("options"));
        assertNull(RESOLVER.resolveVariable("state"));
        assertNull(RESOLVER.resolveVariable("unknown"));

        assertNull(new ExpressionResolver(ENV, null).resolveVariable("extra"));
    }

    @Test
    void expressions() {
        assertEquals(5, RESOLVER.resolve(new SubscriptNode(new NameNode("counts"), new ConstantNode(-1))));
        assertEquals("Cave", RESOLVER.resolve(new AttributeNode(new NameNode("door"), "name")));
        assertEquals("ganon", RESOLVER.resolve(new AttributeNode(new NameNode("options"), "goal")));
        assertEquals(6, RESOLVER.resolve(new BinaryOpNode(new NameNode("extra"), "*", new ConstantNode(3))));
        assertEquals(List.of(4, 5, 4, 5),
                RESOLVER.resolve(new BinaryOpNode(new NameNode("counts"), "*", new ConstantNode(2))));
    }

    @Test
    void unresolvable() {
        assertNull(RESOLVER.resolve(null));
        assertNull(RESOLVER.resolve(new NameNode("unknown")));
        assertNull(RESOLVER.resolve(new SubscriptNode(new NameNode("counts"), new NameNode("unknown"))));
        assertNull(RESOLVER.resolve(new AttributeNode(new NameNode("unknown"), "name")));
        assertNull(RESOLVER.resolve(new HelperNode("helper", List.of())));
        assertNull(RESOLVER.resolve(new ItemCheckNode(new ConstantNode("A"))));
    }
}
