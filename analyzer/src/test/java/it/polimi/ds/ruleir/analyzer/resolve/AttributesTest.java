package it.polimi.ds.ruleir.analyzer.resolve;

import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AttributesTest {

    enum Medallion {
        BOMBOS, ETHER
    }

    record Location(String name, int address) {
    }

    static class Options {
        public static final int MAX_KEYS = 3;

        public final String goal = "ganon";

        public int getShopSlots() {
            return 4;
        }

        public boolean isOpen() {
            return true;
        }

        public int getBroken() {
            throw new IllegalStateException("Not available");
        }

        public void reset() {
        }
    }

    @Test
    void maps() {
        assertEquals(1, Attributes.get(Map.of("a", 1), "a"));
        assertNull(Attributes.get(Map.of("a", 1), "b"));
    }

    @Test
    void classes() {
        assertEquals(Medallion.ETHER, Attributes.get(Medallion.class, "ETHER"));
        assertEquals(3, Attributes.get(Options.class, "MAX_KEYS"));
        assertNull(Attributes.get(Medallion.class, "QUAKE"));
        assertNull(Attributes.get(Options.class, "goal"));
    }

    @Test
    void instances() {
        final Options options = new Options();
        assertEquals("ganon", Attributes.get(options, "goal"));
        assertEquals(4, Attributes.get(options, "shop_slots"));
        assertEquals(4, Attributes.get(options, "shopSlots"));
        assertEquals(true, Attributes.get(options, "open"));
        assertNull(Attributes.get(options, "broken"));
        assertNull(Attributes.get(options, "reset"));
        assertNull(Attributes.get(options, "missing"));

        assertEquals("Cave", Attributes.get(new Location("Cave", 1), "name"));
        assertEquals(1, Attributes.get(new Location("Cave", 1), "address"));
    }

    @Test
    void plainMethodsAreNotInvoked() {
        final Deque<String> keys = new ArrayDeque<>(List.of("Big Key", "Small Key"));
        assertNull(Attributes.get(keys, "pop"));
        assertNull(Attributes.get(keys.iterator(), "next"));
        assertEquals(List.of("Big Key", "Small Key"), List.copyOf(keys));
    }

    @Test
    void camelCase() {
        assertEquals("hasBigKey", Attributes.toCamelCase("has_big_key"));
        assertEquals("level2", Attributes.toCamelCase("level_2"));
        assertEquals("plain", Attributes.toCamelCase("plain"));
    }
}
