package it.polimi.ds.ruleir.analyzer.resolve;

import it.polimi.ds.ruleir.analyzer.GameHandler;
import it.polimi.ds.ruleir.ir.*;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CollectionFolderTest {

    static final GameHandler HANDLER = new GameHandler() {
        @Override
        public @Nullable Integer getCollectionLength(String name) {
            return switch (name) {
                case "keys" -> 3;
                case "rupees" -> 2_000_000_000;
                default -> null;
            };
        }

        @Override
        public @Nullable List<?> getCollectionData(String name) {
            return switch (name) {
                case "bosses" -> List.of("Moldorm", "Arrghus");
                case "rewards" -> List.of(PyValuesTest.Medallion.ETHER);
                default -> null;
            };
        }
    };

    static final CollectionFolder FOLDER = new CollectionFolder(HANDLER, 4);

    private static ConstantNode constant(Object value) {
        return new ConstantNode(value);
    }

    @Test
    void repeatLists() {
        var list = new ListNode(List.of(constant(1)));

        assertEquals(new ListNode(List.of(constant(1), constant(1), constant(1))),
                FOLDER.foldBinary(list, "*", constant(3)));
        assertEquals(new ListNode(List.of(constant(1), constant(1))),
                FOLDER.foldBinary(list, "*", new HelperNode("len", List.of(constant(List.of("a", "b"))))));
        assertEquals(new ListNode(List.of(constant(1), constant(1), constant(1))),
                FOLDER.foldBinary(list, "*", new HelperNode("len", List.of(new NameNode("keys")))));

        assertNull(FOLDER.foldBinary(list, "*", constant(0)));
        assertNull(FOLDER.foldBinary(list, "*", new NameNode("n")));
        assertNull(FOLDER.foldBinary(list, "-", constant(3)));
    }

    @Test
    void repeatTooLongIsNotFolded() {
        var list = new ListNode(List.of(constant(1), constant(2), constant(3)));

        assertNull(FOLDER.foldBinary(list, "*", constant(2_000_000_000)));
        assertNull(FOLDER.foldBinary(list, "*", new HelperNode("len", List.of(new NameNode("rupees")))));
        assertEquals(PyValues.MAX_SEQUENCE_LENGTH,
                ((ListNode) FOLDER.foldBinary(new ListNode(List.of(constant(1))), "*",
                        constant(PyValues.MAX_SEQUENCE_LENGTH))).value().size());
    }

    @Test
    void concatenateCollections() {
        assertEquals(constant(List.of("Moldorm", "Arrghus", "ETHER")),
                FOLDER.foldBinary(new NameNode("bosses"), "+", new NameNode("rewards")));
        assertNull(FOLDER.foldBinary(new NameNode("bosses"), "+", new NameNode("unknown")));
    }

    @Test
    void length() {
        assertEquals(constant(3), FOLDER.foldLen(new NameNode("keys")));
        assertEquals(constant(2), FOLDER.foldLen(new ListNode(List.of(constant(1), new NameNode("player")))));
        assertEquals(constant(3), FOLDER.foldLen(constant(List.of(1, 2, 3))));
        assertNull(FOLDER.foldLen(new NameNode("bosses")));
        assertNull(FOLDER.foldLen(new ListNode(List.of(new NameNode("other")))));
    }

    @Test
    void zip() {
        assertEquals(constant(List.of(List.of(4, "a"), List.of(2, "b"))),
                FOLDER.foldZip(List.of(
                        new ListNode(List.of(new NameNode("player"), constant(2))),
                        constant(List.of("a", "b", "c")))));
        assertEquals(constant(List.of(List.of("Moldorm", "x"), List.of("Arrghus", "x"))),
                FOLDER.foldZip(List.of(
                        new NameNode("bosses"),
                        new BinaryOpNode(new ListNode(List.of(constant("x"))), "*", constant(2)))));

        assertNull(FOLDER.foldZip(List.of(constant(List.of(1)))));
        assertNull(FOLDER.foldZip(List.of(constant(List.of(1)), new NameNode("unknown"))));
    }
}
