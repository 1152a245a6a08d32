package it.polimi.ds.ruleir.analyzer.resolve;

import it.polimi.ds.ruleir.analyzer.fn.SourcePredicate;
import it.polimi.ds.ruleir.ir.ConstantNode;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class PyValuesTest {

    enum Medallion {
        BOMBOS, ETHER
    }

    enum Difficulty {
        EASY(0), HARD(2);

        public final int value;

        Difficulty(int value) {
            this.value = value;
        }
    }

    record Location(String name, int address) {
    }

    @Test
    void intArithmetic() {
        assertEquals(5, PyValues.binary("+", 2, 3));
        assertEquals(-1, PyValues.binary("-", 2, 3));
        assertEquals(-2, PyValues.binary("//", -7, 4));
        assertEquals(1, PyValues.binary("%", -7, 4));
        assertEquals(-1, PyValues.binary("%", 7, -4));
        assertEquals(2.5, PyValues.binary("/", 5, 2));
        assertEquals(1024, PyValues.binary("**", 2, 10));
        assertEquals(0.5, PyValues.binary("**", 2, -1));
        assertEquals(2, PyValues.binary("+", true, 1));
    }

    @Test
    void integersWiden() {
        assertEquals(4_294_967_296L, PyValues.binary("*", 65_536, 65_536));
        assertEquals(BigInteger.ONE.shiftLeft(100), PyValues.binary("**", 2, 100));
        assertEquals(Integer.MAX_VALUE, PyValues.narrow(BigInteger.valueOf(Integer.MAX_VALUE)));
    }

    @Test
    void unsupportedArithmetic() {
        assertNull(PyValues.binary("/", 1, 0));
        assertNull(PyValues.binary("//", 1, 0));
        assertNull(PyValues.binary("%", 1.0, 0));
        assertNull(PyValues.binary("<<", 1, 2));
        assertNull(PyValues.binary("-", "a", "b"));
        assertNull(PyValues.binary("+", null, 1));
        assertNull(PyValues.binary("+", new Object(), 1));
        assertNull(PyValues.binary("**", 2, 100_000));
    }

    @Test
    void floatArithmetic() {
        assertEquals(3.5, PyValues.binary("+", 1.5, 2));
        assertEquals(-1.0, PyValues.binary("//", -1.5, 2));
        assertEquals(0.5, PyValues.binary("%", -1.5, 2));
    }

    @Test
    void nonFiniteFloatsAreNotResolved() {
        assertNull(PyValues.binary("**", 2.0, 10_000));
        assertNull(PyValues.binary("*", 1e308, 10.0));
        assertNull(PyValues.binary("/", 1e308, 0.1));
    }

    @Test
    void sequences() {
        assertEquals("abab", PyValues.binary("*", "ab", 2));
        assertEquals("abab", PyValues.binary("*", 2, "ab"));
        assertEquals("ab", PyValues.binary("+", "a", "b"));
        assertEquals(List.of(1, 2, 1, 2), PyValues.binary("*", List.of(1, 2), 2));
        assertEquals(List.of(), PyValues.binary("*", List.of(1, 2), -1));
        assertEquals(List.of(1, 2, 3), PyValues.binary("+", List.of(1), List.of(2, 3)));
    }

    @Test
    void repeatTooLongIsNotResolved() {
        assertNull(PyValues.binary("*", List.of(1, 2, 3), 2_000_000_000));
        assertNull(PyValues.binary("*", List.of("a", "b", "c"), 1_000_000_000));
        assertNull(PyValues.binary("*", "x", 2_000_000_000));
        assertEquals(PyValues.MAX_SEQUENCE_LENGTH,
                ((String) PyValues.binary("*", "x", PyValues.MAX_SEQUENCE_LENGTH)).length());
    }

    @Test
    void subscript() {
        assertEquals(3, PyValues.subscript(List.of(1, 2, 3), -1));
        assertEquals(1, PyValues.subscript(List.of(1, 2, 3), false));
        assertNull(PyValues.subscript(List.of(1, 2, 3), 3));
        assertNull(PyValues.subscript(List.of(1, 2, 3), "0"));
        assertEquals("b", PyValues.subscript("abc", 1));
        assertEquals("v", PyValues.subscript(Map.of("k", "v"), "k"));
        assertEquals(0x10, PyValues.subscript(new Location("Cave", 0x10), 1));
        assertEquals(7, PyValues.subscript(new int[]{5, 6, 7}, 2));
    }

    @Test
    void toJson() {
        assertEquals(List.of("Cave", 16), PyValues.toJson(new Location("Cave", 16)));
        assertEquals(List.of(1, "a", "b"), PyValues.toJson(new LinkedHashSet<>(List.of("b", 1, "a"))));
        assertEquals("ETHER", PyValues.toJson(Medallion.ETHER));
        assertEquals(2, PyValues.toJson(Difficulty.HARD));
        assertEquals(Map.of("1", "x"), PyValues.toJson(Map.of(1, 'x')));
        assertEquals(3, PyValues.toJson((short) 3));
        assertEquals(1.5, PyValues.toJson(1.5f));
    }

    @Test
    void constants() {
        assertEquals(new ConstantNode(null), PyValues.nameConstant(null));
        assertEquals(new ConstantNode("x"), PyValues.nameConstant("x"));
        assertEquals(new ConstantNode(2), PyValues.nameConstant(Difficulty.HARD));
        assertEquals(new ConstantNode(List.of("Cave", 1)), PyValues.nameConstant(new Location("Cave", 1)));
        assertNull(PyValues.nameConstant(List.of(1, 2)));
        assertNull(PyValues.nameConstant(new Object()));

        assertEquals(new ConstantNode("BOMBOS"), PyValues.argumentConstant(Medallion.BOMBOS));
        assertEquals(new ConstantNode(List.of(1, 2)), PyValues.argumentConstant(List.of(1, 2)));
    }

    @Test
    void simpleValues() {
        assertTrue(PyValues.isSimple("a"));
        assertTrue(PyValues.isSimple(Medallion.ETHER));
        assertTrue(PyValues.isSimple(List.of(1, Set.of("a"), Map.of("k", List.of()))));
        assertTrue(PyValues.isSimple(new Location("Cave", 1)));
        assertTrue(PyValues.isSimple(Arrays.asList(1, null)));
        assertFalse(PyValues.isSimple(null));
        assertFalse(PyValues.isSimple(new Object()));
        assertFalse(PyValues.isSimple(List.of(new Object())));
        assertFalse(PyValues.isSimple(SourcePredicate.builder("rule").source("lambda: True").build()));
    }

    @Test
    void sortOrder() {
        final List<Object> values = new ArrayList<>(List.of("b", 10, "a", true, 2));
        values.sort(PyValues.SORT_ORDER);
        assertEquals(List.of(true, 10, 2, "a", "b"), values);
    }

    @Test
    void reprAndStr() {
        assertEquals("'a'", PyValues.repr("a"));
        assertEquals("a", PyValues.str("a"));
        assertEquals("None", PyValues.repr(null));
        assertEquals("[1, 'a', [True]]", PyValues.repr(List.of(1, "a", List.of(true))));
        assertEquals("{'k': 1.5}", PyValues.repr(Map.of("k", 1.5)));
        assertEquals("'c'", PyValues.repr('c'));
        assertEquals("dict", PyValues.typeName(Map.of()));
        assertEquals("Location", PyValues.typeName(new Location("Cave", 1)));
    }
}
