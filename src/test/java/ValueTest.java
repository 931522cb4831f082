import org.junit.jupiter.api.Test;

import com.useless.script.error.ErrorKind;
import com.useless.script.error.ScriptError;
import com.useless.script.parser.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTest {

    @Test
    void truthiness() {
        assertFalse(Value.nil().coerceBoolean());
        assertFalse(Value.number(0).coerceBoolean());
        assertFalse(Value.number(Double.NaN).coerceBoolean());
        assertFalse(Value.string("").coerceBoolean());
        assertFalse(Value.bool(false).coerceBoolean());

        assertTrue(Value.number(-0.5).coerceBoolean());
        assertTrue(Value.string("false").coerceBoolean());
        assertTrue(Value.array(List.of()).coerceBoolean());
        assertTrue(Value.record(Map.of()).coerceBoolean());
    }

    @Test
    void booleansCompareAgainstTruthiness() {
        assertTrue(Value.scriptEquals(Value.bool(true), Value.number(3)));
        assertTrue(Value.scriptEquals(Value.string(""), Value.bool(false)));
        assertFalse(Value.scriptEquals(Value.bool(true), Value.number(0)));
    }

    @Test
    void nullOnlyEqualsNull() {
        assertTrue(Value.scriptEquals(Value.nil(), Value.nil()));
        assertFalse(Value.scriptEquals(Value.nil(), Value.bool(false)));
        assertFalse(Value.scriptEquals(Value.number(0), Value.nil()));
    }

    @Test
    void crossTypeComparisonsAreMismatches() {
        ScriptError e = assertThrows(ScriptError.class,
                () -> Value.scriptEquals(Value.number(1), Value.string("1")));
        assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
        assertTrue(e.getMessage().contains("Apples and oranges"));

        assertThrows(ScriptError.class, () -> Value.scriptEquals(Value.array(List.of()), Value.bool(true)));
        assertThrows(ScriptError.class, () -> Value.lessThan(Value.number(1), Value.string("2")));
        assertThrows(ScriptError.class, () -> Value.lessThan(Value.nil(), Value.nil()));
    }

    @Test
    void ordering() {
        assertTrue(Value.lessThan(Value.number(1), Value.number(2)));
        assertFalse(Value.lessThan(Value.number(2), Value.number(2)));
        assertTrue(Value.lessThan(Value.string("apple"), Value.string("banana")));
        assertTrue(Value.lessThan(Value.bool(false), Value.bool(true)));
        assertFalse(Value.lessThan(Value.bool(true), Value.bool(false)));
    }

    @Test
    void containersCompareStructurally() {
        Map<String, Value> ab = new LinkedHashMap<>();
        ab.put("a", Value.number(1));
        ab.put("b", Value.array(List.of(Value.string("x"))));
        Map<String, Value> ba = new LinkedHashMap<>();
        ba.put("b", Value.array(List.of(Value.string("x"))));
        ba.put("a", Value.number(1));

        assertTrue(Value.scriptEquals(Value.record(ab), Value.record(ba)));
        assertEquals(Value.record(ab).hashCode(), Value.record(ba).hashCode());
        assertFalse(Value.scriptEquals(Value.array(List.of(Value.number(1))), Value.array(List.of(Value.number(2)))));
        assertEquals(Value.number(0.0).hashCode(), Value.number(-0.0).hashCode());
    }

    @Test
    void containersAreSnapshots() {
        List<Value> items = new ArrayList<>();
        items.add(Value.number(1));
        Value arr = Value.array(items);
        items.add(Value.number(2));

        assertEquals(1, arr.asArray().size());
        assertThrows(UnsupportedOperationException.class, () -> arr.asArray().add(Value.nil()));
    }

    @Test
    void accessorsRejectTheWrongType() {
        ScriptError e = assertThrows(ScriptError.class, () -> Value.string("x").asNumber());
        assertEquals(ErrorKind.TYPE_MISMATCH, e.kind());
        assertThrows(ScriptError.class, () -> Value.number(1).asRecord());
        assertThrows(ScriptError.class, () -> Value.nil().asArray());
        assertEquals("text", Value.string("x").typeName());
        assertEquals("record", Value.record(Map.of()).typeName());
    }
}
