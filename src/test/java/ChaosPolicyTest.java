import org.junit.jupiter.api.Test;

import com.useless.script.chaos.ArithOp;
import com.useless.script.chaos.ChaosPolicy;
import com.useless.script.chaos.DeterministicRandomSource;
import com.useless.script.chaos.PromiseFate;
import com.useless.script.error.ErrorKind;
import com.useless.script.error.ScriptError;
import com.useless.script.parser.Value;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ChaosPolicyTest {

    private static final int N = 10_000;

    private static ChaosPolicy seeded(long seed) {
        return new ChaosPolicy(new DeterministicRandomSource(seed));
    }

    @Test
    void addBecomesMultiplyAboutOneTimeInFive() {
        ChaosPolicy chaos = seeded(42);
        int multiply = 0;
        for (int i = 0; i < N; i++) {
            ArithOp op = chaos.pickArithAlt(ArithOp.ADD);
            assertNotEquals(ArithOp.ADD, op);
            if (op == ArithOp.MULTIPLY) multiply++;
        }
        assertEquals(0.2, multiply / (double) N, 0.02);
    }

    @Test
    void multiplyNeverMultiplies() {
        ChaosPolicy chaos = seeded(7);
        int add = 0;
        for (int i = 0; i < N; i++) {
            ArithOp op = chaos.pickArithAlt(ArithOp.MULTIPLY);
            assertTrue(op == ArithOp.ADD || op == ArithOp.DIVIDE);
            if (op == ArithOp.ADD) add++;
        }
        assertEquals(0.2, add / (double) N, 0.02);
    }

    @Test
    void divisionByZeroRaises() {
        ScriptError e = assertThrows(ScriptError.class, () -> ArithOp.DIVIDE.apply(1, 0));
        assertEquals(ErrorKind.DIVISION_BY_ZERO, e.kind());
        assertEquals(-2.0, ArithOp.SUBTRACT.apply(1, 3), 1e-9);
    }

    @Test
    void aboutAQuarterOfExpressionsBecomeBooleans() {
        ChaosPolicy chaos = seeded(3);
        int replaced = 0;
        for (int i = 0; i < N; i++) {
            Value v = chaos.maybeRandomizeExpressionResult(Value.number(i));
            if (v.getType() == Value.Type.BOOL) replaced++;
        }
        assertEquals(0.25, replaced / (double) N, 0.02);
    }

    @Test
    void booleanFormsFollowTheTable() {
        ChaosPolicy chaos = seeded(9);
        int flipped = 0, text = 0, number = 0, same = 0;
        for (int i = 0; i < N; i++) {
            Value v = chaos.maybeFlipBoolean(Value.bool(true));
            switch (v.getType()) {
                case BOOL:
                    if (v.asBool()) same++; else flipped++;
                    break;
                case STRING:
                    assertEquals("false", v.asString());
                    text++;
                    break;
                case NUMBER:
                    assertEquals(0.0, v.asNumber(), 0);
                    number++;
                    break;
                default:
                    fail("unexpected " + v);
            }
        }
        assertEquals(0.30, flipped / (double) N, 0.02);
        assertEquals(0.20, text / (double) N, 0.02);
        assertEquals(0.20, number / (double) N, 0.02);
        assertEquals(0.30, same / (double) N, 0.02);
    }

    @Test
    void letsGoMissingAboutOneTimeInFive() {
        ChaosPolicy chaos = seeded(21);
        int lost = 0;
        for (int i = 0; i < N; i++) {
            if (chaos.letLost("x")) lost++;
        }
        assertEquals(0.20, lost / (double) N, 0.02);
    }

    @Test
    void nonBooleansKeepTheirForm() {
        ChaosPolicy chaos = seeded(1);
        for (int i = 0; i < 100; i++) {
            assertEquals(Value.string("x"), chaos.maybeFlipBoolean(Value.string("x")));
        }
    }

    @Test
    void outOfRangeIndexAlwaysFails_acrossSeeds() {
        for (long seed = 0; seed < 200; seed++) {
            ChaosPolicy chaos = seeded(seed);
            for (double idx : new double[] { -1, 3, 4, 100 }) {
                ScriptError e = assertThrows(ScriptError.class, () -> chaos.pickContainerIndex(3, idx));
                assertEquals(ErrorKind.INDEX_OUT_OF_VACATION, e.kind());
            }
            int chosen = chaos.pickContainerIndex(3, 1);
            assertTrue(chosen >= 0 && chosen < 3);
        }
    }

    @Test
    void indexMovesAboutThreeQuartersOfTheTime() {
        ChaosPolicy chaos = seeded(21);
        int kept = 0;
        for (int i = 0; i < N; i++) {
            if (chaos.pickContainerIndex(4, 2) == 2) kept++;
        }
        // 25% untouched plus a quarter of the 75% that land on 2 anyway.
        assertEquals(0.25 + 0.75 / 4, kept / (double) N, 0.02);
    }

    @Test
    void fieldPickStaysInsideTheRecord() {
        ChaosPolicy chaos = seeded(5);
        Map<String, Value> rec = new LinkedHashMap<>();
        rec.put("a", Value.number(1));
        rec.put("b", Value.number(2));
        for (int i = 0; i < 500; i++) {
            String k = chaos.pickField(rec, "zzz");
            assertTrue(k.equals("zzz") || rec.containsKey(k), k);
        }
        ScriptError e = assertThrows(ScriptError.class, () -> chaos.pickField(Map.of(), "a"));
        assertEquals(ErrorKind.EMPTY_RECORD_ACCESS, e.kind());
    }

    @Test
    void promiseFatesFollowTheTable() {
        ChaosPolicy chaos = seeded(17);
        Map<PromiseFate, Integer> counts = new EnumMap<>(PromiseFate.class);
        for (int i = 0; i < N; i++) counts.merge(chaos.promiseTick(), 1, Integer::sum);
        assertEquals(0.50, counts.get(PromiseFate.RESOLVE) / (double) N, 0.02);
        assertEquals(0.15, counts.get(PromiseFate.ABANDON) / (double) N, 0.02);
        assertEquals(0.35, counts.get(PromiseFate.STAY_PENDING) / (double) N, 0.02);
    }

    @Test
    void controlFlowRulesHoldEvenWhenCalm() {
        ChaosPolicy chaos = seeded(0);
        chaos.setCalm(true);
        assertTrue(chaos.isCalm());
        assertEquals("else", chaos.invertBranchAlways("then", "else"));
        assertNull(chaos.invertBranchAlways("then", null));
        assertEquals("body", chaos.loopOnce("body"));
    }

    @Test
    void calmModeIsHonest() {
        ChaosPolicy chaos = seeded(8);
        chaos.setCalm(true);
        for (int i = 0; i < 1000; i++) {
            assertEquals(ArithOp.ADD, chaos.pickArithAlt(ArithOp.ADD));
            assertEquals(Value.bool(true), chaos.applyExpressionChaos(Value.bool(true)));
            assertEquals(Value.number(4), chaos.maybePartyNumber(4));
            assertEquals(1, chaos.pickContainerIndex(3, 1));
            assertFalse(chaos.variableOnVacation("x"));
            assertFalse(chaos.letLost("x"));
            assertFalse(chaos.printFails());
            assertFalse(chaos.teapot());
            assertFalse(chaos.flagMindChange());
            assertTrue(chaos.surfaceComparisonMismatch());
            assertEquals(PromiseFate.RESOLVE, chaos.promiseTick());
        }
    }

    @Test
    void partyLengthIsCapped() {
        ChaosPolicy chaos = new ScriptedChaos().rolls(com.useless.script.chaos.ChaosPoint.PARTY_NUMBER, 0.0, 0.0);
        assertEquals(ChaosPolicy.PARTY.repeat(ChaosPolicy.MAX_PARTY_REPEAT), chaos.maybePartyNumber(1e9).asString());
        assertEquals("", chaos.maybePartyNumber(0).asString());
    }

    @Test
    void sameSeedSameDecisions() {
        ChaosPolicy a = seeded(1234);
        ChaosPolicy b = seeded(1234);
        for (int i = 0; i < 1000; i++) {
            assertEquals(a.applyExpressionChaos(Value.number(i)), b.applyExpressionChaos(Value.number(i)));
            assertEquals(a.promiseTick(), b.promiseTick());
        }
    }
}
