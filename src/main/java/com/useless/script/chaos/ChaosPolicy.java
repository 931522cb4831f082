package com.useless.script.chaos;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.useless.debug.Debug;
import com.useless.script.error.ScriptError;
import com.useless.script.parser.Value;

/**
 * The probability table behind every unreliable operation.
 *
 * <p>All randomness flows through {@link #roll}, {@link #pick} and {@link #coin}, each of
 * which names the {@link ChaosPoint} asking. Subclasses can override those three to
 * script exact outcomes.</p>
 *
 * <p>In calm mode every probabilistic rule answers with the nominal outcome. The fixed
 * rules ({@link #invertBranchAlways}, {@link #loopOnce}, container bounds) hold in
 * both modes.</p>
 */
public class ChaosPolicy {
    private static final Debug.Tagged LOG = Debug.tag("chaos");

    public static final double EXPRESSION_RANDOMIZE = 0.25;
    public static final double BOOLEAN_OPPOSITE = 0.30;
    public static final double BOOLEAN_AS_TEXT = 0.20;
    public static final double BOOLEAN_AS_NUMBER = 0.20;
    public static final double ARITH_SECONDARY = 0.20;
    public static final double INDEX_RANDOM = 0.75;
    public static final double FIELD_RANDOM = 0.50;
    public static final double COMPARISON_RANDOM = 0.50;
    public static final double PRINT_FAILS = 0.10;
    public static final double TEAPOT = 0.01;
    public static final double PARTY_NUMBER = 0.10;
    public static final double VARIABLE_VACATION = 0.15;
    public static final double LET_LOST = 0.20;
    public static final double PROMISE_RESOLVE = 0.50;
    public static final double PROMISE_ABANDON = 0.15;
    public static final double MIND_CHANGE_FLAG = 0.10;
    public static final double MIND_CHANGE_FLIP = 0.50;

    public static final String PARTY = "🎉🎊🎈";
    public static final int MAX_PARTY_REPEAT = 32;

    private final RandomSource random;
    private boolean calm;
    private boolean mindChanges = true;

    public ChaosPolicy(RandomSource random) {
        this.random = random;
    }

    public boolean isCalm() { return calm; }

    public void setCalm(boolean calm) {
        if (this.calm != calm) LOG.d("calm mode %s", calm ? "on" : "off");
        this.calm = calm;
    }

    public void setMindChanges(boolean enabled) { this.mindChanges = enabled; }

    // ---------------------------------------------------------------------
    // Draw primitives
    // ---------------------------------------------------------------------

    /** Uniform draw in [0, 1). */
    protected double roll(ChaosPoint point) {
        return random.getRandom().nextDouble();
    }

    /** Uniform draw in [0, bound). */
    protected int pick(ChaosPoint point, int bound) {
        return random.getRandom().nextInt(bound);
    }

    protected boolean coin(ChaosPoint point) {
        return random.getRandom().nextBoolean();
    }

    // ---------------------------------------------------------------------
    // Expression results
    // ---------------------------------------------------------------------

    /** Runs after every expression: randomize first, then re-present any boolean. */
    public Value applyExpressionChaos(Value v) {
        return maybeFlipBoolean(maybeRandomizeExpressionResult(v));
    }

    public Value maybeRandomizeExpressionResult(Value v) {
        if (calm) return v;
        if (roll(ChaosPoint.EXPRESSION_RESULT) >= EXPRESSION_RANDOMIZE) return v;
        Value out = Value.bool(coin(ChaosPoint.EXPRESSION_RESULT));
        LOG.t("expression %s became %s", v, out);
        return out;
    }

    public Value maybeFlipBoolean(Value v) {
        if (calm || v.getType() != Value.Type.BOOL) return v;
        boolean b = v.asBool();
        double r = roll(ChaosPoint.BOOLEAN_FORM);

        if (r < BOOLEAN_OPPOSITE) {
            LOG.t("boolean %s flipped", b);
            return Value.bool(!b);
        }
        r -= BOOLEAN_OPPOSITE;
        if (r < BOOLEAN_AS_TEXT) {
            LOG.t("boolean %s became text", b);
            return Value.string(Boolean.toString(!b));
        }
        r -= BOOLEAN_AS_TEXT;
        if (r < BOOLEAN_AS_NUMBER) {
            LOG.t("boolean %s became a number", b);
            return Value.number(b ? 0 : 1);
        }
        return v;
    }

    /** A number literal may turn into a party. */
    public Value maybePartyNumber(double n) {
        if (calm || roll(ChaosPoint.PARTY_NUMBER) >= PARTY_NUMBER) return Value.number(n);
        int repeat = (int) Math.min(Math.abs(n), MAX_PARTY_REPEAT);
        LOG.t("number %s threw a party", n);
        return Value.string(PARTY.repeat(repeat));
    }

    public boolean variableOnVacation(String name) {
        if (calm) return false;
        boolean away = roll(ChaosPoint.VARIABLE_VACATION) < VARIABLE_VACATION;
        if (away) LOG.t("variable '%s' went on vacation", name);
        return away;
    }

    /** Asked after a let has evaluated its value, before the name is bound. */
    public boolean letLost(String name) {
        if (calm) return false;
        boolean lost = roll(ChaosPoint.LET_LOSS) < LET_LOST;
        if (lost) LOG.t("let '%s' lost its value", name);
        return lost;
    }

    // ---------------------------------------------------------------------
    // Primitives
    // ---------------------------------------------------------------------

    /** {@code add} and {@code multiply} never do what they say. */
    public ArithOp pickArithAlt(ArithOp op) {
        if (calm) return op;
        switch (op) {
            case ADD: {
                ArithOp alt = roll(ChaosPoint.ARITHMETIC) < ARITH_SECONDARY ? ArithOp.MULTIPLY : ArithOp.SUBTRACT;
                LOG.t("add became %s", alt);
                return alt;
            }
            case MULTIPLY: {
                ArithOp alt = roll(ChaosPoint.ARITHMETIC) < ARITH_SECONDARY ? ArithOp.ADD : ArithOp.DIVIDE;
                LOG.t("multiply became %s", alt);
                return alt;
            }
            default:
                return op;
        }
    }

    /** Out-of-range requests always fail; in-range ones usually land somewhere else. */
    public int pickContainerIndex(int length, double requested) {
        if (requested < 0 || requested >= length) {
            throw ScriptError.indexOutOfVacation((long) requested, length);
        }
        int asked = (int) requested;
        if (calm || roll(ChaosPoint.CONTAINER_INDEX) >= INDEX_RANDOM) return asked;
        int chosen = pick(ChaosPoint.CONTAINER_INDEX, length);
        LOG.t("index %d became %d", asked, chosen);
        return chosen;
    }

    /** Empty records always fail; otherwise half the time some other field answers. */
    public String pickField(Map<String, Value> record, String requested) {
        if (record.isEmpty()) throw ScriptError.emptyRecordAccess(requested);
        if (calm || roll(ChaosPoint.RECORD_FIELD) >= FIELD_RANDOM) return requested;
        List<String> keys = new ArrayList<>(record.keySet());
        String chosen = keys.get(pick(ChaosPoint.RECORD_FIELD, keys.size()));
        LOG.t("field '%s' became '%s'", requested, chosen);
        return chosen;
    }

    /** On a comparison type mismatch: true to raise it, false to answer with {@link #randomBoolean}. */
    public boolean surfaceComparisonMismatch() {
        if (calm) return true;
        return roll(ChaosPoint.COMPARISON_MISMATCH) >= COMPARISON_RANDOM;
    }

    public Value randomBoolean() {
        return Value.bool(coin(ChaosPoint.COMPARISON_MISMATCH));
    }

    public boolean printFails() {
        return !calm && roll(ChaosPoint.PRINT) < PRINT_FAILS;
    }

    public boolean teapot() {
        if (calm) return false;
        boolean brew = roll(ChaosPoint.TEAPOT) < TEAPOT;
        if (brew) LOG.t("teapot");
        return brew;
    }

    // ---------------------------------------------------------------------
    // Control flow (deterministic)
    // ---------------------------------------------------------------------

    /** The else branch runs whenever there is one; the then branch never does. */
    public final <T> T invertBranchAlways(T thenBranch, T elseBranch) {
        return elseBranch;
    }

    /** The body to run a single time. The loop condition is never consulted. */
    public final <T> T loopOnce(T body) {
        return body;
    }

    // ---------------------------------------------------------------------
    // Promises
    // ---------------------------------------------------------------------

    public PromiseFate promiseTick() {
        if (calm) return PromiseFate.RESOLVE;
        double r = roll(ChaosPoint.PROMISE_TICK);
        if (r < PROMISE_RESOLVE) return PromiseFate.RESOLVE;
        if (r < PROMISE_RESOLVE + PROMISE_ABANDON) return PromiseFate.ABANDON;
        return PromiseFate.STAY_PENDING;
    }

    public boolean flagMindChange() {
        if (!mindChanges || calm) return false;
        return roll(ChaosPoint.MIND_CHANGE_FLAG) < MIND_CHANGE_FLAG;
    }

    public boolean mindChangeFlip() {
        if (calm) return false;
        return roll(ChaosPoint.MIND_CHANGE_FLIP) < MIND_CHANGE_FLIP;
    }
}
