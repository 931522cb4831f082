import org.junit.jupiter.api.Test;

import com.useless.script.async.PromiseEntry;
import com.useless.script.async.PromiseHandle;
import com.useless.script.async.PromiseScheduler;
import com.useless.script.async.PromiseState;
import com.useless.script.async.Waiter;
import com.useless.script.chaos.ChaosPoint;
import com.useless.script.chaos.ChaosPolicy;
import com.useless.script.chaos.DeterministicRandomSource;
import com.useless.script.error.ErrorKind;
import com.useless.script.error.ErrorValue;
import com.useless.script.parser.Value;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class PromiseSchedulerTest {

    @Test
    void zeroTimeoutSettlesOnTheFirstTick_acrossSeeds() {
        for (long seed = 0; seed < 200; seed++) {
            ChaosPolicy chaos = new ChaosPolicy(new DeterministicRandomSource(seed));
            chaos.setMindChanges(false);
            PromiseScheduler s = new PromiseScheduler(chaos);
            PromiseHandle h = s.promise(Value.number(1), 0);

            s.tick();

            PromiseState st = s.state(h);
            assertTrue(st == PromiseState.RESOLVED || st == PromiseState.ABANDONED, "seed " + seed + ": " + st);
            assertEquals(0, s.pendingCount());
        }
    }

    @Test
    void pendingPromiseOutlivesItsTimeoutOnlyUntilTheNextTick() {
        ScriptedChaos chaos = new ScriptedChaos().byDefault(ChaosPoint.PROMISE_TICK, ScriptedChaos.NOMINAL);
        PromiseScheduler s = new PromiseScheduler(chaos);
        PromiseHandle h = s.promise(Value.number(1), 20);

        s.tick();
        s.tick();
        assertEquals(PromiseState.PENDING, s.state(h));
        s.tick();
        assertEquals(PromiseState.ABANDONED, s.state(h));
        assertEquals(30, s.now());
    }

    @Test
    void waitersWakeInSuspensionOrder() {
        PromiseScheduler s = new PromiseScheduler(new ScriptedChaos());
        PromiseHandle first = s.promise(Value.string("x"), 100);
        PromiseHandle second = s.promise(Value.string("y"), 100);
        List<String> order = new ArrayList<>();

        s.suspend(e -> order.add("w1:" + e.value().asString()), second);
        s.suspend(e -> order.add("w2:" + e.value().asString()), first);
        s.suspend(e -> order.add("w3:" + e.value().asString()), second);

        s.run();

        assertEquals(List.of("w1:y", "w2:x", "w3:y"), order);
        assertEquals(1, s.ticks());
    }

    @Test
    void suspendingOnASettledPromiseWakesOnTheNextDrain() {
        PromiseScheduler s = new PromiseScheduler(new ScriptedChaos());
        PromiseHandle h = s.deferred("task");
        s.resolve(h, Value.number(4));

        Waiter w = mock(Waiter.class);
        s.suspend(w, h);
        verifyNoInteractions(w);

        s.drainReady();
        verify(w).resume(s.entry(h));
    }

    @Test
    void settledPromisesIgnoreLaterSettlement() {
        PromiseScheduler s = new PromiseScheduler(new ScriptedChaos());
        PromiseHandle h = s.deferred("task");
        s.resolve(h, Value.number(1));
        s.reject(h, new ErrorValue(ErrorKind.TEAPOT_ERROR, "late"));
        s.resolve(h, Value.number(2));

        PromiseEntry e = s.entry(h);
        assertEquals(PromiseState.RESOLVED, e.state());
        assertEquals(Value.number(1), e.value());
        assertNull(e.error());
    }

    @Test
    void flaggedPromiseChangesItsMindOnce() {
        ScriptedChaos chaos = new ScriptedChaos()
                .rolls(ChaosPoint.MIND_CHANGE_FLAG, 0.0)
                .byDefault(ChaosPoint.MIND_CHANGE_FLIP, 0.0);
        PromiseScheduler s = new PromiseScheduler(chaos);
        PromiseHandle h = s.promise(Value.number(1), 100);
        assertTrue(s.entry(h).hasMindChangeFlag());

        s.tick();
        assertEquals(PromiseState.RESOLVED, s.state(h));

        s.tick();
        PromiseEntry e = s.entry(h);
        assertEquals(PromiseState.REJECTED, e.state());
        assertEquals(ErrorKind.PROMISE_REJECTED, e.error().kind());
        assertTrue(e.hasChangedMind());

        s.tick();
        assertEquals(PromiseState.REJECTED, s.state(h));
    }

    @Test
    void abandonedPromisesNeverChangeTheirMind() {
        ScriptedChaos chaos = new ScriptedChaos()
                .rolls(ChaosPoint.MIND_CHANGE_FLAG, 0.0)
                .rolls(ChaosPoint.PROMISE_TICK, 0.6)
                .byDefault(ChaosPoint.MIND_CHANGE_FLIP, 0.0);
        PromiseScheduler s = new PromiseScheduler(chaos);
        PromiseHandle h = s.promise(Value.number(1), 100);

        s.tick();
        s.tick();
        assertEquals(PromiseState.ABANDONED, s.state(h));
        assertFalse(s.entry(h).hasChangedMind());
    }

    @Test
    void tasksWaitingOnlyOnEachOtherAreAbandoned() {
        PromiseScheduler s = new PromiseScheduler(new ScriptedChaos());
        PromiseHandle h = s.deferred("stuck");
        List<PromiseState> seen = new ArrayList<>();
        s.suspend(e -> seen.add(e.state()), h);

        s.run();

        assertEquals(List.of(PromiseState.ABANDONED), seen);
        assertEquals(0, s.ticks());
    }

    @Test
    void tickBudgetAbandonsWhatIsLeft() {
        ScriptedChaos chaos = new ScriptedChaos().byDefault(ChaosPoint.PROMISE_TICK, ScriptedChaos.NOMINAL);
        PromiseScheduler s = new PromiseScheduler(chaos);
        s.setMaxTicks(5);
        PromiseHandle h = s.promise(Value.nil(), 1_000_000);

        s.run();

        assertEquals(PromiseState.ABANDONED, s.state(h));
        assertEquals(5, s.ticks());
    }

    @Test
    void calmPromisesAlwaysResolve() {
        ChaosPolicy chaos = new ChaosPolicy(new DeterministicRandomSource(11));
        chaos.setCalm(true);
        PromiseScheduler s = new PromiseScheduler(chaos);
        List<PromiseHandle> hs = new ArrayList<>();
        for (int i = 0; i < 50; i++) hs.add(s.promise(Value.number(i), 0));

        s.run();

        for (PromiseHandle h : hs) assertEquals(PromiseState.RESOLVED, s.state(h));
        assertEquals(1, s.ticks());
    }

    @Test
    void foreignHandlesAreRejected() {
        PromiseScheduler mine = new PromiseScheduler(new ScriptedChaos());
        PromiseScheduler other = new PromiseScheduler(new ScriptedChaos());
        mine.promise(Value.nil(), 0);
        PromiseHandle foreign = other.promise(Value.nil(), 0);

        assertThrows(IllegalStateException.class, () -> mine.entry(foreign));
        assertThrows(IllegalStateException.class, () -> mine.state(null));
    }

    @Test
    void negativeTimeoutIsRefused() {
        PromiseScheduler s = new PromiseScheduler(new ScriptedChaos());
        assertThrows(IllegalArgumentException.class, () -> s.promise(Value.nil(), -1));
    }
}
