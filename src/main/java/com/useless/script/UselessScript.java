package com.useless.script;

import java.util.List;
import java.util.function.Function;

import com.useless.debug.Debug;
import com.useless.script.async.PromiseScheduler;
import com.useless.script.chaos.ChaosPolicy;
import com.useless.script.chaos.DeterministicRandomSource;
import com.useless.script.chaos.RandomSource;
import com.useless.script.error.ErrorValue;
import com.useless.script.error.ScriptError;
import com.useless.script.parser.Environment;
import com.useless.script.parser.Interpreter;
import com.useless.script.parser.Lexer;
import com.useless.script.parser.Parser;
import com.useless.script.parser.Statement.Stmt;
import com.useless.script.present.ConsolePresenter;
import com.useless.script.present.Presenter;

/**
 * UselessScript engine.
 *
 * - Built-ins called as functions: add, multiply, equals, lessThan, index, access,
 *   print, save, exit, promise
 * - Types: number (double), boolean, text, null, array, record, function, promise
 * - Control flow: if/else (the else always wins), loop/while (exactly one pass),
 *   try/catch, return, break
 * - Async: async functions, promise(value, timeoutMs), await
 * - #[directive(disable_useless)] calms everything probabilistic down
 *
 * Each {@link #run} gets its own random stream, scheduler and global scope. Setting a
 * seed makes the run reproducible.
 */
public class UselessScript {
    private static final Debug.Tagged LOG = Debug.tag("engine");

    private Long seed;
    private Presenter presenter = new ConsolePresenter();
    private boolean mindChanges = true;
    private int maxCallDepth = Interpreter.DEFAULT_MAX_DEPTH;
    private int maxTicks = PromiseScheduler.DEFAULT_MAX_TICKS;
    private Function<RandomSource, ChaosPolicy> chaosFactory = ChaosPolicy::new;

    /** Null means a fresh seed is drawn (and logged) for each run. */
    public void setSeed(Long seed) { this.seed = seed; }

    public Long getSeed() { return seed; }

    public void setPresenter(Presenter presenter) {
        this.presenter = (presenter == null) ? new ConsolePresenter() : presenter;
    }

    public void setMindChanges(boolean enabled) { this.mindChanges = enabled; }

    /** @throws IllegalArgumentException unless {@code 1 <= depth <= Interpreter.MAX_DEPTH_LIMIT} */
    public void setMaxCallDepth(int depth) {
        if (depth < 1 || depth > Interpreter.MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException("maxCallDepth must be between 1 and " + Interpreter.MAX_DEPTH_LIMIT + ", got " + depth);
        }
        this.maxCallDepth = depth;
    }

    public void setMaxTicks(int ticks) { this.maxTicks = ticks; }

    /** Swaps the probability table, e.g. for one that scripts its outcomes. */
    public void setChaosFactory(Function<RandomSource, ChaosPolicy> factory) {
        this.chaosFactory = (factory == null) ? ChaosPolicy::new : factory;
    }

    /** @throws com.useless.script.parser.ParseException if the source is not a valid program */
    public List<Stmt> parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    /**
     * Parses and runs {@code source}, then drives the scheduler until no promise is pending.
     * Runtime errors never escape: an uncaught one ends the run, goes to the presenter's
     * error channel and decides the exit code.
     *
     * @throws com.useless.script.parser.ParseException if the source is not a valid program
     */
    public RunResult run(String source) {
        List<Stmt> program = parse(source);

        RandomSource random = (seed == null)
                ? DeterministicRandomSource.fromEntropy()
                : new DeterministicRandomSource(seed);
        ChaosPolicy chaos = chaosFactory.apply(random);
        chaos.setMindChanges(mindChanges);

        PromiseScheduler scheduler = new PromiseScheduler(chaos);
        scheduler.setMaxTicks(maxTicks);

        Environment globals = new Environment();
        Interpreter interpreter = new Interpreter(globals, chaos, scheduler, presenter, maxCallDepth);

        ErrorValue uncaught = null;
        try {
            interpreter.execute(program);
            scheduler.run();
        } catch (ScriptError e) {
            uncaught = e.error();
            LOG.d("run ended by %s", uncaught);
            presenter.presentError(uncaught.toString());
        }

        ExitCode code;
        if (uncaught == null) code = ExitCode.SUCCESS;
        else if (uncaught.isFatal()) code = ExitCode.FATAL;
        else code = ExitCode.UNCAUGHT_ERROR;

        RunResult result = new RunResult(code, uncaught, globals.snapshot(), random.getSeed(), scheduler.ticks());
        LOG.i("finished: %s", result);
        return result;
    }
}
