package com.useless.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.useless.debug.Debug;
import com.useless.script.async.PromiseEntry;
import com.useless.script.async.PromiseScheduler;
import com.useless.script.chaos.ArithOp;
import com.useless.script.chaos.ChaosPolicy;
import com.useless.script.error.ErrorKind;
import com.useless.script.error.ScriptError;
import com.useless.script.parser.Expr.ArrayLiteral;
import com.useless.script.parser.Expr.Assign;
import com.useless.script.parser.Expr.Await;
import com.useless.script.parser.Expr.Call;
import com.useless.script.parser.Expr.ExprVisitor;
import com.useless.script.parser.Expr.FunctionExpr;
import com.useless.script.parser.Expr.Literal;
import com.useless.script.parser.Expr.RecordLiteral;
import com.useless.script.parser.Expr.Variable;
import com.useless.script.parser.Statement.Stmt;
import com.useless.script.present.Presenter;

/**
 * Tree-walking evaluator for expressions and built-ins. Statements are run by
 * {@link ScriptTask}, which can park at an {@code await} and pick up later.
 *
 * <p>Every expression goes through {@link #eval}, which is the single place expression
 * chaos is applied.</p>
 */
public class Interpreter implements ExprVisitor<Value> {
    private static final Debug.Tagged LOG = Debug.tag("interpreter");

    public static final int DEFAULT_MAX_DEPTH = 64;
    /** Each script call nests Java frames, so the limit itself is capped. */
    public static final int MAX_DEPTH_LIMIT = 256;

    public static final String DISABLE_CHAOS = "disable_useless";
    public static final String ENABLE_CHAOS = "enable_useless";

    /** Functional interface for built-in functions. */
    interface BuiltinFunction {
        Value call(List<Value> args);
    }

    Environment env;
    private final Environment globals;
    private final ChaosPolicy chaos;
    private final PromiseScheduler scheduler;
    private final Presenter presenter;
    private final Map<String, BuiltinFunction> builtins = new LinkedHashMap<>();
    private final Deque<String> callStack = new ArrayDeque<String>();
    private final int maxDepth;
    private int currentLine;

    public Interpreter(Environment globals, ChaosPolicy chaos, PromiseScheduler scheduler,
                       Presenter presenter, int maxDepth) {
        this.globals = globals;
        this.env = globals;
        this.chaos = chaos;
        this.scheduler = scheduler;
        this.presenter = presenter;
        this.maxDepth = maxDepth;
        registerCoreBuiltins();
    }

    public ChaosPolicy chaos() { return chaos; }
    public PromiseScheduler scheduler() { return scheduler; }
    public Environment globals() { return globals; }

    public String currentFunctionName() {
        return callStack.isEmpty() ? null : callStack.peek();
    }

    /**
     * Starts the top-level task and runs it until it finishes or first parks on a
     * pending promise. Uncaught errors propagate.
     */
    public ScriptTask execute(List<Stmt> program) {
        ScriptTask main = ScriptTask.forProgram(this, program, globals);
        main.runUntilBlocked();
        return main;
    }

    public Value eval(Expr.ExprInterface expr) {
        return chaos.applyExpressionChaos(expr.accept(this));
    }

    /** The value an await produces from a settled promise, or the error it raises. */
    Value settledValue(PromiseEntry entry) {
        switch (entry.state()) {
            case RESOLVED:
                return chaos.applyExpressionChaos(entry.value());
            case REJECTED:
                throw new ScriptError(entry.error());
            case ABANDONED:
                throw ScriptError.promiseAbandoned();
            default:
                throw new IllegalStateException(entry + " is still pending");
        }
    }

    void applyDirective(Token name) {
        switch (name.lexeme) {
            case DISABLE_CHAOS:
                chaos.setCalm(true);
                break;
            case ENABLE_CHAOS:
                chaos.setCalm(false);
                break;
            default:
                LOG.w("line %d: ignoring unknown directive '%s'", name.line, name.lexeme);
        }
    }

    void markLine(int line) {
        this.currentLine = line;
    }

    // ---------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        if (expr.value == null) return Value.nil();
        if (expr.value instanceof Boolean) return Value.bool((Boolean) expr.value);
        if (expr.value instanceof Double) return chaos.maybePartyNumber((Double) expr.value);
        if (expr.value instanceof String) return Value.string((String) expr.value);
        throw new IllegalStateException("Unsupported literal value: " + expr.value);
    }

    @Override
    public Value visitArrayLiteralExpr(ArrayLiteral expr) {
        List<Value> values = new ArrayList<Value>(expr.items.size());
        for (Expr.ExprInterface e : expr.items) values.add(eval(e));
        return Value.array(values);
    }

    @Override
    public Value visitRecordLiteralExpr(RecordLiteral expr) {
        LinkedHashMap<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Expr.ExprInterface> e : expr.entries.entrySet()) {
            out.put(e.getKey(), eval(e.getValue()));
        }
        return Value.record(out);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        String name = expr.name.lexeme;
        if (chaos.variableOnVacation(name)) {
            throw ScriptError.onVacation(name);
        }
        return env.get(name);
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        env.assign(expr.name.lexeme, value);
        return value;
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = null;
        String builtin = null;

        // Plain names resolve without chaos; a user binding shadows a builtin.
        if (expr.callee instanceof Variable) {
            String name = ((Variable) expr.callee).name.lexeme;
            if (env.exists(name)) callee = env.get(name);
            else if (builtins.containsKey(name)) builtin = name;
            else throw ScriptError.nameNotFound(name);
        } else {
            callee = eval(expr.callee);
        }

        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (Expr.ExprInterface a : expr.arguments) args.add(eval(a));

        if (builtin != null) {
            return builtins.get(builtin).call(args);
        }
        if (callee.getType() != Value.Type.FUNC) {
            throw ScriptError.typeMismatch("Can't call a " + callee.typeName() + ". It didn't pick up.");
        }
        return callFunction(callee.asFunction(), args, expr.paren.line);
    }

    public Value callFunction(ScriptFunction fn, List<Value> args, int line) {
        if (callStack.size() >= maxDepth) {
            LOG.d("call depth %d reached calling %s from %s at line %d", maxDepth, fn.name, currentFunctionName(), line);
            throw ScriptError.callDepthExceeded(maxDepth);
        }
        callStack.push(fn.name);
        try {
            return fn.call(this, args);
        } finally {
            callStack.pop();
        }
    }

    @Override
    public Value visitFunctionExpr(FunctionExpr expr) {
        return Value.func(new ScriptFunction(ScriptFunction.ANONYMOUS, expr.params, expr.body, env, expr.async));
    }

    @Override
    public Value visitAwaitExpr(Await expr) {
        throw new IllegalStateException("[line " + expr.keyword.line + "] await reached outside a statement");
    }

    // ---------------------------------------------------------------------
    // Built-ins
    // ---------------------------------------------------------------------

    private void registerFunction(String name, BuiltinFunction fn) {
        builtins.put(name, fn);
    }

    private void registerCoreBuiltins() {
        registerFunction("add", args -> arithmetic("add", ArithOp.ADD, args));
        registerFunction("multiply", args -> arithmetic("multiply", ArithOp.MULTIPLY, args));

        registerFunction("equals", args -> {
            requireArgCount("equals", args, 2);
            return comparison(() -> Value.scriptEquals(args.get(0), args.get(1)));
        });

        registerFunction("lessThan", args -> {
            requireArgCount("lessThan", args, 2);
            return comparison(() -> Value.lessThan(args.get(0), args.get(1)));
        });

        registerFunction("index", args -> {
            requireArgCount("index", args, 2);
            List<Value> items = args.get(0).asArray();
            double requested = args.get(1).asNumber();
            if (requested != Math.rint(requested)) {
                throw ScriptError.typeMismatch("index() wants a whole number, got " + requested);
            }
            int chosen = chaos.pickContainerIndex(items.size(), requested);
            brewTeapot();
            return items.get(chosen);
        });

        registerFunction("access", args -> {
            requireArgCount("access", args, 2);
            Map<String, Value> record = args.get(0).asRecord();
            String requested = args.get(1).asString();
            String chosen = chaos.pickField(record, requested);
            brewTeapot();
            Value v = record.get(chosen);
            return (v == null) ? Value.nil() : v;
        });

        registerFunction("print", args -> {
            requireArgCount("print", args, 1);
            if (chaos.printFails()) {
                presenter.presentError(ScriptError.BROWSER_MESSAGE);
            } else {
                presenter.present(args.get(0));
            }
            return Value.nil();
        });

        registerFunction("save", args -> {
            throw ScriptError.saveAlwaysFails();
        });

        registerFunction("exit", args -> {
            LOG.d("line %d: exit() called, carrying on anyway", currentLine);
            return Value.nil();
        });

        registerFunction("promise", args -> {
            if (args.size() != 1 && args.size() != 2) {
                throw ScriptError.typeMismatch("promise() expects 1 or 2 arguments, got " + args.size());
            }
            long timeout = PromiseScheduler.DEFAULT_TIMEOUT_MILLIS;
            if (args.size() == 2) {
                double t = args.get(1).asNumber();
                if (t < 0 || Double.isNaN(t)) {
                    throw ScriptError.typeMismatch("promise() timeout must be a non-negative number, got " + t);
                }
                timeout = (long) t;
            }
            return Value.promise(scheduler.promise(args.get(0), timeout));
        });
    }

    private Value arithmetic(String name, ArithOp requested, List<Value> args) {
        requireArgCount(name, args, 2);
        double a = args.get(0).asNumber();
        double b = args.get(1).asNumber();
        ArithOp op = chaos.pickArithAlt(requested);
        Value result = Value.number(op.apply(a, b));
        brewTeapot();
        return result;
    }

    private interface Comparison {
        boolean compare();
    }

    private Value comparison(Comparison c) {
        boolean result;
        try {
            result = c.compare();
        } catch (ScriptError e) {
            if (e.kind() != ErrorKind.TYPE_MISMATCH || chaos.surfaceComparisonMismatch()) throw e;
            Value guess = chaos.randomBoolean();
            LOG.t("line %d: %s, guessing %s", currentLine, e.error().message(), guess);
            return guess;
        }
        brewTeapot();
        return Value.bool(result);
    }

    private void brewTeapot() {
        if (chaos.teapot()) throw ScriptError.teapot();
    }

    private static void requireArgCount(String name, List<Value> args, int n) {
        if (args.size() != n) {
            throw ScriptError.typeMismatch(name + "() expects " + n + " argument(s), got " + args.size());
        }
    }
}
