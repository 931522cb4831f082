package com.useless.script.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

import com.useless.debug.Debug;
import com.useless.script.async.PromiseEntry;
import com.useless.script.async.PromiseHandle;
import com.useless.script.async.Waiter;
import com.useless.script.error.ScriptError;
import com.useless.script.parser.Expr.Assign;
import com.useless.script.parser.Expr.Await;
import com.useless.script.parser.Statement.Block;
import com.useless.script.parser.Statement.BreakStmt;
import com.useless.script.parser.Statement.Directive;
import com.useless.script.parser.Statement.ExprStmt;
import com.useless.script.parser.Statement.FunctionStmt;
import com.useless.script.parser.Statement.If;
import com.useless.script.parser.Statement.Loop;
import com.useless.script.parser.Statement.ReturnStmt;
import com.useless.script.parser.Statement.Stmt;
import com.useless.script.parser.Statement.StmtVisitor;
import com.useless.script.parser.Statement.TryCatch;
import com.useless.script.parser.Statement.VarStmt;

/**
 * One running body of statements: the program itself, or one function call.
 *
 * <p>Control flow is an explicit stack of frames instead of the Java call stack, so the
 * task can stop at an {@code await} on a pending promise, hand itself to the scheduler,
 * and continue from the same spot when the promise settles.</p>
 */
final class ScriptTask implements StmtVisitor, Waiter {
    private static final Debug.Tagged LOG = Debug.tag("task");

    private enum FrameKind { BODY, BLOCK, LOOP, TRY, CATCH }

    private static final class Frame {
        final FrameKind kind;
        final List<Stmt> statements;
        final Environment env;
        final TryCatch handler;
        int pc;

        Frame(FrameKind kind, List<Stmt> statements, Environment env, TryCatch handler) {
            this.kind = kind;
            this.statements = statements;
            this.env = env;
            this.handler = handler;
        }
    }

    private final Interpreter interpreter;
    private final String name;
    private final boolean awaitAllowed;
    private final PromiseHandle completion;
    private final Deque<Frame> frames = new ArrayDeque<>();

    private Value result = Value.nil();
    private boolean done;
    private PromiseHandle awaiting;
    private Consumer<Value> continuation;
    private int awaitLine;

    private ScriptTask(Interpreter interpreter, String name, List<Stmt> body, Environment scope,
                       boolean awaitAllowed, PromiseHandle completion) {
        this.interpreter = interpreter;
        this.name = name;
        this.awaitAllowed = awaitAllowed;
        this.completion = completion;
        frames.push(new Frame(FrameKind.BODY, body, scope, null));
    }

    static ScriptTask forProgram(Interpreter interpreter, List<Stmt> program, Environment globals) {
        return new ScriptTask(interpreter, "<main>", program, globals, true, null);
    }

    static ScriptTask forCall(Interpreter interpreter, ScriptFunction fn, Environment scope) {
        return new ScriptTask(interpreter, fn.name, fn.body, scope, false, null);
    }

    static ScriptTask forAsyncCall(Interpreter interpreter, ScriptFunction fn, Environment scope, PromiseHandle completion) {
        return new ScriptTask(interpreter, fn.name, fn.body, scope, true, completion);
    }

    boolean isDone() { return done; }
    Value result() { return result; }

    /** Runs until the body finishes or parks on a pending promise. */
    void runUntilBlocked() {
        Environment previous = interpreter.env;
        try {
            while (!done && awaiting == null) step();
        } finally {
            interpreter.env = previous;
        }
    }

    private void step() {
        Frame frame = frames.peek();
        if (frame == null) {
            complete(Value.nil());
            return;
        }

        if (frame.pc >= frame.statements.size()) {
            frames.pop();
            if (frames.isEmpty()) complete(Value.nil());
            return;
        }

        Stmt stmt = frame.statements.get(frame.pc++);
        interpreter.env = frame.env;
        interpreter.markLine(stmt.line());
        try {
            stmt.accept(this);
        } catch (ScriptError e) {
            fail(e.atLine(stmt.line()));
        }
    }

    private void push(FrameKind kind, List<Stmt> statements, TryCatch handler) {
        frames.push(new Frame(kind, statements, interpreter.env.childScope(), handler));
    }

    private void complete(Value value) {
        frames.clear();
        done = true;
        result = value;
        if (completion != null) interpreter.scheduler().resolve(completion, value);
    }

    /**
     * Unwinds to the nearest enclosing try. Fatal errors skip every try; an error nobody
     * catches rejects an async task's promise, or leaves any other task.
     */
    private void fail(ScriptError e) {
        if (e.isFatal()) {
            frames.clear();
            done = true;
            throw e;
        }

        while (!frames.isEmpty()) {
            Frame f = frames.pop();
            if (f.kind == FrameKind.TRY) {
                Environment scope = f.env.parent.childScope();
                scope.define(f.handler.errorName.lexeme, e.error().toRecord());
                frames.push(new Frame(FrameKind.CATCH, f.handler.handler, scope, null));
                LOG.d("%s caught %s", name, e.error());
                return;
            }
        }

        done = true;
        if (completion != null) {
            LOG.w("async %s rejected: %s", name, e.error());
            interpreter.scheduler().reject(completion, e.error());
            return;
        }
        throw e;
    }

    // ---------------------------------------------------------------------
    // Await
    // ---------------------------------------------------------------------

    /** True when {@code expr} is an await, possibly on the right of an assignment. */
    private static boolean awaits(Expr.ExprInterface expr) {
        return expr instanceof Await
                || (expr instanceof Assign && awaits(((Assign) expr).value));
    }

    /**
     * Awaits {@code expr}, stores the settled value through any assignment around the
     * await, then hands it to {@code then}.
     */
    private void awaitInto(Expr.ExprInterface expr, Consumer<Value> then) {
        if (expr instanceof Await) {
            awaitThen((Await) expr, then);
            return;
        }
        Assign assign = (Assign) expr;
        Environment target = interpreter.env;
        awaitInto(assign.value, v -> {
            target.assign(assign.name.lexeme, v);
            then.accept(v);
        });
    }

    private void awaitThen(Await await, Consumer<Value> then) {
        if (!awaitAllowed) {
            throw ScriptError.typeMismatch("'await' in " + name
                    + "(), which is not async. Patience is only for async functions.");
        }

        Value target = interpreter.eval(await.value);
        if (target.getType() != Value.Type.PROMISE) {
            then.accept(interpreter.chaos().applyExpressionChaos(target));
            return;
        }

        PromiseHandle handle = target.asPromise();
        PromiseEntry entry = interpreter.scheduler().entry(handle);
        if (entry.state().isSettled()) {
            then.accept(interpreter.settledValue(entry));
            return;
        }

        awaiting = handle;
        continuation = then;
        awaitLine = await.keyword.line;
        LOG.t("%s parked on %s", name, handle);
        interpreter.scheduler().suspend(this, handle);
    }

    @Override
    public void resume(PromiseEntry settled) {
        if (awaiting == null || !awaiting.equals(settled.handle())) {
            throw new IllegalStateException(name + " woken by " + settled.handle() + " while waiting on " + awaiting);
        }
        Consumer<Value> then = continuation;
        awaiting = null;
        continuation = null;
        LOG.t("%s resumed by %s", name, settled);

        Environment previous = interpreter.env;
        try {
            then.accept(interpreter.settledValue(settled));
        } catch (ScriptError e) {
            fail(e.atLine(awaitLine));
        } finally {
            interpreter.env = previous;
        }
        runUntilBlocked();
    }

    // ---------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------

    @Override
    public void visitExprStmt(ExprStmt stmt) {
        if (awaits(stmt.expression)) {
            awaitInto(stmt.expression, v -> { });
            return;
        }
        interpreter.eval(stmt.expression);
    }

    @Override
    public void visitVarStmt(VarStmt stmt) {
        Environment target = interpreter.env;
        if (awaits(stmt.initializer)) {
            awaitInto(stmt.initializer, v -> bind(target, stmt.name.lexeme, v));
            return;
        }
        bind(target, stmt.name.lexeme, interpreter.eval(stmt.initializer));
    }

    private void bind(Environment target, String name, Value value) {
        if (interpreter.chaos().letLost(name)) throw ScriptError.nameNotFound(name);
        target.define(name, value);
    }

    @Override
    public void visitBlockStmt(Block stmt) {
        push(FrameKind.BLOCK, stmt.statements, null);
    }

    @Override
    public void visitIfStmt(If stmt) {
        // The condition still runs, side effects and errors included.
        interpreter.eval(stmt.condition);
        List<Stmt> branch = interpreter.chaos().invertBranchAlways(stmt.thenBranch, stmt.elseBranch);
        if (branch != null) push(FrameKind.BLOCK, branch, null);
    }

    @Override
    public void visitLoopStmt(Loop stmt) {
        push(FrameKind.LOOP, interpreter.chaos().loopOnce(stmt.body), null);
    }

    @Override
    public void visitFunctionStmt(FunctionStmt stmt) {
        ScriptFunction fn = new ScriptFunction(stmt.name.lexeme, stmt.params, stmt.body, interpreter.env, stmt.async);
        interpreter.env.define(stmt.name.lexeme, Value.func(fn));
    }

    @Override
    public void visitReturnStmt(ReturnStmt stmt) {
        if (stmt.value == null) {
            complete(Value.nil());
        } else if (awaits(stmt.value)) {
            awaitInto(stmt.value, this::complete);
        } else {
            complete(interpreter.eval(stmt.value));
        }
    }

    @Override
    public void visitBreakStmt(BreakStmt stmt) {
        while (!frames.isEmpty()) {
            Frame f = frames.pop();
            if (f.kind == FrameKind.LOOP) return;
        }
        throw new IllegalStateException("[line " + stmt.keyword.line + "] break outside a loop in " + name);
    }

    @Override
    public void visitTryCatchStmt(TryCatch stmt) {
        push(FrameKind.TRY, stmt.body, stmt);
    }

    @Override
    public void visitDirectiveStmt(Directive stmt) {
        interpreter.applyDirective(stmt.name);
    }
}
