package com.useless.script.parser;

import java.util.List;

import com.useless.script.async.PromiseHandle;
import com.useless.script.error.ScriptError;
import com.useless.script.parser.Statement.Stmt;

/**
 * A closure: parameters, body and the scope it was created in. Calling an async
 * function returns a promise straight away; its body runs up to the first await.
 */
public class ScriptFunction {
    public static final String ANONYMOUS = "<anonymous>";

    final String name;
    final List<Token> params;
    final List<Stmt> body;
    final Environment closure;
    final boolean async;

    ScriptFunction(String name, List<Token> params, List<Stmt> body, Environment closure, boolean async) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
        this.async = async;
    }

    Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw ScriptError.typeMismatch(name + "() expects " + params.size() + " argument(s), got " + args.size());
        }

        // New call frame is a child of the closure (lexical scoping), not of the caller.
        Environment scope = closure.childScope();
        for (int i = 0; i < params.size(); i++) {
            scope.define(params.get(i).lexeme, args.get(i));
        }

        if (async) {
            PromiseHandle completion = interpreter.scheduler().deferred(name);
            ScriptTask.forAsyncCall(interpreter, this, scope, completion).runUntilBlocked();
            return Value.promise(completion);
        }

        ScriptTask task = ScriptTask.forCall(interpreter, this, scope);
        task.runUntilBlocked();
        if (!task.isDone()) {
            throw new IllegalStateException("Synchronous call to " + name + " did not finish");
        }
        return task.result();
    }
}
