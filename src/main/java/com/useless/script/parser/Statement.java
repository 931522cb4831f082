package com.useless.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);

        /** Source line the statement starts on. */
        int line();
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitVarStmt(VarStmt stmt);
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitLoopStmt(Loop stmt);
        void visitFunctionStmt(FunctionStmt stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitBreakStmt(BreakStmt stmt);
        void visitTryCatchStmt(TryCatch stmt);
        void visitDirectiveStmt(Directive stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        final int line;
        ExprStmt(Expr.ExprInterface expression, int line) { this.expression = expression; this.line = line; }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
        public int line() { return line; }
    }

    public static final class VarStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer;
        VarStmt(Token name, Expr.ExprInterface initializer) { this.name = name; this.initializer = initializer; }
        public void accept(StmtVisitor visitor) { visitor.visitVarStmt(this); }
        public int line() { return name.line; }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        final int line;
        Block(List<Stmt> statements, int line) { this.statements = statements; this.line = line; }
        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
        public int line() { return line; }
    }

    /** {@code elseBranch} is null when there is no else; an else-if is a one-statement else branch. */
    public static final class If implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final List<Stmt> thenBranch;
        public final List<Stmt> elseBranch;
        If(Token keyword, Expr.ExprInterface condition, List<Stmt> thenBranch, List<Stmt> elseBranch) {
            this.keyword = keyword;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
        public int line() { return keyword.line; }
    }

    /** Both {@code loop [cond] {..}} and {@code while cond {..}}; condition may be null. */
    public static final class Loop implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;
        Loop(Token keyword, Expr.ExprInterface condition, List<Stmt> body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitLoopStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;
        public final boolean async;

        FunctionStmt(Token name, List<Token> params, List<Stmt> body, boolean async) {
            this.name = name;
            this.params = params;
            this.body = body;
            this.async = async;
        }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
        public int line() { return name.line; }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // may be null

        ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class BreakStmt implements Stmt {
        public final Token keyword;
        BreakStmt(Token keyword) { this.keyword = keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitBreakStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class TryCatch implements Stmt {
        public final Token keyword;
        public final List<Stmt> body;
        public final Token errorName;
        public final List<Stmt> handler;

        TryCatch(Token keyword, List<Stmt> body, Token errorName, List<Stmt> handler) {
            this.keyword = keyword;
            this.body = body;
            this.errorName = errorName;
            this.handler = handler;
        }

        public void accept(StmtVisitor visitor) { visitor.visitTryCatchStmt(this); }
        public int line() { return keyword.line; }
    }

    /** {@code #[directive(name)]}. */
    public static final class Directive implements Stmt {
        public final Token name;
        Directive(Token name) { this.name = name; }
        public void accept(StmtVisitor visitor) { visitor.visitDirectiveStmt(this); }
        public int line() { return name.line; }
    }
}
