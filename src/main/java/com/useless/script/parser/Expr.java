package com.useless.script.parser;

import java.util.LinkedHashMap;
import java.util.List;

import com.useless.script.parser.Statement.Stmt;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitArrayLiteralExpr(ArrayLiteral expr);
        R visitRecordLiteralExpr(RecordLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitAssignExpr(Assign expr);
        R visitCallExpr(Call expr);
        R visitFunctionExpr(FunctionExpr expr);
        R visitAwaitExpr(Await expr);
    }

    /** Number (double), string, boolean or null. */
    public static final class Literal implements ExprInterface {
        public final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class ArrayLiteral implements ExprInterface {
        public final List<ExprInterface> items;

        public ArrayLiteral(List<ExprInterface> items) {
            this.items = items;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayLiteralExpr(this);
        }
    }

    public static final class RecordLiteral implements ExprInterface {
        public final LinkedHashMap<String, ExprInterface> entries; // source order

        public RecordLiteral(LinkedHashMap<String, ExprInterface> entries) {
            this.entries = entries;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRecordLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Assign implements ExprInterface {
        public final Token name;
        public final ExprInterface value;

        public Assign(Token name, ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** Anonymous {@code function (..) {..}}, optionally {@code async}. */
    public static final class FunctionExpr implements ExprInterface {
        public final Token keyword;
        public final List<Token> params;
        public final List<Stmt> body;
        public final boolean async;

        public FunctionExpr(Token keyword, List<Token> params, List<Stmt> body, boolean async) {
            this.keyword = keyword;
            this.params = params;
            this.body = body;
            this.async = async;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunctionExpr(this);
        }
    }

    /**
     * Only ever the whole right-hand side of a statement; the parser rejects it anywhere else.
     */
    public static final class Await implements ExprInterface {
        public final Token keyword;
        public final ExprInterface value;

        public Await(Token keyword, ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAwaitExpr(this);
        }
    }
}
