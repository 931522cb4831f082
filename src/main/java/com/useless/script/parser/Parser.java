package com.useless.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import com.useless.script.parser.Expr.ArrayLiteral;
import com.useless.script.parser.Expr.Assign;
import com.useless.script.parser.Expr.Await;
import com.useless.script.parser.Expr.FunctionExpr;
import com.useless.script.parser.Expr.Literal;
import com.useless.script.parser.Expr.RecordLiteral;
import com.useless.script.parser.Expr.Variable;
import com.useless.script.parser.Statement.Block;
import com.useless.script.parser.Statement.ExprStmt;
import com.useless.script.parser.Statement.FunctionStmt;
import com.useless.script.parser.Statement.Stmt;

public class Parser {
    static final int MAX_PARAMS = 64;

    private final List<Token> tokens;
    private int current = 0;
    private int loopDepth = 0;
    private int functionDepth = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(declaration());
        }
        return statements;
    }

    private Stmt declaration() {
        if (match(TokenType.HASH_BRACKET)) return directive();
        if (check(TokenType.ASYNC) && (checkAt(1, TokenType.IDENTIFIER)
                || (checkAt(1, TokenType.FUNCTION) && checkAt(2, TokenType.IDENTIFIER)))) {
            advance();
            match(TokenType.FUNCTION);
            return functionDeclaration(true);
        }
        if (check(TokenType.FUNCTION) && checkAt(1, TokenType.IDENTIFIER)) {
            advance();
            return functionDeclaration(false);
        }
        if (match(TokenType.LET)) return varDeclaration();
        return statement();
    }

    private Stmt directive() {
        Token word = consume(TokenType.IDENTIFIER, "Expect 'directive' after '#['.");
        if (!"directive".equals(word.lexeme)) {
            throw error(word, "Unknown attribute '" + word.lexeme + "', only 'directive' is supported.");
        }
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'directive'.");
        Token name = consume(TokenType.IDENTIFIER, "Expect directive name.");
        consume(TokenType.RIGHT_PAREN, "Expect ')' after directive name.");
        consume(TokenType.RIGHT_BRACKET, "Expect ']' after directive.");
        match(TokenType.SEMICOLON);
        return new Statement.Directive(name);
    }

    private Stmt functionDeclaration(boolean async) {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        List<Token> params = parameters("function name");
        List<Stmt> body = functionBody();
        return new FunctionStmt(name, params, body, async);
    }

    private List<Token> parameters(String after) {
        consume(TokenType.LEFT_PAREN, "Expect '(' after " + after + ".");
        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_PARAMS) {
                    throw error(peek(), "Too many parameters (max " + MAX_PARAMS + ").");
                }
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        return params;
    }

    /** Function bodies reset loop nesting: a break cannot leave a function. */
    private List<Stmt> functionBody() {
        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
        int savedLoops = loopDepth;
        loopDepth = 0;
        functionDepth++;
        try {
            return block();
        } finally {
            functionDepth--;
            loopDepth = savedLoops;
        }
    }

    private Stmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
        consume(TokenType.EQUAL, "Expect '=' after variable name.");
        Expr.ExprInterface initializer = awaitable();
        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new Statement.VarStmt(name, initializer);
    }

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.LOOP)) return loopStatement(false);
        if (match(TokenType.WHILE)) return loopStatement(true);
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.BREAK)) return breakStatement();
        if (match(TokenType.TRY)) return tryStatement();
        if (match(TokenType.LEFT_BRACE)) {
            int line = previous().line;
            return new Block(block(), line);
        }
        return exprStatement();
    }

    private Stmt breakStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            throw error(keyword, "'break' used outside of a loop.");
        }
        consume(TokenType.SEMICOLON, "Expect ';' after 'break'.");
        return new Statement.BreakStmt(keyword);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        if (functionDepth <= 0) {
            throw error(keyword, "'return' used outside of a function.");
        }
        Expr.ExprInterface value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = awaitable();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after return value.");
        return new Statement.ReturnStmt(keyword, value);
    }

    // if cond { .. } [else if .. | else { .. }]
    private Stmt ifStatement() {
        Token keyword = previous();
        Expr.ExprInterface condition = expression();
        consume(TokenType.LEFT_BRACE, "Expect '{' after if condition.");
        List<Stmt> thenBranch = block();

        List<Stmt> elseBranch = null;
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                elseBranch = List.of(ifStatement());
            } else {
                consume(TokenType.LEFT_BRACE, "Expect '{' after 'else'.");
                elseBranch = block();
            }
        }
        return new Statement.If(keyword, condition, thenBranch, elseBranch);
    }

    // loop [cond] { .. }   |   while cond { .. }
    private Stmt loopStatement(boolean conditionRequired) {
        Token keyword = previous();
        Expr.ExprInterface condition = null;
        if (conditionRequired || !check(TokenType.LEFT_BRACE)) {
            condition = expression();
        }
        consume(TokenType.LEFT_BRACE, "Expect '{' before loop body.");

        loopDepth++;
        try {
            return new Statement.Loop(keyword, condition, block());
        } finally {
            loopDepth--;
        }
    }

    // try { .. } catch err { .. }   (parentheses around err are optional)
    private Stmt tryStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_BRACE, "Expect '{' after 'try'.");
        List<Stmt> body = block();

        consume(TokenType.CATCH, "Expect 'catch' after try block.");
        Token name;
        if (match(TokenType.LEFT_PAREN)) {
            name = consume(TokenType.IDENTIFIER, "Expect error variable name.");
            consume(TokenType.RIGHT_PAREN, "Expect ')' after error variable.");
        } else {
            name = consume(TokenType.IDENTIFIER, "Expect error variable name after 'catch'.");
        }
        consume(TokenType.LEFT_BRACE, "Expect '{' after catch clause.");
        List<Stmt> handler = block();
        return new Statement.TryCatch(keyword, body, name, handler);
    }

    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(declaration());
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    private Stmt exprStatement() {
        int line = peek().line;
        Expr.ExprInterface expr = awaitable();
        consume(TokenType.SEMICOLON, "Expect ';' after expression.");
        return new ExprStmt(expr, line);
    }

    /**
     * The only positions where {@code await} may appear: a whole expression statement,
     * a let initializer, the value of an assignment statement, or a return value.
     */
    private Expr.ExprInterface awaitable() {
        if (match(TokenType.AWAIT)) {
            return new Await(previous(), expression());
        }
        if (check(TokenType.IDENTIFIER) && checkAt(1, TokenType.EQUAL) && checkAt(2, TokenType.AWAIT)) {
            Token name = advance();
            advance(); // '='
            Token keyword = advance();
            return new Assign(name, new Await(keyword, expression()));
        }
        return expression();
    }

    private Expr.ExprInterface expression() { return assignment(); }

    private Expr.ExprInterface assignment() {
        Expr.ExprInterface expr = call();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            Expr.ExprInterface value = assignment();
            if (expr instanceof Variable) {
                Token name = ((Variable) expr).name;
                return new Assign(name, value);
            }
            throw error(equals, "Invalid assignment target.");
        }
        return expr;
    }

    private Expr.ExprInterface call() {
        Expr.ExprInterface expr = primary();
        while (match(TokenType.LEFT_PAREN)) {
            expr = finishCall(expr);
        }
        return expr;
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (arguments.size() >= MAX_PARAMS) {
                    throw error(peek(), "Too many arguments (max " + MAX_PARAMS + ").");
                }
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        Token paren = consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Expr.Call(callee, paren, arguments);
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.NULL)) return new Literal(null);
        if (match(TokenType.NUMBER)) return new Literal(previous().literal);
        if (match(TokenType.STRING)) return new Literal(previous().literal);
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.MINUS)) {
            Token minus = previous();
            if (!match(TokenType.NUMBER)) {
                throw error(minus, "'-' only negates number literals. Use add() like everyone else.");
            }
            double n = (Double) previous().literal;
            return new Literal(-n);
        }

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            List<Expr.ExprInterface> items = new ArrayList<Expr.ExprInterface>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after array literal.");
            return new ArrayLiteral(items);
        }

        // Record literal (JSON-style object)
        if (match(TokenType.LEFT_BRACE)) {
            LinkedHashMap<String, Expr.ExprInterface> entries = new LinkedHashMap<>();
            if (!check(TokenType.RIGHT_BRACE)) {
                do {
                    String key;
                    if (match(TokenType.STRING)) {
                        key = (String) previous().literal;
                    } else if (match(TokenType.IDENTIFIER)) {
                        key = previous().lexeme;
                    } else {
                        throw error(peek(), "Expect record key (string or identifier).");
                    }
                    consume(TokenType.COLON, "Expect ':' after record key.");
                    entries.put(key, expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACE, "Expect '}' after record literal.");
            return new RecordLiteral(entries);
        }

        if (match(TokenType.FUNCTION)) return functionExpression(previous(), false);
        if (match(TokenType.ASYNC)) {
            Token keyword = previous();
            consume(TokenType.FUNCTION, "Expect 'function' after 'async' in an expression.");
            return functionExpression(keyword, true);
        }

        if (check(TokenType.AWAIT)) {
            throw error(peek(), "'await' must be a whole statement, a let initializer, "
                    + "an assignment value or a return value.");
        }

        throw error(peek(), "Expect expression.");
    }

    private Expr.ExprInterface functionExpression(Token keyword, boolean async) {
        List<Token> params = parameters("'function'");
        List<Stmt> body = functionBody();
        return new FunctionExpr(keyword, params, body, async);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkAt(int offset, TokenType type) {
        int i = current + offset;
        if (i >= tokens.size()) return false;
        return tokens.get(i).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseException error(Token token, String message) {
        return new ParseException(token.line, message);
    }
}
