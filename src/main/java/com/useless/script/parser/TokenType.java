package com.useless.script.parser;

public enum TokenType {
    // Punctuation
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACE, RIGHT_BRACE,
    LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, COLON, SEMICOLON,
    MINUS, EQUAL,
    HASH_BRACKET,

    // Literals
    IDENTIFIER, STRING, NUMBER,

    // Keywords
    LET, IF, ELSE, LOOP, WHILE,
    FUNCTION, ASYNC, AWAIT, RETURN, BREAK,
    TRY, CATCH,
    TRUE, FALSE, NULL,

    EOF
}
