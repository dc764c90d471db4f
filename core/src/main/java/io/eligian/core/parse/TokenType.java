package io.eligian.core.parse;

/** Lexical categories. Keywords are lexed as {@link #IDENT} and recognized by the parser. */
public enum TokenType {
    IDENT,
    STRING,
    NUMBER,
    TIME,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    COMMA,
    COLON,
    SEMICOLON,
    DOT,
    RANGE,
    AT_AT,
    AT,
    DOLLAR,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    BANG,
    ASSIGN,
    EQ,
    NEQ,
    LT,
    GT,
    LE,
    GE,
    AND,
    OR,
    EOF
}
