package io.eligian.core.parse;

import io.eligian.core.ast.SourceLocation;
import io.eligian.core.error.ParseException;
import java.util.ArrayList;
import java.util.List;

/** Turns Eligian source text into tokens. Skips whitespace, {@code //} and block comments. */
final class Lexer {

    private final String source;
    private final String file;
    private int pos;
    private int line = 1;
    private int column = 1;

    Lexer(String source, String file) {
        this.source = source;
        this.file = file;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipTrivia();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", line, column, 1));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int startLine = line;
        int startColumn = column;
        char c = peek(0);

        if (Character.isLetter(c) || c == '_') {
            int start = pos;
            while (pos < source.length() && (Character.isLetterOrDigit(peek(0)) || peek(0) == '_')) {
                advance();
            }
            return token(TokenType.IDENT, source.substring(start, pos), startLine, startColumn, pos - start);
        }
        if (Character.isDigit(c)) {
            return number(startLine, startColumn);
        }
        if (c == '"' || c == '\'') {
            return string(c, startLine, startColumn);
        }

        Token token = switch (c) {
            case '(' -> single(TokenType.LPAREN, startLine, startColumn);
            case ')' -> single(TokenType.RPAREN, startLine, startColumn);
            case '{' -> single(TokenType.LBRACE, startLine, startColumn);
            case '}' -> single(TokenType.RBRACE, startLine, startColumn);
            case '[' -> single(TokenType.LBRACKET, startLine, startColumn);
            case ']' -> single(TokenType.RBRACKET, startLine, startColumn);
            case ',' -> single(TokenType.COMMA, startLine, startColumn);
            case ':' -> single(TokenType.COLON, startLine, startColumn);
            case ';' -> single(TokenType.SEMICOLON, startLine, startColumn);
            case '$' -> single(TokenType.DOLLAR, startLine, startColumn);
            case '+' -> single(TokenType.PLUS, startLine, startColumn);
            case '-' -> single(TokenType.MINUS, startLine, startColumn);
            case '*' -> single(TokenType.STAR, startLine, startColumn);
            case '/' -> single(TokenType.SLASH, startLine, startColumn);
            case '%' -> single(TokenType.PERCENT, startLine, startColumn);
            case '.' -> peek(1) == '.'
                    ? pair(TokenType.RANGE, startLine, startColumn)
                    : single(TokenType.DOT, startLine, startColumn);
            case '@' -> peek(1) == '@'
                    ? pair(TokenType.AT_AT, startLine, startColumn)
                    : single(TokenType.AT, startLine, startColumn);
            case '!' -> peek(1) == '='
                    ? pair(TokenType.NEQ, startLine, startColumn)
                    : single(TokenType.BANG, startLine, startColumn);
            case '=' -> peek(1) == '='
                    ? pair(TokenType.EQ, startLine, startColumn)
                    : single(TokenType.ASSIGN, startLine, startColumn);
            case '<' -> peek(1) == '='
                    ? pair(TokenType.LE, startLine, startColumn)
                    : single(TokenType.LT, startLine, startColumn);
            case '>' -> peek(1) == '='
                    ? pair(TokenType.GE, startLine, startColumn)
                    : single(TokenType.GT, startLine, startColumn);
            // a lone '&' or '|' is not an operator
            case '&' -> peek(1) == '&' ? pair(TokenType.AND, startLine, startColumn) : null;
            case '|' -> peek(1) == '|' ? pair(TokenType.OR, startLine, startColumn) : null;
            default -> null;
        };
        if (token != null) {
            return token;
        }
        throw new ParseException(
                "Unexpected character '" + c + "'", new SourceLocation(file, startLine, startColumn, 1));
    }

    private Token number(int startLine, int startColumn) {
        int start = pos;
        while (Character.isDigit(peek(0))) {
            advance();
        }
        // a single dot followed by a digit is a fraction; ".." is a range
        if (peek(0) == '.' && Character.isDigit(peek(1))) {
            advance();
            while (Character.isDigit(peek(0))) {
                advance();
            }
        }
        TokenType type = TokenType.NUMBER;
        if (peek(0) == 'm' && peek(1) == 's' && !isIdentPart(peek(2))) {
            advance();
            advance();
            type = TokenType.TIME;
        } else if (peek(0) == 's' && !isIdentPart(peek(1))) {
            advance();
            type = TokenType.TIME;
        }
        return token(type, source.substring(start, pos), startLine, startColumn, pos - start);
    }

    private Token string(char quote, int startLine, int startColumn) {
        int start = pos;
        advance();
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= source.length() || peek(0) == '\n') {
                throw new ParseException(
                        "Unterminated string literal",
                        new SourceLocation(file, startLine, startColumn, pos - start),
                        "Close the string with " + quote);
            }
            char c = advance();
            if (c == quote) {
                break;
            }
            if (c == '\\' && pos < source.length()) {
                char escaped = advance();
                value.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    default -> escaped;
                });
            } else {
                value.append(c);
            }
        }
        return token(TokenType.STRING, value.toString(), startLine, startColumn, pos - start);
    }

    private void skipTrivia() {
        while (pos < source.length()) {
            char c = peek(0);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peek(1) == '/') {
                while (pos < source.length() && peek(0) != '\n') {
                    advance();
                }
            } else if (c == '/' && peek(1) == '*') {
                int startLine = line;
                int startColumn = column;
                advance();
                advance();
                while (!(peek(0) == '*' && peek(1) == '/')) {
                    if (pos >= source.length()) {
                        throw new ParseException(
                                "Unterminated block comment", new SourceLocation(file, startLine, startColumn, 2));
                    }
                    advance();
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private Token single(TokenType type, int startLine, int startColumn) {
        String text = String.valueOf(advance());
        return token(type, text, startLine, startColumn, 1);
    }

    private Token pair(TokenType type, int startLine, int startColumn) {
        String text = "" + advance() + advance();
        return token(type, text, startLine, startColumn, 2);
    }

    private static Token token(TokenType type, String text, int line, int column, int length) {
        return new Token(type, text, line, column, length);
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }
}
