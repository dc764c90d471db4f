package io.eligian.core.parse;

import io.eligian.core.ast.SourceLocation;

/**
 * A lexed token. For {@link TokenType#STRING} the {@code text} is the unescaped value; for {@link
 * TokenType#TIME} it is the literal as written ({@code 1.5s}, {@code 200ms}).
 */
record Token(TokenType type, String text, int line, int column, int length) {

    boolean is(TokenType expected) {
        return type == expected;
    }

    boolean isKeyword(String keyword) {
        return type == TokenType.IDENT && text.equals(keyword);
    }

    SourceLocation location(String file) {
        return new SourceLocation(file, line, column, length);
    }

    /** Value in seconds of a {@link TokenType#TIME} or {@link TokenType#NUMBER} token. */
    double seconds() {
        if (type == TokenType.TIME) {
            if (text.endsWith("ms")) {
                return Double.parseDouble(text.substring(0, text.length() - 2)) / 1000.0;
            }
            return Double.parseDouble(text.substring(0, text.length() - 1));
        }
        return Double.parseDouble(text);
    }

    String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case STRING -> "string \"" + text + "\"";
            default -> "'" + text + "'";
        };
    }
}
