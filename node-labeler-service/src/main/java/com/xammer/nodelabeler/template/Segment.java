package com.xammer.nodelabeler.template;

import java.util.Objects;

/**
 * One piece of a compiled template: either literal text or a token.
 */
public final class Segment {

    private final String literal;
    private final TokenKind token;
    private final int index;

    private Segment(String literal, TokenKind token, int index) {
        this.literal = literal;
        this.token = token;
        this.index = index;
    }

    public static Segment literal(String text) {
        return new Segment(Objects.requireNonNull(text, "text"), null, -1);
    }

    public static Segment token(TokenKind kind) {
        if (kind == TokenKind.INDEX) {
            throw new IllegalArgumentException("index tokens need a position, use index(int)");
        }
        return new Segment(null, Objects.requireNonNull(kind, "kind"), -1);
    }

    public static Segment index(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        return new Segment(null, TokenKind.INDEX, index);
    }

    public boolean isLiteral() {
        return token == null;
    }

    public String getLiteral() {
        return literal;
    }

    public TokenKind getToken() {
        return token;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Segment)) return false;
        Segment that = (Segment) o;
        return index == that.index && Objects.equals(literal, that.literal) && token == that.token;
    }

    @Override
    public int hashCode() {
        return Objects.hash(literal, token, index);
    }

    @Override
    public String toString() {
        if (isLiteral()) {
            return literal;
        }
        return token == TokenKind.INDEX ? "{" + index + "}" : "{:" + token.name().toLowerCase() + "}";
    }
}
