package io.topolang.slc;

/**
 * Lexical token of a lambda calculus term.
 *
 * @param type     token kind
 * @param text     matched source text; empty for {@link Type#END}
 * @param position offset of the first character in the source
 */
public record Token(Type type, String text, int position) {

    public enum Type {
        LAMBDA,
        VARIABLE,
        DOT,
        OPEN_PAREN,
        CLOSE_PAREN,
        END
    }

    static Token of(Type type, char ch, int position) {
        return new Token(type, String.valueOf(ch), position);
    }

    static Token variable(String name, int position) {
        return new Token(Type.VARIABLE, name, position);
    }

    static Token end(int position) {
        return new Token(Type.END, "", position);
    }

    public boolean is(Type t) {
        return type == t;
    }

    /**
     * True when this token can begin an atomic expression.
     */
    public boolean startsAtomic() {
        return type == Type.VARIABLE || type == Type.OPEN_PAREN;
    }
}
