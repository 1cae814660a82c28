package io.topolang.slc;

/**
 * On-demand tokenizer for lambda calculus source text.
 * Recognizes {@code \ . ( )} and maximal alphanumeric runs; whitespace separates tokens.
 */
public final class Lexer {
    private final String src;
    private int pos;

    public Lexer(String src) {
        this.src = src;
        this.pos = 0;
    }

    /**
     * Returns the token at the cursor and advances past it.
     * Returns {@link Token.Type#END} at end of input, repeatedly if called again.
     *
     * @throws InvalidTokenException on any unrecognized character
     */
    public Token nextToken() {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) pos++;
        if (pos >= src.length()) return Token.end(pos);

        int start = pos;
        char ch = src.charAt(pos);
        switch (ch) {
            case '\\' -> {
                pos++;
                return Token.of(Token.Type.LAMBDA, ch, start);
            }
            case '.' -> {
                pos++;
                return Token.of(Token.Type.DOT, ch, start);
            }
            case '(' -> {
                pos++;
                return Token.of(Token.Type.OPEN_PAREN, ch, start);
            }
            case ')' -> {
                pos++;
                return Token.of(Token.Type.CLOSE_PAREN, ch, start);
            }
            default -> {
                if (!isIdentChar(ch)) throw new InvalidTokenException(ch, start);
                while (pos < src.length() && isIdentChar(src.charAt(pos))) pos++;
                return Token.variable(src.substring(start, pos), start);
            }
        }
    }

    /**
     * Current cursor offset into the source.
     */
    public int position() {
        return pos;
    }

    // ASCII letters and digits only
    private static boolean isIdentChar(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9');
    }
}
