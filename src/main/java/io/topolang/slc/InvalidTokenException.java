package io.topolang.slc;

/**
 * Raised by the lexer on a character outside the lambda calculus alphabet.
 */
public class InvalidTokenException extends SlcException {
    private final char character;

    public InvalidTokenException(char character, int position) {
        super("invalid token '" + character + "' at " + position, position);
        this.character = character;
    }

    public char character() {
        return character;
    }
}
