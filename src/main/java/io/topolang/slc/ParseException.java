package io.topolang.slc;

/**
 * No grammar production matches at the current token.
 */
public class ParseException extends SlcException {
    public ParseException(String message, int position) {
        super(message, position);
    }
}
