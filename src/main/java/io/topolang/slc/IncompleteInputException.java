package io.topolang.slc;

/**
 * Bracket text ended before a complete top-level set was read.
 */
public class IncompleteInputException extends SlcException {
    public IncompleteInputException(String message, int position) {
        super(message, position);
    }
}
