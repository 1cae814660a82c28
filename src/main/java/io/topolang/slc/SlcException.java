package io.topolang.slc;

/**
 * Base error for lexing, parsing, conversion and structural parsing failures.
 * Every failure is terminal for the call that raised it.
 */
public class SlcException extends RuntimeException {
    private final int position;

    public SlcException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Source offset of the failure, or -1 when not known.
     */
    public int position() {
        return position;
    }
}
