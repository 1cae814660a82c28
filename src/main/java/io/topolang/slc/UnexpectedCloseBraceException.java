package io.topolang.slc;

public class UnexpectedCloseBraceException extends SlcException {
    public UnexpectedCloseBraceException(int position) {
        super("unexpected '}' at " + position, position);
    }
}
