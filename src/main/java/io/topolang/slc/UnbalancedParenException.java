package io.topolang.slc;

public class UnbalancedParenException extends SlcException {
    public UnbalancedParenException(int position) {
        super("unbalanced parens: '(' at " + position + " is never closed", position);
    }
}
