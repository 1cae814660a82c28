package io.topolang.slc;

/**
 * A variable reference with no enclosing binder of the same name.
 */
public class UnknownVariableException extends SlcException {
    private final String name;

    public UnknownVariableException(String name, int position) {
        super("unknown variable: " + name, position);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
