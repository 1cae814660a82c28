package io.topolang.slc;

/**
 * Lexical scope of bound variable names, innermost binder first.
 * Persistent: {@link #bind} returns a new scope and leaves this one untouched,
 * so sibling subtrees converted under the same scope never see each other's binders.
 */
public final class Scope {
    private static final Scope EMPTY = new Scope(null, null, 0);

    private final String name;
    private final Scope outer;
    private final int size;

    private Scope(String name, Scope outer, int size) {
        this.name = name;
        this.outer = outer;
        this.size = size;
    }

    public static Scope empty() {
        return EMPTY;
    }

    public Scope bind(String variable) {
        return new Scope(variable, this, size + 1);
    }

    /**
     * 1-based distance from the innermost binder of {@code variable}, or -1 if unbound.
     */
    public int distance(String variable) {
        int d = 1;
        for (Scope s = this; s != EMPTY; s = s.outer, d++) {
            if (s.name.equals(variable)) return d;
        }
        return -1;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder("[");
        for (Scope s = this; s != EMPTY; s = s.outer) {
            if (s != this) out.append(", ");
            out.append(s.name);
        }
        return out.append(']').toString();
    }
}
