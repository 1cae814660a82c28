package io.topolang.slc;

/**
 * AST node for lambda calculus terms. Sealed interface with record variants;
 * each node owns its children outright.
 */
public sealed interface Node {
    record Atomic(Token token) implements Node {
        public String name() { return token.text(); }
    }
    record Definition(Atomic variable, Node body) implements Node {}
    record Application(Node function, Node argument) implements Node {}
    record Group(Node inner) implements Node {}

    static Atomic atomic(Token variable) { return new Atomic(variable); }
    static Node definition(Atomic variable, Node body) { return new Definition(variable, body); }
    static Node application(Node function, Node argument) { return new Application(function, argument); }
    static Node group(Node inner) { return new Group(inner); }

    /**
     * Strips any number of enclosing parentheses.
     */
    default Node unwrap() {
        Node n = this;
        while (n instanceof Group g) n = g.inner();
        return n;
    }

    /**
     * Fully parenthesized rendering with groups dropped, e.g. {@code (\x.(x x))}.
     * Terms that differ only in redundant parentheses show the same.
     */
    default String show() {
        Node n = unwrap();
        if (n instanceof Atomic a) return a.name();
        if (n instanceof Definition d) return "(\\" + d.variable().name() + "." + d.body().show() + ")";
        Application app = (Application) n;
        return "(" + app.function().show() + " " + app.argument().show() + ")";
    }
}
