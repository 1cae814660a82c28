package io.topolang.slc;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Translates a lambda calculus AST into a Set Lambda Calculus term.
 *
 * <p>A definition {@code \v.body} becomes {@code {binder, body}} and an application
 * {@code f a} becomes {@code {{f}, a}}: wrapping the function side in its own set
 * keeps the two positions apart inside an unordered pair. Parentheses are
 * transparent. Bound variables resolve against the enclosing {@link Scope} to a
 * 1-based distance, which the {@link Encoding} renders as a numeral, an integer or
 * the name itself.
 *
 * <p>Recursion follows abstraction bodies and parenthesized arguments; the
 * function side of an application chain is folded iteratively. Going deeper than
 * {@link Settings#maxDepth} fails with a {@link ParseException} reading
 * {@code max conversion depth exceeded} and no source position.
 */
public final class Converter {
    public static final String LAMBDA = "λ";
    public static final String PROMOTE = "⊕";

    private final Encoding encoding;
    private final Settings settings;
    private int depth;

    public Converter(Encoding encoding) {
        this(encoding, Settings.defaults());
    }

    public Converter(Encoding encoding, Settings settings) {
        this.encoding = encoding;
        this.settings = settings;
    }

    /**
     * Converts a whole term. A bare variable at the root has no binder, so it fails
     * with {@link UnknownVariableException} except under {@link Encoding#SYMBOLIC}.
     */
    public SetTerm convert(Node root) {
        return convert(root, Scope.empty());
    }

    SetTerm convert(Node node, Scope scope) {
        depth++;
        if (depth > settings.maxDepth) {
            depth--;
            throw new ParseException("max conversion depth exceeded", -1);
        }
        try {
            return convertInner(node.unwrap(), scope);
        } finally {
            depth--;
        }
    }

    private SetTerm convertInner(Node node, Scope scope) {
        if (node instanceof Node.Application app) return convertApplication(app, scope);
        SetTerm.Builder out = SetTerm.builder();
        if (node instanceof Node.Definition def) {
            String name = def.variable().name();
            out.add(binder(name));
            out.add(element(def.body(), scope.bind(name)));
        } else {
            out.add(leaf((Node.Atomic) node, scope));
        }
        return out.build();
    }

    // f a b c parses as a left spine ((f a) b) c; fold it in a loop, innermost first
    private SetTerm convertApplication(Node.Application outer, Scope scope) {
        Deque<Node> arguments = new ArrayDeque<>();
        Node head = outer;
        while (head instanceof Node.Application app) {
            arguments.push(app.argument());
            head = app.function().unwrap();
        }
        SetTerm.Element function = element(head, scope);
        SetTerm result = null;
        while (!arguments.isEmpty()) {
            result = SetTerm.builder()
                .add(promote(function))
                .add(element(arguments.pop(), scope))
                .build();
            function = new SetTerm.Nested(result);
        }
        return result;
    }

    // a variable child is inlined as a leaf, anything else nests
    private SetTerm.Element element(Node node, Scope scope) {
        Node n = node.unwrap();
        if (n instanceof Node.Atomic a) return leaf(a, scope);
        return new SetTerm.Nested(convert(n, scope));
    }

    private SetTerm.Element leaf(Node.Atomic variable, Scope scope) {
        if (encoding == Encoding.SYMBOLIC) return new SetTerm.Symbol(variable.name());

        int distance = scope.distance(variable.name());
        if (distance < 0) throw new UnknownVariableException(variable.name(), variable.token().position());
        return switch (encoding) {
            case NAMED -> new SetTerm.Nested(makeNumber(distance));
            case DE_BRUIJN -> new SetTerm.Index(distance);
            default -> throw new IllegalStateException("unreachable: " + encoding);
        };
    }

    private SetTerm.Element binder(String name) {
        return switch (encoding) {
            case NAMED -> new SetTerm.Nested(SetTerm.builder().add(SetTerm.empty()).build());
            case DE_BRUIJN -> new SetTerm.Symbol(LAMBDA);
            case SYMBOLIC -> new SetTerm.Nested(SetTerm.builder().add(LAMBDA).add(name).build());
        };
    }

    private SetTerm.Element promote(SetTerm.Element function) {
        SetTerm.Builder wrapper = SetTerm.builder();
        if (encoding == Encoding.SYMBOLIC) wrapper.add(PROMOTE);
        return new SetTerm.Nested(wrapper.add(function).build());
    }

    /**
     * Nested-set numeral: {@code 1 = {{{}, {}}}}, and each further step adds
     * another empty set beside the base pair, so {@code 3 = {{{}, {}}, {}, {}}}.
     */
    public static SetTerm makeNumber(int n) {
        if (n < 1) throw new IllegalArgumentException("numerals start at 1: " + n);
        SetTerm base = SetTerm.builder().add(SetTerm.empty()).add(SetTerm.empty()).build();
        SetTerm.Builder top = SetTerm.builder().add(base);
        for (int i = 1; i < n; i++) {
            top.add(SetTerm.empty());
        }
        return top.build();
    }
}
