package io.topolang.slc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable nested set of Set Lambda Calculus. Elements are symbols, non-negative
 * integers or nested sets, held in canonical order: symbols, then integers, then
 * nested sets, each kind sorted by natural order and nested sets by their
 * rendering. {@link #toString()} is therefore a pure function of the contents.
 *
 * <p>Symbols and integers are deduplicated by value. A nested set is an owned
 * occurrence: adding the same instance twice is a no-op, while two distinct
 * instances that render alike are both kept. Numerals rely on this, since
 * {@code 3} is a base pair followed by two separate empty sets.
 */
public final class SetTerm {

    public sealed interface Element {
        int rank();
        String render();
    }

    public record Symbol(String text) implements Element {
        public Symbol {
            Objects.requireNonNull(text, "text");
        }
        public int rank() { return 0; }
        public String render() { return text; }
    }

    public record Index(int value) implements Element {
        public Index {
            if (value < 0) throw new IllegalArgumentException("negative index: " + value);
        }
        public int rank() { return 1; }
        public String render() { return Integer.toString(value); }
    }

    public record Nested(SetTerm set) implements Element {
        public Nested {
            Objects.requireNonNull(set, "set");
        }
        public int rank() { return 2; }
        public String render() { return set.toString(); }
    }

    static final Comparator<Element> CANONICAL_ORDER = (a, b) -> {
        if (a.rank() != b.rank()) return Integer.compare(a.rank(), b.rank());
        if (a instanceof Symbol s && b instanceof Symbol t) return s.text().compareTo(t.text());
        if (a instanceof Index i && b instanceof Index j) return Integer.compare(i.value(), j.value());
        return compareRenderings(((Nested) a).set(), ((Nested) b).set());
    };

    private final List<Element> elements;
    private final int depth;
    private String rendering;

    private SetTerm(List<Element> elements, int depth) {
        this.elements = elements;
        this.depth = depth;
    }

    /**
     * A fresh empty set. Each call yields a distinct occurrence.
     */
    public static SetTerm empty() {
        return new SetTerm(List.of(), 1);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Elements in canonical order.
     */
    public List<Element> elements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Brace nesting depth; {@code {}} has depth 1.
     */
    public int depth() {
        return depth;
    }

    /**
     * Nested sets among the elements, in canonical order.
     */
    public List<SetTerm> children() {
        List<SetTerm> out = new ArrayList<>();
        for (Element e : elements) {
            if (e instanceof Nested n) out.add(n.set());
        }
        return out;
    }

    /**
     * Canonical text, e.g. {@code {λ, {λ, 2}}}.
     */
    @Override
    public String toString() {
        String r = rendering;
        if (r == null) {
            r = render();
            rendering = r;
        }
        return r;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof SetTerm other && compareRenderings(this, other) == 0;
    }

    /**
     * Same value as {@code toString().hashCode()}, computed without building the string.
     */
    @Override
    public int hashCode() {
        if (rendering != null) return rendering.hashCode();
        int h = 0;
        Cursor c = new Cursor(this);
        for (int ch = c.next(); ch >= 0; ch = c.next()) h = 31 * h + ch;
        return h;
    }

    private String render() {
        StringBuilder out = new StringBuilder();
        Cursor c = new Cursor(this);
        for (int ch = c.next(); ch >= 0; ch = c.next()) out.append((char) ch);
        return out.toString();
    }

    /**
     * Orders two sets exactly as {@code a.toString().compareTo(b.toString())} would,
     * reading both renderings lazily and stopping at the first difference.
     */
    static int compareRenderings(SetTerm a, SetTerm b) {
        if (a == b) return 0;
        if (a.rendering != null && b.rendering != null) return a.rendering.compareTo(b.rendering);
        Cursor x = new Cursor(a);
        Cursor y = new Cursor(b);
        while (true) {
            int cx = x.next();
            int cy = y.next();
            if (cx != cy) return Integer.compare(cx, cy);
            if (cx < 0) return 0;
        }
    }

    /**
     * Character stream over the canonical rendering of a set. Walks nested sets on an
     * explicit stack, so structural parses deeper than the call stack are safe.
     */
    private static final class Cursor {
        private final Deque<Frame> stack = new ArrayDeque<>();
        private String pending = "{";
        private int offset;

        Cursor(SetTerm root) {
            stack.push(new Frame(root));
        }

        // next UTF-16 unit, or -1 at the end
        int next() {
            while (true) {
                if (offset < pending.length()) return pending.charAt(offset++);
                if (stack.isEmpty()) return -1;
                offset = 0;
                Frame f = stack.peek();
                if (f.next == f.term.elements.size()) {
                    stack.pop();
                    pending = "}";
                } else if (f.next > 0 && !f.separated) {
                    f.separated = true;
                    pending = ", ";
                } else {
                    f.separated = false;
                    Element e = f.term.elements.get(f.next++);
                    if (e instanceof Nested n) {
                        pending = "{";
                        stack.push(new Frame(n.set()));
                    } else {
                        pending = e.render();
                    }
                }
            }
        }
    }

    private static final class Frame {
        final SetTerm term;
        int next;
        boolean separated;

        Frame(SetTerm term) {
            this.term = term;
        }
    }

    /**
     * Incremental construction of a {@link SetTerm}. Adding an element that is
     * already present leaves the builder unchanged.
     */
    public static final class Builder {
        private final List<Element> elements = new ArrayList<>();
        private final Set<Element> scalars = new HashSet<>();
        private final Set<SetTerm> owned = Collections.newSetFromMap(new IdentityHashMap<>());
        private int depth = 1;

        private Builder() {}

        public Builder add(String symbol) {
            return add(new Symbol(symbol));
        }

        public Builder add(int value) {
            return add(new Index(value));
        }

        public Builder add(SetTerm set) {
            return add(new Nested(set));
        }

        public Builder add(Element e) {
            boolean fresh = e instanceof Nested n ? owned.add(n.set()) : scalars.add(e);
            if (fresh) {
                elements.add(e);
                if (e instanceof Nested m) depth = Math.max(depth, m.set().depth() + 1);
            }
            return this;
        }

        public int size() {
            return elements.size();
        }

        public SetTerm build() {
            if (elements.isEmpty()) return empty();
            List<Element> sorted = new ArrayList<>(elements);
            sorted.sort(CANONICAL_ORDER);
            return new SetTerm(Collections.unmodifiableList(sorted), depth);
        }
    }
}
