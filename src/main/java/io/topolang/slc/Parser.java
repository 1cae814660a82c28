package io.topolang.slc;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for untyped lambda calculus.
 *
 * <pre>
 * Expr        := Abstraction | Application
 * Abstraction := '\' VARIABLE '.' Expr
 * Application := Atomic Atomic*
 * Atomic      := '(' Expr ')' | VARIABLE
 * </pre>
 *
 * Applications fold to the left, so {@code f x y} is {@code ((f x) y)}, and
 * abstraction bodies extend as far right as possible. Tokens are pulled from the
 * lexer on demand and buffered so a failed abstraction can rewind the cursor.
 */
public final class Parser {
    private final Lexer lexer;
    private final Settings settings;
    private final List<Token> tokens = new ArrayList<>();
    private int index;
    private int depth;

    public Parser(Lexer lexer, Settings settings) {
        this.lexer = lexer;
        this.settings = settings;
        tokens.add(lexer.nextToken());
    }

    public static Node parse(String src) {
        return parse(src, Settings.defaults());
    }

    public static Node parse(String src, Settings settings) {
        return new Parser(new Lexer(src), settings).parse();
    }

    /**
     * Parses the whole input into a single root node.
     * Tokens after the root expression are ignored unless
     * {@link Settings#rejectTrailingTokens} is set.
     */
    public Node parse() {
        Node root = parseExpression();
        if (root == null) throw unexpected(peek());
        if (settings.rejectTrailingTokens && !peek().is(Token.Type.END)) {
            throw new ParseException("extra tokens", peek().position());
        }
        return root;
    }

    private Node parseExpression() {
        depth++;
        if (depth > settings.maxDepth) {
            depth--;
            throw new ParseException("max nesting depth exceeded", peek().position());
        }
        try {
            if (peek().is(Token.Type.LAMBDA)) return parseAbstraction();

            Node head = parseAtomic();
            if (head == null) return null;
            while (peek().startsAtomic()) {
                head = Node.application(head, parseAtomic());
            }
            return head;
        } finally {
            depth--;
        }
    }

    // null (with the cursor restored) when the abstraction is incomplete
    private Node parseAbstraction() {
        int start = index;
        if (consume(Token.Type.LAMBDA)) {
            Node.Atomic variable = consumeVariable();
            if (variable != null && consume(Token.Type.DOT)) {
                Node body = parseExpression();
                if (body != null) return Node.definition(variable, body);
            }
        }
        index = start;
        return null;
    }

    private Node parseAtomic() {
        Token open = peek();
        if (consume(Token.Type.OPEN_PAREN)) {
            Node inner = parseExpression();
            if (!peek().is(Token.Type.CLOSE_PAREN)) throw new UnbalancedParenException(open.position());
            if (inner == null) throw unexpected(peek());
            advance();
            return Node.group(inner);
        }
        return consumeVariable();
    }

    private Node.Atomic consumeVariable() {
        Token tok = peek();
        if (!tok.is(Token.Type.VARIABLE)) return null;
        advance();
        return Node.atomic(tok);
    }

    private boolean consume(Token.Type type) {
        if (!peek().is(type)) return false;
        advance();
        return true;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private void advance() {
        index++;
        if (index >= tokens.size()) tokens.add(lexer.nextToken());
    }

    private static ParseException unexpected(Token tok) {
        if (tok.is(Token.Type.END)) return new ParseException("unexpected end of input", tok.position());
        return new ParseException("unexpected '" + tok.text() + "' at " + tok.position(), tok.position());
    }
}
