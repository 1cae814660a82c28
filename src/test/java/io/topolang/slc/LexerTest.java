package io.topolang.slc;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

class LexerTest {

    static List<Token> lex(String src) {
        Lexer lexer = new Lexer(src);
        List<Token> out = new ArrayList<>();
        Token t;
        do {
            t = lexer.nextToken();
            out.add(t);
        } while (!t.is(Token.Type.END));
        return out;
    }

    static List<Token.Type> types(String src) {
        List<Token.Type> out = new ArrayList<>();
        for (Token t : lex(src)) out.add(t.type());
        return out;
    }

    @Test void punctuation() {
        assertEquals(List.of(Token.Type.LAMBDA, Token.Type.DOT, Token.Type.OPEN_PAREN,
            Token.Type.CLOSE_PAREN, Token.Type.END), types("\\.()"));
    }

    @Test void identity() {
        assertEquals(List.of(Token.Type.LAMBDA, Token.Type.VARIABLE, Token.Type.DOT,
            Token.Type.VARIABLE, Token.Type.END), types("\\x.x"));
    }

    @Test void maximalAlphanumericRun() {
        List<Token> tokens = lex("foo42 Bar");
        assertEquals("foo42", tokens.get(0).text());
        assertEquals("Bar", tokens.get(1).text());
        assertEquals(Token.Type.END, tokens.get(2).type());
    }

    @Test void positions() {
        List<Token> tokens = lex("  \\ab . c");
        assertEquals(2, tokens.get(0).position());
        assertEquals(3, tokens.get(1).position());
        assertEquals(6, tokens.get(2).position());
        assertEquals(8, tokens.get(3).position());
    }

    @Test void whitespaceIsInsignificant() {
        assertEquals(types("\\x.(f x)"), types(" \\ x \t.\n( f  x ) "));
    }

    @Test void emptyInput() { assertEquals(List.of(Token.Type.END), types("")); }
    @Test void onlyWhitespace() { assertEquals(List.of(Token.Type.END), types("   \n\t")); }

    @Test void endRepeats() {
        Lexer lexer = new Lexer("x  ");
        lexer.nextToken();
        assertEquals(1, lexer.position());
        assertTrue(lexer.nextToken().is(Token.Type.END));
        assertTrue(lexer.nextToken().is(Token.Type.END));
    }

    @Test void invalidCharacter() {
        InvalidTokenException e = assertThrows(InvalidTokenException.class, () -> lex("\\x.x + y"));
        assertEquals('+', e.character());
        assertEquals(5, e.position());
    }

    @Test void unicodeLambdaIsNotAccepted() {
        assertThrows(InvalidTokenException.class, () -> lex("λx.x"));
    }
}
