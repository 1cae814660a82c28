package io.topolang.slc;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class SlcTest {

    @Test void identity() { assertEquals("{λ, 1}", Slc.toDeBruijn("\\x.x")); }
    @Test void kCombinator() { assertEquals("{λ, {λ, 2}}", Slc.toDeBruijn("\\x.\\y.x")); }
    @Test void namedIdentity() { assertEquals("{{{{}, {}}}, {{}}}", Slc.toNamed("\\x.x")); }
    @Test void symbolicIdentity() { assertEquals("{x, {x, λ}}", Slc.toSymbolic("\\x.x")); }

    @Test void whitespaceVariants() {
        assertEquals(Slc.toDeBruijn("\\x.\\y.x"), Slc.toDeBruijn("  \\ x . \\ y .  x \n"));
    }

    @Test void convertWithSettings() {
        Settings settings = new Settings();
        settings.rejectTrailingTokens = true;
        assertEquals("{λ, 1}", Slc.convert("\\x.x", Encoding.DE_BRUIJN, settings).toString());
        assertThrows(ParseException.class, () -> Slc.convert("\\x.x)", Encoding.DE_BRUIJN, settings));
        assertEquals("{λ, 1}", Slc.toDeBruijn("\\x.x)"));
    }

    @Test void roundTripStructure() {
        String named = Slc.toNamed("(\\f.(\\x.f (x x)) (\\x.f (x x)))");
        assertEquals(named, Slc.parseStructure(named).toString());
    }

    @Test void errorsShareBaseType() {
        assertThrows(SlcException.class, () -> Slc.toDeBruijn("\\x.x + 1"));
        assertThrows(SlcException.class, () -> Slc.toDeBruijn(""));
        assertThrows(SlcException.class, () -> Slc.toDeBruijn("(x"));
        assertThrows(SlcException.class, () -> Slc.toDeBruijn("\\x.y"));
        assertThrows(SlcException.class, () -> Slc.parseStructure("}"));
        assertThrows(SlcException.class, () -> Slc.parseStructure("{"));
    }

    @Test void errorMessages() {
        assertEquals("invalid token '+' at 5",
            assertThrows(SlcException.class, () -> Slc.toDeBruijn("\\x.x + 1")).getMessage());
        assertEquals("unknown variable: y",
            assertThrows(SlcException.class, () -> Slc.toDeBruijn("\\x.y")).getMessage());
        assertEquals("unexpected end of input",
            assertThrows(SlcException.class, () -> Slc.toDeBruijn("  ")).getMessage());
    }
}
