package io.topolang.slc;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ScopeTest {

    @Test void emptyResolvesNothing() {
        assertEquals(-1, Scope.empty().distance("x"));
        assertTrue(Scope.empty().isEmpty());
    }

    @Test void innermostIsOne() {
        Scope s = Scope.empty().bind("x").bind("y");
        assertEquals(1, s.distance("y"));
        assertEquals(2, s.distance("x"));
        assertEquals(-1, s.distance("z"));
        assertEquals(2, s.size());
    }

    @Test void shadowingResolvesInnermost() {
        Scope s = Scope.empty().bind("x").bind("y").bind("x");
        assertEquals(1, s.distance("x"));
        assertEquals(2, s.distance("y"));
    }

    @Test void bindLeavesOuterUntouched() {
        Scope outer = Scope.empty().bind("x");
        Scope left = outer.bind("y");
        Scope right = outer.bind("z");
        assertEquals(-1, right.distance("y"));
        assertEquals(-1, left.distance("z"));
        assertEquals(1, outer.distance("x"));
        assertEquals("[x]", outer.toString());
        assertEquals("[y, x]", left.toString());
    }
}
