package org.cuelang.cue.errors;

import org.cuelang.cue.token.Pos;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for sentinel errors and error decoration.
 */
class ErrorsTest {

    // ========================================
    // Identity Matching Tests
    // ========================================

    @Nested
    @DisplayName("Errors.is")
    class IsTests {
        @Test
        void sentinelMatchesItself() {
            assertTrue(Errors.is(Errors.INCOMPLETE, Errors.INCOMPLETE));
            assertFalse(Errors.is(Errors.INCOMPLETE, Errors.INEXACT));
        }

        @Test
        void equalMessageDoesNotMatch() {
            CueException lookalike = new CueException("incomplete value");
            assertFalse(Errors.is(lookalike, Errors.INCOMPLETE));
        }

        @Test
        void causeChainIsSearched() {
            CueException wrapper = new CueException("evaluating a.b", Pos.NONE, Errors.INCOMPLETE);
            RuntimeException outer = new RuntimeException("outer", wrapper);

            assertTrue(Errors.is(outer, Errors.INCOMPLETE));
            assertTrue(Errors.is(outer, wrapper));
        }

        @Test
        void nullHandling() {
            assertFalse(Errors.is(null, Errors.INCOMPLETE));
            assertFalse(Errors.is(Errors.INCOMPLETE, null));
        }

        @Test
        void sentinelsHaveNoStackTrace() {
            assertEquals(0, Errors.INEXACT.getStackTrace().length);
            assertEquals("inexact subsumption", Errors.INEXACT.getMessage());
        }
    }

    // ========================================
    // Decoration Tests
    // ========================================

    @Nested
    @DisplayName("Errors.decorate")
    class DecorateTests {
        @Test
        void decoratedMatchesInfoAndPrimary() {
            CueException primary = new CueException("cannot unify int and string", Pos.at(12, 2, 4));

            CueException decorated = Errors.decorate(Errors.INCOMPLETE, primary);

            assertTrue(Errors.is(decorated, Errors.INCOMPLETE));
            assertTrue(Errors.is(decorated, primary));
            assertFalse(Errors.is(decorated, Errors.INEXACT));
        }

        @Test
        void decoratedDelegatesMessageAndPosition() {
            Pos pos = Pos.at(12, 2, 4);
            CueException primary = new CueException("cannot unify int and string", pos);

            CueException decorated = Errors.decorate(Errors.INEXACT, primary);

            assertEquals("cannot unify int and string", decorated.getMessage());
            assertEquals(pos, decorated.position());
            assertTrue(decorated.hasPosition());
            assertSame(primary, decorated.getCause());
        }

        @Test
        void decorationNests() {
            CueException primary = new CueException("conflict");
            CueException inner = Errors.decorate(Errors.INEXACT, primary);

            CueException outer = Errors.decorate(Errors.INCOMPLETE, inner);

            assertTrue(Errors.is(outer, Errors.INCOMPLETE));
            assertTrue(Errors.is(outer, Errors.INEXACT));
            assertTrue(Errors.is(outer, primary));
        }

        @Test
        void decoratedSurvivesWrapping() {
            CueException decorated = Errors.decorate(Errors.INCOMPLETE, new CueException("x"));
            IllegalStateException wrapped = new IllegalStateException("builtin failed", decorated);

            assertTrue(Errors.is(wrapped, Errors.INCOMPLETE));
        }

        @Test
        void primaryIsRequired() {
            assertThrows(NullPointerException.class, () -> Errors.decorate(Errors.INCOMPLETE, null));
        }
    }
}
