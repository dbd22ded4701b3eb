package org.cuelang.cue.internal;

import org.cuelang.cue.ast.Alias;
import org.cuelang.cue.ast.Ast;
import org.cuelang.cue.ast.Ellipsis;
import org.cuelang.cue.ast.Field;
import org.cuelang.cue.ast.Ident;
import org.cuelang.cue.ast.Label;
import org.cuelang.cue.ast.ParenExpr;
import org.cuelang.cue.token.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for label and declaration classification.
 */
class FieldKindsTest {

    // ========================================
    // Name Tests
    // ========================================

    @Nested
    @DisplayName("Names")
    class NameTests {
        @ParameterizedTest(name = "{0}: definition={1} hidden={2} either={3}")
        @CsvSource({
                "#Foo,  true,  false, true",
                "_#foo, true,  true,  true",
                "_foo,  false, true,  true",
                "foo,   false, false, false",
                "a#b,   false, false, false",
                "'',    false, false, false"
        })
        void classifiesNames(String name, boolean definition, boolean hidden, boolean either) {
            assertEquals(definition, FieldKinds.isDefinitionName(name));
            assertEquals(hidden, FieldKinds.isHiddenName(name));
            assertEquals(either, FieldKinds.isDefinitionOrHiddenName(name));
        }
    }

    // ========================================
    // Label Tests
    // ========================================

    @Nested
    @DisplayName("Definition labels")
    class LabelTests {
        @Test
        void identifierLabel() {
            assertTrue(FieldKinds.isDefinitionLabel(Ast.newIdent("#Def")));
            assertFalse(FieldKinds.isDefinitionLabel(Ast.newIdent("plain")));
        }

        @Test
        void aliasedIdentifierLabel() {
            Label label = new Alias(Ast.newIdent("X"), Ast.newIdent("#Def"));
            assertTrue(FieldKinds.isDefinitionLabel(label));
        }

        @Test
        void aliasNameItselfIsIgnored() {
            Label label = new Alias(Ast.newIdent("#X"), Ast.newIdent("plain"));
            assertFalse(FieldKinds.isDefinitionLabel(label));
        }

        @Test
        void otherLabelKindsAreNeverDefinitions() {
            assertFalse(FieldKinds.isDefinitionLabel(Ast.newString("#Def")));
            assertFalse(FieldKinds.isDefinitionLabel(Ast.newList(Ast.newIdent("#Def"))));
            assertFalse(FieldKinds.isDefinitionLabel(new ParenExpr(Ast.newIdent("#Def"))));
        }
    }

    // ========================================
    // Regular Field Tests
    // ========================================

    @Nested
    @DisplayName("Regular fields")
    class RegularFieldTests {
        @Test
        void plainFieldIsRegular() {
            assertTrue(FieldKinds.isRegularField(Ast.newField("foo", Ast.newInt(1))));
        }

        @Test
        void definitionAndHiddenFieldsAreNotRegular() {
            assertFalse(FieldKinds.isRegularField(Ast.newField("#Foo", Ast.newInt(1))));
            assertFalse(FieldKinds.isRegularField(Ast.newField("_foo", Ast.newInt(1))));
        }

        @Test
        void typeConstraintFieldIsNotRegular() {
            Field field = new Field(Ast.newIdent("foo"), Token.ISA, Ast.newIdent("int"));
            assertFalse(FieldKinds.isRegularField(field));
        }

        @Test
        void aliasIsUnwrapped() {
            Field field = new Field(new Alias(Ast.newIdent("X"), Ast.newIdent("_foo")), Ast.newInt(1));
            assertFalse(FieldKinds.isRegularField(field));
        }

        @Test
        void unnamedLabelsDefaultToRegular() {
            assertTrue(FieldKinds.isRegularField(new Field(Ast.newList(Ast.newIdent("string")), Ast.newInt(1))));
            assertTrue(FieldKinds.isRegularField(new Field(new ParenExpr(Ast.newIdent("k")), Ast.newInt(1))));
            assertTrue(FieldKinds.isRegularField(new Field(Ast.newString("_quoted"), Ast.newInt(1))));
        }
    }

    // ========================================
    // Bulk and Rest Tests
    // ========================================

    @Nested
    @DisplayName("Bulk fields and rest sentinels")
    class BulkAndRestTests {
        @Test
        void patternLabelIsBulk() {
            assertTrue(FieldKinds.isBulkOptionalField(new Field(Ast.newList(Ast.newIdent("string")), Ast.newInt(1))));
            assertFalse(FieldKinds.isBulkOptionalField(Ast.newField("a", Ast.newInt(1))));
            assertFalse(FieldKinds.isBulkOptionalField(new Ellipsis()));
        }

        @Test
        void ellipsisIsRest() {
            assertTrue(FieldKinds.isRestSentinel(new Ellipsis()));
        }

        @ParameterizedTest(name = "[{0}]: _ -> {1}")
        @CsvSource({
                "string, true",
                "_,      true",
                "int,    false",
                "#Name,  false"
        })
        void longHandRest(String pattern, boolean expected) {
            Field field = new Field(Ast.newList(Ast.newIdent(pattern)), Ast.newIdent("_"));
            assertEquals(expected, FieldKinds.isRestSentinel(field));
        }

        @Test
        void longHandRequiresTopValue() {
            Field field = new Field(Ast.newList(Ast.newIdent("string")), Ast.newIdent("int"));
            assertFalse(FieldKinds.isRestSentinel(field));
        }

        @Test
        void longHandRequiresSinglePattern() {
            Field field = new Field(Ast.newList(Ast.newIdent("string"), Ast.newIdent("_")), Ast.newIdent("_"));
            assertFalse(FieldKinds.isRestSentinel(field));
        }

        @Test
        void longHandRequiresIdentifierPattern() {
            Field field = new Field(Ast.newList(Ast.newString("string")), Ast.newIdent("_"));
            assertFalse(FieldKinds.isRestSentinel(field));
        }

        @Test
        void otherDeclarationsAreNotRest() {
            assertFalse(FieldKinds.isRestSentinel(Ast.newField("_", new Ident("_"))));
            assertFalse(FieldKinds.isRestSentinel(Ast.embed(Ast.newIdent("_"))));
        }
    }
}
