package com.ifdefgraph.core;

import com.ifdefgraph.core.condition.ConditionNormalizer;
import com.ifdefgraph.core.condition.ConditionParser;
import com.ifdefgraph.core.condition.ConditionRenderer;
import com.ifdefgraph.core.condition.PresenceCondition;
import com.ifdefgraph.core.condition.PresenceCondition.Atom;
import com.ifdefgraph.core.condition.PresenceCondition.Constant;
import com.ifdefgraph.core.condition.PresenceCondition.Unknown;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ifdefgraph.core.condition.PresenceCondition.and;
import static com.ifdefgraph.core.condition.PresenceCondition.not;
import static com.ifdefgraph.core.condition.PresenceCondition.or;
import static org.junit.jupiter.api.Assertions.*;

class ConditionNormalizerTest {

    private static final Atom A = new Atom("A");
    private static final Atom B = new Atom("B");
    private static final Atom C = new Atom("C");

    private final ConditionNormalizer normalizer = new ConditionNormalizer();

    private String canonical(PresenceCondition c) {
        return ConditionRenderer.render(normalizer.normalize(c));
    }

    @Test
    void nestedConjunctionsAreFlattened() {
        assertEquals("A and B and C", canonical(and(A, and(B, C))));
    }

    @Test
    void nestedDisjunctionsAreFlattened() {
        assertEquals("A or B or C", canonical(or(or(C, B), A)));
    }

    @Test
    void duplicateOperandsAreRemoved() {
        assertEquals("A and B", canonical(and(B, A, B, A)));
    }

    @Test
    void doubleNegationCollapses() {
        assertEquals("A", canonical(not(not(A))));
        assertEquals("not A", canonical(not(not(not(A)))));
    }

    @Test
    void negatedDisjunctionBecomesConjunctionOfNegations() {
        assertEquals("(not X) and (not Y)", canonical(not(or(new Atom("Y"), new Atom("X")))));
    }

    @Test
    void operandsSortedLexicallyWithLiteralsFirst() {
        assertEquals("A and C and (B or D)", canonical(and(or(new Atom("D"), B), C, A)));
    }

    @Test
    void literalsOrderedByAtomRegardlessOfPolarity() {
        assertEquals("A and (not B)", canonical(and(not(B), A)));
        assertEquals("(not A) and B", canonical(and(B, not(A))));
    }

    @Test
    void literalAndItsNegationInDisjunctionIsTrue() {
        assertEquals("TRUE", canonical(or(B, not(A), A)));
    }

    @Test
    void trueIsDroppedFromConjunction() {
        assertEquals("A", canonical(and(Constant.TRUE, A, Constant.TRUE)));
        assertEquals("TRUE", canonical(and(Constant.TRUE, Constant.TRUE)));
    }

    @Test
    void falseAbsorbsConjunction() {
        assertEquals("FALSE", canonical(and(A, Constant.FALSE)));
    }

    @Test
    void contradictionInConjunctionIsFalse() {
        assertEquals("FALSE", canonical(and(A, B, not(A))));
    }

    @Test
    void contradictionFoundAfterFlattening() {
        assertEquals("FALSE", canonical(and(A, and(B, not(A)))));
    }

    @Test
    void contradictionUnderNegatedDisjunctionIsFalse() {
        // #ifdef A ... #else of an #if A group
        Atom defined = Atom.defined("A");
        assertEquals("FALSE", canonical(and(defined, not(or(defined)))));
    }

    @Test
    void notTrueIsFalse() {
        assertSame(Constant.FALSE, normalizer.normalize(not(Constant.TRUE)));
    }

    @Test
    void singleOperandJunctionCollapsesToOperand() {
        assertEquals(A, normalizer.normalize(and(A)));
        assertEquals(A, normalizer.normalize(or(A)));
    }

    @Test
    void compoundNegationIsParenthesizedWhenRendered() {
        assertEquals("not (A and B)", ConditionRenderer.render(not(and(A, B))));
        assertEquals("(not A) or (not B)", canonical(not(and(A, B))));
    }

    @Test
    void unknownIsNeitherFoldedNorConfusedWithAMacro() {
        assertEquals("UNKNOWN and (not UNKNOWN)", canonical(and(not(Unknown.UNKNOWN), Unknown.UNKNOWN)));
        assertEquals("UNKNOWN and [UNKNOWN]", canonical(and(new Atom("UNKNOWN"), Unknown.UNKNOWN)));
        assertEquals("not UNKNOWN", canonical(not(Unknown.UNKNOWN)));
        assertEquals("FALSE", canonical(and(Unknown.UNKNOWN, Constant.FALSE)));
    }

    @Test
    void opaqueAtomsAreBracketedWhenRendered() {
        assertEquals("not [X == 1]", canonical(not(new Atom("X == 1"))));
        assertEquals("A and [VERSION > 2]", canonical(and(new Atom("VERSION > 2"), A)));
        assertEquals("[or] or defined(FOO)", canonical(or(new Atom("or"), Atom.defined("FOO"))));
    }

    @Test
    void normalizationIsIdempotent() {
        ConditionParser parser = new ConditionParser();
        List<PresenceCondition> samples = List.of(
            A,
            not(not(A)),
            and(or(C, B), not(or(A, B)), Constant.TRUE),
            or(and(A, B), and(B, A), C),
            not(and(or(A, not(B)), C)),
            and(A, not(A)),
            parser.parse("defined(FOO) && (X > 2 || !defined BAR) && 1"),
            parser.parse("!(A || (B && !C)) || 0"),
            and(Unknown.UNKNOWN, not(Unknown.UNKNOWN), new Atom("UNKNOWN"))
        );
        for (PresenceCondition c : samples) {
            PresenceCondition once = normalizer.normalize(c);
            PresenceCondition twice = normalizer.normalize(once);
            assertEquals(once, twice, "normalize must be idempotent for " + ConditionRenderer.render(c));
            assertEquals(ConditionRenderer.render(once), ConditionRenderer.render(twice));
        }
    }

    @Test
    void operandOrderDoesNotAffectCanonicalForm() {
        assertEquals(canonical(and(A, or(B, C), not(C))), canonical(and(not(C), or(C, B), A)));
    }
}
