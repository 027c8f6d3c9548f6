package dumb.lolli;

import org.junit.jupiter.api.Test;

import java.util.List;

import static dumb.lolli.Formula.*;
import static org.junit.jupiter.api.Assertions.*;

class SequentTests extends AbstractTest {

    @Test
    void replaceKeepsPosition() {
        var s = seq(A, par(B, C), TOP);
        assertEquals(seq(A, B, C, TOP), s.replace(1, B, C));
        assertEquals(seq(A, TOP), s.replace(1));
        assertEquals(seq(par(B, C), TOP), s.remove(0));
        assertEquals(seq(A, par(B, C), TOP, ONE), s.append(ONE));
        assertEquals(seq(A, par(B, C), TOP), s);
    }

    @Test
    void multisetEquality() {
        assertTrue(seq(A, B, A).sameFormulas(seq(B, A, A)));
        assertFalse(seq(A, B, A).sameFormulas(seq(A, B, B)));
        assertFalse(seq(A, B).sameFormulas(seq(A, B, B)));
        assertNotEquals(seq(A, B), seq(B, A));
        assertEquals(2, seq(A, B, A).multiset().get(A));
    }

    @Test
    void immutable() {
        var s = seq(A);
        assertThrows(UnsupportedOperationException.class, () -> s.linear().add(B));
        assertThrows(NullPointerException.class, () -> seq(A, null));
    }

    @Test
    void desugarEveryFormula() {
        assertEquals(seq(par(negAtom("A"), B), A), seq(lolli(A, B), A).desugar());
    }

    @Test
    void pretty() {
        assertEquals("⊢ A, B⊥", seq(A, negAtom("B")).pretty());
        assertEquals("|- A, B^", seq(A, negAtom("B")).prettyAscii());
    }

    @Test
    void twoSidedToOneSided() {
        var s = entails(List.of(A, lolli(A, B)), B);
        assertEquals(seq(negAtom("A"), tensor(A, negAtom("B")), B), s.toOneSided());
        assertEquals("A, (A ⊸ B) ⊢ B", s.pretty());
        assertEquals("⊢ B", entails(List.of(), B).pretty());
        assertEquals(seq(B), entails(List.of(), B).toOneSided());
    }

    @Test
    void ruleArity() {
        assertEquals(0, Rule.AXIOM.arity());
        assertEquals(0, Rule.TOP_INTRO.arity());
        assertEquals(2, Rule.TENSOR_INTRO.arity());
        assertEquals(2, Rule.WITH_INTRO.arity());
        assertEquals(2, Rule.cut(A).arity());
        assertEquals(1, Rule.CONTRACTION.arity());
        assertEquals(1, Rule.BLUR.arity());
        assertEquals(1, Rule.focusNegative(par(A, B)).arity());
    }

    @Test
    void internalRules() {
        assertTrue(Rule.BLUR.isInternal());
        assertTrue(Rule.focusPositive(A).isInternal());
        assertFalse(Rule.cut(A).isInternal());
        assertFalse(Rule.DERELICTION.isInternal());
    }

    @Test
    void ruleFormulaMustMatchKind() {
        assertThrows(IllegalArgumentException.class, () -> new Rule(Rule.Kind.CUT, null));
        assertThrows(IllegalArgumentException.class, () -> new Rule(Rule.Kind.AXIOM, A));
        assertEquals(Rule.cut(A), new Rule(Rule.Kind.CUT, A));
        assertEquals("Cut(A)", Rule.cut(A).label());
        assertEquals("Weakening", Rule.WEAKENING.label());
    }

    @Test
    void proofMeasures() {
        var leaf = axiom(A);
        assertEquals(1, leaf.depth());
        assertEquals(1, leaf.size());

        var cut = Proof.of(seq(negAtom("A"), A), Rule.cut(A), leaf, leaf);
        var root = Proof.of(seq(par(negAtom("A"), A)), Rule.PAR_INTRO, cut);
        assertEquals(3, root.depth());
        assertEquals(4, root.size());
        assertEquals(1, root.cutCount());
        assertEquals(leaf, root.premise(0).premise(1));
    }

    @Test
    void withoutMarkersDropsInternalNodes() {
        var leaf = axiom(A);
        var blurred = Proof.of(leaf.conclusion(), Rule.BLUR, leaf);
        var s = seq(negAtom("A"), plus(A, B));
        var focused = Proof.of(s, Rule.focusPositive(plus(A, B)), Proof.of(s, Rule.PLUS_INTRO_LEFT, blurred));

        assertEquals(Proof.of(s, Rule.PLUS_INTRO_LEFT, leaf), focused.withoutMarkers());
        assertEquals(leaf, leaf.withoutMarkers());
    }
}
