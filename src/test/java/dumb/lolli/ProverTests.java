package dumb.lolli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static dumb.lolli.Formula.*;
import static org.junit.jupiter.api.Assertions.*;

class ProverTests extends AbstractTest {

    static Stream<TwoSidedSequent> mallTheorems() {
        return Stream.of(
                entails(List.of(A), A),
                entails(List.of(), lolli(A, A)),
                entails(List.of(A, B), tensor(A, B)),
                entails(List.of(tensor(A, B)), tensor(B, A)),
                entails(List.of(A, lolli(A, B)), B),
                entails(List.of(lolli(tensor(A, B), C)), lolli(A, lolli(B, C))),
                entails(List.of(lolli(A, lolli(B, C))), lolli(tensor(A, B), C)),
                entails(List.of(tensor(A, plus(B, C))), plus(tensor(A, B), tensor(A, C))),
                entails(List.of(plus(tensor(A, B), tensor(A, C))), tensor(A, plus(B, C))),
                entails(List.of(with(A, B)), A),
                entails(List.of(with(A, B)), B),
                entails(List.of(A), plus(A, B)),
                entails(List.of(B), plus(A, B)),
                entails(List.of(A, B), with(tensor(A, B), tensor(B, A))),
                entails(List.of(A, B), TOP),
                entails(List.of(ZERO), A),
                entails(List.of(), ONE),
                entails(List.of(A), tensor(A, ONE)),
                entails(List.of(par(A, B)), par(B, A))
        );
    }

    static Stream<TwoSidedSequent> mallNonTheorems() {
        return Stream.of(
                entails(List.of(A), B),
                entails(List.of(A), tensor(A, A)),
                entails(List.of(A, B), A),
                entails(List.of(with(A, B)), tensor(A, B)),
                entails(List.of(plus(A, B)), A),
                entails(List.of(tensor(A, B)), with(A, B)),
                entails(List.of(), ZERO),
                entails(List.of(A), ONE),
                entails(List.of(), A)
        );
    }

    @ParameterizedTest
    @MethodSource("mallTheorems")
    void provesMallTheorems(TwoSidedSequent s) {
        var proof = proved(s);
        assertEquals(s.toOneSided().desugar(), proof.conclusion());
        assertEquals(0, proof.cutCount());
    }

    @ParameterizedTest
    @MethodSource("mallNonTheorems")
    void rejectsMallNonTheorems(TwoSidedSequent s) {
        assertTrue(prover.prove(s).isEmpty(), s.pretty());
    }

    @Test
    void axiom() {
        var proof = proved(seq(negAtom("A"), A));
        assertEquals(Rule.AXIOM, proof.rule());
        assertTrue(proof.premises().isEmpty());
        assertEquals(Rule.AXIOM, proved(seq(A, negAtom("A"))).rule());
    }

    @Test
    void leafRulesCloseAtDepthZero() {
        var bounded = new Prover(0);
        assertEquals(Rule.AXIOM, bounded.prove(seq(negAtom("A"), A)).orElseThrow().rule());
        assertEquals(Rule.ONE_INTRO, bounded.prove(seq(ONE)).orElseThrow().rule());
        assertEquals(Rule.TOP_INTRO, bounded.prove(seq(A, B, TOP)).orElseThrow().rule());
        assertTrue(bounded.prove(seq(par(negAtom("A"), A))).isEmpty());
        assertTrue(new Prover(1).prove(seq(par(negAtom("A"), A))).isPresent());
    }

    @Test
    void unrelatedAtomsHaveNoProof() {
        assertTrue(prover.prove(seq(A, B)).isEmpty());
        assertTrue(prover.explored() > 0);
    }

    @Test
    void withSharesTheContext() {
        var proof = proved(entails(List.of(A, B), with(tensor(A, B), tensor(B, A))));
        assertEquals(Rule.WITH_INTRO, proof.rule());
        assertEquals(2, proof.premises().size());
        var rest = seq(negAtom("A"), negAtom("B"));
        assertEquals(rest.append(tensor(A, B)), proof.premise(0).conclusion());
        assertEquals(rest.append(tensor(B, A)), proof.premise(1).conclusion());
    }

    @Test
    void tensorSplitsTheContext() {
        var proof = proved(entails(List.of(A, B), tensor(A, B)));
        assertEquals(Rule.TENSOR_INTRO, proof.rule());
        assertEquals(seq(negAtom("A"), A), proof.premise(0).conclusion());
        assertEquals(seq(negAtom("B"), B), proof.premise(1).conclusion());
    }

    @Test
    void plusPicksTheProvableSide() {
        assertEquals(Rule.PLUS_INTRO_LEFT, proved(entails(List.of(A), plus(A, B))).rule());
        assertEquals(Rule.PLUS_INTRO_RIGHT, proved(entails(List.of(B), plus(A, B))).rule());
    }

    @Test
    void dereliction() {
        var proof = proved(entails(List.of(ofCourse(A)), A));
        assertEquals(Rule.DERELICTION, proof.rule());
        assertEquals(Rule.AXIOM, proof.premise(0).rule());
    }

    @Test
    void whyNotIntroOnPositiveBody() {
        var proof = proved(seq(whyNot(A), negAtom("A")));
        assertEquals(Rule.WHY_NOT_INTRO, proof.rule());
        assertEquals(seq(A, negAtom("A")), proof.premise(0).conclusion());
    }

    @Test
    void weakening() {
        var proof = proved(entails(List.of(ofCourse(A)), ONE));
        assertEquals(Rule.WEAKENING, proof.rule());
        assertEquals(Rule.ONE_INTRO, proof.premise(0).rule());
    }

    @Test
    void contraction() {
        var proof = proved(entails(List.of(ofCourse(A)), tensor(A, A)));
        assertEquals(Rule.CONTRACTION, proof.rule());
        assertEquals(seq(whyNot(negAtom("A")), whyNot(negAtom("A")), tensor(A, A)), proof.premise(0).conclusion());
    }

    @Test
    void promotion() {
        var proof = proved(entails(List.of(ofCourse(A)), ofCourse(A)));
        assertEquals(Rule.OF_COURSE_INTRO, proof.rule());
        assertEquals(Rule.ONE_INTRO, proved(seq(ofCourse(ONE))).premise(0).rule());
    }

    @Test
    void promotionNeedsAnExponentialContext() {
        assertTrue(prover.prove(entails(List.of(A), ofCourse(A))).isEmpty());
        assertTrue(prover.prove(seq(ofCourse(A))).isEmpty());
    }

    @Test
    void topClosesImmediately() {
        var proof = proved(seq(tensor(A, B), ZERO, TOP));
        assertEquals(Rule.TOP_INTRO, proof.rule());
        assertEquals(1, proof.size());
    }

    @Test
    void bottomIsDropped() {
        var proof = proved(seq(BOTTOM, ONE));
        assertEquals(Rule.BOTTOM_INTRO, proof.rule());
        assertEquals(seq(ONE), proof.premise(0).conclusion());
    }

    @Test
    void recordedFocusMarkersVerifyAndStrip() {
        var s = entails(List.of(with(A, B)), A);
        var recorded = new Prover(Prover.DEFAULT_MAX_DEPTH, true).prove(s).orElseThrow();
        assertValid(recorded);
        assertEquals(Rule.focusPositive(plus(negAtom("A"), negAtom("B"))), recorded.rule());
        assertEquals(Rule.BLUR, recorded.premise(0).premise(0).rule());
        assertEquals(proved(s), recorded.withoutMarkers());
    }

    @Test
    void depthIsBounded() {
        var s = entails(List.of(lolli(tensor(A, B), C)), lolli(A, lolli(B, C)));
        var proof = proved(s);
        assertTrue(new Prover(proof.depth() - 1).prove(s).isPresent());
        assertTrue(new Prover(2).prove(s).isEmpty());
        assertEquals(7, new Prover(7).maxDepth());
        assertThrows(IllegalArgumentException.class, () -> new Prover(-1));
    }

    @Test
    void oversizedTensorContext() {
        var formulas = new ArrayList<Formula>();
        for (var i = 0; i < 32; i++) formulas.add(atom("P" + i));
        for (var i = 0; i < 31; i++) formulas.add(negAtom("P" + i));
        formulas.add(tensor(negAtom("P31"), ONE));
        assertThrows(IllegalStateException.class, () -> prover.prove(new Sequent(formulas)));
    }

    @Test
    void equalFormulasSplitOnce() {
        var formulas = new ArrayList<Formula>();
        for (var i = 0; i < Long.SIZE; i++) formulas.add(negAtom("A"));
        formulas.add(tensor(A, ONE));
        assertTrue(prover.prove(new Sequent(formulas)).isEmpty());
        assertTrue(prover.explored() < 1_000, () -> prover.explored() + " nodes");
    }

    static Stream<Sequent> exponentialNonTheorems() {
        return Stream.of(
                seq(whyNot(A), whyNot(B), C),
                seq(whyNot(A), whyNot(B), whyNot(C), atom("D")),
                seq(whyNot(A), whyNot(negAtom("A")), ZERO),
                seq(whyNot(A), whyNot(negAtom("A")), whyNot(B), ZERO)
        );
    }

    @ParameterizedTest
    @MethodSource("exponentialNonTheorems")
    @Timeout(10)
    void exponentialSearchTerminates(Sequent s) {
        assertEquals(Prover.DEFAULT_MAX_DEPTH, prover.maxDepth());
        assertTrue(prover.prove(s).isEmpty(), s.pretty());
    }

    @Test
    @Timeout(10)
    void structuralMovesAfterAWithSplit() {
        // each & branch handles ?A⊥ differently: weakened beside 1, derelicted beside A
        var proof = proved(seq(whyNot(negAtom("A")), whyNot(with(ONE, A))));
        var split = proof;
        while (split.rule() != Rule.WITH_INTRO) split = split.premise(0);
        assertEquals(Rule.WEAKENING, split.premise(0).rule());
        assertEquals(Rule.WEAKENING, split.premise(1).rule());
    }

    @Test
    void derelictsEachHypothesis() {
        var proof = proved(seq(whyNot(negAtom("A")), whyNot(negAtom("B")), tensor(B, A)));
        assertEquals(Rule.DERELICTION, proof.rule());
        assertEquals(Rule.DERELICTION, proof.premise(0).rule());
        assertEquals(Rule.TENSOR_INTRO, proof.premise(0).premise(0).rule());
    }
}
