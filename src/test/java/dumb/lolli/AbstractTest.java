package dumb.lolli;

import org.junit.jupiter.api.BeforeEach;

import java.util.List;

import static dumb.lolli.Formula.atom;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    static final Formula A = atom("A");
    static final Formula B = atom("B");
    static final Formula C = atom("C");

    protected Prover prover;

    @BeforeEach
    void setUp() {
        prover = new Prover();
    }

    static Sequent seq(Formula... formulas) {
        return Sequent.of(formulas);
    }

    static TwoSidedSequent entails(List<Formula> antecedent, Formula... succedent) {
        return new TwoSidedSequent(antecedent, List.of(succedent));
    }

    /** {@code ⊢ a⊥, a} by the axiom. */
    static Proof axiom(Formula a) {
        return Proof.of(seq(a.negate(), a), Rule.AXIOM);
    }

    Proof proved(Sequent s) {
        var proof = prover.prove(s).orElseGet(() -> fail("No proof found for " + s.pretty()));
        assertValid(proof);
        return proof;
    }

    Proof proved(TwoSidedSequent s) {
        var proof = prover.prove(s).orElseGet(() -> fail("No proof found for " + s.pretty()));
        assertValid(proof);
        return proof;
    }

    static void assertValid(Proof proof) {
        Verifier.check(proof).ifPresent(e -> fail("Invalid proof: " + e.getMessage(), e));
    }
}
