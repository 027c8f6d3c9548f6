package dumb.lolli;

import dumb.lolli.Formula.Bottom;
import dumb.lolli.Formula.OfCourse;
import dumb.lolli.Formula.One;
import dumb.lolli.Formula.Par;
import dumb.lolli.Formula.Plus;
import dumb.lolli.Formula.Tensor;
import dumb.lolli.Formula.WhyNot;
import dumb.lolli.Formula.With;
import dumb.lolli.ProofException.ContextMismatch;
import dumb.lolli.ProofException.InvalidRule;
import dumb.lolli.ProofException.PremiseFailed;
import dumb.lolli.ProofException.WrongPremiseCount;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Re-checks a proof tree node by node, independently of how it was built. Contexts are compared as multisets,
 * so premises may list their formulas in any order.
 */
public enum Verifier {
    ;

    public static void verify(Proof proof) throws ProofException {
        checkRule(proof);
        var premises = proof.premises();
        for (var i = 0; i < premises.size(); i++) {
            try {
                verify(premises.get(i));
            } catch (ProofException e) {
                throw new PremiseFailed(i, e);
            }
        }
    }

    public static Optional<ProofException> check(Proof proof) {
        try {
            verify(proof);
            return Optional.empty();
        } catch (ProofException e) {
            return Optional.of(e);
        }
    }

    public static boolean isValid(Proof proof) {
        return check(proof).isEmpty();
    }

    private static void checkRule(Proof proof) throws ProofException {
        var rule = proof.rule();
        var s = proof.conclusion();
        var n = proof.premises().size();
        if (n != rule.arity()) throw new WrongPremiseCount(rule, rule.arity(), n);

        switch (rule.kind()) {
            case AXIOM -> {
                if (s.size() != 2 || !Formula.dual(s.get(0), s.get(1))) throw new InvalidRule(rule, s);
            }
            case ONE_INTRO -> {
                if (s.size() != 1 || !(s.get(0) instanceof One)) throw new InvalidRule(rule, s);
            }
            case TOP_INTRO -> {
                if (!s.contains(Formula.TOP)) throw new InvalidRule(rule, s);
            }
            case BOTTOM_INTRO -> principal(proof, (c, i) ->
                    c.get(i) instanceof Bottom ? List.of(c.remove(i)) : null);
            case PAR_INTRO -> principal(proof, (c, i) ->
                    c.get(i) instanceof Par p ? List.of(c.replace(i, p.left(), p.right())) : null);
            case WITH_INTRO -> principal(proof, (c, i) ->
                    c.get(i) instanceof With w ? List.of(c.replace(i, w.left()), c.replace(i, w.right())) : null);
            case PLUS_INTRO_LEFT -> principal(proof, (c, i) ->
                    c.get(i) instanceof Plus p ? List.of(c.replace(i, p.left())) : null);
            case PLUS_INTRO_RIGHT -> principal(proof, (c, i) ->
                    c.get(i) instanceof Plus p ? List.of(c.replace(i, p.right())) : null);
            case OF_COURSE_INTRO -> principal(proof, (c, i) ->
                    c.get(i) instanceof OfCourse o && othersWhyNot(c, i) ? List.of(c.replace(i, o.body())) : null);
            case WHY_NOT_INTRO, DERELICTION -> principal(proof, (c, i) ->
                    c.get(i) instanceof WhyNot w ? List.of(c.replace(i, w.body())) : null);
            case WEAKENING -> principal(proof, (c, i) ->
                    c.get(i) instanceof WhyNot ? List.of(c.remove(i)) : null);
            case CONTRACTION -> principal(proof, (c, i) ->
                    c.get(i) instanceof WhyNot w ? List.of(c.replace(i, w, w)) : null);
            case TENSOR_INTRO -> tensor(proof);
            case CUT -> cut(proof);
            case FOCUS_POSITIVE, FOCUS_NEGATIVE -> {
                var f = rule.formula();
                var positive = rule.kind() == Rule.Kind.FOCUS_POSITIVE;
                if (f == null || !s.contains(f) || f.isPositive() != positive) throw new InvalidRule(rule, s);
                sameContext(proof);
            }
            case BLUR -> sameContext(proof);
        }
    }

    /**
     * Succeeds if some formula of the conclusion is a principal formula for the rule whose expected premises
     * match the actual ones. {@code expected} returns null for formulas of the wrong shape.
     */
    private static void principal(Proof proof, BiFunction<Sequent, Integer, List<Sequent>> expected) throws ProofException {
        var s = proof.conclusion();
        var found = false;
        for (var i = 0; i < s.size(); i++) {
            var premises = expected.apply(s, i);
            if (premises == null) continue;
            found = true;
            if (matches(premises, proof.premises())) return;
        }
        if (!found) throw new InvalidRule(proof.rule(), s);
        throw mismatch(proof);
    }

    private static void tensor(Proof proof) throws ProofException {
        var s = proof.conclusion();
        var left = proof.premise(0).conclusion();
        var right = proof.premise(1).conclusion();
        var found = false;
        for (var i = 0; i < s.size(); i++) {
            if (!(s.get(i) instanceof Tensor t)) continue;
            found = true;
            if (splits(s.remove(i), left, t.left(), right, t.right())) return;
        }
        if (!found) throw new InvalidRule(proof.rule(), s);
        throw mismatch(proof);
    }

    private static void cut(Proof proof) throws ProofException {
        var c = proof.rule().formula();
        if (c == null || !splits(proof.conclusion(), proof.premise(0).conclusion(), c, proof.premise(1).conclusion(), c.negate()))
            throw mismatch(proof);
    }

    private static void sameContext(Proof proof) throws ProofException {
        if (!proof.premise(0).conclusion().sameFormulas(proof.conclusion())) throw mismatch(proof);
    }

    /** {@code left} holds {@code a}, {@code right} holds {@code b}, and what remains of both is {@code rest}. */
    private static boolean splits(Sequent rest, Sequent left, Formula a, Sequent right, Formula b) {
        if (!left.contains(a) || !right.contains(b)) return false;
        Map<Formula, Integer> combined = new HashMap<>(left.multiset());
        right.multiset().forEach((f, k) -> combined.merge(f, k, Integer::sum));
        return combined.equals(rest.append(a, b).multiset());
    }

    private static boolean othersWhyNot(Sequent s, int i) {
        for (var j = 0; j < s.size(); j++)
            if (j != i && !(s.get(j) instanceof WhyNot)) return false;
        return true;
    }

    private static boolean matches(List<Sequent> expected, List<Proof> premises) {
        if (expected.size() != premises.size()) return false;
        for (var k = 0; k < expected.size(); k++)
            if (!expected.get(k).sameFormulas(premises.get(k).conclusion())) return false;
        return true;
    }

    private static ContextMismatch mismatch(Proof proof) {
        return new ContextMismatch(proof.rule().label() + " does not derive " + proof.conclusion().pretty() + " from "
                + proof.premises().stream().map(p -> p.conclusion().pretty()).collect(Collectors.joining(" ; ", "[", "]")));
    }
}
