package dumb.lolli;

import dumb.lolli.Formula.Atom;
import dumb.lolli.Formula.NegAtom;
import dumb.lolli.Formula.Plus;
import dumb.lolli.Formula.Tensor;
import dumb.lolli.Formula.WhyNot;
import dumb.lolli.Term.Abs;
import dumb.lolli.Term.App;
import dumb.lolli.Term.Case;
import dumb.lolli.Term.Copy;
import dumb.lolli.Term.Derelict;
import dumb.lolli.Term.Discard;
import dumb.lolli.Term.Inl;
import dumb.lolli.Term.Inr;
import dumb.lolli.Term.LetPair;
import dumb.lolli.Term.Pair;
import dumb.lolli.Term.Promote;
import dumb.lolli.Term.Var;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Curry–Howard extraction: reads a linear lambda term off a proof.
 * <p>
 * Hypotheses introduced by a cut are kept on an environment stack while the consuming premise is read, so that
 * axioms inside it resolve to the bound variable. Fresh names are unique within one instance.
 */
public class Extractor {

    private final Deque<Binding> env = new ArrayDeque<>();
    private int counter;

    public static Term extractTerm(Proof proof) {
        return new Extractor().extract(proof);
    }

    public String freshVar() {
        return "x" + counter++;
    }

    /** A fresh name hinting at the formula: {@code a3} for the atom {@code A}, else {@code x3}. */
    public String varForFormula(Formula f) {
        if (f instanceof Atom a) return a.name().toLowerCase(Locale.ROOT) + counter++;
        if (f instanceof NegAtom n) return n.name().toLowerCase(Locale.ROOT) + counter++;
        return freshVar();
    }

    public Term extract(Proof proof) {
        var p = proof.premises();
        return switch (proof.rule().kind()) {
            case AXIOM -> axiom(proof.conclusion());
            case ONE_INTRO -> Term.UNIT;
            case TOP_INTRO -> Term.TRIVIAL;
            case BOTTOM_INTRO, PAR_INTRO, WHY_NOT_INTRO, FOCUS_POSITIVE, FOCUS_NEGATIVE, BLUR -> extract(p.get(0));
            case TENSOR_INTRO, WITH_INTRO -> {
                var left = extract(p.get(0));
                yield new Pair(left, extract(p.get(1)));
            }
            case PLUS_INTRO_LEFT -> new Inl(extract(p.get(0)));
            case PLUS_INTRO_RIGHT -> new Inr(extract(p.get(0)));
            case OF_COURSE_INTRO -> new Promote(extract(p.get(0)));
            case DERELICTION -> new Derelict(extract(p.get(0)));
            case WEAKENING -> weakening(proof);
            case CONTRACTION -> contraction(proof);
            case CUT -> cut(proof);
        };
    }

    /** The variable bound to the dual of one of the two formulas, innermost binding first. */
    private Term axiom(Sequent s) {
        for (var b : env)
            for (var f : s.linear())
                if (Formula.dual(b.formula(), f)) return new Var(b.name());
        var x = freshVar();
        return new Abs(x, new Var(x));
    }

    private Term weakening(Proof proof) {
        var dropped = extra(proof.conclusion(), proof.premise(0).conclusion());
        var bound = dropped == null ? null : lookup(dropped.negate());
        var body = extract(proof.premise(0));
        return new Discard(bound != null ? new Var(bound) : Term.UNIT, body);
    }

    private Term contraction(Proof proof) {
        var copied = extra(proof.premise(0).conclusion(), proof.conclusion());
        var hypothesis = copied == null ? null : copied.negate();
        var bound = hypothesis == null ? null : lookup(hypothesis);
        var source = new Var(bound != null ? bound : freshVar());
        var x = freshVar();
        var y = freshVar();
        if (hypothesis == null) return new Copy(source, x, y, extract(proof.premise(0)));
        env.push(new Binding(hypothesis, x));
        env.push(new Binding(hypothesis, y));
        try {
            return new Copy(source, x, y, extract(proof.premise(0)));
        } finally {
            env.pop();
            env.pop();
        }
    }

    private Term cut(Proof proof) {
        var c = requireNonNull(proof.rule().formula());
        var producerProof = proof.premise(0);
        var consumerProof = proof.premise(1);

        if (c instanceof Tensor t) {
            var producer = extract(producerProof);
            var x = varForFormula(t.left());
            var y = varForFormula(t.right());
            var consumer = under(consumerProof, new Binding(t.left(), x), new Binding(t.right(), y));
            return new LetPair(x, y, producer, consumer);
        }

        if (c instanceof Plus sum) {
            var producer = extract(producerProof);
            var x = varForFormula(sum.left());
            var y = varForFormula(sum.right());
            if (choice(consumerProof, sum)) {
                var left = under(consumerProof.premise(0), new Binding(sum.left(), x));
                var right = under(consumerProof.premise(1), new Binding(sum.right(), y));
                return new Case(producer, x, left, y, right);
            }
            var consumer = under(consumerProof, new Binding(sum.left(), x), new Binding(sum.right(), y));
            return new Case(producer, x, consumer, y, consumer);
        }

        var v = varForFormula(c);
        var producer = extract(producerProof);
        var consumer = under(consumerProof, new Binding(c, v));
        return new App(new Abs(v, consumer), producer);
    }

    /** The consumer decomposes the cut's dual {@code A⊥ & B⊥} itself, one premise per alternative. */
    private static boolean choice(Proof consumer, Plus sum) {
        return consumer.rule().kind() == Rule.Kind.WITH_INTRO
                && consumer.conclusion().contains(sum.negate())
                && consumer.premise(0).conclusion().contains(sum.left().negate())
                && consumer.premise(1).conclusion().contains(sum.right().negate());
    }

    /** Extracts {@code proof} with the given hypotheses in scope, the last one innermost. */
    private Term under(Proof proof, Binding... bindings) {
        for (var b : bindings) env.push(b);
        try {
            return extract(proof);
        } finally {
            for (var i = 0; i < bindings.length; i++) env.pop();
        }
    }

    @Nullable
    private String lookup(Formula hypothesis) {
        for (var b : env)
            if (b.formula().equals(hypothesis)) return b.name();
        return null;
    }

    /** The first {@code ?}-formula occurring more often in {@code more} than in {@code less}. */
    @Nullable
    private static Formula extra(Sequent more, Sequent less) {
        var counts = less.multiset();
        for (var f : more.linear()) {
            if (f instanceof WhyNot && counts.merge(f, -1, Integer::sum) < 0) return f;
        }
        return null;
    }

    private record Binding(Formula formula, String name) {
    }
}
