package dumb.lolli;

import dumb.lolli.Term.Abort;
import dumb.lolli.Term.Abs;
import dumb.lolli.Term.App;
import dumb.lolli.Term.Case;
import dumb.lolli.Term.Copy;
import dumb.lolli.Term.Derelict;
import dumb.lolli.Term.Discard;
import dumb.lolli.Term.Fst;
import dumb.lolli.Term.Inl;
import dumb.lolli.Term.Inr;
import dumb.lolli.Term.LetPair;
import dumb.lolli.Term.Pair;
import dumb.lolli.Term.Promote;
import dumb.lolli.Term.Snd;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;
import java.util.function.Function;

/**
 * Small-step reduction of linear lambda terms. The head redex is contracted first; otherwise the first reducible
 * subterm, in constructor order, takes a step.
 */
public enum Normalizer {
    ;

    public static Optional<Term> step(Term t) {
        return Optional.ofNullable(reduce(t));
    }

    /** Reduces until no redex is left. Linear terms are strongly normalizing, so this terminates. */
    public static Term normalize(Term t) {
        return normalize(t, Long.MAX_VALUE);
    }

    /** At most {@code maxSteps} steps; the result may still be reducible. */
    public static Term normalize(Term t, long maxSteps) {
        var current = t;
        for (var i = 0L; i < maxSteps; i++) {
            var next = reduce(current);
            if (next == null) break;
            current = next;
        }
        return current;
    }

    public static boolean isNormal(Term t) {
        return reduce(t) == null;
    }

    @Nullable
    private static Term reduce(Term t) {
        if (t instanceof App a) {
            if (a.fun() instanceof Abs f) return f.body().substitute(f.param(), a.arg());
            return first(a.fun(), x -> new App(x, a.arg()), a.arg(), x -> new App(a.fun(), x));
        } else if (t instanceof LetPair l) {
            if (l.pair() instanceof Pair p)
                return l.body().substitute(l.left(), p.first()).substitute(l.right(), p.second());
            return first(l.pair(), x -> new LetPair(l.left(), l.right(), x, l.body()),
                    l.body(), x -> new LetPair(l.left(), l.right(), l.pair(), x));
        } else if (t instanceof Case c) {
            if (c.scrutinee() instanceof Inl i) return c.left().substitute(c.leftName(), i.body());
            if (c.scrutinee() instanceof Inr i) return c.right().substitute(c.rightName(), i.body());
            var s = reduce(c.scrutinee());
            if (s != null) return new Case(s, c.leftName(), c.left(), c.rightName(), c.right());
            return first(c.left(), x -> new Case(c.scrutinee(), c.leftName(), x, c.rightName(), c.right()),
                    c.right(), x -> new Case(c.scrutinee(), c.leftName(), c.left(), c.rightName(), x));
        } else if (t instanceof Fst f) {
            if (f.pair() instanceof Pair p) return p.first();
            return map(f.pair(), Fst::new);
        } else if (t instanceof Snd s) {
            if (s.pair() instanceof Pair p) return p.second();
            return map(s.pair(), Snd::new);
        } else if (t instanceof Derelict d) {
            if (d.body() instanceof Promote p) return p.body();
            return map(d.body(), Derelict::new);
        } else if (t instanceof Copy c) {
            // the promoted value is normalized before it is duplicated
            var s = reduce(c.source());
            if (s != null) return new Copy(s, c.left(), c.right(), c.body());
            if (c.source() instanceof Promote)
                return c.body().substitute(c.left(), c.source()).substitute(c.right(), c.source());
            return map(c.body(), x -> new Copy(c.source(), c.left(), c.right(), x));
        } else if (t instanceof Discard d) {
            if (d.discarded() instanceof Promote) return d.body();
            return first(d.discarded(), x -> new Discard(x, d.body()), d.body(), x -> new Discard(d.discarded(), x));
        } else if (t instanceof Abs a) {
            return map(a.body(), x -> new Abs(a.param(), x));
        } else if (t instanceof Pair p) {
            return first(p.first(), x -> new Pair(x, p.second()), p.second(), x -> new Pair(p.first(), x));
        } else if (t instanceof Inl i) {
            return map(i.body(), Inl::new);
        } else if (t instanceof Inr i) {
            return map(i.body(), Inr::new);
        } else if (t instanceof Promote p) {
            return map(p.body(), Promote::new);
        } else if (t instanceof Abort a) {
            return map(a.body(), Abort::new);
        }
        return null; // Var, Unit, Trivial
    }

    @Nullable
    private static Term map(Term sub, Function<Term, Term> rebuild) {
        var r = reduce(sub);
        return r == null ? null : rebuild.apply(r);
    }

    @Nullable
    private static Term first(Term a, Function<Term, Term> rebuildA, Term b, Function<Term, Term> rebuildB) {
        var r = map(a, rebuildA);
        return r != null ? r : map(b, rebuildB);
    }
}
