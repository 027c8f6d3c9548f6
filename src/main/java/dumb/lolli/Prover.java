package dumb.lolli;

import dumb.lolli.Formula.Atom;
import dumb.lolli.Formula.Bottom;
import dumb.lolli.Formula.Lolli;
import dumb.lolli.Formula.NegAtom;
import dumb.lolli.Formula.One;
import dumb.lolli.Formula.OfCourse;
import dumb.lolli.Formula.Par;
import dumb.lolli.Formula.Plus;
import dumb.lolli.Formula.Tensor;
import dumb.lolli.Formula.Top;
import dumb.lolli.Formula.WhyNot;
import dumb.lolli.Formula.With;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static dumb.lolli.util.Log.debug;
import static dumb.lolli.util.Log.debugging;

/**
 * Focused backward proof search for MALL with exponentials.
 * <p>
 * Invertible formulas ({@code ⅋ ⊥ & ⊤}) are decomposed eagerly, left to right. Once none is left the search
 * picks a positive formula, decomposes it under focus until a negative subformula is reached, and backtracks
 * over focus choices, tensor context splits and plus branches. {@code ?A} formulas are handled last, by
 * weakening, dereliction or contraction, in position order between two focus steps. Every rule application costs one unit of depth; leaf rules close even
 * at depth 0.
 * <p>
 * An instance keeps per-call state and must not be shared between concurrent searches.
 */
public class Prover {

    public static final int DEFAULT_MAX_DEPTH = 100;

    private final int maxDepth;
    private final boolean recordFocus;

    /** Stable sequents on the current branch, as multisets, with their position on the branch. */
    private final Map<Map<Formula, Integer>, Integer> branch = new HashMap<>();

    /** Largest depth at which a stable sequent failed without a loop check reaching above it. */
    private final Map<Visit, Integer> failed = new HashMap<>();

    /** Shallowest branch position a loop check hit inside the current subtree. */
    private int blockedAt;
    private long explored;

    public Prover() {
        this(DEFAULT_MAX_DEPTH);
    }

    public Prover(int maxDepth) {
        this(maxDepth, false);
    }

    /**
     * @param recordFocus wrap focus decisions in {@link Rule.Kind#FOCUS_POSITIVE} nodes and the return to the
     *                    invertible phase in {@link Rule.Kind#BLUR} nodes
     */
    public Prover(int maxDepth, boolean recordFocus) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        this.maxDepth = maxDepth;
        this.recordFocus = recordFocus;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /** Nodes visited by the most recent call. */
    public long explored() {
        return explored;
    }

    public Optional<Proof> prove(TwoSidedSequent sequent) {
        return prove(sequent.toOneSided());
    }

    public Optional<Proof> prove(Sequent sequent) {
        var goal = sequent.desugar();
        branch.clear();
        failed.clear();
        blockedAt = Integer.MAX_VALUE;
        explored = 0;

        var proof = search(goal, maxDepth, 0);

        if (debugging())
            debug(proof != null
                    ? String.format("Proved %s: depth %d, %d nodes explored", goal.pretty(), proof.depth(), explored)
                    : String.format("No proof of %s within depth %d (%d nodes explored)", goal.pretty(), maxDepth, explored));
        return Optional.ofNullable(proof);
    }

    /**
     * @param from first position open to structural moves. Positions before it hold formulas left untouched since
     *             the last focus or {@code &} split, so moves on them would only reorder an earlier choice.
     */
    @Nullable
    private Proof search(Sequent s, int depth, int from) {
        explored++;

        for (var f : s.linear())
            if (f instanceof Top) return Proof.of(s, Rule.TOP_INTRO);

        for (var i = 0; i < s.size(); i++) {
            var f = s.get(i);
            if (f instanceof Par p) {
                if (depth <= 0) return null;
                return wrap(s, Rule.PAR_INTRO, search(s.replace(i, p.left(), p.right()), depth - 1, from));
            } else if (f instanceof Bottom) {
                if (depth <= 0) return null;
                return wrap(s, Rule.BOTTOM_INTRO, search(s.remove(i), depth - 1, from));
            } else if (f instanceof With w) {
                if (depth <= 0) return null;
                var left = search(s.replace(i, w.left()), depth - 1, 0);
                if (left == null) return null;
                var right = search(s.replace(i, w.right()), depth - 1, 0);
                return right == null ? null : Proof.of(s, Rule.WITH_INTRO, left, right);
            }
        }

        return stable(s, depth, from);
    }

    /** No invertible formula left: close by a leaf rule, focus, or fall back to the exponential moves. */
    @Nullable
    private Proof stable(Sequent s, int depth, int from) {
        if (s.size() == 2 && Formula.dual(s.get(0), s.get(1))) return Proof.of(s, Rule.AXIOM);
        if (s.size() == 1 && s.get(0) instanceof One) return Proof.of(s, Rule.ONE_INTRO);
        if (depth <= 0 || stranded(s)) return null;

        var visit = new Visit(s, from);
        var known = failed.get(visit);
        if (known != null && known >= depth) return null;

        var key = s.multiset();
        var level = branch.size();
        var seen = branch.putIfAbsent(key, level);
        if (seen != null) {
            blockedAt = Math.min(blockedAt, seen);
            return null;
        }

        var outer = blockedAt;
        blockedAt = Integer.MAX_VALUE;
        try {
            var proof = decide(s, depth, from);
            if (proof == null && blockedAt >= level) failed.merge(visit, depth, Math::max);
            return proof;
        } finally {
            branch.remove(key);
            blockedAt = Math.min(outer, blockedAt);
        }
    }

    @Nullable
    private Proof decide(Sequent s, int depth, int from) {
        for (var i = 0; i < s.size(); i++) {
            var f = s.get(i);
            if (f instanceof Tensor || f instanceof Plus || f instanceof OfCourse || f instanceof One) {
                var proof = focus(s, i, depth);
                if (proof != null) return recordFocus ? Proof.of(s, Rule.focusPositive(f), proof) : proof;
            }
        }
        return structural(s, depth, from);
    }

    /** Decomposes {@code s.get(i)} under focus. */
    @Nullable
    private Proof focus(Sequent s, int i, int depth) {
        explored++;
        var f = s.get(i);

        if (f instanceof Atom)
            return s.size() == 2 && Formula.dual(s.get(0), s.get(1)) ? Proof.of(s, Rule.AXIOM) : null;
        if (f instanceof One)
            return s.size() == 1 ? Proof.of(s, Rule.ONE_INTRO) : null;
        if (f.isNegative()) {
            var proof = search(s, depth, 0);
            return recordFocus ? wrap(s, Rule.BLUR, proof) : proof;
        }
        if (depth <= 0) return null;

        if (f instanceof Tensor t) {
            return tensor(s, i, t, depth);
        } else if (f instanceof Plus p) {
            var left = focus(s.replace(i, p.left()), i, depth - 1);
            if (left != null) return Proof.of(s, Rule.PLUS_INTRO_LEFT, left);
            return wrap(s, Rule.PLUS_INTRO_RIGHT, focus(s.replace(i, p.right()), i, depth - 1));
        } else if (f instanceof OfCourse o) {
            for (var j = 0; j < s.size(); j++)
                if (j != i && !(s.get(j) instanceof WhyNot)) return null;
            return wrap(s, Rule.OF_COURSE_INTRO, search(s.replace(i, o.body()), depth - 1, 0));
        }
        return null; // 0 has no rule
    }

    /**
     * Tries every split of the other formulas between the two premises. Equal formulas are interchangeable, so a
     * split only fixes how many copies of each go left.
     */
    @Nullable
    private Proof tensor(Sequent s, int i, Tensor t, int depth) {
        var counts = new LinkedHashMap<Formula, Integer>();
        for (var j = 0; j < s.size(); j++)
            if (j != i) counts.merge(s.get(j), 1, Integer::sum);

        long splits = 1;
        try {
            for (var c : counts.values()) splits = Math.multiplyExact(splits, c + 1L);
        } catch (ArithmeticException e) {
            throw new IllegalStateException("Context too large to split: " + s.size() + " formulas", e);
        }

        for (var n = 0L; n < splits; n++) {
            var quota = new HashMap<Formula, Long>();
            var rest = n;
            for (var e : counts.entrySet()) {
                quota.put(e.getKey(), rest % (e.getValue() + 1));
                rest /= e.getValue() + 1;
            }

            var left = new ArrayList<Formula>();
            var right = new ArrayList<Formula>();
            int leftFocus = -1, rightFocus = -1;
            for (var j = 0; j < s.size(); j++) {
                var f = s.get(j);
                if (j == i) {
                    leftFocus = left.size();
                    left.add(t.left());
                    rightFocus = right.size();
                    right.add(t.right());
                } else if (quota.merge(f, -1L, Long::sum) >= 0) {
                    left.add(f);
                } else {
                    right.add(f);
                }
            }

            var l = focus(new Sequent(left), leftFocus, depth - 1);
            if (l == null) continue;
            var r = focus(new Sequent(right), rightFocus, depth - 1);
            if (r != null) return Proof.of(s, Rule.TENSOR_INTRO, l, r);
        }
        return null;
    }

    /**
     * Weakening, dereliction and contraction on the first occurrence of each distinct {@code ?A} at or after
     * {@code from}. Moves on different occurrences commute, so a run of them is only explored in position order.
     */
    @Nullable
    private Proof structural(Sequent s, int depth, int from) {
        var tried = new HashSet<Formula>();
        for (var i = from; i < s.size(); i++) {
            if (!(s.get(i) instanceof WhyNot w) || !tried.add(w)) continue;

            var proof = wrap(s, Rule.WEAKENING, search(s.remove(i), depth - 1, i));
            if (proof != null) return proof;

            var use = w.body().isNegative() ? Rule.DERELICTION : Rule.WHY_NOT_INTRO;
            proof = wrap(s, use, search(s.replace(i, w.body()), depth - 1, i));
            if (proof != null) return proof;

            if (s.multiset().get(w) == 1) {
                proof = wrap(s, Rule.CONTRACTION, search(s.replace(i, w, w), depth - 1, i));
                if (proof != null) return proof;
            }
        }
        return null;
    }

    /**
     * A literal leaves the context only through an axiom with its dual or under {@code ⊤}. When neither occurs as
     * a subformula anywhere in {@code s}, no cut-free proof exists.
     */
    private static boolean stranded(Sequent s) {
        var found = new HashSet<Formula>();
        for (var f : s.linear()) literals(f, found);
        if (found.contains(Formula.TOP)) return false;
        for (var f : s.linear())
            if ((f instanceof Atom || f instanceof NegAtom) && !found.contains(f.negate())) return true;
        return false;
    }

    /** Collects the literal and {@code ⊤} subformulas of {@code f}. */
    private static void literals(Formula f, Set<Formula> into) {
        if (f instanceof Atom || f instanceof NegAtom || f instanceof Top) {
            into.add(f);
        } else if (f instanceof Tensor t) {
            literals(t.left(), into);
            literals(t.right(), into);
        } else if (f instanceof Par p) {
            literals(p.left(), into);
            literals(p.right(), into);
        } else if (f instanceof With w) {
            literals(w.left(), into);
            literals(w.right(), into);
        } else if (f instanceof Plus p) {
            literals(p.left(), into);
            literals(p.right(), into);
        } else if (f instanceof Lolli l) {
            literals(l.left(), into);
            literals(l.right(), into);
        } else if (f instanceof OfCourse o) {
            literals(o.body(), into);
        } else if (f instanceof WhyNot w) {
            literals(w.body(), into);
        }
    }

    @Nullable
    private static Proof wrap(Sequent conclusion, Rule rule, @Nullable Proof premise) {
        return premise == null ? null : Proof.of(conclusion, rule, premise);
    }

    private record Visit(Sequent sequent, int from) {
    }
}
