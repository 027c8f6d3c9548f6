package dumb.lolli;

import java.util.Arrays;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** A proof tree: {@code conclusion} follows from the conclusions of {@code premises} by {@code rule}. */
public record Proof(Sequent conclusion, Rule rule, List<Proof> premises) {

    public Proof {
        requireNonNull(conclusion);
        requireNonNull(rule);
        premises = List.copyOf(requireNonNull(premises));
    }

    public static Proof of(Sequent conclusion, Rule rule, Proof... premises) {
        return new Proof(conclusion, rule, Arrays.asList(premises));
    }

    public Proof premise(int index) {
        return premises.get(index);
    }

    /** Height of the tree; a leaf has depth 1. */
    public int depth() {
        return 1 + premises.stream().mapToInt(Proof::depth).max().orElse(0);
    }

    public int size() {
        return 1 + premises.stream().mapToInt(Proof::size).sum();
    }

    public int cutCount() {
        return (rule.kind() == Rule.Kind.CUT ? 1 : 0) + premises.stream().mapToInt(Proof::cutCount).sum();
    }

    /** The same proof with every focusing marker node replaced by its premise. */
    public Proof withoutMarkers() {
        if (rule.isInternal() && premises.size() == 1) return premises.get(0).withoutMarkers();
        return new Proof(conclusion, rule, premises.stream().map(Proof::withoutMarkers).toList());
    }
}
