package dumb.lolli;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * One-sided sequent {@code ⊢ Γ}: every formula of the linear context is consumed exactly once,
 * unless an exponential rule duplicates or discards it.
 */
public record Sequent(@JsonProperty("linear") List<Formula> linear) {

    public Sequent {
        linear = List.copyOf(requireNonNull(linear));
    }

    public static Sequent of(Formula... formulas) {
        return new Sequent(Arrays.asList(formulas));
    }

    public int size() {
        return linear.size();
    }

    public Formula get(int index) {
        return linear.get(index);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return linear.isEmpty();
    }

    public boolean contains(Formula f) {
        return linear.contains(f);
    }

    public Sequent remove(int index) {
        var next = new ArrayList<>(linear);
        next.remove(index);
        return new Sequent(next);
    }

    /** Replaces the formula at {@code index} by {@code replacements}, in place. */
    public Sequent replace(int index, Formula... replacements) {
        var next = new ArrayList<Formula>(linear.size() + replacements.length);
        next.addAll(linear.subList(0, index));
        next.addAll(Arrays.asList(replacements));
        next.addAll(linear.subList(index + 1, linear.size()));
        return new Sequent(next);
    }

    public Sequent append(Formula... formulas) {
        var next = new ArrayList<>(linear);
        next.addAll(Arrays.asList(formulas));
        return new Sequent(next);
    }

    public Sequent desugar() {
        return new Sequent(linear.stream().map(Formula::desugar).toList());
    }

    /** Occurrence count of each formula. */
    public Map<Formula, Integer> multiset() {
        var counts = new HashMap<Formula, Integer>();
        linear.forEach(f -> counts.merge(f, 1, Integer::sum));
        return counts;
    }

    /** Multiset equality: same formulas with the same multiplicities, in any order. */
    public boolean sameFormulas(Sequent other) {
        return size() == other.size() && multiset().equals(other.multiset());
    }

    public String pretty() {
        return linear.stream().map(Formula::pretty).collect(Collectors.joining(", ", "⊢ ", ""));
    }

    public String prettyAscii() {
        return linear.stream().map(Formula::prettyAscii).collect(Collectors.joining(", ", "|- ", ""));
    }
}
