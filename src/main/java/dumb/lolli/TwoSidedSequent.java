package dumb.lolli;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** Two-sided sequent {@code Γ ⊢ Δ}. */
public record TwoSidedSequent(List<Formula> antecedent, List<Formula> succedent) {

    public TwoSidedSequent {
        antecedent = List.copyOf(requireNonNull(antecedent));
        succedent = List.copyOf(requireNonNull(succedent));
    }

    /** {@code Γ ⊢ Δ} becomes {@code ⊢ Γ⊥, Δ}: negated antecedent first, then the succedent. */
    public Sequent toOneSided() {
        var linear = new ArrayList<Formula>(antecedent.size() + succedent.size());
        antecedent.forEach(f -> linear.add(f.negate()));
        linear.addAll(succedent);
        return new Sequent(linear);
    }

    public String pretty() {
        return (side(antecedent) + " ⊢ " + side(succedent)).strip();
    }

    private static String side(List<Formula> formulas) {
        return formulas.stream().map(Formula::pretty).collect(Collectors.joining(", "));
    }
}
