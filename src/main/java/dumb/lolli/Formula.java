package dumb.lolli;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import static java.util.Objects.requireNonNull;

/**
 * A linear logic formula.
 * <p>
 * Positive formulas ({@code A}, {@code ⊗}, {@code 1}, {@code ⊕}, {@code 0}, {@code !}) decompose under focus;
 * negative ones ({@code A⊥}, {@code ⅋}, {@code ⊥}, {@code &}, {@code ⊤}, {@code ?}) decompose invertibly.
 * {@link Lolli} is sugar for {@code A⊥ ⅋ B} and is removed by {@link #desugar()} before search.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Formula.Atom.class, name = "atom"),
        @JsonSubTypes.Type(value = Formula.NegAtom.class, name = "negAtom"),
        @JsonSubTypes.Type(value = Formula.Tensor.class, name = "tensor"),
        @JsonSubTypes.Type(value = Formula.Par.class, name = "par"),
        @JsonSubTypes.Type(value = Formula.One.class, name = "one"),
        @JsonSubTypes.Type(value = Formula.Bottom.class, name = "bottom"),
        @JsonSubTypes.Type(value = Formula.With.class, name = "with"),
        @JsonSubTypes.Type(value = Formula.Plus.class, name = "plus"),
        @JsonSubTypes.Type(value = Formula.Top.class, name = "top"),
        @JsonSubTypes.Type(value = Formula.Zero.class, name = "zero"),
        @JsonSubTypes.Type(value = Formula.OfCourse.class, name = "ofCourse"),
        @JsonSubTypes.Type(value = Formula.WhyNot.class, name = "whyNot"),
        @JsonSubTypes.Type(value = Formula.Lolli.class, name = "lolli")
})
public sealed interface Formula permits Formula.Atom, Formula.NegAtom, Formula.Tensor, Formula.Par, Formula.One,
        Formula.Bottom, Formula.With, Formula.Plus, Formula.Top, Formula.Zero, Formula.OfCourse, Formula.WhyNot,
        Formula.Lolli {

    One ONE = new One();
    Bottom BOTTOM = new Bottom();
    Top TOP = new Top();
    Zero ZERO = new Zero();

    static Atom atom(String name) {
        return new Atom(name);
    }

    static NegAtom negAtom(String name) {
        return new NegAtom(name);
    }

    static Tensor tensor(Formula left, Formula right) {
        return new Tensor(left, right);
    }

    static Par par(Formula left, Formula right) {
        return new Par(left, right);
    }

    static With with(Formula left, Formula right) {
        return new With(left, right);
    }

    static Plus plus(Formula left, Formula right) {
        return new Plus(left, right);
    }

    static Lolli lolli(Formula left, Formula right) {
        return new Lolli(left, right);
    }

    static OfCourse ofCourse(Formula body) {
        return new OfCourse(body);
    }

    static WhyNot whyNot(Formula body) {
        return new WhyNot(body);
    }

    /** Linear negation; involutive on every primitive connective. */
    Formula negate();

    /** Expands every {@code A ⊸ B} into {@code A⊥ ⅋ B}. */
    Formula desugar();

    /** Number of atom and connective nodes. */
    int size();

    String print(boolean ascii);

    default String pretty() {
        return print(false);
    }

    default String prettyAscii() {
        return print(true);
    }

    @JsonIgnore
    default boolean isPositive() {
        return this instanceof Atom || this instanceof Tensor || this instanceof One
                || this instanceof Plus || this instanceof Zero || this instanceof OfCourse;
    }

    @JsonIgnore
    default boolean isNegative() {
        return !isPositive();
    }

    /** True for the two-formula pattern closed by the axiom: an atom and its negation. */
    static boolean dual(Formula x, Formula y) {
        return (x instanceof Atom a && y instanceof NegAtom n && a.name().equals(n.name()))
                || (x instanceof NegAtom n2 && y instanceof Atom a2 && a2.name().equals(n2.name()));
    }

    private static String infix(Formula left, String op, Formula right, boolean ascii) {
        return "(" + left.print(ascii) + " " + op + " " + right.print(ascii) + ")";
    }

    record Atom(@JsonProperty("name") String name) implements Formula {
        public Atom {
            requireNonNull(name);
        }

        @Override
        public Formula negate() {
            return new NegAtom(name);
        }

        @Override
        public Formula desugar() {
            return this;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String print(boolean ascii) {
            return name;
        }
    }

    record NegAtom(@JsonProperty("name") String name) implements Formula {
        public NegAtom {
            requireNonNull(name);
        }

        @Override
        public Formula negate() {
            return new Atom(name);
        }

        @Override
        public Formula desugar() {
            return this;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String print(boolean ascii) {
            return name + (ascii ? "^" : "⊥");
        }
    }

    record Tensor(Formula left, Formula right) implements Formula {
        public Tensor {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public Formula negate() {
            return new Par(left.negate(), right.negate());
        }

        @Override
        public Formula desugar() {
            return new Tensor(left.desugar(), right.desugar());
        }

        @Override
        public int size() {
            return 1 + left.size() + right.size();
        }

        @Override
        public String print(boolean ascii) {
            return infix(left, ascii ? "*" : "⊗", right, ascii);
        }
    }

    record Par(Formula left, Formula right) implements Formula {
        public Par {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public Formula negate() {
            return new Tensor(left.negate(), right.negate());
        }

        @Override
        public Formula desugar() {
            return new Par(left.desugar(), right.desugar());
        }

        @Override
        public int size() {
            return 1 + left.size() + right.size();
        }

        @Override
        public String print(boolean ascii) {
            return infix(left, ascii ? "|" : "⅋", right, ascii);
        }
    }

    record One() implements Formula {
        @Override
        public Formula negate() {
            return BOTTOM;
        }

        @Override
        public Formula desugar() {
            return this;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String print(boolean ascii) {
            return "1";
        }
    }

    record Bottom() implements Formula {
        @Override
        public Formula negate() {
            return ONE;
        }

        @Override
        public Formula desugar() {
            return this;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String print(boolean ascii) {
            return ascii ? "bot" : "⊥";
        }
    }

    record With(Formula left, Formula right) implements Formula {
        public With {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public Formula negate() {
            return new Plus(left.negate(), right.negate());
        }

        @Override
        public Formula desugar() {
            return new With(left.desugar(), right.desugar());
        }

        @Override
        public int size() {
            return 1 + left.size() + right.size();
        }

        @Override
        public String print(boolean ascii) {
            return infix(left, "&", right, ascii);
        }
    }

    record Plus(Formula left, Formula right) implements Formula {
        public Plus {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public Formula negate() {
            return new With(left.negate(), right.negate());
        }

        @Override
        public Formula desugar() {
            return new Plus(left.desugar(), right.desugar());
        }

        @Override
        public int size() {
            return 1 + left.size() + right.size();
        }

        @Override
        public String print(boolean ascii) {
            return infix(left, ascii ? "+" : "⊕", right, ascii);
        }
    }

    record Top() implements Formula {
        @Override
        public Formula negate() {
            return ZERO;
        }

        @Override
        public Formula desugar() {
            return this;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String print(boolean ascii) {
            return ascii ? "top" : "⊤";
        }
    }

    record Zero() implements Formula {
        @Override
        public Formula negate() {
            return TOP;
        }

        @Override
        public Formula desugar() {
            return this;
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public String print(boolean ascii) {
            return "0";
        }
    }

    record OfCourse(@JsonProperty("body") Formula body) implements Formula {
        public OfCourse {
            requireNonNull(body);
        }

        @Override
        public Formula negate() {
            return new WhyNot(body.negate());
        }

        @Override
        public Formula desugar() {
            return new OfCourse(body.desugar());
        }

        @Override
        public int size() {
            return 1 + body.size();
        }

        @Override
        public String print(boolean ascii) {
            return "!" + body.print(ascii);
        }
    }

    record WhyNot(@JsonProperty("body") Formula body) implements Formula {
        public WhyNot {
            requireNonNull(body);
        }

        @Override
        public Formula negate() {
            return new OfCourse(body.negate());
        }

        @Override
        public Formula desugar() {
            return new WhyNot(body.desugar());
        }

        @Override
        public int size() {
            return 1 + body.size();
        }

        @Override
        public String print(boolean ascii) {
            return "?" + body.print(ascii);
        }
    }

    record Lolli(Formula left, Formula right) implements Formula {
        public Lolli {
            requireNonNull(left);
            requireNonNull(right);
        }

        /** {@code (A ⊸ B)⊥ = A ⊗ B⊥}. */
        @Override
        public Formula negate() {
            return new Tensor(left, right.negate());
        }

        @Override
        public Formula desugar() {
            return new Par(left.negate().desugar(), right.desugar());
        }

        @Override
        public int size() {
            return 1 + left.size() + right.size();
        }

        @Override
        public String print(boolean ascii) {
            return infix(left, ascii ? "-o" : "⊸", right, ascii);
        }
    }
}
