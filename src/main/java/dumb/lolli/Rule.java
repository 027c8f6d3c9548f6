package dumb.lolli;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A sequent-calculus rule application label. Focusing markers share this type with the logical rules so that
 * every consumer walks one tree shape; {@link Kind#internal} tells them apart.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Rule(Kind kind, @Nullable Formula formula) {

    public static final Rule AXIOM = new Rule(Kind.AXIOM, null);
    public static final Rule ONE_INTRO = new Rule(Kind.ONE_INTRO, null);
    public static final Rule TOP_INTRO = new Rule(Kind.TOP_INTRO, null);
    public static final Rule BOTTOM_INTRO = new Rule(Kind.BOTTOM_INTRO, null);
    public static final Rule TENSOR_INTRO = new Rule(Kind.TENSOR_INTRO, null);
    public static final Rule PAR_INTRO = new Rule(Kind.PAR_INTRO, null);
    public static final Rule WITH_INTRO = new Rule(Kind.WITH_INTRO, null);
    public static final Rule PLUS_INTRO_LEFT = new Rule(Kind.PLUS_INTRO_LEFT, null);
    public static final Rule PLUS_INTRO_RIGHT = new Rule(Kind.PLUS_INTRO_RIGHT, null);
    public static final Rule OF_COURSE_INTRO = new Rule(Kind.OF_COURSE_INTRO, null);
    public static final Rule WHY_NOT_INTRO = new Rule(Kind.WHY_NOT_INTRO, null);
    public static final Rule WEAKENING = new Rule(Kind.WEAKENING, null);
    public static final Rule CONTRACTION = new Rule(Kind.CONTRACTION, null);
    public static final Rule DERELICTION = new Rule(Kind.DERELICTION, null);
    public static final Rule BLUR = new Rule(Kind.BLUR, null);

    public Rule {
        requireNonNull(kind);
        if (kind.carriesFormula != (formula != null))
            throw new IllegalArgumentException(kind.carriesFormula ? kind.label + " requires a formula" : kind.label + " takes no formula");
    }

    public static Rule cut(Formula formula) {
        return new Rule(Kind.CUT, requireNonNull(formula));
    }

    public static Rule focusPositive(Formula formula) {
        return new Rule(Kind.FOCUS_POSITIVE, requireNonNull(formula));
    }

    public static Rule focusNegative(Formula formula) {
        return new Rule(Kind.FOCUS_NEGATIVE, requireNonNull(formula));
    }

    public int arity() {
        return kind.arity;
    }

    @JsonIgnore
    public boolean isInternal() {
        return kind.internal;
    }

    public String label() {
        return formula == null ? kind.label : kind.label + "(" + formula.pretty() + ")";
    }

    @Override
    public String toString() {
        return label();
    }

    public enum Kind {
        AXIOM("Axiom", 0),
        ONE_INTRO("OneIntro", 0),
        TOP_INTRO("TopIntro", 0),
        BOTTOM_INTRO("BottomIntro", 1),
        TENSOR_INTRO("TensorIntro", 2),
        PAR_INTRO("ParIntro", 1),
        WITH_INTRO("WithIntro", 2),
        PLUS_INTRO_LEFT("PlusIntroLeft", 1),
        PLUS_INTRO_RIGHT("PlusIntroRight", 1),
        OF_COURSE_INTRO("OfCourseIntro", 1),
        WHY_NOT_INTRO("WhyNotIntro", 1),
        WEAKENING("Weakening", 1),
        CONTRACTION("Contraction", 1),
        DERELICTION("Dereliction", 1),
        CUT("Cut", 2, true, false),
        FOCUS_POSITIVE("FocusPositive", 1, true, true),
        FOCUS_NEGATIVE("FocusNegative", 1, true, true),
        BLUR("Blur", 1, false, true);

        public final String label;
        public final int arity;
        public final boolean carriesFormula;
        public final boolean internal;

        Kind(String label, int arity) {
            this(label, arity, false, false);
        }

        Kind(String label, int arity, boolean carriesFormula, boolean internal) {
            this.label = label;
            this.arity = arity;
            this.carriesFormula = carriesFormula;
            this.internal = internal;
        }
    }
}
