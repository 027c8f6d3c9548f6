package dumb.lolli;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Linear lambda terms: the computational content of proofs.
 * <p>
 * {@code Pair} serves both {@code ⊗} (eliminated by {@code LetPair}) and {@code &} (eliminated by {@code Fst} /
 * {@code Snd}); {@code Promote} marks a replicable value that {@code Copy}, {@code Discard} and {@code Derelict}
 * consume.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Term.Var.class, name = "var"),
        @JsonSubTypes.Type(value = Term.Abs.class, name = "abs"),
        @JsonSubTypes.Type(value = Term.App.class, name = "app"),
        @JsonSubTypes.Type(value = Term.Unit.class, name = "unit"),
        @JsonSubTypes.Type(value = Term.Trivial.class, name = "trivial"),
        @JsonSubTypes.Type(value = Term.Pair.class, name = "pair"),
        @JsonSubTypes.Type(value = Term.LetPair.class, name = "letPair"),
        @JsonSubTypes.Type(value = Term.Inl.class, name = "inl"),
        @JsonSubTypes.Type(value = Term.Inr.class, name = "inr"),
        @JsonSubTypes.Type(value = Term.Case.class, name = "case"),
        @JsonSubTypes.Type(value = Term.Promote.class, name = "promote"),
        @JsonSubTypes.Type(value = Term.Derelict.class, name = "derelict"),
        @JsonSubTypes.Type(value = Term.Copy.class, name = "copy"),
        @JsonSubTypes.Type(value = Term.Discard.class, name = "discard"),
        @JsonSubTypes.Type(value = Term.Abort.class, name = "abort"),
        @JsonSubTypes.Type(value = Term.Fst.class, name = "fst"),
        @JsonSubTypes.Type(value = Term.Snd.class, name = "snd")
})
public sealed interface Term permits Term.Var, Term.Abs, Term.App, Term.Unit, Term.Trivial, Term.Pair, Term.LetPair,
        Term.Inl, Term.Inr, Term.Case, Term.Promote, Term.Derelict, Term.Copy, Term.Discard, Term.Abort, Term.Fst,
        Term.Snd {

    Unit UNIT = new Unit();
    Trivial TRIVIAL = new Trivial();

    static Var var(String name) {
        return new Var(name);
    }

    String pretty();

    Set<String> freeVars();

    /** Replaces the free occurrences of {@code name} by {@code value}, renaming binders that would capture. */
    Term substitute(String name, Term value);

    /**
     * Substitution under the binders {@code bound}: a binder equal to {@code name} shadows it, a binder free in
     * {@code value} is renamed by priming. Returns the possibly renamed binders and the rewritten body.
     */
    private static Scope under(Term body, String name, Term value, String... bound) {
        var names = bound.clone();
        if (Arrays.asList(names).contains(name) || !body.freeVars().contains(name)) return new Scope(names, body);
        var avoid = value.freeVars();
        for (var k = 0; k < names.length; k++) {
            if (!avoid.contains(names[k])) continue;
            var fresh = names[k] + "'";
            while (avoid.contains(fresh) || body.freeVars().contains(fresh) || Arrays.asList(names).contains(fresh))
                fresh += "'";
            body = body.substitute(names[k], new Var(fresh));
            names[k] = fresh;
        }
        return new Scope(names, body.substitute(name, value));
    }

    private static Set<String> without(Set<String> vars, String... bound) {
        var result = new HashSet<>(vars);
        for (var b : bound) result.remove(b);
        return result;
    }

    private static Set<String> union(Term... terms) {
        var result = new HashSet<String>();
        for (var t : terms) result.addAll(t.freeVars());
        return result;
    }

    record Scope(String[] names, Term body) {
    }

    record Var(@JsonProperty("name") String name) implements Term {
        public Var {
            requireNonNull(name);
        }

        @Override
        public String pretty() {
            return name;
        }

        @Override
        public Set<String> freeVars() {
            return Set.of(name);
        }

        @Override
        public Term substitute(String name, Term value) {
            return this.name.equals(name) ? value : this;
        }
    }

    record Abs(String param, Term body) implements Term {
        public Abs {
            requireNonNull(param);
            requireNonNull(body);
        }

        @Override
        public String pretty() {
            return "λ" + param + ". " + body.pretty();
        }

        @Override
        public Set<String> freeVars() {
            return without(body.freeVars(), param);
        }

        @Override
        public Term substitute(String name, Term value) {
            var b = under(body, name, value, param);
            return new Abs(b.names()[0], b.body());
        }
    }

    record App(Term fun, Term arg) implements Term {
        public App {
            requireNonNull(fun);
            requireNonNull(arg);
        }

        @Override
        public String pretty() {
            var f = fun instanceof Abs ? "(" + fun.pretty() + ")" : fun.pretty();
            var a = arg instanceof App || arg instanceof Abs ? "(" + arg.pretty() + ")" : arg.pretty();
            return f + " " + a;
        }

        @Override
        public Set<String> freeVars() {
            return union(fun, arg);
        }

        @Override
        public Term substitute(String name, Term value) {
            return new App(fun.substitute(name, value), arg.substitute(name, value));
        }
    }

    record Unit() implements Term {
        @Override
        public String pretty() {
            return "()";
        }

        @Override
        public Set<String> freeVars() {
            return Set.of();
        }

        @Override
        public Term substitute(String name, Term value) {
            return this;
        }
    }

    record Trivial() implements Term {
        @Override
        public String pretty() {
            return "⟨⟩";
        }

        @Override
        public Set<String> freeVars() {
            return Set.of();
        }

        @Override
        public Term substitute(String name, Term value) {
            return this;
        }
    }

    record Pair(Term first, Term second) implements Term {
        public Pair {
            requireNonNull(first);
            requireNonNull(second);
        }

        @Override
        public String pretty() {
            return "(" + first.pretty() + ", " + second.pretty() + ")";
        }

        @Override
        public Set<String> freeVars() {
            return union(first, second);
        }

        @Override
        public Term substitute(String name, Term value) {
            return new Pair(first.substitute(name, value), second.substitute(name, value));
        }
    }

    /** {@code let (left, right) = pair in body}. */
    record LetPair(String left, String right, Term pair, Term body) implements Term {
        public LetPair {
            requireNonNull(left);
            requireNonNull(right);
            requireNonNull(pair);
            requireNonNull(body);
        }

        @Override
        public String pretty() {
            return "let (" + left + ", " + right + ") = " + pair.pretty() + " in " + body.pretty();
        }

        @Override
        public Set<String> freeVars() {
            var vars = without(body.freeVars(), left, right);
            vars.addAll(pair.freeVars());
            return vars;
        }

        @Override
        public Term substitute(String name, Term value) {
            var b = under(body, name, value, left, right);
            return new LetPair(b.names()[0], b.names()[1], pair.substitute(name, value), b.body());
        }
    }

    record Inl(@JsonProperty("body") Term body) implements Term {
        public Inl {
            requireNonNull(body);
        }

        @Override
        public String pretty() {
            return "inl " + atomic(body);
        }

        @Override
        public Set<String> freeVars() {
            return body.freeVars();
        }

        @Override
        public Term substitute(String name, Term value) {
            return new Inl(body.substitute(name, value));
        }
    }

    record Inr(@JsonProperty("body") Term body) implements Term {
        public Inr {
            requireNonNull(body);
        }

        @Override
        public String pretty() {
            return "inr " + atomic(body);
        }

        @Override
        public Set<String> freeVars() {
            return body.freeVars();
        }

        @Override
        public Term substitute(String name, Term value) {
            return new Inr(body.substitute(name, value));
        }
    }

    /** {@code case scrutinee of inl leftName => left | inr rightName => right}. */
    record Case(Term scrutinee, String leftName, Term left, String rightName, Term right) implements Term {
        public Case {
            requireNonNull(scrutinee);
            requireNonNull(leftName);
            requireNonNull(left);
            requireNonNull(rightName);
            requireNonNull(right);
        }

        @Override
        public String pretty() {
            return "case " + scrutinee.pretty() + " of inl " + leftName + " => " + left.pretty()
                    + " | inr " + rightName + " => " + right.pretty();
        }

        @Override
        public Set<String> freeVars() {
            var vars = without(left.freeVars(), leftName);
            vars.addAll(without(right.freeVars(), rightName));
            vars.addAll(scrutinee.freeVars());
            return vars;
        }

        @Override
        public Term substitute(String name, Term value) {
            var l = under(left, name, value, leftName);
            var r = under(right, name, value, rightName);
            return new Case(scrutinee.substitute(name, value), l.names()[0], l.body(), r.names()[0], r.body());
        }
    }

    record Promote(@JsonProperty("body") Term body) implements Term {
        public Promote {
            requireNonNull(body);
        }

        @Override
        public String pretty() {
            return "!" + atomic(body);
        }

        @Override
        public Set<String> freeVars() {
            return body.freeVars();
        }

        @Override
        public Term substitute(String name, Term value) {
            return new Promote(body.substitute(name, value));
        }
    }

    record Derelict(@JsonProperty("body") Term body) implements Term {
        public Derelict {
            requireNonNull(body);
        }

        @Override
        public String pretty() {
            return "derelict " + atomic(body);
        }

        @Override
        public Set<String> freeVars() {
            return body.freeVars();
        }

        @Override
        public Term substitute(String name, Term value) {
            return new Derelict(body.substitute(name, value));
        }
    }

    /** {@code copy source as (left, right) in body}. */
    record Copy(Term source, String left, String right, Term body) implements Term {
        public Copy {
            requireNonNull(source);
            requireNonNull(left);
            requireNonNull(right);
            requireNonNull(body);
        }

        @Override
        public String pretty() {
            return "copy " + source.pretty() + " as (" + left + ", " + right + ") in " + body.pretty();
        }

        @Override
        public Set<String> freeVars() {
            var vars = without(body.freeVars(), left, right);
            vars.addAll(source.freeVars());
            return vars;
        }

        @Override
        public Term substitute(String name, Term value) {
            var b = under(body, name, value, left, right);
            return new Copy(source.substitute(name, value), b.names()[0], b.names()[1], b.body());
        }
    }

    /** {@code discard discarded in body}. */
    record Discard(Term discarded, Term body) implements Term {
        public Discard {
            requireNonNull(discarded);
            requireNonNull(body);
        }

        @Override
        public String pretty() {
            return "discard " + discarded.pretty() + " in " + body.pretty();
        }

        @Override
        public Set<String> freeVars() {
            return union(discarded, body);
        }

        @Override
        public Term substitute(String name, Term value) {
            return new Discard(discarded.substitute(name, value), body.substitute(name, value));
        }
    }

    record Abort(@JsonProperty("body") Term body) implements Term {
        public Abort {
            requireNonNull(body);
        }

        @Override
        public String pretty() {
            return "abort " + atomic(body);
        }

        @Override
        public Set<String> freeVars() {
            return body.freeVars();
        }

        @Override
        public Term substitute(String name, Term value) {
            return new Abort(body.substitute(name, value));
        }
    }

    record Fst(@JsonProperty("pair") Term pair) implements Term {
        public Fst {
            requireNonNull(pair);
        }

        @Override
        public String pretty() {
            return "fst " + atomic(pair);
        }

        @Override
        public Set<String> freeVars() {
            return pair.freeVars();
        }

        @Override
        public Term substitute(String name, Term value) {
            return new Fst(pair.substitute(name, value));
        }
    }

    record Snd(@JsonProperty("pair") Term pair) implements Term {
        public Snd {
            requireNonNull(pair);
        }

        @Override
        public String pretty() {
            return "snd " + atomic(pair);
        }

        @Override
        public Set<String> freeVars() {
            return pair.freeVars();
        }

        @Override
        public Term substitute(String name, Term value) {
            return new Snd(pair.substitute(name, value));
        }
    }

    private static String atomic(Term t) {
        return t instanceof Var || t instanceof Unit || t instanceof Trivial || t instanceof Pair
                ? t.pretty() : "(" + t.pretty() + ")";
    }
}
