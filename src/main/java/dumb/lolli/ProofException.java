package dumb.lolli;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A proof failed verification. A failure below the root arrives as a chain of {@link PremiseFailed} whose last
 * cause names the offending node; {@link #path()} lists the chain.
 */
public abstract sealed class ProofException extends Exception
        permits ProofException.InvalidRule, ProofException.WrongPremiseCount, ProofException.ContextMismatch,
        ProofException.PremiseFailed {

    ProofException(String message) {
        super(message);
    }

    ProofException(String message, Throwable cause) {
        super(message, cause);
    }

    /** This failure followed by its nested causes, outermost first. */
    public List<ProofException> path() {
        var path = new ArrayList<ProofException>();
        Throwable e = this;
        while (e instanceof ProofException p) {
            path.add(p);
            e = p.getCause();
        }
        return path;
    }

    /** The innermost failure: the node that is actually wrong. */
    public ProofException root() {
        var path = path();
        return path.get(path.size() - 1);
    }

    /** The rule does not fit the shape of the conclusion. */
    public static final class InvalidRule extends ProofException {
        private final Rule rule;
        private final Sequent conclusion;

        public InvalidRule(Rule rule, Sequent conclusion) {
            super("Invalid rule " + rule.label() + " for conclusion " + conclusion.pretty());
            this.rule = requireNonNull(rule);
            this.conclusion = requireNonNull(conclusion);
        }

        public Rule rule() {
            return rule;
        }

        public Sequent conclusion() {
            return conclusion;
        }
    }

    public static final class WrongPremiseCount extends ProofException {
        private final Rule rule;
        private final int expected;
        private final int got;

        public WrongPremiseCount(Rule rule, int expected, int got) {
            super(rule.label() + ": expected " + expected + " premises, got " + got);
            this.rule = requireNonNull(rule);
            this.expected = expected;
            this.got = got;
        }

        public Rule rule() {
            return rule;
        }

        public int expected() {
            return expected;
        }

        public int got() {
            return got;
        }
    }

    /** The premises do not carry the context the rule requires. */
    public static final class ContextMismatch extends ProofException {
        public ContextMismatch(String message) {
            super("Context mismatch: " + message);
        }
    }

    public static final class PremiseFailed extends ProofException {
        private final int index;

        public PremiseFailed(int index, ProofException cause) {
            super("Premise " + index + " failed: " + cause.getMessage(), requireNonNull(cause));
            this.index = index;
        }

        public int index() {
            return index;
        }

        @Override
        public synchronized ProofException getCause() {
            return (ProofException) super.getCause();
        }
    }
}
