package dumb.lolli;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.lolli.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;

import static dumb.lolli.util.Log.debug;
import static dumb.lolli.util.Log.debugging;
import static dumb.lolli.util.Log.error;
import static dumb.lolli.util.Log.message;
import static dumb.lolli.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * The prove, verify, extract, normalize pipeline behind one configurable entry point.
 * <p>
 * Not thread-safe: each call creates its own {@link Prover} and {@link Extractor}, but configuration updates
 * are not coordinated with running calls.
 */
public class Workbench {

    public static final String CONFIG_RESOURCE = "lolli.json";

    static final int DEFAULT_SEARCH_DEPTH = Prover.DEFAULT_MAX_DEPTH;
    static final long DEFAULT_NORMALIZE_STEPS = 10_000;
    static final boolean DEFAULT_RECORD_FOCUS = false;
    static final boolean DEFAULT_VERIFY_PROOFS = true;

    private Configuration config;

    public Workbench() {
        this(new Configuration());
    }

    public Workbench(Configuration config) {
        applyConfig(config);
    }

    /** A workbench configured from the {@value #CONFIG_RESOURCE} classpath resource, or the defaults without it. */
    public static Workbench load() {
        try (var in = Workbench.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in == null) {
                warning("No " + CONFIG_RESOURCE + " on the classpath, using defaults.");
                return new Workbench();
            }
            return new Workbench(Json.obj(in, Configuration.class));
        } catch (IOException | IllegalArgumentException e) {
            error("Failed to load " + CONFIG_RESOURCE + ", using defaults: " + e.getMessage());
            return new Workbench();
        }
    }

    public Configuration config() {
        return config;
    }

    /** Replaces the configuration; on malformed or invalid JSON the current one is kept. */
    public boolean updateConfig(String json) {
        try {
            applyConfig(Json.obj(json, Configuration.class));
            return true;
        } catch (Exception e) {
            error("Failed to parse or apply new configuration JSON: " + e.getMessage());
            return false;
        }
    }

    void applyConfig(Configuration config) {
        this.config = requireNonNull(config);
        message(String.format("Config applied: searchDepth=%d, normalizeSteps=%d, recordFocus=%b, verifyProofs=%b",
                config.searchDepth(), config.normalizeSteps(), config.recordFocus(), config.verifyProofs()));
    }

    public Outcome run(TwoSidedSequent sequent) {
        return run(sequent.toOneSided());
    }

    /**
     * @throws IllegalStateException if proof verification is enabled and the found proof does not check
     */
    public Outcome run(Sequent sequent) {
        var c = config;
        var proof = new Prover(c.searchDepth(), c.recordFocus()).prove(sequent).orElse(null);
        if (proof == null) {
            message("No proof of " + sequent.pretty() + " within depth " + c.searchDepth());
            return new Outcome(sequent, null, null, null);
        }

        if (c.verifyProofs()) {
            try {
                Verifier.verify(proof);
            } catch (ProofException e) {
                throw new IllegalStateException("Found an invalid proof of " + sequent.pretty(), e);
            }
        }

        var term = Extractor.extractTerm(proof);
        var normal = Normalizer.normalize(term, c.normalizeSteps());
        if (!Normalizer.isNormal(normal))
            warning("Normalization of " + term.pretty() + " stopped after " + c.normalizeSteps() + " steps");
        if (debugging())
            debug(String.format("%s: %d rules, term %s, normal form %s", sequent.pretty(), proof.size(),
                    term.pretty(), normal.pretty()));
        return new Outcome(sequent, proof, term, normal);
    }

    public record Configuration(
            @JsonProperty("searchDepth") int searchDepth,
            @JsonProperty("normalizeSteps") long normalizeSteps,
            @JsonProperty("recordFocus") boolean recordFocus,
            @JsonProperty("verifyProofs") boolean verifyProofs
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("searchDepth") Integer searchDepth,
                @JsonProperty("normalizeSteps") Long normalizeSteps,
                @JsonProperty("recordFocus") Boolean recordFocus,
                @JsonProperty("verifyProofs") Boolean verifyProofs
        ) {
            this(
                    searchDepth != null ? searchDepth : DEFAULT_SEARCH_DEPTH,
                    normalizeSteps != null ? normalizeSteps : DEFAULT_NORMALIZE_STEPS,
                    recordFocus != null ? recordFocus : DEFAULT_RECORD_FOCUS,
                    verifyProofs != null ? verifyProofs : DEFAULT_VERIFY_PROOFS
            );
        }

        public Configuration() {
            this(DEFAULT_SEARCH_DEPTH, DEFAULT_NORMALIZE_STEPS, DEFAULT_RECORD_FOCUS, DEFAULT_VERIFY_PROOFS);
        }

        public Configuration(int searchDepth, long normalizeSteps, boolean recordFocus, boolean verifyProofs) {
            if (searchDepth < 0) throw new IllegalArgumentException("searchDepth must be >= 0: " + searchDepth);
            if (normalizeSteps < 0) throw new IllegalArgumentException("normalizeSteps must be >= 0: " + normalizeSteps);
            this.searchDepth = searchDepth;
            this.normalizeSteps = normalizeSteps;
            this.recordFocus = recordFocus;
            this.verifyProofs = verifyProofs;
        }
    }

    /** What {@link #run} found for {@code sequent}; the other components are null when no proof was found. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Outcome(Sequent sequent, @Nullable Proof proof, @Nullable Term term, @Nullable Term normal) {

        public Outcome {
            requireNonNull(sequent);
        }

        @JsonIgnore
        public boolean proved() {
            return proof != null;
        }
    }
}
