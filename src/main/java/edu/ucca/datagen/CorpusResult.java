package edu.ucca.datagen;

import edu.stanford.nlp.stats.ClassicCounter;
import edu.stanford.nlp.stats.Counter;
import edu.stanford.nlp.util.Pair;
import edu.ucca.core.Passage;
import edu.ucca.parser.Action;
import edu.ucca.parser.Derivation;
import edu.ucca.parser.OracleError;

import java.util.*;

/**
 * Outcome of a corpus run: one entry per input passage, in input order. Passages sharing an ID
 * each keep their own entry.
 */
public class CorpusResult {

    /**
     * The derivation of one passage, or the error that stopped it.
     */
    public static class Entry {
        private final Passage passage;
        private final Derivation derivation;
        private final OracleError error;

        private Entry(Passage passage, Derivation derivation, OracleError error) {
            this.passage = passage;
            this.derivation = derivation;
            this.error = error;
        }

        public Passage getPassage() {
            return passage;
        }

        public boolean isSuccess() {
            return derivation != null;
        }

        /** The derivation, or null if the passage failed. */
        public Derivation getDerivation() {
            return derivation;
        }

        /** The error, or null if the passage was derived. */
        public OracleError getError() {
            return error;
        }

        @Override
        public String toString() {
            return passage.getId() + ": " + (isSuccess() ? derivation.size() + " actions" : error.getReason());
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    void addDerivation(Passage passage, Derivation derivation) {
        entries.add(new Entry(passage, derivation, null));
    }

    void addFailure(Passage passage, OracleError error) {
        entries.add(new Entry(passage, null, error));
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /** Derivations of the passages that succeeded, in input order. */
    public List<Derivation> getDerivations() {
        List<Derivation> derivations = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.isSuccess()) derivations.add(entry.derivation);
        }
        return derivations;
    }

    /** Errors of the passages that failed, in input order. */
    public List<OracleError> getFailures() {
        List<OracleError> failures = new ArrayList<>();
        for (Entry entry : entries) {
            if (!entry.isSuccess()) failures.add(entry.error);
        }
        return failures;
    }

    /** The flat action records of every derived passage, ready for {@link ActionSequences}. */
    public List<Pair<String, List<ActionRecord>>> toRecords() {
        List<Pair<String, List<ActionRecord>>> records = new ArrayList<>();
        for (Derivation derivation : getDerivations()) {
            records.add(new Pair<>(derivation.getPassageId(), ActionRecord.of(derivation.getActions())));
        }
        return records;
    }

    /** How often each action type occurs over all derivations. */
    public Counter<String> actionCounts() {
        Counter<String> counts = new ClassicCounter<>();
        for (Derivation derivation : getDerivations()) {
            for (Action action : derivation.getActions()) {
                counts.incrementCount(action.getType().getName());
            }
        }
        return counts;
    }
}
