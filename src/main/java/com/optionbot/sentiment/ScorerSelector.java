package com.optionbot.sentiment;

import com.optionbot.core.diagnostics.CauseCode;
import com.optionbot.core.diagnostics.FeatureResolution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-scoped choice between the classifier and the lexicon.
 * UNTRIED moves to CLASSIFIER_ACTIVE on the first successful batch; any failure moves to
 * LEXICON_LOCKED, which is terminal for the run.
 */
public final class ScorerSelector {
    private static final Logger LOG = LogManager.getLogger(ScorerSelector.class);
    public static final String FEATURE_KEY = "sentiment.classifier";

    public enum State {
        UNTRIED,
        CLASSIFIER_ACTIVE,
        LEXICON_LOCKED
    }

    private final AtomicReference<Snapshot> current;

    public ScorerSelector(boolean classifierEnabled, boolean classifierPresent) {
        FeatureResolution resolution = FeatureResolution.resolve(FEATURE_KEY, classifierEnabled, classifierPresent);
        State initial = resolution.enabled() ? State.UNTRIED : State.LEXICON_LOCKED;
        this.current = new AtomicReference<>(new Snapshot(initial, resolution));
    }

    public State state() {
        return current.get().state;
    }

    public FeatureResolution resolution() {
        return current.get().resolution;
    }

    public boolean classifierAllowed() {
        return state() != State.LEXICON_LOCKED;
    }

    public void markClassifierSucceeded() {
        Snapshot snapshot = current.get();
        if (snapshot.state == State.UNTRIED) {
            current.compareAndSet(snapshot, new Snapshot(State.CLASSIFIER_ACTIVE, snapshot.resolution));
        }
    }

    /**
     * @return true when this call performed the transition
     */
    public boolean lockToLexicon(Throwable error, CauseCode cause) {
        while (true) {
            Snapshot snapshot = current.get();
            if (snapshot.state == State.LEXICON_LOCKED) {
                return false;
            }
            FeatureResolution resolution = FeatureResolution.failed(FEATURE_KEY, error, cause);
            if (current.compareAndSet(snapshot, new Snapshot(State.LEXICON_LOCKED, resolution))) {
                LOG.warn("sentiment classifier locked out for this run: {}", resolution);
                return true;
            }
        }
    }

    private static final class Snapshot {
        private final State state;
        private final FeatureResolution resolution;

        private Snapshot(State state, FeatureResolution resolution) {
            this.state = state;
            this.resolution = resolution;
        }
    }
}
