package edu.ucca.parser;

import edu.ucca.core.Passage;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives a parser state with an oracle until the state is finished.
 */
public class TransitionRunner {

    private TransitionRunner() {
    }

    /**
     * Derives the gold action sequence of a passage.
     *
     * @throws OracleException if the passage holds a structure the transitions can't build
     */
    public static Derivation extract(Passage passage, OracleConfig config) {
        return run(new ParserState(passage), new GoldOracle(passage, config), maxSteps(passage, config));
    }

    public static Derivation extract(Passage passage) {
        return extract(passage, OracleConfig.DEFAULT);
    }

    /**
     * Runs the oracle until it finishes, failing after {@code maxSteps} actions.
     */
    public static Derivation run(ParserState state, Oracle oracle, int maxSteps) {
        List<Action> actions = new ArrayList<>();
        while (!state.isFinished()) {
            if (actions.size() >= maxSteps) {
                throw new OracleException(oracle.describeFailure(state, "Exceeded the limit of " + maxSteps + " actions"));
            }
            Action action = oracle.nextAction(state).orElseThrow();
            actions.add(action);
            state.transition(action);
        }
        return new Derivation(actions, state);
    }

    /** The step limit for a passage, capped at {@code Integer.MAX_VALUE}. */
    public static int maxSteps(Passage passage, OracleConfig config) {
        long elements = passage.getTerminals().size() + passage.getUnits().size() + passage.getEdges().size() + 1;
        return (int) Math.min(Integer.MAX_VALUE, config.getMaxStepsPerElement() * elements);
    }
}
