package edu.ucca.parser;

import edu.ucca.core.Passage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The actions taken to parse a passage, and the state they led to.
 */
public class Derivation {
    private final List<Action> actions;
    private final ParserState finalState;

    public Derivation(List<Action> actions, ParserState finalState) {
        this.actions = new ArrayList<>(actions);
        this.finalState = finalState;
    }

    public String getPassageId() {
        return finalState.getPassage().getId();
    }

    public List<Action> getActions() {
        return Collections.unmodifiableList(actions);
    }

    public ParserState getFinalState() {
        return finalState;
    }

    public int count(ActionType type) {
        int count = 0;
        for (Action action : actions) {
            if (action.getType() == type) count++;
        }
        return count;
    }

    /** The passage built by the derivation. */
    public Passage generatePassage() {
        return PassageGenerator.generatePassage(finalState);
    }

    public int size() {
        return actions.size();
    }

    @Override
    public String toString() {
        return getPassageId() + ": " + actions;
    }
}
