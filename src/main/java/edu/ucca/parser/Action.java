package edu.ucca.parser;

import edu.ucca.core.EdgeTag;
import edu.ucca.core.Node;

import java.util.Objects;

/**
 * A single transition, with its edge tag (NODE, IMPLICIT and edge actions) or its distance (SWAP).
 *
 * Actions produced by the gold oracle also point at the gold node a NODE or IMPLICIT action
 * creates. That reference is not part of the action's identity: two actions are equal when their
 * type, tag and distance are.
 */
public class Action {
    public static final Action SHIFT = new Action(ActionType.SHIFT, null, 0, null);
    public static final Action REDUCE = new Action(ActionType.REDUCE, null, 0, null);
    public static final Action FINISH = new Action(ActionType.FINISH, null, 0, null);

    private final ActionType type;
    private final EdgeTag tag;
    private final int distance;
    private final Node origNode;

    private Action(ActionType type, EdgeTag tag, int distance, Node origNode) {
        this.type = type;
        this.tag = tag;
        this.distance = distance;
        this.origNode = origNode;
    }

    public static Action node(EdgeTag tag, Node origNode) {
        return new Action(ActionType.NODE, Objects.requireNonNull(tag), 0, origNode);
    }

    public static Action implicit(EdgeTag tag, Node origNode) {
        return new Action(ActionType.IMPLICIT, Objects.requireNonNull(tag), 0, origNode);
    }

    public static Action edge(boolean left, boolean remote, EdgeTag tag) {
        return new Action(ActionType.edge(left, remote), Objects.requireNonNull(tag), 0, null);
    }

    public static Action swap(int distance) {
        if (distance < 1) {
            throw new IllegalArgumentException("Swap distance must be positive, got " + distance);
        }
        return new Action(ActionType.SWAP, null, distance, null);
    }

    /**
     * Rebuilds an action from its flat parts, without any gold node attached.
     */
    public static Action of(ActionType type, EdgeTag tag, int distance) {
        switch (type) {
            case SHIFT: return SHIFT;
            case REDUCE: return REDUCE;
            case FINISH: return FINISH;
            case SWAP: return swap(distance);
            case NODE: return node(tag, null);
            case IMPLICIT: return implicit(tag, null);
            default: return edge(type.isLeft(), type.isRemote(), tag);
        }
    }

    public ActionType getType() {
        return type;
    }

    public EdgeTag getTag() {
        return tag;
    }

    /** Number of stack elements a SWAP moves back to the buffer; 0 for every other action. */
    public int getDistance() {
        return distance;
    }

    public Node getOrigNode() {
        return origNode;
    }

    public boolean is(ActionType... types) {
        for (ActionType t : types) {
            if (t == type) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Action)) return false;
        Action action = (Action) o;
        return distance == action.distance && type == action.type && tag == action.tag;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, tag, distance);
    }

    @Override
    public String toString() {
        if (tag != null) return type + "-" + tag;
        if (type == ActionType.SWAP) return type + "-" + distance;
        return type.toString();
    }
}
