package edu.ucca.parser;

/**
 * The closed set of transitions. Edge actions come in a left/right direction and a primary/remote
 * flavour.
 */
public enum ActionType {
    SHIFT("SHIFT"),
    NODE("NODE"),
    IMPLICIT("IMPLICIT"),
    REDUCE("REDUCE"),
    LEFT_EDGE("LEFT-EDGE"),
    RIGHT_EDGE("RIGHT-EDGE"),
    LEFT_REMOTE("LEFT-REMOTE"),
    RIGHT_REMOTE("RIGHT-REMOTE"),
    SWAP("SWAP"),
    FINISH("FINISH");

    private final String name;

    ActionType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean isEdge() {
        return this == LEFT_EDGE || this == RIGHT_EDGE || this == LEFT_REMOTE || this == RIGHT_REMOTE;
    }

    public boolean isLeft() {
        return this == LEFT_EDGE || this == LEFT_REMOTE;
    }

    public boolean isRemote() {
        return this == LEFT_REMOTE || this == RIGHT_REMOTE;
    }

    /** Whether actions of this type carry an edge tag. */
    public boolean hasTag() {
        return this == NODE || this == IMPLICIT || isEdge();
    }

    public static ActionType edge(boolean left, boolean remote) {
        if (left) return remote ? LEFT_REMOTE : LEFT_EDGE;
        return remote ? RIGHT_REMOTE : RIGHT_EDGE;
    }

    public static ActionType fromName(String name) {
        for (ActionType type : values()) {
            if (type.name.equals(name)) return type;
        }
        throw new IllegalArgumentException("Unknown action type: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
