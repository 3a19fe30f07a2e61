package edu.ucca.parser;

import edu.ucca.core.EdgeTag;

public class StateEdge {
    private final StateNode parent;
    private final StateNode child;
    private final EdgeTag tag;
    private final boolean remote;

    StateEdge(StateNode parent, StateNode child, EdgeTag tag, boolean remote) {
        this.parent = parent;
        this.child = child;
        this.tag = tag;
        this.remote = remote;
    }

    public StateNode getParent() {
        return parent;
    }

    public StateNode getChild() {
        return child;
    }

    public EdgeTag getTag() {
        return tag;
    }

    public boolean isRemote() {
        return remote;
    }

    @Override
    public String toString() {
        return parent + "-" + tag + (remote ? "*" : "") + "->" + child;
    }
}
