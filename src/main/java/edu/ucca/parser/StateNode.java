package edu.ucca.parser;

import edu.ucca.core.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the graph under construction. It remembers the gold node it stands for (if any), so
 * the oracle can look up the gold edges that still have to be built around it.
 */
public class StateNode {
    private final int index;
    private final Node origNode;
    private final boolean implicit;

    final List<StateEdge> incoming = new ArrayList<>();
    final List<StateEdge> outgoing = new ArrayList<>();

    StateNode(int index, Node origNode, boolean implicit) {
        this.index = index;
        this.origNode = origNode;
        this.implicit = implicit;
    }

    /** Creation order within the parser state. */
    public int getIndex() {
        return index;
    }

    public Node getOrigNode() {
        return origNode;
    }

    /** The ID of the gold node this node was built for, or null if there is none. */
    public String getNodeId() {
        return origNode == null ? null : origNode.getId();
    }

    public boolean isTerminal() {
        return origNode != null && origNode.isTerminal();
    }

    public boolean isImplicit() {
        return implicit;
    }

    public List<StateEdge> getIncoming() {
        return Collections.unmodifiableList(incoming);
    }

    public List<StateEdge> getOutgoing() {
        return Collections.unmodifiableList(outgoing);
    }

    @Override
    public String toString() {
        if (isTerminal()) return origNode.getText();
        String id = origNode == null ? "#" + index : origNode.getId();
        return implicit ? id + "(IMPLICIT)" : id;
    }
}
