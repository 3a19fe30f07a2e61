package edu.ucca.core;

import java.util.Comparator;

/**
 * A labeled, directed link between two nodes of the same passage. Remote edges are the
 * secondary parent links that turn the primary tree into a DAG.
 */
public class Edge {

    /**
     * Total order used wherever several edges compete: tag abbreviation, then child ID, then parent
     * ID, primary before remote, and finally creation order.
     */
    public static final Comparator<Edge> ORDER = (a, b) -> {
        int cmp = a.tag.getAbbreviation().compareTo(b.tag.getAbbreviation());
        if (cmp != 0) return cmp;
        cmp = Node.compareIds(a.child.getId(), b.child.getId());
        if (cmp != 0) return cmp;
        cmp = Node.compareIds(a.parent.getId(), b.parent.getId());
        if (cmp != 0) return cmp;
        cmp = Boolean.compare(a.remote, b.remote);
        if (cmp != 0) return cmp;
        return Integer.compare(a.index, b.index);
    };

    private final Node parent;
    private final Node child;
    private final EdgeTag tag;
    private final boolean remote;
    private final int index;

    Edge(Node parent, Node child, EdgeTag tag, boolean remote, int index) {
        this.parent = parent;
        this.child = child;
        this.tag = tag;
        this.remote = remote;
        this.index = index;
    }

    public Node getParent() {
        return parent;
    }

    public Node getChild() {
        return child;
    }

    public EdgeTag getTag() {
        return tag;
    }

    public boolean isRemote() {
        return remote;
    }

    /** Creation order of this edge within its passage. */
    public int getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return parent.getId() + "-" + tag + (remote ? "*" : "") + "->" + child.getId();
    }
}
