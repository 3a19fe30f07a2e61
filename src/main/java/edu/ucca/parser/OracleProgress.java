package edu.ucca.parser;

import edu.stanford.nlp.util.StringUtils;
import edu.ucca.core.Edge;
import edu.ucca.core.Node;
import edu.ucca.core.Passage;

import java.util.*;

/**
 * The gold structure an oracle still has to account for: units not yet created and edges not yet
 * built. Both only ever shrink, through {@link #discharge(Edge)} and {@link #discharge(Node)}.
 *
 * Kept in sorted sets so that every scan over the remaining edges sees them in {@link Edge#ORDER}.
 */
public class OracleProgress {
    private final SortedSet<String> nodesRemaining = new TreeSet<>(Node.ID_ORDER);
    private final SortedSet<Edge> edgesRemaining = new TreeSet<>(Edge.ORDER);

    public OracleProgress(Passage passage) {
        for (Node unit : passage.getUnits()) {
            if (!unit.isRoot()) nodesRemaining.add(unit.getId());
        }
        edgesRemaining.addAll(passage.getEdges());
    }

    public boolean isComplete() {
        return edgesRemaining.isEmpty();
    }

    public boolean isRemaining(Node node) {
        return nodesRemaining.contains(node.getId());
    }

    public boolean isRemaining(Edge edge) {
        return edgesRemaining.contains(edge);
    }

    /** Remaining edges into the given node, in edge order. */
    public List<Edge> incoming(Node node) {
        return remaining(node.getIncoming());
    }

    /** Remaining edges out of the given node, in edge order. */
    public List<Edge> outgoing(Node node) {
        return remaining(node.getOutgoing());
    }

    private List<Edge> remaining(List<Edge> edges) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            if (edgesRemaining.contains(edge)) result.add(edge);
        }
        result.sort(Edge.ORDER);
        return result;
    }

    public void discharge(Edge edge) {
        if (!edgesRemaining.remove(edge)) {
            throw new IllegalStateException("Edge was already discharged: " + edge);
        }
    }

    public void discharge(Node node) {
        if (!nodesRemaining.remove(node.getId())) {
            throw new IllegalStateException("Node was already created: " + node);
        }
    }

    public SortedSet<String> getNodesRemaining() {
        return Collections.unmodifiableSortedSet(nodesRemaining);
    }

    public SortedSet<Edge> getEdgesRemaining() {
        return Collections.unmodifiableSortedSet(edgesRemaining);
    }

    public String describe(String sep) {
        return "nodes left: [" + StringUtils.join(nodesRemaining, " ") + "]" + sep
                + "edges left: [" + StringUtils.join(edgesRemaining, " ") + "]";
    }

    @Override
    public String toString() {
        return describe(" ");
    }
}
