package edu.ucca.parser;

import edu.ucca.core.Edge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Why an oracle could not go on, with a snapshot of the parser state and of the gold structure it
 * still had to build, so the offending passage can be found and inspected.
 */
public class OracleError {
    private final String passageId;
    private final String reason;
    private final String stateDescription;
    private final List<String> nodesRemaining;
    private final List<String> edgesRemaining;

    public OracleError(String reason, ParserState state, Collection<String> nodesRemaining, Collection<Edge> edgesRemaining) {
        this.passageId = state.getPassage().getId();
        this.reason = reason;
        this.stateDescription = state.describe("\n");
        this.nodesRemaining = new ArrayList<>(nodesRemaining);
        this.edgesRemaining = new ArrayList<>();
        for (Edge edge : edgesRemaining) this.edgesRemaining.add(edge.toString());
    }

    public String getPassageId() {
        return passageId;
    }

    public String getReason() {
        return reason;
    }

    public String getStateDescription() {
        return stateDescription;
    }

    public List<String> getNodesRemaining() {
        return Collections.unmodifiableList(nodesRemaining);
    }

    public List<String> getEdgesRemaining() {
        return Collections.unmodifiableList(edgesRemaining);
    }

    @Override
    public String toString() {
        return reason + " (passage " + passageId + ")\n" + stateDescription
                + "\nnodes left: " + nodesRemaining + "\nedges left: " + edgesRemaining;
    }
}
