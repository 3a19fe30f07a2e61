package edu.ucca.parser;

import edu.ucca.core.Edge;
import edu.ucca.core.Node;
import edu.ucca.core.Passage;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Produces the transitions that rebuild a gold passage exactly, to be used as training data for a
 * transition classifier.
 *
 * Each call looks at the top of the stack and, in order:
 * <ol>
 *     <li>finishes once every gold edge has been built;</li>
 *     <li>reduces the top if no gold edge is left around it;</li>
 *     <li>shifts if the front of the buffer is one of its remaining neighbours;</li>
 *     <li>builds an edge between the two top nodes (right before left), or swaps if all its
 *         neighbours are buried deeper in the stack;</li>
 *     <li>creates a missing parent (NODE) or an implicit child (IMPLICIT);</li>
 *     <li>otherwise shifts.</li>
 * </ol>
 * Among several candidate edges the first one in {@link Edge#ORDER} wins.
 *
 * One instance serves a single derivation of a single passage: its progress is consumed as actions
 * are emitted.
 */
public class GoldOracle extends Oracle {
    private final Passage passage;
    private final OracleConfig config;
    private final OracleProgress progress;

    public GoldOracle(Passage passage) {
        this(passage, OracleConfig.DEFAULT);
    }

    public GoldOracle(Passage passage, OracleConfig config) {
        this.passage = passage;
        this.config = config;
        this.progress = new OracleProgress(passage);
    }

    @Override
    public OracleResult nextAction(ParserState state) {
        if (progress.isComplete()) {
            return OracleResult.of(Action.FINISH);
        }

        StateNode top = state.stackTop();
        if (top != null) {
            Node node = top.getOrigNode();
            if (node == null) {
                throw new IllegalStateException("Stack node " + top + " has no gold counterpart");
            }
            List<Edge> incoming = progress.incoming(node);
            List<Edge> outgoing = progress.outgoing(node);
            if (incoming.isEmpty() && outgoing.isEmpty()) {
                return OracleResult.of(Action.REDUCE);
            }

            Set<String> related = new LinkedHashSet<>();
            for (Edge edge : outgoing) related.add(edge.getChild().getId());
            for (Edge edge : incoming) related.add(edge.getParent().getId());

            // Prefer bringing an immediate relative next to the top
            StateNode next = state.bufferHead();
            if (next != null && related.contains(next.getNodeId())) {
                return OracleResult.of(Action.SHIFT);
            }

            if (state.stackSize() > 1) {
                Action binary = binaryAction(state.stackSecond(), incoming, outgoing);
                if (binary != null) return OracleResult.of(binary);

                int distance = swapDistance(state, related);
                if (distance > 0) return OracleResult.of(Action.swap(distance));
            }

            Action unary = unaryAction(incoming, outgoing);
            if (unary != null) return OracleResult.of(unary);
        }

        if (state.bufferSize() == 0) {
            return OracleResult.failure(describeFailure(state, "No action is possible"));
        }
        return OracleResult.of(Action.SHIFT);
    }

    private Action binaryAction(StateNode second, List<Edge> incoming, List<Edge> outgoing) {
        String secondId = second.getNodeId();
        for (Edge edge : incoming) {
            if (edge.getParent().getId().equals(secondId)) {
                progress.discharge(edge);
                return Action.edge(false, edge.isRemote(), edge.getTag());
            }
        }
        for (Edge edge : outgoing) {
            if (edge.getChild().getId().equals(secondId)) {
                progress.discharge(edge);
                return Action.edge(true, edge.isRemote(), edge.getTag());
            }
        }
        return null;
    }

    /**
     * How many nodes below the top have to go back to the buffer before the top can meet its
     * relatives: 0 if they are not all deeper in the stack, at most 1 without compound swap.
     */
    int swapDistance(ParserState state, Set<String> related) {
        List<StateNode> stack = state.getStack();
        int distance = 0;
        while (stack.size() > distance + 1
                && (config.isCompoundSwap() || distance < 1)
                && idsBelow(stack, distance + 2).containsAll(related)) {
            distance++;
        }
        return distance;
    }

    /** IDs of the stack nodes below the top {@code depth} ones. */
    private static Set<String> idsBelow(List<StateNode> stack, int depth) {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < stack.size() - depth; i++) {
            ids.add(stack.get(i).getNodeId());
        }
        return ids;
    }

    private Action unaryAction(List<Edge> incoming, List<Edge> outgoing) {
        for (Edge edge : incoming) {
            if (!edge.isRemote() && progress.isRemaining(edge.getParent())) {
                progress.discharge(edge);
                progress.discharge(edge.getParent());
                return Action.node(edge.getTag(), edge.getParent());
            }
        }
        for (Edge edge : outgoing) {
            if (!edge.isRemote() && edge.getChild().isImplicit() && progress.isRemaining(edge.getChild())) {
                progress.discharge(edge);
                progress.discharge(edge.getChild());
                return Action.implicit(edge.getTag(), edge.getChild());
            }
        }
        return null;
    }

    @Override
    public OracleError describeFailure(ParserState state, String reason) {
        return new OracleError(reason, state, progress.getNodesRemaining(), progress.getEdgesRemaining());
    }

    public Passage getPassage() {
        return passage;
    }

    public OracleConfig getConfig() {
        return config;
    }

    public OracleProgress getProgress() {
        return progress;
    }

    @Override
    public String toString() {
        return progress.toString();
    }
}
