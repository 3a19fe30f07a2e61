package edu.ucca.parser;

import edu.stanford.nlp.util.StringUtils;
import edu.ucca.core.Node;
import edu.ucca.core.Passage;

import java.util.*;

/**
 * Holds the state of a transition-based parse: a stack of nodes being attached, a buffer of nodes
 * still to be processed (the terminals at first) and the graph built so far.
 *
 * The state starts with the root on the stack and every terminal in the buffer, in text order.
 * Nodes created by NODE and IMPLICIT go to the front of the buffer, so the next SHIFT puts them on
 * top of the stack.
 */
public class ParserState {
    private final Passage passage;
    private final List<StateNode> nodes = new ArrayList<>();
    private final List<StateEdge> edges = new ArrayList<>();
    private final List<StateNode> stack = new ArrayList<>();
    private final Deque<StateNode> buffer = new ArrayDeque<>();
    private final StateNode root;
    private boolean finished = false;

    public ParserState(Passage passage) {
        this.passage = passage;
        this.root = addNode(passage.getRoot(), false);
        stack.add(root);
        for (Node terminal : passage.getTerminals()) {
            buffer.add(addNode(terminal, false));
        }
    }

    private StateNode addNode(Node origNode, boolean implicit) {
        StateNode node = new StateNode(nodes.size(), origNode, implicit);
        nodes.add(node);
        return node;
    }

    private void addEdge(StateNode parent, StateNode child, Action action) {
        StateEdge edge = new StateEdge(parent, child, action.getTag(), action.getType().isRemote());
        parent.outgoing.add(edge);
        child.incoming.add(edge);
        edges.add(edge);
    }

    /**
     * Applies an action. Throws an IllegalStateException if its precondition doesn't hold.
     */
    public void transition(Action action) {
        if (finished) {
            throw new IllegalStateException("Can't apply " + action + " to a finished state");
        }
        switch (action.getType()) {
            case SHIFT:
                require(!buffer.isEmpty(), action, "the buffer is empty");
                stack.add(buffer.removeFirst());
                break;
            case NODE: {
                require(!stack.isEmpty(), action, "the stack is empty");
                StateNode parent = addNode(action.getOrigNode(),
                        action.getOrigNode() != null && action.getOrigNode().isImplicit());
                addEdge(parent, stackTop(), action);
                buffer.addFirst(parent);
                break;
            }
            case IMPLICIT: {
                require(!stack.isEmpty(), action, "the stack is empty");
                StateNode child = addNode(action.getOrigNode(), true);
                addEdge(stackTop(), child, action);
                buffer.addFirst(child);
                break;
            }
            case REDUCE:
                require(!stack.isEmpty(), action, "the stack is empty");
                stack.remove(stack.size() - 1);
                break;
            case LEFT_EDGE:
            case LEFT_REMOTE:
                require(stack.size() > 1, action, "the stack has fewer than two nodes");
                addEdge(stackTop(), stackSecond(), action);
                break;
            case RIGHT_EDGE:
            case RIGHT_REMOTE:
                require(stack.size() > 1, action, "the stack has fewer than two nodes");
                addEdge(stackSecond(), stackTop(), action);
                break;
            case SWAP: {
                int distance = action.getDistance();
                require(stack.size() > distance, action, "the stack has only " + stack.size() + " nodes");
                // The nodes right below the top go back to the buffer, keeping their order
                List<StateNode> swapped = stack.subList(stack.size() - distance - 1, stack.size() - 1);
                for (int i = swapped.size() - 1; i >= 0; i--) {
                    buffer.addFirst(swapped.get(i));
                }
                swapped.clear();
                break;
            }
            case FINISH:
                finished = true;
                break;
            default:
                throw new IllegalStateException("Unknown action type " + action.getType());
        }
    }

    private void require(boolean condition, Action action, String reason) {
        if (!condition) {
            throw new IllegalStateException("Can't apply " + action + ": " + reason);
        }
    }

    public Passage getPassage() {
        return passage;
    }

    public boolean isFinished() {
        return finished;
    }

    public StateNode getRoot() {
        return root;
    }

    /** The stack, bottom first. */
    public List<StateNode> getStack() {
        return Collections.unmodifiableList(stack);
    }

    /** A copy of the buffer, front first. */
    public List<StateNode> getBuffer() {
        return new ArrayList<>(buffer);
    }

    public int stackSize() {
        return stack.size();
    }

    public int bufferSize() {
        return buffer.size();
    }

    /** Top of the stack, or null if the stack is empty. */
    public StateNode stackTop() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    /** The node right below the top of the stack, or null if there is none. */
    public StateNode stackSecond() {
        return stack.size() < 2 ? null : stack.get(stack.size() - 2);
    }

    /** Front of the buffer, or null if the buffer is empty. */
    public StateNode bufferHead() {
        return buffer.peekFirst();
    }

    /** Every node created so far, in creation order (root and terminals first). */
    public List<StateNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<StateEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public String describe(String sep) {
        return "stack: [" + StringUtils.join(stack, " ") + "]" + sep + "buffer: [" + StringUtils.join(buffer, " ") + "]";
    }

    @Override
    public String toString() {
        return describe(" ");
    }
}
