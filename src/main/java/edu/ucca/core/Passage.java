package edu.ucca.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An annotated passage: the terminals of the text (layer 0), the units built over them
 * (layer 1, rooted at {@link #ROOT_ID}) and the labeled edges between them.
 *
 * Passages are built incrementally and are treated as read-only once handed to the oracle.
 */
public class Passage {
    public static final String TERMINAL_LAYER = "0";
    public static final String UNIT_LAYER = "1";
    public static final String ROOT_ID = UNIT_LAYER + ".1";

    private final String id;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Node> terminals = new ArrayList<>();
    private final List<Node> units = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Node root;

    public Passage(String id) {
        this.id = id;
        this.root = register(new Node(this, ROOT_ID, NodeTag.FOUNDATIONAL, false), units);
    }

    private Node register(Node node, List<Node> layer) {
        nodes.put(node.getId(), node);
        layer.add(node);
        return node;
    }

    public String getId() {
        return id;
    }

    /**
     * Appends a terminal at the end of the text. Paragraphs are numbered from 1 and may only grow.
     */
    public Node addTerminal(String text, boolean punct, int paragraph) {
        int paragraphPosition = 1;
        if (!terminals.isEmpty()) {
            Node last = terminals.get(terminals.size() - 1);
            if (paragraph < last.getParagraph()) {
                throw new IllegalArgumentException("Paragraph " + paragraph + " comes after paragraph " + last.getParagraph());
            }
            if (paragraph == last.getParagraph()) paragraphPosition = last.getParagraphPosition() + 1;
        }
        int position = terminals.size() + 1;
        return register(new Node(this, TERMINAL_LAYER + "." + position,
                punct ? NodeTag.PUNCTUATION : NodeTag.WORD, false,
                text, position, paragraph, paragraphPosition), terminals);
    }

    public Node addUnit(NodeTag tag) {
        return addUnit(tag, false);
    }

    public Node addImplicitUnit() {
        return addUnit(NodeTag.FOUNDATIONAL, true);
    }

    public Node addUnit(NodeTag tag, boolean implicit) {
        if (tag.isTerminal()) {
            throw new IllegalArgumentException("Terminals are added with addTerminal, got " + tag);
        }
        return register(new Node(this, UNIT_LAYER + "." + (units.size() + 1), tag, implicit), units);
    }

    public Edge addEdge(Node parent, Node child, EdgeTag tag) {
        return addEdge(parent, child, tag, false);
    }

    public Edge addEdge(Node parent, Node child, EdgeTag tag, boolean remote) {
        if (parent.getPassage() != this || child.getPassage() != this) {
            throw new IllegalArgumentException("Can't link nodes of another passage: " + parent + " -> " + child);
        }
        if (parent == child) {
            throw new IllegalArgumentException("Can't link a node to itself: " + parent);
        }
        if (parent.isTerminal()) {
            throw new IllegalArgumentException("Terminals can't have children: " + parent);
        }
        if (child == root) {
            throw new IllegalArgumentException("The root can't have parents");
        }
        for (Edge existing : parent.outgoing) {
            if (existing.getChild() == child) {
                throw new IllegalArgumentException("Can't add an edge between the same two nodes twice: " + existing);
            }
        }
        Edge edge = new Edge(parent, child, tag, remote, edges.size());
        parent.outgoing.add(edge);
        child.incoming.add(edge);
        edges.add(edge);
        return edge;
    }

    public Node getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    public Node getRoot() {
        return root;
    }

    public List<Node> getTerminals() {
        return Collections.unmodifiableList(terminals);
    }

    /** Layer 1 nodes, root first. */
    public List<Node> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public List<Node> getNonRootNodes() {
        List<Node> result = new ArrayList<>(nodes.size() - 1);
        for (Node node : nodes.values()) {
            if (node != root) result.add(node);
        }
        return result;
    }

    /** Every edge of the passage, in creation order. */
    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    /** True if any unit has children, i.e. the passage carries more than bare text. */
    public boolean isLabeled() {
        for (Node unit : units) {
            if (!unit.outgoing.isEmpty()) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Passage ").append(id).append(":");
        for (Node terminal : terminals) sb.append(" ").append(terminal.getText());
        for (Edge edge : edges) sb.append("\n\t").append(edge);
        return sb.toString();
    }
}
