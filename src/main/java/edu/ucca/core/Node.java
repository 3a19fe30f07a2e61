package edu.ucca.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A node of a passage: either a terminal (a token of the text, layer 0) or a unit (layer 1).
 * Nodes are created through {@link Passage}, which also wires up their edges.
 */
public class Node {

    /**
     * Orders node IDs ("layer.index") by layer, then by numeric index, so "1.10" comes after "1.9".
     */
    public static final Comparator<String> ID_ORDER = Node::compareIds;

    private final Passage passage;
    private final String id;
    private final NodeTag tag;
    private final boolean implicit;

    // Only meaningful for terminals
    private final String text;
    private final int position;
    private final int paragraph;
    private final int paragraphPosition;

    final List<Edge> incoming = new ArrayList<>();
    final List<Edge> outgoing = new ArrayList<>();

    Node(Passage passage, String id, NodeTag tag, boolean implicit) {
        this(passage, id, tag, implicit, null, -1, -1, -1);
    }

    Node(Passage passage, String id, NodeTag tag, boolean implicit,
         String text, int position, int paragraph, int paragraphPosition) {
        this.passage = passage;
        this.id = id;
        this.tag = tag;
        this.implicit = implicit;
        this.text = text;
        this.position = position;
        this.paragraph = paragraph;
        this.paragraphPosition = paragraphPosition;
    }

    public Passage getPassage() {
        return passage;
    }

    public String getId() {
        return id;
    }

    public NodeTag getTag() {
        return tag;
    }

    public boolean isImplicit() {
        return implicit;
    }

    public boolean isTerminal() {
        return tag.isTerminal();
    }

    public boolean isPunctuation() {
        return tag == NodeTag.PUNCTUATION;
    }

    public boolean isRoot() {
        return passage.getRoot() == this;
    }

    public String getText() {
        return text;
    }

    /** 1-based position of a terminal in the passage, -1 for units. */
    public int getPosition() {
        return position;
    }

    public int getParagraph() {
        return paragraph;
    }

    /** 1-based position of a terminal inside its paragraph. */
    public int getParagraphPosition() {
        return paragraphPosition;
    }

    public List<Edge> getIncoming() {
        return Collections.unmodifiableList(incoming);
    }

    public List<Edge> getOutgoing() {
        return Collections.unmodifiableList(outgoing);
    }

    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>();
        for (Edge edge : outgoing) children.add(edge.getChild());
        return children;
    }

    public List<Node> getParents() {
        List<Node> parents = new ArrayList<>();
        for (Edge edge : incoming) parents.add(edge.getParent());
        return parents;
    }

    public static int compareIds(String a, String b) {
        int aDot = a.indexOf('.');
        int bDot = b.indexOf('.');
        if (aDot < 0 || bDot < 0) return a.compareTo(b);
        int cmp = Integer.compare(Integer.parseInt(a.substring(0, aDot)), Integer.parseInt(b.substring(0, bDot)));
        if (cmp != 0) return cmp;
        return Integer.compare(Integer.parseInt(a.substring(aDot + 1)), Integer.parseInt(b.substring(bDot + 1)));
    }

    @Override
    public String toString() {
        if (isTerminal()) return id + "(" + text + ")";
        return implicit ? id + "(IMPLICIT)" : id;
    }
}
