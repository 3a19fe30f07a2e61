package edu.ucca.parser;

import edu.ucca.core.Node;
import edu.ucca.core.NodeTag;
import edu.ucca.core.Passage;

import java.util.HashMap;
import java.util.Map;

/**
 * Turns the graph built in a parser state into a fresh passage. Units get new IDs in the order the
 * parser created them, so they need not match the gold IDs.
 */
public class PassageGenerator {

    private PassageGenerator() {
    }

    public static Passage generatePassage(ParserState state) {
        Passage source = state.getPassage();
        Passage passage = new Passage(source.getId());
        Map<StateNode, Node> newNodes = new HashMap<>();
        newNodes.put(state.getRoot(), passage.getRoot());

        for (StateNode node : state.getNodes()) {
            if (node.isTerminal()) {
                Node orig = node.getOrigNode();
                newNodes.put(node, passage.addTerminal(orig.getText(), orig.isPunctuation(), orig.getParagraph()));
            }
        }
        for (StateNode node : state.getNodes()) {
            if (node == state.getRoot() || node.isTerminal()) continue;
            NodeTag tag = node.getOrigNode() == null ? NodeTag.FOUNDATIONAL : node.getOrigNode().getTag();
            newNodes.put(node, passage.addUnit(tag, node.isImplicit()));
        }
        for (StateEdge edge : state.getEdges()) {
            passage.addEdge(newNodes.get(edge.getParent()), newNodes.get(edge.getChild()), edge.getTag(), edge.isRemote());
        }
        return passage;
    }
}
