package edu.ucca.core;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class PassageTest {

    @Test
    public void testIds() {
        Passage passage = Passages.fromText("ids", "A B , C");
        assertEquals("1.1", passage.getRoot().getId());
        assertTrue(passage.getRoot().isRoot());
        assertEquals(4, passage.getTerminals().size());
        assertEquals("0.3", passage.getTerminals().get(2).getId());
        assertTrue(passage.getNode("0.3").isPunctuation());
        assertFalse(passage.getNode("0.4").isPunctuation());

        Node unit = passage.addUnit(NodeTag.FOUNDATIONAL);
        Node elided = passage.addImplicitUnit();
        assertEquals("1.2", unit.getId());
        assertEquals("1.3", elided.getId());
        assertTrue(elided.isImplicit());
        assertSame(unit, passage.getNode("1.2"));
        assertEquals(Arrays.asList(passage.getRoot(), unit, elided), passage.getUnits());
        assertEquals(6, passage.getNonRootNodes().size());
    }

    @Test
    public void testParagraphPositions() {
        Passage passage = Passages.fromText("paragraphs", "A B", "C");
        Node c = passage.getNode("0.3");
        assertEquals(3, c.getPosition());
        assertEquals(2, c.getParagraph());
        assertEquals(1, c.getParagraphPosition());
        assertEquals(2, passage.getNode("0.2").getParagraphPosition());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParagraphsOnlyGrow() {
        Passage passage = Passages.fromText("paragraphs", "A", "B");
        passage.addTerminal("C", false, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnitsAreNotTerminals() {
        new Passage("units").addUnit(NodeTag.WORD);
    }

    @Test
    public void testEdgeValidation() {
        Passage passage = Passages.fromText("edges", "A B");
        Node a = passage.getNode("0.1");
        Node b = passage.getNode("0.2");
        Node unit = passage.addUnit(NodeTag.FOUNDATIONAL);
        passage.addEdge(unit, a, EdgeTag.CENTER);

        assertRejected(passage, unit, unit);
        assertRejected(passage, a, b);
        assertRejected(passage, unit, passage.getRoot());
        assertRejected(passage, unit, a);
        assertRejected(passage, unit, Passages.fromText("other", "A").getNode("0.1"));
        assertEquals(1, passage.getEdges().size());
    }

    private static void assertRejected(Passage passage, Node parent, Node child) {
        try {
            passage.addEdge(parent, child, EdgeTag.ELABORATOR);
            fail("Expected " + parent + " -> " + child + " to be rejected");
        }
        catch (IllegalArgumentException ignored) {
        }
    }

    @Test
    public void testEdgesWireUpBothEnds() {
        Passage passage = TestPassages.remote();
        Node p = passage.getNode("1.2");
        Node q = passage.getNode("1.3");
        Edge remote = passage.getEdges().get(4);

        assertTrue(remote.isRemote());
        assertEquals(4, remote.getIndex());
        assertEquals("1.3-A*->1.2", remote.toString());
        assertEquals(Arrays.asList(passage.getRoot(), q), p.getParents());
        assertEquals(Arrays.asList(passage.getNode("0.2"), p), q.getChildren());
        assertTrue(passage.isLabeled());
        assertFalse(Passages.fromText("bare", "A").isLabeled());
    }

    @Test
    public void testIdOrder() {
        List<String> ids = new ArrayList<>(Arrays.asList("1.10", "0.2", "1.9", "1.1", "0.10"));
        ids.sort(Node.ID_ORDER);
        assertEquals(Arrays.asList("0.2", "0.10", "1.1", "1.9", "1.10"), ids);
    }

    @Test
    public void testEdgeOrder() {
        Passage passage = TestPassages.projective();
        List<Edge> edges = new ArrayList<>(passage.getEdges());
        edges.sort(Edge.ORDER);
        List<String> names = new ArrayList<>();
        for (Edge edge : edges) names.add(edge.toString());
        assertEquals(Arrays.asList("1.2-A->0.3", "1.1-H->1.2", "1.1-L->0.1", "1.2-P->0.2"), names);
    }

    @Test
    public void testEdgeTagAbbreviations() {
        assertEquals(EdgeTag.LINK_ARGUMENT, EdgeTag.fromAbbreviation("LA"));
        assertEquals(EdgeTag.PARALLEL_SCENE, EdgeTag.fromAbbreviation("H"));
        assertEquals("Terminal", EdgeTag.TERMINAL.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdgeTag() {
        EdgeTag.fromAbbreviation("X");
    }
}
