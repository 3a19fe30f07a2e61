package edu.ucca.core;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class PassagesTest {

    @Test
    public void testFromText() {
        Passage passage = Passages.fromText("text", "  Hello ,  world !", "Bye");
        assertEquals("text", passage.getId());
        assertEquals(5, passage.getTerminals().size());
        assertEquals("world", passage.getNode("0.3").getText());
        assertEquals(NodeTag.PUNCTUATION, passage.getNode("0.2").getTag());
        assertEquals(NodeTag.WORD, passage.getNode("0.3").getTag());
        assertEquals(2, passage.getNode("0.5").getParagraph());
        assertFalse(passage.isLabeled());
    }

    @Test
    public void testToText() {
        Passage passage = Passages.fromText("text", "A B . C", "D");
        assertEquals(Collections.singletonList("A B . C D"), Passages.toText(passage, false));
        assertEquals(Arrays.asList("A B .", "C", "D"), Passages.toText(passage, true));
    }

    @Test
    public void testPrimaryYieldSkipsRemoteEdges() {
        Passage passage = TestPassages.remote();
        Node q = passage.getNode("1.3");
        assertEquals(Collections.singletonList(passage.getNode("0.2")), Passages.primaryYield(q));
        assertEquals(Arrays.asList(passage.getNode("0.1"), passage.getNode("0.2")),
                Passages.primaryYield(passage.getRoot()));
        assertSame(passage.getRoot(), Passages.primaryParent(passage.getNode("1.2")));
        assertNull(Passages.primaryParent(passage.getRoot()));
    }

    @Test
    public void testEdgeSignatures() {
        assertEquals(Arrays.asList(
                "FN[2,3] -A-> 0.3",
                "FN[2,3] -P-> 0.2",
                "ROOT -H-> FN[2,3]",
                "ROOT -L-> 0.1"), Passages.edgeSignatures(TestPassages.projective()));
        assertTrue(Passages.edgeSignatures(TestPassages.implicit()).contains("FN[1] -A-> IMPLICIT(FN[1])"));
        assertTrue(Passages.edgeSignatures(TestPassages.remote()).contains("FN[2] -A*-> FN[1]"));
    }

    @Test
    public void testEdgeSignaturesIgnoreUnitIds() {
        // Same graph as the double crossing fixture, with the units created the other way round
        Passage passage = Passages.fromText("double-crossing", "A B C D E");
        Node q = passage.addUnit(NodeTag.FOUNDATIONAL);
        Node p = passage.addUnit(NodeTag.FOUNDATIONAL);
        passage.addEdge(q, passage.getNode("0.5"), EdgeTag.STATE);
        passage.addEdge(q, passage.getNode("0.2"), EdgeTag.PARTICIPANT);
        passage.addEdge(p, passage.getNode("0.4"), EdgeTag.PROCESS);
        passage.addEdge(p, passage.getNode("0.1"), EdgeTag.PARTICIPANT);
        passage.addEdge(passage.getRoot(), passage.getNode("0.3"), EdgeTag.LINKER);
        passage.addEdge(passage.getRoot(), q, EdgeTag.PARALLEL_SCENE);
        passage.addEdge(passage.getRoot(), p, EdgeTag.PARALLEL_SCENE);

        assertEquals(Passages.edgeSignatures(TestPassages.doubleCrossing()), Passages.edgeSignatures(passage));
        assertNotEquals(Passages.edgeSignatures(TestPassages.crossing()),
                Passages.edgeSignatures(TestPassages.projective()));
    }

    /**
     * "A B": X over Y over A, Z over B, and Z is a remote parent of either Y or X.
     */
    private static Passage unaryChain(boolean remoteToInner) {
        Passage passage = Passages.fromText("chain", "A B");
        Node x = passage.addUnit(NodeTag.FOUNDATIONAL);
        Node y = passage.addUnit(NodeTag.FOUNDATIONAL);
        Node z = passage.addUnit(NodeTag.FOUNDATIONAL);
        passage.addEdge(passage.getRoot(), x, EdgeTag.PARALLEL_SCENE);
        passage.addEdge(x, y, EdgeTag.CENTER);
        passage.addEdge(y, passage.getNode("0.1"), EdgeTag.PROCESS);
        passage.addEdge(passage.getRoot(), z, EdgeTag.PARALLEL_SCENE);
        passage.addEdge(z, passage.getNode("0.2"), EdgeTag.PROCESS);
        passage.addEdge(z, remoteToInner ? y : x, EdgeTag.PARTICIPANT, true);
        return passage;
    }

    @Test
    public void testEdgeSignaturesTellUnaryChainsApart() {
        List<String> inner = Passages.edgeSignatures(unaryChain(true));
        assertTrue(inner.contains("FN[1] -C-> FN[1]<FN[1]"));
        assertTrue(inner.contains("FN[1]<FN[1] -P-> 0.1"));
        assertTrue(inner.contains("FN[2] -A*-> FN[1]<FN[1]"));
        assertNotEquals(inner, Passages.edgeSignatures(unaryChain(false)));
    }
}
