package edu.ucca.parser;

import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import edu.ucca.core.EdgeTag;
import edu.ucca.core.Node;
import edu.ucca.core.NodeTag;
import edu.ucca.core.Passage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Random passages with units nested under each other, terminals scattered over the units (so
 * many units are discontinuous), a few implicit children and a few remote edges between units.
 * Every unit covers at least one terminal.
 */
public class NestedPassageGen extends Generator<Passage> {
    private static final EdgeTag[] TAGS = {
            EdgeTag.PROCESS, EdgeTag.STATE, EdgeTag.PARTICIPANT, EdgeTag.CENTER, EdgeTag.ADVERBIAL,
            EdgeTag.ELABORATOR, EdgeTag.PARALLEL_SCENE, EdgeTag.LINKER, EdgeTag.FUNCTION
    };

    public NestedPassageGen() {
        super(Passage.class);
    }

    @Override
    public Passage generate(SourceOfRandomness random, GenerationStatus status) {
        Passage passage = new Passage("nested-" + random.nextInt(0, 99999));
        int numUnits = random.nextInt(1, 5);
        int numTerminals = numUnits + random.nextInt(0, 4);
        for (int i = 0; i < numTerminals; i++) {
            passage.addTerminal("w" + i, false, 1);
        }

        // Each unit hangs off the root or an earlier unit
        List<Node> owners = new ArrayList<>();
        owners.add(passage.getRoot());
        List<Node> units = new ArrayList<>();
        for (int i = 0; i < numUnits; i++) {
            Node unit = passage.addUnit(NodeTag.FOUNDATIONAL);
            passage.addEdge(owners.get(random.nextInt(0, owners.size() - 1)), unit, random.choose(TAGS));
            owners.add(unit);
            units.add(unit);
        }

        // One distinct terminal per unit, the rest to any owner
        List<Node> terminals = new ArrayList<>(passage.getTerminals());
        Collections.shuffle(terminals, random.toJDKRandom());
        for (int i = 0; i < terminals.size(); i++) {
            Node owner = i < units.size() ? units.get(i) : owners.get(random.nextInt(0, owners.size() - 1));
            passage.addEdge(owner, terminals.get(i), random.choose(TAGS));
        }

        if (random.nextDouble() < 0.3) {
            passage.addEdge(random.choose(units), passage.addImplicitUnit(), EdgeTag.PARTICIPANT);
        }

        int numRemotes = units.size() < 2 ? 0 : random.nextInt(0, 2);
        for (int i = 0; i < numRemotes; i++) {
            Node parent = random.choose(units);
            Node child = random.choose(units);
            if (parent != child && !linked(parent, child)) {
                passage.addEdge(parent, child, random.choose(TAGS), true);
            }
        }
        return passage;
    }

    private static boolean linked(Node a, Node b) {
        return a.getChildren().contains(b) || b.getChildren().contains(a);
    }
}
