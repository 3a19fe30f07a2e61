package edu.ucca.core;

import edu.stanford.nlp.util.StringUtils;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Static helpers for building passages from text, rendering them back to text, and comparing the
 * structure of two passages regardless of how their units are numbered.
 */
public class Passages {
    private static final Pattern PUNCT = Pattern.compile("^\\p{Punct}+$");

    private Passages() {
    }

    /**
     * Builds an unlabeled passage from tokenized text: one string per paragraph, tokens separated
     * by whitespace.
     */
    public static Passage fromText(String passageId, List<String> paragraphs) {
        Passage passage = new Passage(passageId);
        for (int i = 0; i < paragraphs.size(); i++) {
            for (String token : paragraphs.get(i).trim().split("\\s+")) {
                if (token.isEmpty()) continue;
                passage.addTerminal(token, PUNCT.matcher(token).matches(), i + 1);
            }
        }
        return passage;
    }

    public static Passage fromText(String passageId, String... paragraphs) {
        return fromText(passageId, Arrays.asList(paragraphs));
    }

    /**
     * Renders the passage tokens, either one string per sentence or everything in a single string.
     */
    public static List<String> toText(Passage passage, boolean sentences) {
        List<String> tokens = new ArrayList<>();
        for (Node terminal : passage.getTerminals()) tokens.add(terminal.getText());
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        if (sentences) {
            starts.addAll(SentenceBreaker.breakToSentences(passage));
        }
        else {
            starts.add(tokens.size());
        }
        List<String> text = new ArrayList<>();
        for (int i = 0; i < starts.size() - 1; i++) {
            text.add(StringUtils.join(tokens.subList(starts.get(i), starts.get(i + 1)), " "));
        }
        return text;
    }

    /**
     * The terminals a node covers through primary edges, sorted by position.
     */
    public static List<Node> primaryYield(Node node) {
        List<Node> yield = new ArrayList<>();
        Set<Node> visited = new HashSet<>();
        Deque<Node> agenda = new ArrayDeque<>();
        agenda.push(node);
        while (!agenda.isEmpty()) {
            Node current = agenda.pop();
            if (!visited.add(current)) continue;
            if (current.isTerminal()) {
                yield.add(current);
                continue;
            }
            for (Edge edge : current.getOutgoing()) {
                if (!edge.isRemote()) agenda.push(edge.getChild());
            }
        }
        yield.sort(Comparator.comparingInt(Node::getPosition));
        return yield;
    }

    public static Node primaryParent(Node node) {
        for (Edge edge : node.getIncoming()) {
            if (!edge.isRemote()) return edge.getParent();
        }
        return null;
    }

    /**
     * Describes every edge by what its endpoints cover rather than by their IDs, so that two
     * passages with the same structure give the same (sorted) list even if their units were
     * created in a different order. A unit below another unit is keyed by its tag and yield
     * followed by its primary parent's key, e.g. {@code FN[1]<FN[1,2]}.
     */
    public static List<String> edgeSignatures(Passage passage) {
        Map<Node, String> keys = new HashMap<>();
        List<String> signatures = new ArrayList<>();
        for (Edge edge : passage.getEdges()) {
            signatures.add(key(edge.getParent(), keys) + " -" + edge.getTag() + (edge.isRemote() ? "*" : "") + "-> "
                    + key(edge.getChild(), keys));
        }
        Collections.sort(signatures);
        return signatures;
    }

    private static String key(Node node, Map<Node, String> keys) {
        String key = keys.get(node);
        if (key != null) return key;
        if (node.isRoot()) {
            key = "ROOT";
        }
        else if (node.isTerminal()) {
            key = node.getId();
        }
        else if (node.isImplicit()) {
            Node parent = primaryParent(node);
            keys.put(node, "IMPLICIT(?)");  // guards against cycles through implicit nodes
            key = "IMPLICIT(" + (parent == null ? "?" : key(parent, keys)) + ")";
        }
        else {
            List<String> positions = new ArrayList<>();
            for (Node terminal : primaryYield(node)) positions.add(Integer.toString(terminal.getPosition()));
            key = node.getTag().getName() + "[" + StringUtils.join(positions, ",") + "]";
            // Units of a unary chain cover the same terminals, so they are told apart by their parent
            Node parent = primaryParent(node);
            if (parent != null && !parent.isRoot()) {
                keys.put(node, key + "<?");
                key = key + "<" + key(parent, keys);
            }
        }
        keys.put(node, key);
        return key;
    }
}
