package edu.ucca.core;

import edu.stanford.nlp.ling.CoreLabel;
import edu.stanford.nlp.process.WordToSentenceProcessor;

import java.util.*;

/**
 * Finds sentence and paragraph boundaries of a passage. Boundaries are reported as the position
 * of the closing terminal, which is also the index (into the terminal list) where the next
 * sentence starts.
 */
public class SentenceBreaker {
    public static final Set<String> SENTENCE_END_MARKS = new HashSet<>(Arrays.asList(".", "?", "!"));

    private SentenceBreaker() {
    }

    public static List<Integer> breakToParagraphs(Passage passage) {
        List<Node> terminals = passage.getTerminals();
        List<Integer> ends = new ArrayList<>();
        if (terminals.isEmpty()) return ends;
        for (Node terminal : terminals) {
            if (terminal.getPosition() > 1 && terminal.getParagraphPosition() == 1) {
                ends.add(terminal.getPosition() - 1);
            }
        }
        ends.add(terminals.get(terminals.size() - 1).getPosition());
        return ends;
    }

    /**
     * A sentence ends at an end mark which closes a top-level scene (or hangs right after one
     * without opening another), and at every paragraph end. Sentences made only of punctuation are
     * merged into the sentence before them. Unlabeled passages are split by CoreNLP's sentence
     * splitter.
     */
    public static List<Integer> breakToSentences(Passage passage) {
        List<Node> terminals = passage.getTerminals();
        if (terminals.isEmpty()) return new ArrayList<>();

        List<Integer> marks;
        if (passage.isLabeled()) {
            marks = new ArrayList<>();
            for (Node terminal : terminals) {
                if (SENTENCE_END_MARKS.contains(terminal.getText())) marks.add(terminal.getPosition());
            }
            Set<Integer> sceneEnds = new HashSet<>();
            Set<Integer> sceneStarts = new HashSet<>();
            for (Node scene : topScenes(passage)) {
                List<Node> yield = Passages.primaryYield(scene);
                if (yield.isEmpty()) continue;
                sceneStarts.add(yield.get(0).getPosition());
                sceneEnds.add(yield.get(yield.size() - 1).getPosition());
            }
            List<Integer> filtered = new ArrayList<>();
            for (int mark : marks) {
                if (sceneEnds.contains(mark) || (sceneEnds.contains(mark - 1) && !sceneStarts.contains(mark))) {
                    filtered.add(mark);
                }
            }
            marks = filtered;
        }
        else {
            marks = splitSentences(terminals);
        }

        TreeSet<Integer> sorted = new TreeSet<>(marks);
        sorted.addAll(breakToParagraphs(passage));
        List<Integer> ends = new ArrayList<>(sorted);

        // Avoid punctuation-only sentences
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < ends.size() - 1; i++) {
            boolean allPunct = true;
            for (Node terminal : terminals.subList(ends.get(i), ends.get(i + 1))) {
                if (!terminal.isPunctuation()) {
                    allPunct = false;
                    break;
                }
            }
            if (!allPunct) result.add(ends.get(i));
        }
        result.add(ends.get(ends.size() - 1));
        return result;
    }

    /**
     * Positions of the last terminal of each sentence found by {@link WordToSentenceProcessor}, so
     * closing quotes and brackets stay with the sentence they close.
     */
    static List<Integer> splitSentences(List<Node> terminals) {
        List<CoreLabel> tokens = new ArrayList<>(terminals.size());
        for (Node terminal : terminals) {
            CoreLabel token = new CoreLabel();
            token.setWord(terminal.getText());
            token.setValue(terminal.getText());
            token.setOriginalText(terminal.getText());
            token.setIndex(terminal.getPosition());
            tokens.add(token);
        }
        List<Integer> ends = new ArrayList<>();
        for (List<CoreLabel> sentence : new WordToSentenceProcessor<CoreLabel>().process(tokens)) {
            if (!sentence.isEmpty()) ends.add(sentence.get(sentence.size() - 1).index());
        }
        return ends;
    }

    /**
     * Scenes directly under the root: a primary child of the root that has a process or state is a
     * scene; otherwise we look through its parallel-scene children.
     */
    public static List<Node> topScenes(Passage passage) {
        List<Node> scenes = new ArrayList<>();
        Deque<Node> agenda = new ArrayDeque<>();
        for (Edge edge : passage.getRoot().getOutgoing()) {
            if (!edge.isRemote()) agenda.add(edge.getChild());
        }
        Set<Node> visited = new HashSet<>();
        while (!agenda.isEmpty()) {
            Node unit = agenda.poll();
            if (unit.isTerminal() || unit.getTag() != NodeTag.FOUNDATIONAL || !visited.add(unit)) continue;
            if (isScene(unit)) {
                scenes.add(unit);
                continue;
            }
            for (Edge edge : unit.getOutgoing()) {
                if (!edge.isRemote() && edge.getTag() == EdgeTag.PARALLEL_SCENE) agenda.add(edge.getChild());
            }
        }
        return scenes;
    }

    public static boolean isScene(Node unit) {
        for (Edge edge : unit.getOutgoing()) {
            if (!edge.isRemote() && (edge.getTag() == EdgeTag.PROCESS || edge.getTag() == EdgeTag.STATE)) return true;
        }
        return false;
    }
}
