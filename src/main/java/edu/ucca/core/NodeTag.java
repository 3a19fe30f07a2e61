package edu.ucca.core;

/**
 * The kinds of nodes a passage holds. Terminals live in layer 0, everything else in layer 1.
 */
public enum NodeTag {
    WORD("Word", true),
    PUNCTUATION("Punctuation", true),
    FOUNDATIONAL("FN", false),
    PUNCTUATION_UNIT("PNCT", false),
    LINKAGE("LKG", false);

    private final String name;
    private final boolean terminal;

    NodeTag(String name, boolean terminal) {
        this.name = name;
        this.terminal = terminal;
    }

    public String getName() {
        return name;
    }

    public boolean isTerminal() {
        return terminal;
    }

    @Override
    public String toString() {
        return name;
    }
}
