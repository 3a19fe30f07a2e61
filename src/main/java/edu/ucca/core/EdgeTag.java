package edu.ucca.core;

import java.util.HashMap;
import java.util.Map;

/**
 * The closed vocabulary of semantic categories an edge can carry.
 */
public enum EdgeTag {
    PROCESS("P"),
    STATE("S"),
    PARTICIPANT("A"),
    CENTER("C"),
    ADVERBIAL("D"),
    ELABORATOR("E"),
    CONNECTOR("N"),
    RELATOR("R"),
    PARALLEL_SCENE("H"),
    LINKER("L"),
    GROUND("G"),
    FUNCTION("F"),
    TIME("T"),
    PUNCTUATION("U"),
    LINK_RELATION("LR"),
    LINK_ARGUMENT("LA"),
    TERMINAL("Terminal");

    private static final Map<String, EdgeTag> byAbbreviation = new HashMap<>();
    static {
        for (EdgeTag tag : values()) {
            byAbbreviation.put(tag.abbreviation, tag);
        }
    }

    private final String abbreviation;

    EdgeTag(String abbreviation) {
        this.abbreviation = abbreviation;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    public static EdgeTag fromAbbreviation(String abbreviation) {
        EdgeTag tag = byAbbreviation.get(abbreviation);
        if (tag == null) {
            throw new IllegalArgumentException("Unknown edge tag: " + abbreviation);
        }
        return tag;
    }

    @Override
    public String toString() {
        return abbreviation;
    }
}
