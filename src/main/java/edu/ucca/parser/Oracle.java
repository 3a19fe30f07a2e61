package edu.ucca.parser;

import java.util.Collections;

/**
 * Anything that picks the next transition for a parser state.
 */
public abstract class Oracle {

    public abstract OracleResult nextAction(ParserState state);

    /**
     * Builds the error reported when a derivation driven by this oracle has to stop.
     */
    public OracleError describeFailure(ParserState state, String reason) {
        return new OracleError(reason, state, Collections.emptyList(), Collections.emptyList());
    }
}
