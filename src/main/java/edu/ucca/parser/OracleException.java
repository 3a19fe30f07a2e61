package edu.ucca.parser;

/**
 * Thrown when a derivation can't be completed. Carries the {@link OracleError} describing why.
 */
public class OracleException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient OracleError error;

    public OracleException(OracleError error) {
        super(error.toString());
        this.error = error;
    }

    public OracleError getError() {
        return error;
    }
}
