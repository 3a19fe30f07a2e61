package edu.ucca.parser;

/**
 * What an oracle decided for one step: either the next action, or an error if no action can make
 * progress.
 */
public class OracleResult {
    private final Action action;
    private final OracleError error;

    private OracleResult(Action action, OracleError error) {
        this.action = action;
        this.error = error;
    }

    public static OracleResult of(Action action) {
        if (action == null) {
            throw new IllegalArgumentException("A successful result needs an action");
        }
        return new OracleResult(action, null);
    }

    public static OracleResult failure(OracleError error) {
        if (error == null) {
            throw new IllegalArgumentException("A failed result needs an error");
        }
        return new OracleResult(null, error);
    }

    public boolean isSuccess() {
        return action != null;
    }

    public Action getAction() {
        if (action == null) {
            throw new IllegalStateException("No action, the oracle failed: " + error.getReason());
        }
        return action;
    }

    public OracleError getError() {
        if (error == null) {
            throw new IllegalStateException("No error, the oracle returned " + action);
        }
        return error;
    }

    public Action orElseThrow() {
        if (error != null) throw new OracleException(error);
        return action;
    }

    @Override
    public String toString() {
        return action != null ? action.toString() : "ERROR: " + error.getReason();
    }
}
