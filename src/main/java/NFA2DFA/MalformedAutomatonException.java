package NFA2DFA;

/**
 * Thrown when an automaton description breaks one of the structural invariants of {@link Automaton}.
 */
public class MalformedAutomatonException extends IllegalArgumentException {

    public enum Violation {
        MISSING_INITIAL_STATE,
        UNDECLARED_INITIAL_STATE,
        UNDECLARED_ACCEPTING_STATE,
        UNDECLARED_TRANSITION_STATE,
        UNDECLARED_SYMBOL,
        EPSILON_IN_ALPHABET
    }

    private final Violation violation;

    public MalformedAutomatonException(Violation violation, String message) {
        super(violation + ": " + message);
        this.violation = violation;
    }

    public Violation getViolation() {
        return violation;
    }
}
