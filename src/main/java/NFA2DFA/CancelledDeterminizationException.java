package NFA2DFA;

/**
 * Thrown when a determinization is stopped by its {@link NFA2DFA.Model.Cancellation}.
 */
public class CancelledDeterminizationException extends RuntimeException {
    private final String label;
    private final int discoveredStates;

    public CancelledDeterminizationException(String label, int discoveredStates) {
        super("Determinization cancelled (" + label + ") after " + discoveredStates + " DFA states");
        this.label = label;
        this.discoveredStates = discoveredStates;
    }

    /**
     * @return "TO" if interrupted, "OOM" if the state threshold was crossed
     */
    public String getLabel() {
        return label;
    }

    public int getDiscoveredStates() {
        return discoveredStates;
    }
}
