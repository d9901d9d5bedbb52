package NFA2DFA.Model;

/**
 * Stop conditions for a determinization: an upper bound on the number of DFA states,
 * and an interrupt flag that may be raised from another thread.
 */
public class Cancellation {

    private final int stateThreshold;

    private volatile boolean interrupted;
    private boolean oom;

    public Cancellation() {
        this(false, Integer.MAX_VALUE);
    }

    public Cancellation(int stateThreshold) {
        this(false, stateThreshold);
    }

    public Cancellation(boolean interrupted, int stateThreshold) {
        if (stateThreshold < 1) {
            throw new IllegalArgumentException("State threshold must be positive: " + stateThreshold);
        }
        this.interrupted = interrupted;
        this.stateThreshold = stateThreshold;
    }

    public int getStateThreshold() {
        return stateThreshold;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public void setInterrupted() {
        this.interrupted = true;
    }

    public boolean isOom() {
        return oom;
    }

    public boolean isAboveThreshold(int states) {
        this.oom |= states > stateThreshold;
        return this.oom;
    }

    public boolean isCancelled() {
        return isInterrupted() || isOom();
    }

    public String cancelLabel() {
        return this.isInterrupted() ? "TO" : "OOM";
    }
}
