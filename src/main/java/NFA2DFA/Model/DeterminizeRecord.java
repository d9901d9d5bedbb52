package NFA2DFA.Model;

import java.util.BitSet;

/**
 * Worklist entry of the subset construction: the state set being explored and its DFA state number.
 */
public record DeterminizeRecord(BitSet inputState, int outputAddress) {

  @Override
  public String toString() {
    return outputAddress + ": " + inputState;
  }
}
