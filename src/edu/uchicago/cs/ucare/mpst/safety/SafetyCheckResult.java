package edu.uchicago.cs.ucare.mpst.safety;

public class SafetyCheckResult {

  private final SafetyVerdict verdict;
  private final SafetyViolation violation;
  private final int statesExplored;

  public SafetyCheckResult(SafetyVerdict verdict, SafetyViolation violation, int statesExplored) {
    this.verdict = verdict;
    this.violation = violation;
    this.statesExplored = statesExplored;
  }

  public SafetyVerdict getVerdict() {
    return verdict;
  }

  public boolean isSafe() {
    return verdict == SafetyVerdict.SAFE;
  }

  /** Null unless the verdict is {@link SafetyVerdict#UNSAFE}. */
  public SafetyViolation getViolation() {
    return violation;
  }

  public int getStatesExplored() {
    return statesExplored;
  }

  @Override
  public String toString() {
    return verdict + " (" + statesExplored + " contexts)"
        + (violation == null ? "" : ": " + violation.getMessage());
  }

}
