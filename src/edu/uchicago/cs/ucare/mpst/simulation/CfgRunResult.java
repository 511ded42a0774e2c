package edu.uchicago.cs.ucare.mpst.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CfgRunResult {

  private final boolean completed;
  private final CfgErrorKind error;
  private final int steps;
  private final List<CfgEvent> trace;

  public CfgRunResult(boolean completed, CfgErrorKind error, int steps, List<CfgEvent> trace) {
    this.completed = completed;
    this.error = error;
    this.steps = steps;
    this.trace = Collections.unmodifiableList(new ArrayList<CfgEvent>(trace));
  }

  public boolean isCompleted() {
    return completed;
  }

  /** Why the run stopped early, null when it completed. */
  public CfgErrorKind getError() {
    return error;
  }

  public int getSteps() {
    return steps;
  }

  public List<CfgEvent> getTrace() {
    return trace;
  }

  @Override
  public String toString() {
    return (completed ? "completed" : "stopped with " + error) + " after " + steps + " steps";
  }

}
