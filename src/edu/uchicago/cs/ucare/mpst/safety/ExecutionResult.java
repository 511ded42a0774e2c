package edu.uchicago.cs.ucare.mpst.safety;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ExecutionResult {

  private final ExecutionOutcome outcome;
  private final List<TypingContext> trace;
  private final List<Communication> communications;

  public ExecutionResult(ExecutionOutcome outcome, List<TypingContext> trace,
      List<Communication> communications) {
    this.outcome = outcome;
    this.trace = Collections.unmodifiableList(new ArrayList<TypingContext>(trace));
    this.communications = Collections.unmodifiableList(new ArrayList<Communication>(communications));
  }

  public ExecutionOutcome getOutcome() {
    return outcome;
  }

  /** Every context visited, starting with the one execution began from. */
  public List<TypingContext> getTrace() {
    return trace;
  }

  public List<Communication> getCommunications() {
    return communications;
  }

  public int getSteps() {
    return communications.size();
  }

  public TypingContext getFinalContext() {
    return trace.get(trace.size() - 1);
  }

}
