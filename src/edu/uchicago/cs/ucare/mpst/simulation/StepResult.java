package edu.uchicago.cs.ucare.mpst.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class StepResult {

  private final StepOutcome outcome;
  private final String role;
  private final List<SimulationEvent> events;

  public StepResult(StepOutcome outcome, String role, List<SimulationEvent> events) {
    this.outcome = outcome;
    this.role = role;
    this.events = Collections.unmodifiableList(new ArrayList<SimulationEvent>(events));
  }

  public StepOutcome getOutcome() {
    return outcome;
  }

  /** Role that moved, null when nobody did. */
  public String getRole() {
    return role;
  }

  public List<SimulationEvent> getEvents() {
    return events;
  }

  @Override
  public String toString() {
    return outcome + (role == null ? "" : " " + role) + " " + events;
  }

}
