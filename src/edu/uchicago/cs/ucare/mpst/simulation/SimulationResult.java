package edu.uchicago.cs.ucare.mpst.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SimulationResult {

  private final SimulationOutcome outcome;
  private final int steps;
  private final Map<String, List<SimulationEvent>> traces;
  private final Map<String, Integer> finalStates;
  private final List<QueuedMessage> orphanMessages;

  public SimulationResult(SimulationOutcome outcome, int steps,
      Map<String, List<SimulationEvent>> traces, Map<String, Integer> finalStates,
      List<QueuedMessage> orphanMessages) {
    this.outcome = outcome;
    this.steps = steps;
    Map<String, List<SimulationEvent>> copy = new LinkedHashMap<String, List<SimulationEvent>>();
    for (Map.Entry<String, List<SimulationEvent>> entry : traces.entrySet()) {
      copy.put(entry.getKey(),
          Collections.unmodifiableList(new ArrayList<SimulationEvent>(entry.getValue())));
    }
    this.traces = Collections.unmodifiableMap(copy);
    this.finalStates = Collections.unmodifiableMap(new LinkedHashMap<String, Integer>(finalStates));
    this.orphanMessages = Collections.unmodifiableList(new ArrayList<QueuedMessage>(orphanMessages));
  }

  public SimulationOutcome getOutcome() {
    return outcome;
  }

  public int getSteps() {
    return steps;
  }

  public Map<String, List<SimulationEvent>> getTraces() {
    return traces;
  }

  public List<SimulationEvent> getTrace(String role) {
    List<SimulationEvent> trace = traces.get(role);
    return trace == null ? Collections.<SimulationEvent>emptyList() : trace;
  }

  public Map<String, Integer> getFinalStates() {
    return finalStates;
  }

  /** Messages still queued when the run ended. */
  public List<QueuedMessage> getOrphanMessages() {
    return orphanMessages;
  }

  @Override
  public String toString() {
    return outcome + " after " + steps + " steps, final states " + finalStates
        + (orphanMessages.isEmpty() ? "" : ", orphans " + orphanMessages);
  }

}
