package edu.uchicago.cs.ucare.mpst.simulation;

public enum SimulationOutcome {
  SUCCESS, DEADLOCK, BUDGET_EXCEEDED
}
