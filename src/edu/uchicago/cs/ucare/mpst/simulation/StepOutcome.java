package edu.uchicago.cs.ucare.mpst.simulation;

public enum StepOutcome {
  STEPPED, SUCCESS, DEADLOCK, BUDGET_EXCEEDED, ALREADY_COMPLETED, MESSAGE_NOT_READY
}
