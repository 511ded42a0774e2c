package edu.uchicago.cs.ucare.mpst.safety;

public enum ExecutionOutcome {
  TERMINAL, STUCK, BUDGET_EXCEEDED
}
