package edu.uchicago.cs.ucare.mpst.simulation;

public enum CfgErrorKind {
  CHOICE_REQUIRED, INVALID_CHOICE, ALREADY_COMPLETED, BUDGET_EXCEEDED, NO_HISTORY, STUCK,
  NO_REGISTRY, INVALID_CALL, CALL_DEPTH_EXCEEDED
}
