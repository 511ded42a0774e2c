package edu.uchicago.cs.ucare.mpst.projection;

public enum ProjectionErrorKind {
  ROLE_NOT_FOUND, NON_DETERMINISTIC, BUDGET_EXCEEDED
}
