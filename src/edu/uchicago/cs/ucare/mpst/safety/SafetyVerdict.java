package edu.uchicago.cs.ucare.mpst.safety;

public enum SafetyVerdict {
  SAFE, UNSAFE, BUDGET_EXCEEDED
}
