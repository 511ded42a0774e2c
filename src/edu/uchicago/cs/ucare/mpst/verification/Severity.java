package edu.uchicago.cs.ucare.mpst.verification;

public enum Severity {
  ERROR, WARNING
}
