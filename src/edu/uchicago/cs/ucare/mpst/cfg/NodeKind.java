package edu.uchicago.cs.ucare.mpst.cfg;

public enum NodeKind {
  INITIAL, TERMINAL, ACTION, BRANCH, MERGE, FORK, JOIN, RECURSION, CALL
}
