package edu.uchicago.cs.ucare.mpst.cfg;

public enum EdgeKind {
  SEQUENCE, MESSAGE, BRANCH, FORK, CONTINUE
}
