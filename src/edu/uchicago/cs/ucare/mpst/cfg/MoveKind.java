package edu.uchicago.cs.ucare.mpst.cfg;

public enum MoveKind {
  /** Initial, merge and recursion nodes passing control on. */
  STRUCTURAL,
  ACTION,
  CALL,
  BRANCH,
  FORK,
  JOIN
}
