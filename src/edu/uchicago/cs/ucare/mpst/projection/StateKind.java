package edu.uchicago.cs.ucare.mpst.projection;

import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;

public enum StateKind {
  INITIAL, TERMINAL, SEND, RECEIVE, CHOICE, CALL, ACTION, MERGE, FORK, JOIN, RECURSION;

  public static StateKind mirror(NodeKind kind) {
    switch (kind) {
    case INITIAL:
      return INITIAL;
    case TERMINAL:
      return TERMINAL;
    case ACTION:
      return ACTION;
    case BRANCH:
      return CHOICE;
    case MERGE:
      return MERGE;
    case FORK:
      return FORK;
    case JOIN:
      return JOIN;
    case RECURSION:
      return RECURSION;
    case CALL:
      return CALL;
    default:
      throw new IllegalArgumentException("Unknown node kind " + kind);
    }
  }
}
