package edu.uchicago.cs.ucare.mpst.simulation;

public enum CfgEventKind {
  MESSAGE, DYNAMIC_ROLE, CHOICE, RECURSION, FORK, JOIN, SUBPROTOCOL_ENTER, SUBPROTOCOL_EXIT,
  COMPLETE
}
