package edu.uchicago.cs.ucare.mpst.cfg;

public enum ActionKind {
  MESSAGE, CREATE_PARTICIPANTS, INVITATION
}
