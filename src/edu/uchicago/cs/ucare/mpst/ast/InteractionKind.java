package edu.uchicago.cs.ucare.mpst.ast;

public enum InteractionKind {
  MESSAGE_TRANSFER, CHOICE, PARALLEL, RECURSION, CONTINUE, DO, NEW_ROLE, CREATE_PARTICIPANTS, INVITATION
}
