package edu.uchicago.cs.ucare.mpst.simulation;

public enum SimulationEventKind {
  STATE_CHANGE, SEND, RECEIVE, CALL, ERROR
}
