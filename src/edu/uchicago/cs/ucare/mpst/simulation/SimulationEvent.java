package edu.uchicago.cs.ucare.mpst.simulation;

import java.io.Serializable;

import edu.uchicago.cs.ucare.mpst.ast.Message;

/**
 * Entry of a role's trace in the distributed simulator.
 */
public class SimulationEvent implements Serializable {

  private static final long serialVersionUID = 1L;

  private final SimulationEventKind kind;
  private final int step;
  private final String role;
  private final int fromState;
  private final int toState;
  private final String peer;
  private final Message message;
  private final String detail;

  public SimulationEvent(SimulationEventKind kind, int step, String role, int fromState,
      int toState, String peer, Message message, String detail) {
    this.kind = kind;
    this.step = step;
    this.role = role;
    this.fromState = fromState;
    this.toState = toState;
    this.peer = peer;
    this.message = message;
    this.detail = detail;
  }

  public SimulationEventKind getKind() {
    return kind;
  }

  public int getStep() {
    return step;
  }

  public String getRole() {
    return role;
  }

  public int getFromState() {
    return fromState;
  }

  public int getToState() {
    return toState;
  }

  /** Receiver list for sends, sender for receives, null otherwise. */
  public String getPeer() {
    return peer;
  }

  public Message getMessage() {
    return message;
  }

  public String getDetail() {
    return detail;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("#").append(step).append(" ").append(role).append(" ").append(kind);
    if (message != null) {
      sb.append(" ").append(message);
    }
    if (peer != null) {
      sb.append(kind == SimulationEventKind.RECEIVE ? " from " : " to ").append(peer);
    }
    if (fromState >= 0) {
      sb.append(" s").append(fromState).append("->s").append(toState);
    }
    if (detail != null) {
      sb.append(" (").append(detail).append(")");
    }
    return sb.toString();
  }

}
