package edu.uchicago.cs.ucare.mpst.cfg;

import java.io.Serializable;

/**
 * One firing of the token game: the node that fires, the edge taken (for branch and structural
 * moves) and the marking it leads to.
 */
public class Move implements Serializable {

  private static final long serialVersionUID = 1L;

  private final MoveKind kind;
  private final Node node;
  private final Edge edge;
  private final int branchIndex;
  private final Marking target;

  public Move(MoveKind kind, Node node, Edge edge, int branchIndex, Marking target) {
    this.kind = kind;
    this.node = node;
    this.edge = edge;
    this.branchIndex = branchIndex;
    this.target = target;
  }

  public MoveKind getKind() {
    return kind;
  }

  public Node getNode() {
    return node;
  }

  /** Edge taken, null for fork and join moves. */
  public Edge getEdge() {
    return edge;
  }

  /** Index of the chosen branch, -1 unless this is a branch move. */
  public int getBranchIndex() {
    return branchIndex;
  }

  public Marking getTarget() {
    return target;
  }

  /** Node the moving token lands on, or -1 for fork moves. */
  public int getLanding() {
    return edge == null ? -1 : edge.getTo();
  }

  @Override
  public String toString() {
    return kind + "@" + node + " -> " + target;
  }

}
