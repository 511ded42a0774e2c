package edu.uchicago.cs.ucare.mpst.projection;

import java.io.Serializable;

import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;

public class CfsmState implements Serializable {

  private static final long serialVersionUID = 1L;

  private final int id;
  private final StateKind kind;
  private final int sourceNode;
  private final NodeKind sourceKind;

  public CfsmState(int id, StateKind kind) {
    this(id, kind, -1, null);
  }

  public CfsmState(int id, StateKind kind, int sourceNode, NodeKind sourceKind) {
    this.id = id;
    this.kind = kind;
    this.sourceNode = sourceNode;
    this.sourceKind = sourceKind;
  }

  public int getId() {
    return id;
  }

  public StateKind getKind() {
    return kind;
  }

  /** CFG node this state was derived from, -1 when built by hand. */
  public int getSourceNode() {
    return sourceNode;
  }

  public NodeKind getSourceKind() {
    return sourceKind;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + id;
    result = prime * result + kind.hashCode();
    result = prime * result + sourceNode;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    CfsmState other = (CfsmState) obj;
    return id == other.id && kind == other.kind && sourceNode == other.sourceNode
        && sourceKind == other.sourceKind;
  }

  @Override
  public String toString() {
    return "s" + id + "(" + kind.toString().toLowerCase() + ")";
  }

}
