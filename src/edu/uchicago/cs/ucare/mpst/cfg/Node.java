package edu.uchicago.cs.ucare.mpst.cfg;

import java.io.Serializable;

/**
 * Plain CFG node, used as is for initial, terminal and merge nodes.
 */
public class Node implements Serializable {

  private static final long serialVersionUID = 1L;

  protected final int id;
  protected final NodeKind kind;

  public Node(int id, NodeKind kind) {
    this.id = id;
    this.kind = kind;
  }

  public int getId() {
    return id;
  }

  public NodeKind getKind() {
    return kind;
  }

  /** True for nodes whose firing is observable by at least one role. */
  public boolean isCommunicating() {
    return false;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + id;
    result = prime * result + kind.hashCode();
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
    Node other = (Node) obj;
    return id == other.id && kind == other.kind;
  }

  @Override
  public String toString() {
    return kind.toString().toLowerCase() + "#" + id;
  }

}
