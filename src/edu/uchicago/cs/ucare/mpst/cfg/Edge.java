package edu.uchicago.cs.ucare.mpst.cfg;

import java.io.Serializable;

public class Edge implements Serializable {

  private static final long serialVersionUID = 1L;

  private final int from;
  private final int to;
  private final EdgeKind kind;
  private final String label;

  public Edge(int from, int to, EdgeKind kind, String label) {
    this.from = from;
    this.to = to;
    this.kind = kind;
    this.label = label;
  }

  public int getFrom() {
    return from;
  }

  public int getTo() {
    return to;
  }

  public EdgeKind getKind() {
    return kind;
  }

  /** Branch label for branch edges, may be null. */
  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return from + " -" + kind.toString().toLowerCase() + (label == null ? "" : "[" + label + "]")
        + "-> " + to;
  }

}
