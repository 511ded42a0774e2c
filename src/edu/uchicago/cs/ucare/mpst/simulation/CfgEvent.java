package edu.uchicago.cs.ucare.mpst.simulation;

import java.io.Serializable;

public class CfgEvent implements Serializable {

  private static final long serialVersionUID = 1L;

  private final CfgEventKind kind;
  private final int step;
  private final int node;
  private final String description;

  public CfgEvent(CfgEventKind kind, int step, int node, String description) {
    this.kind = kind;
    this.step = step;
    this.node = node;
    this.description = description;
  }

  public CfgEventKind getKind() {
    return kind;
  }

  public int getStep() {
    return step;
  }

  public int getNode() {
    return node;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return "#" + step + " " + kind + " " + description;
  }

}
