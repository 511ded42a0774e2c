package edu.uchicago.cs.ucare.mpst.cfg;

@SuppressWarnings("serial")
public class RecursionNode extends Node {

  private final String label;

  public RecursionNode(int id, String label) {
    super(id, NodeKind.RECURSION);
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return "rec#" + id + "[" + label + "]";
  }

}
