package edu.uchicago.cs.ucare.mpst.cfg;

@SuppressWarnings("serial")
public class BranchNode extends Node {

  private final String decider;
  private final int mergeId;

  public BranchNode(int id, String decider, int mergeId) {
    super(id, NodeKind.BRANCH);
    this.decider = decider;
    this.mergeId = mergeId;
  }

  public String getDecider() {
    return decider;
  }

  public int getMergeId() {
    return mergeId;
  }

  @Override
  public String toString() {
    return "branch#" + id + "[at " + decider + "]";
  }

}
