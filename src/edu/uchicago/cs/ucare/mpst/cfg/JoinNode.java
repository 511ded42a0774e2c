package edu.uchicago.cs.ucare.mpst.cfg;

@SuppressWarnings("serial")
public class JoinNode extends Node {

  private final int parallelId;
  private final int branchCount;

  public JoinNode(int id, int parallelId, int branchCount) {
    super(id, NodeKind.JOIN);
    this.parallelId = parallelId;
    this.branchCount = branchCount;
  }

  public int getParallelId() {
    return parallelId;
  }

  /** Number of tokens that must arrive before the join fires. */
  public int getBranchCount() {
    return branchCount;
  }

}
