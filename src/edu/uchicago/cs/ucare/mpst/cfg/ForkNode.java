package edu.uchicago.cs.ucare.mpst.cfg;

@SuppressWarnings("serial")
public class ForkNode extends Node {

  private final int parallelId;
  private final int joinId;

  public ForkNode(int id, int parallelId, int joinId) {
    super(id, NodeKind.FORK);
    this.parallelId = parallelId;
    this.joinId = joinId;
  }

  public int getParallelId() {
    return parallelId;
  }

  public int getJoinId() {
    return joinId;
  }

}
