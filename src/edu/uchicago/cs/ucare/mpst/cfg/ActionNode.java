package edu.uchicago.cs.ucare.mpst.cfg;

@SuppressWarnings("serial")
public class ActionNode extends Node {

  private final Action action;

  public ActionNode(int id, Action action) {
    super(id, NodeKind.ACTION);
    this.action = action;
  }

  public Action getAction() {
    return action;
  }

  @Override
  public boolean isCommunicating() {
    return true;
  }

  @Override
  public String toString() {
    return "action#" + id + "[" + action + "]";
  }

}
