package edu.uchicago.cs.ucare.mpst.transition;

import java.io.Serializable;
import java.util.Comparator;

public class CfsmTransition implements Serializable {

  private static final long serialVersionUID = 1L;

  private final int id;
  private final int from;
  private final int to;
  private final LocalAction action;

  public CfsmTransition(int id, int from, int to, LocalAction action) {
    this.id = id;
    this.from = from;
    this.to = to;
    this.action = action;
  }

  public int getId() {
    return id;
  }

  public int getFrom() {
    return from;
  }

  public int getTo() {
    return to;
  }

  public LocalAction getAction() {
    return action;
  }

  public static final Comparator<CfsmTransition> COMPARATOR = new Comparator<CfsmTransition>() {
    public int compare(CfsmTransition o1, CfsmTransition o2) {
      Integer i1 = o1.getId();
      Integer i2 = o2.getId();
      return i1.compareTo(i2);
    }
  };

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + from;
    result = prime * result + to;
    result = prime * result + action.hashCode();
    return result;
  }

  /** Transition ids do not take part in equality. */
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    CfsmTransition other = (CfsmTransition) obj;
    return from == other.from && to == other.to && action.equals(other.action);
  }

  @Override
  public String toString() {
    return "s" + from + " --" + action + "--> s" + to;
  }

}
