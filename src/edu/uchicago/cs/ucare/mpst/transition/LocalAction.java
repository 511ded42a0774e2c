package edu.uchicago.cs.ucare.mpst.transition;

import java.io.Serializable;
import java.util.Comparator;
import java.util.List;

/**
 * Action carried by a local state machine transition.
 */
@SuppressWarnings("serial")
public abstract class LocalAction implements Serializable {

  public enum Type {
    SEND, RECEIVE, TAU, CALL
  }

  protected final Type type;

  protected LocalAction(Type type) {
    this.type = type;
  }

  public Type getType() {
    return type;
  }

  /** Silent actions are never matched against a peer. */
  public boolean isSilent() {
    return type == Type.TAU || type == Type.CALL;
  }

  /**
   * Direction, peer and label. Two transitions leaving one state with the same observable key
   * make a machine non-deterministic.
   */
  public abstract String getObservableKey();

  /** Everything the action carries, payload included. */
  public abstract String getKey();

  public static final Comparator<LocalAction> COMPARATOR = new Comparator<LocalAction>() {
    public int compare(LocalAction o1, LocalAction o2) {
      return o1.getKey().compareTo(o2.getKey());
    }
  };

  public static String extract(List<? extends LocalAction> actions) {
    StringBuilder strBuilder = new StringBuilder();
    for (LocalAction action : actions) {
      strBuilder.append(action.toString());
      strBuilder.append("\n");
    }
    return strBuilder.length() > 0 ? strBuilder.substring(0, strBuilder.length() - 1) : "";
  }

  @Override
  public int hashCode() {
    return getKey().hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    return getKey().equals(((LocalAction) obj).getKey());
  }

  @Override
  public String toString() {
    return getKey();
  }

}
