package edu.uchicago.cs.ucare.mpst.cfg;

import java.io.Serializable;
import java.util.List;

@SuppressWarnings("serial")
public abstract class Action implements Serializable {

  protected final ActionKind kind;

  protected Action(ActionKind kind) {
    this.kind = kind;
  }

  public ActionKind getKind() {
    return kind;
  }

  public abstract List<String> getRoles();

  public boolean involves(String role) {
    return getRoles().contains(role);
  }

}
