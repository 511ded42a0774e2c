package edu.uchicago.cs.ucare.mpst.ast;

import java.io.Serializable;
import java.util.List;

@SuppressWarnings("serial")
public abstract class Interaction implements Serializable {

  protected final InteractionKind kind;

  protected Interaction(InteractionKind kind) {
    this.kind = kind;
  }

  public InteractionKind getKind() {
    return kind;
  }

  /**
   * Roles this interaction names directly, not counting nested bodies.
   */
  public abstract List<String> getReferencedRoles();

}
