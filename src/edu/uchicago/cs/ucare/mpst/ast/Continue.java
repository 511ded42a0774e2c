package edu.uchicago.cs.ucare.mpst.ast;

import java.util.Collections;
import java.util.List;

@SuppressWarnings("serial")
public class Continue extends Interaction {

  private final String label;

  public Continue(String label) {
    super(InteractionKind.CONTINUE);
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  @Override
  public List<String> getReferencedRoles() {
    return Collections.emptyList();
  }

  @Override
  public String toString() {
    return "continue " + label + ";";
  }

}
