package edu.uchicago.cs.ucare.mpst.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@SuppressWarnings("serial")
public class Recursion extends Interaction {

  private final String label;
  private final List<Interaction> body;

  public Recursion(String label, List<Interaction> body) {
    super(InteractionKind.RECURSION);
    this.label = label;
    this.body = Collections.unmodifiableList(new ArrayList<Interaction>(body));
  }

  public String getLabel() {
    return label;
  }

  public List<Interaction> getBody() {
    return body;
  }

  @Override
  public List<String> getReferencedRoles() {
    return Collections.emptyList();
  }

}
