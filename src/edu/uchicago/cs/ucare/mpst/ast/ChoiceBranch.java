package edu.uchicago.cs.ucare.mpst.ast;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ChoiceBranch implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String label;
  private final List<Interaction> body;

  public ChoiceBranch(String label, List<Interaction> body) {
    this.label = label;
    this.body = Collections.unmodifiableList(new ArrayList<Interaction>(body));
  }

  public String getLabel() {
    return label;
  }

  public List<Interaction> getBody() {
    return body;
  }

}
