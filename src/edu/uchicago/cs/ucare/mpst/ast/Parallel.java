package edu.uchicago.cs.ucare.mpst.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@SuppressWarnings("serial")
public class Parallel extends Interaction {

  private final List<List<Interaction>> branches;

  public Parallel(List<List<Interaction>> branches) {
    super(InteractionKind.PARALLEL);
    List<List<Interaction>> copy = new ArrayList<List<Interaction>>();
    for (List<Interaction> branch : branches) {
      copy.add(Collections.unmodifiableList(new ArrayList<Interaction>(branch)));
    }
    this.branches = Collections.unmodifiableList(copy);
  }

  public List<List<Interaction>> getBranches() {
    return branches;
  }

  @Override
  public List<String> getReferencedRoles() {
    return Collections.emptyList();
  }

}
