package edu.uchicago.cs.ucare.mpst.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@SuppressWarnings("serial")
public class Choice extends Interaction {

  private final String decider;
  private final List<ChoiceBranch> branches;

  public Choice(String decider, List<ChoiceBranch> branches) {
    super(InteractionKind.CHOICE);
    this.decider = decider;
    this.branches = Collections.unmodifiableList(new ArrayList<ChoiceBranch>(branches));
  }

  public String getDecider() {
    return decider;
  }

  public List<ChoiceBranch> getBranches() {
    return branches;
  }

  @Override
  public List<String> getReferencedRoles() {
    return Collections.singletonList(decider);
  }

}
