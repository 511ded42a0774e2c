package edu.uchicago.cs.ucare.mpst.ast;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A global protocol declaration as handed over by the parser.
 */
public class Protocol implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String name;
  private final List<String> roles;
  private final List<Interaction> body;

  public Protocol(String name, List<String> roles, List<Interaction> body) {
    this.name = name;
    this.roles = Collections.unmodifiableList(new ArrayList<String>(roles));
    this.body = Collections.unmodifiableList(new ArrayList<Interaction>(body));
  }

  public String getName() {
    return name;
  }

  public List<String> getRoles() {
    return roles;
  }

  public List<Interaction> getBody() {
    return body;
  }

  /**
   * Declared roles followed by roles introduced with {@link NewRole}, in order of appearance.
   */
  public List<String> getAllRoles() {
    Set<String> all = new LinkedHashSet<String>(roles);
    for (Interaction interaction : findAll(InteractionKind.NEW_ROLE)) {
      all.add(((NewRole) interaction).getRole());
    }
    return new ArrayList<String>(all);
  }

  public List<Interaction> findAll(InteractionKind kind) {
    List<Interaction> result = new ArrayList<Interaction>();
    collect(body, kind, result);
    return result;
  }

  private static void collect(List<Interaction> interactions, InteractionKind kind,
      List<Interaction> result) {
    for (Interaction interaction : interactions) {
      if (interaction.getKind() == kind) {
        result.add(interaction);
      }
      switch (interaction.getKind()) {
      case CHOICE:
        for (ChoiceBranch branch : ((Choice) interaction).getBranches()) {
          collect(branch.getBody(), kind, result);
        }
        break;
      case PARALLEL:
        for (List<Interaction> branch : ((Parallel) interaction).getBranches()) {
          collect(branch, kind, result);
        }
        break;
      case RECURSION:
        collect(((Recursion) interaction).getBody(), kind, result);
        break;
      default:
        break;
      }
    }
  }

  @Override
  public String toString() {
    return "global protocol " + name + "(" + String.join(", ", roles) + ")";
  }

}
