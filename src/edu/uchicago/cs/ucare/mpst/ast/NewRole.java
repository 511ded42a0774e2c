package edu.uchicago.cs.ucare.mpst.ast;

import java.util.Collections;
import java.util.List;

/**
 * Dynamic role declaration. The role joins the protocol's role set for the whole body.
 */
@SuppressWarnings("serial")
public class NewRole extends Interaction {

  private final String role;

  public NewRole(String role) {
    super(InteractionKind.NEW_ROLE);
    this.role = role;
  }

  public String getRole() {
    return role;
  }

  @Override
  public List<String> getReferencedRoles() {
    return Collections.singletonList(role);
  }

}
