package edu.uchicago.cs.ucare.mpst.ast;

import java.util.Arrays;
import java.util.List;

@SuppressWarnings("serial")
public class CreateParticipants extends Interaction {

  private final String creator;
  private final String role;

  public CreateParticipants(String creator, String role) {
    super(InteractionKind.CREATE_PARTICIPANTS);
    this.creator = creator;
    this.role = role;
  }

  public String getCreator() {
    return creator;
  }

  public String getRole() {
    return role;
  }

  @Override
  public List<String> getReferencedRoles() {
    return Arrays.asList(creator, role);
  }

}
