package edu.uchicago.cs.ucare.mpst.cfg;

import java.util.Arrays;
import java.util.List;

@SuppressWarnings("serial")
public class CreateParticipantsAction extends Action {

  private final String creator;
  private final String role;

  public CreateParticipantsAction(String creator, String role) {
    super(ActionKind.CREATE_PARTICIPANTS);
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
  public List<String> getRoles() {
    return Arrays.asList(creator, role);
  }

  @Override
  public String toString() {
    return creator + " creates " + role;
  }

}
