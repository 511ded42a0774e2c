package edu.uchicago.cs.ucare.mpst.ast;

import java.util.Arrays;
import java.util.List;

@SuppressWarnings("serial")
public class Invitation extends Interaction {

  private final String inviter;
  private final String invitee;

  public Invitation(String inviter, String invitee) {
    super(InteractionKind.INVITATION);
    this.inviter = inviter;
    this.invitee = invitee;
  }

  public String getInviter() {
    return inviter;
  }

  public String getInvitee() {
    return invitee;
  }

  @Override
  public List<String> getReferencedRoles() {
    return Arrays.asList(inviter, invitee);
  }

}
