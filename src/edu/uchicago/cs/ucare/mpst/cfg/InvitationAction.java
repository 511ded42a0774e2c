package edu.uchicago.cs.ucare.mpst.cfg;

import java.util.Arrays;
import java.util.List;

@SuppressWarnings("serial")
public class InvitationAction extends Action {

  private final String inviter;
  private final String invitee;

  public InvitationAction(String inviter, String invitee) {
    super(ActionKind.INVITATION);
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
  public List<String> getRoles() {
    return Arrays.asList(inviter, invitee);
  }

  @Override
  public String toString() {
    return inviter + " invites " + invitee;
  }

}
