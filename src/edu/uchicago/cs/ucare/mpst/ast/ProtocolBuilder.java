package edu.uchicago.cs.ucare.mpst.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static factories for assembling protocol trees in code, meant to be imported statically.
 */
public final class ProtocolBuilder {

  private ProtocolBuilder() {
  }

  public static Protocol protocol(String name, List<String> roles, Interaction... body) {
    return new Protocol(name, roles, Arrays.asList(body));
  }

  public static List<String> roles(String... roles) {
    return Arrays.asList(roles);
  }

  public static List<Interaction> body(Interaction... interactions) {
    return Arrays.asList(interactions);
  }

  public static PayloadType type(String name, PayloadType... arguments) {
    return new PayloadType(name, Arrays.asList(arguments));
  }

  public static MessageTransfer send(String from, String to, String label) {
    return new MessageTransfer(from, Collections.singletonList(to), new Message(label));
  }

  public static MessageTransfer send(String from, String to, String label, PayloadType payload) {
    return new MessageTransfer(from, Collections.singletonList(to), new Message(label, payload));
  }

  public static MessageTransfer multicast(String from, List<String> to, String label) {
    return new MessageTransfer(from, to, new Message(label));
  }

  public static ChoiceBranch branch(Interaction... body) {
    return new ChoiceBranch(null, Arrays.asList(body));
  }

  public static ChoiceBranch labelledBranch(String label, Interaction... body) {
    return new ChoiceBranch(label, Arrays.asList(body));
  }

  public static Choice choice(String decider, ChoiceBranch... branches) {
    return new Choice(decider, Arrays.asList(branches));
  }

  @SafeVarargs
  public static Parallel par(List<Interaction>... branches) {
    return new Parallel(new ArrayList<List<Interaction>>(Arrays.asList(branches)));
  }

  public static Recursion rec(String label, Interaction... body) {
    return new Recursion(label, Arrays.asList(body));
  }

  public static Continue cont(String label) {
    return new Continue(label);
  }

  public static Do call(String protocol, String... roleArguments) {
    return new Do(protocol, Arrays.asList(roleArguments));
  }

  public static NewRole newRole(String role) {
    return new NewRole(role);
  }

  public static CreateParticipants create(String creator, String role) {
    return new CreateParticipants(creator, role);
  }

  public static Invitation invite(String inviter, String invitee) {
    return new Invitation(inviter, invitee);
  }

}
