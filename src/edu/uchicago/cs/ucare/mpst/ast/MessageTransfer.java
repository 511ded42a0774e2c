package edu.uchicago.cs.ucare.mpst.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@SuppressWarnings("serial")
public class MessageTransfer extends Interaction {

  private final String from;
  private final List<String> to;
  private final Message message;

  public MessageTransfer(String from, List<String> to, Message message) {
    super(InteractionKind.MESSAGE_TRANSFER);
    this.from = from;
    this.to = Collections.unmodifiableList(new ArrayList<String>(to));
    this.message = message;
  }

  public String getFrom() {
    return from;
  }

  public List<String> getTo() {
    return to;
  }

  public Message getMessage() {
    return message;
  }

  public boolean isMulticast() {
    return to.size() > 1;
  }

  @Override
  public List<String> getReferencedRoles() {
    List<String> roles = new ArrayList<String>();
    roles.add(from);
    roles.addAll(to);
    return roles;
  }

  @Override
  public String toString() {
    return message + " from " + from + " to " + String.join(", ", to) + ";";
  }

}
