package edu.uchicago.cs.ucare.mpst.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.uchicago.cs.ucare.mpst.ast.Message;

@SuppressWarnings("serial")
public class MessageAction extends Action {

  private final String from;
  private final List<String> to;
  private final Message message;

  public MessageAction(String from, List<String> to, Message message) {
    super(ActionKind.MESSAGE);
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
  public List<String> getRoles() {
    List<String> roles = new ArrayList<String>();
    roles.add(from);
    roles.addAll(to);
    return roles;
  }

  @Override
  public String toString() {
    return from + "->" + String.join(",", to) + ":" + message;
  }

}
