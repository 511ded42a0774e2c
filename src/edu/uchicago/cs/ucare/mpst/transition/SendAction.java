package edu.uchicago.cs.ucare.mpst.transition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.uchicago.cs.ucare.mpst.ast.Message;

@SuppressWarnings("serial")
public class SendAction extends LocalAction {

  private final List<String> to;
  private final Message message;

  public SendAction(List<String> to, Message message) {
    super(Type.SEND);
    this.to = Collections.unmodifiableList(new ArrayList<String>(to));
    this.message = message;
  }

  public List<String> getTo() {
    return to;
  }

  public Message getMessage() {
    return message;
  }

  @Override
  public String getObservableKey() {
    return "!" + String.join(",", to) + ":" + message.getLabel();
  }

  @Override
  public String getKey() {
    return String.join(",", to) + "!" + message;
  }

}
