package edu.uchicago.cs.ucare.mpst.transition;

import edu.uchicago.cs.ucare.mpst.ast.Message;

@SuppressWarnings("serial")
public class ReceiveAction extends LocalAction {

  private final String from;
  private final Message message;

  public ReceiveAction(String from, Message message) {
    super(Type.RECEIVE);
    this.from = from;
    this.message = message;
  }

  public String getFrom() {
    return from;
  }

  public Message getMessage() {
    return message;
  }

  @Override
  public String getObservableKey() {
    return "?" + from + ":" + message.getLabel();
  }

  @Override
  public String getKey() {
    return from + "?" + message;
  }

}
