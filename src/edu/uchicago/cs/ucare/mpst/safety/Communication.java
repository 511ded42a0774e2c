package edu.uchicago.cs.ucare.mpst.safety;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.uchicago.cs.ucare.mpst.ast.Message;
import edu.uchicago.cs.ucare.mpst.transition.CfsmTransition;

/**
 * One rendezvous: a send and the matching receive of every receiver, fired together.
 */
public class Communication implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String sender;
  private final List<String> receivers;
  private final Message message;
  private final CfsmTransition senderTransition;
  private final List<CfsmTransition> receiverTransitions;

  public Communication(String sender, List<String> receivers, Message message,
      CfsmTransition senderTransition, List<CfsmTransition> receiverTransitions) {
    this.sender = sender;
    this.receivers = Collections.unmodifiableList(new ArrayList<String>(receivers));
    this.message = message;
    this.senderTransition = senderTransition;
    this.receiverTransitions = Collections.unmodifiableList(
        new ArrayList<CfsmTransition>(receiverTransitions));
  }

  public String getSender() {
    return sender;
  }

  public List<String> getReceivers() {
    return receivers;
  }

  public Message getMessage() {
    return message;
  }

  public CfsmTransition getSenderTransition() {
    return senderTransition;
  }

  /** Aligned with {@link #getReceivers()}. */
  public List<CfsmTransition> getReceiverTransitions() {
    return receiverTransitions;
  }

  @Override
  public String toString() {
    return sender + "->" + String.join(",", receivers) + ":" + message;
  }

}
