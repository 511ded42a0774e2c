package edu.uchicago.cs.ucare.mpst.safety;

import java.io.Serializable;

/**
 * A send whose peer is ready to receive from the sender, but not this label.
 */
public class SafetyViolation implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String sender;
  private final String receiver;
  private final String label;
  private final int senderState;
  private final int receiverState;
  private final TypingContext context;

  public SafetyViolation(String sender, String receiver, String label, int senderState,
      int receiverState, TypingContext context) {
    this.sender = sender;
    this.receiver = receiver;
    this.label = label;
    this.senderState = senderState;
    this.receiverState = receiverState;
    this.context = context;
  }

  public String getSender() {
    return sender;
  }

  public String getReceiver() {
    return receiver;
  }

  public String getLabel() {
    return label;
  }

  public int getSenderState() {
    return senderState;
  }

  /** -1 when the receiver is not part of the context. */
  public int getReceiverState() {
    return receiverState;
  }

  public TypingContext getContext() {
    return context;
  }

  public String getMessage() {
    if (receiverState < 0) {
      return sender + " sends " + label + " to unknown role " + receiver;
    }
    return sender + " can send " + label + " to " + receiver + " at s" + senderState + ", but "
        + receiver + " cannot receive it at s" + receiverState;
  }

  @Override
  public String toString() {
    return getMessage() + " in " + context;
  }

}
