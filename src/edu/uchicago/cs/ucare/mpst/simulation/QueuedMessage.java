package edu.uchicago.cs.ucare.mpst.simulation;

import java.io.Serializable;

import edu.uchicago.cs.ucare.mpst.ast.Message;
import edu.uchicago.cs.ucare.mpst.cfg.Channel;

public class QueuedMessage implements Serializable {

  private static final long serialVersionUID = 1L;

  private final Channel channel;
  private final Message message;

  public QueuedMessage(Channel channel, Message message) {
    this.channel = channel;
    this.message = message;
  }

  public Channel getChannel() {
    return channel;
  }

  public Message getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return message + " on " + channel;
  }

}
