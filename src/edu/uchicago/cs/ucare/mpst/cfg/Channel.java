package edu.uchicago.cs.ucare.mpst.cfg;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered (sender, receiver) pair.
 */
public final class Channel implements Serializable, Comparable<Channel> {

  private static final long serialVersionUID = 1L;

  private final String sender;
  private final String receiver;

  public Channel(String sender, String receiver) {
    this.sender = sender;
    this.receiver = receiver;
  }

  /** One channel per receiver of the message. */
  public static List<Channel> expand(MessageAction action) {
    List<Channel> channels = new ArrayList<Channel>();
    for (String receiver : action.getTo()) {
      Channel channel = new Channel(action.getFrom(), receiver);
      if (!channels.contains(channel)) {
        channels.add(channel);
      }
    }
    return channels;
  }

  public String getSender() {
    return sender;
  }

  public String getReceiver() {
    return receiver;
  }

  public int compareTo(Channel other) {
    int c = sender.compareTo(other.sender);
    return c != 0 ? c : receiver.compareTo(other.receiver);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + sender.hashCode();
    result = prime * result + receiver.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Channel other = (Channel) obj;
    return sender.equals(other.sender) && receiver.equals(other.receiver);
  }

  @Override
  public String toString() {
    return "(" + sender + "," + receiver + ")";
  }

}
