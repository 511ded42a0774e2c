package edu.uchicago.cs.ucare.mpst.ast;

import java.io.Serializable;

public class Message implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String label;
  private final PayloadType payload;

  public Message(String label) {
    this(label, null);
  }

  public Message(String label, PayloadType payload) {
    if (label == null || label.isEmpty()) {
      throw new IllegalArgumentException("Message needs a label");
    }
    this.label = label;
    this.payload = payload;
  }

  public String getLabel() {
    return label;
  }

  /** May be null when the message carries no payload. */
  public PayloadType getPayload() {
    return payload;
  }

  public boolean hasPayload() {
    return payload != null;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + label.hashCode();
    result = prime * result + ((payload == null) ? 0 : payload.hashCode());
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
    Message other = (Message) obj;
    if (!label.equals(other.label))
      return false;
    if (payload == null) {
      return other.payload == null;
    }
    return payload.equals(other.payload);
  }

  @Override
  public String toString() {
    return label + "(" + (payload == null ? "" : payload.toString()) + ")";
  }

}
