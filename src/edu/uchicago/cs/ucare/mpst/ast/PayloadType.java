package edu.uchicago.cs.ucare.mpst.ast;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Payload type of a message, either simple (Int) or parametric (List&lt;Map&lt;String, Int&gt;&gt;).
 */
public class PayloadType implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String name;
  private final List<PayloadType> arguments;

  public PayloadType(String name) {
    this(name, Collections.<PayloadType>emptyList());
  }

  public PayloadType(String name, List<PayloadType> arguments) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Payload type needs a name");
    }
    this.name = name;
    this.arguments = Collections.unmodifiableList(new ArrayList<PayloadType>(arguments));
  }

  public String getName() {
    return name;
  }

  public List<PayloadType> getArguments() {
    return arguments;
  }

  public boolean isParametric() {
    return !arguments.isEmpty();
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + name.hashCode();
    result = prime * result + arguments.hashCode();
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
    PayloadType other = (PayloadType) obj;
    return name.equals(other.name) && arguments.equals(other.arguments);
  }

  @Override
  public String toString() {
    if (arguments.isEmpty()) {
      return name;
    }
    StringBuilder sb = new StringBuilder(name);
    sb.append("<");
    for (int i = 0; i < arguments.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(arguments.get(i));
    }
    sb.append(">");
    return sb.toString();
  }

}
