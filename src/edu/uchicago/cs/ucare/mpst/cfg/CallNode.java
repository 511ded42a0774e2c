package edu.uchicago.cs.ucare.mpst.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@SuppressWarnings("serial")
public class CallNode extends Node {

  private final String protocol;
  private final List<String> roleArguments;

  public CallNode(int id, String protocol, List<String> roleArguments) {
    super(id, NodeKind.CALL);
    this.protocol = protocol;
    this.roleArguments = Collections.unmodifiableList(new ArrayList<String>(roleArguments));
  }

  public String getProtocol() {
    return protocol;
  }

  public List<String> getRoleArguments() {
    return roleArguments;
  }

  @Override
  public boolean isCommunicating() {
    return true;
  }

  @Override
  public String toString() {
    return "call#" + id + "[" + protocol + "(" + String.join(", ", roleArguments) + ")]";
  }

}
