package edu.uchicago.cs.ucare.mpst.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sub-protocol invocation. Role arguments bind positionally to the callee's declared roles.
 */
@SuppressWarnings("serial")
public class Do extends Interaction {

  private final String protocol;
  private final List<String> roleArguments;

  public Do(String protocol, List<String> roleArguments) {
    super(InteractionKind.DO);
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
  public List<String> getReferencedRoles() {
    return roleArguments;
  }

  @Override
  public String toString() {
    return "do " + protocol + "(" + String.join(", ", roleArguments) + ");";
  }

}
