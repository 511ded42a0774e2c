package edu.uchicago.cs.ucare.mpst.transition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@SuppressWarnings("serial")
public class CallAction extends LocalAction {

  private final String protocol;
  private final List<String> roleArguments;

  public CallAction(String protocol, List<String> roleArguments) {
    super(Type.CALL);
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
  public String getObservableKey() {
    return getKey();
  }

  @Override
  public String getKey() {
    return "do " + protocol + "(" + String.join(",", roleArguments) + ")";
  }

}
