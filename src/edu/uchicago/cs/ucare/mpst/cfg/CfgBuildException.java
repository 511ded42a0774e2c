package edu.uchicago.cs.ucare.mpst.cfg;

@SuppressWarnings("serial")
public class CfgBuildException extends Exception {

  private final String protocol;

  public CfgBuildException(String protocol, String message) {
    super("Cannot build CFG of " + protocol + ": " + message);
    this.protocol = protocol;
  }

  public CfgBuildException(String protocol, String message, Throwable cause) {
    super("Cannot build CFG of " + protocol + ": " + message, cause);
    this.protocol = protocol;
  }

  public String getProtocol() {
    return protocol;
  }

}
