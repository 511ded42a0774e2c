package edu.uchicago.cs.ucare.mpst.ast;

@SuppressWarnings("serial")
public class ProtocolRegistryException extends Exception {

  public ProtocolRegistryException(String message) {
    super(message);
  }

}
