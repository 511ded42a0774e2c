package edu.uchicago.cs.ucare.mpst.verification;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Diagnostic implements Serializable {

  private static final long serialVersionUID = 1L;

  private final Severity severity;
  private final String message;
  private final List<Integer> nodes;
  private final List<String> roles;

  public Diagnostic(Severity severity, String message, List<Integer> nodes, List<String> roles) {
    this.severity = severity;
    this.message = message;
    this.nodes = Collections.unmodifiableList(new ArrayList<Integer>(nodes));
    this.roles = Collections.unmodifiableList(new ArrayList<String>(roles));
  }

  public static Diagnostic error(String message, List<Integer> nodes, List<String> roles) {
    return new Diagnostic(Severity.ERROR, message, nodes, roles);
  }

  public static Diagnostic warning(String message, List<Integer> nodes, List<String> roles) {
    return new Diagnostic(Severity.WARNING, message, nodes, roles);
  }

  public Severity getSeverity() {
    return severity;
  }

  public String getMessage() {
    return message;
  }

  /** CFG nodes the diagnostic is about. */
  public List<Integer> getNodes() {
    return nodes;
  }

  public List<String> getRoles() {
    return roles;
  }

  @Override
  public String toString() {
    return severity + ": " + message + (nodes.isEmpty() ? "" : " " + nodes);
  }

}
