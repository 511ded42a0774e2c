package edu.uchicago.cs.ucare.mpst.projection;

import java.io.Serializable;

public class ProjectionError implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String role;
  private final ProjectionErrorKind kind;
  private final String message;

  public ProjectionError(String role, ProjectionErrorKind kind, String message) {
    this.role = role;
    this.kind = kind;
    this.message = message;
  }

  public String getRole() {
    return role;
  }

  public ProjectionErrorKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return role + ": " + kind + " " + message;
  }

}
