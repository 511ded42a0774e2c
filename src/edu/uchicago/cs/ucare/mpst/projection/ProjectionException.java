package edu.uchicago.cs.ucare.mpst.projection;

@SuppressWarnings("serial")
public class ProjectionException extends Exception {

  private final String role;
  private final ProjectionErrorKind kind;

  public ProjectionException(String role, ProjectionErrorKind kind, String message) {
    super(message);
    this.role = role;
    this.kind = kind;
  }

  public String getRole() {
    return role;
  }

  public ProjectionErrorKind getKind() {
    return kind;
  }

  public ProjectionError toError() {
    return new ProjectionError(role, kind, getMessage());
  }

}
