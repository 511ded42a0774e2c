package edu.uchicago.cs.ucare.mpst.projection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ProjectionResult {

  private final Map<String, Cfsm> cfsms;
  private final List<ProjectionError> errors;

  public ProjectionResult(Map<String, Cfsm> cfsms, List<ProjectionError> errors) {
    this.cfsms = Collections.unmodifiableMap(new LinkedHashMap<String, Cfsm>(cfsms));
    this.errors = Collections.unmodifiableList(new ArrayList<ProjectionError>(errors));
  }

  /** Machines of the roles that projected cleanly, in role declaration order. */
  public Map<String, Cfsm> getCfsms() {
    return cfsms;
  }

  public Cfsm getCfsm(String role) {
    return cfsms.get(role);
  }

  public List<ProjectionError> getErrors() {
    return errors;
  }

  public boolean isSuccessful() {
    return errors.isEmpty();
  }

}
