package edu.uchicago.cs.ucare.mpst.verification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class VerificationResult {

  private final String check;
  private final List<Diagnostic> errors;
  private final List<Diagnostic> warnings;

  public VerificationResult(String check, List<Diagnostic> diagnostics) {
    this.check = check;
    List<Diagnostic> errs = new ArrayList<Diagnostic>();
    List<Diagnostic> warns = new ArrayList<Diagnostic>();
    for (Diagnostic diagnostic : diagnostics) {
      if (diagnostic.getSeverity() == Severity.ERROR) {
        errs.add(diagnostic);
      } else {
        warns.add(diagnostic);
      }
    }
    this.errors = Collections.unmodifiableList(errs);
    this.warnings = Collections.unmodifiableList(warns);
  }

  public String getCheck() {
    return check;
  }

  public boolean isPassed() {
    return errors.isEmpty();
  }

  public List<Diagnostic> getErrors() {
    return errors;
  }

  public List<Diagnostic> getWarnings() {
    return warnings;
  }

  public List<Diagnostic> getDiagnostics() {
    List<Diagnostic> all = new ArrayList<Diagnostic>(errors);
    all.addAll(warnings);
    return all;
  }

  @Override
  public String toString() {
    return check + ": " + (isPassed() ? "passed" : "failed") + " (" + errors.size() + " errors, "
        + warnings.size() + " warnings)";
  }

}
