package edu.uchicago.cs.ucare.mpst.verification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class VerificationReport {

  private final String protocol;
  private final List<VerificationResult> results;
  private final boolean strict;

  public VerificationReport(String protocol, List<VerificationResult> results, boolean strict) {
    this.protocol = protocol;
    this.results = Collections.unmodifiableList(new ArrayList<VerificationResult>(results));
    this.strict = strict;
  }

  public String getProtocol() {
    return protocol;
  }

  public List<VerificationResult> getResults() {
    return results;
  }

  /** Null when the check was not run. */
  public VerificationResult getResult(String check) {
    for (VerificationResult result : results) {
      if (result.getCheck().equals(check)) {
        return result;
      }
    }
    return null;
  }

  public boolean isStrict() {
    return strict;
  }

  /** All checks passed; in strict mode warnings count as failures too. */
  public boolean isPassed() {
    for (VerificationResult result : results) {
      if (!result.isPassed() || (strict && !result.getWarnings().isEmpty())) {
        return false;
      }
    }
    return true;
  }

  public int getErrorCount() {
    int count = 0;
    for (VerificationResult result : results) {
      count += result.getErrors().size();
    }
    return count;
  }

  public int getWarningCount() {
    int count = 0;
    for (VerificationResult result : results) {
      count += result.getWarnings().size();
    }
    return count;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(protocol).append(": ").append(isPassed() ? "PASSED" : "FAILED");
    for (VerificationResult result : results) {
      sb.append("\n  ").append(result);
      for (Diagnostic diagnostic : result.getDiagnostics()) {
        sb.append("\n    ").append(diagnostic);
      }
    }
    return sb.toString();
  }

}
