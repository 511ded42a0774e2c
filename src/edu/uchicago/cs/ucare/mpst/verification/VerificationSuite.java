package edu.uchicago.cs.ucare.mpst.verification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.projection.Projector;
import edu.uchicago.cs.ucare.mpst.safety.ContextReducer;
import edu.uchicago.cs.ucare.mpst.util.MpstConfig;

/**
 * Runs the configured verifiers over one CFG.
 */
public class VerificationSuite {

  protected final static Logger LOG = LoggerFactory.getLogger(VerificationSuite.class);

  private final List<ProtocolVerifier> verifiers;
  private final boolean strict;

  public VerificationSuite(MpstConfig config) {
    Projector projector = new Projector(config.getProjectionMaxConfigurations());
    ContextReducer reducer = new ContextReducer();
    int maxStates = config.getSafetyMaxStates();
    ProgressVerifier progress = new ProgressVerifier();
    DeadlockVerifier deadlock = new DeadlockVerifier(projector, reducer, maxStates);

    verifiers = new ArrayList<ProtocolVerifier>();
    if (config.isCheckEnabled("structure")) {
      verifiers.add(new StructuralVerifier());
    }
    if (config.isCheckEnabled("connectedness")) {
      verifiers.add(new ConnectednessVerifier());
    }
    if (config.isCheckEnabled("deadlock")) {
      verifiers.add(deadlock);
    }
    if (config.isCheckEnabled("parallel_deadlock")) {
      verifiers.add(new ParallelDeadlockVerifier());
    }
    if (config.isCheckEnabled("races")) {
      verifiers.add(new RaceVerifier());
    }
    if (config.isCheckEnabled("progress")) {
      verifiers.add(progress);
    }
    if (config.isCheckEnabled("liveness")) {
      verifiers.add(new LivenessVerifier(progress, deadlock));
    }
    if (config.isCheckEnabled("choice_determinism")) {
      verifiers.add(new ChoiceDeterminismVerifier());
    }
    if (config.isCheckEnabled("multicast")) {
      verifiers.add(new MulticastVerifier(projector));
    }
    strict = config.isStrictMode();
  }

  public VerificationSuite(List<ProtocolVerifier> verifiers, boolean strict) {
    this.verifiers = new ArrayList<ProtocolVerifier>(verifiers);
    this.strict = strict;
  }

  public List<ProtocolVerifier> getVerifiers() {
    return Collections.unmodifiableList(verifiers);
  }

  public VerificationReport verify(Cfg cfg) {
    List<VerificationResult> results = new ArrayList<VerificationResult>();
    for (ProtocolVerifier verifier : verifiers) {
      results.add(verifier.verify(cfg));
    }
    VerificationReport report = new VerificationReport(cfg.getName(), results, strict);
    LOG.info("Verified " + cfg.getName() + ": " + (report.isPassed() ? "passed" : "failed")
        + " with " + report.getErrorCount() + " errors and " + report.getWarningCount()
        + " warnings");
    return report;
  }

}
