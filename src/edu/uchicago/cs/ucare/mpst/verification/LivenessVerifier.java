package edu.uchicago.cs.ucare.mpst.verification;

import java.util.List;

import edu.uchicago.cs.ucare.mpst.cfg.Cfg;

/**
 * Progress together with deadlock-freedom.
 */
public class LivenessVerifier extends ProtocolVerifier {

  private final ProgressVerifier progress;
  private final DeadlockVerifier deadlock;

  public LivenessVerifier(ProgressVerifier progress, DeadlockVerifier deadlock) {
    super("liveness");
    this.progress = progress;
    this.deadlock = deadlock;
  }

  @Override
  protected void check(Cfg cfg, List<Diagnostic> diagnostics) {
    diagnostics.addAll(progress.verify(cfg).getDiagnostics());
    diagnostics.addAll(deadlock.verify(cfg).getDiagnostics());
  }

}
