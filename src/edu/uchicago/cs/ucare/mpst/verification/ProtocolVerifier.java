package edu.uchicago.cs.ucare.mpst.verification;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uchicago.cs.ucare.mpst.cfg.Cfg;

/**
 * One static analysis over a CFG. Implementations report findings as diagnostics and never
 * throw on a CFG produced by the builder.
 */
public abstract class ProtocolVerifier {

  protected final Logger LOG = LoggerFactory.getLogger(this.getClass());

  private final String name;

  protected ProtocolVerifier(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public VerificationResult verify(Cfg cfg) {
    List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    check(cfg, diagnostics);
    VerificationResult result = new VerificationResult(name, diagnostics);
    LOG.debug(cfg.getName() + " " + result);
    return result;
  }

  protected abstract void check(Cfg cfg, List<Diagnostic> diagnostics);

}
