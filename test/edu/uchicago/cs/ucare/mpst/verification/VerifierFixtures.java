package edu.uchicago.cs.ucare.mpst.verification;

import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.cont;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.protocol;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.rec;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.roles;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.send;

import edu.uchicago.cs.ucare.mpst.ast.Protocol;
import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.CfgBuildException;
import edu.uchicago.cs.ucare.mpst.cfg.CfgBuilder;
import edu.uchicago.cs.ucare.mpst.cfg.NodeIdAllocator;
import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;

final class VerifierFixtures {

  private VerifierFixtures() {
  }

  static Cfg build(Protocol protocol) throws CfgBuildException {
    return new CfgBuilder(new NodeIdAllocator()).build(protocol, ProtocolLibrary.registry());
  }

  /** One message, then a loop that never communicates again. */
  static Protocol spin() {
    return protocol("Spin", roles("A", "B"), send("A", "B", "x"), rec("X", cont("X")));
  }

  static boolean mentions(VerificationResult result, String text) {
    for (Diagnostic diagnostic : result.getDiagnostics()) {
      if (diagnostic.getMessage().contains(text)) {
        return true;
      }
    }
    return false;
  }

}
