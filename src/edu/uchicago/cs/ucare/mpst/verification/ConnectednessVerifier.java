package edu.uchicago.cs.ucare.mpst.verification;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import edu.uchicago.cs.ucare.mpst.cfg.ActionNode;
import edu.uchicago.cs.ucare.mpst.cfg.CallNode;
import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.Node;
import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;

/**
 * Every role takes part in at least one action or call.
 */
public class ConnectednessVerifier extends ProtocolVerifier {

  public ConnectednessVerifier() {
    super("connectedness");
  }

  @Override
  protected void check(Cfg cfg, List<Diagnostic> diagnostics) {
    Set<String> active = new HashSet<String>();
    for (Node node : cfg.getNodes()) {
      if (node.getKind() == NodeKind.ACTION) {
        active.addAll(((ActionNode) node).getAction().getRoles());
      } else if (node.getKind() == NodeKind.CALL) {
        active.addAll(((CallNode) node).getRoleArguments());
      }
    }
    for (String role : cfg.getRoles()) {
      if (!active.contains(role)) {
        diagnostics.add(Diagnostic.error("Role " + role + " never takes part in " + cfg.getName(),
            Collections.<Integer>emptyList(), Collections.singletonList(role)));
      }
    }
  }

}
