package edu.uchicago.cs.ucare.mpst.verification;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.Node;
import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;

/**
 * A reachable node is blocked when no path from it reaches a communicating node or the end of
 * the protocol.
 */
public class ProgressVerifier extends ProtocolVerifier {

  public ProgressVerifier() {
    super("progress");
  }

  @Override
  protected void check(Cfg cfg, List<Diagnostic> diagnostics) {
    Set<Integer> goals = new HashSet<Integer>();
    for (Node node : cfg.getNodes()) {
      if (node.isCommunicating() || node.getKind() == NodeKind.TERMINAL) {
        goals.add(node.getId());
      }
    }
    Set<Integer> live = CfgAnalysis.canReach(cfg, goals);
    for (Integer id : CfgAnalysis.reachableFrom(cfg, cfg.getInitialId())) {
      Node node = cfg.getNode(id);
      if (node.getKind() != NodeKind.TERMINAL && !live.contains(id)) {
        diagnostics.add(Diagnostic.error(node + " can never make progress", Arrays.asList(id),
            Collections.<String>emptyList()));
      }
    }
  }

}
