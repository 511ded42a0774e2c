package edu.uchicago.cs.ucare.mpst.verification;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.Edge;
import edu.uchicago.cs.ucare.mpst.cfg.EdgeKind;
import edu.uchicago.cs.ucare.mpst.cfg.JoinNode;
import edu.uchicago.cs.ucare.mpst.cfg.Node;
import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;

/**
 * Shape invariants of a CFG.
 */
public class StructuralVerifier extends ProtocolVerifier {

  public StructuralVerifier() {
    super("structure");
  }

  @Override
  protected void check(Cfg cfg, List<Diagnostic> diagnostics) {
    List<String> noRoles = Collections.emptyList();
    if (cfg.getNodes(NodeKind.INITIAL).size() != 1 || cfg.getNodes(NodeKind.TERMINAL).size() != 1) {
      diagnostics.add(Diagnostic.error("CFG needs exactly one initial and one terminal node",
          Collections.<Integer>emptyList(), noRoles));
    }
    for (Node node : cfg.getNodes()) {
      int out = cfg.getOutgoing(node.getId()).size();
      if (node.getKind() != NodeKind.TERMINAL && out == 0) {
        diagnostics.add(Diagnostic.error(node + " has no outgoing edge",
            Arrays.asList(node.getId()), noRoles));
      }
      if ((node.getKind() == NodeKind.BRANCH || node.getKind() == NodeKind.FORK) && out < 2) {
        diagnostics.add(Diagnostic.error(node + " has fewer than two outgoing edges",
            Arrays.asList(node.getId()), noRoles));
      }
      if (node.getKind() == NodeKind.JOIN) {
        JoinNode join = (JoinNode) node;
        int in = cfg.getIncoming(join.getId()).size();
        if (in != join.getBranchCount()) {
          diagnostics.add(Diagnostic.error(node + " expects " + join.getBranchCount()
              + " branches but " + in + " reach it", Arrays.asList(node.getId()), noRoles));
        }
      }
    }
    for (Edge edge : cfg.getEdges()) {
      if (edge.getKind() != EdgeKind.CONTINUE) {
        continue;
      }
      Node target = cfg.getNode(edge.getTo());
      if (target.getKind() != NodeKind.RECURSION || target.getId() > edge.getFrom()) {
        diagnostics.add(Diagnostic.error("Continue edge " + edge
            + " does not lead back to an earlier recursion header",
            Arrays.asList(edge.getFrom(), edge.getTo()), noRoles));
      }
    }
    Set<Integer> reachable = CfgAnalysis.reachableFrom(cfg, cfg.getInitialId());
    for (Node node : cfg.getNodes()) {
      if (!reachable.contains(node.getId())) {
        diagnostics.add(Diagnostic.warning(node + " is unreachable", Arrays.asList(node.getId()),
            noRoles));
      }
    }
  }

}
