package edu.uchicago.cs.ucare.mpst.verification;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.uchicago.cs.ucare.mpst.cfg.ActionNode;
import edu.uchicago.cs.ucare.mpst.cfg.BranchNode;
import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.Edge;
import edu.uchicago.cs.ucare.mpst.cfg.MessageAction;
import edu.uchicago.cs.ucare.mpst.cfg.Node;
import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;

/**
 * Every branch of a choice opens with a message from the deciding role, and no two branches
 * open with the same message.
 */
public class ChoiceDeterminismVerifier extends ProtocolVerifier {

  public ChoiceDeterminismVerifier() {
    super("choice-determinism");
  }

  @Override
  protected void check(Cfg cfg, List<Diagnostic> diagnostics) {
    for (Node node : cfg.getNodes(NodeKind.BRANCH)) {
      BranchNode branch = (BranchNode) node;
      String decider = branch.getDecider();
      List<Edge> edges = cfg.getOutgoing(branch.getId());
      Map<String, Integer> openers = new HashMap<String, Integer>();
      int silentBranches = 0;
      for (int i = 0; i < edges.size(); i++) {
        List<ActionNode> firsts = CfgAnalysis.firstMessages(cfg, edges.get(i).getTo(),
            branch.getMergeId());
        if (firsts.isEmpty()) {
          silentBranches++;
          diagnostics.add(Diagnostic.warning("Branch " + i + " of " + branch
              + " starts with no message", Arrays.asList(branch.getId()), Arrays.asList(decider)));
          continue;
        }
        for (ActionNode first : firsts) {
          MessageAction action = (MessageAction) first.getAction();
          if (!action.getFrom().equals(decider)) {
            diagnostics.add(Diagnostic.error("Branch " + i + " of " + branch + " starts with "
                + action + " which " + decider + " does not send",
                Arrays.asList(branch.getId(), first.getId()),
                Arrays.asList(decider, action.getFrom())));
          }
          String opener = action.getFrom() + "->" + String.join(",", action.getTo()) + ":"
              + action.getMessage().getLabel();
          Integer other = openers.get(opener);
          if (other != null && other != i) {
            diagnostics.add(Diagnostic.error("Branches " + other + " and " + i + " of " + branch
                + " both start with " + opener, Arrays.asList(branch.getId(), first.getId()),
                new ArrayList<String>(action.getRoles())));
          } else {
            openers.put(opener, i);
          }
        }
      }
      if (silentBranches > 1) {
        diagnostics.add(Diagnostic.error(silentBranches + " branches of " + branch
            + " cannot be told apart", Arrays.asList(branch.getId()), Arrays.asList(decider)));
      }
    }
  }

}
