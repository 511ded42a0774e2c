package edu.uchicago.cs.ucare.mpst.verification;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import edu.uchicago.cs.ucare.mpst.cfg.ActionKind;
import edu.uchicago.cs.ucare.mpst.cfg.ActionNode;
import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.MessageAction;
import edu.uchicago.cs.ucare.mpst.cfg.Node;
import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;
import edu.uchicago.cs.ucare.mpst.projection.Cfsm;
import edu.uchicago.cs.ucare.mpst.projection.ProjectionResult;
import edu.uchicago.cs.ucare.mpst.projection.Projector;
import edu.uchicago.cs.ucare.mpst.transition.CfsmTransition;
import edu.uchicago.cs.ucare.mpst.transition.LocalAction;
import edu.uchicago.cs.ucare.mpst.transition.ReceiveAction;

/**
 * Receiver sets of multicasts. A sender among its own receivers is an error; repeated
 * receivers and receivers whose local machine never takes the message are warnings.
 */
public class MulticastVerifier extends ProtocolVerifier {

  private final Projector projector;

  public MulticastVerifier() {
    this(new Projector());
  }

  public MulticastVerifier(Projector projector) {
    super("multicast");
    this.projector = projector;
  }

  @Override
  protected void check(Cfg cfg, List<Diagnostic> diagnostics) {
    ProjectionResult projection = null;
    for (Node node : cfg.getNodes(NodeKind.ACTION)) {
      ActionNode actionNode = (ActionNode) node;
      if (actionNode.getAction().getKind() != ActionKind.MESSAGE) {
        continue;
      }
      MessageAction action = (MessageAction) actionNode.getAction();
      List<Integer> nodes = Arrays.asList(node.getId());
      if (action.getTo().isEmpty()) {
        diagnostics.add(Diagnostic.error(action + " has no receiver", nodes,
            Arrays.asList(action.getFrom())));
        continue;
      }
      if (action.getTo().contains(action.getFrom())) {
        diagnostics.add(Diagnostic.error(action.getFrom() + " sends " + action.getMessage()
            + " to itself", nodes, Arrays.asList(action.getFrom())));
      }
      if (!action.isMulticast()) {
        continue;
      }
      Set<String> distinct = new HashSet<String>();
      for (String receiver : action.getTo()) {
        if (!distinct.add(receiver)) {
          diagnostics.add(Diagnostic.warning(receiver + " is listed twice in " + action, nodes,
              Arrays.asList(receiver)));
        }
      }
      if (projection == null) {
        projection = projector.projectAll(cfg);
      }
      for (String receiver : distinct) {
        if (receiver.equals(action.getFrom())) {
          continue;
        }
        Cfsm cfsm = projection.getCfsm(receiver);
        if (cfsm == null) {
          diagnostics.add(Diagnostic.warning("Cannot check " + receiver + " for " + action
              + ", its projection failed", nodes, Arrays.asList(receiver)));
        } else if (!receives(cfsm, action)) {
          diagnostics.add(Diagnostic.warning(receiver + " never receives " + action.getMessage()
              + " from " + action.getFrom(), nodes, Arrays.asList(receiver)));
        }
      }
    }
  }

  private static boolean receives(Cfsm cfsm, MessageAction action) {
    for (CfsmTransition transition : cfsm.getTransitions()) {
      if (transition.getAction().getType() != LocalAction.Type.RECEIVE) {
        continue;
      }
      ReceiveAction receive = (ReceiveAction) transition.getAction();
      if (receive.getFrom().equals(action.getFrom())
          && receive.getMessage().equals(action.getMessage())) {
        return true;
      }
    }
    return false;
  }

}
