package edu.uchicago.cs.ucare.mpst.safety;

import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uchicago.cs.ucare.mpst.projection.Cfsm;
import edu.uchicago.cs.ucare.mpst.transition.CfsmTransition;
import edu.uchicago.cs.ucare.mpst.transition.LocalAction;
import edu.uchicago.cs.ucare.mpst.transition.ReceiveAction;
import edu.uchicago.cs.ucare.mpst.transition.SendAction;

/**
 * Breadth-first search over the contexts reachable from a starting context. Each context must
 * satisfy [S-⊕&]: when a role can send to a peer that is waiting for a message from it, the
 * peer accepts that label.
 */
public class SafetyChecker {

  protected final static Logger LOG = LoggerFactory.getLogger(SafetyChecker.class);

  public static final int DEFAULT_MAX_STATES = 100000;

  private final ContextReducer reducer;
  private final int maxStates;

  public SafetyChecker() {
    this(new ContextReducer(), DEFAULT_MAX_STATES);
  }

  public SafetyChecker(ContextReducer reducer, int maxStates) {
    this.reducer = reducer;
    this.maxStates = maxStates;
  }

  public SafetyCheckResult check(TypingContext context) {
    Set<TypingContext> visited = new HashSet<TypingContext>();
    LinkedList<TypingContext> queue = new LinkedList<TypingContext>();
    visited.add(context);
    queue.add(context);
    int explored = 0;
    while (!queue.isEmpty()) {
      TypingContext current = queue.removeFirst();
      explored++;
      SafetyViolation violation = checkContext(current);
      if (violation != null) {
        LOG.info("Unsafe after " + explored + " contexts: " + violation.getMessage());
        return new SafetyCheckResult(SafetyVerdict.UNSAFE, violation, explored);
      }
      for (TypingContext successor : reducer.findAllSuccessors(current)) {
        if (visited.add(successor)) {
          if (visited.size() > maxStates) {
            LOG.warn("Safety check gave up after " + maxStates + " contexts");
            return new SafetyCheckResult(SafetyVerdict.BUDGET_EXCEEDED, null, explored);
          }
          queue.add(successor);
        }
      }
    }
    LOG.debug("Safe, " + explored + " contexts explored");
    return new SafetyCheckResult(SafetyVerdict.SAFE, null, explored);
  }

  /**
   * Rule [S-⊕&] on a single context, null when it holds.
   */
  public SafetyViolation checkContext(TypingContext context) {
    for (String sender : context.getRoles()) {
      int senderState = context.getState(sender);
      Cfsm cfsm = context.getCfsm(sender);
      for (CfsmTransition transition : cfsm.getOutgoing(senderState)) {
        if (transition.getAction().getType() != LocalAction.Type.SEND) {
          continue;
        }
        SendAction send = (SendAction) transition.getAction();
        String label = send.getMessage().getLabel();
        for (String receiver : send.getTo()) {
          if (!context.hasRole(receiver)) {
            return new SafetyViolation(sender, receiver, label, senderState, -1, context);
          }
          if (isReceivingFrom(context, receiver, sender)
              && ContextReducer.findMatchingReceives(context, receiver, sender, label).isEmpty()) {
            return new SafetyViolation(sender, receiver, label, senderState,
                context.getState(receiver), context);
          }
        }
      }
    }
    return null;
  }

  private static boolean isReceivingFrom(TypingContext context, String receiver, String sender) {
    List<CfsmTransition> out = context.getCfsm(receiver).getOutgoing(context.getState(receiver));
    for (CfsmTransition transition : out) {
      LocalAction action = transition.getAction();
      if (action.getType() == LocalAction.Type.RECEIVE
          && ((ReceiveAction) action).getFrom().equals(sender)) {
        return true;
      }
    }
    return false;
  }

}
