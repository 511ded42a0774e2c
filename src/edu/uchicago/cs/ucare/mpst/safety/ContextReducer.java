package edu.uchicago.cs.ucare.mpst.safety;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uchicago.cs.ucare.mpst.projection.Cfsm;
import edu.uchicago.cs.ucare.mpst.transition.CallAction;
import edu.uchicago.cs.ucare.mpst.transition.CfsmTransition;
import edu.uchicago.cs.ucare.mpst.transition.LocalAction;
import edu.uchicago.cs.ucare.mpst.transition.ReceiveAction;
import edu.uchicago.cs.ucare.mpst.transition.SendAction;

/**
 * Synchronous reduction of typing contexts. A step fires one send together with the matching
 * receive of each of its receivers; afterwards every role whose state offers a single silent
 * transition and nothing else is advanced through it. A state offering several alternatives
 * that include silent ones stays put, and each of those alternatives is a step of its own: a
 * sub-protocol call fires jointly for all of its role arguments, a tau fires alone.
 */
public class ContextReducer {

  protected final static Logger LOG = LoggerFactory.getLogger(ContextReducer.class);

  private final CommunicationSelector selector;

  public ContextReducer() {
    this(CommunicationSelector.FIRST);
  }

  public ContextReducer(CommunicationSelector selector) {
    this.selector = selector;
  }

  /** Every role at its initial state, tau closed. */
  public TypingContext initialContext(Map<String, Cfsm> cfsms) {
    return tauClosure(TypingContext.of(cfsms));
  }

  public EnabledCommunications findEnabledCommunications(TypingContext context) {
    List<Communication> communications = new ArrayList<Communication>();
    for (String sender : context.getRoles()) {
      Cfsm cfsm = context.getCfsm(sender);
      for (CfsmTransition transition : cfsm.getOutgoing(context.getState(sender))) {
        if (transition.getAction().getType() != LocalAction.Type.SEND) {
          continue;
        }
        SendAction send = (SendAction) transition.getAction();
        List<List<CfsmTransition>> options = new ArrayList<List<CfsmTransition>>();
        boolean matched = true;
        for (String receiver : send.getTo()) {
          List<CfsmTransition> receives = context.hasRole(receiver)
              ? findMatchingReceives(context, receiver, sender, send.getMessage().getLabel())
              : new ArrayList<CfsmTransition>();
          if (receives.isEmpty()) {
            matched = false;
            break;
          }
          options.add(receives);
        }
        if (matched) {
          expand(sender, send, transition, options, 0, new ArrayList<CfsmTransition>(),
              communications);
        }
      }
    }
    return new EnabledCommunications(communications, context.isTerminal());
  }

  /**
   * Receives offered by {@code receiver} in its current state for {@code label} from
   * {@code sender}.
   */
  public static List<CfsmTransition> findMatchingReceives(TypingContext context, String receiver,
      String sender, String label) {
    List<CfsmTransition> result = new ArrayList<CfsmTransition>();
    Cfsm cfsm = context.getCfsm(receiver);
    for (CfsmTransition transition : cfsm.getOutgoing(context.getState(receiver))) {
      if (transition.getAction().getType() != LocalAction.Type.RECEIVE) {
        continue;
      }
      ReceiveAction receive = (ReceiveAction) transition.getAction();
      if (receive.getFrom().equals(sender) && receive.getMessage().getLabel().equals(label)) {
        result.add(transition);
      }
    }
    return result;
  }

  private void expand(String sender, SendAction send, CfsmTransition sendTransition,
      List<List<CfsmTransition>> options, int index, List<CfsmTransition> chosen,
      List<Communication> out) {
    if (index == options.size()) {
      out.add(new Communication(sender, send.getTo(), send.getMessage(), sendTransition, chosen));
      return;
    }
    for (CfsmTransition option : options.get(index)) {
      List<CfsmTransition> next = new ArrayList<CfsmTransition>(chosen);
      next.add(option);
      expand(sender, send, sendTransition, options, index + 1, next, out);
    }
  }

  /**
   * Fires one enabled communication picked by the selector.
   *
   * @throws IllegalStateException when nothing is enabled
   */
  public TypingContext reduce(TypingContext context) {
    EnabledCommunications enabled = findEnabledCommunications(context);
    if (enabled.getCommunications().isEmpty()) {
      throw new IllegalStateException("Cannot reduce " + (enabled.isTerminal() ? "terminal" : "stuck")
          + " context " + context);
    }
    return reduceBy(context, selector.select(enabled.getCommunications()));
  }

  public TypingContext reduceBy(TypingContext context, Communication communication) {
    Map<String, Integer> updates = new LinkedHashMap<String, Integer>();
    CfsmTransition send = communication.getSenderTransition();
    if (send.getFrom() != context.getState(communication.getSender())) {
      throw new IllegalArgumentException("Communication " + communication
          + " is not enabled in " + context);
    }
    updates.put(communication.getSender(), send.getTo());
    for (int i = 0; i < communication.getReceivers().size(); i++) {
      String receiver = communication.getReceivers().get(i);
      CfsmTransition receive = communication.getReceiverTransitions().get(i);
      if (receive.getFrom() != context.getState(receiver)) {
        throw new IllegalArgumentException("Communication " + communication
            + " is not enabled in " + context);
      }
      updates.put(receiver, receive.getTo());
    }
    return tauClosure(context.withStates(updates));
  }

  /** Distinct contexts reachable in one step. */
  public List<TypingContext> findAllSuccessors(TypingContext context) {
    Set<TypingContext> successors = new LinkedHashSet<TypingContext>();
    for (Communication communication : findEnabledCommunications(context).getCommunications()) {
      successors.add(reduceBy(context, communication));
    }
    successors.addAll(findSilentSteps(context));
    return new ArrayList<TypingContext>(successors);
  }

  /**
   * Contexts reached by taking one of the silent alternatives the closure left in place. A call
   * is only enabled when every role argument present in the context offers the same call.
   */
  public List<TypingContext> findSilentSteps(TypingContext context) {
    Set<TypingContext> steps = new LinkedHashSet<TypingContext>();
    for (String role : context.getRoles()) {
      for (CfsmTransition transition : context.getCfsm(role).getOutgoing(context.getState(role))) {
        LocalAction action = transition.getAction();
        if (!action.isSilent()) {
          continue;
        }
        Map<String, Integer> updates = new LinkedHashMap<String, Integer>();
        updates.put(role, transition.getTo());
        if (action.getType() == LocalAction.Type.CALL
            && !joinCall(context, role, (CallAction) action, updates)) {
          continue;
        }
        steps.add(tauClosure(context.withStates(updates)));
      }
    }
    return new ArrayList<TypingContext>(steps);
  }

  private static boolean joinCall(TypingContext context, String caller, CallAction call,
      Map<String, Integer> updates) {
    for (String participant : call.getRoleArguments()) {
      if (participant.equals(caller) || !context.hasRole(participant)) {
        continue;
      }
      CfsmTransition match = null;
      for (CfsmTransition transition : context.getCfsm(participant).getOutgoing(
          context.getState(participant))) {
        if (transition.getAction().getType() == LocalAction.Type.CALL
            && transition.getAction().getKey().equals(call.getKey())) {
          match = transition;
          break;
        }
      }
      if (match == null) {
        return false;
      }
      updates.put(participant, match.getTo());
    }
    return true;
  }

  public ExecutionResult executeToCompletion(TypingContext context, int maxSteps) {
    List<TypingContext> trace = new ArrayList<TypingContext>();
    List<Communication> fired = new ArrayList<Communication>();
    TypingContext current = context;
    trace.add(current);
    while (true) {
      EnabledCommunications enabled = findEnabledCommunications(current);
      if (enabled.isTerminal()) {
        LOG.debug("Reached terminal context " + current + " after " + fired.size() + " steps");
        return new ExecutionResult(ExecutionOutcome.TERMINAL, trace, fired);
      }
      List<TypingContext> silent = enabled.getCommunications().isEmpty()
          ? findSilentSteps(current) : new ArrayList<TypingContext>();
      if (enabled.isStuck() && silent.isEmpty()) {
        LOG.debug("Stuck at " + current + " after " + fired.size() + " steps");
        return new ExecutionResult(ExecutionOutcome.STUCK, trace, fired);
      }
      if (trace.size() - 1 >= maxSteps) {
        return new ExecutionResult(ExecutionOutcome.BUDGET_EXCEEDED, trace, fired);
      }
      if (silent.isEmpty()) {
        Communication communication = selector.select(enabled.getCommunications());
        current = reduceBy(current, communication);
        fired.add(communication);
      } else {
        current = silent.get(0);
      }
      trace.add(current);
    }
  }

  public TypingContext tauClosure(TypingContext context) {
    Map<String, Integer> updates = new LinkedHashMap<String, Integer>();
    for (String role : context.getRoles()) {
      int state = context.getState(role);
      int closed = closeState(context.getCfsm(role), state);
      if (closed != state) {
        updates.put(role, closed);
      }
    }
    return updates.isEmpty() ? context : context.withStates(updates);
  }

  // follows a silent transition only while it is the sole way out of the state
  static int closeState(Cfsm cfsm, int state) {
    Set<Integer> visited = new HashSet<Integer>();
    int current = state;
    visited.add(current);
    while (true) {
      List<CfsmTransition> out = cfsm.getOutgoing(current);
      if (out.size() != 1 || !out.get(0).getAction().isSilent()) {
        return current;
      }
      int next = out.get(0).getTo();
      if (!visited.add(next)) {
        return current;
      }
      current = next;
    }
  }

}
