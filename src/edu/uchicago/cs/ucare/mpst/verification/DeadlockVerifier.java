package edu.uchicago.cs.ucare.mpst.verification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.projection.ProjectionError;
import edu.uchicago.cs.ucare.mpst.projection.ProjectionResult;
import edu.uchicago.cs.ucare.mpst.projection.Projector;
import edu.uchicago.cs.ucare.mpst.safety.ContextReducer;
import edu.uchicago.cs.ucare.mpst.safety.SafetyCheckResult;
import edu.uchicago.cs.ucare.mpst.safety.SafetyChecker;
import edu.uchicago.cs.ucare.mpst.safety.SafetyVerdict;
import edu.uchicago.cs.ucare.mpst.safety.TypingContext;

/**
 * Cycles in which no node ever communicates, plus a search of the projected machines'
 * reachable contexts for stuck ones and for sends the peer refuses.
 */
public class DeadlockVerifier extends ProtocolVerifier {

  private final Projector projector;
  private final ContextReducer reducer;
  private final int maxStates;

  public DeadlockVerifier() {
    this(new Projector(), new ContextReducer(), SafetyChecker.DEFAULT_MAX_STATES);
  }

  public DeadlockVerifier(Projector projector, ContextReducer reducer, int maxStates) {
    super("deadlock");
    this.projector = projector;
    this.reducer = reducer;
    this.maxStates = maxStates;
  }

  @Override
  protected void check(Cfg cfg, List<Diagnostic> diagnostics) {
    checkSilentCycles(cfg, diagnostics);
    ProjectionResult projection = projector.projectAll(cfg);
    for (ProjectionError error : projection.getErrors()) {
      diagnostics.add(Diagnostic.error("Cannot project onto " + error.getRole() + ": "
          + error.getMessage(), Collections.<Integer>emptyList(),
          Collections.singletonList(error.getRole())));
    }
    if (!projection.isSuccessful()) {
      return;
    }
    TypingContext initial = reducer.initialContext(projection.getCfsms());
    SafetyCheckResult safety = new SafetyChecker(reducer, maxStates).check(initial);
    if (safety.getVerdict() == SafetyVerdict.UNSAFE) {
      diagnostics.add(Diagnostic.error("Unmatched send: " + safety.getViolation().getMessage(),
          Collections.<Integer>emptyList(), roles(safety)));
    } else if (safety.getVerdict() == SafetyVerdict.BUDGET_EXCEEDED) {
      diagnostics.add(Diagnostic.warning("Safety search exceeded " + maxStates + " contexts",
          Collections.<Integer>emptyList(), Collections.<String>emptyList()));
    }
    checkStuckContexts(initial, diagnostics);
  }

  private void checkSilentCycles(Cfg cfg, List<Diagnostic> diagnostics) {
    for (List<Integer> component : CfgAnalysis.cyclicComponents(cfg)) {
      boolean communicates = false;
      for (Integer id : component) {
        if (cfg.getNode(id).isCommunicating()) {
          communicates = true;
          break;
        }
      }
      if (!communicates) {
        List<Integer> nodes = new ArrayList<Integer>(component);
        Collections.sort(nodes);
        diagnostics.add(Diagnostic.error("Cycle over " + nodes + " never communicates", nodes,
            Collections.<String>emptyList()));
      }
    }
  }

  /**
   * Breadth-first search for a reachable context where nothing can fire although some role has
   * not finished. Reports the first one found.
   */
  void checkStuckContexts(TypingContext initial, List<Diagnostic> diagnostics) {
    Set<TypingContext> visited = new HashSet<TypingContext>();
    LinkedList<TypingContext> queue = new LinkedList<TypingContext>();
    visited.add(initial);
    queue.add(initial);
    while (!queue.isEmpty()) {
      TypingContext current = queue.removeFirst();
      List<TypingContext> successors = reducer.findAllSuccessors(current);
      if (successors.isEmpty() && !current.isTerminal()) {
        List<String> waiting = new ArrayList<String>();
        for (String role : current.getRoles()) {
          if (!current.getCfsm(role).isTerminal(current.getState(role))) {
            waiting.add(role);
          }
        }
        diagnostics.add(Diagnostic.error("Stuck at " + current + ", waiting: " + waiting,
            Collections.<Integer>emptyList(), waiting));
        return;
      }
      for (TypingContext next : successors) {
        if (visited.add(next)) {
          if (visited.size() > maxStates) {
            diagnostics.add(Diagnostic.warning("Deadlock search exceeded " + maxStates
                + " contexts", Collections.<Integer>emptyList(), Collections.<String>emptyList()));
            return;
          }
          queue.add(next);
        }
      }
    }
  }

  private static List<String> roles(SafetyCheckResult safety) {
    List<String> roles = new ArrayList<String>();
    roles.add(safety.getViolation().getSender());
    roles.add(safety.getViolation().getReceiver());
    return roles;
  }

}
