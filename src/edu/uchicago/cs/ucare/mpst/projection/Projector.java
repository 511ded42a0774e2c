package edu.uchicago.cs.ucare.mpst.projection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uchicago.cs.ucare.mpst.cfg.Action;
import edu.uchicago.cs.ucare.mpst.cfg.ActionKind;
import edu.uchicago.cs.ucare.mpst.cfg.ActionNode;
import edu.uchicago.cs.ucare.mpst.cfg.CallNode;
import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.Marking;
import edu.uchicago.cs.ucare.mpst.cfg.MessageAction;
import edu.uchicago.cs.ucare.mpst.cfg.Move;
import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;
import edu.uchicago.cs.ucare.mpst.cfg.TokenGame;
import edu.uchicago.cs.ucare.mpst.transition.CallAction;
import edu.uchicago.cs.ucare.mpst.transition.CfsmTransition;
import edu.uchicago.cs.ucare.mpst.transition.LocalAction;
import edu.uchicago.cs.ucare.mpst.transition.ReceiveAction;
import edu.uchicago.cs.ucare.mpst.transition.SendAction;

/**
 * Derives the local state machine of a role from a global CFG.
 *
 * The CFG is executed as a token game and every move is labelled with what the role observes
 * of it. Moves the role does not take part in are silent and get collapsed, then states with
 * identical futures are merged. Whatever non-determinism survives the merge is a projection
 * error.
 */
public class Projector {

  protected final static Logger LOG = LoggerFactory.getLogger(Projector.class);

  public static final int DEFAULT_MAX_CONFIGURATIONS = 100000;

  private final int maxConfigurations;

  public Projector() {
    this(DEFAULT_MAX_CONFIGURATIONS);
  }

  public Projector(int maxConfigurations) {
    this.maxConfigurations = maxConfigurations;
  }

  public Cfsm project(Cfg cfg, String role) throws ProjectionException {
    if (!cfg.getRoles().contains(role)) {
      throw new ProjectionException(role, ProjectionErrorKind.ROLE_NOT_FOUND,
          "Role " + role + " is not part of protocol " + cfg.getName());
    }
    Exploration exploration = explore(cfg, role);
    Collapsed collapsed = collapse(exploration);
    int[] blocks = minimize(collapsed);
    Cfsm cfsm = buildMachine(cfg, role, exploration, collapsed, blocks);
    checkDeterminism(cfsm);
    LOG.debug("Projected " + cfg.getName() + " onto " + role + ": "
        + cfsm.getStates().size() + " states, " + cfsm.getTransitions().size()
        + " transitions from " + exploration.markings.size() + " markings");
    return cfsm;
  }

  /**
   * Projects every role. A role that fails is reported in the result and skipped.
   */
  public ProjectionResult projectAll(Cfg cfg) {
    Map<String, Cfsm> cfsms = new LinkedHashMap<String, Cfsm>();
    List<ProjectionError> errors = new ArrayList<ProjectionError>();
    for (String role : cfg.getRoles()) {
      try {
        cfsms.put(role, project(cfg, role));
      } catch (ProjectionException e) {
        LOG.warn("Projection of " + cfg.getName() + " onto " + role + " failed: " + e.getMessage());
        errors.add(e.toError());
      }
    }
    return new ProjectionResult(cfsms, errors);
  }

  /**
   * What {@code role} observes of a move, or null when the move is silent for it.
   */
  public static LocalAction observe(Move move, String role) {
    switch (move.getKind()) {
    case ACTION: {
      Action action = ((ActionNode) move.getNode()).getAction();
      if (action.getKind() != ActionKind.MESSAGE) {
        return null;
      }
      MessageAction message = (MessageAction) action;
      if (message.getFrom().equals(role)) {
        return new SendAction(message.getTo(), message.getMessage());
      }
      if (message.getTo().contains(role)) {
        return new ReceiveAction(message.getFrom(), message.getMessage());
      }
      return null;
    }
    case CALL: {
      CallNode call = (CallNode) move.getNode();
      if (call.getRoleArguments().contains(role)) {
        return new CallAction(call.getProtocol(), call.getRoleArguments());
      }
      return null;
    }
    default:
      return null;
    }
  }

  private Exploration explore(Cfg cfg, String role) throws ProjectionException {
    TokenGame game = new TokenGame(cfg);
    Exploration exploration = new Exploration();
    Marking initial = game.initialMarking();
    exploration.add(initial, cfg.getInitialId(), game.isFinal(initial));
    LinkedList<Integer> queue = new LinkedList<Integer>();
    queue.add(0);
    while (!queue.isEmpty()) {
      int current = queue.removeFirst();
      Marking marking = exploration.markings.get(current);
      for (Move move : game.moves(marking)) {
        Marking target = move.getTarget();
        Integer targetIndex = exploration.index.get(target);
        if (targetIndex == null) {
          if (exploration.markings.size() >= maxConfigurations) {
            throw new ProjectionException(role, ProjectionErrorKind.BUDGET_EXCEEDED,
                "More than " + maxConfigurations + " markings while projecting "
                    + cfg.getName() + " onto " + role);
          }
          int landing = move.getLanding() < 0 ? move.getNode().getId() : move.getLanding();
          targetIndex = exploration.add(target, landing, game.isFinal(target));
          queue.add(targetIndex);
        }
        exploration.steps.get(current).add(new Step(observe(move, role), targetIndex));
      }
    }
    return exploration;
  }

  // silent closure of every anchor: the initial marking and every target of a visible step
  private Collapsed collapse(Exploration exploration) {
    Collapsed collapsed = new Collapsed();
    collapsed.anchorOf(0);
    for (int a = 0; a < collapsed.anchors.size(); a++) {
      int start = collapsed.anchors.get(a);
      boolean isFinal = false;
      List<Step> arcs = new ArrayList<Step>();
      Set<String> seenArcs = new HashSet<String>();
      Set<Integer> visited = new HashSet<Integer>();
      LinkedList<Integer> stack = new LinkedList<Integer>();
      stack.add(start);
      visited.add(start);
      while (!stack.isEmpty()) {
        int config = stack.removeFirst();
        if (exploration.finals.get(config)) {
          isFinal = true;
        }
        for (Step step : exploration.steps.get(config)) {
          if (step.action == null) {
            if (visited.add(step.target)) {
              stack.add(step.target);
            }
          } else {
            int targetAnchor = collapsed.anchorOf(step.target);
            if (seenArcs.add(step.action.getKey() + "->" + targetAnchor)) {
              arcs.add(new Step(step.action, targetAnchor));
            }
          }
        }
      }
      collapsed.finals.add(isFinal);
      collapsed.arcs.add(arcs);
    }
    return collapsed;
  }

  // partition refinement up to strong bisimulation
  private int[] minimize(Collapsed collapsed) {
    int n = collapsed.anchors.size();
    int[] blocks = new int[n];
    for (int s = 0; s < n; s++) {
      blocks[s] = collapsed.finals.get(s) ? 1 : 0;
    }
    int blockCount = -1;
    while (true) {
      Map<String, Integer> signatures = new HashMap<String, Integer>();
      int[] next = new int[n];
      for (int s = 0; s < n; s++) {
        TreeSet<String> arcKeys = new TreeSet<String>();
        for (Step arc : collapsed.arcs.get(s)) {
          arcKeys.add(arc.action.getKey() + "->" + blocks[arc.target]);
        }
        String signature = blocks[s] + "|" + arcKeys;
        Integer block = signatures.get(signature);
        if (block == null) {
          block = signatures.size();
          signatures.put(signature, block);
        }
        next[s] = block;
      }
      blocks = next;
      if (signatures.size() == blockCount) {
        return blocks;
      }
      blockCount = signatures.size();
    }
  }

  private Cfsm buildMachine(Cfg cfg, String role, Exploration exploration, Collapsed collapsed,
      int[] blocks) {
    // representative anchor of each block, the first one discovered
    Map<Integer, Integer> representative = new HashMap<Integer, Integer>();
    for (int s = 0; s < blocks.length; s++) {
      if (!representative.containsKey(blocks[s])) {
        representative.put(blocks[s], s);
      }
    }

    // number blocks breadth first from the initial one, arcs in action order
    Map<Integer, Integer> stateOf = new HashMap<Integer, Integer>();
    List<Integer> order = new ArrayList<Integer>();
    LinkedList<Integer> queue = new LinkedList<Integer>();
    stateOf.put(blocks[0], 0);
    order.add(blocks[0]);
    queue.add(blocks[0]);
    Map<Integer, List<Step>> sortedArcs = new HashMap<Integer, List<Step>>();
    while (!queue.isEmpty()) {
      int block = queue.removeFirst();
      List<Step> arcs = new ArrayList<Step>(collapsed.arcs.get(representative.get(block)));
      Collections.sort(arcs, new Comparator<Step>() {
        public int compare(Step o1, Step o2) {
          return LocalAction.COMPARATOR.compare(o1.action, o2.action);
        }
      });
      sortedArcs.put(block, arcs);
      for (Step arc : arcs) {
        int targetBlock = blocks[arc.target];
        if (!stateOf.containsKey(targetBlock)) {
          stateOf.put(targetBlock, order.size());
          order.add(targetBlock);
          queue.add(targetBlock);
        }
      }
    }

    List<CfsmState> states = new ArrayList<CfsmState>();
    List<CfsmTransition> transitions = new ArrayList<CfsmTransition>();
    Set<Integer> terminals = new TreeSet<Integer>();
    for (int stateId = 0; stateId < order.size(); stateId++) {
      int block = order.get(stateId);
      int anchor = representative.get(block);
      Set<String> seen = new HashSet<String>();
      List<Step> outgoing = new ArrayList<Step>();
      for (Step arc : sortedArcs.get(block)) {
        int target = stateOf.get(blocks[arc.target]);
        if (seen.add(arc.action.getKey() + "->" + target)) {
          outgoing.add(arc);
          transitions.add(new CfsmTransition(transitions.size(), stateId, target, arc.action));
        }
      }
      boolean isFinal = collapsed.finals.get(anchor);
      if (isFinal) {
        terminals.add(stateId);
      }
      int sourceNode = exploration.landings.get(collapsed.anchors.get(anchor));
      NodeKind sourceKind = cfg.getNode(sourceNode).getKind();
      states.add(new CfsmState(stateId, kindOf(stateId, outgoing, isFinal, sourceKind),
          sourceNode, sourceKind));
    }
    return new Cfsm(role, cfg.getName(), states, transitions, 0, terminals);
  }

  private static StateKind kindOf(int stateId, List<Step> outgoing, boolean isFinal,
      NodeKind sourceKind) {
    if (stateId == 0) {
      return StateKind.INITIAL;
    }
    if (outgoing.isEmpty()) {
      return isFinal ? StateKind.TERMINAL : StateKind.mirror(sourceKind);
    }
    if (outgoing.size() > 1) {
      return StateKind.CHOICE;
    }
    switch (outgoing.get(0).action.getType()) {
    case SEND:
      return StateKind.SEND;
    case RECEIVE:
      return StateKind.RECEIVE;
    case CALL:
      return StateKind.CALL;
    default:
      return StateKind.mirror(sourceKind);
    }
  }

  private void checkDeterminism(Cfsm cfsm) throws ProjectionException {
    for (CfsmState state : cfsm.getStates()) {
      Map<String, Integer> targets = new HashMap<String, Integer>();
      for (CfsmTransition transition : cfsm.getOutgoing(state.getId())) {
        String key = transition.getAction().getObservableKey();
        Integer previous = targets.get(key);
        if (previous != null && previous != transition.getTo()) {
          throw new ProjectionException(cfsm.getRole(), ProjectionErrorKind.NON_DETERMINISTIC,
              "Role " + cfsm.getRole() + " cannot tell apart " + key + " to s" + previous
                  + " and to s" + transition.getTo() + " at s" + state.getId());
        }
        targets.put(key, transition.getTo());
      }
    }
  }

  private static class Step {

    final LocalAction action;
    final int target;

    Step(LocalAction action, int target) {
      this.action = action;
      this.target = target;
    }

  }

  private static class Exploration {

    final List<Marking> markings = new ArrayList<Marking>();
    final Map<Marking, Integer> index = new HashMap<Marking, Integer>();
    final List<List<Step>> steps = new ArrayList<List<Step>>();
    final List<Integer> landings = new ArrayList<Integer>();
    final List<Boolean> finals = new ArrayList<Boolean>();

    int add(Marking marking, int landing, boolean isFinal) {
      int id = markings.size();
      markings.add(marking);
      index.put(marking, id);
      steps.add(new ArrayList<Step>());
      landings.add(landing);
      finals.add(isFinal);
      return id;
    }

  }

  private static class Collapsed {

    final List<Integer> anchors = new ArrayList<Integer>();
    final Map<Integer, Integer> anchorIndex = new HashMap<Integer, Integer>();
    final List<Boolean> finals = new ArrayList<Boolean>();
    final List<List<Step>> arcs = new ArrayList<List<Step>>();

    int anchorOf(int config) {
      Integer anchor = anchorIndex.get(config);
      if (anchor == null) {
        anchor = anchors.size();
        anchors.add(config);
        anchorIndex.put(config, anchor);
      }
      return anchor;
    }

  }

}
