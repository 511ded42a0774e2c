package edu.uchicago.cs.ucare.mpst.verification;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import edu.uchicago.cs.ucare.mpst.cfg.ActionKind;
import edu.uchicago.cs.ucare.mpst.cfg.ActionNode;
import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.Edge;
import edu.uchicago.cs.ucare.mpst.cfg.MessageAction;
import edu.uchicago.cs.ucare.mpst.cfg.Node;
import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;

/**
 * Graph helpers shared by the verifiers.
 */
public final class CfgAnalysis {

  private CfgAnalysis() {
  }

  public static Set<Integer> reachableFrom(Cfg cfg, int start) {
    Set<Integer> visited = new LinkedHashSet<Integer>();
    LinkedList<Integer> queue = new LinkedList<Integer>();
    visited.add(start);
    queue.add(start);
    while (!queue.isEmpty()) {
      int current = queue.removeFirst();
      for (Integer next : cfg.getSuccessors(current)) {
        if (visited.add(next)) {
          queue.add(next);
        }
      }
    }
    return visited;
  }

  /** Nodes from which some node of {@code targets} is reachable, targets included. */
  public static Set<Integer> canReach(Cfg cfg, Set<Integer> targets) {
    Set<Integer> visited = new LinkedHashSet<Integer>(targets);
    LinkedList<Integer> queue = new LinkedList<Integer>(targets);
    while (!queue.isEmpty()) {
      int current = queue.removeFirst();
      for (Edge edge : cfg.getIncoming(current)) {
        if (visited.add(edge.getFrom())) {
          queue.add(edge.getFrom());
        }
      }
    }
    return visited;
  }

  /**
   * Nodes reachable from {@code start} without passing through {@code boundary}.
   */
  public static Set<Integer> nodesUntil(Cfg cfg, int start, int boundary) {
    Set<Integer> visited = new LinkedHashSet<Integer>();
    if (start == boundary) {
      return visited;
    }
    LinkedList<Integer> queue = new LinkedList<Integer>();
    visited.add(start);
    queue.add(start);
    while (!queue.isEmpty()) {
      int current = queue.removeFirst();
      for (Integer next : cfg.getSuccessors(current)) {
        if (next != boundary && visited.add(next)) {
          queue.add(next);
        }
      }
    }
    return visited;
  }

  /**
   * Message actions that can fire first when control enters {@code start}, looking no further
   * than {@code boundary}.
   */
  public static List<ActionNode> firstMessages(Cfg cfg, int start, int boundary) {
    List<ActionNode> result = new ArrayList<ActionNode>();
    Set<Integer> visited = new LinkedHashSet<Integer>();
    LinkedList<Integer> stack = new LinkedList<Integer>();
    stack.push(start);
    while (!stack.isEmpty()) {
      int current = stack.pop();
      if (current == boundary || !visited.add(current)) {
        continue;
      }
      Node node = cfg.getNode(current);
      if (node.getKind() == NodeKind.ACTION) {
        ActionNode action = (ActionNode) node;
        if (action.getAction().getKind() == ActionKind.MESSAGE) {
          result.add(action);
          continue;
        }
      } else if (node.getKind() == NodeKind.CALL || node.getKind() == NodeKind.TERMINAL) {
        continue;
      }
      List<Integer> successors = cfg.getSuccessors(current);
      for (int i = successors.size() - 1; i >= 0; i--) {
        stack.push(successors.get(i));
      }
    }
    return result;
  }

  public static List<MessageAction> messages(Cfg cfg, Set<Integer> nodes) {
    List<MessageAction> result = new ArrayList<MessageAction>();
    for (Integer id : nodes) {
      Node node = cfg.getNode(id);
      if (node.getKind() == NodeKind.ACTION
          && ((ActionNode) node).getAction().getKind() == ActionKind.MESSAGE) {
        result.add((MessageAction) ((ActionNode) node).getAction());
      }
    }
    return result;
  }

  /**
   * Strongly connected components that contain a cycle (Tarjan).
   */
  public static List<List<Integer>> cyclicComponents(Cfg cfg) {
    Tarjan tarjan = new Tarjan(cfg);
    for (Node node : cfg.getNodes()) {
      if (!tarjan.index.containsKey(node.getId())) {
        tarjan.strongConnect(node.getId());
      }
    }
    List<List<Integer>> cyclic = new ArrayList<List<Integer>>();
    for (List<Integer> component : tarjan.components) {
      if (component.size() > 1 || cfg.getSuccessors(component.get(0)).contains(component.get(0))) {
        cyclic.add(component);
      }
    }
    return cyclic;
  }

  private static class Tarjan {

    final Cfg cfg;
    final Map<Integer, Integer> index = new HashMap<Integer, Integer>();
    final Map<Integer, Integer> lowlink = new HashMap<Integer, Integer>();
    final LinkedList<Integer> stack = new LinkedList<Integer>();
    final Set<Integer> onStack = new LinkedHashSet<Integer>();
    final List<List<Integer>> components = new ArrayList<List<Integer>>();
    int counter = 0;

    Tarjan(Cfg cfg) {
      this.cfg = cfg;
    }

    void strongConnect(int v) {
      index.put(v, counter);
      lowlink.put(v, counter);
      counter++;
      stack.push(v);
      onStack.add(v);
      for (Integer w : cfg.getSuccessors(v)) {
        if (!index.containsKey(w)) {
          strongConnect(w);
          lowlink.put(v, Math.min(lowlink.get(v), lowlink.get(w)));
        } else if (onStack.contains(w)) {
          lowlink.put(v, Math.min(lowlink.get(v), index.get(w)));
        }
      }
      if (lowlink.get(v).equals(index.get(v))) {
        List<Integer> component = new ArrayList<Integer>();
        int w;
        do {
          w = stack.pop();
          onStack.remove(w);
          component.add(w);
        } while (w != v);
        components.add(component);
      }
    }

  }

}
