package edu.uchicago.cs.ucare.mpst.verification;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import edu.uchicago.cs.ucare.mpst.cfg.ActionNode;
import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.Edge;
import edu.uchicago.cs.ucare.mpst.cfg.ForkNode;
import edu.uchicago.cs.ucare.mpst.cfg.MessageAction;
import edu.uchicago.cs.ucare.mpst.cfg.Node;
import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;

/**
 * Waits-for cycles between the branches of one parallel block. Branch X waits for branch Y
 * when a role that opens X only receives at the start of Y.
 */
public class ParallelDeadlockVerifier extends ProtocolVerifier {

  public ParallelDeadlockVerifier() {
    super("parallel-deadlock");
  }

  @Override
  protected void check(Cfg cfg, List<Diagnostic> diagnostics) {
    for (Node node : cfg.getNodes(NodeKind.FORK)) {
      ForkNode fork = (ForkNode) node;
      List<Edge> branches = cfg.getOutgoing(fork.getId());
      int n = branches.size();
      List<Set<String>> senders = new ArrayList<Set<String>>();
      List<Set<String>> receivers = new ArrayList<Set<String>>();
      List<List<MessageAction>> firsts = new ArrayList<List<MessageAction>>();
      for (Edge branch : branches) {
        Set<String> s = new HashSet<String>();
        Set<String> r = new HashSet<String>();
        List<MessageAction> actions = new ArrayList<MessageAction>();
        for (ActionNode first : CfgAnalysis.firstMessages(cfg, branch.getTo(), fork.getJoinId())) {
          MessageAction action = (MessageAction) first.getAction();
          actions.add(action);
          s.add(action.getFrom());
          r.addAll(action.getTo());
        }
        senders.add(s);
        receivers.add(r);
        firsts.add(actions);
      }
      boolean[][] waitsFor = new boolean[n][n];
      for (int x = 0; x < n; x++) {
        for (int y = 0; y < n; y++) {
          if (x == y) {
            continue;
          }
          for (MessageAction action : firsts.get(x)) {
            String role = action.getFrom();
            if (receivers.get(y).contains(role) && !senders.get(y).contains(role)) {
              waitsFor[x][y] = true;
            }
          }
        }
      }
      List<Integer> cycle = findCycle(waitsFor);
      if (!cycle.isEmpty()) {
        diagnostics.add(Diagnostic.error("Branches " + cycle + " of parallel block at "
            + fork + " wait for each other", Arrays.asList(fork.getId()),
            Collections.<String>emptyList()));
      }
    }
  }

  private static List<Integer> findCycle(boolean[][] waitsFor) {
    int n = waitsFor.length;
    int[] color = new int[n];
    for (int start = 0; start < n; start++) {
      List<Integer> path = new ArrayList<Integer>();
      if (color[start] == 0 && visit(start, waitsFor, color, path)) {
        return path;
      }
    }
    return Collections.emptyList();
  }

  // color: 0 unvisited, 1 on path, 2 done
  private static boolean visit(int v, boolean[][] waitsFor, int[] color, List<Integer> path) {
    color[v] = 1;
    path.add(v);
    for (int w = 0; w < waitsFor.length; w++) {
      if (!waitsFor[v][w]) {
        continue;
      }
      if (color[w] == 1) {
        path.subList(0, path.indexOf(w)).clear();
        return true;
      }
      if (color[w] == 0 && visit(w, waitsFor, color, path)) {
        return true;
      }
    }
    color[v] = 2;
    path.remove(path.size() - 1);
    return false;
  }

}
