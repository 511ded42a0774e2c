package edu.uchicago.cs.ucare.mpst.cfg;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Execution semantics of a {@link Cfg} in terms of markings. Parallel branches interleave; a
 * join fires once all of its branches have delivered their token.
 */
public class TokenGame {

  private final Cfg cfg;

  public TokenGame(Cfg cfg) {
    this.cfg = cfg;
  }

  public Cfg getCfg() {
    return cfg;
  }

  public Marking initialMarking() {
    return Marking.of(cfg.getInitialId());
  }

  public boolean isFinal(Marking marking) {
    return marking.size() == 1 && marking.contains(cfg.getTerminalId());
  }

  /**
   * Every move enabled in {@code marking}, ordered by the node the token sits on.
   */
  public List<Move> moves(Marking marking) {
    List<Move> moves = new ArrayList<Move>();
    Set<Integer> positions = new LinkedHashSet<Integer>();
    for (int token : marking.getTokens()) {
      positions.add(token);
    }
    for (Integer position : positions) {
      Node node = cfg.getNode(position);
      List<Edge> out = cfg.getOutgoing(position);
      switch (node.getKind()) {
      case TERMINAL:
        break;
      case INITIAL:
      case MERGE:
      case RECURSION:
        moves.add(new Move(MoveKind.STRUCTURAL, node, out.get(0), -1,
            marking.move(position, out.get(0).getTo())));
        break;
      case ACTION:
        moves.add(new Move(MoveKind.ACTION, node, out.get(0), -1,
            marking.move(position, out.get(0).getTo())));
        break;
      case CALL:
        moves.add(new Move(MoveKind.CALL, node, out.get(0), -1,
            marking.move(position, out.get(0).getTo())));
        break;
      case BRANCH:
        for (int i = 0; i < out.size(); i++) {
          moves.add(new Move(MoveKind.BRANCH, node, out.get(i), i,
              marking.move(position, out.get(i).getTo())));
        }
        break;
      case FORK: {
        int[] targets = new int[out.size()];
        for (int i = 0; i < out.size(); i++) {
          targets[i] = out.get(i).getTo();
        }
        moves.add(new Move(MoveKind.FORK, node, null, -1, marking.move(position, targets)));
        break;
      }
      case JOIN: {
        JoinNode join = (JoinNode) node;
        int arrived = marking.count(position);
        if (arrived >= join.getBranchCount()) {
          moves.add(new Move(MoveKind.JOIN, node, out.get(0), -1,
              marking.moveAll(position, join.getBranchCount(), out.get(0).getTo())));
        }
        break;
      }
      default:
        throw new IllegalStateException("Unknown node kind " + node.getKind());
      }
    }
    return moves;
  }

}
