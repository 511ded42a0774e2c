package edu.uchicago.cs.ucare.mpst.cfg;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;

public class TokenGameTest {

  @Test
  public void testMarkingIsAMultiset() {
    Marking marking = Marking.of(5, 2, 5);
    assertThat(marking.size(), is(3));
    assertThat(marking.count(5), is(2));
    assertThat(marking.contains(3), is(false));
    assertThat(marking, is(Marking.of(5, 5, 2)));
    assertThat(marking.move(5, 7), is(Marking.of(2, 5, 7)));
    assertThat(marking.moveAll(5, 2, 9), is(Marking.of(2, 9)));
    try {
      marking.moveAll(2, 2, 9);
      fail("removed more tokens than present");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testParallelForksAndJoins() throws CfgBuildException {
    Cfg cfg = new CfgBuilder(new NodeIdAllocator()).build(ProtocolLibrary.parallel());
    TokenGame game = new TokenGame(cfg);
    Marking marking = game.initialMarking();
    int widest = marking.size();
    int moves = 0;
    boolean joined = false;
    while (!game.isFinal(marking)) {
      List<Move> enabled = game.moves(marking);
      assertThat("stuck at " + marking, enabled.isEmpty(), is(false));
      Move move = enabled.get(0);
      if (move.getKind() == MoveKind.JOIN) {
        joined = true;
      }
      marking = move.getTarget();
      widest = Math.max(widest, marking.size());
      moves++;
    }
    assertThat(widest, is(2));
    assertThat(joined, is(true));
    // entry, fork, two messages, join, sync
    assertThat(moves, is(6));
  }

  @Test
  public void testBranchOffersEveryBranch() throws CfgBuildException {
    Cfg cfg = new CfgBuilder(new NodeIdAllocator()).build(ProtocolLibrary.twoBuyer());
    TokenGame game = new TokenGame(cfg);
    int branchId = cfg.getNodes(NodeKind.BRANCH).get(0).getId();
    List<Move> moves = game.moves(Marking.of(branchId));
    assertThat(moves.size(), is(2));
    assertThat(moves.get(0).getKind(), is(MoveKind.BRANCH));
    assertThat(moves.get(1).getBranchIndex(), is(1));
  }

}
