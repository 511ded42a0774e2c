package edu.uchicago.cs.ucare.mpst.safety;

import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.branch;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.call;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.choice;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.protocol;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.roles;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.send;
import static edu.uchicago.cs.ucare.mpst.safety.Machines.context;
import static edu.uchicago.cs.ucare.mpst.safety.Machines.machine;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.junit.Before;
import org.junit.Test;

import edu.uchicago.cs.ucare.mpst.ast.Protocol;
import edu.uchicago.cs.ucare.mpst.ast.ProtocolRegistry;
import edu.uchicago.cs.ucare.mpst.cfg.CfgBuilder;
import edu.uchicago.cs.ucare.mpst.cfg.NodeIdAllocator;
import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;
import edu.uchicago.cs.ucare.mpst.projection.Cfsm;
import edu.uchicago.cs.ucare.mpst.projection.ProjectionResult;
import edu.uchicago.cs.ucare.mpst.projection.Projector;

public class ContextReducerTest {

  private ContextReducer reducer;

  @Before
  public void setUp() {
    reducer = new ContextReducer();
  }

  static Map<String, Cfsm> project(Protocol protocol) throws Exception {
    ProjectionResult result = new Projector().projectAll(
        new CfgBuilder(new NodeIdAllocator()).build(protocol, ProtocolLibrary.registry()));
    assertThat(result.getErrors().toString(), result.isSuccessful(), is(true));
    return result.getCfsms();
  }

  /**
   * A picks between two sub-protocols that both involve B, then sends a branch specific label.
   */
  public static Map<String, Cfsm> callChoice() throws Exception {
    ProtocolRegistry registry = new ProtocolRegistry();
    registry.register(protocol("P", roles("X", "Y"), send("X", "Y", "p")));
    registry.register(protocol("Q", roles("X", "Y"), send("Y", "X", "q")));
    Protocol protocol = protocol("CallChoice", roles("A", "B"),
        choice("A",
            branch(call("P", "A", "B"), send("A", "B", "x")),
            branch(call("Q", "A", "B"), send("A", "B", "y"))));
    ProjectionResult result = new Projector().projectAll(
        new CfgBuilder(new NodeIdAllocator()).build(protocol, registry));
    assertThat(result.getErrors().toString(), result.isSuccessful(), is(true));
    return result.getCfsms();
  }

  @Test
  public void testPingPongTakesTwoSteps() throws Exception {
    TypingContext initial = reducer.initialContext(project(protocol("PingPong", roles("A", "B"),
        send("A", "B", "M"), send("B", "A", "M2"))));
    EnabledCommunications enabled = reducer.findEnabledCommunications(initial);
    assertThat(enabled.getCommunications().size(), is(1));
    assertThat(enabled.getCommunications().get(0).getSender(), is("A"));
    assertThat(enabled.getCommunications().get(0).getReceivers(), is(roles("B")));

    ExecutionResult result = reducer.executeToCompletion(initial, 10);
    assertThat(result.getOutcome(), is(ExecutionOutcome.TERMINAL));
    assertThat(result.getSteps(), is(2));
    assertThat(result.getTrace().size(), is(3));
    TypingContext last = result.getFinalContext();
    assertThat(last.isTerminal(), is(true));
    assertThat(last.getCfsm("A").isTerminal(last.getState("A")), is(true));
    assertThat(last.getCfsm("B").isTerminal(last.getState("B")), is(true));
  }

  @Test
  public void testContextsAreValues() throws Exception {
    Map<String, Cfsm> cfsms = project(ProtocolLibrary.requestResponse());
    TypingContext one = reducer.initialContext(cfsms);
    TypingContext two = reducer.initialContext(cfsms);
    assertThat(one, is(two));
    TypingContext next = reducer.reduce(one);
    assertThat(next.equals(one), is(false));
    assertThat(one.getState("Client"), is(0));
  }

  @Test
  public void testReduceTerminalContext() throws Exception {
    TypingContext empty = reducer.initialContext(project(protocol("Empty", roles("A", "B"))));
    assertThat(empty.isTerminal(), is(true));
    assertThat(reducer.findEnabledCommunications(empty).isTerminal(), is(true));
    try {
      reducer.reduce(empty);
      fail("reduced a terminal context");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test
  public void testStaleCommunicationRejected() throws Exception {
    TypingContext initial = reducer.initialContext(project(ProtocolLibrary.requestResponse()));
    Communication first = reducer.findEnabledCommunications(initial).getCommunications().get(0);
    TypingContext next = reducer.reduceBy(initial, first);
    try {
      reducer.reduceBy(next, first);
      fail("fired a communication that is no longer enabled");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  @Test
  public void testTauClosure() {
    Map<String, Cfsm> cfsms = context(
        machine("A", 3).tau(0, 1).send(1, 2, "B", "m").terminal(2),
        machine("B", 2).receive(0, 1, "A", "m").terminal(1));
    TypingContext initial = reducer.initialContext(cfsms);
    assertThat(initial.getState("A"), is(1));
    assertThat(initial.getState("B"), is(0));
    ExecutionResult result = reducer.executeToCompletion(initial, 10);
    assertThat(result.getOutcome(), is(ExecutionOutcome.TERMINAL));
    assertThat(result.getSteps(), is(1));
  }

  @Test
  public void testStuckContext() {
    Map<String, Cfsm> cfsms = context(
        machine("A", 2).receive(0, 1, "B", "x").terminal(1),
        machine("B", 2).receive(0, 1, "A", "y").terminal(1));
    ExecutionResult result = reducer.executeToCompletion(reducer.initialContext(cfsms), 10);
    assertThat(result.getOutcome(), is(ExecutionOutcome.STUCK));
    assertThat(result.getSteps(), is(0));
  }

  @Test
  public void testMulticastFiresWithAllReceivers() throws Exception {
    TypingContext initial = reducer.initialContext(project(ProtocolLibrary.broadcast()));
    List<Communication> enabled = reducer.findEnabledCommunications(initial).getCommunications();
    assertThat(enabled.size(), is(1));
    Communication update = enabled.get(0);
    assertThat(update.getReceivers(), is(roles("Client1", "Client2")));
    assertThat(update.getReceiverTransitions().size(), is(2));

    TypingContext next = reducer.reduceBy(initial, update);
    assertThat(next.getState("Client1") == initial.getState("Client1"), is(false));
    assertThat(next.getState("Client2") == initial.getState("Client2"), is(false));

    ExecutionResult result = reducer.executeToCompletion(initial, 10);
    assertThat(result.getOutcome(), is(ExecutionOutcome.TERMINAL));
    assertThat(result.getSteps(), is(3));
  }

  @Test
  public void testSendWaitsForItsReceiver() {
    Map<String, Cfsm> cfsms = context(
        machine("S", 2).send(0, 1, "A", "m").terminal(1),
        machine("A", 1).terminal(0));
    EnabledCommunications enabled =
        reducer.findEnabledCommunications(reducer.initialContext(cfsms));
    assertThat(enabled.getCommunications().isEmpty(), is(true));
    assertThat(enabled.isStuck(), is(true));
  }

  @Test
  public void testBudget() throws Exception {
    TypingContext initial = reducer.initialContext(project(ProtocolLibrary.streaming()));
    ExecutionResult result = reducer.executeToCompletion(initial, 5);
    assertThat(result.getOutcome(), is(ExecutionOutcome.BUDGET_EXCEEDED));
    assertThat(result.getSteps(), is(5));
  }

  @Test
  public void testRandomSelectionStillTerminates() throws Exception {
    ContextReducer random = new ContextReducer(CommunicationSelector.random(7L));
    TypingContext initial = random.initialContext(project(ProtocolLibrary.twoBuyer()));
    ExecutionResult result = random.executeToCompletion(initial, 100);
    assertThat(result.getOutcome(), is(ExecutionOutcome.TERMINAL));
    assertThat(result.getSteps(), is(6));
  }

  @Test
  public void testEveryCallAlternativeIsExplored() throws Exception {
    TypingContext initial = reducer.initialContext(callChoice());
    assertThat(initial.isTerminal(), is(false));
    assertThat(reducer.findEnabledCommunications(initial).getCommunications().isEmpty(), is(true));

    List<TypingContext> successors = reducer.findAllSuccessors(initial);
    assertThat(successors.size(), is(2));
    Set<String> labels = new TreeSet<String>();
    for (TypingContext successor : successors) {
      List<Communication> enabled =
          reducer.findEnabledCommunications(successor).getCommunications();
      assertThat(enabled.size(), is(1));
      labels.add(enabled.get(0).getMessage().getLabel());
    }
    assertThat(new ArrayList<String>(labels), is(Arrays.asList("x", "y")));
  }

  @Test
  public void testCallFiresForAllItsRoles() throws Exception {
    TypingContext initial = reducer.initialContext(callChoice());
    for (TypingContext next : reducer.findSilentSteps(initial)) {
      assertThat(next.getState("A") == initial.getState("A"), is(false));
      assertThat(next.getState("B") == initial.getState("B"), is(false));
    }
    ExecutionResult result = reducer.executeToCompletion(initial, 10);
    assertThat(result.getOutcome(), is(ExecutionOutcome.TERMINAL));
    assertThat(result.getSteps(), is(1));
    assertThat(result.getTrace().size(), is(3));
  }

  @Test
  public void testCallWaitsForItsPartner() {
    TypingContext blocked = reducer.initialContext(context(
        machine("A", 3).call(0, 1, "P", "A", "B").send(0, 2, "B", "m").terminal(1).terminal(2),
        machine("B", 2).receive(0, 1, "A", "m").terminal(1)));
    assertThat(blocked.getState("A"), is(0));
    assertThat(reducer.findSilentSteps(blocked).isEmpty(), is(true));
    assertThat(reducer.findAllSuccessors(blocked).size(), is(1));

    // C takes no part in this context, so A runs the call on its own
    TypingContext alone = reducer.initialContext(context(
        machine("A", 3).call(0, 1, "P", "A", "C").send(0, 2, "B", "m").terminal(1).terminal(2),
        machine("B", 2).receive(0, 1, "A", "m").terminal(1)));
    List<TypingContext> steps = reducer.findSilentSteps(alone);
    assertThat(steps.size(), is(1));
    assertThat(steps.get(0).getState("A"), is(1));
    assertThat(steps.get(0).getState("B"), is(0));
  }

}
