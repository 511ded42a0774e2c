package edu.uchicago.cs.ucare.mpst.safety;

import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.protocol;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.roles;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.send;
import static edu.uchicago.cs.ucare.mpst.safety.ContextReducerTest.project;
import static edu.uchicago.cs.ucare.mpst.safety.Machines.context;
import static edu.uchicago.cs.ucare.mpst.safety.Machines.machine;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;

import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import edu.uchicago.cs.ucare.mpst.ast.Protocol;
import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;
import edu.uchicago.cs.ucare.mpst.projection.Cfsm;

public class SafetyCheckerTest {

  private ContextReducer reducer;
  private SafetyChecker checker;

  @Before
  public void setUp() {
    reducer = new ContextReducer();
    checker = new SafetyChecker(reducer, SafetyChecker.DEFAULT_MAX_STATES);
  }

  @Test
  public void testEmptyProtocolIsSafe() throws Exception {
    TypingContext initial = reducer.initialContext(project(protocol("Empty", roles("A", "B"))));
    assertThat(initial.isTerminal(), is(true));
    SafetyCheckResult result = checker.check(initial);
    assertThat(result.isSafe(), is(true));
    assertThat(result.getStatesExplored(), is(1));
    assertThat(result.getViolation(), nullValue());
  }

  @Test
  public void testOAuthIsSafe() throws Exception {
    SafetyCheckResult result = checker.check(reducer.initialContext(
        project(ProtocolLibrary.oAuth())));
    assertThat(result.getVerdict(), is(SafetyVerdict.SAFE));
    assertThat(result.getStatesExplored() > 1, is(true));
  }

  @Test
  public void testSecondCallBranchIsChecked() throws Exception {
    SafetyCheckResult result = checker.check(reducer.initialContext(
        ContextReducerTest.callChoice()));
    assertThat(result.getVerdict(), is(SafetyVerdict.SAFE));
    // initial, one context per call, terminal
    assertThat(result.getStatesExplored(), is(4));
  }

  @Test
  public void testLibraryIsSafe() throws Exception {
    for (Protocol protocol : ProtocolLibrary.all()) {
      SafetyCheckResult result = checker.check(reducer.initialContext(project(protocol)));
      assertThat(protocol.getName() + ": " + result, result.isSafe(), is(true));
    }
  }

  @Test
  public void testPeerBusyElsewhereIsNotAViolation() throws Exception {
    // C waits for B while A already offers z to C
    Map<String, Cfsm> cfsms = project(protocol("Relay", roles("A", "B", "C"),
        send("A", "B", "x"), send("B", "C", "y"), send("A", "C", "z")));
    assertThat(checker.check(reducer.initialContext(cfsms)).isSafe(), is(true));
  }

  @Test
  public void testUnexpectedLabel() {
    Map<String, Cfsm> cfsms = context(
        machine("A", 2).send(0, 1, "B", "x").terminal(1),
        machine("B", 2).receive(0, 1, "A", "y").terminal(1));
    SafetyCheckResult result = checker.check(reducer.initialContext(cfsms));
    assertThat(result.getVerdict(), is(SafetyVerdict.UNSAFE));
    assertThat(result.getStatesExplored(), is(1));
    SafetyViolation violation = result.getViolation();
    assertThat(violation.getSender(), is("A"));
    assertThat(violation.getReceiver(), is("B"));
    assertThat(violation.getLabel(), is("x"));
    assertThat(violation.getSenderState(), is(0));
    assertThat(violation.getReceiverState(), is(0));
  }

  @Test
  public void testViolationFoundAfterReduction() {
    Map<String, Cfsm> cfsms = context(
        machine("A", 3).send(0, 1, "B", "hello").send(1, 2, "B", "data").terminal(2),
        machine("B", 3).receive(0, 1, "A", "hello").receive(1, 2, "A", "bye").terminal(2));
    SafetyCheckResult result = checker.check(reducer.initialContext(cfsms));
    assertThat(result.getVerdict(), is(SafetyVerdict.UNSAFE));
    assertThat(result.getStatesExplored(), is(2));
    assertThat(result.getViolation().getLabel(), is("data"));
    assertThat(result.getViolation().getContext().getState("A"), is(1));
  }

  @Test
  public void testSendToMissingRole() {
    Map<String, Cfsm> cfsms = context(
        machine("A", 2).send(0, 1, "C", "x").terminal(1),
        machine("B", 1).terminal(0));
    SafetyCheckResult result = checker.check(reducer.initialContext(cfsms));
    assertThat(result.getVerdict(), is(SafetyVerdict.UNSAFE));
    assertThat(result.getViolation().getReceiver(), is("C"));
    assertThat(result.getViolation().getReceiverState(), is(-1));
    assertThat(result.getViolation().getMessage(), containsString("C"));
  }

  @Test
  public void testBudgetExceeded() throws Exception {
    SafetyChecker tiny = new SafetyChecker(reducer, 1);
    SafetyCheckResult result = tiny.check(reducer.initialContext(
        project(ProtocolLibrary.twoBuyer())));
    assertThat(result.getVerdict(), is(SafetyVerdict.BUDGET_EXCEEDED));
    assertThat(result.isSafe(), is(false));
  }

}
