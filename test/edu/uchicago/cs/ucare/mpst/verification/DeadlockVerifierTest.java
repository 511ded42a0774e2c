package edu.uchicago.cs.ucare.mpst.verification;

import static edu.uchicago.cs.ucare.mpst.safety.Machines.context;
import static edu.uchicago.cs.ucare.mpst.safety.Machines.machine;
import static edu.uchicago.cs.ucare.mpst.verification.VerifierFixtures.build;
import static edu.uchicago.cs.ucare.mpst.verification.VerifierFixtures.mentions;
import static edu.uchicago.cs.ucare.mpst.verification.VerifierFixtures.spin;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;
import edu.uchicago.cs.ucare.mpst.safety.ContextReducer;
import edu.uchicago.cs.ucare.mpst.safety.ContextReducerTest;
import edu.uchicago.cs.ucare.mpst.safety.SafetyChecker;
import edu.uchicago.cs.ucare.mpst.safety.SafetyVerdict;
import edu.uchicago.cs.ucare.mpst.safety.TypingContext;

public class DeadlockVerifierTest {

  private final DeadlockVerifier deadlock = new DeadlockVerifier();
  private final ProgressVerifier progress = new ProgressVerifier();
  private final LivenessVerifier liveness = new LivenessVerifier(progress, deadlock);

  @Test
  public void testRequestResponse() throws Exception {
    Cfg cfg = build(ProtocolLibrary.requestResponse());
    assertThat(deadlock.verify(cfg).isPassed(), is(true));
    assertThat(progress.verify(cfg).isPassed(), is(true));
    assertThat(liveness.verify(cfg).isPassed(), is(true));
  }

  @Test
  public void testRecursionWithExitIsLive() throws Exception {
    Cfg cfg = build(ProtocolLibrary.conditionalRecursion());
    assertThat(deadlock.verify(cfg).getDiagnostics().toString(), deadlock.verify(cfg).isPassed(),
        is(true));
    assertThat(liveness.verify(cfg).isPassed(), is(true));
  }

  @Test
  public void testSilentLoop() throws Exception {
    Cfg cfg = build(spin());
    VerificationResult result = deadlock.verify(cfg);
    assertThat(result.getCheck(), is("deadlock"));
    assertThat(result.isPassed(), is(false));
    assertThat(mentions(result, "never communicates"), is(true));
    assertThat(mentions(result, "Stuck at"), is(true));
  }

  @Test
  public void testSilentLoopMakesNoProgress() throws Exception {
    Cfg cfg = build(spin());
    VerificationResult result = progress.verify(cfg);
    assertThat(result.isPassed(), is(false));
    assertThat(mentions(result, "can never make progress"), is(true));
    VerificationResult live = liveness.verify(cfg);
    assertThat(live.getCheck(), is("liveness"));
    assertThat(live.isPassed(), is(false));
    assertThat(live.getErrors().size(),
        is(result.getErrors().size() + deadlock.verify(cfg).getErrors().size()));
  }

  @Test
  public void testSendToPeerWaitingOnSomeoneElse() {
    ContextReducer reducer = new ContextReducer();
    TypingContext initial = reducer.initialContext(context(
        machine("A", 2).send(0, 1, "B", "x").terminal(1),
        machine("B", 3).receive(0, 1, "C", "y").receive(1, 2, "A", "x").terminal(2),
        machine("C", 1).terminal(0)));
    // B is not receiving from A yet, so no single context breaks the send rule
    assertThat(new SafetyChecker().check(initial).getVerdict(), is(SafetyVerdict.SAFE));

    List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    deadlock.checkStuckContexts(initial, diagnostics);
    assertThat(diagnostics.size(), is(1));
    assertThat(diagnostics.get(0).getSeverity(), is(Severity.ERROR));
    assertThat(diagnostics.get(0).getMessage(), containsString("Stuck at {A=0, B=0, C=0}"));
    assertThat(diagnostics.get(0).getRoles(), is(Arrays.asList("A", "B")));
  }

  @Test
  public void testEveryCallBranchIsSearched() throws Exception {
    ContextReducer reducer = new ContextReducer();
    TypingContext initial = reducer.initialContext(ContextReducerTest.callChoice());
    List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    deadlock.checkStuckContexts(initial, diagnostics);
    assertThat(diagnostics.toString(), diagnostics.isEmpty(), is(true));
  }

}
