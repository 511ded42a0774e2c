package edu.uchicago.cs.ucare.mpst.verification;

import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.body;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.par;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.protocol;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.roles;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.send;
import static edu.uchicago.cs.ucare.mpst.verification.VerifierFixtures.build;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import org.junit.Test;

import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;

public class ParallelDeadlockVerifierTest {

  private final ParallelDeadlockVerifier verifier = new ParallelDeadlockVerifier();

  @Test
  public void testIndependentBranches() throws Exception {
    assertThat(verifier.verify(build(ProtocolLibrary.parallel())).isPassed(), is(true));
    assertThat(verifier.verify(build(ProtocolLibrary.twoPhaseCommit())).isPassed(), is(true));
  }

  @Test
  public void testBranchesWaitingForEachOther() throws Exception {
    VerificationResult result = verifier.verify(build(protocol("Crossed", roles("A", "B"),
        par(body(send("A", "B", "x"), send("B", "A", "y")),
            body(send("B", "A", "z"), send("A", "B", "w"))))));
    assertThat(result.isPassed(), is(false));
    assertThat(result.getErrors().size(), is(1));
    assertThat(result.getErrors().get(0).getMessage(), containsString("wait for each other"));
  }

  @Test
  public void testOneWayDependencyIsFine() throws Exception {
    VerificationResult result = verifier.verify(build(protocol("Pipe", roles("A", "B", "C"),
        par(body(send("A", "B", "x")), body(send("B", "C", "y"))))));
    assertThat(result.isPassed(), is(true));
  }

}
