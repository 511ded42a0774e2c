package edu.uchicago.cs.ucare.mpst.verification;

import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.branch;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.choice;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.protocol;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.roles;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.send;
import static edu.uchicago.cs.ucare.mpst.verification.VerifierFixtures.build;
import static edu.uchicago.cs.ucare.mpst.verification.VerifierFixtures.mentions;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import org.junit.Test;

import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;

public class ChoiceDeterminismVerifierTest {

  private final ChoiceDeterminismVerifier verifier = new ChoiceDeterminismVerifier();

  @Test
  public void testLibraryChoices() throws Exception {
    assertThat(verifier.verify(build(ProtocolLibrary.twoBuyer())).isPassed(), is(true));
    assertThat(verifier.verify(build(ProtocolLibrary.nestedChoice())).isPassed(), is(true));
    assertThat(verifier.verify(build(ProtocolLibrary.travelAgency())).isPassed(), is(true));
  }

  @Test
  public void testBranchOpenedByAnotherRole() throws Exception {
    VerificationResult result = verifier.verify(build(protocol("P", roles("A", "B"),
        choice("A",
            branch(send("B", "A", "x")),
            branch(send("A", "B", "y"))))));
    assertThat(result.isPassed(), is(false));
    assertThat(result.getErrors().size(), is(1));
    assertThat(mentions(result, "which A does not send"), is(true));
  }

  @Test
  public void testSameOpeningMessage() throws Exception {
    VerificationResult result = verifier.verify(build(protocol("P", roles("A", "B"),
        choice("A",
            branch(send("A", "B", "x"), send("A", "B", "y")),
            branch(send("A", "B", "x"), send("A", "B", "z"))))));
    assertThat(result.isPassed(), is(false));
    assertThat(mentions(result, "both start with A->B:x"), is(true));
  }

  @Test
  public void testEmptyBranch() throws Exception {
    VerificationResult one = verifier.verify(build(protocol("P", roles("A", "B"),
        choice("A", branch(send("A", "B", "x")), branch()))));
    assertThat(one.isPassed(), is(true));
    assertThat(one.getWarnings().size(), is(1));

    VerificationResult two = verifier.verify(build(protocol("P", roles("A", "B"),
        choice("A", branch(), branch()))));
    assertThat(two.isPassed(), is(false));
    assertThat(mentions(two, "cannot be told apart"), is(true));
  }

}
