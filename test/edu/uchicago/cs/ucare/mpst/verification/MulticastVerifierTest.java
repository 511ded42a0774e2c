package edu.uchicago.cs.ucare.mpst.verification;

import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.multicast;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.protocol;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.roles;
import static edu.uchicago.cs.ucare.mpst.verification.VerifierFixtures.build;
import static edu.uchicago.cs.ucare.mpst.verification.VerifierFixtures.mentions;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import org.junit.Test;

import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;

public class MulticastVerifierTest {

  private final MulticastVerifier verifier = new MulticastVerifier();

  @Test
  public void testBroadcast() throws Exception {
    VerificationResult result = verifier.verify(build(ProtocolLibrary.broadcast()));
    assertThat(result.isPassed(), is(true));
    assertThat(result.getWarnings().isEmpty(), is(true));
  }

  @Test
  public void testSenderAmongReceivers() throws Exception {
    VerificationResult result = verifier.verify(build(protocol("Echo", roles("A", "B"),
        multicast("A", roles("A", "B"), "m"))));
    assertThat(result.isPassed(), is(false));
    assertThat(mentions(result, "A sends m() to itself"), is(true));
  }

  @Test
  public void testRepeatedReceiver() throws Exception {
    VerificationResult result = verifier.verify(build(protocol("Twice", roles("A", "B"),
        multicast("A", roles("B", "B"), "m"))));
    assertThat(result.isPassed(), is(true));
    assertThat(mentions(result, "B is listed twice"), is(true));
  }

}
