package edu.uchicago.cs.ucare.mpst.verification;

import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.body;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.par;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.protocol;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.roles;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.send;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import org.junit.Test;

import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.CfgBuilder;
import edu.uchicago.cs.ucare.mpst.cfg.NodeIdAllocator;

public class RaceVerifierTest {

  private final RaceVerifier verifier = new RaceVerifier();

  @Test
  public void testDisjointChannels() throws Exception {
    Cfg cfg = new CfgBuilder(new NodeIdAllocator()).build(protocol("Hub", roles("Hub", "A", "B"),
        par(body(send("Hub", "A", "M1")), body(send("Hub", "B", "M2")))));
    VerificationResult result = verifier.verify(cfg);
    assertThat(result.getCheck(), is("races"));
    assertThat(result.isPassed(), is(true));
    assertThat(result.getDiagnostics().isEmpty(), is(true));
  }

  @Test
  public void testSharedChannel() throws Exception {
    Cfg cfg = new CfgBuilder(new NodeIdAllocator()).build(protocol("Hub", roles("Hub", "A"),
        par(body(send("Hub", "A", "M1")), body(send("Hub", "A", "M2")))));
    VerificationResult result = verifier.verify(cfg);
    assertThat(result.isPassed(), is(false));
    assertThat(result.getErrors().size(), is(1));
    assertThat(result.getErrors().get(0).getMessage(), containsString("(Hub,A)"));
    assertThat(result.getErrors().get(0).getRoles(), is(roles("Hub", "A")));
  }

  @Test
  public void testOppositeDirectionsDoNotRace() throws Exception {
    Cfg cfg = new CfgBuilder(new NodeIdAllocator()).build(protocol("Swap", roles("A", "B"),
        par(body(send("A", "B", "x")), body(send("B", "A", "y")))));
    assertThat(verifier.verify(cfg).isPassed(), is(true));
  }

}
