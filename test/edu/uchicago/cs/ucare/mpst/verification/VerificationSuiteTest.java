package edu.uchicago.cs.ucare.mpst.verification;

import static edu.uchicago.cs.ucare.mpst.verification.VerifierFixtures.build;
import static edu.uchicago.cs.ucare.mpst.verification.VerifierFixtures.spin;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;

import java.util.Arrays;

import org.junit.Test;

import edu.uchicago.cs.ucare.mpst.ast.Protocol;
import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;
import edu.uchicago.cs.ucare.mpst.util.MpstConfig;

public class VerificationSuiteTest {

  @Test
  public void testAllChecksOnByDefault() throws Exception {
    VerificationReport report = new VerificationSuite(new MpstConfig())
        .verify(build(ProtocolLibrary.requestResponse()));
    assertThat(report.getResults().size(), is(9));
    for (String check : Arrays.asList("structure", "connectedness", "deadlock",
        "parallel-deadlock", "races", "progress", "liveness", "choice-determinism", "multicast")) {
      assertThat(check, report.getResult(check), notNullValue());
    }
    assertThat(report.isPassed(), is(true));
    assertThat(report.getErrorCount(), is(0));
  }

  @Test
  public void testSwitchedOffCheck() throws Exception {
    MpstConfig config = new MpstConfig();
    config.set("verify_races", "false");
    VerificationReport report = new VerificationSuite(config)
        .verify(build(ProtocolLibrary.parallel()));
    assertThat(report.getResults().size(), is(8));
    assertThat(report.getResult("races"), nullValue());
  }

  @Test
  public void testStrictModeFailsOnWarnings() throws Exception {
    Cfg cfg = build(spin());
    VerificationReport lenient = new VerificationSuite(
        Arrays.<ProtocolVerifier>asList(new StructuralVerifier()), false).verify(cfg);
    assertThat(lenient.isPassed(), is(true));
    assertThat(lenient.getWarningCount() > 0, is(true));

    VerificationReport strict = new VerificationSuite(
        Arrays.<ProtocolVerifier>asList(new StructuralVerifier()), true).verify(cfg);
    assertThat(strict.isStrict(), is(true));
    assertThat(strict.isPassed(), is(false));
  }

  @Test
  public void testSilentLoopFails() throws Exception {
    VerificationReport report = new VerificationSuite(new MpstConfig()).verify(build(spin()));
    assertThat(report.isPassed(), is(false));
    assertThat(report.getResult("structure").isPassed(), is(true));
    assertThat(report.getResult("deadlock").isPassed(), is(false));
    assertThat(report.getResult("progress").isPassed(), is(false));
    assertThat(report.getResult("liveness").isPassed(), is(false));
  }

  @Test
  public void testLibraryPasses() throws Exception {
    VerificationSuite suite = new VerificationSuite(new MpstConfig());
    for (Protocol protocol : ProtocolLibrary.all()) {
      VerificationReport report = suite.verify(build(protocol));
      assertThat(report.toString(), report.isPassed(), is(true));
      // a live protocol is also deadlock free
      if (report.getResult("liveness").isPassed()) {
        assertThat(protocol.getName(), report.getResult("deadlock").isPassed(), is(true));
      }
    }
  }

}
