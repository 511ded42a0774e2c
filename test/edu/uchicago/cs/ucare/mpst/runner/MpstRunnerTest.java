package edu.uchicago.cs.ucare.mpst.runner;

import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.protocol;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.roles;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.send;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.gson.JsonObject;

import edu.uchicago.cs.ucare.mpst.ast.Protocol;
import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;
import edu.uchicago.cs.ucare.mpst.util.MpstConfig;

public class MpstRunnerTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testAnalyze() {
    MpstRunner runner = new MpstRunner(new MpstConfig(), ProtocolLibrary.registry());
    JsonObject report = runner.analyze(ProtocolLibrary.requestResponse());
    assertThat(report.get("protocol").getAsString(), is("RequestResponse"));
    assertThat(report.get("passed").getAsBoolean(), is(true));
    for (String key : Arrays.asList("verification", "projection", "safety", "simulation",
        "cfgSimulation")) {
      assertThat(key, report.has(key), is(true));
    }
    assertThat(report.getAsJsonObject("safety").get("verdict").getAsString(), is("SAFE"));
    assertThat(report.getAsJsonObject("simulation").get("outcome").getAsString(),
        is("SUCCESS"));
  }

  @Test
  public void testAnalyzeUnbuildableProtocol() {
    MpstRunner runner = new MpstRunner(new MpstConfig(), ProtocolLibrary.registry());
    JsonObject report = runner.analyze(protocol("Broken", roles("A"), send("A", "C", "m")));
    assertThat(report.get("passed").getAsBoolean(), is(false));
    assertThat(report.get("error").getAsString(), containsString("role C is not declared"));
    assertThat(report.has("verification"), is(false));
  }

  @Test
  public void testSelect() {
    MpstRunner runner = new MpstRunner(new MpstConfig(), ProtocolLibrary.registry());
    assertThat(runner.select(Collections.<String>emptyList()).size(), is(14));
    List<Protocol> picked = runner.select(Arrays.asList("OAuth", "Streaming"));
    assertThat(picked.size(), is(2));
    assertThat(picked.get(0).getName(), is("OAuth"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSelectUnknown() {
    new MpstRunner(new MpstConfig(), ProtocolLibrary.registry())
        .select(Arrays.asList("RequestResponse", "Nope"));
  }

  @Test
  public void testRunWritesReports() {
    File dir = new File(folder.getRoot(), "out");
    MpstConfig config = new MpstConfig();
    config.set("report_dir", dir.getPath());
    MpstRunner runner = new MpstRunner(config, ProtocolLibrary.registry());
    int failures = runner.run(Arrays.asList(ProtocolLibrary.requestResponse(),
        ProtocolLibrary.broadcast()));
    assertThat(failures, is(0));
    assertThat(new File(dir, "RequestResponse.json").isFile(), is(true));
    assertThat(new File(dir, "Broadcast.json").isFile(), is(true));
  }

  @Test
  public void testWholeLibraryPasses() {
    MpstRunner runner = new MpstRunner(new MpstConfig(), ProtocolLibrary.registry());
    assertThat(runner.run(ProtocolLibrary.all()), is(0));
  }

}
