package edu.uchicago.cs.ucare.mpst.runner;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;

import edu.uchicago.cs.ucare.mpst.ast.Protocol;
import edu.uchicago.cs.ucare.mpst.ast.ProtocolRegistry;
import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.CfgBuildException;
import edu.uchicago.cs.ucare.mpst.cfg.CfgBuilder;
import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;
import edu.uchicago.cs.ucare.mpst.projection.Cfsm;
import edu.uchicago.cs.ucare.mpst.projection.ProjectionResult;
import edu.uchicago.cs.ucare.mpst.projection.Projector;
import edu.uchicago.cs.ucare.mpst.safety.ContextReducer;
import edu.uchicago.cs.ucare.mpst.safety.SafetyCheckResult;
import edu.uchicago.cs.ucare.mpst.safety.SafetyChecker;
import edu.uchicago.cs.ucare.mpst.serializer.CfsmSerializer;
import edu.uchicago.cs.ucare.mpst.serializer.ReportWriter;
import edu.uchicago.cs.ucare.mpst.simulation.CfgRunResult;
import edu.uchicago.cs.ucare.mpst.simulation.CfgSimulator;
import edu.uchicago.cs.ucare.mpst.simulation.DistributedSimulator;
import edu.uchicago.cs.ucare.mpst.simulation.SimulationResult;
import edu.uchicago.cs.ucare.mpst.util.MpstConfig;
import edu.uchicago.cs.ucare.mpst.verification.VerificationReport;
import edu.uchicago.cs.ucare.mpst.verification.VerificationSuite;

/**
 * Analyses library protocols end to end: CFG, verification checks, projection, safety and both
 * simulators. Protocol names given on the command line override the {@code protocols} key.
 */
public class MpstRunner {

  protected final static Logger LOG = LoggerFactory.getLogger(MpstRunner.class);

  private final MpstConfig config;
  private final ProtocolRegistry registry;
  private final VerificationSuite suite;
  private final Projector projector;
  private final SafetyChecker safetyChecker;
  private final ContextReducer reducer;
  private final ReportWriter reportWriter;

  public MpstRunner(MpstConfig config, ProtocolRegistry registry) {
    this.config = config;
    this.registry = registry;
    this.suite = new VerificationSuite(config);
    this.projector = new Projector(config.getProjectionMaxConfigurations());
    this.reducer = new ContextReducer();
    this.safetyChecker = new SafetyChecker(reducer, config.getSafetyMaxStates());
    String reportDir = config.getReportDir();
    this.reportWriter = new ReportWriter(new File(reportDir.isEmpty() ? "." : reportDir));
  }

  public static void main(String[] args) {
    MpstConfig config;
    try {
      config = MpstConfig.load();
    } catch (IOException e) {
      LOG.error("Cannot load " + MpstConfig.CONFIG_FILE, e);
      System.exit(2);
      return;
    }
    MpstRunner runner = new MpstRunner(config, ProtocolLibrary.registry());
    List<String> names = args.length > 0 ? Arrays.asList(args) : config.getProtocols();
    List<Protocol> protocols;
    try {
      protocols = runner.select(names);
    } catch (IllegalArgumentException e) {
      LOG.error(e.getMessage());
      System.exit(2);
      return;
    }
    int failures = runner.run(protocols);
    System.exit(failures == 0 ? 0 : 1);
  }

  /**
   * Resolves protocol names against the registry; an empty list selects every protocol.
   */
  public List<Protocol> select(List<String> names) {
    List<Protocol> protocols = new ArrayList<Protocol>();
    if (names.isEmpty()) {
      protocols.addAll(registry.getProtocols());
      return protocols;
    }
    for (String name : names) {
      if (!registry.contains(name)) {
        throw new IllegalArgumentException("Unknown protocol " + name);
      }
      protocols.add(registry.get(name));
    }
    return protocols;
  }

  /**
   * @return number of protocols that did not pass
   */
  public int run(List<Protocol> protocols) {
    int failures = 0;
    for (Protocol protocol : protocols) {
      JsonObject report = analyze(protocol);
      if (!report.get("passed").getAsBoolean()) {
        failures++;
      }
      if (!config.getReportDir().isEmpty()) {
        try {
          reportWriter.write(protocol.getName(), report);
        } catch (IOException e) {
          LOG.error("Cannot write report for " + protocol.getName(), e);
        }
      }
    }
    LOG.info("Analysed " + protocols.size() + " protocols, " + failures + " failed");
    return failures;
  }

  public JsonObject analyze(Protocol protocol) {
    JsonObject report = new JsonObject();
    report.addProperty("protocol", protocol.getName());
    Cfg cfg;
    try {
      cfg = new CfgBuilder().build(protocol, registry);
    } catch (CfgBuildException e) {
      LOG.error("Cannot build CFG of " + protocol.getName() + ": " + e.getMessage());
      report.addProperty("passed", false);
      report.addProperty("error", e.getMessage());
      return report;
    }
    LOG.info("Built CFG of " + protocol.getName() + " with " + cfg.size() + " nodes");

    VerificationReport verification = suite.verify(cfg);
    report.add("verification", reportWriter.toJson(verification));
    LOG.info(verification.toString());

    ProjectionResult projection = projector.projectAll(cfg);
    report.add("projection", reportWriter.toJson(projection));
    if (LOG.isDebugEnabled()) {
      for (Cfsm cfsm : projection.getCfsms().values()) {
        LOG.debug("\n" + CfsmSerializer.serialize(cfsm));
      }
    }

    boolean safe = false;
    if (projection.isSuccessful()) {
      Map<String, Cfsm> cfsms = projection.getCfsms();
      SafetyCheckResult safety = safetyChecker.check(reducer.initialContext(cfsms));
      report.add("safety", reportWriter.toJson(safety));
      LOG.info("Safety of " + protocol.getName() + ": " + safety);
      safe = safety.isSafe();

      SimulationResult simulation = new DistributedSimulator(cfsms, config).run();
      report.add("simulation", reportWriter.toJson(simulation));
      LOG.info("Distributed simulation of " + protocol.getName() + ": " + simulation);
    } else {
      LOG.warn("Skipping safety and simulation of " + protocol.getName()
          + ", projection failed for " + projection.getErrors().size() + " roles");
    }

    CfgRunResult run = new CfgSimulator(cfg, registry, config).run();
    report.add("cfgSimulation", reportWriter.toJson(run));

    boolean passed = verification.isPassed() && projection.isSuccessful() && safe;
    report.addProperty("passed", passed);
    if (passed) {
      LOG.info(protocol.getName() + " passed");
    } else {
      LOG.warn(protocol.getName() + " failed");
    }
    return report;
  }

}
