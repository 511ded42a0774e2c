package edu.uchicago.cs.ucare.mpst.serializer;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import edu.uchicago.cs.ucare.mpst.projection.Cfsm;
import edu.uchicago.cs.ucare.mpst.projection.ProjectionError;
import edu.uchicago.cs.ucare.mpst.projection.ProjectionResult;
import edu.uchicago.cs.ucare.mpst.safety.SafetyCheckResult;
import edu.uchicago.cs.ucare.mpst.safety.SafetyViolation;
import edu.uchicago.cs.ucare.mpst.simulation.CfgEvent;
import edu.uchicago.cs.ucare.mpst.simulation.CfgRunResult;
import edu.uchicago.cs.ucare.mpst.simulation.QueuedMessage;
import edu.uchicago.cs.ucare.mpst.simulation.SimulationEvent;
import edu.uchicago.cs.ucare.mpst.simulation.SimulationResult;
import edu.uchicago.cs.ucare.mpst.transition.CfsmTransition;
import edu.uchicago.cs.ucare.mpst.verification.Diagnostic;
import edu.uchicago.cs.ucare.mpst.verification.VerificationReport;
import edu.uchicago.cs.ucare.mpst.verification.VerificationResult;

/**
 * Builds JSON trees for analysis results and writes one report file per protocol.
 */
public class ReportWriter {

  protected final static Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

  private final File directory;
  private final Gson gson;

  public ReportWriter(File directory) {
    this.directory = directory;
    this.gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
  }

  public File getDirectory() {
    return directory;
  }

  public JsonObject toJson(VerificationReport report) {
    JsonObject json = new JsonObject();
    json.addProperty("protocol", report.getProtocol());
    json.addProperty("passed", report.isPassed());
    json.addProperty("strict", report.isStrict());
    json.addProperty("errors", report.getErrorCount());
    json.addProperty("warnings", report.getWarningCount());
    JsonObject checks = new JsonObject();
    for (VerificationResult result : report.getResults()) {
      JsonObject check = new JsonObject();
      check.addProperty("passed", result.isPassed());
      JsonArray diagnostics = new JsonArray();
      for (Diagnostic diagnostic : result.getDiagnostics()) {
        JsonObject d = new JsonObject();
        d.addProperty("severity", diagnostic.getSeverity().toString());
        d.addProperty("message", diagnostic.getMessage());
        d.add("nodes", gson.toJsonTree(diagnostic.getNodes()));
        d.add("roles", gson.toJsonTree(diagnostic.getRoles()));
        diagnostics.add(d);
      }
      check.add("diagnostics", diagnostics);
      checks.add(result.getCheck(), check);
    }
    json.add("checks", checks);
    return json;
  }

  public JsonObject toJson(SafetyCheckResult result) {
    JsonObject json = new JsonObject();
    json.addProperty("verdict", result.getVerdict().toString());
    json.addProperty("statesExplored", result.getStatesExplored());
    SafetyViolation violation = result.getViolation();
    if (violation != null) {
      JsonObject v = new JsonObject();
      v.addProperty("sender", violation.getSender());
      v.addProperty("receiver", violation.getReceiver());
      v.addProperty("label", violation.getLabel());
      v.addProperty("senderState", violation.getSenderState());
      v.addProperty("receiverState", violation.getReceiverState());
      v.addProperty("message", violation.getMessage());
      json.add("violation", v);
    }
    return json;
  }

  public JsonObject toJson(ProjectionResult result) {
    JsonObject json = new JsonObject();
    JsonObject machines = new JsonObject();
    for (Map.Entry<String, Cfsm> entry : result.getCfsms().entrySet()) {
      machines.add(entry.getKey(), toJson(entry.getValue()));
    }
    json.add("cfsms", machines);
    JsonArray errors = new JsonArray();
    for (ProjectionError error : result.getErrors()) {
      JsonObject e = new JsonObject();
      e.addProperty("role", error.getRole());
      e.addProperty("kind", error.getKind().toString());
      e.addProperty("message", error.getMessage());
      errors.add(e);
    }
    json.add("errors", errors);
    return json;
  }

  public JsonObject toJson(Cfsm cfsm) {
    JsonObject json = new JsonObject();
    json.addProperty("role", cfsm.getRole());
    json.addProperty("initial", cfsm.getInitialState());
    json.add("terminal", gson.toJsonTree(cfsm.getTerminalStates()));
    json.addProperty("states", cfsm.getStates().size());
    JsonArray transitions = new JsonArray();
    for (CfsmTransition transition : cfsm.getTransitions()) {
      JsonObject t = new JsonObject();
      t.addProperty("from", transition.getFrom());
      t.addProperty("to", transition.getTo());
      t.addProperty("action", transition.getAction().getKey());
      transitions.add(t);
    }
    json.add("transitions", transitions);
    json.addProperty("local", CfsmSerializer.serialize(cfsm));
    return json;
  }

  public JsonObject toJson(SimulationResult result) {
    JsonObject json = new JsonObject();
    json.addProperty("outcome", result.getOutcome().toString());
    json.addProperty("steps", result.getSteps());
    json.add("finalStates", gson.toJsonTree(result.getFinalStates()));
    JsonObject traces = new JsonObject();
    for (Map.Entry<String, List<SimulationEvent>> entry : result.getTraces().entrySet()) {
      JsonArray events = new JsonArray();
      for (SimulationEvent event : entry.getValue()) {
        events.add(event.toString());
      }
      traces.add(entry.getKey(), events);
    }
    json.add("traces", traces);
    JsonArray orphans = new JsonArray();
    for (QueuedMessage orphan : result.getOrphanMessages()) {
      orphans.add(orphan.toString());
    }
    json.add("orphanMessages", orphans);
    return json;
  }

  public JsonObject toJson(CfgRunResult result) {
    JsonObject json = new JsonObject();
    json.addProperty("completed", result.isCompleted());
    if (result.getError() != null) {
      json.addProperty("error", result.getError().toString());
    }
    json.addProperty("steps", result.getSteps());
    JsonArray trace = new JsonArray();
    for (CfgEvent event : result.getTrace()) {
      JsonObject e = new JsonObject();
      e.addProperty("step", event.getStep());
      e.addProperty("kind", event.getKind().toString());
      e.addProperty("node", event.getNode());
      e.addProperty("description", event.getDescription());
      trace.add(e);
    }
    json.add("trace", trace);
    return json;
  }

  public String toString(JsonObject json) {
    return gson.toJson(json);
  }

  /**
   * Writes {@code report} to {@code <directory>/<name>.json}, creating the directory first.
   */
  public File write(String name, JsonObject report) throws IOException {
    if (!directory.exists() && !directory.mkdirs()) {
      throw new IOException("Cannot create report directory " + directory.getAbsolutePath());
    }
    File file = new File(directory, name + ".json");
    BufferedWriter bw = new BufferedWriter(
        new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8));
    try {
      bw.write(gson.toJson(report));
    } finally {
      bw.close();
    }
    LOG.info("Report for " + name + " written to " + file.getAbsolutePath());
    return file;
  }

}
