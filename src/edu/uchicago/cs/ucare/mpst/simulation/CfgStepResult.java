package edu.uchicago.cs.ucare.mpst.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CfgStepResult {

  private final CfgErrorKind error;
  private final String message;
  private final List<CfgEvent> events;
  private final List<String> choices;
  private final CfgSnapshot snapshot;

  public CfgStepResult(CfgErrorKind error, String message, List<CfgEvent> events,
      List<String> choices, CfgSnapshot snapshot) {
    this.error = error;
    this.message = message;
    this.events = Collections.unmodifiableList(new ArrayList<CfgEvent>(events));
    this.choices = Collections.unmodifiableList(new ArrayList<String>(choices));
    this.snapshot = snapshot;
  }

  public boolean isSuccess() {
    return error == null;
  }

  /** Null on success. */
  public CfgErrorKind getError() {
    return error;
  }

  public String getMessage() {
    return message;
  }

  public List<CfgEvent> getEvents() {
    return events;
  }

  /** Branch labels to pick from when the error is {@link CfgErrorKind#CHOICE_REQUIRED}. */
  public List<String> getChoices() {
    return choices;
  }

  public CfgSnapshot getSnapshot() {
    return snapshot;
  }

  @Override
  public String toString() {
    return (error == null ? "OK" : error + ": " + message) + " " + events;
  }

}
