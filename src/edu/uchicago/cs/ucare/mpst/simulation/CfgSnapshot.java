package edu.uchicago.cs.ucare.mpst.simulation;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import edu.uchicago.cs.ucare.mpst.cfg.Marking;

/**
 * Complete state of a CFG simulation at one point, never modified once taken.
 */
public final class CfgSnapshot implements Serializable {

  private static final long serialVersionUID = 1L;

  private final List<CallFrame> frames;
  private final int step;
  private final List<CfgEvent> trace;
  private final boolean completed;

  public CfgSnapshot(List<CallFrame> frames, int step, List<CfgEvent> trace, boolean completed) {
    this.frames = Collections.unmodifiableList(new ArrayList<CallFrame>(frames));
    this.step = step;
    this.trace = Collections.unmodifiableList(new ArrayList<CfgEvent>(trace));
    this.completed = completed;
  }

  /** Marking of the innermost running protocol. */
  public Marking getMarking() {
    return frames.get(frames.size() - 1).getMarking();
  }

  public int getStep() {
    return step;
  }

  public Map<Integer, Integer> getIterations() {
    return frames.get(frames.size() - 1).getIterations();
  }

  /** Call stack, the simulated protocol first. */
  public List<CallFrame> getFrames() {
    return frames;
  }

  /** Number of sub-protocols currently entered. */
  public int getCallDepth() {
    return frames.size() - 1;
  }

  public List<CfgEvent> getTrace() {
    return trace;
  }

  public boolean isCompleted() {
    return completed;
  }

}
