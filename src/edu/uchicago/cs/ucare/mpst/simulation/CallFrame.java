package edu.uchicago.cs.ucare.mpst.simulation;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import edu.uchicago.cs.ucare.mpst.cfg.Marking;

/**
 * One protocol instance on the CFG simulator's call stack. The bottom frame is the simulated
 * protocol itself; every frame above it is a sub-protocol entered through a call node of the
 * frame below. Frames are values, each update returns a new frame.
 */
public final class CallFrame implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String protocol;
  private final Marking marking;
  private final Map<Integer, Integer> iterations;
  private final Map<String, String> roles;
  private final int callNode;
  private final Marking resume;

  private CallFrame(String protocol, Marking marking, Map<Integer, Integer> iterations,
      Map<String, String> roles, int callNode, Marking resume) {
    this.protocol = protocol;
    this.marking = marking;
    this.iterations = iterations;
    this.roles = roles;
    this.callNode = callNode;
    this.resume = resume;
  }

  public static CallFrame root(String protocol, Marking marking) {
    return new CallFrame(protocol, marking, Collections.<Integer, Integer>emptyMap(),
        Collections.<String, String>emptyMap(), -1, null);
  }

  /**
   * @param roles callee role to the role of the simulated protocol playing it
   * @param callNode call node in the caller's graph
   * @param resume caller marking once the call is done
   */
  public static CallFrame call(String protocol, Marking marking, Map<String, String> roles,
      int callNode, Marking resume) {
    return new CallFrame(protocol, marking, Collections.<Integer, Integer>emptyMap(),
        Collections.unmodifiableMap(new LinkedHashMap<String, String>(roles)), callNode, resume);
  }

  public String getProtocol() {
    return protocol;
  }

  public Marking getMarking() {
    return marking;
  }

  /** Times each recursion header of this frame's graph has been entered. */
  public Map<Integer, Integer> getIterations() {
    return iterations;
  }

  public Map<String, String> getRoles() {
    return roles;
  }

  public boolean isRoot() {
    return callNode < 0;
  }

  public int getCallNode() {
    return callNode;
  }

  public Marking getResume() {
    return resume;
  }

  /** The role of the simulated protocol behind {@code role}. */
  public String actual(String role) {
    String mapped = roles.get(role);
    return mapped == null ? role : mapped;
  }

  public List<String> actual(List<String> formal) {
    List<String> mapped = new ArrayList<String>();
    for (String role : formal) {
      mapped.add(actual(role));
    }
    return mapped;
  }

  public CallFrame withMarking(Marking next) {
    return new CallFrame(protocol, next, iterations, roles, callNode, resume);
  }

  public CallFrame withIteration(int node, int count) {
    Map<Integer, Integer> next = new HashMap<Integer, Integer>(iterations);
    next.put(node, count);
    return new CallFrame(protocol, marking, Collections.unmodifiableMap(next), roles, callNode,
        resume);
  }

  @Override
  public String toString() {
    return protocol + (roles.isEmpty() ? "" : roles.toString()) + "@" + marking;
  }

}
