package edu.uchicago.cs.ucare.mpst.safety;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import edu.uchicago.cs.ucare.mpst.projection.Cfsm;

/**
 * Current state of every role's machine. Contexts are values: equality only looks at the
 * role to state map, and every update returns a new context.
 */
public final class TypingContext implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String protocol;
  private final Map<String, Cfsm> machines;
  private final Map<String, Integer> states;

  private TypingContext(String protocol, Map<String, Cfsm> machines, Map<String, Integer> states) {
    this.protocol = protocol;
    this.machines = machines;
    this.states = states;
  }

  /**
   * Every role at its machine's initial state, before tau closure. Use
   * {@link ContextReducer#initialContext(Map)} for the closed context.
   */
  public static TypingContext of(Map<String, Cfsm> cfsms) {
    Map<String, Cfsm> machines = new LinkedHashMap<String, Cfsm>(cfsms);
    Map<String, Integer> states = new LinkedHashMap<String, Integer>();
    String protocol = null;
    for (Map.Entry<String, Cfsm> entry : machines.entrySet()) {
      states.put(entry.getKey(), entry.getValue().getInitialState());
      protocol = entry.getValue().getProtocol();
    }
    return new TypingContext(protocol, Collections.unmodifiableMap(machines),
        Collections.unmodifiableMap(states));
  }

  public String getProtocol() {
    return protocol;
  }

  public List<String> getRoles() {
    return new ArrayList<String>(states.keySet());
  }

  public boolean hasRole(String role) {
    return states.containsKey(role);
  }

  public Cfsm getCfsm(String role) {
    Cfsm cfsm = machines.get(role);
    if (cfsm == null) {
      throw new IllegalArgumentException("Role " + role + " is not part of this context");
    }
    return cfsm;
  }

  public int getState(String role) {
    Integer state = states.get(role);
    if (state == null) {
      throw new IllegalArgumentException("Role " + role + " is not part of this context");
    }
    return state;
  }

  public Map<String, Integer> getStates() {
    return states;
  }

  public TypingContext withState(String role, int state) {
    Map<String, Integer> updates = new LinkedHashMap<String, Integer>();
    updates.put(role, state);
    return withStates(updates);
  }

  public TypingContext withStates(Map<String, Integer> updates) {
    Map<String, Integer> next = new LinkedHashMap<String, Integer>(states);
    for (Map.Entry<String, Integer> update : updates.entrySet()) {
      Cfsm cfsm = getCfsm(update.getKey());
      if (cfsm.getState(update.getValue()) == null) {
        throw new IllegalArgumentException("Role " + update.getKey() + " has no state s"
            + update.getValue());
      }
      next.put(update.getKey(), update.getValue());
    }
    return new TypingContext(protocol, machines, Collections.unmodifiableMap(next));
  }

  /** Every role sits in a terminal state of its machine. */
  public boolean isTerminal() {
    for (Map.Entry<String, Integer> entry : states.entrySet()) {
      if (!machines.get(entry.getKey()).isTerminal(entry.getValue())) {
        return false;
      }
    }
    return true;
  }

  /** Role-sorted rendering, stable across role declaration orders. */
  public String key() {
    return new TreeMap<String, Integer>(states).toString();
  }

  @Override
  public int hashCode() {
    return states.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    return states.equals(((TypingContext) obj).states);
  }

  @Override
  public String toString() {
    return key();
  }

}
