package edu.uchicago.cs.ucare.mpst.projection;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import edu.uchicago.cs.ucare.mpst.transition.CfsmTransition;

/**
 * Local state machine of one role.
 */
public class Cfsm implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String role;
  private final String protocol;
  private final List<CfsmState> states;
  private final List<CfsmTransition> transitions;
  private final int initialState;
  private final Set<Integer> terminalStates;
  private final Map<Integer, CfsmState> stateIndex;
  private final Map<Integer, List<CfsmTransition>> outgoing;

  public Cfsm(String role, String protocol, List<CfsmState> states,
      List<CfsmTransition> transitions, int initialState, Set<Integer> terminalStates) {
    this.role = role;
    this.protocol = protocol;
    this.states = Collections.unmodifiableList(new ArrayList<CfsmState>(states));
    this.transitions = Collections.unmodifiableList(new ArrayList<CfsmTransition>(transitions));
    this.initialState = initialState;
    this.terminalStates = Collections.unmodifiableSet(new TreeSet<Integer>(terminalStates));
    this.stateIndex = new HashMap<Integer, CfsmState>();
    Map<Integer, List<CfsmTransition>> out = new HashMap<Integer, List<CfsmTransition>>();
    for (CfsmState state : this.states) {
      stateIndex.put(state.getId(), state);
      out.put(state.getId(), new ArrayList<CfsmTransition>());
    }
    if (!stateIndex.containsKey(initialState)) {
      throw new IllegalArgumentException("Initial state s" + initialState + " of " + role
          + " is not a state");
    }
    for (CfsmTransition transition : this.transitions) {
      List<CfsmTransition> list = out.get(transition.getFrom());
      if (list == null || !stateIndex.containsKey(transition.getTo())) {
        throw new IllegalArgumentException("Transition " + transition + " of " + role
            + " refers to an unknown state");
      }
      list.add(transition);
    }
    for (Integer id : stateIndex.keySet()) {
      out.put(id, Collections.unmodifiableList(out.get(id)));
    }
    this.outgoing = out;
  }

  public String getRole() {
    return role;
  }

  public String getProtocol() {
    return protocol;
  }

  public List<CfsmState> getStates() {
    return states;
  }

  public CfsmState getState(int id) {
    return stateIndex.get(id);
  }

  public List<CfsmTransition> getTransitions() {
    return transitions;
  }

  public List<CfsmTransition> getOutgoing(int state) {
    List<CfsmTransition> out = outgoing.get(state);
    return out == null ? Collections.<CfsmTransition>emptyList() : out;
  }

  public CfsmTransition getTransition(int id) {
    for (CfsmTransition transition : transitions) {
      if (transition.getId() == id) {
        return transition;
      }
    }
    return null;
  }

  public int getInitialState() {
    return initialState;
  }

  public Set<Integer> getTerminalStates() {
    return terminalStates;
  }

  public boolean isTerminal(int state) {
    return terminalStates.contains(state);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + role.hashCode();
    result = prime * result + states.hashCode();
    result = prime * result + transitions.hashCode();
    result = prime * result + initialState;
    result = prime * result + terminalStates.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Cfsm other = (Cfsm) obj;
    return role.equals(other.role) && states.equals(other.states)
        && transitions.equals(other.transitions) && initialState == other.initialState
        && terminalStates.equals(other.terminalStates);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("CFSM ").append(protocol).append("@").append(role).append(" initial=s")
        .append(initialState).append(" terminal=").append(terminalStates);
    for (CfsmTransition transition : transitions) {
      sb.append("\n  ").append(transition);
    }
    return sb.toString();
  }

}
