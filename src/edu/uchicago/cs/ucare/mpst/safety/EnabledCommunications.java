package edu.uchicago.cs.ucare.mpst.safety;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class EnabledCommunications {

  private final List<Communication> communications;
  private final boolean terminal;

  public EnabledCommunications(List<Communication> communications, boolean terminal) {
    this.communications = Collections.unmodifiableList(new ArrayList<Communication>(communications));
    this.terminal = terminal;
  }

  public List<Communication> getCommunications() {
    return communications;
  }

  public boolean isTerminal() {
    return terminal;
  }

  /** Nothing can fire although some role has not finished. */
  public boolean isStuck() {
    return communications.isEmpty() && !terminal;
  }

}
