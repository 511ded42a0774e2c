package edu.uchicago.cs.ucare.mpst.simulation;

import java.util.ArrayList;
import java.util.List;

public class RoundRobinScheduler extends Scheduler {

  private final List<String> roles;
  private int last;

  public RoundRobinScheduler(List<String> roles) {
    this.roles = new ArrayList<String>(roles);
    this.last = -1;
  }

  @Override
  public String nextRole(List<String> ready) {
    for (int i = 1; i <= roles.size(); i++) {
      int candidate = (last + i) % roles.size();
      if (ready.contains(roles.get(candidate))) {
        last = candidate;
        return roles.get(candidate);
      }
    }
    return null;
  }

  @Override
  public void reset() {
    last = -1;
  }

}
