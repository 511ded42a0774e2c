package edu.uchicago.cs.ucare.mpst.simulation;

import java.util.List;

public class FixedFirstScheduler extends Scheduler {

  @Override
  public String nextRole(List<String> ready) {
    return ready.isEmpty() ? null : ready.get(0);
  }

}
