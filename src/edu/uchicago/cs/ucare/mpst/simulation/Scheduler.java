package edu.uchicago.cs.ucare.mpst.simulation;

import java.util.List;

/**
 * Picks which ready role moves next, and which of its executable transitions it takes.
 */
public abstract class Scheduler {

  public abstract String nextRole(List<String> ready);

  public int nextTransition(int executable) {
    return 0;
  }

  public void reset() {
  }

  public static Scheduler create(SchedulingStrategy strategy, List<String> roles, long seed) {
    switch (strategy) {
    case ROUND_ROBIN:
      return new RoundRobinScheduler(roles);
    case RANDOM:
      return new RandomScheduler(seed);
    case FIXED_FIRST:
      return new FixedFirstScheduler();
    default:
      throw new IllegalArgumentException("Unknown scheduling strategy " + strategy);
    }
  }

}
