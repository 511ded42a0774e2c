package edu.uchicago.cs.ucare.mpst.simulation;

import java.util.List;
import java.util.Random;

public class RandomScheduler extends Scheduler {

  private final long seed;
  private Random random;

  public RandomScheduler(long seed) {
    this.seed = seed;
    this.random = new Random(seed);
  }

  @Override
  public String nextRole(List<String> ready) {
    return ready.isEmpty() ? null : ready.get(random.nextInt(ready.size()));
  }

  @Override
  public int nextTransition(int executable) {
    return random.nextInt(executable);
  }

  @Override
  public void reset() {
    random = new Random(seed);
  }

}
