package edu.uchicago.cs.ucare.mpst.safety;

import java.util.List;
import java.util.Random;

/**
 * Resolves the choice between several enabled communications.
 */
public abstract class CommunicationSelector {

  public abstract Communication select(List<Communication> enabled);

  public static final CommunicationSelector FIRST = new CommunicationSelector() {
    @Override
    public Communication select(List<Communication> enabled) {
      return enabled.get(0);
    }
  };

  public static CommunicationSelector random(long seed) {
    final Random random = new Random(seed);
    return new CommunicationSelector() {
      @Override
      public Communication select(List<Communication> enabled) {
        return enabled.get(random.nextInt(enabled.size()));
      }
    };
  }

}
