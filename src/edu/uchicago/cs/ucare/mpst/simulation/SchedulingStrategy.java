package edu.uchicago.cs.ucare.mpst.simulation;

public enum SchedulingStrategy {
  ROUND_ROBIN, RANDOM, FIXED_FIRST;

  /** Accepts the configuration spelling, e.g. round-robin. */
  public static SchedulingStrategy parse(String value) {
    return valueOf(value.trim().toUpperCase().replace('-', '_'));
  }
}
