package edu.uchicago.cs.ucare.mpst.simulation;

public enum ChoiceStrategy {
  MANUAL, FIRST, RANDOM;

  public static ChoiceStrategy parse(String value) {
    return valueOf(value.trim().toUpperCase());
  }
}
