package edu.uchicago.cs.ucare.mpst.cfg;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Positions of the control tokens in a CFG, kept as a sorted multiset of node ids. A single
 * token is enough outside parallel blocks.
 */
public final class Marking implements Serializable {

  private static final long serialVersionUID = 1L;

  private final int[] tokens;

  private Marking(int[] sortedTokens) {
    this.tokens = sortedTokens;
  }

  public static Marking of(int... tokens) {
    int[] copy = Arrays.copyOf(tokens, tokens.length);
    Arrays.sort(copy);
    return new Marking(copy);
  }

  public int[] getTokens() {
    return Arrays.copyOf(tokens, tokens.length);
  }

  public int size() {
    return tokens.length;
  }

  public int count(int node) {
    int count = 0;
    for (int token : tokens) {
      if (token == node) {
        count++;
      }
    }
    return count;
  }

  public boolean contains(int node) {
    return count(node) > 0;
  }

  /**
   * Removes one token from {@code node} and adds one token on each of {@code targets}.
   */
  public Marking move(int node, int... targets) {
    return moveAll(node, 1, targets);
  }

  /**
   * Removes {@code removed} tokens from {@code node} and adds one token on each target.
   */
  public Marking moveAll(int node, int removed, int... targets) {
    int[] next = new int[tokens.length - removed + targets.length];
    int pos = 0;
    int skipped = 0;
    for (int token : tokens) {
      if (token == node && skipped < removed) {
        skipped++;
        continue;
      }
      next[pos++] = token;
    }
    if (skipped < removed) {
      throw new IllegalArgumentException("Marking " + this + " has fewer than " + removed
          + " tokens on node " + node);
    }
    for (int target : targets) {
      next[pos++] = target;
    }
    Arrays.sort(next);
    return new Marking(next);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(tokens);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    return Arrays.equals(tokens, ((Marking) obj).tokens);
  }

  @Override
  public String toString() {
    return Arrays.toString(tokens);
  }

}
