package edu.uchicago.cs.ucare.mpst.simulation;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * Bounded stack of past snapshots; the oldest are dropped once the bound is hit.
 */
public class ExecutionHistory {

  private final int maxSnapshots;
  private final LinkedList<CfgSnapshot> snapshots;

  public ExecutionHistory(int maxSnapshots) {
    this.maxSnapshots = maxSnapshots;
    this.snapshots = new LinkedList<CfgSnapshot>();
  }

  public void push(CfgSnapshot snapshot) {
    snapshots.addLast(snapshot);
    while (snapshots.size() > maxSnapshots) {
      snapshots.removeFirst();
    }
  }

  public CfgSnapshot pop() {
    return snapshots.isEmpty() ? null : snapshots.removeLast();
  }

  public boolean isEmpty() {
    return snapshots.isEmpty();
  }

  public int size() {
    return snapshots.size();
  }

  public void clear() {
    snapshots.clear();
  }

  public List<CfgSnapshot> getSnapshots() {
    return new ArrayList<CfgSnapshot>(snapshots);
  }

}
