package edu.uchicago.cs.ucare.mpst.cfg;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Source of CFG node ids. Ids handed out by one allocator never repeat, so graphs built from
 * the same allocator can be composed without renumbering.
 */
public class NodeIdAllocator {

  private static final NodeIdAllocator SHARED = new NodeIdAllocator();

  private final AtomicInteger next;

  public NodeIdAllocator() {
    this(0);
  }

  public NodeIdAllocator(int first) {
    next = new AtomicInteger(first);
  }

  /** Allocator shared by every builder created without an explicit one. */
  public static NodeIdAllocator shared() {
    return SHARED;
  }

  public int allocate() {
    return next.getAndIncrement();
  }

  public int peek() {
    return next.get();
  }

}
