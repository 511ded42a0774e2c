package edu.uchicago.cs.ucare.mpst.cfg;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Control-flow graph of one global protocol. Nodes live in an id-addressed arena; recursion
 * back-edges are ordinary edges to an earlier id. Immutable once built.
 */
public class Cfg implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String name;
  private final List<String> roles;
  private final Map<Integer, Node> nodes;
  private final List<Edge> edges;
  private final Map<Integer, List<Edge>> outgoing;
  private final Map<Integer, List<Edge>> incoming;
  private final int initialId;
  private final int terminalId;

  Cfg(String name, List<String> roles, Map<Integer, Node> nodes, List<Edge> edges, int initialId,
      int terminalId) {
    this.name = name;
    this.roles = Collections.unmodifiableList(new ArrayList<String>(roles));
    this.nodes = Collections.unmodifiableMap(new TreeMap<Integer, Node>(nodes));
    this.edges = Collections.unmodifiableList(new ArrayList<Edge>(edges));
    this.initialId = initialId;
    this.terminalId = terminalId;
    Map<Integer, List<Edge>> out = new HashMap<Integer, List<Edge>>();
    Map<Integer, List<Edge>> in = new HashMap<Integer, List<Edge>>();
    for (Integer id : this.nodes.keySet()) {
      out.put(id, new ArrayList<Edge>());
      in.put(id, new ArrayList<Edge>());
    }
    for (Edge edge : this.edges) {
      out.get(edge.getFrom()).add(edge);
      in.get(edge.getTo()).add(edge);
    }
    for (Integer id : this.nodes.keySet()) {
      out.put(id, Collections.unmodifiableList(out.get(id)));
      in.put(id, Collections.unmodifiableList(in.get(id)));
    }
    this.outgoing = out;
    this.incoming = in;
  }

  public String getName() {
    return name;
  }

  public List<String> getRoles() {
    return roles;
  }

  public Node getNode(int id) {
    Node node = nodes.get(id);
    if (node == null) {
      throw new IllegalArgumentException("No node " + id + " in CFG of " + name);
    }
    return node;
  }

  public boolean containsNode(int id) {
    return nodes.containsKey(id);
  }

  /** Nodes in ascending id order. */
  public Collection<Node> getNodes() {
    return nodes.values();
  }

  public List<Node> getNodes(NodeKind kind) {
    List<Node> result = new ArrayList<Node>();
    for (Node node : nodes.values()) {
      if (node.getKind() == kind) {
        result.add(node);
      }
    }
    return result;
  }

  public List<Edge> getEdges() {
    return edges;
  }

  public List<Edge> getOutgoing(int id) {
    List<Edge> out = outgoing.get(id);
    return out == null ? Collections.<Edge>emptyList() : out;
  }

  public List<Edge> getIncoming(int id) {
    List<Edge> in = incoming.get(id);
    return in == null ? Collections.<Edge>emptyList() : in;
  }

  public List<Integer> getSuccessors(int id) {
    List<Integer> result = new ArrayList<Integer>();
    for (Edge edge : getOutgoing(id)) {
      result.add(edge.getTo());
    }
    return result;
  }

  public int getInitialId() {
    return initialId;
  }

  public int getTerminalId() {
    return terminalId;
  }

  public Node getInitial() {
    return nodes.get(initialId);
  }

  public Node getTerminal() {
    return nodes.get(terminalId);
  }

  public int size() {
    return nodes.size();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("CFG ").append(name).append(" (").append(nodes.size()).append(" nodes, ")
        .append(edges.size()).append(" edges)");
    for (Edge edge : edges) {
      sb.append("\n  ").append(nodes.get(edge.getFrom())).append(" -")
          .append(edge.getKind().toString().toLowerCase()).append("-> ")
          .append(nodes.get(edge.getTo()));
    }
    return sb.toString();
  }

}
