package edu.uchicago.cs.ucare.mpst.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Protocol declarations of one module, addressable by name for sub-protocol calls.
 */
public class ProtocolRegistry {

  protected final static Logger LOG = LoggerFactory.getLogger(ProtocolRegistry.class);

  private final Map<String, Protocol> protocols;

  public ProtocolRegistry() {
    protocols = new LinkedHashMap<String, Protocol>();
  }

  public void register(Protocol protocol) throws ProtocolRegistryException {
    if (protocols.containsKey(protocol.getName())) {
      throw new ProtocolRegistryException("Protocol " + protocol.getName() + " is already registered");
    }
    protocols.put(protocol.getName(), protocol);
    LOG.debug("Registered protocol " + protocol.getName());
  }

  public boolean contains(String name) {
    return protocols.containsKey(name);
  }

  public Protocol get(String name) {
    return protocols.get(name);
  }

  public Collection<Protocol> getProtocols() {
    return Collections.unmodifiableCollection(protocols.values());
  }

  /**
   * Checks a single call site against the registered callee.
   */
  public void checkCall(Do call) throws ProtocolRegistryException {
    Protocol callee = protocols.get(call.getProtocol());
    if (callee == null) {
      throw new ProtocolRegistryException("Sub-protocol " + call.getProtocol() + " is not defined");
    }
    if (callee.getRoles().size() != call.getRoleArguments().size()) {
      throw new ProtocolRegistryException("Sub-protocol " + call.getProtocol() + " expects "
          + callee.getRoles().size() + " roles but got " + call.getRoleArguments().size());
    }
  }

  /**
   * Validates every call site and rejects cyclic sub-protocol calls.
   */
  public void validate() throws ProtocolRegistryException {
    for (Protocol protocol : protocols.values()) {
      for (Interaction interaction : protocol.findAll(InteractionKind.DO)) {
        checkCall((Do) interaction);
      }
    }
    Set<String> done = new HashSet<String>();
    for (String name : protocols.keySet()) {
      findCycle(name, new LinkedList<String>(), done);
    }
  }

  public List<String> getCallees(String name) {
    List<String> callees = new ArrayList<String>();
    Protocol protocol = protocols.get(name);
    if (protocol == null) {
      return callees;
    }
    for (Interaction interaction : protocol.findAll(InteractionKind.DO)) {
      String callee = ((Do) interaction).getProtocol();
      if (!callees.contains(callee)) {
        callees.add(callee);
      }
    }
    return callees;
  }

  private void findCycle(String name, LinkedList<String> path, Set<String> done)
      throws ProtocolRegistryException {
    if (done.contains(name)) {
      return;
    }
    if (path.contains(name)) {
      path.add(name);
      throw new ProtocolRegistryException("Cyclic sub-protocol calls: " + String.join(" -> ",
          path.subList(path.indexOf(name), path.size())));
    }
    path.add(name);
    for (String callee : getCallees(name)) {
      findCycle(callee, path, done);
    }
    path.removeLast();
    done.add(name);
  }

}
