package edu.uchicago.cs.ucare.mpst.cfg;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uchicago.cs.ucare.mpst.ast.Choice;
import edu.uchicago.cs.ucare.mpst.ast.ChoiceBranch;
import edu.uchicago.cs.ucare.mpst.ast.Continue;
import edu.uchicago.cs.ucare.mpst.ast.CreateParticipants;
import edu.uchicago.cs.ucare.mpst.ast.Do;
import edu.uchicago.cs.ucare.mpst.ast.Interaction;
import edu.uchicago.cs.ucare.mpst.ast.Invitation;
import edu.uchicago.cs.ucare.mpst.ast.MessageTransfer;
import edu.uchicago.cs.ucare.mpst.ast.Parallel;
import edu.uchicago.cs.ucare.mpst.ast.Protocol;
import edu.uchicago.cs.ucare.mpst.ast.ProtocolRegistry;
import edu.uchicago.cs.ucare.mpst.ast.ProtocolRegistryException;
import edu.uchicago.cs.ucare.mpst.ast.Recursion;

/**
 * Turns a protocol tree into a {@link Cfg}. Each interaction sequence is built from its last
 * element backwards, every element receiving the entry node of what follows it as its exit.
 */
public class CfgBuilder {

  protected final static Logger LOG = LoggerFactory.getLogger(CfgBuilder.class);

  private final NodeIdAllocator allocator;

  public CfgBuilder() {
    this(NodeIdAllocator.shared());
  }

  public CfgBuilder(NodeIdAllocator allocator) {
    this.allocator = allocator;
  }

  public NodeIdAllocator getAllocator() {
    return allocator;
  }

  public Cfg build(Protocol protocol) throws CfgBuildException {
    return build(protocol, null);
  }

  /**
   * Builds the graph, checking sub-protocol calls against the registry when one is given.
   */
  public Cfg build(Protocol protocol, ProtocolRegistry registry) throws CfgBuildException {
    Set<String> declared = new HashSet<String>();
    for (String role : protocol.getRoles()) {
      if (!declared.add(role)) {
        throw new CfgBuildException(protocol.getName(), "role " + role + " is declared twice");
      }
    }
    BuildContext ctx = new BuildContext(protocol.getName(),
        new LinkedHashSet<String>(protocol.getAllRoles()), registry);

    int initialId = allocator.allocate();
    ctx.addNode(new Node(initialId, NodeKind.INITIAL));
    int terminalId = allocator.allocate();
    ctx.addNode(new Node(terminalId, NodeKind.TERMINAL));

    int entry = buildSequence(protocol.getBody(), terminalId, ctx);
    ctx.link(initialId, entry, EdgeKind.SEQUENCE, null);

    Cfg cfg = new Cfg(protocol.getName(), new ArrayList<String>(ctx.roles), ctx.nodes, ctx.edges,
        initialId, terminalId);
    LOG.debug("Built " + cfg);
    return cfg;
  }

  private int buildSequence(List<Interaction> body, int exit, BuildContext ctx)
      throws CfgBuildException {
    int next = exit;
    for (int i = body.size() - 1; i >= 0; i--) {
      next = buildInteraction(body.get(i), next, ctx);
    }
    return next;
  }

  private int buildInteraction(Interaction interaction, int exit, BuildContext ctx)
      throws CfgBuildException {
    switch (interaction.getKind()) {
    case MESSAGE_TRANSFER:
      return buildMessage((MessageTransfer) interaction, exit, ctx);
    case CHOICE:
      return buildChoice((Choice) interaction, exit, ctx);
    case PARALLEL:
      return buildParallel((Parallel) interaction, exit, ctx);
    case RECURSION:
      return buildRecursion((Recursion) interaction, exit, ctx);
    case CONTINUE:
      return resolveContinue((Continue) interaction, ctx);
    case DO:
      return buildCall((Do) interaction, exit, ctx);
    case NEW_ROLE:
      // collected up front by Protocol.getAllRoles
      return exit;
    case CREATE_PARTICIPANTS: {
      CreateParticipants create = (CreateParticipants) interaction;
      ctx.checkRoles(create.getReferencedRoles());
      return buildAction(new CreateParticipantsAction(create.getCreator(), create.getRole()),
          exit, EdgeKind.SEQUENCE, ctx);
    }
    case INVITATION: {
      Invitation invitation = (Invitation) interaction;
      ctx.checkRoles(invitation.getReferencedRoles());
      return buildAction(new InvitationAction(invitation.getInviter(), invitation.getInvitee()),
          exit, EdgeKind.SEQUENCE, ctx);
    }
    default:
      throw new CfgBuildException(ctx.protocol, "unsupported interaction " + interaction.getKind());
    }
  }

  private int buildMessage(MessageTransfer transfer, int exit, BuildContext ctx)
      throws CfgBuildException {
    if (transfer.getTo().isEmpty()) {
      throw new CfgBuildException(ctx.protocol, "message " + transfer.getMessage().getLabel()
          + " from " + transfer.getFrom() + " has no receiver");
    }
    ctx.checkRoles(transfer.getReferencedRoles());
    MessageAction action = new MessageAction(transfer.getFrom(), transfer.getTo(),
        transfer.getMessage());
    return buildAction(action, exit, EdgeKind.MESSAGE, ctx);
  }

  private int buildAction(Action action, int exit, EdgeKind kind, BuildContext ctx) {
    int id = allocator.allocate();
    ctx.addNode(new ActionNode(id, action));
    ctx.link(id, exit, kind, null);
    return id;
  }

  private int buildChoice(Choice choice, int exit, BuildContext ctx) throws CfgBuildException {
    ctx.checkRole(choice.getDecider());
    if (choice.getBranches().size() < 2) {
      throw new CfgBuildException(ctx.protocol, "choice at " + choice.getDecider()
          + " needs at least two branches");
    }
    int mergeId = allocator.allocate();
    ctx.addNode(new Node(mergeId, NodeKind.MERGE));
    ctx.link(mergeId, exit, EdgeKind.SEQUENCE, null);

    List<Integer> entries = new ArrayList<Integer>();
    for (ChoiceBranch branch : choice.getBranches()) {
      entries.add(buildSequence(branch.getBody(), mergeId, ctx));
    }
    int branchId = allocator.allocate();
    ctx.addNode(new BranchNode(branchId, choice.getDecider(), mergeId));
    for (int i = 0; i < entries.size(); i++) {
      String label = choice.getBranches().get(i).getLabel();
      ctx.link(branchId, entries.get(i), EdgeKind.BRANCH, label == null ? "branch" + i : label);
    }
    return branchId;
  }

  private int buildParallel(Parallel parallel, int exit, BuildContext ctx)
      throws CfgBuildException {
    int count = parallel.getBranches().size();
    if (count < 2) {
      throw new CfgBuildException(ctx.protocol, "parallel block needs at least two branches");
    }
    int joinId = allocator.allocate();
    int forkId = allocator.allocate();
    ctx.addNode(new JoinNode(joinId, forkId, count));
    ctx.link(joinId, exit, EdgeKind.SEQUENCE, null);

    ctx.parallelDepth++;
    List<Integer> entries = new ArrayList<Integer>();
    for (List<Interaction> branch : parallel.getBranches()) {
      entries.add(buildSequence(branch, joinId, ctx));
    }
    ctx.parallelDepth--;

    ctx.addNode(new ForkNode(forkId, forkId, joinId));
    for (int i = 0; i < entries.size(); i++) {
      ctx.link(forkId, entries.get(i), EdgeKind.FORK, "branch" + i);
    }
    return forkId;
  }

  private int buildRecursion(Recursion recursion, int exit, BuildContext ctx)
      throws CfgBuildException {
    int headerId = allocator.allocate();
    ctx.addNode(new RecursionNode(headerId, recursion.getLabel()));
    ctx.recStack.push(new RecScope(recursion.getLabel(), headerId, ctx.parallelDepth));
    int entry = buildSequence(recursion.getBody(), exit, ctx);
    ctx.link(headerId, entry, EdgeKind.SEQUENCE, null);
    ctx.recStack.pop();
    return headerId;
  }

  private int resolveContinue(Continue cont, BuildContext ctx) throws CfgBuildException {
    RecScope scope = ctx.findScope(cont.getLabel());
    if (scope == null) {
      throw new CfgBuildException(ctx.protocol, "continue " + cont.getLabel()
          + " has no enclosing rec " + cont.getLabel());
    }
    if (scope.parallelDepth != ctx.parallelDepth) {
      throw new CfgBuildException(ctx.protocol, "continue " + cont.getLabel()
          + " leaves the parallel branch it appears in");
    }
    return scope.headerId;
  }

  private int buildCall(Do call, int exit, BuildContext ctx) throws CfgBuildException {
    ctx.checkRoles(call.getRoleArguments());
    if (ctx.registry != null) {
      try {
        ctx.registry.checkCall(call);
      } catch (ProtocolRegistryException e) {
        throw new CfgBuildException(ctx.protocol, e.getMessage(), e);
      }
    }
    int id = allocator.allocate();
    ctx.addNode(new CallNode(id, call.getProtocol(), call.getRoleArguments()));
    ctx.link(id, exit, EdgeKind.SEQUENCE, null);
    return id;
  }

  private static class RecScope {

    final String label;
    final int headerId;
    final int parallelDepth;

    RecScope(String label, int headerId, int parallelDepth) {
      this.label = label;
      this.headerId = headerId;
      this.parallelDepth = parallelDepth;
    }

  }

  private static class BuildContext {

    final String protocol;
    final Set<String> roles;
    final ProtocolRegistry registry;
    final TreeMap<Integer, Node> nodes;
    final List<Edge> edges;
    final LinkedList<RecScope> recStack;
    int parallelDepth;

    BuildContext(String protocol, Set<String> roles, ProtocolRegistry registry) {
      this.protocol = protocol;
      this.roles = roles;
      this.registry = registry;
      this.nodes = new TreeMap<Integer, Node>();
      this.edges = new ArrayList<Edge>();
      this.recStack = new LinkedList<RecScope>();
      this.parallelDepth = 0;
    }

    void addNode(Node node) {
      nodes.put(node.getId(), node);
    }

    // an edge into a header of an enclosing rec is a back-edge
    void link(int from, int to, EdgeKind kind, String label) {
      EdgeKind actual = kind;
      for (RecScope scope : recStack) {
        if (scope.headerId == to) {
          actual = EdgeKind.CONTINUE;
          break;
        }
      }
      edges.add(new Edge(from, to, actual, label));
    }

    RecScope findScope(String label) {
      Iterator<RecScope> it = recStack.iterator();
      while (it.hasNext()) {
        RecScope scope = it.next();
        if (scope.label.equals(label)) {
          return scope;
        }
      }
      return null;
    }

    void checkRole(String role) throws CfgBuildException {
      if (!roles.contains(role)) {
        throw new CfgBuildException(protocol, "role " + role + " is not declared");
      }
    }

    void checkRoles(List<String> refs) throws CfgBuildException {
      for (String role : refs) {
        checkRole(role);
      }
    }

  }

}
