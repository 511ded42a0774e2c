package edu.uchicago.cs.ucare.mpst.simulation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uchicago.cs.ucare.mpst.ast.Protocol;
import edu.uchicago.cs.ucare.mpst.ast.ProtocolRegistry;
import edu.uchicago.cs.ucare.mpst.cfg.Action;
import edu.uchicago.cs.ucare.mpst.cfg.ActionNode;
import edu.uchicago.cs.ucare.mpst.cfg.BranchNode;
import edu.uchicago.cs.ucare.mpst.cfg.CallNode;
import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.CfgBuildException;
import edu.uchicago.cs.ucare.mpst.cfg.CfgBuilder;
import edu.uchicago.cs.ucare.mpst.cfg.CreateParticipantsAction;
import edu.uchicago.cs.ucare.mpst.cfg.Edge;
import edu.uchicago.cs.ucare.mpst.cfg.InvitationAction;
import edu.uchicago.cs.ucare.mpst.cfg.Marking;
import edu.uchicago.cs.ucare.mpst.cfg.MessageAction;
import edu.uchicago.cs.ucare.mpst.cfg.Move;
import edu.uchicago.cs.ucare.mpst.cfg.MoveKind;
import edu.uchicago.cs.ucare.mpst.cfg.NodeIdAllocator;
import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;
import edu.uchicago.cs.ucare.mpst.cfg.RecursionNode;
import edu.uchicago.cs.ucare.mpst.cfg.TokenGame;
import edu.uchicago.cs.ucare.mpst.util.MpstConfig;

/**
 * Walks the global CFG one observable event at a time. Structural moves (entry, merges) are
 * taken silently; every other move is a step. Past states are kept as snapshots so a run can be
 * stepped back and replayed.
 * <p>
 * A call node enters the callee's graph, looked up in the protocol registry, on a call stack.
 * Events inside the callee name the caller's roles. Once the callee reaches its terminal node it
 * is left and the caller goes on past the call.
 */
public class CfgSimulator {

  protected final static Logger LOG = LoggerFactory.getLogger(CfgSimulator.class);

  public static final int DEFAULT_MAX_CALL_DEPTH = 100;

  private final Cfg cfg;
  private final TokenGame game;
  private final ProtocolRegistry registry;
  private final ChoiceStrategy choiceStrategy;
  private final int maxSteps;
  private final long seed;
  private final int maxCallDepth;
  private final ExecutionHistory history;
  private final LinkedList<CfgSnapshot> redo;
  private final Map<String, Cfg> callees;
  private final Map<String, TokenGame> calleeGames;

  private Random random;
  private LinkedList<CallFrame> frames;
  private int steps;
  private List<CfgEvent> trace;
  private boolean completed;
  private int pendingBranch;

  public CfgSimulator(Cfg cfg, ChoiceStrategy choiceStrategy, int maxSteps, long seed,
      int historyLimit) {
    this(cfg, null, choiceStrategy, maxSteps, seed, historyLimit, DEFAULT_MAX_CALL_DEPTH);
  }

  /**
   * @param registry resolves sub-protocol calls; without one a call stops the simulation with
   *     {@link CfgErrorKind#NO_REGISTRY}
   */
  public CfgSimulator(Cfg cfg, ProtocolRegistry registry, ChoiceStrategy choiceStrategy,
      int maxSteps, long seed, int historyLimit, int maxCallDepth) {
    this.cfg = cfg;
    this.game = new TokenGame(cfg);
    this.registry = registry;
    this.choiceStrategy = choiceStrategy;
    this.maxSteps = maxSteps;
    this.seed = seed;
    this.maxCallDepth = maxCallDepth;
    this.history = new ExecutionHistory(historyLimit);
    this.redo = new LinkedList<CfgSnapshot>();
    this.callees = new HashMap<String, Cfg>();
    this.calleeGames = new HashMap<String, TokenGame>();
    reset();
  }

  public CfgSimulator(Cfg cfg, MpstConfig config) {
    this(cfg, null, config);
  }

  public CfgSimulator(Cfg cfg, ProtocolRegistry registry, MpstConfig config) {
    this(cfg, registry, ChoiceStrategy.parse(config.getChoiceStrategy()), config.getMaxSteps(),
        config.getRandomSeed(), config.getHistoryMaxSnapshots(), config.getMaxCallDepth());
  }

  public void reset() {
    random = new Random(seed);
    frames = new LinkedList<CallFrame>();
    frames.add(CallFrame.root(cfg.getName(), game.initialMarking()));
    steps = 0;
    trace = new ArrayList<CfgEvent>();
    completed = false;
    pendingBranch = -1;
    history.clear();
    redo.clear();
  }

  /**
   * Fires silent moves until one observable move has fired. Under the manual strategy a choice
   * point stops the step with {@link CfgErrorKind#CHOICE_REQUIRED}; call {@link #choose(int)}.
   */
  public CfgStepResult step() {
    return advance(-1);
  }

  /**
   * Resolves the pending choice with branch {@code index} and fires it.
   */
  public CfgStepResult choose(int index) {
    if (pendingBranch < 0) {
      return error(CfgErrorKind.INVALID_CHOICE, "No choice is pending");
    }
    int branches = currentCfg().getOutgoing(pendingBranch).size();
    if (index < 0 || index >= branches) {
      return error(CfgErrorKind.INVALID_CHOICE, "Choice " + index + " out of range, "
          + branches + " branches available");
    }
    return advance(index);
  }

  public CfgStepResult stepBack() {
    CfgSnapshot previous = history.pop();
    if (previous == null) {
      return error(CfgErrorKind.NO_HISTORY, "Nothing to step back to");
    }
    redo.push(getSnapshot());
    restore(previous);
    return new CfgStepResult(null, "Stepped back to step " + steps, new ArrayList<CfgEvent>(),
        new ArrayList<String>(), getSnapshot());
  }

  /**
   * Replays an undone step if there is one, otherwise takes a fresh step.
   */
  public CfgStepResult stepForward() {
    if (redo.isEmpty()) {
      return step();
    }
    CfgSnapshot before = getSnapshot();
    CfgSnapshot next = redo.pop();
    history.push(before);
    restore(next);
    List<CfgEvent> replayed = new ArrayList<CfgEvent>(
        next.getTrace().subList(before.getTrace().size(), next.getTrace().size()));
    return new CfgStepResult(null, "Replayed step " + steps, replayed, new ArrayList<String>(),
        getSnapshot());
  }

  /**
   * Steps until the protocol completes or a step fails.
   */
  public CfgRunResult run() {
    CfgErrorKind stopped = null;
    while (!completed) {
      CfgStepResult result = step();
      if (!result.isSuccess()) {
        stopped = result.getError();
        break;
      }
    }
    LOG.info("Simulation of " + cfg.getName() + " "
        + (completed ? "completed" : "stopped with " + stopped) + " after " + steps + " steps");
    return new CfgRunResult(completed, stopped, steps, trace);
  }

  public CfgSnapshot getSnapshot() {
    return new CfgSnapshot(frames, steps, trace, completed);
  }

  public boolean isCompleted() {
    return completed;
  }

  public int getSteps() {
    return steps;
  }

  /** Marking of the innermost running protocol. */
  public Marking getMarking() {
    return frames.getLast().getMarking();
  }

  /** Number of sub-protocols currently entered. */
  public int getCallDepth() {
    return frames.size() - 1;
  }

  public List<CallFrame> getCallStack() {
    return new ArrayList<CallFrame>(frames);
  }

  public List<CfgEvent> getTrace() {
    return new ArrayList<CfgEvent>(trace);
  }

  public ExecutionHistory getHistory() {
    return history;
  }

  /** Branch labels of the choice waiting for {@link #choose(int)}, empty if none. */
  public List<String> getPendingChoices() {
    List<String> choices = new ArrayList<String>();
    if (pendingBranch >= 0) {
      for (Edge edge : currentCfg().getOutgoing(pendingBranch)) {
        choices.add(edge.getLabel());
      }
    }
    return choices;
  }

  private CfgStepResult advance(int chosen) {
    if (completed) {
      return error(CfgErrorKind.ALREADY_COMPLETED, "Protocol " + cfg.getName()
          + " already completed");
    }
    List<CfgEvent> events = new ArrayList<CfgEvent>();
    if (steps >= maxSteps) {
      unwind(events);
      return error(CfgErrorKind.BUDGET_EXCEEDED, "Maximum steps (" + maxSteps + ") reached",
          events);
    }
    CfgSnapshot before = getSnapshot();
    while (true) {
      CallFrame frame = frames.getLast();
      TokenGame current = currentGame();
      if (current.isFinal(frame.getMarking())) {
        if (frame.isRoot()) {
          complete(events);
          break;
        }
        exit(events);
        continue;
      }
      List<Move> moves = current.moves(frame.getMarking());
      if (moves.isEmpty()) {
        String message = "No move enabled at marking " + frame.getMarking() + " of "
            + frame.getProtocol();
        unwind(events);
        return error(CfgErrorKind.STUCK, message, events);
      }
      Move move = pick(moves, chosen);
      if (move == null) {
        return new CfgStepResult(CfgErrorKind.CHOICE_REQUIRED, "Choice at "
            + currentCfg().getNode(pendingBranch) + " must be resolved with choose()", events,
            getPendingChoices(), getSnapshot());
      }
      if (move.getKind() == MoveKind.CALL) {
        CfgStepResult refused = enter(move, events);
        if (refused != null) {
          return refused;
        }
        settle(events);
        break;
      }
      frames.set(frames.size() - 1, frame.withMarking(move.getTarget()));
      CfgEvent event = describe(move);
      if (event != null) {
        steps++;
        events.add(event);
        trace.add(event);
        pendingBranch = -1;
        settle(events);
        break;
      }
    }
    history.push(before);
    redo.clear();
    LOG.debug("Step " + steps + " of " + cfg.getName() + ": " + events);
    return new CfgStepResult(null, null, events, new ArrayList<String>(), getSnapshot());
  }

  /**
   * Non-branch moves go first so a choice is only taken once nothing else can run. Returns null
   * when a manual choice is needed.
   */
  private Move pick(List<Move> moves, int chosen) {
    for (Move move : moves) {
      if (move.getKind() != MoveKind.BRANCH) {
        return move;
      }
    }
    int branch = moves.get(0).getNode().getId();
    List<Move> options = new ArrayList<Move>();
    for (Move move : moves) {
      if (move.getNode().getId() == branch) {
        options.add(move);
      }
    }
    pendingBranch = branch;
    if (chosen >= 0) {
      return options.get(chosen);
    }
    switch (choiceStrategy) {
    case FIRST:
      return options.get(0);
    case RANDOM:
      return options.get(random.nextInt(options.size()));
    case MANUAL:
      return null;
    default:
      throw new IllegalStateException("Unknown choice strategy " + choiceStrategy);
    }
  }

  /**
   * Pushes the callee of a call move. Null on success, otherwise the failed step; the caller is
   * left in front of the call.
   */
  private CfgStepResult enter(Move move, List<CfgEvent> events) {
    CallNode call = (CallNode) move.getNode();
    CallFrame caller = frames.getLast();
    if (registry == null) {
      return error(CfgErrorKind.NO_REGISTRY, "Cannot enter " + call.getProtocol()
          + ", no protocol registry to look it up in", events);
    }
    if (getCallDepth() >= maxCallDepth) {
      unwind(events);
      return error(CfgErrorKind.CALL_DEPTH_EXCEEDED, "Maximum call depth (" + maxCallDepth
          + ") reached entering " + call.getProtocol(), events);
    }
    Protocol callee = registry.get(call.getProtocol());
    if (callee == null) {
      return error(CfgErrorKind.INVALID_CALL, "Sub-protocol " + call.getProtocol()
          + " is not defined", events);
    }
    if (callee.getRoles().size() != call.getRoleArguments().size()) {
      return error(CfgErrorKind.INVALID_CALL, "Sub-protocol " + call.getProtocol() + " expects "
          + callee.getRoles().size() + " roles but got " + call.getRoleArguments().size(),
          events);
    }
    TokenGame calleeGame;
    try {
      calleeGame = gameOf(callee);
    } catch (CfgBuildException e) {
      LOG.warn("Cannot build sub-protocol " + callee.getName() + ": " + e.getMessage());
      return error(CfgErrorKind.INVALID_CALL, e.getMessage(), events);
    }
    Map<String, String> roles = new LinkedHashMap<String, String>();
    for (int i = 0; i < callee.getRoles().size(); i++) {
      roles.put(callee.getRoles().get(i), caller.actual(call.getRoleArguments().get(i)));
    }
    frames.add(CallFrame.call(callee.getName(), calleeGame.initialMarking(), roles,
        call.getId(), move.getTarget()));
    steps++;
    pendingBranch = -1;
    CfgEvent event = new CfgEvent(CfgEventKind.SUBPROTOCOL_ENTER, steps, call.getId(), "enter "
        + callee.getName() + "(" + String.join(", ", roles.values()) + ")");
    events.add(event);
    trace.add(event);
    LOG.debug("Entered " + callee.getName() + " at depth " + getCallDepth() + " with " + roles);
    return null;
  }

  private void exit(List<CfgEvent> events) {
    CallFrame done = frames.removeLast();
    CallFrame caller = frames.removeLast();
    frames.add(caller.withMarking(done.getResume()));
    CfgEvent event = new CfgEvent(CfgEventKind.SUBPROTOCOL_EXIT, steps, done.getCallNode(),
        "exit " + done.getProtocol());
    events.add(event);
    trace.add(event);
  }

  // abandons every entered sub-protocol, the outermost caller stays in front of its call
  private void unwind(List<CfgEvent> events) {
    while (frames.size() > 1) {
      CallFrame done = frames.removeLast();
      LOG.warn("Abandoning sub-protocol " + done.getProtocol() + " at " + done.getMarking());
      CfgEvent event = new CfgEvent(CfgEventKind.SUBPROTOCOL_EXIT, steps, done.getCallNode(),
          "exit " + done.getProtocol() + " aborted");
      events.add(event);
      trace.add(event);
    }
    pendingBranch = -1;
  }

  // leaves every sub-protocol that just reached its end and completes the protocol if it did
  private void settle(List<CfgEvent> events) {
    while (currentGame().isFinal(frames.getLast().getMarking())) {
      if (frames.getLast().isRoot()) {
        complete(events);
        return;
      }
      exit(events);
    }
  }

  private CfgEvent describe(Move move) {
    CallFrame frame = frames.getLast();
    int node = move.getNode().getId();
    int step = steps + 1;
    switch (move.getKind()) {
    case ACTION: {
      Action action = ((ActionNode) move.getNode()).getAction();
      switch (action.getKind()) {
      case MESSAGE: {
        MessageAction message = (MessageAction) action;
        return new CfgEvent(CfgEventKind.MESSAGE, step, node, frame.actual(message.getFrom())
            + "->" + String.join(",", frame.actual(message.getTo())) + ":"
            + message.getMessage());
      }
      case CREATE_PARTICIPANTS: {
        CreateParticipantsAction create = (CreateParticipantsAction) action;
        return new CfgEvent(CfgEventKind.DYNAMIC_ROLE, step, node,
            frame.actual(create.getCreator()) + " creates " + frame.actual(create.getRole()));
      }
      case INVITATION: {
        InvitationAction invite = (InvitationAction) action;
        return new CfgEvent(CfgEventKind.DYNAMIC_ROLE, step, node,
            frame.actual(invite.getInviter()) + " invites " + frame.actual(invite.getInvitee()));
      }
      default:
        throw new IllegalStateException("Unknown action kind " + action.getKind());
      }
    }
    case BRANCH: {
      BranchNode branch = (BranchNode) move.getNode();
      return new CfgEvent(CfgEventKind.CHOICE, step, node, frame.actual(branch.getDecider())
          + " chooses " + move.getEdge().getLabel());
    }
    case FORK:
      return new CfgEvent(CfgEventKind.FORK, step, node, "fork "
          + currentCfg().getOutgoing(node).size() + " branches");
    case JOIN:
      return new CfgEvent(CfgEventKind.JOIN, step, node, "join");
    case STRUCTURAL:
      if (move.getNode().getKind() == NodeKind.RECURSION) {
        RecursionNode rec = (RecursionNode) move.getNode();
        Integer count = frame.getIterations().get(node);
        int iteration = count == null ? 1 : count + 1;
        frames.set(frames.size() - 1, frame.withIteration(node, iteration));
        return new CfgEvent(CfgEventKind.RECURSION, step, node, "rec " + rec.getLabel()
            + " iteration " + iteration);
      }
      return null;
    default:
      throw new IllegalStateException("Unknown move kind " + move.getKind());
    }
  }

  private Cfg currentCfg() {
    CallFrame frame = frames.getLast();
    return frame.isRoot() ? cfg : callees.get(frame.getProtocol());
  }

  private TokenGame currentGame() {
    CallFrame frame = frames.getLast();
    return frame.isRoot() ? game : calleeGames.get(frame.getProtocol());
  }

  private TokenGame gameOf(Protocol callee) throws CfgBuildException {
    TokenGame calleeGame = calleeGames.get(callee.getName());
    if (calleeGame == null) {
      Cfg built = new CfgBuilder(new NodeIdAllocator()).build(callee, registry);
      callees.put(callee.getName(), built);
      calleeGame = new TokenGame(built);
      calleeGames.put(callee.getName(), calleeGame);
    }
    return calleeGame;
  }

  private void complete(List<CfgEvent> events) {
    completed = true;
    CfgEvent done = new CfgEvent(CfgEventKind.COMPLETE, steps, cfg.getTerminalId(), "protocol "
        + cfg.getName() + " completed");
    events.add(done);
    trace.add(done);
  }

  private void restore(CfgSnapshot snapshot) {
    frames = new LinkedList<CallFrame>(snapshot.getFrames());
    steps = snapshot.getStep();
    trace = new ArrayList<CfgEvent>(snapshot.getTrace());
    completed = snapshot.isCompleted();
    pendingBranch = -1;
  }

  private CfgStepResult error(CfgErrorKind kind, String message) {
    return error(kind, message, new ArrayList<CfgEvent>());
  }

  private CfgStepResult error(CfgErrorKind kind, String message, List<CfgEvent> events) {
    return new CfgStepResult(kind, message, events, getPendingChoices(), getSnapshot());
  }

}
