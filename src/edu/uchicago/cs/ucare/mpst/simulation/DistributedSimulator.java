package edu.uchicago.cs.ucare.mpst.simulation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.uchicago.cs.ucare.mpst.ast.Message;
import edu.uchicago.cs.ucare.mpst.cfg.Channel;
import edu.uchicago.cs.ucare.mpst.projection.Cfsm;
import edu.uchicago.cs.ucare.mpst.transition.CallAction;
import edu.uchicago.cs.ucare.mpst.transition.CfsmTransition;
import edu.uchicago.cs.ucare.mpst.transition.LocalAction;
import edu.uchicago.cs.ucare.mpst.transition.ReceiveAction;
import edu.uchicago.cs.ucare.mpst.transition.SendAction;
import edu.uchicago.cs.ucare.mpst.util.MpstConfig;

/**
 * Runs the role machines against FIFO channels. Sends enqueue and never block; a receive can
 * only fire once the head of its channel carries the expected label. A sub-protocol call is a
 * rendezvous: it fires once every role argument offers it, and moves all of them in one step.
 */
public class DistributedSimulator {

  protected final static Logger LOG = LoggerFactory.getLogger(DistributedSimulator.class);

  private final Map<String, Cfsm> cfsms;
  private final List<String> roles;
  private final Scheduler scheduler;
  private final int maxSteps;

  private Map<String, Integer> states;
  private Map<Channel, LinkedList<Message>> queues;
  private Map<String, List<SimulationEvent>> traces;
  private int steps;
  private SimulationOutcome outcome;

  public DistributedSimulator(Map<String, Cfsm> cfsms, SchedulingStrategy strategy, int maxSteps,
      long seed) {
    this.cfsms = new LinkedHashMap<String, Cfsm>(cfsms);
    this.roles = new ArrayList<String>(cfsms.keySet());
    this.scheduler = Scheduler.create(strategy, roles, seed);
    this.maxSteps = maxSteps;
    reset();
  }

  public DistributedSimulator(Map<String, Cfsm> cfsms, MpstConfig config) {
    this(cfsms, SchedulingStrategy.parse(config.getSchedulingStrategy()), config.getMaxSteps(),
        config.getRandomSeed());
  }

  public void reset() {
    states = new LinkedHashMap<String, Integer>();
    traces = new LinkedHashMap<String, List<SimulationEvent>>();
    for (String role : roles) {
      states.put(role, cfsms.get(role).getInitialState());
      traces.put(role, new ArrayList<SimulationEvent>());
    }
    queues = new LinkedHashMap<Channel, LinkedList<Message>>();
    steps = 0;
    outcome = null;
    scheduler.reset();
  }

  public StepResult step() {
    if (outcome != null) {
      return new StepResult(StepOutcome.ALREADY_COMPLETED, null, new ArrayList<SimulationEvent>());
    }
    List<String> ready = new ArrayList<String>();
    for (String role : roles) {
      if (!executable(role).isEmpty()) {
        ready.add(role);
      }
    }
    if (allTerminal() && (ready.isEmpty() || queuesEmpty())) {
      return finish(SimulationOutcome.SUCCESS, StepOutcome.SUCCESS,
          new ArrayList<SimulationEvent>());
    }
    if (ready.isEmpty()) {
      List<SimulationEvent> errors = new ArrayList<SimulationEvent>();
      for (String role : roles) {
        if (!cfsms.get(role).isTerminal(states.get(role))) {
          errors.add(notReady(role));
        }
      }
      return finish(SimulationOutcome.DEADLOCK, StepOutcome.DEADLOCK, errors);
    }
    if (steps >= maxSteps) {
      return finish(SimulationOutcome.BUDGET_EXCEEDED, StepOutcome.BUDGET_EXCEEDED,
          new ArrayList<SimulationEvent>());
    }
    String role = scheduler.nextRole(ready);
    List<CfsmTransition> options = executable(role);
    return new StepResult(StepOutcome.STEPPED, role,
        fire(role, options.get(scheduler.nextTransition(options.size()))));
  }

  /**
   * Advances one particular role, bypassing the scheduler.
   */
  public StepResult stepRole(String role) {
    if (!cfsms.containsKey(role)) {
      throw new IllegalArgumentException("Unknown role " + role);
    }
    if (outcome != null) {
      return new StepResult(StepOutcome.ALREADY_COMPLETED, role, new ArrayList<SimulationEvent>());
    }
    List<CfsmTransition> options = executable(role);
    if (options.isEmpty()) {
      if (cfsms.get(role).getOutgoing(states.get(role)).isEmpty()) {
        return new StepResult(StepOutcome.ALREADY_COMPLETED, role,
            new ArrayList<SimulationEvent>());
      }
      List<SimulationEvent> events = new ArrayList<SimulationEvent>();
      events.add(notReady(role));
      return new StepResult(StepOutcome.MESSAGE_NOT_READY, role, events);
    }
    if (steps >= maxSteps) {
      return finish(SimulationOutcome.BUDGET_EXCEEDED, StepOutcome.BUDGET_EXCEEDED,
          new ArrayList<SimulationEvent>());
    }
    return new StepResult(StepOutcome.STEPPED, role,
        fire(role, options.get(scheduler.nextTransition(options.size()))));
  }

  public SimulationResult run() {
    while (outcome == null) {
      step();
    }
    return getResult();
  }

  /** Null while the simulation is still running. */
  public SimulationResult getResult() {
    if (outcome == null) {
      return null;
    }
    return new SimulationResult(outcome, steps, traces, states, getQueuedMessages());
  }

  public boolean isCompleted() {
    return outcome != null;
  }

  public int getSteps() {
    return steps;
  }

  public int getState(String role) {
    return states.get(role);
  }

  public List<Message> getQueue(String sender, String receiver) {
    LinkedList<Message> queue = queues.get(new Channel(sender, receiver));
    return queue == null ? new ArrayList<Message>() : new ArrayList<Message>(queue);
  }

  public List<SimulationEvent> getTrace(String role) {
    return new ArrayList<SimulationEvent>(traces.get(role));
  }

  public List<QueuedMessage> getQueuedMessages() {
    List<QueuedMessage> queued = new ArrayList<QueuedMessage>();
    for (Map.Entry<Channel, LinkedList<Message>> entry : queues.entrySet()) {
      for (Message message : entry.getValue()) {
        queued.add(new QueuedMessage(entry.getKey(), message));
      }
    }
    return queued;
  }

  private List<CfsmTransition> executable(String role) {
    List<CfsmTransition> result = new ArrayList<CfsmTransition>();
    for (CfsmTransition transition : cfsms.get(role).getOutgoing(states.get(role))) {
      if (transition.getAction().getType() == LocalAction.Type.RECEIVE) {
        ReceiveAction receive = (ReceiveAction) transition.getAction();
        LinkedList<Message> queue = queues.get(new Channel(receive.getFrom(), role));
        if (queue == null || queue.isEmpty()
            || !queue.getFirst().getLabel().equals(receive.getMessage().getLabel())) {
          continue;
        }
      } else if (transition.getAction().getType() == LocalAction.Type.CALL
          && !partnersReady(role, (CallAction) transition.getAction())) {
        continue;
      }
      result.add(transition);
    }
    return result;
  }

  private boolean partnersReady(String role, CallAction call) {
    for (String participant : call.getRoleArguments()) {
      if (!participant.equals(role) && cfsms.containsKey(participant)
          && matchingCall(participant, call) == null) {
        return false;
      }
    }
    return true;
  }

  private CfsmTransition matchingCall(String role, CallAction call) {
    for (CfsmTransition transition : cfsms.get(role).getOutgoing(states.get(role))) {
      if (transition.getAction().getType() == LocalAction.Type.CALL
          && transition.getAction().getKey().equals(call.getKey())) {
        return transition;
      }
    }
    return null;
  }

  private List<SimulationEvent> fire(String role, CfsmTransition transition) {
    steps++;
    List<SimulationEvent> events = new ArrayList<SimulationEvent>();
    List<SimulationEvent> joined = new ArrayList<SimulationEvent>();
    LocalAction action = transition.getAction();
    int from = transition.getFrom();
    int to = transition.getTo();
    switch (action.getType()) {
    case SEND: {
      SendAction send = (SendAction) action;
      for (String receiver : send.getTo()) {
        Channel channel = new Channel(role, receiver);
        LinkedList<Message> queue = queues.get(channel);
        if (queue == null) {
          queue = new LinkedList<Message>();
          queues.put(channel, queue);
        }
        queue.addLast(send.getMessage());
      }
      events.add(new SimulationEvent(SimulationEventKind.SEND, steps, role, from, to,
          String.join(",", send.getTo()), send.getMessage(), null));
      break;
    }
    case RECEIVE: {
      ReceiveAction receive = (ReceiveAction) action;
      Message message = queues.get(new Channel(receive.getFrom(), role)).removeFirst();
      events.add(new SimulationEvent(SimulationEventKind.RECEIVE, steps, role, from, to,
          receive.getFrom(), message, null));
      break;
    }
    case CALL: {
      CallAction call = (CallAction) action;
      for (String participant : call.getRoleArguments()) {
        if (participant.equals(role) || !cfsms.containsKey(participant)) {
          continue;
        }
        CfsmTransition partner = matchingCall(participant, call);
        SimulationEvent event = new SimulationEvent(SimulationEventKind.CALL, steps, participant,
            partner.getFrom(), partner.getTo(), null, null, call.getKey());
        states.put(participant, partner.getTo());
        traces.get(participant).add(event);
        joined.add(event);
      }
      events.add(new SimulationEvent(SimulationEventKind.CALL, steps, role, from, to, null, null,
          call.getKey()));
      break;
    }
    case TAU:
      events.add(new SimulationEvent(SimulationEventKind.STATE_CHANGE, steps, role, from, to,
          null, null, action.getKey()));
      break;
    default:
      throw new IllegalStateException("Unknown action type " + action.getType());
    }
    states.put(role, to);
    traces.get(role).addAll(events);
    events.addAll(joined);
    LOG.debug("Step " + steps + ": " + events);
    return events;
  }

  private SimulationEvent notReady(String role) {
    StringBuilder waiting = new StringBuilder();
    for (CfsmTransition transition : cfsms.get(role).getOutgoing(states.get(role))) {
      if (transition.getAction().getType() == LocalAction.Type.RECEIVE) {
        ReceiveAction receive = (ReceiveAction) transition.getAction();
        if (waiting.length() > 0) {
          waiting.append(" or ");
        }
        waiting.append(receive.getMessage().getLabel()).append(" from ").append(receive.getFrom());
      } else if (transition.getAction().getType() == LocalAction.Type.CALL) {
        if (waiting.length() > 0) {
          waiting.append(" or ");
        }
        waiting.append("partners of ").append(transition.getAction().getKey());
      }
    }
    String detail = waiting.length() > 0 ? "message not ready, waiting for " + waiting
        : "no transition from s" + states.get(role);
    return new SimulationEvent(SimulationEventKind.ERROR, steps, role, -1, -1, null, null, detail);
  }

  private StepResult finish(SimulationOutcome result, StepOutcome stepOutcome,
      List<SimulationEvent> events) {
    outcome = result;
    for (SimulationEvent event : events) {
      traces.get(event.getRole()).add(event);
    }
    LOG.info("Simulation ended with " + result + " after " + steps + " steps");
    return new StepResult(stepOutcome, null, events);
  }

  private boolean allTerminal() {
    for (String role : roles) {
      if (!cfsms.get(role).isTerminal(states.get(role))) {
        return false;
      }
    }
    return true;
  }

  private boolean queuesEmpty() {
    for (LinkedList<Message> queue : queues.values()) {
      if (!queue.isEmpty()) {
        return false;
      }
    }
    return true;
  }

}
