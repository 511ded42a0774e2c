package edu.uchicago.cs.ucare.mpst.simulation;

import static edu.uchicago.cs.ucare.mpst.safety.Machines.context;
import static edu.uchicago.cs.ucare.mpst.safety.Machines.machine;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.Test;

import edu.uchicago.cs.ucare.mpst.ast.Protocol;
import edu.uchicago.cs.ucare.mpst.cfg.CfgBuilder;
import edu.uchicago.cs.ucare.mpst.cfg.NodeIdAllocator;
import edu.uchicago.cs.ucare.mpst.library.ProtocolLibrary;
import edu.uchicago.cs.ucare.mpst.projection.Cfsm;
import edu.uchicago.cs.ucare.mpst.projection.Projector;
import edu.uchicago.cs.ucare.mpst.safety.ContextReducerTest;
import edu.uchicago.cs.ucare.mpst.util.MpstConfig;

public class DistributedSimulatorTest {

  static Map<String, Cfsm> project(Protocol protocol) throws Exception {
    return new Projector().projectAll(new CfgBuilder(new NodeIdAllocator())
        .build(protocol, ProtocolLibrary.registry())).getCfsms();
  }

  @Test
  public void testRequestResponse() throws Exception {
    DistributedSimulator simulator = new DistributedSimulator(
        project(ProtocolLibrary.requestResponse()), new MpstConfig());
    SimulationResult result = simulator.run();
    assertThat(result.getOutcome(), is(SimulationOutcome.SUCCESS));
    assertThat(result.getSteps(), is(4));
    assertThat(result.getOrphanMessages().isEmpty(), is(true));
    List<SimulationEvent> client = result.getTrace("Client");
    assertThat(client.size(), is(2));
    assertThat(client.get(0).getKind(), is(SimulationEventKind.SEND));
    assertThat(client.get(0).getPeer(), is("Server"));
    assertThat(client.get(0).getMessage().getLabel(), is("Request"));
    assertThat(client.get(1).getKind(), is(SimulationEventKind.RECEIVE));
    assertThat(client.get(1).getStep(), is(4));
    assertThat(simulator.isCompleted(), is(true));
  }

  @Test
  public void testRandomSchedulingStillCompletes() throws Exception {
    for (long seed = 0; seed < 5; seed++) {
      SimulationResult result = new DistributedSimulator(project(ProtocolLibrary.twoBuyer()),
          SchedulingStrategy.RANDOM, 100, seed).run();
      assertThat(result.getOutcome(), is(SimulationOutcome.SUCCESS));
      assertThat(result.getOrphanMessages().isEmpty(), is(true));
    }
  }

  @Test
  public void testDeadlock() throws Exception {
    DistributedSimulator simulator = new DistributedSimulator(context(
        machine("A", 2).receive(0, 1, "B", "x").terminal(1),
        machine("B", 2).receive(0, 1, "A", "y").terminal(1)),
        SchedulingStrategy.ROUND_ROBIN, 100, 0L);
    StepResult step = simulator.step();
    assertThat(step.getOutcome(), is(StepOutcome.DEADLOCK));
    assertThat(step.getEvents().size(), is(2));
    assertThat(step.getEvents().get(0).getKind(), is(SimulationEventKind.ERROR));
    assertThat(step.getEvents().get(0).getDetail(), containsString("waiting for x from B"));

    SimulationResult result = simulator.getResult();
    assertThat(result.getOutcome(), is(SimulationOutcome.DEADLOCK));
    assertThat(result.getSteps(), is(0));
    assertThat(simulator.step().getOutcome(), is(StepOutcome.ALREADY_COMPLETED));
  }

  @Test
  public void testUnboundedStreamHitsBudget() throws Exception {
    DistributedSimulator simulator = new DistributedSimulator(
        project(ProtocolLibrary.streaming()), SchedulingStrategy.FIXED_FIRST, 10, 0L);
    SimulationResult result = simulator.run();
    assertThat(result.getOutcome(), is(SimulationOutcome.BUDGET_EXCEEDED));
    assertThat(result.getSteps(), is(10));
    assertThat(result.getOrphanMessages().size(), is(10));
    assertThat(result.getOrphanMessages().get(0).getMessage().getLabel(), is("Data"));
    assertThat(result.getTrace("Consumer").isEmpty(), is(true));
  }

  @Test
  public void testStepRole() throws Exception {
    DistributedSimulator simulator = new DistributedSimulator(
        project(ProtocolLibrary.requestResponse()), new MpstConfig());
    assertThat(simulator.getResult(), nullValue());

    StepResult blocked = simulator.stepRole("Server");
    assertThat(blocked.getOutcome(), is(StepOutcome.MESSAGE_NOT_READY));
    assertThat(blocked.getEvents().get(0).getDetail(),
        containsString("waiting for Request from Client"));
    assertThat(simulator.getSteps(), is(0));

    StepResult sent = simulator.stepRole("Client");
    assertThat(sent.getOutcome(), is(StepOutcome.STEPPED));
    assertThat(sent.getRole(), is("Client"));
    assertThat(simulator.getQueue("Client", "Server").size(), is(1));
    assertThat(simulator.getQueue("Server", "Client").isEmpty(), is(true));

    assertThat(simulator.stepRole("Server").getOutcome(), is(StepOutcome.STEPPED));
    assertThat(simulator.getQueue("Client", "Server").isEmpty(), is(true));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testStepUnknownRole() throws Exception {
    new DistributedSimulator(project(ProtocolLibrary.requestResponse()), new MpstConfig())
        .stepRole("Nobody");
  }

  @Test
  public void testMulticastFillsEveryChannel() throws Exception {
    DistributedSimulator simulator = new DistributedSimulator(
        project(ProtocolLibrary.broadcast()), new MpstConfig());
    simulator.stepRole("Server");
    assertThat(simulator.getQueue("Server", "Client1").size(), is(1));
    assertThat(simulator.getQueue("Server", "Client2").size(), is(1));
    assertThat(simulator.run().getOutcome(), is(SimulationOutcome.SUCCESS));
  }

  @Test
  public void testUndeliveredMessage() throws Exception {
    DistributedSimulator simulator = new DistributedSimulator(context(
        machine("A", 2).send(0, 1, "B", "x").terminal(1),
        machine("B", 1).terminal(0)),
        SchedulingStrategy.ROUND_ROBIN, 100, 0L);
    SimulationResult result = simulator.run();
    assertThat(result.getOutcome(), is(SimulationOutcome.SUCCESS));
    assertThat(result.getSteps(), is(1));
    assertThat(result.getOrphanMessages().size(), is(1));
    assertThat(result.getOrphanMessages().get(0).getChannel().getReceiver(), is("B"));
  }

  @Test
  public void testReset() throws Exception {
    DistributedSimulator simulator = new DistributedSimulator(
        project(ProtocolLibrary.requestResponse()), new MpstConfig());
    simulator.run();
    simulator.reset();
    assertThat(simulator.isCompleted(), is(false));
    assertThat(simulator.getSteps(), is(0));
    assertThat(simulator.getTrace("Client").isEmpty(), is(true));
    assertThat(simulator.run().getSteps(), is(4));
  }

  @Test
  public void testCallsFireJointly() throws Exception {
    for (long seed = 0; seed < 10; seed++) {
      SimulationResult result = new DistributedSimulator(ContextReducerTest.callChoice(),
          SchedulingStrategy.RANDOM, 100, seed).run();
      assertThat(result.getOutcome(), is(SimulationOutcome.SUCCESS));
      assertThat(result.getOrphanMessages().isEmpty(), is(true));
      assertThat(result.getSteps(), is(3));
      SimulationEvent a = result.getTrace("A").get(0);
      SimulationEvent b = result.getTrace("B").get(0);
      assertThat(a.getKind(), is(SimulationEventKind.CALL));
      assertThat(b.getKind(), is(SimulationEventKind.CALL));
      assertThat(b.getDetail(), is(a.getDetail()));
      assertThat(b.getStep(), is(1));
    }
  }

  @Test
  public void testCallWithoutItsPartnerDeadlocks() throws Exception {
    DistributedSimulator simulator = new DistributedSimulator(context(
        machine("A", 2).call(0, 1, "P", "A", "B").terminal(1),
        machine("B", 2).receive(0, 1, "A", "m").terminal(1)),
        SchedulingStrategy.ROUND_ROBIN, 100, 0L);
    StepResult step = simulator.step();
    assertThat(step.getOutcome(), is(StepOutcome.DEADLOCK));
    assertThat(step.getEvents().get(0).getDetail(), containsString("partners of do P(A,B)"));
  }

}
