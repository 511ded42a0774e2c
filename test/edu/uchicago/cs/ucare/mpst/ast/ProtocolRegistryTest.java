package edu.uchicago.cs.ucare.mpst.ast;

import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.call;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.protocol;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.roles;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.send;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

public class ProtocolRegistryTest {

  private ProtocolRegistry registry;

  @Before
  public void setUp() throws ProtocolRegistryException {
    registry = new ProtocolRegistry();
    registry.register(protocol("Auth", roles("C", "S"), send("C", "S", "login")));
  }

  @Test
  public void testDuplicateNameRejected() {
    try {
      registry.register(protocol("Auth", roles("X"), send("X", "X", "m")));
      fail("duplicate protocol accepted");
    } catch (ProtocolRegistryException e) {
      assertThat(e.getMessage(), containsString("Auth"));
    }
    assertThat(registry.getProtocols().size(), is(1));
  }

  @Test
  public void testCallChecks() throws ProtocolRegistryException {
    registry.checkCall(call("Auth", "A", "B"));
    try {
      registry.checkCall(call("Missing", "A"));
      fail("call to undefined protocol accepted");
    } catch (ProtocolRegistryException e) {
      assertThat(e.getMessage(), containsString("Missing"));
    }
    try {
      registry.checkCall(call("Auth", "A"));
      fail("call with wrong number of roles accepted");
    } catch (ProtocolRegistryException e) {
      assertThat(e.getMessage(), containsString("expects 2 roles"));
    }
  }

  @Test
  public void testCyclicCallsRejected() throws ProtocolRegistryException {
    registry.register(protocol("Ping", roles("A", "B"), send("A", "B", "ping"),
        call("Pong", "B", "A")));
    registry.register(protocol("Pong", roles("A", "B"), send("A", "B", "pong"),
        call("Ping", "B", "A")));
    try {
      registry.validate();
      fail("cycle not detected");
    } catch (ProtocolRegistryException e) {
      assertThat(e.getMessage(), is("Cyclic sub-protocol calls: Ping -> Pong -> Ping"));
    }
  }

  @Test
  public void testCallees() throws ProtocolRegistryException {
    registry.register(protocol("Main", roles("C", "S"), call("Auth", "C", "S"),
        send("S", "C", "data"), call("Auth", "C", "S")));
    registry.validate();
    assertThat(registry.getCallees("Main"), is(Arrays.asList("Auth")));
    assertThat(registry.getCallees("Auth").isEmpty(), is(true));
    assertThat(registry.contains("Main"), is(true));
    assertThat(registry.get("Main").getRoles(), is(roles("C", "S")));
  }

}
