package edu.uchicago.cs.ucare.mpst.library;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import edu.uchicago.cs.ucare.mpst.ast.Protocol;
import edu.uchicago.cs.ucare.mpst.ast.ProtocolRegistry;
import edu.uchicago.cs.ucare.mpst.cfg.CfgBuilder;
import edu.uchicago.cs.ucare.mpst.cfg.NodeIdAllocator;

public class ProtocolLibraryTest {

  @Test
  public void testNamesAreDistinct() {
    List<Protocol> all = ProtocolLibrary.all();
    Set<String> names = new HashSet<String>();
    for (Protocol protocol : all) {
      names.add(protocol.getName());
    }
    assertThat(all.size(), is(14));
    assertThat(names.size(), is(14));
  }

  @Test
  public void testLookup() {
    assertThat(ProtocolLibrary.get("TwoBuyer").getRoles().size(), is(3));
    assertThat(ProtocolLibrary.get("Auth").getName(), is("Auth"));
    assertThat(ProtocolLibrary.get("Nope"), nullValue());
  }

  @Test
  public void testEveryProtocolBuilds() throws Exception {
    ProtocolRegistry registry = ProtocolLibrary.registry();
    assertThat(registry.getProtocols().size(), is(14));
    assertThat(registry.getCallees("Session").contains("Auth"), is(true));
    for (Protocol protocol : ProtocolLibrary.all()) {
      assertThat(protocol.getName(),
          new CfgBuilder(new NodeIdAllocator()).build(protocol, registry).getName(),
          is(protocol.getName()));
    }
  }

}
