package edu.uchicago.cs.ucare.mpst.library;

import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.body;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.branch;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.call;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.choice;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.cont;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.create;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.invite;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.multicast;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.newRole;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.par;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.protocol;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.rec;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.roles;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.send;
import static edu.uchicago.cs.ucare.mpst.ast.ProtocolBuilder.type;

import java.util.ArrayList;
import java.util.List;

import edu.uchicago.cs.ucare.mpst.ast.Protocol;
import edu.uchicago.cs.ucare.mpst.ast.ProtocolRegistry;
import edu.uchicago.cs.ucare.mpst.ast.ProtocolRegistryException;

/**
 * Well-known example protocols, built directly as syntax trees.
 */
public final class ProtocolLibrary {

  private ProtocolLibrary() {
  }

  public static Protocol requestResponse() {
    return protocol("RequestResponse", roles("Client", "Server"),
        send("Client", "Server", "Request", type("String")),
        send("Server", "Client", "Response", type("Int")));
  }

  public static Protocol twoBuyer() {
    return protocol("TwoBuyer", roles("Buyer1", "Buyer2", "Seller"),
        send("Buyer1", "Seller", "BookQuote", type("String")),
        send("Seller", "Buyer1", "Quote", type("Int")),
        send("Seller", "Buyer2", "Quote", type("Int")),
        send("Buyer1", "Buyer2", "Share", type("Int")),
        choice("Buyer2",
            branch(send("Buyer2", "Seller", "Buy"), send("Buyer2", "Buyer1", "Buy")),
            branch(send("Buyer2", "Seller", "Quit"), send("Buyer2", "Buyer1", "Quit"))));
  }

  public static Protocol threeParty() {
    return protocol("ThreeParty", roles("A", "B", "C"),
        send("A", "B", "Init", type("String")),
        send("A", "C", "Init", type("String")),
        send("B", "A", "Ack"),
        send("C", "A", "Ack"),
        send("A", "B", "Done"),
        send("A", "C", "Done"));
  }

  public static Protocol streaming() {
    return protocol("Streaming", roles("Producer", "Consumer"),
        rec("Loop",
            choice("Producer",
                branch(send("Producer", "Consumer", "Data", type("String")), cont("Loop")),
                branch(send("Producer", "Consumer", "End")))));
  }

  public static Protocol parallel() {
    return protocol("Parallel", roles("A", "B", "C"),
        par(body(send("A", "B", "Msg1", type("Int"))),
            body(send("A", "C", "Msg2", type("String")))),
        send("B", "C", "Sync"));
  }

  public static Protocol nestedChoice() {
    return protocol("NestedChoice", roles("Client", "Server"),
        send("Client", "Server", "Request", type("String")),
        choice("Server",
            branch(send("Server", "Client", "Success", type("Int")),
                choice("Client",
                    branch(send("Client", "Server", "Continue")),
                    branch(send("Client", "Server", "Stop")))),
            branch(send("Server", "Client", "Error", type("String")))));
  }

  public static Protocol twoPhaseCommit() {
    return protocol("TwoPhaseCommit", roles("Coordinator", "Participant1", "Participant2"),
        send("Coordinator", "Participant1", "Prepare"),
        send("Coordinator", "Participant2", "Prepare"),
        par(body(choice("Participant1",
                branch(send("Participant1", "Coordinator", "Yes")),
                branch(send("Participant1", "Coordinator", "No")))),
            body(choice("Participant2",
                branch(send("Participant2", "Coordinator", "Yes")),
                branch(send("Participant2", "Coordinator", "No"))))),
        choice("Coordinator",
            branch(send("Coordinator", "Participant1", "Commit"),
                send("Coordinator", "Participant2", "Commit")),
            branch(send("Coordinator", "Participant1", "Abort"),
                send("Coordinator", "Participant2", "Abort"))));
  }

  public static Protocol conditionalRecursion() {
    return protocol("ConditionalRecursion", roles("Client", "Server"),
        rec("Loop",
            send("Client", "Server", "Request", type("Int")),
            choice("Server",
                branch(send("Server", "Client", "Continue", type("String")), cont("Loop")),
                branch(send("Server", "Client", "Stop")))));
  }

  public static Protocol oAuth() {
    return protocol("OAuth", roles("s", "c", "a"),
        choice("s",
            branch(send("s", "c", "login"),
                send("c", "a", "passwd", type("Str")),
                send("a", "s", "auth", type("Bool"))),
            branch(send("s", "c", "cancel"),
                send("c", "a", "quit"))));
  }

  public static Protocol travelAgency() {
    return protocol("TravelAgency", roles("Customer", "Agency", "Service"),
        rec("Loop",
            choice("Customer",
                branch(send("Customer", "Agency", "Query", type("String")),
                    send("Agency", "Customer", "Quote", type("Int")),
                    cont("Loop")),
                branch(send("Customer", "Agency", "Accept"),
                    send("Agency", "Service", "Book", type("String")),
                    send("Service", "Customer", "Confirm", type("Int"))),
                branch(send("Customer", "Agency", "Reject"),
                    send("Agency", "Service", "Cancel")))));
  }

  public static Protocol broadcast() {
    return protocol("Broadcast", roles("Server", "Client1", "Client2"),
        multicast("Server", roles("Client1", "Client2"), "Update"),
        send("Client1", "Server", "Ack"),
        send("Client2", "Server", "Ack"));
  }

  public static Protocol authentication() {
    return protocol("Auth", roles("Client", "Server"),
        send("Client", "Server", "Login", type("String")),
        send("Server", "Client", "Token", type("String")));
  }

  public static Protocol authenticatedSession() {
    return protocol("Session", roles("Client", "Server"),
        call("Auth", "Client", "Server"),
        send("Client", "Server", "Request", type("String")),
        send("Server", "Client", "Response", type("Int")));
  }

  public static Protocol dynamicWorker() {
    return protocol("DynamicWorker", roles("Manager"),
        newRole("Worker"),
        create("Manager", "Worker"),
        invite("Manager", "Worker"),
        send("Manager", "Worker", "Task", type("String")),
        send("Worker", "Manager", "Result", type("Int")));
  }

  public static List<Protocol> all() {
    List<Protocol> protocols = new ArrayList<Protocol>();
    protocols.add(requestResponse());
    protocols.add(twoBuyer());
    protocols.add(threeParty());
    protocols.add(streaming());
    protocols.add(parallel());
    protocols.add(nestedChoice());
    protocols.add(twoPhaseCommit());
    protocols.add(conditionalRecursion());
    protocols.add(oAuth());
    protocols.add(travelAgency());
    protocols.add(broadcast());
    protocols.add(authentication());
    protocols.add(authenticatedSession());
    protocols.add(dynamicWorker());
    return protocols;
  }

  /** Null if no library protocol has this name. */
  public static Protocol get(String name) {
    for (Protocol protocol : all()) {
      if (protocol.getName().equals(name)) {
        return protocol;
      }
    }
    return null;
  }

  /**
   * A registry holding every library protocol, so that calls between them resolve.
   */
  public static ProtocolRegistry registry() {
    ProtocolRegistry registry = new ProtocolRegistry();
    try {
      for (Protocol protocol : all()) {
        registry.register(protocol);
      }
      registry.validate();
    } catch (ProtocolRegistryException e) {
      throw new IllegalStateException("Protocol library is inconsistent", e);
    }
    return registry;
  }

}
