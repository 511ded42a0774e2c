package edu.uchicago.cs.ucare.mpst.serializer;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import edu.uchicago.cs.ucare.mpst.projection.Cfsm;
import edu.uchicago.cs.ucare.mpst.transition.CallAction;
import edu.uchicago.cs.ucare.mpst.transition.CfsmTransition;
import edu.uchicago.cs.ucare.mpst.transition.LocalAction;
import edu.uchicago.cs.ucare.mpst.transition.ReceiveAction;
import edu.uchicago.cs.ucare.mpst.transition.SendAction;

/**
 * Renders a role machine back as local protocol text. Straight runs are printed in order and
 * branching states become nested choice blocks. Every state is printed once: a transition back
 * to a state on the current path becomes a cycle marker, one into a state printed elsewhere
 * becomes a continue marker. The result is not guaranteed to parse back to the same machine.
 */
public class CfsmSerializer {

  private static final String INDENT = "  ";

  private CfsmSerializer() {
  }

  public static String serialize(Cfsm cfsm) {
    StringBuilder sb = new StringBuilder();
    sb.append("local protocol ").append(cfsm.getProtocol()).append("_").append(cfsm.getRole())
        .append(" at ").append(cfsm.getRole()).append("() {\n");
    walk(cfsm, cfsm.getInitialState(), 1, new HashSet<Integer>(), new HashSet<Integer>(), sb);
    sb.append("}\n");
    return sb.toString();
  }

  public static String actionText(LocalAction action) {
    switch (action.getType()) {
    case SEND: {
      SendAction send = (SendAction) action;
      return send.getMessage() + " to " + String.join(", ", send.getTo()) + ";";
    }
    case RECEIVE: {
      ReceiveAction receive = (ReceiveAction) action;
      return receive.getMessage() + " from " + receive.getFrom() + ";";
    }
    case CALL: {
      CallAction call = (CallAction) action;
      return "do " + call.getProtocol() + "(" + String.join(", ", call.getRoleArguments()) + ");";
    }
    case TAU:
      return "// tau";
    default:
      throw new IllegalStateException("Unknown action type " + action.getType());
    }
  }

  private static void walk(Cfsm cfsm, int state, int depth, Set<Integer> path,
      Set<Integer> rendered, StringBuilder sb) {
    if (path.contains(state)) {
      line(sb, depth, "// cycle to s" + state);
      return;
    }
    List<CfsmTransition> outgoing = cfsm.getOutgoing(state);
    if (outgoing.isEmpty()) {
      return;
    }
    if (!rendered.add(state)) {
      line(sb, depth, "// continue at s" + state);
      return;
    }
    path.add(state);
    if (outgoing.size() == 1) {
      CfsmTransition transition = outgoing.get(0);
      line(sb, depth, actionText(transition.getAction()));
      walk(cfsm, transition.getTo(), depth, path, rendered, sb);
    } else {
      line(sb, depth, "choice {");
      for (int i = 0; i < outgoing.size(); i++) {
        if (i > 0) {
          line(sb, depth, "} or {");
        }
        CfsmTransition transition = outgoing.get(i);
        line(sb, depth + 1, actionText(transition.getAction()));
        walk(cfsm, transition.getTo(), depth + 1, path, rendered, sb);
      }
      line(sb, depth, "}");
    }
    path.remove(state);
  }

  private static void line(StringBuilder sb, int depth, String text) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
    sb.append(text).append("\n");
  }

}
