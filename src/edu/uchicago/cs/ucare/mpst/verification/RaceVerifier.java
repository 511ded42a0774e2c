package edu.uchicago.cs.ucare.mpst.verification;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import edu.uchicago.cs.ucare.mpst.cfg.Cfg;
import edu.uchicago.cs.ucare.mpst.cfg.Channel;
import edu.uchicago.cs.ucare.mpst.cfg.Edge;
import edu.uchicago.cs.ucare.mpst.cfg.ForkNode;
import edu.uchicago.cs.ucare.mpst.cfg.MessageAction;
import edu.uchicago.cs.ucare.mpst.cfg.Node;
import edu.uchicago.cs.ucare.mpst.cfg.NodeKind;

/**
 * Sibling parallel branches race when they use a common channel. Labels do not matter and
 * sharing a role is fine.
 */
public class RaceVerifier extends ProtocolVerifier {

  public RaceVerifier() {
    super("races");
  }

  @Override
  protected void check(Cfg cfg, List<Diagnostic> diagnostics) {
    for (Node node : cfg.getNodes(NodeKind.FORK)) {
      ForkNode fork = (ForkNode) node;
      List<TreeSet<Channel>> channels = new ArrayList<TreeSet<Channel>>();
      for (Edge branch : cfg.getOutgoing(fork.getId())) {
        TreeSet<Channel> used = new TreeSet<Channel>();
        for (MessageAction action : CfgAnalysis.messages(cfg,
            CfgAnalysis.nodesUntil(cfg, branch.getTo(), fork.getJoinId()))) {
          used.addAll(Channel.expand(action));
        }
        channels.add(used);
      }
      for (int i = 0; i < channels.size(); i++) {
        for (int j = i + 1; j < channels.size(); j++) {
          TreeSet<Channel> shared = new TreeSet<Channel>(channels.get(i));
          shared.retainAll(channels.get(j));
          if (shared.isEmpty()) {
            continue;
          }
          List<String> roles = new ArrayList<String>();
          for (Channel channel : shared) {
            if (!roles.contains(channel.getSender())) {
              roles.add(channel.getSender());
            }
            if (!roles.contains(channel.getReceiver())) {
              roles.add(channel.getReceiver());
            }
          }
          diagnostics.add(Diagnostic.error("Branches " + i + " and " + j + " of " + fork
              + " race on " + shared, Arrays.asList(fork.getId()), roles));
        }
      }
    }
  }

}
