package com.infraops.orchestrator.workflow.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Builds a topology model and a Markdown page from {@code show cdp neighbors} output. */
public class GenerateDocumentationAction implements InternalAction {

  public static final String NAME = "generate_documentation";

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
  private static final String INTERFACE = "([A-Za-z-]+\\s?\\d[\\d/.:]*)";
  private static final Pattern NEIGHBOR =
      Pattern.compile("^(\\S+)\\s+" + INTERFACE + "\\s+(\\d+)\\s+.*\\s" + INTERFACE + "$");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public JsonNode apply(InternalActionContext context) {
    TreeSet<String> devices = new TreeSet<>();
    List<Link> links = new ArrayList<>();

    CommandOutputs.byDevice(context.previousResult())
        .forEach(
            (device, output) -> {
              String local = CommandOutputs.ALL_DEVICES.equals(device) ? "local" : device;
              devices.add(local);
              for (String line : CommandOutputs.lines(output)) {
                Matcher matcher = NEIGHBOR.matcher(line.trim());
                if (!matcher.matches()) {
                  continue;
                }
                String neighbor = matcher.group(1);
                devices.add(neighbor);
                links.add(new Link(local, matcher.group(2), neighbor, matcher.group(4)));
              }
            });

    ObjectNode result = NODES.objectNode();
    ObjectNode topology = result.putObject("topology");
    ArrayNode deviceArray = topology.putArray("devices");
    devices.forEach(deviceArray::add);
    ArrayNode connections = topology.putArray("connections");
    for (Link link : links) {
      ObjectNode connection = connections.addObject();
      connection.put("from", link.from());
      connection.put("interface", link.localInterface());
      connection.put("to", link.to());
      connection.put("remote_interface", link.remoteInterface());
    }
    result.put("documentation", render(devices, links));
    return result;
  }

  private static String render(TreeSet<String> devices, List<Link> links) {
    StringBuilder markdown = new StringBuilder("# Network Topology\n\n## Devices\n\n");
    devices.forEach(device -> markdown.append("- ").append(device).append('\n'));
    markdown.append("\n## Connections\n\n");
    if (links.isEmpty()) {
      markdown.append("No neighbor adjacencies discovered.\n");
      return markdown.toString();
    }
    markdown.append("| From | Interface | To | Remote Interface |\n");
    markdown.append("|------|-----------|----|------------------|\n");
    for (Link link : links) {
      markdown
          .append("| ")
          .append(link.from())
          .append(" | ")
          .append(link.localInterface())
          .append(" | ")
          .append(link.to())
          .append(" | ")
          .append(link.remoteInterface())
          .append(" |\n");
    }
    return markdown.toString();
  }

  private record Link(String from, String localInterface, String to, String remoteInterface) {}
}
