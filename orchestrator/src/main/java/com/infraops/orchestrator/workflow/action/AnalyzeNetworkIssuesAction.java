package com.infraops.orchestrator.workflow.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code show ip interface brief} output and reports interfaces that are not up/up.
 * Administratively shut interfaces are the only ones considered safe to fix automatically.
 */
public class AnalyzeNetworkIssuesAction implements InternalAction {

  public static final String NAME = "analyze_network_issues";

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public JsonNode apply(InternalActionContext context) {
    ArrayNode issues = NODES.arrayNode();
    Map<String, List<String>> fixCommands = new LinkedHashMap<>();
    Set<String> issueTypes = new LinkedHashSet<>();
    Set<String> affectedDevices = new LinkedHashSet<>();

    CommandOutputs.byDevice(context.previousResult())
        .forEach(
            (device, output) -> {
              for (String line : CommandOutputs.lines(output)) {
                InterfaceLine parsed = InterfaceLine.parse(line);
                if (parsed == null || parsed.healthy()) {
                  continue;
                }
                ObjectNode issue = issues.addObject();
                issue.put("device", device);
                issue.put("interface", parsed.name());
                issue.put("type", parsed.issueType());
                issue.put("severity", parsed.severity());
                issue.put(
                    "description",
                    "Interface " + parsed.name() + " is " + parsed.status() + "/" + parsed.protocol());
                issueTypes.add(parsed.issueType());
                affectedDevices.add(device);
                if (parsed.administrativelyDown()) {
                  fixCommands
                      .computeIfAbsent(device, key -> new ArrayList<>())
                      .addAll(List.of("interface " + parsed.name(), " no shutdown"));
                }
              }
            });

    ObjectNode result = NODES.objectNode();
    result.set("issues", issues);
    result.put("auto_fix_available", !fixCommands.isEmpty());
    ArrayNode devices = result.putArray("affected_devices");
    affectedDevices.forEach(devices::add);
    result.put(
        "config_commands",
        String.join("\n", fixCommands.values().stream().flatMap(List::stream).toList()));
    ArrayNode recommendations = result.putArray("recommendations");
    issueTypes.forEach(type -> recommendations.add(recommendationFor(type)));
    result.put(
        "summary", issues.size() + " interface issue(s) on " + affectedDevices.size() + " device(s)");

    ObjectNode problem = result.putObject("problem");
    problem.put("short_description", "Network issues detected: " + result.path("summary").asText());
    problem.put("description", describe(issues));
    problem.put("impact", issueTypes.contains("interface_down") ? "1" : "2");
    return result;
  }

  private static String describe(ArrayNode issues) {
    StringBuilder description = new StringBuilder();
    issues.forEach(
        issue ->
            description
                .append(issue.path("device").asText())
                .append(": ")
                .append(issue.path("description").asText())
                .append('\n'));
    return description.toString().trim();
  }

  private static String recommendationFor(String issueType) {
    return switch (issueType) {
      case "interface_down" -> "Check physical connection and cabling";
      case "protocol_down" -> "Verify encapsulation and keepalive settings on both ends";
      case "interface_shutdown" -> "Confirm the shutdown is unintended before re-enabling";
      default -> "Review interface configuration";
    };
  }

  record InterfaceLine(String name, String status, String protocol) {

    static InterfaceLine parse(String line) {
      if (line == null || line.isBlank()) {
        return null;
      }
      String[] tokens = line.trim().split("\\s+");
      if (tokens.length < 6 || tokens[0].equalsIgnoreCase("Interface")) {
        return null;
      }
      String protocol = tokens[tokens.length - 1].toLowerCase(Locale.ROOT);
      String status =
          String.join(" ", Arrays.copyOfRange(tokens, 4, tokens.length - 1)).toLowerCase(Locale.ROOT);
      if (!protocol.equals("up") && !protocol.equals("down")) {
        return null;
      }
      return new InterfaceLine(tokens[0], status, protocol);
    }

    boolean healthy() {
      return status.equals("up") && protocol.equals("up");
    }

    boolean administrativelyDown() {
      return status.startsWith("administratively");
    }

    String issueType() {
      if (administrativelyDown()) {
        return "interface_shutdown";
      }
      return status.equals("up") ? "protocol_down" : "interface_down";
    }

    String severity() {
      return switch (issueType()) {
        case "interface_down" -> "high";
        case "protocol_down" -> "medium";
        default -> "low";
      };
    }
  }
}
