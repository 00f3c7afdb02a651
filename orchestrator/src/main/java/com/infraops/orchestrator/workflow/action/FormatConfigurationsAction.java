package com.infraops.orchestrator.workflow.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Normalizes running configs into one committable {@code <device>.cfg} file per device. */
public class FormatConfigurationsAction implements InternalAction {

  public static final String NAME = "format_configurations";

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
  private static final Pattern HOSTNAME = Pattern.compile("(?m)^hostname\\s+(\\S+)");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public JsonNode apply(InternalActionContext context) {
    ObjectNode result = NODES.objectNode();
    ArrayNode formatted = result.putArray("formatted_configs");
    ArrayNode files = result.putArray("files");

    CommandOutputs.byDevice(context.previousResult())
        .forEach(
            (key, raw) -> {
              String device = deviceName(key, raw);
              String config = normalize(device, raw);
              ObjectNode entry = formatted.addObject();
              entry.put("device", device);
              entry.put("config", config);
              ObjectNode file = files.addObject();
              file.put("path", device + ".cfg");
              file.put("content", config);
            });
    result.put("device_count", formatted.size());
    return result;
  }

  private static String deviceName(String key, String config) {
    if (!CommandOutputs.ALL_DEVICES.equals(key)) {
      return key;
    }
    Matcher matcher = HOSTNAME.matcher(config);
    return matcher.find() ? matcher.group(1) : key;
  }

  static String normalize(String device, String raw) {
    List<String> kept = new ArrayList<>();
    kept.add("# " + device + " configuration");
    for (String line : CommandOutputs.lines(raw)) {
      String trimmed = line.stripTrailing();
      if (trimmed.startsWith("Building configuration")
          || trimmed.startsWith("Current configuration")) {
        continue;
      }
      if (trimmed.isEmpty() && !kept.isEmpty() && kept.get(kept.size() - 1).isEmpty()) {
        continue;
      }
      kept.add(trimmed);
    }
    while (kept.size() > 1 && kept.get(kept.size() - 1).isEmpty()) {
      kept.remove(kept.size() - 1);
    }
    return String.join("\n", kept) + "\n";
  }
}
