package com.infraops.orchestrator.workflow.action;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pulls per-device CLI text out of a device-automation result. Accepts a bare string, an object
 * with an {@code output} field, or an object keyed by device name.
 */
final class CommandOutputs {

  static final String ALL_DEVICES = "all";

  private CommandOutputs() {}

  static Map<String, String> byDevice(JsonNode result) {
    Map<String, String> outputs = new LinkedHashMap<>();
    if (result == null || result.isMissingNode() || result.isNull()) {
      return outputs;
    }
    if (result.isTextual()) {
      outputs.put(ALL_DEVICES, result.asText());
      return outputs;
    }
    if (!result.isObject()) {
      return outputs;
    }
    JsonNode output = firstText(result, "output", "config", "stdout");
    if (output != null) {
      String device = result.path("device").asText(result.path("device_name").asText(ALL_DEVICES));
      outputs.put(device, output.asText());
      return outputs;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = result.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      if (value.isTextual()) {
        outputs.put(field.getKey(), value.asText());
      } else if (value.isObject()) {
        JsonNode nested = firstText(value, "output", "config", "stdout");
        if (nested != null) {
          outputs.put(field.getKey(), nested.asText());
        }
      }
    }
    return outputs;
  }

  static String[] lines(String text) {
    return text == null ? new String[0] : text.split("\\r?\\n");
  }

  private static JsonNode firstText(JsonNode node, String... names) {
    for (String name : names) {
      JsonNode candidate = node.get(name);
      if (candidate != null && candidate.isTextual()) {
        return candidate;
      }
    }
    return null;
  }
}
