package com.infraops.orchestrator.events;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import org.springframework.util.StringUtils;

public enum EventTopic {
  /** Service discovery and health changes. */
  REGISTRY,
  /** Workflow progress and completion. */
  AUTOMATION;

  public static Set<EventTopic> parse(String csv) {
    if (!StringUtils.hasText(csv)) {
      return EnumSet.allOf(EventTopic.class);
    }
    Set<EventTopic> topics = EnumSet.noneOf(EventTopic.class);
    for (String token : csv.split(",")) {
      if (StringUtils.hasText(token)) {
        try {
          topics.add(EventTopic.valueOf(token.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
          throw new IllegalArgumentException("Unknown event topic: " + token.trim(), ex);
        }
      }
    }
    return topics.isEmpty() ? EnumSet.allOf(EventTopic.class) : topics;
  }
}
