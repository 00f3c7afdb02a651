package com.infraops.orchestrator.workflow.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.infraops.orchestrator.workflow.domain.StepOutcome;
import com.infraops.orchestrator.workflow.exception.WorkflowFatalException;
import java.util.Map;
import java.util.function.BiPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named continuation checks. Each built-in depends only on the step outcome and the workflow
 * parameters. Unknown names continue with a warning unless strict mode is on.
 */
public class StepConditions {

  private static final Logger log = LoggerFactory.getLogger(StepConditions.class);

  public static final String ISSUES_FOUND = "issues_found";
  public static final String AUTO_FIX_AVAILABLE = "auto_fix_available";
  public static final String AUTO_FIX_REQUESTED = "auto_fix_requested";
  public static final String STEP_SUCCEEDED = "step_succeeded";

  private static final Map<String, BiPredicate<StepOutcome, Map<String, Object>>> BUILT_INS =
      Map.of(
          ISSUES_FOUND, (outcome, params) -> hasIssues(outcome.result()),
          AUTO_FIX_AVAILABLE,
              (outcome, params) ->
                  outcome.result() != null
                      && outcome.result().path("auto_fix_available").asBoolean(false),
          AUTO_FIX_REQUESTED, (outcome, params) -> isTruthy(params.get("autoFix")),
          STEP_SUCCEEDED, (outcome, params) -> outcome.success());

  private final boolean strict;

  public StepConditions(boolean strict) {
    this.strict = strict;
  }

  public boolean evaluate(
      String workflowId, String condition, StepOutcome outcome, Map<String, Object> parameters) {
    BiPredicate<StepOutcome, Map<String, Object>> predicate = BUILT_INS.get(condition);
    if (predicate == null) {
      if (strict) {
        throw new WorkflowFatalException(workflowId, "Unknown step condition: " + condition);
      }
      log.warn("Unknown step condition '{}' in workflow {}; continuing", condition, workflowId);
      return true;
    }
    return predicate.test(outcome, parameters != null ? parameters : Map.of());
  }

  public boolean isKnown(String condition) {
    return BUILT_INS.containsKey(condition);
  }

  private static boolean hasIssues(JsonNode result) {
    if (result == null) {
      return false;
    }
    JsonNode issues = result.path("issues");
    return issues.isArray() && !issues.isEmpty();
  }

  private static boolean isTruthy(Object value) {
    if (value instanceof Boolean flag) {
      return flag;
    }
    return value != null && Boolean.parseBoolean(value.toString().trim());
  }
}
