package com.gentoro.recordbridge.workflow;

import com.gentoro.recordbridge.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Outcome of a workflow: collected data plus guidance for the calling agent. */
public final class WorkflowResult {
  private final String operation;
  private final Map<String, Object> data = new LinkedHashMap<>();
  private final List<String> nextSteps = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();

  WorkflowResult(String operation) {
    this.operation = operation;
  }

  public String operation() {
    return operation;
  }

  public Map<String, Object> data() {
    return data;
  }

  public List<String> nextSteps() {
    return nextSteps;
  }

  public List<String> warnings() {
    return warnings;
  }

  WorkflowResult put(String key, Object value) {
    data.put(key, value);
    return this;
  }

  WorkflowResult nextStep(String step) {
    nextSteps.add(step);
    return this;
  }

  WorkflowResult warn(String warning) {
    warnings.add(warning);
    return this;
  }

  /** {@code {success, operation, data, next_steps?, warnings?}} */
  public Map<String, Object> toResponse() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("success", true);
    out.put("operation", operation);
    out.put("data", data);
    if (!nextSteps.isEmpty()) out.put("next_steps", nextSteps);
    if (!warnings.isEmpty()) out.put("warnings", warnings);
    return out;
  }

  public String toJson() {
    return JacksonUtility.toJson(toResponse());
  }
}
