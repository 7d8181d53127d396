package com.gentoro.recordbridge.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A multi-step workflow stopped part way. Keeps the error code of the step that failed and adds
 * the workflow name and whatever the completed steps produced under {@code partial_data}.
 */
public class WorkflowException extends RecordBridgeException {
  public WorkflowException(String workflow, RecordBridgeException cause, Map<String, ?> partialData) {
    super(cause.getCode(), cause.getMessage(), merge(workflow, cause.getContext(), partialData), cause);
  }

  public WorkflowException(
      String workflow, RecordBridgeErrorCode code, String message, Map<String, ?> partialData) {
    super(code, message, merge(workflow, Map.of(), partialData));
  }

  private static Map<String, Object> merge(
      String workflow, Map<String, Object> context, Map<String, ?> partialData) {
    Map<String, Object> ctx = new LinkedHashMap<>(context);
    ctx.put("workflow", workflow);
    if (partialData != null && !partialData.isEmpty()) {
      ctx.put("partial_data", new LinkedHashMap<>(partialData));
    }
    return ctx;
  }
}
