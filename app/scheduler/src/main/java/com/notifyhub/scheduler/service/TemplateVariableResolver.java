/*
 * Where: Scheduler service layer
 * What: Parses stored schedule variables and builds the per-recipient merge set
 * Why: Identity and context fields must win over authored variables of the same name
 */
package com.notifyhub.scheduler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.scheduler.model.Recipient;
import com.notifyhub.scheduler.model.ScheduleExecutionContext;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TemplateVariableResolver {

  private static final Logger logger = LoggerFactory.getLogger(TemplateVariableResolver.class);

  private final ObjectMapper objectMapper;

  /** Returns an empty map for blank or unparseable input, never throws. */
  public Map<String, String> parse(String scheduleId, String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      logger.warn(
          "schedule template variables unparseable, using none scheduleId={} error={}",
          scheduleId,
          ex.getOriginalMessage());
      return Map.of();
    }
    if (root == null || !root.isObject()) {
      logger.warn("schedule template variables are not a JSON object scheduleId={}", scheduleId);
      return Map.of();
    }
    final Map<String, String> variables = new LinkedHashMap<>();
    root.fields()
        .forEachRemaining(
            entry -> {
              final JsonNode value = entry.getValue();
              if (value.isNull()) {
                return;
              }
              variables.put(entry.getKey(), value.isValueNode() ? value.asText() : value.toString());
            });
    return Collections.unmodifiableMap(variables);
  }

  public Map<String, String> merge(
      Map<String, String> scheduleVariables,
      Recipient recipient,
      ScheduleExecutionContext context) {
    final Map<String, String> merged = new HashMap<>(scheduleVariables);
    put(merged, "first_name", recipient.firstName());
    put(merged, "last_name", recipient.lastName());
    put(merged, "full_name", recipient.displayName());
    put(merged, "email", recipient.email());
    put(merged, "phone_number", recipient.phoneNumber());
    put(merged, "department_name", context.departmentName());
    put(merged, "sub_department_name", context.subDepartmentName());
    put(merged, "template_name", context.templateName());
    put(merged, "schedule_id", context.scheduleId());
    return merged;
  }

  // identity and context keys are always set, even when the source value is missing
  private void put(Map<String, String> target, String key, String value) {
    target.put(key, value == null ? "" : value);
  }
}
