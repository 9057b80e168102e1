package com.tableflow.tableflow_automation.model.trigger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** { "operator": "equals", "value": "Open" } keyed by field id. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldCondition {
    private String operator = "equals";
    private Object value;
}
