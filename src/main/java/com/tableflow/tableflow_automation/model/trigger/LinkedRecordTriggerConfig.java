package com.tableflow.tableflow_automation.model.trigger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LinkedRecordTriggerConfig {

    public static final String ANY_CHANGE = "any_change";

    private String linkFieldId;
    // Table whose rows change
    private String linkedTableId;
    // Table holding the link field
    private String parentTableId;
    private String changeType = ANY_CHANGE;
    private List<String> monitoredFields = new ArrayList<>();
    private Map<String, FieldCondition> linkedRecordConditions = new LinkedHashMap<>();
}
