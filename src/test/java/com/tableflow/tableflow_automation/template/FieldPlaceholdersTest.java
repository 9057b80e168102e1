package com.tableflow.tableflow_automation.template;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FieldPlaceholdersTest {

    private static final Map<String, Object> TRIGGER = Map.of(
            "type", "date_based_trigger",
            "table_id", "tasks_table",
            "date_field_id", "due_date",
            "check_time", "09:00",
            "additional_conditions", Map.of("status", Map.of("operator", "equals", "value", "open")));

    @Test
    void collectsPlaceholderValuesAndFieldKeyedMapKeys() {
        Map<String, String> found = FieldPlaceholders.collect(TRIGGER);

        assertThat(found)
                .containsEntry("tasks_table", "table_id")
                .containsEntry("due_date", "date_field_id")
                .containsEntry("status", "additional_conditions")
                .doesNotContainKeys("09:00", "open", "date_based_trigger");
    }

    @Test
    void monitoredFieldsAreThePlaceholderListAndOtherListsAreNot() {
        Map<String, Object> config = Map.of(
                "monitored_fields", List.of("status"),
                "allowed_methods", List.of("POST"));

        assertThat(FieldPlaceholders.collect(config)).containsOnlyKeys("status");
    }

    @Test
    @SuppressWarnings("unchecked")
    void substituteReplacesMappedNamesInACopy() {
        Map<String, String> mappings = Map.of("tasks_table", "tbl_42", "due_date", "fld_7", "status", "fld_9");

        Map<String, Object> result = (Map<String, Object>) FieldPlaceholders.substitute(TRIGGER, mappings);

        assertThat(result)
                .containsEntry("table_id", "tbl_42")
                .containsEntry("date_field_id", "fld_7")
                .containsEntry("check_time", "09:00");
        assertThat((Map<String, Object>) result.get("additional_conditions")).containsOnlyKeys("fld_9");
        assertThat(TRIGGER).containsEntry("table_id", "tasks_table");
    }

    @Test
    void unmappedPlaceholdersAreLeftAlone() {
        Object result = FieldPlaceholders.substitute(Map.of("table_id", "tasks_table"), Map.of());

        assertThat(result).isEqualTo(Map.of("table_id", "tasks_table"));
    }

    @Test
    void expectedTypeComesFromTheKey() {
        assertThat(FieldPlaceholders.expectedFieldType("date_field_id")).contains("date");
        assertThat(FieldPlaceholders.expectedFieldType("link_field_id")).contains("link_row");
        assertThat(FieldPlaceholders.expectedFieldType("table_id")).isEmpty();
    }
}
