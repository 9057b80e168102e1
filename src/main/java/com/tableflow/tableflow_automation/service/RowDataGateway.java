package com.tableflow.tableflow_automation.service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Narrow view of the table layer the automation core needs. Rows are plain maps keyed by
 * field id, each carrying its row id under "id".
 */
public interface RowDataGateway {

    List<Map<String, Object>> findRows(String tableId, int limit);

    /** Rows of tableId whose link field references any of the given row ids. */
    List<Map<String, Object>> findRowsLinkingTo(String tableId, String linkFieldId, Collection<?> linkedRowIds, int limit);

    /** Field type such as "date", "link_row" or "text"; empty when the field does not exist. */
    Optional<String> findFieldType(String fieldId);

    /** Applies the values and returns the updated row; empty when table or row do not exist. */
    Optional<Map<String, Object>> updateRow(String tableId, Object rowId, Map<String, Object> values);
}
