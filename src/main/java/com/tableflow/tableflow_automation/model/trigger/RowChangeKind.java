package com.tableflow.tableflow_automation.model.trigger;

public enum RowChangeKind {
    CREATED("linked_record_created"),
    UPDATED("linked_record_updated"),
    DELETED("linked_record_deleted"),
    LINK_ADDED("link_added"),
    LINK_REMOVED("link_removed");

    private final String changeType;

    RowChangeKind(String changeType) {
        this.changeType = changeType;
    }

    /** The linked-record trigger's change_type this kind satisfies. */
    public String getChangeType() {
        return changeType;
    }
}
