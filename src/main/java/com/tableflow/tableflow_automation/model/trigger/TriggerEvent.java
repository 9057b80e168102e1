package com.tableflow.tableflow_automation.model.trigger;

/**
 * External occurrence fed to the trigger evaluators. The event id identifies the
 * logical event for deduplication; null means the event is never deduplicated.
 */
public interface TriggerEvent {

    String eventId();
}
