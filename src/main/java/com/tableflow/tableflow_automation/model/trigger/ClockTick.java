package com.tableflow.tableflow_automation.model.trigger;

import java.time.Instant;

public record ClockTick(String eventId, Instant now) implements TriggerEvent {

    /** One tick per minute; the id makes a re-delivered tick for the same minute a duplicate. */
    public static ClockTick at(Instant now) {
        long minute = now.getEpochSecond() / 60;
        return new ClockTick("tick-" + minute, now);
    }
}
