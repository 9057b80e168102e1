package com.tableflow.tableflow_automation.engine;

import com.tableflow.tableflow_automation.model.trigger.ClockTick;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class DateTriggerScheduler {

    private final AutomationEngine engine;
    private final Clock clock;

    @Scheduled(cron = "${tableflow.automation.scheduler.date-tick-cron:0 * * * * *}")
    public void tick() {
        ClockTick tick = ClockTick.at(clock.instant());
        if (!engine.submitEvent(tick)) {
            log.warn("Clock tick {} was not queued", tick.eventId());
        }
    }
}
