package com.tableflow.tableflow_automation.config;

import com.tableflow.tableflow_automation.service.InMemoryRowDataGateway;
import com.tableflow.tableflow_automation.service.RowDataGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class RowDataGatewayConfig {

    @Bean
    @ConditionalOnMissingBean(RowDataGateway.class)
    public RowDataGateway inMemoryRowDataGateway() {
        log.warn("No RowDataGateway registered, using the in-memory table store");
        return new InMemoryRowDataGateway();
    }
}
