package com.tableflow.tableflow_automation.template;

import com.tableflow.tableflow_automation.config.AutomationProperties;
import com.tableflow.tableflow_automation.repository.AutomationTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Seeds the built-in templates into an empty catalog. Existing catalogs are left untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultTemplateInitializer implements ApplicationRunner {

    private final AutomationTemplateRepository templateRepository;
    private final AutomationProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getTemplates().isSeedDefaults()) {
            return;
        }
        try {
            if (templateRepository.count() > 0) {
                return;
            }
            templateRepository.saveAll(DefaultTemplates.all());
            log.info("Seeded {} default automation template(s)", DefaultTemplates.all().size());
        } catch (DataAccessException e) {
            log.warn("Default template seeding failed (non-fatal): {}", e.getMessage());
        }
    }
}
