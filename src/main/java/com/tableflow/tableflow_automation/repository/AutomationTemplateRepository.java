package com.tableflow.tableflow_automation.repository;

import com.tableflow.tableflow_automation.model.domain.AutomationTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

public interface AutomationTemplateRepository extends JpaRepository<AutomationTemplate, UUID> {

    List<AutomationTemplate> findByActiveTrueOrderByUsageCountDescNameAsc();

    List<AutomationTemplate> findByActiveTrueAndCategoryOrderByUsageCountDescNameAsc(String category);

    @Transactional
    @Modifying
    @Query("update AutomationTemplate t set t.usageCount = t.usageCount + 1 where t.id = :id")
    int incrementUsage(@Param("id") UUID id);
}
