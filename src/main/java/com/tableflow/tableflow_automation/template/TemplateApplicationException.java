package com.tableflow.tableflow_automation.template;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;

import java.util.List;

/** Carries every problem found while validating a template application. */
public class TemplateApplicationException extends AutomationConfigurationException {

    private final List<String> problems;

    public TemplateApplicationException(String templateName, List<String> problems) {
        super("Template '" + templateName + "' cannot be applied: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
