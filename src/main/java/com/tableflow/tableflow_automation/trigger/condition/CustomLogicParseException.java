package com.tableflow.tableflow_automation.trigger.condition;

import com.tableflow.tableflow_automation.engine.AutomationConfigurationException;

public class CustomLogicParseException extends AutomationConfigurationException {

    public CustomLogicParseException(String expression, String problem) {
        super("Invalid custom logic '" + expression + "': " + problem);
    }
}
